package me.golemcore.recommender.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recommender.domain.RecommenderConstants;
import me.golemcore.recommender.domain.model.CandidateScore;
import me.golemcore.recommender.domain.model.Interaction;
import me.golemcore.recommender.domain.model.Product;
import me.golemcore.recommender.domain.model.RecommendationAlgorithm;
import me.golemcore.recommender.port.outbound.CatalogQueryPort;
import me.golemcore.recommender.port.outbound.InteractionQueryPort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ranks available products the user has not touched by raw interaction
 * volume. Products with no interactions stay in the list at score 0.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PopularityScorer {

    static final double SATURATION_COUNT = 10.0;

    private final InteractionQueryPort interactionQueryPort;
    private final CatalogQueryPort catalogQueryPort;

    public List<CandidateScore> score(long userId, int limit) {
        Set<Long> touched = interactionQueryPort.findByUser(userId).stream()
                .map(Interaction::getProductId)
                .collect(Collectors.toSet());

        List<Long> untouched = catalogQueryPort.findAvailable().stream()
                .map(Product::getId)
                .filter(productId -> !touched.contains(productId))
                .toList();
        Map<Long, List<Interaction>> byProduct = interactionQueryPort.findByProducts(untouched);

        List<CandidateScore> candidates = untouched.stream()
                .map(productId -> CandidateScore.of(productId,
                        normalize(byProduct.getOrDefault(productId, List.of()).size()),
                        RecommendationAlgorithm.POPULARITY, RecommenderConstants.REASON_POPULARITY))
                .sorted(CandidateOrdering.BY_SCORE_DESC)
                .limit(Math.max(0, limit))
                .toList();

        log.debug("[Popularity] user={} candidates={}", userId, candidates.size());
        return candidates;
    }

    static double normalize(int count) {
        return Math.min(count / SATURATION_COUNT, 1.0);
    }
}
