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
import me.golemcore.recommender.domain.model.SimilarUser;
import me.golemcore.recommender.infrastructure.config.RecommenderProperties;
import me.golemcore.recommender.port.outbound.CatalogQueryPort;
import me.golemcore.recommender.port.outbound.InteractionQueryPort;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores products liked by similar users that the target user has not touched
 * yet.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CollaborativeScorer {

    private final InteractionQueryPort interactionQueryPort;
    private final CatalogQueryPort catalogQueryPort;
    private final SimilarityFinder similarityFinder;
    private final RecommenderProperties properties;

    public List<CandidateScore> score(long userId, int limit) {
        List<Interaction> targetInteractions = interactionQueryPort.findByUser(userId);
        List<SimilarUser> similarUsers = similarityFinder.findSimilar(userId, targetInteractions,
                properties.getSimilarity().getLimit());
        if (similarUsers.isEmpty()) {
            log.debug("[Collaborative] user={} has no similar users", userId);
            return List.of();
        }

        Set<Long> touched = targetInteractions.stream()
                .map(Interaction::getProductId)
                .collect(Collectors.toSet());

        Map<Long, Double> accumulated = new HashMap<>();
        for (SimilarUser similarUser : similarUsers) {
            for (Interaction interaction : interactionQueryPort.findByUser(similarUser.userId())) {
                if (touched.contains(interaction.getProductId())) {
                    continue;
                }
                double contribution = InteractionWeights.affinityWeight(interaction.getType())
                        * similarUser.similarity();
                accumulated.merge(interaction.getProductId(), contribution, Double::sum);
            }
        }
        if (accumulated.isEmpty()) {
            return List.of();
        }

        Set<Long> available = new HashSet<>();
        for (Product product : catalogQueryPort.findByIds(accumulated.keySet())) {
            available.add(product.getId());
        }

        List<CandidateScore> candidates = accumulated.entrySet().stream()
                .filter(entry -> available.contains(entry.getKey()))
                .filter(entry -> entry.getValue() > 0)
                .map(entry -> CandidateScore.of(entry.getKey(), Math.min(1.0, entry.getValue()),
                        RecommendationAlgorithm.COLLABORATIVE, RecommenderConstants.REASON_COLLABORATIVE))
                .sorted(CandidateOrdering.BY_SCORE_DESC)
                .limit(Math.max(0, limit))
                .toList();

        log.debug("[Collaborative] user={} similarUsers={} candidates={}", userId, similarUsers.size(),
                candidates.size());
        return candidates;
    }
}
