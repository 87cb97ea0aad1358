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
import me.golemcore.recommender.domain.model.Interaction;
import me.golemcore.recommender.domain.model.SimilarUser;
import me.golemcore.recommender.port.outbound.InteractionQueryPort;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds users whose interaction footprint overlaps the target user's.
 *
 * <p>
 * A candidate must share at least two distinct products with the target and
 * accumulate a weighted overlap above {@value #MIN_WEIGHTED_SCORE}. Similarity
 * is {@code min(1, weighted / max(1, sharedProducts))}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SimilarityFinder {

    public static final int MIN_SHARED_PRODUCTS = 2;
    public static final double MIN_WEIGHTED_SCORE = 0.2;

    private static final Comparator<SimilarUser> ORDER = Comparator
            .comparingDouble(SimilarUser::similarity).reversed()
            .thenComparing(Comparator.comparingInt(SimilarUser::sharedProductCount).reversed())
            .thenComparingLong(SimilarUser::userId);

    private final InteractionQueryPort interactionQueryPort;

    public List<SimilarUser> findSimilar(long userId, int limit) {
        return findSimilar(userId, interactionQueryPort.findByUser(userId), limit);
    }

    public List<SimilarUser> findSimilar(long userId, List<Interaction> targetInteractions, int limit) {
        if (targetInteractions.isEmpty() || limit <= 0) {
            return List.of();
        }

        Set<Long> targetProducts = new LinkedHashSet<>();
        for (Interaction interaction : targetInteractions) {
            targetProducts.add(interaction.getProductId());
        }

        Map<Long, Overlap> overlaps = new HashMap<>();
        for (List<Interaction> onProduct : interactionQueryPort.findByProducts(targetProducts).values()) {
            for (Interaction interaction : onProduct) {
                if (interaction.getUserId() == userId) {
                    continue;
                }
                overlaps.computeIfAbsent(interaction.getUserId(), id -> new Overlap())
                        .add(interaction);
            }
        }

        List<SimilarUser> similar = overlaps.entrySet().stream()
                .filter(entry -> entry.getValue().products.size() >= MIN_SHARED_PRODUCTS)
                .filter(entry -> entry.getValue().weighted > MIN_WEIGHTED_SCORE)
                .map(entry -> entry.getValue().toSimilarUser(entry.getKey()))
                .sorted(ORDER)
                .limit(limit)
                .toList();

        log.debug("[Similarity] user={} candidates={} similar={}", userId, overlaps.size(), similar.size());
        return similar;
    }

    private static final class Overlap {
        private final Set<Long> products = new HashSet<>();
        private double weighted;

        void add(Interaction interaction) {
            products.add(interaction.getProductId());
            weighted += InteractionWeights.similarityWeight(interaction);
        }

        SimilarUser toSimilarUser(long userId) {
            int shared = products.size();
            double similarity = Math.min(1.0, weighted / Math.max(1, shared));
            return new SimilarUser(userId, similarity, shared);
        }
    }
}
