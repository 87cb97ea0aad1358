package me.golemcore.recommender.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Full statistic set over an arbitrary list of recommendations, active and
 * expired alike.
 */
@Value
@Builder
public class RecommendationReport {

    private static final Duration EXPIRING_SOON = Duration.ofHours(24);

    long total;
    double averageScore;
    long highConfidenceCount;
    long mediumConfidenceCount;
    long lowConfidenceCount;
    Map<String, Long> algorithmDistribution;
    long expired;
    long expiringSoon;
    long active;

    public static RecommendationReport of(Collection<Recommendation> recommendations, Instant now) {
        Map<String, Long> distribution = new LinkedHashMap<>();
        for (RecommendationAlgorithm algorithm : RecommendationAlgorithm.values()) {
            distribution.put(algorithm.getCode(), 0L);
        }
        long high = 0;
        long medium = 0;
        long low = 0;
        long expired = 0;
        long expiringSoon = 0;
        long active = 0;
        double totalScore = 0;
        Instant soon = now.plus(EXPIRING_SOON);

        for (Recommendation recommendation : recommendations) {
            totalScore += recommendation.getScore();
            switch (recommendation.confidence()) {
            case HIGH -> high++;
            case MEDIUM -> medium++;
            default -> low++;
            }
            if (recommendation.getAlgorithm() != null) {
                distribution.merge(recommendation.getAlgorithm().getCode(), 1L, Long::sum);
            }
            if (recommendation.isExpired(now)) {
                expired++;
            } else if (!recommendation.getExpiresAt().isAfter(soon)) {
                expiringSoon++;
            } else {
                active++;
            }
        }

        int size = recommendations.size();
        return RecommendationReport.builder()
                .total(size)
                .averageScore(size == 0 ? 0 : totalScore / size)
                .highConfidenceCount(high)
                .mediumConfidenceCount(medium)
                .lowConfidenceCount(low)
                .algorithmDistribution(distribution)
                .expired(expired)
                .expiringSoon(expiringSoon)
                .active(active)
                .build();
    }
}
