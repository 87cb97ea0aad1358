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

import java.time.Instant;

/**
 * Item returned from the engine to its callers.
 *
 * @param productId
 *            recommended product
 * @param score
 *            score in [0,1]
 * @param algorithm
 *            source tag
 * @param confidence
 *            band derived from {@code score}
 * @param reason
 *            explanation shown to the user
 * @param expiresAt
 *            expiry of the persisted row, {@code null} for transient results
 */
public record RecommendationResult(
        long productId,
        double score,
        RecommendationAlgorithm algorithm,
        Confidence confidence,
        String reason,
        Instant expiresAt
) {
    public static RecommendationResult fromCandidate(CandidateScore candidate, Instant expiresAt) {
        return new RecommendationResult(candidate.productId(), candidate.score(), candidate.algorithm(),
                candidate.confidence(), candidate.reason(), expiresAt);
    }

    public static RecommendationResult fromStored(Recommendation recommendation, String reason) {
        return new RecommendationResult(recommendation.getProductId(), recommendation.getScore(),
                recommendation.getAlgorithm(), recommendation.confidence(), reason, recommendation.getExpiresAt());
    }
}
