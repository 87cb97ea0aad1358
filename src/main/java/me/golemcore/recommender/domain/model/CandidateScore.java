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

/**
 * Transient scored candidate produced by a scorer or the fusion combiner.
 *
 * @param productId
 *            candidate product
 * @param score
 *            score in [0,1]
 * @param algorithm
 *            source tag
 * @param reason
 *            human readable explanation
 * @param confidence
 *            band derived from {@code score}
 */
public record CandidateScore(
        long productId,
        double score,
        RecommendationAlgorithm algorithm,
        String reason,
        Confidence confidence
) {
    public static CandidateScore of(long productId, double score, RecommendationAlgorithm algorithm, String reason) {
        return new CandidateScore(productId, score, algorithm, reason, Confidence.fromScore(score));
    }
}
