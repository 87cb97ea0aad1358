package me.golemcore.recommender.domain;

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

import me.golemcore.recommender.domain.model.RecommendationAlgorithm;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Global constants for the recommender.
 *
 * <p>
 * {@link #FUSION_WEIGHTS} blends scorer outputs. {@link #ALGORITHM_WEIGHTS} is
 * the table exposed to callers and is never used for blending.
 *
 * @since 1.0
 */
public final class RecommenderConstants {

    public static final String CATALOG_DIR = "catalog";
    public static final String INTERACTIONS_DIR = "interactions";
    public static final String PREFERENCES_DIR = "preferences";
    public static final String RECOMMENDATIONS_DIR = "recommendations";
    public static final List<String> STORAGE_DIRECTORIES = List.of(
            CATALOG_DIR, INTERACTIONS_DIR, PREFERENCES_DIR, RECOMMENDATIONS_DIR);

    public static final String PRODUCTS_FILE = "products.json";
    public static final String JSON_SUFFIX = ".json";

    public static final Map<RecommendationAlgorithm, Double> FUSION_WEIGHTS = weights(
            0.4, 0.4, 0.0, 0.2);

    public static final Map<RecommendationAlgorithm, Double> ALGORITHM_WEIGHTS = weights(
            0.4, 0.3, 0.2, 0.1);

    public static final String REASON_COLLABORATIVE = "Recommended by users with similar preferences";
    public static final String REASON_POPULARITY = "Popular among other users";
    public static final String REASON_PREVIOUSLY_RECOMMENDED = "Previously recommended";
    public static final String REASON_COMBINED = "Combined recommendation based on similar users and your preferences";
    public static final String REASON_COMBINED_WITH_POPULARITY = "Combined recommendation based on similar users, your preferences, and popularity";

    private RecommenderConstants() {
    }

    private static Map<RecommendationAlgorithm, Double> weights(double collaborative, double contentBased,
            double hybrid, double popularity) {
        Map<RecommendationAlgorithm, Double> map = new EnumMap<>(RecommendationAlgorithm.class);
        map.put(RecommendationAlgorithm.COLLABORATIVE, collaborative);
        map.put(RecommendationAlgorithm.CONTENT_BASED, contentBased);
        if (hybrid > 0) {
            map.put(RecommendationAlgorithm.HYBRID, hybrid);
        }
        map.put(RecommendationAlgorithm.POPULARITY, popularity);
        return Collections.unmodifiableMap(map);
    }
}
