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

import me.golemcore.recommender.domain.model.Interaction;
import me.golemcore.recommender.domain.model.InteractionType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Static weight tables for interaction types.
 *
 * <p>
 * {@link #AFFINITY_WEIGHTS} feeds the scorers; {@link #ANALYTICS_SCORES} is
 * the separate engagement scale used for reporting. The two are independent
 * and must not be derived from each other.
 */
public final class InteractionWeights {

    public static final Map<InteractionType, Double> AFFINITY_WEIGHTS = table(1.0, 0.9, 0.8, 0.7, 0.1, -0.5);
    public static final Map<InteractionType, Double> ANALYTICS_SCORES = table(10, 8, 6, 5, 1, -2);

    public static final double POSITIVE_RATING = 4.0;
    public static final double NEUTRAL_RATING = 3.0;

    private static final double SIMILARITY_LIKE = 1.0;
    private static final double SIMILARITY_FAVORITE = 1.2;
    private static final double SIMILARITY_POSITIVE_RATING = 1.0;
    private static final double SIMILARITY_NEUTRAL_RATING = 0.5;
    private static final double SIMILARITY_OTHER = 0.1;

    private InteractionWeights() {
    }

    public static double affinityWeight(InteractionType type) {
        return type == null ? 0.0 : AFFINITY_WEIGHTS.getOrDefault(type, 0.0);
    }

    public static double analyticsScore(InteractionType type) {
        return type == null ? 0.0 : ANALYTICS_SCORES.getOrDefault(type, 0.0);
    }

    /**
     * Contribution of one interaction to a user-user similarity sum.
     */
    public static double similarityWeight(Interaction interaction) {
        InteractionType type = interaction.getType();
        if (type == InteractionType.LIKE) {
            return SIMILARITY_LIKE;
        }
        if (type == InteractionType.FAVORITE) {
            return SIMILARITY_FAVORITE;
        }
        if (type == InteractionType.RATING) {
            double rating = interaction.rating().orElse(0);
            if (rating >= POSITIVE_RATING) {
                return SIMILARITY_POSITIVE_RATING;
            }
            if (rating >= NEUTRAL_RATING) {
                return SIMILARITY_NEUTRAL_RATING;
            }
        }
        return SIMILARITY_OTHER;
    }

    /**
     * Like, favorite, purchase, or a rating of at least 4.
     */
    public static boolean isPositiveForProfile(Interaction interaction) {
        InteractionType type = interaction.getType();
        if (type == InteractionType.LIKE || type == InteractionType.FAVORITE || type == InteractionType.PURCHASE) {
            return true;
        }
        return type == InteractionType.RATING && interaction.rating().orElse(0) >= POSITIVE_RATING;
    }

    public static boolean isNegative(Interaction interaction) {
        return interaction.getType() == InteractionType.DISLIKE;
    }

    public static boolean isConversion(Interaction interaction) {
        return interaction.getType() == InteractionType.PURCHASE;
    }

    private static Map<InteractionType, Double> table(double purchase, double favorite, double rating, double like,
            double view, double dislike) {
        Map<InteractionType, Double> map = new EnumMap<>(InteractionType.class);
        map.put(InteractionType.PURCHASE, purchase);
        map.put(InteractionType.FAVORITE, favorite);
        map.put(InteractionType.RATING, rating);
        map.put(InteractionType.LIKE, like);
        map.put(InteractionType.VIEW, view);
        map.put(InteractionType.DISLIKE, dislike);
        return Collections.unmodifiableMap(map);
    }
}
