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
import me.golemcore.recommender.domain.model.Interaction;
import me.golemcore.recommender.domain.model.PriceRange;
import me.golemcore.recommender.domain.model.UserPreferences;
import me.golemcore.recommender.domain.model.UserProfile;
import me.golemcore.recommender.port.outbound.InteractionQueryPort;
import me.golemcore.recommender.port.outbound.PreferencesPort;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the transient {@link UserProfile} used by content-based scoring.
 *
 * <p>
 * Weight maps are seeded from explicit preferences only. Positive
 * interactions are counted but do not feed the maps.
 */
@Service
@RequiredArgsConstructor
public class UserProfileBuilder {

    public static final PriceRange DEFAULT_PRICE_PREFERENCE = new PriceRange(0, 10000);
    private static final double EXPLICIT_PREFERENCE_WEIGHT = 1.0;

    private final PreferencesPort preferencesPort;
    private final InteractionQueryPort interactionQueryPort;

    public UserProfile build(long userId) {
        return build(userId, preferencesPort.findByUser(userId), interactionQueryPort.findByUser(userId));
    }

    public UserProfile build(long userId, Optional<UserPreferences> preferences, List<Interaction> interactions) {
        Map<String, Double> categoryWeights = new LinkedHashMap<>();
        Map<String, Double> brandWeights = new LinkedHashMap<>();
        PriceRange pricePreference = DEFAULT_PRICE_PREFERENCE;

        if (preferences.isPresent()) {
            UserPreferences prefs = preferences.get();
            seed(categoryWeights, prefs.getCategories());
            seed(brandWeights, prefs.getBrands());
            if (prefs.getPriceRange() != null) {
                pricePreference = prefs.getPriceRange();
            }
        }

        int positive = (int) interactions.stream()
                .filter(InteractionWeights::isPositiveForProfile)
                .count();

        return UserProfile.builder()
                .userId(userId)
                .categoryWeights(Collections.unmodifiableMap(categoryWeights))
                .brandWeights(Collections.unmodifiableMap(brandWeights))
                .pricePreference(pricePreference)
                .positiveInteractionCount(positive)
                .build();
    }

    private static void seed(Map<String, Double> weights, List<String> values) {
        if (values == null) {
            return;
        }
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                weights.put(value.trim().toLowerCase(Locale.ROOT), EXPLICIT_PREFERENCE_WEIGHT);
            }
        }
    }
}
