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
import me.golemcore.recommender.domain.exception.RecommendationException;
import me.golemcore.recommender.domain.exception.RecommendationValidationException;
import me.golemcore.recommender.domain.model.PreferencesPatch;
import me.golemcore.recommender.domain.model.PreferencesUpdateResult;
import me.golemcore.recommender.domain.model.PriceRange;
import me.golemcore.recommender.domain.model.UserPreferences;
import me.golemcore.recommender.port.outbound.PreferencesPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads user preferences and applies explicit field-by-field patches.
 *
 * <p>
 * Every present field of a patch is validated before anything is written; all
 * violations are reported together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserPreferencesService {

    static final int MAX_CATEGORIES = 20;
    static final int MAX_BRANDS = 20;
    static final int MAX_STYLES = 10;
    static final double MAX_PRICE = 999_999.99;

    private final PreferencesPort preferencesPort;
    private final Clock clock;

    public UserPreferences getPreferences(long userId) {
        return preferencesPort.findByUser(userId).orElseGet(() -> UserPreferences.defaults(userId));
    }

    public PreferencesUpdateResult applyPatch(long userId, PreferencesPatch patch) {
        if (userId <= 0) {
            throw new IllegalArgumentException("Valid user ID is required");
        }
        Objects.requireNonNull(patch, "patch");
        validate(patch);

        UserPreferences current = getPreferences(userId);
        UserPreferences.UserPreferencesBuilder builder = current.toBuilder();
        boolean changed = false;

        if (patch.getCategories() != null) {
            List<String> categories = normalize(patch.getCategories());
            changed |= !categories.equals(current.getCategories());
            builder.categories(categories);
        }
        if (patch.getBrands() != null) {
            List<String> brands = normalize(patch.getBrands());
            changed |= !brands.equals(current.getBrands());
            builder.brands(brands);
        }
        if (patch.getPriceRange() != null) {
            changed |= !patch.getPriceRange().equals(current.getPriceRange());
            builder.priceRange(patch.getPriceRange());
        }
        if (patch.getStylePreferences() != null) {
            List<String> styles = normalize(patch.getStylePreferences());
            changed |= !styles.equals(current.getStylePreferences());
            builder.stylePreferences(styles);
        }

        if (!changed) {
            return new PreferencesUpdateResult(current, false);
        }

        UserPreferences updated = builder.updatedAt(clock.instant()).build();
        try {
            preferencesPort.save(updated);
        } catch (RuntimeException e) {
            log.error("[Preferences] Failed to save preferences for user {}", userId, e);
            throw new RecommendationException("Failed to persist preferences for user " + userId, e);
        }
        log.info("[Preferences] Updated preferences for user {}", userId);
        return new PreferencesUpdateResult(updated, true);
    }

    static void validate(PreferencesPatch patch) {
        List<String> errors = new ArrayList<>();
        validateList(errors, "categories", patch.getCategories(), MAX_CATEGORIES);
        validateList(errors, "brands", patch.getBrands(), MAX_BRANDS);
        validateList(errors, "stylePreferences", patch.getStylePreferences(), MAX_STYLES);

        PriceRange range = patch.getPriceRange();
        if (range != null) {
            if (Double.isNaN(range.min()) || range.min() < 0) {
                errors.add("Minimum price must be a non-negative number");
            }
            if (Double.isNaN(range.max()) || range.max() < range.min()) {
                errors.add("Maximum price must be greater than or equal to minimum price");
            }
            if (range.min() > MAX_PRICE || range.max() > MAX_PRICE) {
                errors.add("Price values must not exceed " + MAX_PRICE);
            }
        }

        if (!errors.isEmpty()) {
            throw new RecommendationValidationException(errors);
        }
    }

    private static void validateList(List<String> errors, String field, List<String> values, int max) {
        if (values == null) {
            return;
        }
        if (values.size() > max) {
            errors.add(field + " must contain at most " + max + " entries");
        }
        if (values.stream().anyMatch(value -> value == null || value.isBlank())) {
            errors.add(field + " must contain only non-empty strings");
        }
    }

    private static List<String> normalize(List<String> values) {
        return values.stream()
                .map(String::trim)
                .distinct()
                .toList();
    }
}
