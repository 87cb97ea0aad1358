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
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Explicit shopping preferences of a user. Read by the profile builder and
 * replaced wholesale by preference patches.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class UserPreferences {

    public static final double DEFAULT_MIN_PRICE = 0;
    public static final double DEFAULT_MAX_PRICE = 1000;

    long userId;

    @Builder.Default
    List<String> categories = List.of();

    @Builder.Default
    List<String> brands = List.of();

    @Builder.Default
    PriceRange priceRange = new PriceRange(DEFAULT_MIN_PRICE, DEFAULT_MAX_PRICE);

    @Builder.Default
    List<String> stylePreferences = List.of();

    Instant updatedAt;

    public static UserPreferences defaults(long userId) {
        return UserPreferences.builder().userId(userId).build();
    }

    public boolean hasCategory(String category) {
        return containsIgnoreCase(categories, category);
    }

    public boolean hasBrand(String brand) {
        return containsIgnoreCase(brands, brand);
    }

    public boolean priceInRange(double price) {
        return priceRange != null && priceRange.contains(price);
    }

    private static boolean containsIgnoreCase(List<String> values, String candidate) {
        if (values == null || candidate == null) {
            return false;
        }
        String needle = candidate.toLowerCase(Locale.ROOT);
        return values.stream()
                .anyMatch(value -> value != null && value.toLowerCase(Locale.ROOT).equals(needle));
    }
}
