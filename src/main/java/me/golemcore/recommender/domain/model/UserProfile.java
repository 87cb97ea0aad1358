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

import java.util.Map;

/**
 * Per-request preference profile derived from stored preferences and positive
 * interactions. Never persisted.
 */
@Value
@Builder
public class UserProfile {

    long userId;
    Map<String, Double> categoryWeights;
    Map<String, Double> brandWeights;
    PriceRange pricePreference;
    int positiveInteractionCount;

    public double categoryWeight(String key) {
        return categoryWeights.getOrDefault(key, 0.0);
    }

    public double brandWeight(String key) {
        return brandWeights.getOrDefault(key, 0.0);
    }
}
