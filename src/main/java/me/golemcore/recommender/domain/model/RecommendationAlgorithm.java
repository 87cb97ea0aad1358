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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Source tag carried by every candidate and persisted recommendation.
 */
public enum RecommendationAlgorithm {
    COLLABORATIVE("collaborative"), CONTENT_BASED("content-based"), HYBRID("hybrid"), POPULARITY("popularity");

    private final String code;

    RecommendationAlgorithm(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static Optional<RecommendationAlgorithm> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(algorithm -> algorithm.code.equalsIgnoreCase(code.trim()))
                .findFirst();
    }

    @JsonCreator
    static RecommendationAlgorithm fromJson(String code) {
        return fromCode(code)
                .orElseThrow(() -> new IllegalArgumentException("Unknown recommendation algorithm: " + code));
    }
}
