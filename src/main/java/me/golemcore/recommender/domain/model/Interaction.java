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
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * A single user-product interaction. Owned by the interaction store; the engine
 * only reads it.
 *
 * <p>
 * Rating interactions carry their value in {@code metadata.rating}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Interaction {

    public static final String RATING_KEY = "rating";

    long id;
    long userId;
    long productId;
    InteractionType type;
    Instant timestamp;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    /**
     * Numeric rating from metadata, if present and parseable.
     */
    public OptionalDouble rating() {
        if (metadata == null) {
            return OptionalDouble.empty();
        }
        Object raw = metadata.get(RATING_KEY);
        if (raw instanceof Number number) {
            return OptionalDouble.of(number.doubleValue());
        }
        if (raw instanceof String text) {
            try {
                return OptionalDouble.of(Double.parseDouble(text.trim()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    public boolean hasType(InteractionType candidate) {
        return type == candidate;
    }
}
