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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Persisted, time-boxed recommendation of one product to one user.
 *
 * <p>
 * Instances are immutable. Updates go through
 * {@link #withUpdate(RecommendationUpdate)}, which returns a new instance
 * together with a flag telling whether anything changed.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Recommendation {

    public static final Duration DEFAULT_FRESHNESS_WINDOW = Duration.ofHours(24);
    public static final double HIGH_QUALITY_THRESHOLD = 0.7;
    public static final double LOW_QUALITY_THRESHOLD = 0.3;
    private static final long SECONDS_PER_HOUR = 3600;

    String id;
    long userId;
    long productId;
    double score;
    RecommendationAlgorithm algorithm;
    Instant createdAt;
    Instant expiresAt;

    public static Recommendation create(long userId, long productId, double score,
            RecommendationAlgorithm algorithm, Instant now, Duration freshnessWindow) {
        return Recommendation.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .productId(productId)
                .score(score)
                .algorithm(algorithm)
                .createdAt(now)
                .expiresAt(now.plus(freshnessWindow))
                .build();
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isActive(Instant now) {
        return !isExpired(now);
    }

    public boolean isExpiringSoon(Instant now, int hours) {
        if (isExpired(now)) {
            return false;
        }
        return !expiresAt.isAfter(now.plus(Duration.ofHours(hours)));
    }

    public boolean isExpiringSoon(Instant now) {
        return isExpiringSoon(now, 24);
    }

    public long hoursUntilExpiration(Instant now) {
        if (isExpired(now)) {
            return 0;
        }
        long seconds = Duration.between(now, expiresAt).getSeconds();
        return (seconds + SECONDS_PER_HOUR - 1) / SECONDS_PER_HOUR;
    }

    public long ageInHours(Instant now) {
        return Math.max(0, Duration.between(createdAt, now).getSeconds() / SECONDS_PER_HOUR);
    }

    public boolean isFresh(Instant now, int maxAgeHours) {
        return ageInHours(now) < maxAgeHours;
    }

    public boolean isFresh(Instant now) {
        return isFresh(now, 24);
    }

    public boolean isHighQuality(Instant now) {
        return score >= HIGH_QUALITY_THRESHOLD && !isExpired(now);
    }

    public boolean isLowQuality(Instant now) {
        return score < LOW_QUALITY_THRESHOLD || isExpired(now);
    }

    public Confidence confidence() {
        return Confidence.fromScore(score);
    }

    /**
     * Human readable explanation based on the algorithm and confidence band.
     */
    public String describe() {
        String strength = confidence() == Confidence.HIGH ? "strongly" : "moderately";
        if (algorithm == null) {
            return "This product was recommended for you";
        }
        return switch (algorithm) {
        case COLLABORATIVE -> "Users with similar preferences " + strength + " liked this product";
        case CONTENT_BASED -> "This product " + strength + " matches your preferences";
        case HYBRID -> "Based on your preferences and similar users, this product " + strength
                + " matches your interests";
        default -> "This product was recommended for you";
        };
    }

    public Recommendation withExtendedExpiration(int hours) {
        return toBuilder().expiresAt(expiresAt.plus(Duration.ofHours(hours))).build();
    }

    public Change withUpdate(RecommendationUpdate update) {
        if (update == null) {
            return new Change(this, false);
        }
        RecommendationBuilder builder = toBuilder();
        boolean changed = false;
        if (update.score() != null && Double.compare(update.score(), score) != 0) {
            double newScore = update.score();
            if (Double.isNaN(newScore) || newScore < 0 || newScore > 1) {
                throw new IllegalArgumentException("Score must be between 0 and 1");
            }
            builder.score(newScore);
            changed = true;
        }
        if (update.algorithm() != null && update.algorithm() != algorithm) {
            builder.algorithm(update.algorithm());
            changed = true;
        }
        if (update.expiresAt() != null && !Objects.equals(update.expiresAt(), expiresAt)) {
            if (!update.expiresAt().isAfter(createdAt)) {
                throw new IllegalArgumentException("Expiration date must be after creation date");
            }
            builder.expiresAt(update.expiresAt());
            changed = true;
        }
        return new Change(changed ? builder.build() : this, changed);
    }

    /**
     * Result of {@link #withUpdate(RecommendationUpdate)}.
     *
     * @param recommendation
     *            updated instance, or the original one when nothing changed
     * @param changed
     *            whether any field was modified
     */
    public record Change(Recommendation recommendation, boolean changed) {
    }
}
