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
import me.golemcore.recommender.domain.RecommenderConstants;
import me.golemcore.recommender.domain.exception.RecommendationException;
import me.golemcore.recommender.domain.model.CandidateScore;
import me.golemcore.recommender.domain.model.Recommendation;
import me.golemcore.recommender.domain.model.RecommendationAlgorithm;
import me.golemcore.recommender.domain.model.RecommendationReport;
import me.golemcore.recommender.domain.model.RecommendationResult;
import me.golemcore.recommender.domain.model.RecommendationStats;
import me.golemcore.recommender.domain.model.RefreshSummary;
import me.golemcore.recommender.infrastructure.config.RecommenderProperties;
import me.golemcore.recommender.infrastructure.metrics.RecommenderMetrics;
import me.golemcore.recommender.port.outbound.RecommendationStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Recommendation lifecycle: generation, persistence, expiry and refresh.
 *
 * <p>
 * Unexpired persisted rows are served as-is; only users without them are
 * re-scored. Generation and refresh for one user are serialized through
 * {@link RefreshCoordinator}, and every write replaces the user's rows in a
 * single store operation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationService {

    private static final Comparator<Recommendation> BY_SCORE_DESC = Comparator
            .comparingDouble(Recommendation::getScore).reversed()
            .thenComparingLong(Recommendation::getProductId);

    private final FusionCombiner fusionCombiner;
    private final CollaborativeScorer collaborativeScorer;
    private final ContentBasedScorer contentBasedScorer;
    private final RecommendationStorePort storePort;
    private final RecommendationValidator validator;
    private final RefreshCoordinator refreshCoordinator;
    private final RecommenderMetrics metrics;
    private final RecommenderProperties properties;
    private final ExecutorService refreshExecutor;
    private final Clock clock;

    /**
     * Returns up to {@code limit} recommendations, reusing unexpired rows when
     * the user has any.
     */
    public List<RecommendationResult> generate(long userId, int limit) {
        requireLimit(limit);
        List<Recommendation> active = findActive(userId, clock.instant());
        if (!active.isEmpty()) {
            return toStoredResults(active, limit);
        }
        return refreshCoordinator.runExclusive(userId, () -> {
            Instant now = clock.instant();
            List<Recommendation> concurrent = findActive(userId, now);
            if (!concurrent.isEmpty()) {
                return toStoredResults(concurrent, limit);
            }
            List<RecommendationResult> generated = scoreAndPersist(userId, limit, now);
            log.info("[Lifecycle] Generated {} recommendations for user {}", generated.size(), userId);
            return generated;
        });
    }

    /**
     * Recomputes the user's recommendations at the default limit and replaces the
     * stored rows.
     */
    public List<RecommendationResult> refresh(long userId) {
        try {
            List<RecommendationResult> refreshed = refreshCoordinator.runExclusive(userId,
                    () -> scoreAndPersist(userId, properties.getDefaultLimit(), clock.instant()));
            metrics.recordRefresh(RecommenderMetrics.OUTCOME_SUCCESS);
            log.info("[Refresh] Refreshed {} recommendations for user {}", refreshed.size(), userId);
            return refreshed;
        } catch (RuntimeException e) {
            metrics.recordRefresh(RecommenderMetrics.OUTCOME_FAILURE);
            throw e;
        }
    }

    /**
     * Refreshes every user owning at least one expired row on the refresh pool.
     * A failing user does not stop the others.
     */
    public RefreshSummary refreshExpired() {
        List<Long> users;
        try {
            users = storePort.findUsersWithExpired(clock.instant());
        } catch (RuntimeException e) {
            throw new RecommendationException("Failed to find users with expired recommendations", e);
        }
        if (users.isEmpty()) {
            log.debug("[Refresh] No expired recommendations");
            return RefreshSummary.empty();
        }

        List<CompletableFuture<Boolean>> tasks = new ArrayList<>(users.size());
        for (Long userId : users) {
            tasks.add(CompletableFuture.runAsync(() -> refresh(userId), refreshExecutor)
                    .handle((ignored, error) -> {
                        if (error != null) {
                            log.warn("[Refresh] Failed to refresh user {}: {}", userId, error.getMessage());
                            return false;
                        }
                        return true;
                    }));
        }

        int refreshed = 0;
        for (CompletableFuture<Boolean> task : tasks) {
            if (Boolean.TRUE.equals(task.join())) {
                refreshed++;
            }
        }
        RefreshSummary summary = new RefreshSummary(users.size(), refreshed, users.size() - refreshed);
        log.info("[Refresh] Expired refresh finished: users={}, refreshed={}, failed={}", summary.usersFound(),
                summary.refreshed(), summary.failed());
        return summary;
    }

    /**
     * Persisted unexpired score for the pair, or 0 when there is none.
     */
    public double scoreFor(long userId, long productId) {
        return findActive(userId, clock.instant()).stream()
                .filter(recommendation -> recommendation.getProductId() == productId)
                .mapToDouble(Recommendation::getScore)
                .max()
                .orElse(0.0);
    }

    public RecommendationStats stats(long userId) {
        List<Recommendation> active = findActive(userId, clock.instant());
        Map<String, Long> distribution = new LinkedHashMap<>();
        for (RecommendationAlgorithm algorithm : RecommendationAlgorithm.values()) {
            long count = active.stream().filter(r -> r.getAlgorithm() == algorithm).count();
            if (count > 0) {
                distribution.put(algorithm.getCode(), count);
            }
        }
        double average = active.stream().mapToDouble(Recommendation::getScore).average().orElse(0.0);
        return new RecommendationStats(active.size(), average, distribution);
    }

    public RecommendationReport report(long userId) {
        List<Recommendation> all = store("load recommendations", userId, () -> storePort.findAll(userId));
        return RecommendationReport.of(all, clock.instant());
    }

    public List<RecommendationResult> collaborativeOnly(long userId, int limit) {
        requireLimit(limit);
        return asTransientResults(metrics.recordScorer(RecommendationAlgorithm.COLLABORATIVE,
                () -> collaborativeScorer.score(userId, limit)));
    }

    public List<RecommendationResult> contentBasedOnly(long userId, int limit) {
        requireLimit(limit);
        return asTransientResults(metrics.recordScorer(RecommendationAlgorithm.CONTENT_BASED,
                () -> contentBasedScorer.score(userId, limit)));
    }

    /**
     * Fresh fusion pass without touching the store.
     */
    public List<RecommendationResult> hybridOnly(long userId, int limit) {
        requireLimit(limit);
        return asTransientResults(fusionCombiner.combine(userId, limit));
    }

    /**
     * Popularity-tagged items of a fusion pass run at twice the limit.
     */
    public List<RecommendationResult> popularityOnly(long userId, int limit) {
        requireLimit(limit);
        return asTransientResults(fusionCombiner.combine(userId, limit * 2).stream()
                .filter(candidate -> candidate.algorithm() == RecommendationAlgorithm.POPULARITY)
                .limit(limit)
                .toList());
    }

    /**
     * General-purpose algorithm weights keyed by algorithm code. Not used for
     * fusion.
     */
    public Map<String, Double> algorithmWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        RecommenderConstants.ALGORITHM_WEIGHTS.forEach((algorithm, weight) -> weights.put(algorithm.getCode(),
                weight));
        return weights;
    }

    private List<RecommendationResult> scoreAndPersist(long userId, int limit, Instant now) {
        List<CandidateScore> candidates = fusionCombiner.combine(userId, limit);
        Duration window = properties.getFreshnessWindow();
        List<Recommendation> rows = candidates.stream()
                .map(candidate -> Recommendation.create(userId, candidate.productId(), candidate.score(),
                        candidate.algorithm(), now, window))
                .toList();
        validator.validateAll(rows);
        store("persist recommendations", userId, () -> {
            storePort.replaceForUser(userId, rows);
            return null;
        });
        Instant expiresAt = now.plus(window);
        return candidates.stream()
                .map(candidate -> RecommendationResult.fromCandidate(candidate, expiresAt))
                .toList();
    }

    private List<Recommendation> findActive(long userId, Instant now) {
        return store("load active recommendations", userId, () -> storePort.findActive(userId, now));
    }

    private static List<RecommendationResult> toStoredResults(List<Recommendation> active, int limit) {
        Set<Long> seen = new HashSet<>();
        return active.stream()
                .sorted(BY_SCORE_DESC)
                .filter(recommendation -> seen.add(recommendation.getProductId()))
                .limit(limit)
                .map(recommendation -> RecommendationResult.fromStored(recommendation,
                        RecommenderConstants.REASON_PREVIOUSLY_RECOMMENDED))
                .toList();
    }

    private static List<RecommendationResult> asTransientResults(List<CandidateScore> candidates) {
        return candidates.stream()
                .map(candidate -> RecommendationResult.fromCandidate(candidate, null))
                .toList();
    }

    private void requireLimit(int limit) {
        if (limit < 1 || limit > properties.getMaxLimit()) {
            throw new IllegalArgumentException("Limit must be between 1 and " + properties.getMaxLimit());
        }
    }

    private static <T> T store(String action, long userId, Supplier<T> call) {
        try {
            return call.get();
        } catch (RecommendationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[Lifecycle] Failed to {} for user {}", action, userId, e);
            throw new RecommendationException("Failed to " + action + " for user " + userId, e);
        }
    }
}
