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
import me.golemcore.recommender.domain.model.RecommendationAlgorithm;
import me.golemcore.recommender.infrastructure.config.RecommenderProperties;
import me.golemcore.recommender.infrastructure.metrics.RecommenderMetrics;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs the three scorers concurrently and blends their candidates into one
 * ranked list.
 *
 * <p>
 * Each source contributes {@code rawScore * weight} using
 * {@link RecommenderConstants#FUSION_WEIGHTS}. A product reported by a single
 * source keeps that source's tag and reason; a product reported by several is
 * tagged {@code hybrid}. Confidence is recomputed from the blended score.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FusionCombiner {

    private final CollaborativeScorer collaborativeScorer;
    private final ContentBasedScorer contentBasedScorer;
    private final PopularityScorer popularityScorer;
    private final ExecutorService scoringExecutor;
    private final RecommenderMetrics metrics;
    private final RecommenderProperties properties;

    public List<CandidateScore> combine(long userId, int limit) {
        int fetch = Math.max(0, limit) * 2;

        CompletableFuture<List<CandidateScore>> collaborative = submit(RecommendationAlgorithm.COLLABORATIVE,
                () -> collaborativeScorer.score(userId, fetch));
        CompletableFuture<List<CandidateScore>> contentBased = submit(RecommendationAlgorithm.CONTENT_BASED,
                () -> contentBasedScorer.score(userId, fetch));
        CompletableFuture<List<CandidateScore>> popularity = submit(RecommendationAlgorithm.POPULARITY,
                () -> popularityScorer.score(userId, fetch));

        awaitAll(userId, collaborative, contentBased, popularity);

        Map<RecommendationAlgorithm, List<CandidateScore>> sources = new EnumMap<>(RecommendationAlgorithm.class);
        sources.put(RecommendationAlgorithm.COLLABORATIVE, collaborative.join());
        sources.put(RecommendationAlgorithm.CONTENT_BASED, contentBased.join());
        sources.put(RecommendationAlgorithm.POPULARITY, popularity.join());

        List<CandidateScore> blended = blend(sources, limit);
        log.debug("[Fusion] user={} collaborative={} contentBased={} popularity={} blended={}", userId,
                sources.get(RecommendationAlgorithm.COLLABORATIVE).size(),
                sources.get(RecommendationAlgorithm.CONTENT_BASED).size(),
                sources.get(RecommendationAlgorithm.POPULARITY).size(), blended.size());
        return blended;
    }

    /**
     * Blends per-source candidate lists. Sources are visited in the map's
     * iteration order; unknown sources contribute nothing.
     */
    public static List<CandidateScore> blend(Map<RecommendationAlgorithm, List<CandidateScore>> sources, int limit) {
        Map<Long, Blended> merged = new LinkedHashMap<>();
        sources.forEach((algorithm, candidates) -> {
            double weight = RecommenderConstants.FUSION_WEIGHTS.getOrDefault(algorithm, 0.0);
            if (weight <= 0 || candidates == null) {
                return;
            }
            for (CandidateScore candidate : candidates) {
                merged.computeIfAbsent(candidate.productId(), id -> new Blended(candidate))
                        .add(algorithm, candidate.score() * weight);
            }
        });

        return merged.values().stream()
                .map(Blended::toCandidate)
                .sorted(CandidateOrdering.BY_SCORE_DESC)
                .limit(Math.max(0, limit))
                .toList();
    }

    private CompletableFuture<List<CandidateScore>> submit(RecommendationAlgorithm algorithm,
            Supplier<List<CandidateScore>> scorer) {
        return CompletableFuture.supplyAsync(() -> metrics.recordScorer(algorithm, scorer), scoringExecutor);
    }

    private void awaitAll(long userId, CompletableFuture<?>... futures) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures);
        long timeoutMillis = properties.getFusion().getTimeout().toMillis();
        try {
            all.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            for (CompletableFuture<?> future : futures) {
                future.cancel(true);
            }
            log.warn("[Fusion] Scoring timed out after {} ms for user {}", timeoutMillis, userId);
            throw new RecommendationException("Scoring timed out for user " + userId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Fusion] Scoring failed for user {}: {}", userId, cause.getMessage());
            throw new RecommendationException("Scoring failed for user " + userId, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RecommendationException("Scoring interrupted for user " + userId, e);
        }
    }

    private static final class Blended {
        private final CandidateScore first;
        private final Set<RecommendationAlgorithm> contributors = EnumSet.noneOf(RecommendationAlgorithm.class);
        private double score;

        private Blended(CandidateScore first) {
            this.first = first;
        }

        void add(RecommendationAlgorithm algorithm, double weightedScore) {
            contributors.add(algorithm);
            score += weightedScore;
        }

        CandidateScore toCandidate() {
            double finalScore = Math.max(0.0, Math.min(1.0, score));
            if (contributors.size() == 1) {
                return CandidateScore.of(first.productId(), finalScore, first.algorithm(), first.reason());
            }
            String reason = contributors.contains(RecommendationAlgorithm.POPULARITY)
                    ? RecommenderConstants.REASON_COMBINED_WITH_POPULARITY
                    : RecommenderConstants.REASON_COMBINED;
            return CandidateScore.of(first.productId(), finalScore, RecommendationAlgorithm.HYBRID, reason);
        }
    }
}
