package me.golemcore.recommender.infrastructure.metrics;

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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import me.golemcore.recommender.domain.model.RecommendationAlgorithm;
import me.golemcore.recommender.infrastructure.config.RecommenderProperties;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer instrumentation for scorer invocations and refresh outcomes.
 *
 * <p>
 * Tags stay low-cardinality: the algorithm code and a fixed set of outcomes.
 */
@Component
public class RecommenderMetrics {

    public static final String SCORER_TIMER = "recommender.scorer";
    public static final String CANDIDATES_SUMMARY = "recommender.candidates";
    public static final String REFRESH_COUNTER = "recommender.refresh";

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";

    private final MeterRegistry registry;
    private final boolean enabled;

    private final Map<RecommendationAlgorithm, Timer> timers = new ConcurrentHashMap<>();
    private final Map<RecommendationAlgorithm, DistributionSummary> summaries = new ConcurrentHashMap<>();
    private final Map<String, Counter> refreshCounters = new ConcurrentHashMap<>();

    public RecommenderMetrics(MeterRegistry registry, RecommenderProperties properties) {
        this.registry = registry;
        this.enabled = properties.getMetrics().isEnabled();
    }

    /**
     * Runs one scorer invocation, recording its latency and candidate count.
     */
    public <T extends Collection<?>> T recordScorer(RecommendationAlgorithm algorithm, Supplier<T> scorer) {
        if (!enabled) {
            return scorer.get();
        }
        Timer timer = timers.computeIfAbsent(algorithm, a -> Timer.builder(SCORER_TIMER)
                .description("Scorer invocation latency")
                .tag("algorithm", a.getCode())
                .register(registry));
        T result = timer.record(scorer);
        if (result != null) {
            summaries.computeIfAbsent(algorithm, a -> DistributionSummary.builder(CANDIDATES_SUMMARY)
                    .description("Candidates produced per scorer invocation")
                    .tag("algorithm", a.getCode())
                    .register(registry))
                    .record(result.size());
        }
        return result;
    }

    public void recordRefresh(String outcome) {
        if (!enabled) {
            return;
        }
        refreshCounters.computeIfAbsent(outcome, o -> Counter.builder(REFRESH_COUNTER)
                .description("Per-user recommendation refreshes")
                .tag("outcome", o)
                .register(registry))
                .increment();
    }
}
