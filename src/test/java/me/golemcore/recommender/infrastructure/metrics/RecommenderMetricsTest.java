package me.golemcore.recommender.infrastructure.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import me.golemcore.recommender.domain.model.RecommendationAlgorithm;
import me.golemcore.recommender.infrastructure.config.RecommenderProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecommenderMetricsTest {

    private SimpleMeterRegistry registry;
    private RecommenderProperties properties;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        properties = new RecommenderProperties();
    }

    @Test
    void shouldRecordScorerLatencyAndCandidateCount() {
        RecommenderMetrics metrics = new RecommenderMetrics(registry, properties);

        List<String> result = metrics.recordScorer(RecommendationAlgorithm.POPULARITY, () -> List.of("a", "b", "c"));
        metrics.recordScorer(RecommendationAlgorithm.POPULARITY, () -> List.<String>of());

        assertEquals(3, result.size());
        assertEquals(2, registry.get(RecommenderMetrics.SCORER_TIMER).tag("algorithm", "popularity").timer()
                .count());
        assertEquals(3.0, registry.get(RecommenderMetrics.CANDIDATES_SUMMARY).tag("algorithm", "popularity")
                .summary().totalAmount());
    }

    @Test
    void shouldCountRefreshOutcomesSeparately() {
        RecommenderMetrics metrics = new RecommenderMetrics(registry, properties);

        metrics.recordRefresh(RecommenderMetrics.OUTCOME_SUCCESS);
        metrics.recordRefresh(RecommenderMetrics.OUTCOME_SUCCESS);
        metrics.recordRefresh(RecommenderMetrics.OUTCOME_FAILURE);

        assertEquals(2.0, registry.get(RecommenderMetrics.REFRESH_COUNTER).tag("outcome", "success").counter()
                .count());
        assertEquals(1.0, registry.get(RecommenderMetrics.REFRESH_COUNTER).tag("outcome", "failure").counter()
                .count());
    }

    @Test
    void shouldPassThroughWhenDisabled() {
        properties.getMetrics().setEnabled(false);
        RecommenderMetrics metrics = new RecommenderMetrics(registry, properties);

        List<String> result = metrics.recordScorer(RecommendationAlgorithm.HYBRID, () -> List.of("x"));
        metrics.recordRefresh(RecommenderMetrics.OUTCOME_FAILURE);

        assertEquals(List.of("x"), result);
        assertTrue(registry.getMeters().isEmpty());
    }

    @Test
    void shouldPropagateScorerFailure() {
        RecommenderMetrics metrics = new RecommenderMetrics(registry, properties);

        assertThrows(IllegalStateException.class, () -> metrics.<List<String>>recordScorer(RecommendationAlgorithm.COLLABORATIVE,
                () -> {
                    throw new IllegalStateException("boom");
                }));
    }
}
