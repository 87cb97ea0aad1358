package me.golemcore.recommender.domain.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import me.golemcore.recommender.domain.RecommenderConstants;
import me.golemcore.recommender.domain.exception.RecommendationException;
import me.golemcore.recommender.domain.exception.RecommendationValidationException;
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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RecommendationServiceTest {

    private static final long USER = 42L;
    private static final Instant NOW = Instant.parse("2026-03-10T10:00:00Z");

    private FusionCombiner fusionCombiner;
    private CollaborativeScorer collaborativeScorer;
    private ContentBasedScorer contentBasedScorer;
    private RecommendationStorePort storePort;
    private SimpleMeterRegistry registry;
    private ExecutorService refreshExecutor;
    private RecommendationService service;

    @BeforeEach
    void setUp() {
        fusionCombiner = mock(FusionCombiner.class);
        collaborativeScorer = mock(CollaborativeScorer.class);
        contentBasedScorer = mock(ContentBasedScorer.class);
        storePort = mock(RecommendationStorePort.class);
        registry = new SimpleMeterRegistry();
        refreshExecutor = Executors.newFixedThreadPool(2);
        RecommenderProperties properties = new RecommenderProperties();
        service = new RecommendationService(fusionCombiner, collaborativeScorer, contentBasedScorer, storePort,
                new RecommendationValidator(), new RefreshCoordinator(),
                new RecommenderMetrics(registry, properties), properties, refreshExecutor,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        refreshExecutor.shutdownNow();
    }

    private static Recommendation stored(long productId, double score, RecommendationAlgorithm algorithm) {
        return Recommendation.create(USER, productId, score, algorithm, NOW.minusSeconds(3600), Duration.ofHours(24));
    }

    private static CandidateScore candidate(long productId, double score, RecommendationAlgorithm algorithm) {
        return CandidateScore.of(productId, score, algorithm, "reason " + productId);
    }

    // ==================== generate ====================

    @Test
    void shouldServeActiveRowsWithoutScoring() {
        when(storePort.findActive(USER, NOW)).thenReturn(List.of(
                stored(10L, 0.4, RecommendationAlgorithm.POPULARITY),
                stored(11L, 0.9, RecommendationAlgorithm.HYBRID),
                stored(10L, 0.6, RecommendationAlgorithm.CONTENT_BASED)));

        List<RecommendationResult> results = service.generate(USER, 10);

        assertEquals(List.of(11L, 10L), results.stream().map(RecommendationResult::productId).toList());
        assertEquals(0.6, results.get(1).score());
        assertEquals(RecommenderConstants.REASON_PREVIOUSLY_RECOMMENDED, results.get(0).reason());
        assertEquals(NOW.plus(Duration.ofHours(23)), results.get(0).expiresAt());
        verifyNoInteractions(fusionCombiner);
        verify(storePort, never()).replaceForUser(anyLong(), anyList());
    }

    @Test
    void shouldTruncateActiveRowsToLimit() {
        when(storePort.findActive(USER, NOW)).thenReturn(List.of(
                stored(10L, 0.4, RecommendationAlgorithm.POPULARITY),
                stored(11L, 0.9, RecommendationAlgorithm.HYBRID),
                stored(12L, 0.5, RecommendationAlgorithm.HYBRID)));

        assertEquals(1, service.generate(USER, 1).size());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldScoreAndPersistWhenNothingIsActive() {
        when(storePort.findActive(USER, NOW)).thenReturn(List.of());
        when(fusionCombiner.combine(USER, 5)).thenReturn(List.of(
                candidate(20L, 0.8, RecommendationAlgorithm.HYBRID),
                candidate(21L, 0.3, RecommendationAlgorithm.POPULARITY)));

        List<RecommendationResult> results = service.generate(USER, 5);

        ArgumentCaptor<List<Recommendation>> rows = ArgumentCaptor.forClass(List.class);
        verify(storePort).replaceForUser(eq(USER), rows.capture());
        assertEquals(2, rows.getValue().size());
        Recommendation first = rows.getValue().get(0);
        assertEquals(20L, first.getProductId());
        assertEquals(NOW, first.getCreatedAt());
        assertEquals(NOW.plus(Duration.ofHours(24)), first.getExpiresAt());
        assertEquals(RecommendationAlgorithm.HYBRID, first.getAlgorithm());

        assertEquals(2, results.size());
        assertEquals("reason 20", results.get(0).reason());
        assertEquals(NOW.plus(Duration.ofHours(24)), results.get(0).expiresAt());
    }

    @Test
    void shouldReturnSameRecommendationsOnRepeatedCalls() {
        List<Recommendation> store = new ArrayList<>();
        when(storePort.findActive(eq(USER), any())).thenAnswer(invocation -> List.copyOf(store));
        doAnswer(invocation -> {
            store.clear();
            store.addAll(invocation.getArgument(1));
            return null;
        }).when(storePort).replaceForUser(eq(USER), anyList());
        when(fusionCombiner.combine(USER, 3)).thenReturn(List.of(
                candidate(30L, 0.9, RecommendationAlgorithm.HYBRID),
                candidate(31L, 0.7, RecommendationAlgorithm.CONTENT_BASED)));

        List<RecommendationResult> first = service.generate(USER, 3);
        List<RecommendationResult> second = service.generate(USER, 3);

        assertEquals(first.stream().map(RecommendationResult::productId).toList(),
                second.stream().map(RecommendationResult::productId).toList());
        verify(fusionCombiner, times(1)).combine(anyLong(), anyInt());
        verify(storePort, times(1)).replaceForUser(eq(USER), anyList());
    }

    @Test
    void shouldNotPersistWhenAnyRowIsInvalid() {
        when(storePort.findActive(USER, NOW)).thenReturn(List.of());
        when(fusionCombiner.combine(USER, 5)).thenReturn(List.of(
                candidate(20L, 0.8, RecommendationAlgorithm.HYBRID),
                candidate(0L, 0.5, RecommendationAlgorithm.POPULARITY)));

        RecommendationValidationException error = assertThrows(RecommendationValidationException.class,
                () -> service.generate(USER, 5));

        assertEquals(List.of("product 0: Valid product ID is required"), error.getViolations());
        verify(storePort, never()).replaceForUser(anyLong(), anyList());
    }

    @Test
    void shouldRejectLimitOutsideBounds() {
        assertThrows(IllegalArgumentException.class, () -> service.generate(USER, 0));
        assertThrows(IllegalArgumentException.class, () -> service.generate(USER, 51));
        verifyNoInteractions(storePort);
    }

    @Test
    void shouldWrapStoreFailures() {
        when(storePort.findActive(USER, NOW)).thenThrow(new UncheckedIOException(new IOException("disk full")));

        RecommendationException error = assertThrows(RecommendationException.class,
                () -> service.generate(USER, 5));

        assertTrue(error.getCause() instanceof UncheckedIOException);
    }

    @Test
    void shouldWrapPersistFailures() {
        when(storePort.findActive(USER, NOW)).thenReturn(List.of());
        when(fusionCombiner.combine(USER, 5)).thenReturn(List.of(candidate(20L, 0.8,
                RecommendationAlgorithm.HYBRID)));
        doThrow(new IllegalStateException("locked")).when(storePort).replaceForUser(eq(USER), anyList());

        assertThrows(RecommendationException.class, () -> service.generate(USER, 5));
    }

    // ==================== refresh ====================

    @Test
    void shouldDoNothingWhenNoRowsExpired() {
        when(storePort.findUsersWithExpired(NOW)).thenReturn(List.of());

        RefreshSummary summary = service.refreshExpired();

        assertEquals(RefreshSummary.empty(), summary);
        verifyNoInteractions(fusionCombiner);
        verify(storePort, never()).replaceForUser(anyLong(), anyList());
    }

    @Test
    void shouldCountFailedUsersWithoutStoppingOthers() {
        when(storePort.findUsersWithExpired(NOW)).thenReturn(List.of(1L, 2L, 3L));
        when(fusionCombiner.combine(1L, 10)).thenReturn(List.of(candidate(5L, 0.5,
                RecommendationAlgorithm.POPULARITY)));
        when(fusionCombiner.combine(2L, 10)).thenThrow(new RecommendationException("Scoring timed out for user 2"));
        when(fusionCombiner.combine(3L, 10)).thenReturn(List.of());

        RefreshSummary summary = service.refreshExpired();

        assertEquals(new RefreshSummary(3, 2, 1), summary);
        verify(storePort).replaceForUser(eq(1L), anyList());
        verify(storePort).replaceForUser(eq(3L), anyList());
        verify(storePort, never()).replaceForUser(eq(2L), anyList());
        assertEquals(2.0, registry.get(RecommenderMetrics.REFRESH_COUNTER)
                .tag("outcome", RecommenderMetrics.OUTCOME_SUCCESS).counter().count());
        assertEquals(1.0, registry.get(RecommenderMetrics.REFRESH_COUNTER)
                .tag("outcome", RecommenderMetrics.OUTCOME_FAILURE).counter().count());
    }

    @Test
    void shouldFailWhenExpiredLookupFails() {
        when(storePort.findUsersWithExpired(NOW)).thenThrow(new IllegalStateException("unreadable"));

        assertThrows(RecommendationException.class, () -> service.refreshExpired());
    }

    @Test
    void shouldRefreshSingleUserAtDefaultLimit() {
        when(fusionCombiner.combine(USER, 10)).thenReturn(List.of(candidate(7L, 0.9,
                RecommendationAlgorithm.HYBRID)));

        List<RecommendationResult> results = service.refresh(USER);

        assertEquals(1, results.size());
        verify(storePort).replaceForUser(eq(USER), anyList());
    }

    // ==================== queries ====================

    @Test
    void shouldReturnHighestActiveScoreOrZero() {
        when(storePort.findActive(USER, NOW)).thenReturn(List.of(
                stored(10L, 0.4, RecommendationAlgorithm.POPULARITY),
                stored(10L, 0.6, RecommendationAlgorithm.HYBRID)));

        assertEquals(0.6, service.scoreFor(USER, 10L));
        assertEquals(0.0, service.scoreFor(USER, 99L));
    }

    @Test
    void shouldSummarizeActiveRows() {
        when(storePort.findActive(USER, NOW)).thenReturn(List.of(
                stored(10L, 0.2, RecommendationAlgorithm.POPULARITY),
                stored(11L, 0.6, RecommendationAlgorithm.HYBRID),
                stored(12L, 1.0, RecommendationAlgorithm.HYBRID)));

        RecommendationStats stats = service.stats(USER);

        assertEquals(3, stats.total());
        assertEquals(0.6, stats.averageScore(), 1e-9);
        assertEquals(Map.of("hybrid", 2L, "popularity", 1L), stats.algorithmDistribution());
    }

    @Test
    void shouldReportEmptyStatsForUnknownUser() {
        when(storePort.findActive(USER, NOW)).thenReturn(List.of());

        RecommendationStats stats = service.stats(USER);

        assertEquals(0, stats.total());
        assertEquals(0.0, stats.averageScore());
        assertTrue(stats.algorithmDistribution().isEmpty());
    }

    @Test
    void shouldBuildReportFromAllRows() {
        Recommendation expired = Recommendation.create(USER, 13L, 0.9, RecommendationAlgorithm.COLLABORATIVE,
                NOW.minus(Duration.ofHours(30)), Duration.ofHours(24));
        when(storePort.findAll(USER)).thenReturn(List.of(expired, stored(10L, 0.5, RecommendationAlgorithm.HYBRID)));

        RecommendationReport report = service.report(USER);

        assertEquals(2, report.getTotal());
        assertEquals(1, report.getExpired());
        assertEquals(1, report.getActive());
    }

    @Test
    void shouldKeepOnlyPopularityItemsFromDoubledFusionPass() {
        when(fusionCombiner.combine(USER, 4)).thenReturn(List.of(
                candidate(1L, 0.9, RecommendationAlgorithm.HYBRID),
                candidate(2L, 0.2, RecommendationAlgorithm.POPULARITY),
                candidate(3L, 0.15, RecommendationAlgorithm.POPULARITY),
                candidate(4L, 0.1, RecommendationAlgorithm.POPULARITY)));

        List<RecommendationResult> results = service.popularityOnly(USER, 2);

        assertEquals(List.of(2L, 3L), results.stream().map(RecommendationResult::productId).toList());
        assertNull(results.get(0).expiresAt());
        verifyNoInteractions(storePort);
    }

    @Test
    void shouldRunSingleScorersWithoutPersisting() {
        when(collaborativeScorer.score(USER, 5)).thenReturn(List.of(candidate(1L, 0.7,
                RecommendationAlgorithm.COLLABORATIVE)));
        when(contentBasedScorer.score(USER, 5)).thenReturn(List.of());

        assertEquals(1, service.collaborativeOnly(USER, 5).size());
        assertTrue(service.contentBasedOnly(USER, 5).isEmpty());
        verifyNoInteractions(storePort);
    }

    @Test
    void shouldExposeAlgorithmWeightsByCode() {
        Map<String, Double> weights = service.algorithmWeights();

        assertEquals(List.of("collaborative", "content-based", "hybrid", "popularity"),
                new ArrayList<>(weights.keySet()));
        assertEquals(0.4, weights.get("collaborative"));
        assertEquals(0.1, weights.get("popularity"));
    }
}
