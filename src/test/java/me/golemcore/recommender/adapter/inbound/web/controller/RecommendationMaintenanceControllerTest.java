package me.golemcore.recommender.adapter.inbound.web.controller;

import me.golemcore.recommender.adapter.inbound.web.dto.RefreshExpiredResponse;
import me.golemcore.recommender.domain.exception.RecommendationException;
import me.golemcore.recommender.domain.model.RefreshSummary;
import me.golemcore.recommender.domain.service.RecommendationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RecommendationMaintenanceControllerTest {

    private RecommendationService recommendationService;
    private RecommendationMaintenanceController controller;

    @BeforeEach
    void setUp() {
        recommendationService = mock(RecommendationService.class);
        controller = new RecommendationMaintenanceController(recommendationService);
    }

    @Test
    void shouldReportRefreshSummary() {
        when(recommendationService.refreshExpired()).thenReturn(new RefreshSummary(3, 2, 1));

        StepVerifier.create(controller.refreshExpired())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(new RefreshExpiredResponse(3, 2, 1), response.getBody());
                })
                .verifyComplete();
    }

    @Test
    void shouldPropagateLookupFailure() {
        when(recommendationService.refreshExpired()).thenThrow(new RecommendationException("store offline"));

        StepVerifier.create(controller.refreshExpired())
                .expectError(RecommendationException.class)
                .verify();
    }

    @Test
    void shouldExposeAlgorithmWeights() {
        Map<String, Double> weights = Map.of("collaborative", 0.4, "content-based", 0.3, "hybrid", 0.2,
                "popularity", 0.1);
        when(recommendationService.algorithmWeights()).thenReturn(weights);

        StepVerifier.create(controller.getAlgorithmWeights())
                .assertNext(response -> assertEquals(weights, response.getBody()))
                .verifyComplete();
    }
}
