package me.golemcore.recommender.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.recommender.adapter.inbound.web.dto.RefreshExpiredResponse;
import me.golemcore.recommender.domain.model.RefreshSummary;
import me.golemcore.recommender.domain.service.RecommendationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Engine-wide endpoints: bulk refresh and the general algorithm weight table.
 */
@RestController
@RequestMapping("/api/recommendations")
@RequiredArgsConstructor
public class RecommendationMaintenanceController {

    private final RecommendationService recommendationService;

    @PostMapping("/refresh-expired")
    public Mono<ResponseEntity<RefreshExpiredResponse>> refreshExpired() {
        return Mono.fromCallable(recommendationService::refreshExpired)
                .subscribeOn(Schedulers.boundedElastic())
                .map(RecommendationMaintenanceController::toResponse)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/algorithm-weights")
    public Mono<ResponseEntity<Map<String, Double>>> getAlgorithmWeights() {
        return Mono.just(ResponseEntity.ok(recommendationService.algorithmWeights()));
    }

    private static RefreshExpiredResponse toResponse(RefreshSummary summary) {
        return new RefreshExpiredResponse(summary.usersFound(), summary.refreshed(), summary.failed());
    }
}
