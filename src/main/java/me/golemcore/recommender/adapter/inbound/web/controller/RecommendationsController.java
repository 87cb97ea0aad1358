package me.golemcore.recommender.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recommender.adapter.inbound.web.dto.ProductDto;
import me.golemcore.recommender.adapter.inbound.web.dto.RecommendationDto;
import me.golemcore.recommender.adapter.inbound.web.dto.RecommendationListResponse;
import me.golemcore.recommender.adapter.inbound.web.dto.ScoreResponse;
import me.golemcore.recommender.domain.model.Confidence;
import me.golemcore.recommender.domain.model.Product;
import me.golemcore.recommender.domain.model.RecommendationAlgorithm;
import me.golemcore.recommender.domain.model.RecommendationReport;
import me.golemcore.recommender.domain.model.RecommendationResult;
import me.golemcore.recommender.domain.model.RecommendationStats;
import me.golemcore.recommender.domain.service.RecommendationService;
import me.golemcore.recommender.infrastructure.config.RecommenderProperties;
import me.golemcore.recommender.port.outbound.CatalogQueryPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Per-user recommendation endpoints. Items are joined with catalog details;
 * items whose product is no longer available are dropped.
 */
@RestController
@RequestMapping("/api/users/{userId}/recommendations")
@RequiredArgsConstructor
@Slf4j
public class RecommendationsController {

    private static final String ALGORITHM_FUSED = "fused";

    private final RecommendationService recommendationService;
    private final CatalogQueryPort catalogQueryPort;
    private final RecommenderProperties properties;

    @GetMapping
    public Mono<ResponseEntity<RecommendationListResponse>> getRecommendations(
            @PathVariable long userId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String algorithm) {
        return blocking(() -> {
            requireUser(userId);
            int resolvedLimit = resolveLimit(limit);
            if (algorithm == null || algorithm.isBlank()) {
                return list(userId, ALGORITHM_FUSED, recommendationService.generate(userId, resolvedLimit));
            }
            RecommendationAlgorithm requested = RecommendationAlgorithm.fromCode(algorithm)
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST,
                            "Algorithm must be one of: collaborative, content-based, hybrid, popularity"));
            return list(userId, requested.getCode(), byAlgorithm(userId, requested, resolvedLimit));
        });
    }

    @GetMapping("/collaborative")
    public Mono<ResponseEntity<RecommendationListResponse>> getCollaborative(
            @PathVariable long userId,
            @RequestParam(required = false) Integer limit) {
        return single(userId, limit, RecommendationAlgorithm.COLLABORATIVE);
    }

    @GetMapping("/content-based")
    public Mono<ResponseEntity<RecommendationListResponse>> getContentBased(
            @PathVariable long userId,
            @RequestParam(required = false) Integer limit) {
        return single(userId, limit, RecommendationAlgorithm.CONTENT_BASED);
    }

    @GetMapping("/hybrid")
    public Mono<ResponseEntity<RecommendationListResponse>> getHybrid(
            @PathVariable long userId,
            @RequestParam(required = false) Integer limit) {
        return single(userId, limit, RecommendationAlgorithm.HYBRID);
    }

    @GetMapping("/popularity")
    public Mono<ResponseEntity<RecommendationListResponse>> getPopularity(
            @PathVariable long userId,
            @RequestParam(required = false) Integer limit) {
        return single(userId, limit, RecommendationAlgorithm.POPULARITY);
    }

    @GetMapping("/score/{productId}")
    public Mono<ResponseEntity<ScoreResponse>> getScore(@PathVariable long userId, @PathVariable long productId) {
        return blocking(() -> {
            requireUser(userId);
            if (productId <= 0) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Valid product ID is required");
            }
            double score = recommendationService.scoreFor(userId, productId);
            return new ScoreResponse(productId, score, Confidence.fromScore(score).getCode());
        });
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<RecommendationStats>> getStats(@PathVariable long userId) {
        return blocking(() -> {
            requireUser(userId);
            return recommendationService.stats(userId);
        });
    }

    @GetMapping("/report")
    public Mono<ResponseEntity<RecommendationReport>> getReport(@PathVariable long userId) {
        return blocking(() -> {
            requireUser(userId);
            return recommendationService.report(userId);
        });
    }

    @PostMapping("/refresh")
    public Mono<ResponseEntity<RecommendationListResponse>> refresh(@PathVariable long userId) {
        return blocking(() -> {
            requireUser(userId);
            List<RecommendationResult> refreshed = recommendationService.refresh(userId);
            log.info("[API] Refreshed recommendations for user {}", userId);
            return list(userId, ALGORITHM_FUSED, refreshed);
        });
    }

    private Mono<ResponseEntity<RecommendationListResponse>> single(long userId, Integer limit,
            RecommendationAlgorithm algorithm) {
        return blocking(() -> {
            requireUser(userId);
            return list(userId, algorithm.getCode(), byAlgorithm(userId, algorithm, resolveLimit(limit)));
        });
    }

    private List<RecommendationResult> byAlgorithm(long userId, RecommendationAlgorithm algorithm, int limit) {
        return switch (algorithm) {
        case COLLABORATIVE -> recommendationService.collaborativeOnly(userId, limit);
        case CONTENT_BASED -> recommendationService.contentBasedOnly(userId, limit);
        case HYBRID -> recommendationService.hybridOnly(userId, limit);
        case POPULARITY -> recommendationService.popularityOnly(userId, limit);
        };
    }

    private RecommendationListResponse list(long userId, String algorithm, List<RecommendationResult> results) {
        List<Long> productIds = results.stream().map(RecommendationResult::productId).toList();
        Map<Long, Product> products = catalogQueryPort.findByIds(productIds).stream()
                .collect(Collectors.toMap(Product::getId, Function.identity(), (first, second) -> first));

        List<RecommendationDto> items = results.stream()
                .filter(result -> products.containsKey(result.productId()))
                .map(result -> toDto(result, products.get(result.productId())))
                .toList();

        return RecommendationListResponse.builder()
                .userId(userId)
                .algorithm(algorithm)
                .count(items.size())
                .recommendations(items)
                .build();
    }

    private int resolveLimit(Integer limit) {
        int resolved = limit != null ? limit : properties.getDefaultLimit();
        if (resolved < 1 || resolved > properties.getMaxLimit()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Limit must be between 1 and " + properties.getMaxLimit());
        }
        return resolved;
    }

    private static void requireUser(long userId) {
        if (userId <= 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Valid user ID is required");
        }
    }

    private static <T> Mono<ResponseEntity<T>> blocking(Callable<T> call) {
        return Mono.fromCallable(call)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    private static RecommendationDto toDto(RecommendationResult result, Product product) {
        return RecommendationDto.builder()
                .productId(result.productId())
                .score(result.score())
                .algorithm(result.algorithm() != null ? result.algorithm().getCode() : null)
                .confidence(result.confidence().getCode())
                .reason(result.reason())
                .expiresAt(result.expiresAt())
                .product(ProductDto.builder()
                        .id(product.getId())
                        .name(product.getName())
                        .description(product.getDescription())
                        .category(product.getCategory())
                        .brand(product.getBrand())
                        .price(product.getPrice())
                        .style(product.getStyle())
                        .imageUrl(product.getImageUrl())
                        .build())
                .build();
    }
}
