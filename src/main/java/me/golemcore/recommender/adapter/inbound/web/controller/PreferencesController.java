package me.golemcore.recommender.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.recommender.adapter.inbound.web.dto.PreferencesPatchRequest;
import me.golemcore.recommender.adapter.inbound.web.dto.PreferencesResponse;
import me.golemcore.recommender.domain.model.PreferencesPatch;
import me.golemcore.recommender.domain.model.PreferencesUpdateResult;
import me.golemcore.recommender.domain.model.PriceRange;
import me.golemcore.recommender.domain.model.UserPreferences;
import me.golemcore.recommender.domain.service.UserPreferencesService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Shopping preferences read and patch endpoints.
 */
@RestController
@RequestMapping("/api/users/{userId}/preferences")
@RequiredArgsConstructor
public class PreferencesController {

    private final UserPreferencesService preferencesService;

    @GetMapping
    public Mono<ResponseEntity<PreferencesResponse>> getPreferences(@PathVariable long userId) {
        return Mono.fromCallable(() -> {
            requireUser(userId);
            return toResponse(preferencesService.getPreferences(userId), false);
        }).subscribeOn(Schedulers.boundedElastic()).map(ResponseEntity::ok);
    }

    @PatchMapping
    public Mono<ResponseEntity<PreferencesResponse>> patchPreferences(
            @PathVariable long userId,
            @RequestBody(required = false) PreferencesPatchRequest request) {
        return Mono.fromCallable(() -> {
            requireUser(userId);
            if (request == null) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
            }
            PreferencesUpdateResult result = preferencesService.applyPatch(userId, toPatch(request));
            return toResponse(result.preferences(), result.changed());
        }).subscribeOn(Schedulers.boundedElastic()).map(ResponseEntity::ok);
    }

    private static PreferencesPatch toPatch(PreferencesPatchRequest request) {
        PriceRange priceRange = null;
        if (request.getPriceRange() != null) {
            PreferencesPatchRequest.PriceRangeDto dto = request.getPriceRange();
            if (dto.getMin() == null || dto.getMax() == null) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "Price range must include both min and max");
            }
            priceRange = new PriceRange(dto.getMin(), dto.getMax());
        }
        return PreferencesPatch.builder()
                .categories(request.getCategories())
                .brands(request.getBrands())
                .priceRange(priceRange)
                .stylePreferences(request.getStylePreferences())
                .build();
    }

    private static PreferencesResponse toResponse(UserPreferences preferences, boolean changed) {
        PriceRange range = preferences.getPriceRange();
        return PreferencesResponse.builder()
                .userId(preferences.getUserId())
                .categories(preferences.getCategories())
                .brands(preferences.getBrands())
                .priceRange(range != null
                        ? new PreferencesPatchRequest.PriceRangeDto(range.min(), range.max())
                        : null)
                .stylePreferences(preferences.getStylePreferences())
                .updatedAt(preferences.getUpdatedAt())
                .changed(changed)
                .build();
    }

    private static void requireUser(long userId) {
        if (userId <= 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Valid user ID is required");
        }
    }
}
