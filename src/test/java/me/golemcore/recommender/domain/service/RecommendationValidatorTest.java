package me.golemcore.recommender.domain.service;

import me.golemcore.recommender.domain.exception.RecommendationValidationException;
import me.golemcore.recommender.domain.model.Recommendation;
import me.golemcore.recommender.domain.model.RecommendationAlgorithm;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecommendationValidatorTest {

    private static final Instant NOW = Instant.parse("2026-03-10T10:00:00Z");

    private final RecommendationValidator validator = new RecommendationValidator();

    private static Recommendation valid() {
        return Recommendation.create(1L, 2L, 0.5, RecommendationAlgorithm.HYBRID, NOW, Duration.ofHours(24));
    }

    @Test
    void shouldAcceptValidRecommendation() {
        assertTrue(validator.violations(valid()).isEmpty());
        assertDoesNotThrow(() -> validator.validateAll(List.of(valid(), valid())));
        assertDoesNotThrow(() -> validator.validateAll(List.of()));
    }

    @Test
    void shouldAcceptScoreBounds() {
        assertTrue(validator.violations(valid().toBuilder().score(0.0).build()).isEmpty());
        assertTrue(validator.violations(valid().toBuilder().score(1.0).build()).isEmpty());
    }

    @Test
    void shouldCollectEveryViolation() {
        Recommendation broken = Recommendation.builder()
                .id(" ")
                .userId(0)
                .productId(-1)
                .score(Double.NaN)
                .build();

        List<String> violations = validator.violations(broken);

        assertEquals(List.of(
                "Recommendation id is required",
                "Valid user ID is required",
                "Valid product ID is required",
                "Score must be between 0 and 1",
                "Algorithm is required",
                "Creation and expiration dates are required"), violations);
    }

    @Test
    void shouldRejectExpiryNotAfterCreation() {
        Recommendation sameInstant = valid().toBuilder().expiresAt(NOW).build();

        assertEquals(List.of("Expiration date must be after creation date"), validator.violations(sameInstant));
    }

    @Test
    void shouldRejectWholeBatchWhenOneRowIsInvalid() {
        Recommendation outOfRange = valid().toBuilder().productId(9L).score(1.01).build();

        RecommendationValidationException error = assertThrows(RecommendationValidationException.class,
                () -> validator.validateAll(List.of(valid(), outOfRange)));

        assertEquals(List.of("product 9: Score must be between 0 and 1"), error.getViolations());
        assertEquals("product 9: Score must be between 0 and 1", error.getMessage());
    }
}
