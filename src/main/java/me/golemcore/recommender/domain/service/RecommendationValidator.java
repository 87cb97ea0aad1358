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

import me.golemcore.recommender.domain.exception.RecommendationValidationException;
import me.golemcore.recommender.domain.model.Recommendation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Write-boundary check for recommendations. Collects every violation before
 * failing so nothing from an invalid batch is stored.
 */
@Component
public class RecommendationValidator {

    public List<String> violations(Recommendation recommendation) {
        List<String> errors = new ArrayList<>();
        if (recommendation.getId() == null || recommendation.getId().isBlank()) {
            errors.add("Recommendation id is required");
        }
        if (recommendation.getUserId() <= 0) {
            errors.add("Valid user ID is required");
        }
        if (recommendation.getProductId() <= 0) {
            errors.add("Valid product ID is required");
        }
        double score = recommendation.getScore();
        if (Double.isNaN(score) || score < 0 || score > 1) {
            errors.add("Score must be between 0 and 1");
        }
        if (recommendation.getAlgorithm() == null) {
            errors.add("Algorithm is required");
        }
        if (recommendation.getCreatedAt() == null || recommendation.getExpiresAt() == null) {
            errors.add("Creation and expiration dates are required");
        } else if (!recommendation.getExpiresAt().isAfter(recommendation.getCreatedAt())) {
            errors.add("Expiration date must be after creation date");
        }
        return errors;
    }

    public void validateAll(Collection<Recommendation> recommendations) {
        List<String> errors = new ArrayList<>();
        for (Recommendation recommendation : recommendations) {
            for (String violation : violations(recommendation)) {
                errors.add("product " + recommendation.getProductId() + ": " + violation);
            }
        }
        if (!errors.isEmpty()) {
            throw new RecommendationValidationException(errors);
        }
    }
}
