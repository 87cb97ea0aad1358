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
import me.golemcore.recommender.domain.model.CandidateScore;
import me.golemcore.recommender.domain.model.Interaction;
import me.golemcore.recommender.domain.model.PriceRange;
import me.golemcore.recommender.domain.model.Product;
import me.golemcore.recommender.domain.model.RecommendationAlgorithm;
import me.golemcore.recommender.domain.model.UserProfile;
import me.golemcore.recommender.port.outbound.CatalogQueryPort;
import me.golemcore.recommender.port.outbound.InteractionQueryPort;
import me.golemcore.recommender.port.outbound.PreferencesPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores available products against the user's explicit preferences.
 *
 * <p>
 * Sub-scores and their weights: category 40%, brand 30%, price fit 20%,
 * style 10%. The style sub-score is a constant placeholder and is applied only
 * to products that carry a style attribute. The final score is the weighted
 * sum divided by the weight actually applied, so a product without a style is
 * not penalized.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentBasedScorer {

    static final double CATEGORY_WEIGHT = 0.4;
    static final double BRAND_WEIGHT = 0.3;
    static final double PRICE_WEIGHT = 0.2;
    static final double STYLE_WEIGHT = 0.1;
    static final double STYLE_PLACEHOLDER = 0.5;
    static final double PARTIAL_MATCH_FACTOR = 0.5;
    static final double REASON_THRESHOLD = 0.5;

    private final PreferencesPort preferencesPort;
    private final InteractionQueryPort interactionQueryPort;
    private final CatalogQueryPort catalogQueryPort;
    private final UserProfileBuilder profileBuilder;

    public List<CandidateScore> score(long userId, int limit) {
        List<Interaction> interactions = interactionQueryPort.findByUser(userId);
        UserProfile profile = profileBuilder.build(userId, preferencesPort.findByUser(userId), interactions);
        Set<Long> excluded = interactions.stream()
                .map(Interaction::getProductId)
                .collect(Collectors.toSet());

        List<CandidateScore> candidates = catalogQueryPort.findAvailable().stream()
                .filter(product -> !excluded.contains(product.getId()))
                .map(product -> scoreProduct(profile, product))
                .sorted(CandidateOrdering.BY_SCORE_DESC)
                .limit(Math.max(0, limit))
                .toList();

        log.debug("[ContentBased] user={} categories={} brands={} candidates={}", userId,
                profile.getCategoryWeights().size(), profile.getBrandWeights().size(), candidates.size());
        return candidates;
    }

    CandidateScore scoreProduct(UserProfile profile, Product product) {
        double category = matchScore(profile.getCategoryWeights(), product.getCategory());
        double brand = matchScore(profile.getBrandWeights(), product.getBrand());
        double price = priceFit(product.getPrice(), profile.getPricePreference());

        double weighted = category * CATEGORY_WEIGHT + brand * BRAND_WEIGHT + price * PRICE_WEIGHT;
        double applied = CATEGORY_WEIGHT + BRAND_WEIGHT + PRICE_WEIGHT;
        if (product.hasStyle()) {
            weighted += STYLE_PLACEHOLDER * STYLE_WEIGHT;
            applied += STYLE_WEIGHT;
        }
        double score = clamp(weighted / applied);

        return CandidateScore.of(product.getId(), score, RecommendationAlgorithm.CONTENT_BASED,
                reason(product, category, brand, price, score));
    }

    /**
     * Exact case-insensitive key match yields the key's weight, a substring match
     * in either direction yields half of it.
     */
    static double matchScore(Map<String, Double> weights, String value) {
        if (value == null || value.isBlank() || weights.isEmpty()) {
            return 0.0;
        }
        String key = value.trim().toLowerCase(Locale.ROOT);
        Double exact = weights.get(key);
        if (exact != null) {
            return exact;
        }
        double best = 0.0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            String preferred = entry.getKey();
            if (key.contains(preferred) || preferred.contains(key)) {
                best = Math.max(best, entry.getValue() * PARTIAL_MATCH_FACTOR);
            }
        }
        return best;
    }

    /**
     * 1.0 at the window midpoint, decaying linearly to 0 at either edge, 0
     * outside.
     */
    static double priceFit(double price, PriceRange window) {
        if (window == null || !window.contains(price)) {
            return 0.0;
        }
        double halfWidth = window.width() / 2;
        if (halfWidth <= 0) {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - Math.abs(price - window.midpoint()) / halfWidth);
    }

    static String reason(Product product, double category, double brand, double price, double score) {
        List<String> parts = new ArrayList<>();
        if (category > REASON_THRESHOLD) {
            parts.add("matches your " + product.getCategory() + " preferences");
        }
        if (brand > REASON_THRESHOLD) {
            parts.add("from your preferred brand " + product.getBrand());
        }
        if (price > REASON_THRESHOLD) {
            parts.add("within your price range");
        }
        if (parts.isEmpty()) {
            return "Recommended based on your preferences (" + Math.round(score * 100) + "% match)";
        }
        return "Recommended because it " + String.join(" and ", parts);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
