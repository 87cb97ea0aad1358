package me.golemcore.recommender.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial preferences update. Omitted fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreferencesPatchRequest {
    private List<String> categories;
    private List<String> brands;
    private PriceRangeDto priceRange;
    private List<String> stylePreferences;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PriceRangeDto {
        private Double min;
        private Double max;
    }
}
