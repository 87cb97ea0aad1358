package me.golemcore.recommender.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreferencesResponse {
    private long userId;
    private List<String> categories;
    private List<String> brands;
    private PreferencesPatchRequest.PriceRangeDto priceRange;
    private List<String> stylePreferences;
    private Instant updatedAt;
    private boolean changed;
}
