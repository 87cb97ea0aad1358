package me.golemcore.recommender.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationDto {
    private long productId;
    private double score;
    private String algorithm;
    private String confidence;
    private String reason;
    private Instant expiresAt;
    private ProductDto product;
}
