package me.golemcore.recommender.adapter.inbound.web.dto;

/**
 * Persisted score of one product for one user.
 */
public record ScoreResponse(long productId, double score, String confidence) {
}
