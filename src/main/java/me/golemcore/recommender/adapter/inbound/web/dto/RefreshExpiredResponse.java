package me.golemcore.recommender.adapter.inbound.web.dto;

public record RefreshExpiredResponse(int usersFound, int refreshed, int failed) {
}
