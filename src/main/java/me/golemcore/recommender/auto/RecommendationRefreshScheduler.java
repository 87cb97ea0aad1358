package me.golemcore.recommender.auto;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recommender.domain.model.RefreshSummary;
import me.golemcore.recommender.domain.service.RecommendationService;
import me.golemcore.recommender.infrastructure.config.RecommenderProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically refreshes users whose recommendations have expired.
 *
 * <p>
 * Runs on a single daemon thread. A tick that starts while the previous one
 * is still running is skipped.
 */
@Component
@Slf4j
public class RecommendationRefreshScheduler {

    private final RecommendationService recommendationService;
    private final RecommenderProperties properties;

    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public RecommendationRefreshScheduler(RecommendationService recommendationService,
            RecommenderProperties properties) {
        this.recommendationService = recommendationService;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        RecommenderProperties.SchedulerProperties schedulerProps = properties.getRefresh().getScheduler();
        if (!schedulerProps.isEnabled()) {
            log.info("[RefreshScheduler] Scheduled refresh disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "recommendation-refresh-scheduler");
            t.setDaemon(true);
            return t;
        });

        long intervalSeconds = Math.max(1, schedulerProps.getInterval().toSeconds());
        tickTask = scheduler.scheduleAtFixedRate(
                this::tick,
                intervalSeconds,
                intervalSeconds,
                TimeUnit.SECONDS);

        log.info("[RefreshScheduler] Started with interval: {}s", intervalSeconds);
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[RefreshScheduler] Shut down");
    }

    boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[RefreshScheduler] Tick skipped: previous execution still in progress");
            return;
        }
        try {
            RefreshSummary summary = recommendationService.refreshExpired();
            if (summary.usersFound() > 0) {
                log.info("[RefreshScheduler] Tick: refreshed {}/{} users, {} failed", summary.refreshed(),
                        summary.usersFound(), summary.failed());
            }
        } catch (RuntimeException e) {
            log.error("[RefreshScheduler] Tick failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }
}
