package me.golemcore.recommender.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the recommender, bound from
 * application.properties.
 *
 * <p>
 * All settings live under the {@code recommender.*} prefix:
 * <ul>
 * <li>{@link SimilarityProperties} - similar-user search</li>
 * <li>{@link FusionProperties} - parallel scoring and blending</li>
 * <li>{@link RefreshProperties} - bulk refresh pool and scheduler</li>
 * <li>{@link StorageProperties} - local workspace location</li>
 * <li>{@link MetricsProperties} - Micrometer instrumentation</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "recommender")
@Data
public class RecommenderProperties {

    private int defaultLimit = 10;
    private int maxLimit = 50;
    private Duration freshnessWindow = Duration.ofHours(24);
    private SimilarityProperties similarity = new SimilarityProperties();
    private FusionProperties fusion = new FusionProperties();
    private RefreshProperties refresh = new RefreshProperties();
    private StorageProperties storage = new StorageProperties();
    private MetricsProperties metrics = new MetricsProperties();

    @Data
    public static class SimilarityProperties {
        private int limit = 10;
    }

    @Data
    public static class FusionProperties {
        private Duration timeout = Duration.ofSeconds(30);
        private int scoringThreads = 3;
    }

    @Data
    public static class RefreshProperties {
        private int parallelism = 2;
        private SchedulerProperties scheduler = new SchedulerProperties();
    }

    @Data
    public static class SchedulerProperties {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(15);
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/recommender";
    }

    @Data
    public static class MetricsProperties {
        private boolean enabled = true;
    }
}
