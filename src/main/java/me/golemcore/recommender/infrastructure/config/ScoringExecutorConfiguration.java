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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Bounded worker pools: one for the concurrent scorers of a fusion pass, one
 * for bulk refreshes of expired users. Both use daemon threads.
 */
@Configuration
@Slf4j
public class ScoringExecutorConfiguration {

    static final String SCORING_THREAD_NAME = "recommender-scoring";
    static final String REFRESH_THREAD_NAME = "recommender-refresh";

    private final RecommenderProperties properties;
    private final List<ExecutorService> executors = new ArrayList<>();

    public ScoringExecutorConfiguration(RecommenderProperties properties) {
        this.properties = properties;
    }

    @Bean
    public ExecutorService scoringExecutor() {
        return register(Executors.newFixedThreadPool(Math.max(1, properties.getFusion().getScoringThreads()),
                r -> daemon(r, SCORING_THREAD_NAME)));
    }

    @Bean
    public ExecutorService refreshExecutor() {
        return register(Executors.newFixedThreadPool(Math.max(1, properties.getRefresh().getParallelism()),
                r -> daemon(r, REFRESH_THREAD_NAME)));
    }

    @PreDestroy
    public void shutdown() {
        synchronized (executors) {
            for (ExecutorService executor : executors) {
                executor.shutdown();
                try {
                    if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                        executor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    executor.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
        }
        log.debug("[Executors] Worker pools shut down");
    }

    private ExecutorService register(ExecutorService executor) {
        synchronized (executors) {
            executors.add(executor);
        }
        return executor;
    }

    private static Thread daemon(Runnable runnable, String name) {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        return thread;
    }
}
