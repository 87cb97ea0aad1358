package me.golemcore.recommender.infrastructure.config;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoringExecutorConfigurationTest {

    private static String[] runOn(ExecutorService executor) throws InterruptedException {
        AtomicReference<String> threadName = new AtomicReference<>();
        AtomicBoolean daemon = new AtomicBoolean();
        CountDownLatch latch = new CountDownLatch(1);
        executor.submit(() -> {
            threadName.set(Thread.currentThread().getName());
            daemon.set(Thread.currentThread().isDaemon());
            latch.countDown();
        });
        assertTrue(latch.await(2, TimeUnit.SECONDS));
        return new String[] { threadName.get(), String.valueOf(daemon.get()) };
    }

    @Test
    void shouldNameScoringAndRefreshThreads() throws Exception {
        ScoringExecutorConfiguration config = new ScoringExecutorConfiguration(new RecommenderProperties());

        String[] scoring = runOn(config.scoringExecutor());
        String[] refresh = runOn(config.refreshExecutor());

        assertEquals(ScoringExecutorConfiguration.SCORING_THREAD_NAME, scoring[0]);
        assertEquals("true", scoring[1]);
        assertEquals(ScoringExecutorConfiguration.REFRESH_THREAD_NAME, refresh[0]);
        assertEquals("true", refresh[1]);

        config.shutdown();
    }

    @Test
    void shouldShutdownEveryPool() {
        RecommenderProperties properties = new RecommenderProperties();
        properties.getFusion().setScoringThreads(0);
        ScoringExecutorConfiguration config = new ScoringExecutorConfiguration(properties);
        ExecutorService scoring = config.scoringExecutor();
        ExecutorService refresh = config.refreshExecutor();

        config.shutdown();

        assertTrue(scoring.isShutdown());
        assertTrue(refresh.isShutdown());
    }
}
