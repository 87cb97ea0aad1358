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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes generation and refresh work per user. Work for different users
 * proceeds in parallel.
 *
 * <p>
 * A user's lock lives in the map only while some thread holds or waits for
 * it; the last one out removes the entry.
 */
@Service
@Slf4j
public class RefreshCoordinator {

    private final Map<Long, UserLock> locks = new ConcurrentHashMap<>();

    public <T> T runExclusive(long userId, Supplier<T> work) {
        UserLock userLock = locks.compute(userId, (id, existing) -> {
            UserLock acquired = existing != null ? existing : new UserLock();
            acquired.holders++;
            return acquired;
        });
        ReentrantLock lock = userLock.lock;
        if (lock.isLocked() && !lock.isHeldByCurrentThread()) {
            log.debug("[Refresh] Waiting for in-flight work on user {}", userId);
        }
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
            locks.computeIfPresent(userId, (id, held) -> --held.holders == 0 ? null : held);
        }
    }

    int trackedUsers() {
        return locks.size();
    }

    // holders is only touched inside map compute calls for the same key
    private static final class UserLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
