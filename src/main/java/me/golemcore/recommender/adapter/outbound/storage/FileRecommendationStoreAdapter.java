package me.golemcore.recommender.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recommender.domain.model.Recommendation;
import me.golemcore.recommender.port.outbound.RecommendationStorePort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static me.golemcore.recommender.domain.RecommenderConstants.JSON_SUFFIX;
import static me.golemcore.recommender.domain.RecommenderConstants.RECOMMENDATIONS_DIR;

/**
 * Recommendations stored as one JSON array per user under
 * {@code recommendations/{userId}.json}.
 *
 * <p>
 * Every write replaces the whole user file through an atomic rename, so a
 * reader never observes a half-written refresh. Writers are serialized on this
 * adapter's monitor.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FileRecommendationStoreAdapter implements RecommendationStorePort {

    private static final TypeReference<List<Recommendation>> LIST_TYPE = new TypeReference<>() {
    };

    private final JsonDocumentStore documentStore;

    @Override
    public synchronized void deleteByUser(long userId) {
        documentStore.delete(RECOMMENDATIONS_DIR, fileName(userId));
    }

    @Override
    public synchronized void insertAll(Collection<Recommendation> recommendations) {
        Map<Long, List<Recommendation>> byUser = new LinkedHashMap<>();
        for (Recommendation recommendation : recommendations) {
            byUser.computeIfAbsent(recommendation.getUserId(), id -> new ArrayList<>()).add(recommendation);
        }
        byUser.forEach((userId, rows) -> {
            List<Recommendation> merged = new ArrayList<>(findAll(userId));
            merged.addAll(rows);
            documentStore.writeAtomic(RECOMMENDATIONS_DIR, fileName(userId), merged);
        });
    }

    @Override
    public List<Recommendation> findActive(long userId, Instant now) {
        return findAll(userId).stream()
                .filter(recommendation -> recommendation.isActive(now))
                .toList();
    }

    @Override
    public List<Long> findUsersWithExpired(Instant now) {
        List<Long> users = new ArrayList<>();
        for (String file : documentStore.list(RECOMMENDATIONS_DIR, JSON_SUFFIX)) {
            Long userId = parseUserId(file);
            if (userId == null) {
                continue;
            }
            boolean anyExpired = findAll(userId).stream()
                    .anyMatch(recommendation -> recommendation.isExpired(now));
            if (anyExpired) {
                users.add(userId);
            }
        }
        return users;
    }

    @Override
    public synchronized void replaceForUser(long userId, Collection<Recommendation> recommendations) {
        documentStore.writeAtomic(RECOMMENDATIONS_DIR, fileName(userId), List.copyOf(recommendations));
        log.debug("[Storage] Replaced recommendations for user {}: {} rows", userId, recommendations.size());
    }

    @Override
    public List<Recommendation> findAll(long userId) {
        return documentStore.readList(RECOMMENDATIONS_DIR, fileName(userId), LIST_TYPE);
    }

    private static String fileName(long userId) {
        return userId + JSON_SUFFIX;
    }

    private static Long parseUserId(String file) {
        String name = file.substring(0, file.length() - JSON_SUFFIX.length());
        try {
            return Long.parseLong(name);
        } catch (NumberFormatException e) {
            log.debug("[Storage] Skipping unexpected recommendation file: {}", file);
            return null;
        }
    }
}
