package me.golemcore.recommender.port.outbound;

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

import me.golemcore.recommender.domain.model.Recommendation;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Write and query contract over persisted recommendations.
 */
public interface RecommendationStorePort {

    void deleteByUser(long userId);

    void insertAll(Collection<Recommendation> recommendations);

    /**
     * Rows of the user whose {@code expiresAt} is after {@code now}.
     */
    List<Recommendation> findActive(long userId, Instant now);

    /**
     * Distinct users owning at least one row with {@code expiresAt <= now}.
     */
    List<Long> findUsersWithExpired(Instant now);

    /**
     * Replace every row of the user with {@code recommendations} in a single
     * operation. Readers observe either the old rows or the new ones.
     */
    void replaceForUser(long userId, Collection<Recommendation> recommendations);

    /**
     * Every stored row of the user, expired ones included.
     */
    List<Recommendation> findAll(long userId);
}
