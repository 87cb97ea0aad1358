package me.golemcore.recommender.domain.model;

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

/**
 * Outcome of a bulk refresh of expired recommendations.
 *
 * @param usersFound
 *            distinct users with at least one expired row
 * @param refreshed
 *            users refreshed successfully
 * @param failed
 *            users whose refresh failed
 */
public record RefreshSummary(int usersFound, int refreshed, int failed) {

    public static RefreshSummary empty() {
        return new RefreshSummary(0, 0, 0);
    }
}
