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
import me.golemcore.recommender.domain.model.UserPreferences;
import me.golemcore.recommender.port.outbound.PreferencesPort;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static me.golemcore.recommender.domain.RecommenderConstants.JSON_SUFFIX;
import static me.golemcore.recommender.domain.RecommenderConstants.PREFERENCES_DIR;

/**
 * Preferences stored as {@code preferences/{userId}.json}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FilePreferencesAdapter implements PreferencesPort {

    private static final TypeReference<UserPreferences> TYPE = new TypeReference<>() {
    };

    private final JsonDocumentStore documentStore;

    @Override
    public Optional<UserPreferences> findByUser(long userId) {
        return documentStore.read(PREFERENCES_DIR, userId + JSON_SUFFIX, TYPE);
    }

    @Override
    public void save(UserPreferences preferences) {
        documentStore.writeAtomic(PREFERENCES_DIR, preferences.getUserId() + JSON_SUFFIX, preferences);
        log.debug("[Storage] Saved preferences for user {}", preferences.getUserId());
    }
}
