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
import me.golemcore.recommender.domain.model.Interaction;
import me.golemcore.recommender.port.outbound.InteractionQueryPort;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static me.golemcore.recommender.domain.RecommenderConstants.INTERACTIONS_DIR;
import static me.golemcore.recommender.domain.RecommenderConstants.JSON_SUFFIX;

/**
 * Interaction history kept as one JSON array per user under
 * {@code interactions/{userId}.json}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FileInteractionAdapter implements InteractionQueryPort {

    private static final TypeReference<List<Interaction>> LIST_TYPE = new TypeReference<>() {
    };

    private static final Comparator<Interaction> NEWEST_FIRST = Comparator
            .comparing(Interaction::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Interaction::getId, Comparator.reverseOrder());

    private final JsonDocumentStore documentStore;

    @Override
    public List<Interaction> findByUser(long userId) {
        return sorted(documentStore.readList(INTERACTIONS_DIR, userId + JSON_SUFFIX, LIST_TYPE).stream());
    }

    @Override
    public List<Interaction> findByProduct(long productId) {
        return findByProducts(List.of(productId)).getOrDefault(productId, List.of());
    }

    @Override
    public Map<Long, List<Interaction>> findByProducts(Collection<Long> productIds) {
        if (productIds.isEmpty()) {
            return Map.of();
        }
        Set<Long> wanted = new HashSet<>(productIds);
        List<String> files = documentStore.list(INTERACTIONS_DIR, JSON_SUFFIX);
        log.debug("[Storage] Scanning {} interaction files for {} products", files.size(), wanted.size());
        return files.stream()
                .flatMap(file -> documentStore.readList(INTERACTIONS_DIR, file, LIST_TYPE).stream())
                .filter(interaction -> wanted.contains(interaction.getProductId()))
                .sorted(NEWEST_FIRST)
                .collect(Collectors.groupingBy(Interaction::getProductId, Collectors.toList()));
    }

    private static List<Interaction> sorted(Stream<Interaction> interactions) {
        return interactions.sorted(NEWEST_FIRST).toList();
    }
}
