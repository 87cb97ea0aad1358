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
import me.golemcore.recommender.domain.model.Product;
import me.golemcore.recommender.port.outbound.CatalogQueryPort;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static me.golemcore.recommender.domain.RecommenderConstants.CATALOG_DIR;
import static me.golemcore.recommender.domain.RecommenderConstants.PRODUCTS_FILE;

/**
 * Catalog snapshot read from {@code catalog/products.json}. Unavailable
 * products are filtered out of every query.
 */
@Component
@RequiredArgsConstructor
public class FileCatalogAdapter implements CatalogQueryPort {

    private static final TypeReference<List<Product>> LIST_TYPE = new TypeReference<>() {
    };

    private final JsonDocumentStore documentStore;

    @Override
    public List<Product> findAvailable() {
        return documentStore.readList(CATALOG_DIR, PRODUCTS_FILE, LIST_TYPE).stream()
                .filter(Product::isAvailability)
                .toList();
    }

    @Override
    public List<Product> findByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        Set<Long> wanted = new HashSet<>(ids);
        return findAvailable().stream()
                .filter(product -> wanted.contains(product.getId()))
                .toList();
    }
}
