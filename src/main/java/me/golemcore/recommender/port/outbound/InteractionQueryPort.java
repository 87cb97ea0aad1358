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

import me.golemcore.recommender.domain.model.Interaction;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read contract over the interaction store. All queries return interactions
 * ordered newest first.
 */
public interface InteractionQueryPort {

    List<Interaction> findByUser(long userId);

    List<Interaction> findByProduct(long productId);

    /**
     * Interactions on any of the given products in one pass over the store,
     * grouped by product id. Products nobody interacted with have no entry.
     */
    Map<Long, List<Interaction>> findByProducts(Collection<Long> productIds);
}
