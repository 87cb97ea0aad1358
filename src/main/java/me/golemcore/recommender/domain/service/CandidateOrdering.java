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

import me.golemcore.recommender.domain.model.CandidateScore;

import java.util.Comparator;

/**
 * Shared ordering for candidate lists: score descending, then product id
 * ascending.
 */
final class CandidateOrdering {

    static final Comparator<CandidateScore> BY_SCORE_DESC = Comparator
            .comparingDouble(CandidateScore::score).reversed()
            .thenComparingLong(CandidateScore::productId);

    private CandidateOrdering() {
    }
}
