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

package me.golemcore.seeker.domain.model;

/**
 * Run-scoped limits. Immutable for the lifetime of a run.
 *
 * @param roundCap
 *            maximum number of search rounds
 * @param concurrencyCap
 *            maximum simultaneous reader pipelines
 * @param perRoundResultCap
 *            maximum candidates requested from the search gateway per round
 * @param perRoundSelectionCap
 *            maximum documents selected for reading per round
 * @param relevanceFloor
 *            reports scoring below this are left out of the synthesis payload
 */
public record ResearchSettings(int roundCap, int concurrencyCap, int perRoundResultCap, int perRoundSelectionCap,
        double relevanceFloor) {

    public ResearchSettings {
        requirePositive("round_cap", roundCap);
        requirePositive("concurrency_cap", concurrencyCap);
        requirePositive("per_round_result_cap", perRoundResultCap);
        requirePositive("per_round_selection_cap", perRoundSelectionCap);
        if (relevanceFloor < 0.0 || relevanceFloor > 1.0) {
            throw new IllegalArgumentException("relevance_floor must be within [0, 1]: " + relevanceFloor);
        }
    }

    /**
     * Returns a copy with the non-null overrides applied.
     */
    public ResearchSettings withOverrides(Integer roundCap, Integer concurrencyCap, Integer perRoundResultCap,
            Integer perRoundSelectionCap) {
        return new ResearchSettings(
                roundCap != null ? roundCap : this.roundCap,
                concurrencyCap != null ? concurrencyCap : this.concurrencyCap,
                perRoundResultCap != null ? perRoundResultCap : this.perRoundResultCap,
                perRoundSelectionCap != null ? perRoundSelectionCap : this.perRoundSelectionCap,
                relevanceFloor);
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be a positive integer: " + value);
        }
    }
}
