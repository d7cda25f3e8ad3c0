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

import java.util.List;

/**
 * Documents chosen by the planner for deep reading in one round. Every entry
 * references a candidate from the same round.
 *
 * @param documents
 *            selected candidates, in the order the planner listed them
 * @param droppedIds
 *            ids the planner named that were unknown, duplicated or beyond the
 *            selection cap
 * @param notes
 *            planner notes
 */
public record SelectionSet(List<CandidateDocument> documents, List<String> droppedIds, String notes) {

    public SelectionSet {
        documents = documents != null ? List.copyOf(documents) : List.of();
        droppedIds = droppedIds != null ? List.copyOf(droppedIds) : List.of();
    }

    public static SelectionSet empty(String notes) {
        return new SelectionSet(List.of(), List.of(), notes);
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }

    public int size() {
        return documents.size();
    }
}
