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
 * Decoded planner decision, produced by the initial plan and by every
 * reflection.
 *
 * @param action
 *            what to do next
 * @param directAnswer
 *            answer text; required for the initial plan when answering
 *            directly
 * @param searchQuery
 *            next search; present when {@code action} is
 *            {@link PlanAction#SEARCH_THEN_ANSWER}
 * @param notes
 *            planner notes
 */
public record Plan(PlanAction action, String directAnswer, SearchQuery searchQuery, String notes) {

    public static Plan directAnswer(String answer, String notes) {
        return new Plan(PlanAction.DIRECT_ANSWER, answer, null, notes);
    }

    public static Plan search(SearchQuery query, String notes) {
        return new Plan(PlanAction.SEARCH_THEN_ANSWER, null, query, notes);
    }
}
