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
 * Terminal answer of a run.
 *
 * @param answer
 *            markdown body
 * @param keyPoints
 *            key points of the answer
 * @param usedResults
 *            evidence keys the answer relies on
 * @param notes
 *            free-form notes (limitations, uncertainty)
 */
public record FinalAnswer(String answer, List<String> keyPoints, List<String> usedResults, String notes) {

    public static final String DIRECT_ANSWER_NOTE = "Direct answer from the planner without web search.";

    public FinalAnswer {
        keyPoints = keyPoints != null ? List.copyOf(keyPoints) : List.of();
        usedResults = usedResults != null ? List.copyOf(usedResults) : List.of();
    }

    public static FinalAnswer direct(String answer) {
        return new FinalAnswer(answer, List.of(), List.of(), DIRECT_ANSWER_NOTE);
    }
}
