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

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * One entry of the run trace.
 *
 * @param sequence
 *            strictly increasing per run, starting at 1
 * @param timestamp
 *            wall-clock time of the event
 * @param state
 *            loop state when the event was recorded
 * @param type
 *            event type
 * @param round
 *            current round, 0 before the first search
 * @param message
 *            human-readable description
 * @param data
 *            structured payload
 * @param errorKind
 *            set for {@link TraceEventType#ERROR} events
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TraceEvent(long sequence, Instant timestamp, ResearchState state, TraceEventType type, int round,
        String message, Map<String, Object> data, ErrorKind errorKind) {
}
