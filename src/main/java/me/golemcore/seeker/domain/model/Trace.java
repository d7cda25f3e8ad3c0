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

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, thread-safe log of everything that happened during a run. The trace
 * is write-only for the loop: nothing in it feeds back into decisions.
 *
 * <p>
 * Reader workers append concurrently with the controller, so every append is
 * synchronized and receives the next sequence number.
 */
@Slf4j
public class Trace {

    private final Clock clock;
    private final List<TraceEvent> events = new ArrayList<>();
    private long sequence;
    private ResearchState state = ResearchState.INIT;
    private int round;

    public Trace(Clock clock) {
        this.clock = clock;
    }

    public synchronized TraceEvent record(TraceEventType type, String message, Map<String, Object> data) {
        return append(type, message, data, null);
    }

    public TraceEvent info(String message) {
        return record(TraceEventType.INFO, message, Map.of());
    }

    public synchronized TraceEvent error(ErrorKind kind, String message, Map<String, Object> data) {
        log.warn("[Research] {}: {}", kind, message);
        return append(TraceEventType.ERROR, message, data, kind);
    }

    /**
     * Records a state transition and makes {@code to} the state stamped on
     * subsequent events.
     */
    public synchronized TraceEvent transition(ResearchState to, String reason) {
        ResearchState from = state;
        state = to;
        log.info("[Research] {} -> {} (round {}): {}", from, to, round, reason);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("from", from.name());
        data.put("to", to.name());
        return append(TraceEventType.STATE_TRANSITION, reason, data, null);
    }

    public synchronized void setRound(int round) {
        this.round = round;
    }

    public synchronized ResearchState currentState() {
        return state;
    }

    public synchronized List<TraceEvent> events() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    public synchronized List<TraceEvent> eventsOfType(TraceEventType type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }

    /**
     * Ordered list of states visited, starting with {@link ResearchState#INIT}.
     */
    public synchronized List<ResearchState> statePath() {
        List<ResearchState> path = new ArrayList<>();
        path.add(ResearchState.INIT);
        for (TraceEvent event : events) {
            if (event.type() == TraceEventType.STATE_TRANSITION) {
                path.add(ResearchState.valueOf((String) event.data().get("to")));
            }
        }
        return path;
    }

    private TraceEvent append(TraceEventType type, String message, Map<String, Object> data, ErrorKind kind) {
        sequence++;
        Map<String, Object> payload = data != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(data))
                : Map.of();
        TraceEvent event = new TraceEvent(sequence, clock.instant(), state, type, round, message, payload, kind);
        events.add(event);
        log.debug("[Research] trace #{} {} {}", sequence, type, message);
        return event;
    }
}
