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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wall-clock, invocation-count and token limits of one run. Zero limits mean
 * unlimited. Counters are updated from reader worker threads.
 */
public class RunBudget {

    private final Clock clock;
    private final Instant deadline;
    private final int maxLlmCalls;
    private final long maxTotalTokens;
    private final AtomicInteger llmCalls = new AtomicInteger();
    private final AtomicLong totalTokens = new AtomicLong();

    public RunBudget(Clock clock, Duration runDeadline, int maxLlmCalls, long maxTotalTokens) {
        this.clock = clock;
        this.deadline = runDeadline != null && !runDeadline.isZero() && !runDeadline.isNegative()
                ? clock.instant().plus(runDeadline)
                : null;
        this.maxLlmCalls = maxLlmCalls;
        this.maxTotalTokens = maxTotalTokens;
    }

    public static RunBudget unlimited(Clock clock) {
        return new RunBudget(clock, null, 0, 0);
    }

    /**
     * Counts one agent invocation and its reported token usage, if any.
     */
    public void recordCall(LlmUsage usage) {
        llmCalls.incrementAndGet();
        if (usage != null) {
            totalTokens.addAndGet(usage.totalTokens());
        }
    }

    public boolean isPastDeadline() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * Time left until the deadline, or {@code null} when there is none.
     */
    public Duration remaining() {
        if (deadline == null) {
            return null;
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * Returns the reason the budget is exhausted, or empty while work may
     * continue.
     */
    public Optional<String> exhaustedReason() {
        if (isPastDeadline()) {
            return Optional.of("run deadline reached");
        }
        if (maxLlmCalls > 0 && llmCalls.get() >= maxLlmCalls) {
            return Optional.of("agent invocation limit reached (" + maxLlmCalls + ")");
        }
        if (maxTotalTokens > 0 && totalTokens.get() >= maxTotalTokens) {
            return Optional.of("token limit reached (" + maxTotalTokens + ")");
        }
        return Optional.empty();
    }

    public int getLlmCalls() {
        return llmCalls.get();
    }

    public long getTotalTokens() {
        return totalTokens.get();
    }
}
