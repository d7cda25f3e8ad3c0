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

package me.golemcore.seeker.domain.service;

import me.golemcore.seeker.domain.protocol.DecodeError;

import java.util.function.Function;

/**
 * Typed result of a structured agent invocation. Never thrown; callers branch
 * on {@link #getStatus()} and apply their own fallback.
 *
 * @param <T>
 *            decoded message type
 */
public final class AgentOutcome<T> {

    public enum Status {
        SUCCESS, DECODE_FAILED, INVOCATION_FAILED
    }

    private final Status status;
    private final T value;
    private final String rawOutput;
    private final DecodeError decodeError;
    private final String failureReason;
    private final int repairAttempts;

    private AgentOutcome(Status status, T value, String rawOutput, DecodeError decodeError, String failureReason,
            int repairAttempts) {
        this.status = status;
        this.value = value;
        this.rawOutput = rawOutput;
        this.decodeError = decodeError;
        this.failureReason = failureReason;
        this.repairAttempts = repairAttempts;
    }

    public static <T> AgentOutcome<T> success(T value, String rawOutput, int repairAttempts) {
        return new AgentOutcome<>(Status.SUCCESS, value, rawOutput, null, null, repairAttempts);
    }

    public static <T> AgentOutcome<T> decodeFailed(DecodeError error, int repairAttempts) {
        return new AgentOutcome<>(Status.DECODE_FAILED, null, error.rawText(), error, error.describe(),
                repairAttempts);
    }

    public static <T> AgentOutcome<T> invocationFailed(String reason, String lastRawOutput, int repairAttempts) {
        return new AgentOutcome<>(Status.INVOCATION_FAILED, null, lastRawOutput, null, reason, repairAttempts);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Status getStatus() {
        return status;
    }

    public T getValue() {
        return value;
    }

    public String getRawOutput() {
        return rawOutput;
    }

    public DecodeError getDecodeError() {
        return decodeError;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public int getRepairAttempts() {
        return repairAttempts;
    }

    /**
     * Transforms a successful value; failures pass through unchanged.
     */
    public <R> AgentOutcome<R> map(Function<T, R> mapper) {
        if (!isSuccess()) {
            return new AgentOutcome<>(status, null, rawOutput, decodeError, failureReason, repairAttempts);
        }
        return new AgentOutcome<>(status, mapper.apply(value), rawOutput, null, null, repairAttempts);
    }
}
