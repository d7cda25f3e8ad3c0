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

package me.golemcore.seeker.domain.protocol;

/**
 * Explicit decode failure carrying the raw agent text.
 *
 * @param reason
 *            failure kind
 * @param detail
 *            readable detail, e.g. the offending field
 * @param rawText
 *            the text that failed to decode
 */
public record DecodeError(DecodeFailureReason reason, String detail, String rawText) {

    /**
     * Human-readable reason, suitable for a repair instruction.
     */
    public String describe() {
        if (detail == null || detail.isBlank()) {
            return reason.getDescription();
        }
        return reason.getDescription() + ": " + detail;
    }
}
