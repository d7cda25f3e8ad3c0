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
 * Why raw agent output could not be decoded.
 */
public enum DecodeFailureReason {

    NO_BLOCK("no structured block found"),
    MULTIPLE_BLOCKS("multiple structured blocks"),
    INVALID_JSON("structured block is not valid JSON"),
    MISSING_FIELD("missing required field"),
    WRONG_TYPE("field has the wrong type"),
    INVALID_VALUE("field value is not allowed");

    private final String description;

    DecodeFailureReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
