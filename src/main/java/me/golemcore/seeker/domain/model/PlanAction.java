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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Planner decision tag. In a reflection, {@link #DIRECT_ANSWER} means
 * "conclude now".
 */
public enum PlanAction {

    DIRECT_ANSWER("direct_answer"), SEARCH_THEN_ANSWER("search_then_answer");

    private final String wireValue;

    PlanAction(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public static PlanAction fromWire(String value) {
        for (PlanAction action : values()) {
            if (action.wireValue.equals(value)) {
                return action;
            }
        }
        return null;
    }
}
