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
 * How a run concluded.
 */
public enum ResultKind {

    /** Planner answered without any web search. */
    DIRECT_ANSWER,

    /** Synthesis over collected evidence, including after the round cap. */
    SYNTHESIZED,

    /** Synthesis forced early by a planner failure or an exhausted budget. */
    PARTIAL_SYNTHESIS,

    /** Synthesis output could not be decoded even after repair. */
    SYNTHESIS_FAILED
}
