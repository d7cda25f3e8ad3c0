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
 * The question under research together with the limits that apply to its run.
 */
public record Question(String text, ResearchSettings settings) {

    public Question {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("question must not be blank");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        text = text.strip();
    }
}
