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
 * Token accounting reported by a provider for one agent invocation.
 *
 * @param inputTokens
 *            prompt tokens, 0 when unknown
 * @param outputTokens
 *            completion tokens, 0 when unknown
 * @param totalTokens
 *            provider total, which may include reasoning tokens
 */
public record LlmUsage(int inputTokens, int outputTokens, int totalTokens) {

    public static LlmUsage of(int inputTokens, int outputTokens) {
        return new LlmUsage(inputTokens, outputTokens, inputTokens + outputTokens);
    }
}
