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

import me.golemcore.seeker.domain.model.AgentRole;
import me.golemcore.seeker.domain.protocol.MessageSchema;

/**
 * One structured agent invocation: who is asked, at which stage, with what
 * prompt, and which schema the answer must satisfy.
 */
public record AgentCall<T>(AgentRole role, String stage, String systemPrompt, String userPayload,
        MessageSchema<T> schema) {
}
