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

package me.golemcore.seeker.port.outbound;

import me.golemcore.seeker.domain.model.LlmRequest;
import me.golemcore.seeker.domain.model.LlmResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Chat completion port used by every planner and reader invocation.
 *
 * <p>
 * Implementations complete the future exceptionally when the provider call
 * fails after their own retries. The caller treats such a failure like an
 * undecodable answer for the stage.
 */
public interface LlmPort {

    String getProviderId();

    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Whether the provider has the credentials it needs.
     */
    boolean isAvailable();
}
