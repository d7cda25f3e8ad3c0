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

package me.golemcore.seeker.adapter.outbound.llm;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.seeker.domain.model.LlmRequest;
import me.golemcore.seeker.domain.model.LlmResponse;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Provider {@code none}: every call fails immediately, so a run without a
 * configured model degrades to partial results instead of hanging on a
 * network call.
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmProviderAdapter {

    static final String PROVIDER_ID = "none";
    static final String NOT_CONFIGURED = "No LLM provider configured (seeker.llm.provider=none)";

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("[LLM] {} called without a provider", request.getStage());
        return CompletableFuture.failedFuture(new IllegalStateException(NOT_CONFIGURED));
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
