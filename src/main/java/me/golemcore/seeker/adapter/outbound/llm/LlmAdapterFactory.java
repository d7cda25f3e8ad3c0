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
import me.golemcore.seeker.infrastructure.config.SeekerProperties;
import me.golemcore.seeker.port.outbound.LlmPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * The {@link LlmPort} the research loop talks to. Resolves
 * {@code seeker.llm.provider} against the registered
 * {@link LlmProviderAdapter}s once, at construction, and forwards every call
 * to that adapter.
 *
 * <p>
 * An unknown provider falls back to {@code none}; with no adapters at all,
 * calls fail.
 */
@Component
@Primary
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    private final Map<String, LlmProviderAdapter> adaptersByProvider;
    private final LlmProviderAdapter activeAdapter;

    public LlmAdapterFactory(SeekerProperties properties, List<LlmProviderAdapter> adapters) {
        Map<String, LlmProviderAdapter> byProvider = new LinkedHashMap<>();
        adapters.forEach(adapter -> byProvider.put(adapter.getProviderId(), adapter));
        this.adaptersByProvider = Map.copyOf(byProvider);
        this.activeAdapter = resolve(properties.getLlm().getProvider(), byProvider, adapters);
        if (activeAdapter != null) {
            activeAdapter.initialize();
        }
    }

    private static LlmProviderAdapter resolve(String provider, Map<String, LlmProviderAdapter> byProvider,
            List<LlmProviderAdapter> adapters) {
        LlmProviderAdapter configured = byProvider.get(provider);
        if (configured != null) {
            log.info("[LLM] Active provider: {}", provider);
            return configured;
        }
        LlmProviderAdapter fallback = byProvider.get(NoOpLlmAdapter.PROVIDER_ID);
        if (fallback == null && !adapters.isEmpty()) {
            fallback = adapters.get(0);
        }
        log.warn("[LLM] Provider '{}' not registered, using {}", provider,
                fallback != null ? fallback.getProviderId() : "nothing");
        return fallback;
    }

    LlmPort getActiveAdapter() {
        return activeAdapter;
    }

    LlmPort getAdapter(String providerId) {
        return adaptersByProvider.get(providerId);
    }

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : NoOpLlmAdapter.PROVIDER_ID;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No LLM adapter registered"));
        }
        return activeAdapter.chat(request);
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
