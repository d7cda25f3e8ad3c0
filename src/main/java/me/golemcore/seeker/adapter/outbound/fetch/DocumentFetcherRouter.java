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

package me.golemcore.seeker.adapter.outbound.fetch;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.seeker.domain.model.CandidateDocument;
import me.golemcore.seeker.infrastructure.config.SeekerProperties;
import me.golemcore.seeker.port.outbound.DocumentFetchPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Chooses the fetcher named by {@code seeker.fetch.mode}: {@code http}
 * (default) or {@code browser}.
 */
@Component
@Primary
@Slf4j
public class DocumentFetcherRouter implements DocumentFetchPort {

    static final String MODE_HTTP = "http";
    static final String MODE_BROWSER = "browser";

    private final DocumentFetchPort delegate;

    public DocumentFetcherRouter(SeekerProperties properties, HttpDocumentFetcher httpFetcher,
            BrowserDocumentFetcher browserFetcher) {
        String mode = properties.getFetch().getMode();
        String normalized = mode == null ? MODE_HTTP : mode.trim().toLowerCase(Locale.ROOT);
        if (MODE_BROWSER.equals(normalized)) {
            this.delegate = browserFetcher;
        } else {
            if (!MODE_HTTP.equals(normalized)) {
                log.warn("[Fetch] Unknown fetch mode '{}', using {}", mode, MODE_HTTP);
            }
            this.delegate = httpFetcher;
        }
        log.info("[Fetch] Document fetch mode: {}", delegate == browserFetcher ? MODE_BROWSER : MODE_HTTP);
    }

    @Override
    public CompletableFuture<String> fetchAndExtract(CandidateDocument document) {
        return delegate.fetchAndExtract(document);
    }

    DocumentFetchPort getDelegate() {
        return delegate;
    }
}
