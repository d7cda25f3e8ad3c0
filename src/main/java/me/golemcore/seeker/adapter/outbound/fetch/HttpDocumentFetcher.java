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
import me.golemcore.seeker.port.outbound.FetchException;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Plain HTTP fetcher: GET the page with OkHttp and extract its text.
 *
 * <p>
 * Responses are read up to {@value #MAX_BODY_BYTES} bytes. HTML and XML
 * bodies go through {@link HtmlTextExtractor#extract(String)}, plain text
 * through {@link HtmlTextExtractor#normalize(String)}. Any other content type
 * or a non-2xx status fails the fetch.
 *
 * <p>
 * The request runs on the calling thread and the returned future is already
 * complete. Reader workers are the unit of fetch concurrency, and the OkHttp
 * call timeout bounds each request.
 */
@Component
@Slf4j
public class HttpDocumentFetcher implements DocumentFetchPort {

    static final long MAX_BODY_BYTES = 2L * 1024 * 1024;

    private final OkHttpClient httpClient;
    private final HtmlTextExtractor extractor;
    private final String userAgent;

    public HttpDocumentFetcher(OkHttpClient baseHttpClient, HtmlTextExtractor extractor,
            SeekerProperties properties) {
        long timeoutMs = properties.getResearch().getFetchTimeout().toMillis();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();
        this.extractor = extractor;
        this.userAgent = properties.getFetch().getUserAgent();
    }

    @Override
    public CompletableFuture<String> fetchAndExtract(CandidateDocument document) {
        try {
            return CompletableFuture.completedFuture(fetch(document.url()));
        } catch (FetchException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    String fetch(String url) {
        Request request;
        try {
            request = new Request.Builder()
                    .url(url)
                    .header("User-Agent", userAgent)
                    .header("Accept", "text/html,application/xhtml+xml,text/plain;q=0.9,*/*;q=0.5")
                    .get()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new FetchException(url, "Invalid URL: " + url, e);
        }

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new FetchException(url, "HTTP " + response.code());
            }
            MediaType contentType = response.body() != null ? response.body().contentType() : null;
            String body = response.peekBody(MAX_BODY_BYTES).string();
            log.debug("[Fetch] {} -> HTTP {} ({} chars)", url, response.code(), body.length());

            if (contentType == null || isMarkup(contentType)) {
                return extractor.extract(body);
            }
            if ("text".equals(contentType.type())) {
                return extractor.normalize(body);
            }
            throw new FetchException(url, "Unsupported content type: " + contentType.type() + "/"
                    + contentType.subtype());
        } catch (IOException e) {
            throw new FetchException(url, "Request failed: " + e.getMessage(), e);
        }
    }

    private static boolean isMarkup(MediaType contentType) {
        String subtype = contentType.subtype().toLowerCase(Locale.ROOT);
        return subtype.contains("html") || subtype.contains("xml");
    }
}
