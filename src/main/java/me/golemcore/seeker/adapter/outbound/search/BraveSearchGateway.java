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

package me.golemcore.seeker.adapter.outbound.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.seeker.domain.model.CandidateDocument;
import me.golemcore.seeker.domain.model.Freshness;
import me.golemcore.seeker.domain.model.SearchQuery;
import me.golemcore.seeker.infrastructure.config.SeekerProperties;
import me.golemcore.seeker.infrastructure.http.FeignClientFactory;
import me.golemcore.seeker.port.outbound.SearchException;
import me.golemcore.seeker.port.outbound.SearchGatewayPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Search gateway backed by the Brave Search web API.
 *
 * <p>
 * The recency filter maps to Brave's {@code freshness} parameter ({@code day}
 * → {@code pd}, {@code week} → {@code pw}, {@code month} → {@code pm},
 * {@code any} → omitted). Keyword and domain filters are applied in memory by
 * {@link SearchResultFilter}; when any are present the full page of 20 rows is
 * requested so filtering has room to work.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code seeker.search.brave.api-key} - Brave API key (required)
 * <li>{@code seeker.search.brave.base-url} - API endpoint
 * <li>{@code seeker.search.max-retries} - retries on HTTP 429
 * </ul>
 *
 * @see <a href="https://brave.com/search/api/">Brave Search API</a>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BraveSearchGateway implements SearchGatewayPort {

    static final int MAX_COUNT = 20;

    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;

    private final FeignClientFactory feignClientFactory;
    private final SeekerProperties properties;

    private BraveSearchApi searchApi;
    private String apiKey;
    private int maxRetries;
    private long initialBackoffMs;

    @PostConstruct
    public void init() {
        SeekerProperties.SearchProperties config = properties.getSearch();
        this.apiKey = config.getBrave().getApiKey();
        this.maxRetries = config.getMaxRetries();
        this.initialBackoffMs = config.getInitialBackoffMs();

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[BraveSearch] API key is not configured; searches will fail");
            return;
        }
        this.searchApi = feignClientFactory.create(BraveSearchApi.class, config.getBrave().getBaseUrl());
        log.info("[BraveSearch] Initialized (max retries: {})", maxRetries);
    }

    @Override
    public boolean isAvailable() {
        return searchApi != null;
    }

    @Override
    public CompletableFuture<List<CandidateDocument>> search(SearchQuery query) {
        return CompletableFuture.supplyAsync(() -> {
            if (searchApi == null) {
                throw new SearchException("Brave Search API key is not configured");
            }
            if (query.query() == null || query.query().isBlank()) {
                throw new SearchException("Search query is required");
            }
            int limit = query.maxResults() != null ? Math.max(1, Math.min(MAX_COUNT, query.maxResults()))
                    : MAX_COUNT;
            int count = query.hasFilters() ? MAX_COUNT : limit;

            BraveSearchResponse response = executeWithRetry(query.query(), count, freshnessOf(query.when()));
            List<CandidateDocument> candidates = SearchResultFilter.apply(toRows(response), query, limit);
            log.info("[BraveSearch] '{}' returned {} candidates", query.query(), candidates.size());
            return candidates;
        });
    }

    static String freshnessOf(Freshness when) {
        if (when == null) {
            return null;
        }
        return switch (when) {
        case DAY -> "pd";
        case WEEK -> "pw";
        case MONTH -> "pm";
        case ANY -> null;
        };
    }

    private BraveSearchResponse executeWithRetry(String query, int count, String freshness) {
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                log.debug("[BraveSearch] query='{}', count={}, freshness={}, attempt={}", query, count, freshness,
                        attempt);
                return searchApi.search(apiKey, query, count, freshness);
            } catch (FeignException e) {
                if (e.status() == HTTP_TOO_MANY_REQUESTS && attempt < maxRetries) {
                    long backoffMs = (long) (initialBackoffMs * Math.pow(BACKOFF_MULTIPLIER, attempt));
                    log.warn("[BraveSearch] Rate limit hit (attempt {}/{}), retrying in {}ms",
                            attempt + 1, maxRetries, backoffMs);
                    sleep(backoffMs);
                } else if (e.status() == HTTP_TOO_MANY_REQUESTS) {
                    log.error("[BraveSearch] Rate limit exceeded after {} retries for query: {}", maxRetries, query);
                    throw new SearchException("Brave Search rate limit exceeded", e);
                } else {
                    log.error("[BraveSearch] API error (status {}) for query: {}", e.status(), query, e);
                    throw new SearchException("Brave Search API error (status " + e.status() + ")", e);
                }
            } catch (RuntimeException e) { // NOSONAR - transport and decoding errors
                log.error("[BraveSearch] Unexpected error for query: {}", query, e);
                throw new SearchException("Brave Search failed: " + e.getMessage(), e);
            }
        }
        throw new SearchException("Brave Search failed: retries exhausted");
    }

    private List<CandidateDocument> toRows(BraveSearchResponse response) {
        if (response == null || response.getWeb() == null || response.getWeb().getResults() == null) {
            return List.of();
        }
        List<CandidateDocument> rows = new ArrayList<>();
        for (WebResult result : response.getWeb().getResults()) {
            Map<String, String> metadata = new LinkedHashMap<>();
            if (result.getMetaUrl() != null && result.getMetaUrl().getHostname() != null) {
                metadata.put(CandidateDocument.META_DOMAIN, result.getMetaUrl().getHostname());
            }
            String age = result.getAge() != null ? result.getAge() : result.getPageAge();
            if (age != null) {
                metadata.put(CandidateDocument.META_AGE, age);
            }
            rows.add(new CandidateDocument(null, result.getUrl(), stripTags(result.getTitle()),
                    stripTags(result.getDescription()), metadata));
        }
        return rows;
    }

    // Brave highlights matches with <strong>
    private static String stripTags(String text) {
        return text != null ? text.replaceAll("<[^>]+>", "") : null;
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchException("BraveSearch retry sleep interrupted", e);
        }
    }

    // Feign API interface; a null freshness is left out of the query string
    interface BraveSearchApi {
        @RequestLine("GET /res/v1/web/search?q={query}&count={count}&freshness={freshness}")
        @Headers({
                "Accept: application/json",
                "X-Subscription-Token: {apiKey}"
        })
        BraveSearchResponse search(
                @Param("apiKey") String apiKey,
                @Param("query") String query,
                @Param("count") int count,
                @Param("freshness") String freshness);
    }

    // Response DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class BraveSearchResponse {
        private WebResults web;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResults {
        private List<WebResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResult {
        private String title;
        private String url;
        private String description;
        private String age;
        @JsonProperty("page_age")
        private String pageAge;
        @JsonProperty("meta_url")
        private MetaUrl metaUrl;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class MetaUrl {
        private String hostname;
    }
}
