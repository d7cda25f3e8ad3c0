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

package me.golemcore.seeker.infrastructure.config;

import lombok.Data;
import me.golemcore.seeker.domain.model.Freshness;
import me.golemcore.seeker.domain.model.ResearchSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the seeker, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code seeker.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - LLM provider and per-role model settings</li>
 * <li>{@link ResearchProperties} - round, concurrency and budget limits</li>
 * <li>{@link SearchProperties} - search backend</li>
 * <li>{@link FetchProperties} - document retrieval and extraction</li>
 * <li>{@link BrowserProperties} - headless browser fetch mode</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link CliProperties} - command-line runner</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "seeker")
@Data
public class SeekerProperties {

    private LlmProperties llm = new LlmProperties();
    private ResearchProperties research = new ResearchProperties();
    private SearchProperties search = new SearchProperties();
    private FetchProperties fetch = new FetchProperties();
    private BrowserProperties browser = new BrowserProperties();
    private HttpProperties http = new HttpProperties();
    private CliProperties cli = new CliProperties();

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        private String plannerModel = "openai/gpt-4o";
        private String readerModel = "openai/gpt-4o-mini";
        private int plannerMaxTokens = 4096;
        private int readerMaxTokens = 1536;
        private double temperature = 0.2;
        private long timeoutMs = 120000;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class ResearchProperties {
        private int maxRounds = 3;
        private int concurrency = 5;
        private int perRoundResultCap = 10;
        private int perRoundSelectionCap = 5;
        private double relevanceFloor = 0.0;
        private Duration runDeadline = Duration.ofMinutes(10);
        private int maxLlmCalls = 60;
        private long maxTotalTokens = 0;
        private Duration fetchTimeout = Duration.ofSeconds(30);

        public ResearchSettings toSettings() {
            return new ResearchSettings(maxRounds, concurrency, perRoundResultCap, perRoundSelectionCap,
                    relevanceFloor);
        }
    }

    @Data
    public static class SearchProperties {
        private Freshness defaultWhen = Freshness.WEEK;
        private int maxRetries = 3;
        private long initialBackoffMs = 2000;
        private BraveProperties brave = new BraveProperties();
    }

    @Data
    public static class BraveProperties {
        private String apiKey;
        private String baseUrl = "https://api.search.brave.com";
    }

    @Data
    public static class FetchProperties {
        private String mode = "http";
        private int maxChars = 8000;
        private String userAgent = "Mozilla/5.0 (compatible; golemcore-seeker/1.0)";
    }

    @Data
    public static class BrowserProperties {
        private boolean headless = true;
        private int timeout = 30000;
    }

    @Data
    public static class HttpProperties {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
        private Duration writeTimeout = Duration.ofSeconds(60);
        private int maxIdleConnections = 5;
        private Duration keepAlive = Duration.ofMinutes(5);
    }

    @Data
    public static class CliProperties {
        private boolean enabled = false;
    }
}
