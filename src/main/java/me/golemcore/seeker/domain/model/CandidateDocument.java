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

import java.net.URI;
import java.util.Locale;
import java.util.Map;

/**
 * A search result eligible for deep reading. Read-only once produced by the
 * search gateway.
 *
 * @param id
 *            per-search identifier ({@code r1..rN})
 * @param url
 *            document reference
 * @param title
 *            result title
 * @param snippet
 *            short description returned by the provider
 * @param sourceMetadata
 *            provider metadata such as {@code domain} or {@code age}
 */
public record CandidateDocument(String id, String url, String title, String snippet,
        Map<String, String> sourceMetadata) {

    public static final String META_DOMAIN = "domain";
    public static final String META_AGE = "age";

    public CandidateDocument {
        title = title != null ? title : "";
        snippet = snippet != null ? snippet : "";
        sourceMetadata = sourceMetadata != null ? Map.copyOf(sourceMetadata) : Map.of();
    }

    /**
     * The {@code domain} metadata when the provider supplied it, otherwise the
     * host of the URL. Lower case; empty when neither is available.
     */
    public String domain() {
        String fromMetadata = sourceMetadata.get(META_DOMAIN);
        if (fromMetadata != null && !fromMetadata.isBlank()) {
            return fromMetadata.toLowerCase(Locale.ROOT);
        }
        try {
            String host = URI.create(url).getHost();
            return host != null ? host.toLowerCase(Locale.ROOT) : "";
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
