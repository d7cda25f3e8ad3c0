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

import me.golemcore.seeker.domain.model.CandidateDocument;
import me.golemcore.seeker.domain.model.SearchQuery;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * In-memory post-filter for provider rows, followed by URL de-duplication,
 * truncation and id assignment.
 *
 * <ul>
 * <li>include: every keyword must appear in title + snippet</li>
 * <li>exclude: any keyword appearing drops the row</li>
 * <li>allow_domains: keep only hosts equal to or under an entry</li>
 * <li>deny_domains: drop hosts equal to or under an entry</li>
 * </ul>
 * Keyword and domain matching is case-insensitive.
 */
public final class SearchResultFilter {

    private SearchResultFilter() {
    }

    /**
     * Applies the query's filters and returns at most {@code limit} candidates
     * with ids {@code r1..rN} in provider order.
     */
    public static List<CandidateDocument> apply(List<CandidateDocument> rows, SearchQuery query, int limit) {
        List<String> include = lower(query.include());
        List<String> exclude = lower(query.exclude());
        List<String> allow = lower(query.allowDomains());
        List<String> deny = lower(query.denyDomains());

        List<CandidateDocument> result = new ArrayList<>();
        Set<String> seenUrls = new HashSet<>();
        for (CandidateDocument row : rows) {
            if (result.size() >= limit) {
                break;
            }
            if (row.url() == null || row.url().isBlank()) {
                continue;
            }
            if (!accepts(row, include, exclude, allow, deny)) {
                continue;
            }
            if (!seenUrls.add(normalizeUrl(row.url()))) {
                continue;
            }
            result.add(new CandidateDocument("r" + (result.size() + 1), row.url(), row.title(), row.snippet(),
                    row.sourceMetadata()));
        }
        return result;
    }

    static boolean matchesDomain(String host, String entry) {
        return host.equals(entry) || host.endsWith("." + entry);
    }

    private static boolean accepts(CandidateDocument row, List<String> include, List<String> exclude,
            List<String> allow, List<String> deny) {
        String text = (row.title() + " " + row.snippet()).toLowerCase(Locale.ROOT);
        String host = row.domain();

        if (!allow.isEmpty() && allow.stream().noneMatch(a -> matchesDomain(host, a))) {
            return false;
        }
        if (deny.stream().anyMatch(d -> matchesDomain(host, d))) {
            return false;
        }
        if (!include.stream().allMatch(text::contains)) {
            return false;
        }
        return exclude.stream().noneMatch(text::contains);
    }

    private static String normalizeUrl(String url) {
        String normalized = url.strip();
        int fragment = normalized.indexOf('#');
        if (fragment >= 0) {
            normalized = normalized.substring(0, fragment);
        }
        if (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    private static List<String> lower(List<String> values) {
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(v -> v.strip().toLowerCase(Locale.ROOT))
                .toList();
    }
}
