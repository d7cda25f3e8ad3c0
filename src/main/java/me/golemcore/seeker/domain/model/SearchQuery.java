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

import java.util.List;

/**
 * One search request proposed by the planner. Consumed once by the search
 * gateway.
 *
 * @param query
 *            free-text query
 * @param when
 *            recency filter, {@code null} when the planner did not ask for one
 * @param include
 *            keywords that must all appear in title or snippet
 * @param exclude
 *            keywords that drop a result when present
 * @param allowDomains
 *            only keep results from these domains (or their subdomains)
 * @param denyDomains
 *            drop results from these domains (or their subdomains)
 * @param maxResults
 *            upper bound on returned candidates, {@code null} for the
 *            configured default
 */
public record SearchQuery(String query, Freshness when, List<String> include, List<String> exclude,
        List<String> allowDomains, List<String> denyDomains, Integer maxResults) {

    public SearchQuery {
        include = include != null ? List.copyOf(include) : List.of();
        exclude = exclude != null ? List.copyOf(exclude) : List.of();
        allowDomains = allowDomains != null ? List.copyOf(allowDomains) : List.of();
        denyDomains = denyDomains != null ? List.copyOf(denyDomains) : List.of();
    }

    public static SearchQuery of(String query) {
        return new SearchQuery(query, null, null, null, null, null, null);
    }

    public SearchQuery withWhen(Freshness freshness) {
        return new SearchQuery(query, freshness, include, exclude, allowDomains, denyDomains, maxResults);
    }

    public SearchQuery withMaxResults(Integer limit) {
        return new SearchQuery(query, when, include, exclude, allowDomains, denyDomains, limit);
    }

    public boolean hasFilters() {
        return !include.isEmpty() || !exclude.isEmpty() || !allowDomains.isEmpty() || !denyDomains.isEmpty();
    }
}
