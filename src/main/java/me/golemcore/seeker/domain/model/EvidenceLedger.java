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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Append-only evidence store for one run. Entries are never removed or
 * replaced; degraded reports are recorded like any other.
 */
public class EvidenceLedger {

    private final List<ReaderReport> entries = new ArrayList<>();
    private final Set<String> keys = new HashSet<>();

    /**
     * Appends a report.
     *
     * @throws IllegalStateException
     *             if a report with the same {@code (round, documentId)} key was
     *             already appended
     */
    public synchronized void append(ReaderReport report) {
        if (!keys.add(report.key())) {
            throw new IllegalStateException("Duplicate evidence key: " + report.key());
        }
        entries.add(report);
    }

    public synchronized List<ReaderReport> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public synchronized List<ReaderReport> entriesForRound(int round) {
        return entries.stream().filter(r -> r.round() == round).toList();
    }

    public synchronized boolean containsKey(String key) {
        return keys.contains(key);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }
}
