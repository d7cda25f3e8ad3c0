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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Per-document result of one reader pipeline. Exactly one report is produced
 * for every selected document in a round, degraded or not.
 *
 * @param round
 *            round that produced the report
 * @param documentId
 *            candidate id within that round
 * @param url
 *            document reference
 * @param title
 *            document title (reader-cleaned when available)
 * @param summary
 *            reader summary, empty for degraded reports
 * @param keyPoints
 *            ordered key points
 * @param relevanceScore
 *            relevance in [0, 1], 0 for degraded reports
 * @param notes
 *            reader notes or the failure reason
 * @param status
 *            outcome tag
 */
public record ReaderReport(int round, String documentId, String url, String title, String summary,
        List<String> keyPoints, double relevanceScore, String notes, ReportStatus status) {

    public ReaderReport {
        if (relevanceScore < 0.0 || relevanceScore > 1.0) {
            throw new IllegalArgumentException("relevanceScore out of range: " + relevanceScore);
        }
        keyPoints = keyPoints != null ? List.copyOf(keyPoints) : List.of();
        summary = summary != null ? summary : "";
        title = title != null ? title : "";
    }

    /**
     * Unique ledger key: {@code <round>:<documentId>}.
     */
    @JsonProperty("key")
    public String key() {
        return keyOf(round, documentId);
    }

    public boolean isOk() {
        return status == ReportStatus.OK;
    }

    public static String keyOf(int round, String documentId) {
        return round + ":" + documentId;
    }

    public static ReaderReport ok(int round, CandidateDocument document, ReaderFindings findings) {
        String title = findings.title() != null && !findings.title().isBlank() ? findings.title()
                : document.title();
        return new ReaderReport(round, document.id(), document.url(), title, findings.summary(),
                findings.keyPoints(), findings.relevanceScore(), findings.notes(), ReportStatus.OK);
    }

    public static ReaderReport fetchFailed(int round, CandidateDocument document, String reason) {
        return degraded(round, document, reason, ReportStatus.FETCH_FAILED);
    }

    public static ReaderReport parseFailed(int round, CandidateDocument document, String reason) {
        return degraded(round, document, reason, ReportStatus.PARSE_FAILED);
    }

    public static ReaderReport agentMalformed(int round, CandidateDocument document, String reason) {
        return degraded(round, document, reason, ReportStatus.AGENT_MALFORMED);
    }

    private static ReaderReport degraded(int round, CandidateDocument document, String reason, ReportStatus status) {
        return new ReaderReport(round, document.id(), document.url(), document.title(), "", List.of(), 0.0,
                reason, status);
    }
}
