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

package me.golemcore.seeker.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.seeker.domain.model.AgentRole;
import me.golemcore.seeker.domain.model.CandidateDocument;
import me.golemcore.seeker.domain.model.ErrorKind;
import me.golemcore.seeker.domain.model.ReaderFindings;
import me.golemcore.seeker.domain.model.ReaderReport;
import me.golemcore.seeker.domain.model.RunContext;
import me.golemcore.seeker.domain.model.SelectionSet;
import me.golemcore.seeker.domain.model.Trace;
import me.golemcore.seeker.domain.model.TraceEventType;
import me.golemcore.seeker.domain.protocol.MessageSchema;
import me.golemcore.seeker.infrastructure.concurrent.MdcAwareExecutor;
import me.golemcore.seeker.port.outbound.DocumentFetchPort;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Runs one reader pipeline per selected document on a bounded worker pool.
 *
 * <p>
 * Pipeline: fetch and extract, then invoke the reader agent and decode its
 * report. Every failure becomes a degraded {@link ReaderReport} inside the
 * pipeline, so dispatching N documents always yields exactly N reports.
 * Workers only fill their document's slot. Once the round is over the
 * dispatching thread appends every report to the evidence ledger in selection
 * order, so the ledger is complete when {@link #dispatch} returns.
 *
 * <p>
 * The dispatcher waits for all pipelines unless the run is cancelled or its
 * deadline passes. Documents still in flight at that point are recorded as
 * {@code fetch_failed}; a slot is claimed once, so their late results are
 * discarded.
 */
@Slf4j
public class ReaderDispatcher {

    static final String STAGE_READ = "read";
    static final String ABANDONED_AT_DEADLINE = "abandoned at run deadline";
    static final String ABANDONED_CANCELLED = "abandoned: run cancelled";

    private static final long WAIT_SLICE_MS = 200;

    private final DocumentFetchPort fetchPort;
    private final StructuredAgentInvoker invoker;
    private final ObjectMapper objectMapper;
    private final Duration fetchTimeout;

    public ReaderDispatcher(DocumentFetchPort fetchPort, StructuredAgentInvoker invoker, ObjectMapper objectMapper,
            Duration fetchTimeout) {
        this.fetchPort = fetchPort;
        this.invoker = invoker;
        this.objectMapper = objectMapper;
        this.fetchTimeout = fetchTimeout;
    }

    public List<ReaderReport> dispatch(RunContext context, SelectionSet selection) {
        if (selection.isEmpty()) {
            return List.of();
        }
        int round = context.getRound();
        List<CandidateDocument> documents = selection.documents();
        int count = documents.size();
        int workers = Math.min(context.getSettings().concurrencyCap(), count);
        AtomicReferenceArray<ReaderReport> slots = new AtomicReferenceArray<>(count);
        CountDownLatch done = new CountDownLatch(count);

        log.info("[Reader] Round {}: reading {} documents with {} workers", round, count, workers);
        MdcAwareExecutor executor = new MdcAwareExecutor(workers, "reader-" + context.getRunId());
        boolean abandoned = false;
        try {
            for (int i = 0; i < count; i++) {
                int index = i;
                CandidateDocument document = documents.get(i);
                executor.execute(() -> {
                    try {
                        if (!context.shouldAbandon()) {
                            slots.compareAndSet(index, null, runPipeline(context, round, document));
                        }
                    } catch (RuntimeException e) {
                        log.warn("[Reader] Pipeline for {} failed unexpectedly", document.url(), e);
                        slots.compareAndSet(index, null, ReaderReport.fetchFailed(round, document,
                                "reader pipeline failed: " + e.getMessage()));
                    } finally {
                        done.countDown();
                    }
                });
            }
            abandoned = !awaitAll(context, done);
        } finally {
            if (abandoned) {
                executor.abandon();
            } else {
                executor.close();
            }
        }

        String reason = context.isCancelled() ? ABANDONED_CANCELLED : ABANDONED_AT_DEADLINE;
        List<ReaderReport> reports = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            CandidateDocument document = documents.get(i);
            if (slots.compareAndSet(i, null, ReaderReport.fetchFailed(round, document, reason))) {
                context.getTrace().error(ErrorKind.FETCH_ERROR, reason + ": " + document.url(),
                        Map.of("documentId", document.id()));
            }
            ReaderReport report = slots.get(i);
            publish(context, report);
            reports.add(report);
        }
        return reports;
    }

    /**
     * Waits for every pipeline. Returns false when the run was cancelled or hit
     * its deadline first.
     */
    private boolean awaitAll(RunContext context, CountDownLatch done) {
        try {
            while (!done.await(WAIT_SLICE_MS, TimeUnit.MILLISECONDS)) {
                if (context.shouldAbandon()) {
                    log.warn("[Reader] Abandoning {} in-flight documents", done.getCount());
                    return false;
                }
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.cancel();
            return false;
        }
    }

    /**
     * Traces a report and appends it to the ledger. Called from the dispatching
     * thread only, in selection order.
     */
    private void publish(RunContext context, ReaderReport report) {
        Trace trace = context.getTrace();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("key", report.key());
        data.put("url", report.url());
        data.put("status", report.status().getWireValue());
        data.put("relevanceScore", report.relevanceScore());
        trace.record(TraceEventType.READER_REPORT, "Reader report " + report.key(), data);
        context.getLedger().append(report);
        trace.record(TraceEventType.LEDGER_APPEND, "Appended " + report.key(),
                Map.of("key", report.key(), "ledgerSize", context.getLedger().size()));
    }

    private ReaderReport runPipeline(RunContext context, int round, CandidateDocument document) {
        String text;
        try {
            text = fetch(context, document);
        } catch (ReaderFetchFailure e) {
            context.getTrace().error(ErrorKind.FETCH_ERROR, "Fetch failed for " + document.url() + ": "
                    + e.getMessage(), Map.of("documentId", document.id()));
            return ReaderReport.fetchFailed(round, document, e.getMessage());
        }
        if (text == null || text.isBlank()) {
            context.getTrace().error(ErrorKind.FETCH_ERROR, "No readable text in " + document.url(),
                    Map.of("documentId", document.id()));
            return ReaderReport.parseFailed(round, document, "no readable text extracted");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("question", context.getQuestion().text());
        payload.put("url", document.url());
        payload.put("title", document.title());
        payload.put("text", text);

        AgentOutcome<ReaderFindings> outcome = invoker.invoke(context, new AgentCall<>(AgentRole.READER,
                STAGE_READ + ":" + ReaderReport.keyOf(round, document.id()), AgentPrompts.READ, toJson(payload),
                MessageSchema.READER_REPORT));
        if (outcome.isSuccess()) {
            log.debug("[Reader] {} read, relevance {}", document.url(), outcome.getValue().relevanceScore());
            return ReaderReport.ok(round, document, outcome.getValue());
        }
        return ReaderReport.agentMalformed(round, document, outcome.getFailureReason());
    }

    private String fetch(RunContext context, CandidateDocument document) {
        Duration timeout = fetchTimeout != null && !fetchTimeout.isZero() ? fetchTimeout : null;
        Duration remaining = context.getBudget().remaining();
        if (remaining != null && (timeout == null || remaining.compareTo(timeout) < 0)) {
            timeout = remaining;
        }
        try {
            if (timeout == null) {
                return fetchPort.fetchAndExtract(document).get();
            }
            return fetchPort.fetchAndExtract(document).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new ReaderFetchFailure("fetch timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ReaderFetchFailure(cause.getMessage() != null ? cause.getMessage()
                    : cause.getClass().getSimpleName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReaderFetchFailure("fetch interrupted");
        } catch (RuntimeException e) {
            throw new ReaderFetchFailure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize reader payload", e);
        }
    }

    private static final class ReaderFetchFailure extends RuntimeException {

        private static final long serialVersionUID = 1L;

        ReaderFetchFailure(String message) {
            super(message);
        }
    }
}
