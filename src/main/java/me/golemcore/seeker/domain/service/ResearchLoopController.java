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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.seeker.domain.model.CandidateDocument;
import me.golemcore.seeker.domain.model.ErrorKind;
import me.golemcore.seeker.domain.model.FinalAnswer;
import me.golemcore.seeker.domain.model.Plan;
import me.golemcore.seeker.domain.model.ReaderReport;
import me.golemcore.seeker.domain.model.ReportStatus;
import me.golemcore.seeker.domain.model.ResearchResult;
import me.golemcore.seeker.domain.model.ResearchState;
import me.golemcore.seeker.domain.model.ResultKind;
import me.golemcore.seeker.domain.model.RunContext;
import me.golemcore.seeker.domain.model.SearchQuery;
import me.golemcore.seeker.domain.model.SelectionSet;
import me.golemcore.seeker.domain.model.TraceEventType;
import me.golemcore.seeker.port.outbound.SearchGatewayPort;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Round-based research state machine.
 *
 * <pre>
 * INIT → PLANNING → {DIRECT_ANSWER, SEARCHING} → SELECTING → READING → REFLECTING → {SEARCHING, SYNTHESIZING} → DONE
 * </pre>
 *
 * <p>
 * Runs on the caller's thread; only reading fans out. Every failure path ends
 * in {@link ResearchState#DONE} with a typed {@link ResearchResult}:
 * <ul>
 * <li>planner decode or invocation failure → synthesis over the current
 * ledger, {@link ResultKind#PARTIAL_SYNTHESIS}</li>
 * <li>search failure → the round continues with zero candidates</li>
 * <li>exhausted budget → synthesis, {@link ResultKind#PARTIAL_SYNTHESIS}</li>
 * <li>round cap → synthesis regardless of the planner's preference</li>
 * <li>synthesis failure → {@link ResultKind#SYNTHESIS_FAILED} with the raw
 * output and the full ledger</li>
 * </ul>
 */
@Slf4j
public class ResearchLoopController {

    static final String MDC_RUN_ID = "runId";

    private final PlannerStage planner;
    private final SearchGatewayPort searchGateway;
    private final ReaderDispatcher readerDispatcher;

    public ResearchLoopController(PlannerStage planner, SearchGatewayPort searchGateway,
            ReaderDispatcher readerDispatcher) {
        this.planner = planner;
        this.searchGateway = searchGateway;
        this.readerDispatcher = readerDispatcher;
    }

    public ResearchResult run(RunContext context) {
        String previousRunId = MDC.get(MDC_RUN_ID);
        MDC.put(MDC_RUN_ID, context.getRunId());
        try {
            log.info("[Research] Run started: {}", context.getQuestion().text());
            LoopCursor cursor = new LoopCursor();
            ResearchState state = ResearchState.INIT;
            while (state != ResearchState.DONE) {
                state = switch (state) {
                case INIT -> moveTo(context, ResearchState.PLANNING, "run started");
                case PLANNING -> onPlanning(context, cursor);
                case DIRECT_ANSWER -> onDirectAnswer(context, cursor);
                case SEARCHING -> onSearching(context, cursor);
                case SELECTING -> onSelecting(context, cursor);
                case READING -> onReading(context, cursor);
                case REFLECTING -> onReflecting(context, cursor);
                case SYNTHESIZING -> onSynthesizing(context, cursor);
                case DONE -> ResearchState.DONE;
                };
            }
            ResearchResult result = buildResult(context, cursor);
            log.info("[Research] Run finished: {} after {} rounds, {} reports, {} agent calls",
                    result.getKind(), result.getRoundsCompleted(), result.getEvidence().size(),
                    result.getLlmCalls());
            return result;
        } finally {
            if (previousRunId != null) {
                MDC.put(MDC_RUN_ID, previousRunId);
            } else {
                MDC.remove(MDC_RUN_ID);
            }
        }
    }

    private ResearchState onPlanning(RunContext context, LoopCursor cursor) {
        AgentOutcome<Plan> outcome = planner.plan(context);
        if (!outcome.isSuccess()) {
            return fallBackToSynthesis(context, cursor, "planning failed: " + outcome.getFailureReason());
        }
        Plan plan = outcome.getValue();
        return switch (plan.action()) {
        case DIRECT_ANSWER -> {
            cursor.directAnswer = plan.directAnswer();
            yield moveTo(context, ResearchState.DIRECT_ANSWER, "planner answered directly");
        }
        case SEARCH_THEN_ANSWER -> {
            cursor.nextQuery = plan.searchQuery();
            yield beginRound(context, cursor, "planner requested search");
        }
        };
    }

    private ResearchState onDirectAnswer(RunContext context, LoopCursor cursor) {
        cursor.kind = ResultKind.DIRECT_ANSWER;
        cursor.finalAnswer = FinalAnswer.direct(cursor.directAnswer);
        return moveTo(context, ResearchState.DONE, "direct answer");
    }

    private ResearchState onSearching(RunContext context, LoopCursor cursor) {
        SearchQuery query = cursor.nextQuery;
        int round = context.getRound();
        context.recordQuery(query);

        List<CandidateDocument> candidates;
        try {
            candidates = searchGateway.search(query).join();
        } catch (RuntimeException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            context.getTrace().error(ErrorKind.SEARCH_ERROR, "Search failed: " + cause.getMessage(),
                    Map.of("query", query.query()));
            candidates = List.of();
        }
        if (candidates == null) {
            candidates = List.of();
        }
        int cap = context.getSettings().perRoundResultCap();
        if (candidates.size() > cap) {
            candidates = candidates.subList(0, cap);
        }
        context.recordCandidates(round, candidates);
        cursor.candidates = candidates;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("query", query);
        data.put("count", candidates.size());
        data.put("ids", candidates.stream().map(CandidateDocument::id).toList());
        context.getTrace().record(TraceEventType.SEARCH_RESULTS,
                "Search returned " + candidates.size() + " candidates", data);
        return moveTo(context, ResearchState.SELECTING, candidates.size() + " candidates");
    }

    private ResearchState onSelecting(RunContext context, LoopCursor cursor) {
        AgentOutcome<SelectionSet> outcome = planner.select(context, cursor.candidates);
        if (!outcome.isSuccess()) {
            return fallBackToSynthesis(context, cursor, "selection failed: " + outcome.getFailureReason());
        }
        SelectionSet selection = outcome.getValue();
        cursor.selection = selection;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("selectedIds", selection.documents().stream().map(CandidateDocument::id).toList());
        data.put("droppedIds", selection.droppedIds());
        if (selection.notes() != null) {
            data.put("notes", selection.notes());
        }
        context.getTrace().record(TraceEventType.SELECTION, "Selected " + selection.size() + " documents", data);

        if (selection.isEmpty()) {
            return moveTo(context, ResearchState.REFLECTING, "nothing selected for reading");
        }
        return moveTo(context, ResearchState.READING, selection.size() + " documents selected");
    }

    private ResearchState onReading(RunContext context, LoopCursor cursor) {
        List<ReaderReport> reports = readerDispatcher.dispatch(context, cursor.selection);
        long ok = reports.stream().filter(r -> r.status() == ReportStatus.OK).count();
        return moveTo(context, ResearchState.REFLECTING,
                reports.size() + " reports (" + ok + " ok), ledger size " + context.getLedger().size());
    }

    private ResearchState onReflecting(RunContext context, LoopCursor cursor) {
        Optional<String> exhausted = exhaustedReason(context);
        if (exhausted.isPresent()) {
            context.getTrace().error(ErrorKind.BUDGET_EXCEEDED, exhausted.get(), Map.of());
            return fallBackToSynthesis(context, cursor, exhausted.get());
        }
        AgentOutcome<Plan> outcome = planner.reflect(context);
        if (!outcome.isSuccess()) {
            return fallBackToSynthesis(context, cursor, "reflection failed: " + outcome.getFailureReason());
        }
        Plan plan = outcome.getValue();
        return switch (plan.action()) {
        case DIRECT_ANSWER -> moveTo(context, ResearchState.SYNTHESIZING, "planner concluded");
        case SEARCH_THEN_ANSWER -> {
            if (context.isAtRoundCap()) {
                context.getTrace().error(ErrorKind.BUDGET_EXCEEDED,
                        "round cap " + context.getSettings().roundCap() + " reached, forcing synthesis",
                        Map.of("requestedQuery", plan.searchQuery().query()));
                yield moveTo(context, ResearchState.SYNTHESIZING, "round cap reached");
            }
            cursor.nextQuery = plan.searchQuery();
            yield beginRound(context, cursor, "planner requested another search");
        }
        };
    }

    private ResearchState onSynthesizing(RunContext context, LoopCursor cursor) {
        closeRound(context, cursor);
        AgentOutcome<FinalAnswer> outcome = planner.synthesize(context);
        if (outcome.isSuccess()) {
            cursor.kind = cursor.fallbackReason != null ? ResultKind.PARTIAL_SYNTHESIS : ResultKind.SYNTHESIZED;
            cursor.finalAnswer = outcome.getValue();
            return moveTo(context, ResearchState.DONE, "synthesis complete");
        }
        cursor.kind = ResultKind.SYNTHESIS_FAILED;
        cursor.rawSynthesisOutput = outcome.getRawOutput();
        cursor.failureReason = outcome.getFailureReason();
        return moveTo(context, ResearchState.DONE, "synthesis failed");
    }

    /**
     * Starts the next round unless a budget is exhausted.
     */
    private ResearchState beginRound(RunContext context, LoopCursor cursor, String reason) {
        closeRound(context, cursor);
        Optional<String> exhausted = exhaustedReason(context);
        if (exhausted.isPresent()) {
            context.getTrace().error(ErrorKind.BUDGET_EXCEEDED, exhausted.get(), Map.of());
            return fallBackToSynthesis(context, cursor, exhausted.get());
        }
        context.advanceRound();
        cursor.roundStartNanos = System.nanoTime();
        cursor.roundOpen = true;
        cursor.candidates = List.of();
        cursor.selection = null;
        return moveTo(context, ResearchState.SEARCHING, reason);
    }

    private void closeRound(RunContext context, LoopCursor cursor) {
        if (!cursor.roundOpen) {
            return;
        }
        cursor.roundOpen = false;
        long durationMs = (System.nanoTime() - cursor.roundStartNanos) / 1_000_000;
        int round = context.getRound();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("durationMs", durationMs);
        data.put("reports", context.getLedger().entriesForRound(round).size());
        context.getTrace().record(TraceEventType.ROUND_COMPLETED, "Round " + round + " completed", data);
    }

    private ResearchState fallBackToSynthesis(RunContext context, LoopCursor cursor, String reason) {
        log.warn("[Research] Falling back to synthesis: {}", reason);
        cursor.fallbackReason = reason;
        return moveTo(context, ResearchState.SYNTHESIZING, "fallback: " + reason);
    }

    private Optional<String> exhaustedReason(RunContext context) {
        if (context.isCancelled()) {
            return Optional.of("run cancelled");
        }
        return context.getBudget().exhaustedReason();
    }

    private ResearchState moveTo(RunContext context, ResearchState next, String reason) {
        context.getTrace().transition(next, reason);
        return next;
    }

    private ResearchResult buildResult(RunContext context, LoopCursor cursor) {
        String failureReason = cursor.failureReason != null ? cursor.failureReason : cursor.fallbackReason;
        return ResearchResult.builder()
                .runId(context.getRunId())
                .question(context.getQuestion().text())
                .kind(cursor.kind)
                .finalAnswer(cursor.finalAnswer)
                .rawSynthesisOutput(cursor.rawSynthesisOutput)
                .failureReason(failureReason)
                .evidence(context.getLedger().entries())
                .trace(context.getTrace().events())
                .roundsCompleted(context.getRound())
                .candidatesByRound(context.getCandidatesByRound())
                .llmCalls(context.getBudget().getLlmCalls())
                .totalTokens(context.getBudget().getTotalTokens())
                .build();
    }

    /**
     * Mutable loop-local state carried between state handlers of one run.
     */
    private static final class LoopCursor {
        private String directAnswer;
        private SearchQuery nextQuery;
        private List<CandidateDocument> candidates = List.of();
        private SelectionSet selection;
        private boolean roundOpen;
        private long roundStartNanos;
        private String fallbackReason;
        private ResultKind kind;
        private FinalAnswer finalAnswer;
        private String rawSynthesisOutput;
        private String failureReason;
    }
}
