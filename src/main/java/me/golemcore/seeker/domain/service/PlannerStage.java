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
import me.golemcore.seeker.domain.model.FinalAnswer;
import me.golemcore.seeker.domain.model.Freshness;
import me.golemcore.seeker.domain.model.Plan;
import me.golemcore.seeker.domain.model.ReaderReport;
import me.golemcore.seeker.domain.model.ResearchSettings;
import me.golemcore.seeker.domain.model.RunContext;
import me.golemcore.seeker.domain.model.SearchQuery;
import me.golemcore.seeker.domain.model.Selection;
import me.golemcore.seeker.domain.model.SelectionSet;
import me.golemcore.seeker.domain.model.Synthesis;
import me.golemcore.seeker.domain.model.TraceEventType;
import me.golemcore.seeker.domain.protocol.MessageSchema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Planner-facing decisions of the research loop: the initial plan, document
 * selection, reflection after a round, and the final synthesis. Each is a
 * single structured agent invocation.
 *
 * <p>
 * Besides decoding, the stage enforces what the schema cannot: selections only
 * reference the current round's candidates and respect the selection cap,
 * search queries are bounded by the per-round result cap, and
 * {@code used_results} only name existing evidence keys.
 */
@Slf4j
public class PlannerStage {

    static final String STAGE_PLAN = "plan";
    static final String STAGE_SELECT = "select";
    static final String STAGE_REFLECT = "reflect";
    static final String STAGE_SYNTHESIZE = "synthesize";

    private final StructuredAgentInvoker invoker;
    private final ObjectMapper objectMapper;
    private final Freshness defaultWhen;

    public PlannerStage(StructuredAgentInvoker invoker, ObjectMapper objectMapper, Freshness defaultWhen) {
        this.invoker = invoker;
        this.objectMapper = objectMapper;
        this.defaultWhen = defaultWhen != null ? defaultWhen : Freshness.WEEK;
    }

    public AgentOutcome<Plan> plan(RunContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("question", context.getQuestion().text());
        payload.put("max_results_limit", context.getSettings().perRoundResultCap());

        AgentOutcome<Plan> outcome = invoker.invoke(context, new AgentCall<>(AgentRole.PLANNER, STAGE_PLAN,
                AgentPrompts.PLAN, toJson(payload), MessageSchema.PLAN));
        return outcome.map(plan -> normalize(plan, context.getSettings()));
    }

    /**
     * Asks the planner which candidates to read. An empty candidate list yields
     * an empty selection without invoking the agent.
     */
    public AgentOutcome<SelectionSet> select(RunContext context, List<CandidateDocument> candidates) {
        if (candidates.isEmpty()) {
            return AgentOutcome.success(SelectionSet.empty("no candidates to select from"), null, 0);
        }
        int cap = context.getSettings().perRoundSelectionCap();

        List<Map<String, Object>> results = new ArrayList<>();
        for (CandidateDocument candidate : candidates) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", candidate.id());
            row.put("title", candidate.title());
            row.put("snippet", candidate.snippet());
            row.put("domain", candidate.domain());
            String age = candidate.sourceMetadata().get(CandidateDocument.META_AGE);
            if (age != null) {
                row.put("age", age);
            }
            results.add(row);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("question", context.getQuestion().text());
        payload.put("round", context.getRound());
        payload.put("results", results);

        AgentOutcome<Selection> outcome = invoker.invoke(context, new AgentCall<>(AgentRole.PLANNER,
                STAGE_SELECT, AgentPrompts.SELECT.formatted(cap), toJson(payload), MessageSchema.SELECTION));
        return outcome.map(selection -> resolveSelection(selection, candidates, cap));
    }

    public AgentOutcome<Plan> reflect(RunContext context) {
        ResearchSettings settings = context.getSettings();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("question", context.getQuestion().text());
        payload.put("round", context.getRound());
        payload.put("max_rounds", settings.roundCap());
        payload.put("searched_queries", context.getSearchedQueries().stream().map(SearchQuery::query).toList());
        payload.put("reports", context.getLedger().entries().stream().map(this::reportPayload).toList());

        String prompt = AgentPrompts.REFLECT.formatted(context.getRound(), settings.roundCap());
        AgentOutcome<Plan> outcome = invoker.invoke(context, new AgentCall<>(AgentRole.PLANNER, STAGE_REFLECT,
                prompt, toJson(payload), MessageSchema.REFLECTION));
        return outcome.map(plan -> normalize(plan, settings));
    }

    public AgentOutcome<FinalAnswer> synthesize(RunContext context) {
        double floor = context.getSettings().relevanceFloor();
        List<ReaderReport> entries = context.getLedger().entries();

        List<Map<String, Object>> evidence = new ArrayList<>();
        List<Map<String, Object>> unreadable = new ArrayList<>();
        for (ReaderReport report : entries) {
            if (!report.isOk()) {
                Map<String, Object> gap = new LinkedHashMap<>();
                gap.put("key", report.key());
                gap.put("url", report.url());
                gap.put("status", report.status().getWireValue());
                unreadable.add(gap);
            } else if (report.relevanceScore() >= floor) {
                evidence.add(reportPayload(report));
            }
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("question", context.getQuestion().text());
        payload.put("rounds_completed", context.getRound());
        payload.put("evidence", evidence);
        payload.put("unreadable", unreadable);

        AgentOutcome<Synthesis> outcome = invoker.invoke(context, new AgentCall<>(AgentRole.PLANNER,
                STAGE_SYNTHESIZE, AgentPrompts.SYNTHESIZE, toJson(payload), MessageSchema.SYNTHESIS));
        return outcome.map(synthesis -> toFinalAnswer(context, synthesis));
    }

    private Plan normalize(Plan plan, ResearchSettings settings) {
        SearchQuery query = plan.searchQuery();
        if (query == null) {
            return plan;
        }
        if (query.when() == null) {
            query = query.withWhen(defaultWhen);
        }
        int cap = settings.perRoundResultCap();
        if (query.maxResults() == null || query.maxResults() > cap) {
            query = query.withMaxResults(cap);
        }
        return new Plan(plan.action(), plan.directAnswer(), query, plan.notes());
    }

    private SelectionSet resolveSelection(Selection selection, List<CandidateDocument> candidates, int cap) {
        Map<String, CandidateDocument> byId = candidates.stream()
                .collect(Collectors.toMap(CandidateDocument::id, Function.identity(), (a, b) -> a,
                        LinkedHashMap::new));
        List<CandidateDocument> chosen = new ArrayList<>();
        List<String> dropped = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (String id : selection.selectedIds()) {
            String trimmed = id.strip();
            CandidateDocument candidate = byId.get(trimmed);
            if (candidate == null || !seen.add(trimmed) || chosen.size() >= cap) {
                dropped.add(id);
                continue;
            }
            chosen.add(candidate);
        }
        if (!dropped.isEmpty()) {
            log.debug("[Research] Dropped selection ids (unknown, duplicate or over cap): {}", dropped);
        }
        return new SelectionSet(chosen, dropped, selection.notes());
    }

    private FinalAnswer toFinalAnswer(RunContext context, Synthesis synthesis) {
        List<String> used = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        for (String key : synthesis.usedResults()) {
            if (context.getLedger().containsKey(key.strip())) {
                used.add(key.strip());
            } else {
                unknown.add(key);
            }
        }
        if (!unknown.isEmpty()) {
            context.getTrace().record(TraceEventType.INFO, "Dropped used_results with no evidence entry",
                    Map.of("dropped", unknown));
        }
        return new FinalAnswer(synthesis.answer(), synthesis.keyPoints(), used, synthesis.notes());
    }

    private Map<String, Object> reportPayload(ReaderReport report) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("key", report.key());
        row.put("url", report.url());
        row.put("title", report.title());
        row.put("status", report.status().getWireValue());
        row.put("summary", report.summary());
        row.put("key_points", report.keyPoints());
        row.put("relevance_score", report.relevanceScore());
        if (report.notes() != null) {
            row.put("notes", report.notes());
        }
        return row;
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize agent payload", e);
        }
    }
}
