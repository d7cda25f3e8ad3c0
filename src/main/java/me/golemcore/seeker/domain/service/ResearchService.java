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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.seeker.domain.model.CandidateDocument;
import me.golemcore.seeker.domain.model.Plan;
import me.golemcore.seeker.domain.model.PlanPreview;
import me.golemcore.seeker.domain.model.Question;
import me.golemcore.seeker.domain.model.ResearchResult;
import me.golemcore.seeker.domain.model.ResearchSettings;
import me.golemcore.seeker.domain.model.RunBudget;
import me.golemcore.seeker.domain.model.RunContext;
import me.golemcore.seeker.domain.model.SearchQuery;
import me.golemcore.seeker.infrastructure.config.SeekerProperties;
import me.golemcore.seeker.port.outbound.SearchGatewayPort;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletionException;

/**
 * Entry point for callers: builds the run context from configuration and
 * per-run overrides and hands it to the research loop.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResearchService {

    private final ResearchLoopController loopController;
    private final PlannerStage plannerStage;
    private final SearchGatewayPort searchGateway;
    private final SeekerProperties properties;
    private final Clock clock;

    public ResearchResult research(String question) {
        return research(question, null, null, null, null);
    }

    /**
     * Runs the full research loop. Null overrides fall back to the configured
     * defaults.
     *
     * @throws IllegalArgumentException
     *             if the question is blank or an override is not positive
     */
    public ResearchResult research(String question, Integer roundCap, Integer concurrencyCap,
            Integer perRoundResultCap, Integer perRoundSelectionCap) {
        ResearchSettings settings = properties.getResearch().toSettings()
                .withOverrides(roundCap, concurrencyCap, perRoundResultCap, perRoundSelectionCap);
        RunContext context = newContext(new Question(question, settings));
        return loopController.run(context);
    }

    /**
     * Runs only the planning step.
     */
    public PlanPreview plan(String question) {
        RunContext context = newContext(new Question(question, properties.getResearch().toSettings()));
        MDC.put(ResearchLoopController.MDC_RUN_ID, context.getRunId());
        try {
            AgentOutcome<Plan> outcome = plannerStage.plan(context);
            return new PlanPreview(context.getRunId(), outcome.isSuccess(), outcome.getValue(),
                    outcome.getFailureReason(), outcome.getRawOutput(), context.getTrace().events());
        } finally {
            MDC.remove(ResearchLoopController.MDC_RUN_ID);
        }
    }

    /**
     * Runs only the search gateway, with the configured recency default and
     * result cap applied.
     */
    public List<CandidateDocument> search(SearchQuery query) {
        if (query == null || query.query() == null || query.query().isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        int cap = properties.getResearch().getPerRoundResultCap();
        SearchQuery normalized = query;
        if (normalized.when() == null) {
            normalized = normalized.withWhen(properties.getSearch().getDefaultWhen());
        }
        if (normalized.maxResults() == null || normalized.maxResults() > cap) {
            normalized = normalized.withMaxResults(cap);
        }
        log.info("[Research] Search only: {}", normalized.query());
        try {
            return searchGateway.search(normalized).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private RunContext newContext(Question question) {
        SeekerProperties.ResearchProperties research = properties.getResearch();
        RunBudget budget = new RunBudget(clock, research.getRunDeadline(), research.getMaxLlmCalls(),
                research.getMaxTotalTokens());
        String runId = UUID.randomUUID().toString().substring(0, 8);
        return new RunContext(runId, question, budget, clock);
    }
}
