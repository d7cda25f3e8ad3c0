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

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Explicit per-run state handed to every stage: the question, the evidence
 * ledger, the trace, the budget and the round counter. Nothing about a run is
 * kept in ambient state, so concurrent runs stay independent.
 */
public class RunContext {

    private final String runId;
    private final Question question;
    private final EvidenceLedger ledger = new EvidenceLedger();
    private final Trace trace;
    private final RunBudget budget;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Map<Integer, List<CandidateDocument>> candidatesByRound = new LinkedHashMap<>();
    private final List<SearchQuery> searchedQueries = new ArrayList<>();
    private int round;

    public RunContext(String runId, Question question, RunBudget budget, Clock clock) {
        this.runId = runId;
        this.question = question;
        this.budget = budget;
        this.trace = new Trace(clock);
    }

    public String getRunId() {
        return runId;
    }

    public Question getQuestion() {
        return question;
    }

    public ResearchSettings getSettings() {
        return question.settings();
    }

    public EvidenceLedger getLedger() {
        return ledger;
    }

    public Trace getTrace() {
        return trace;
    }

    public RunBudget getBudget() {
        return budget;
    }

    public int getRound() {
        return round;
    }

    /**
     * Starts the next round.
     *
     * @throws IllegalStateException
     *             if the round cap has already been reached
     */
    public int advanceRound() {
        if (round >= question.settings().roundCap()) {
            throw new IllegalStateException("Round cap reached: " + round);
        }
        round++;
        trace.setRound(round);
        return round;
    }

    public boolean isAtRoundCap() {
        return round >= question.settings().roundCap();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * True when reader work should be abandoned: external cancellation or the
     * run deadline.
     */
    public boolean shouldAbandon() {
        return cancelled.get() || budget.isPastDeadline();
    }

    public synchronized void recordCandidates(int round, List<CandidateDocument> candidates) {
        candidatesByRound.put(round, List.copyOf(candidates));
    }

    public synchronized void recordQuery(SearchQuery query) {
        searchedQueries.add(query);
    }

    public synchronized List<SearchQuery> getSearchedQueries() {
        return List.copyOf(searchedQueries);
    }

    public synchronized List<CandidateDocument> candidatesFor(int round) {
        return candidatesByRound.getOrDefault(round, List.of());
    }

    public synchronized Map<Integer, List<CandidateDocument>> getCandidatesByRound() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(candidatesByRound));
    }
}
