package me.golemcore.seeker.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.seeker.domain.model.CandidateDocument;
import me.golemcore.seeker.domain.model.ErrorKind;
import me.golemcore.seeker.domain.model.LlmRequest;
import me.golemcore.seeker.domain.model.LlmResponse;
import me.golemcore.seeker.domain.model.Question;
import me.golemcore.seeker.domain.model.ReaderReport;
import me.golemcore.seeker.domain.model.ReportStatus;
import me.golemcore.seeker.domain.model.ResearchResult;
import me.golemcore.seeker.domain.model.ResearchSettings;
import me.golemcore.seeker.domain.model.ResearchState;
import me.golemcore.seeker.domain.model.ResultKind;
import me.golemcore.seeker.domain.model.RunBudget;
import me.golemcore.seeker.domain.model.RunContext;
import me.golemcore.seeker.domain.model.SearchQuery;
import me.golemcore.seeker.domain.model.TraceEvent;
import me.golemcore.seeker.domain.model.TraceEventType;
import me.golemcore.seeker.domain.model.Freshness;
import me.golemcore.seeker.domain.protocol.ProtocolCodec;
import me.golemcore.seeker.infrastructure.config.SeekerProperties;
import me.golemcore.seeker.port.outbound.DocumentFetchPort;
import me.golemcore.seeker.port.outbound.FetchException;
import me.golemcore.seeker.port.outbound.LlmPort;
import me.golemcore.seeker.port.outbound.SearchException;
import me.golemcore.seeker.port.outbound.SearchGatewayPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * End-to-end scenarios for the research loop with scripted planner and reader
 * agents, a stubbed search gateway and a stubbed document fetcher.
 */
class ResearchLoopControllerBddTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    private static final String STAGE_PLAN = "plan";
    private static final String STAGE_SELECT = "select";
    private static final String STAGE_REFLECT = "reflect";
    private static final String STAGE_SYNTHESIZE = "synthesize";
    private static final String STAGE_READ = "read";

    private static final String PLAN_SEARCH = """
            ```json
            {"action": "search_then_answer", "search": {"query": "chess olympiad 2026 winner", "when": "month"}}
            ```
            """;
    private static final String REFLECT_SEARCH_AGAIN = """
            ```json
            {"action": "search_then_answer", "search": {"query": "chess olympiad 2026 final standings"}}
            ```
            """;
    private static final String REFLECT_CONCLUDE = "```json\n{\"action\": \"direct_answer\", \"notes\": \"enough\"}\n```";
    private static final String READER_OUTPUT = """
            ```json
            {"title": "Olympiad report", "summary": "Team A won the open section.", "key_points": ["Team A won"], "relevance_score": 0.9}
            ```
            """;
    private static final String PAGE_TEXT = "Team A won the open section of the 2026 chess olympiad.";

    private final Map<String, Deque<String>> scripts = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

    private LlmPort llmPort;
    private SearchGatewayPort searchGateway;
    private DocumentFetchPort fetchPort;
    private ResearchLoopController controller;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        searchGateway = mock(SearchGatewayPort.class);
        fetchPort = mock(DocumentFetchPort.class);

        when(llmPort.chat(any(LlmRequest.class))).thenAnswer(inv -> {
            LlmRequest request = inv.getArgument(0);
            String stage = stageOf(request.getSystemPrompt());
            calls.computeIfAbsent(stage, k -> new AtomicInteger()).incrementAndGet();
            String content;
            if (STAGE_READ.equals(stage)) {
                content = READER_OUTPUT;
            } else {
                Deque<String> queue = scripts.get(stage);
                synchronized (this) {
                    content = queue == null || queue.isEmpty() ? "" : queue.size() > 1 ? queue.poll() : queue.peek();
                }
            }
            return CompletableFuture.completedFuture(LlmResponse.builder().content(content).build());
        });
        when(fetchPort.fetchAndExtract(any(CandidateDocument.class)))
                .thenReturn(CompletableFuture.completedFuture(PAGE_TEXT));

        ObjectMapper objectMapper = new ObjectMapper();
        StructuredAgentInvoker invoker = new StructuredAgentInvoker(llmPort, new ProtocolCodec(),
                new SeekerProperties.LlmProperties());
        PlannerStage planner = new PlannerStage(invoker, objectMapper, Freshness.WEEK);
        ReaderDispatcher dispatcher = new ReaderDispatcher(fetchPort, invoker, objectMapper, Duration.ofSeconds(5));
        controller = new ResearchLoopController(planner, searchGateway, dispatcher);
    }

    private static String stageOf(String systemPrompt) {
        if (AgentPrompts.PLAN.equals(systemPrompt)) {
            return STAGE_PLAN;
        }
        if (AgentPrompts.READ.equals(systemPrompt)) {
            return STAGE_READ;
        }
        if (AgentPrompts.SYNTHESIZE.equals(systemPrompt)) {
            return STAGE_SYNTHESIZE;
        }
        if (systemPrompt.contains("reflecting after research round")) {
            return STAGE_REFLECT;
        }
        return STAGE_SELECT;
    }

    /**
     * Queues agent outputs for a stage. The last output repeats once the queue
     * is down to one element.
     */
    private void script(String stage, String... outputs) {
        scripts.put(stage, new ArrayDeque<>(List.of(outputs)));
    }

    private int callsTo(String stage) {
        AtomicInteger count = calls.get(stage);
        return count != null ? count.get() : 0;
    }

    private static String synthesis(String answer, String... usedKeys) {
        StringBuilder used = new StringBuilder();
        for (String key : usedKeys) {
            if (used.length() > 0) {
                used.append(", ");
            }
            used.append('"').append(key).append('"');
        }
        return "```json\n{\"answer\": \"" + answer + "\", \"key_points\": [\"" + answer + "\"], \"used_results\": ["
                + used + "]}\n```";
    }

    private static String selection(String... ids) {
        return "```json\n{\"selected_ids\": [\"" + String.join("\", \"", ids) + "\"]}\n```";
    }

    private static List<CandidateDocument> candidates(int count) {
        List<CandidateDocument> docs = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            docs.add(new CandidateDocument("r" + i, "https://news" + i + ".example.com/olympiad", "Result " + i,
                    "Snippet " + i, Map.of()));
        }
        return docs;
    }

    private static RunContext context(String question, ResearchSettings settings, RunBudget budget) {
        return new RunContext("run-bdd", new Question(question, settings), budget, CLOCK);
    }

    private static RunContext context(String question, ResearchSettings settings) {
        return context(question, settings, RunBudget.unlimited(CLOCK));
    }

    private static ResearchSettings settings(int rounds) {
        return new ResearchSettings(rounds, 5, 10, 5, 0.0);
    }

    private static List<TraceEvent> errorsOf(ResearchResult result, ErrorKind kind) {
        return result.getTrace().stream()
                .filter(e -> e.type() == TraceEventType.ERROR && e.errorKind() == kind)
                .toList();
    }

    private static List<ResearchState> statePath(RunContext context) {
        return context.getTrace().statePath();
    }

    @Test
    void scenarioA_arithmeticQuestion_isAnsweredDirectlyWithoutSearch() {
        // GIVEN: the planner answers directly
        script(STAGE_PLAN, "```json\n{\"action\": \"direct_answer\", \"direct_answer\": \"391\", \"notes\": \"arithmetic\"}\n```");
        RunContext context = context("What is 17 × 23?", settings(3));

        // WHEN
        ResearchResult result = controller.run(context);

        // THEN: zero rounds, zero reports, the answer is the planner's text
        assertEquals(ResultKind.DIRECT_ANSWER, result.getKind());
        assertEquals("391", result.getFinalAnswer().answer());
        assertEquals(0, result.getRoundsCompleted());
        assertTrue(result.getEvidence().isEmpty());
        assertEquals(List.of(ResearchState.INIT, ResearchState.PLANNING, ResearchState.DIRECT_ANSWER,
                ResearchState.DONE), statePath(context));
        verifyNoInteractions(searchGateway, fetchPort);
        assertEquals(1, result.getLlmCalls());
        assertTrue(result.isSuccessful());
    }

    @Test
    void scenarioB_tenCandidatesThreeSelectedOneFetchFails_yieldsThreeReports() {
        // GIVEN: search returns 10 candidates, the planner selects 3
        List<CandidateDocument> candidates = candidates(10);
        when(searchGateway.search(any(SearchQuery.class)))
                .thenReturn(CompletableFuture.completedFuture(candidates));
        script(STAGE_PLAN, PLAN_SEARCH);
        script(STAGE_SELECT, selection("r2", "r5", "r7"));
        script(STAGE_REFLECT, REFLECT_CONCLUDE);
        script(STAGE_SYNTHESIZE, synthesis("Team A won", "1:r2", "1:r7"));

        // AND: fetching r5 fails
        when(fetchPort.fetchAndExtract(candidates.get(4)))
                .thenReturn(CompletableFuture.failedFuture(new FetchException(candidates.get(4).url(), "HTTP 503")));
        RunContext context = context("Who won the 2026 chess olympiad?", settings(3));

        // WHEN
        ResearchResult result = controller.run(context);

        // THEN: exactly 3 reports, one degraded with score 0
        assertEquals(ResultKind.SYNTHESIZED, result.getKind());
        assertEquals(1, result.getRoundsCompleted());
        List<ReaderReport> evidence = result.getEvidence();
        assertEquals(3, evidence.size());
        assertEquals(3, context.getLedger().entriesForRound(1).size());
        List<ReaderReport> failed = evidence.stream().filter(r -> r.status() == ReportStatus.FETCH_FAILED).toList();
        assertEquals(1, failed.size());
        assertEquals("r5", failed.get(0).documentId());
        assertEquals(0.0, failed.get(0).relevanceScore());
        assertEquals(2, callsTo(STAGE_READ));

        // AND: the selection only references candidates of the round
        assertTrue(evidence.stream().allMatch(r -> candidates.stream().anyMatch(c -> c.id().equals(r.documentId()))));

        // AND: the trace reconstructs the full path
        assertEquals(List.of(ResearchState.INIT, ResearchState.PLANNING, ResearchState.SEARCHING,
                ResearchState.SELECTING, ResearchState.READING, ResearchState.REFLECTING,
                ResearchState.SYNTHESIZING, ResearchState.DONE), statePath(context));
        assertEquals(List.of("1:r2", "1:r7"), result.getFinalAnswer().usedResults());
        assertEquals(1, context.getTrace().eventsOfType(TraceEventType.ROUND_COMPLETED).size());
        assertEquals(10, result.getCandidatesByRound().get(1).size());
    }

    @Test
    void scenarioC_malformedReflectionAfterRepair_fallsBackToSynthesis() {
        // GIVEN: one round of reading
        when(searchGateway.search(any(SearchQuery.class)))
                .thenReturn(CompletableFuture.completedFuture(candidates(3)));
        script(STAGE_PLAN, PLAN_SEARCH);
        script(STAGE_SELECT, selection("r1", "r2"));

        // AND: reflection output is not structured, twice
        script(STAGE_REFLECT, "I think we have enough, let's wrap up.", "Yes, wrap up now.");
        script(STAGE_SYNTHESIZE, synthesis("Team A won", "1:r1"));
        RunContext context = context("Who won the 2026 chess olympiad?", settings(3));

        // WHEN
        ResearchResult result = controller.run(context);

        // THEN: exactly one repair, then straight to synthesis over the ledger so far
        assertEquals(2, callsTo(STAGE_REFLECT));
        long reflectRepairs = context.getTrace().eventsOfType(TraceEventType.REPAIR_REQUESTED).stream()
                .filter(e -> STAGE_REFLECT.equals(e.data().get("stage")))
                .count();
        assertEquals(1, reflectRepairs);
        assertEquals(ResultKind.PARTIAL_SYNTHESIS, result.getKind());
        assertTrue(result.getFailureReason().startsWith("reflection failed"));
        assertEquals("Team A won", result.getFinalAnswer().answer());
        assertEquals(2, result.getEvidence().size());
        assertEquals(1, result.getRoundsCompleted());

        List<ResearchState> path = statePath(context);
        assertEquals(ResearchState.REFLECTING, path.get(path.size() - 3));
        assertEquals(ResearchState.SYNTHESIZING, path.get(path.size() - 2));
        assertEquals(ResearchState.DONE, path.get(path.size() - 1));
    }

    @Test
    void scenarioD_reflectionAlwaysAsksForMore_stopsAtRoundCap() {
        // GIVEN: MAX_ROUNDS = 3 and reflection always requests another search
        when(searchGateway.search(any(SearchQuery.class)))
                .thenReturn(CompletableFuture.completedFuture(candidates(2)));
        script(STAGE_PLAN, PLAN_SEARCH);
        script(STAGE_SELECT, selection("r1"));
        script(STAGE_REFLECT, REFLECT_SEARCH_AGAIN);
        script(STAGE_SYNTHESIZE, synthesis("Team A won", "1:r1", "3:r1"));
        RunContext context = context("Who won the 2026 chess olympiad?", settings(3));

        // WHEN
        ResearchResult result = controller.run(context);

        // THEN: three rounds exactly, then forced synthesis
        assertEquals(3, result.getRoundsCompleted());
        verify(searchGateway, times(3)).search(any(SearchQuery.class));
        assertEquals(3, callsTo(STAGE_REFLECT));
        assertEquals(ResultKind.SYNTHESIZED, result.getKind());
        assertEquals(List.of("1:r1", "2:r1", "3:r1"),
                result.getEvidence().stream().map(ReaderReport::key).toList());
        assertEquals(1, errorsOf(result, ErrorKind.BUDGET_EXCEEDED).size());
        assertEquals(3, context.getTrace().eventsOfType(TraceEventType.ROUND_COMPLETED).size());
        assertEquals(ResearchState.DONE, context.getTrace().currentState());
    }

    @Test
    void scenarioE_searchFailure_continuesRoundWithoutCandidates() {
        // GIVEN: the search provider fails
        when(searchGateway.search(any(SearchQuery.class)))
                .thenReturn(CompletableFuture.failedFuture(new SearchException("Brave Search API error (status 500)")));
        script(STAGE_PLAN, PLAN_SEARCH);
        script(STAGE_REFLECT, REFLECT_CONCLUDE);
        script(STAGE_SYNTHESIZE, synthesis("No reliable sources were found"));
        RunContext context = context("Who won the 2026 chess olympiad?", settings(3));

        // WHEN
        ResearchResult result = controller.run(context);

        // THEN: the round goes on with zero candidates, no selection call, no reading
        assertEquals(1, errorsOf(result, ErrorKind.SEARCH_ERROR).size());
        assertEquals(0, callsTo(STAGE_SELECT));
        assertFalse(statePath(context).contains(ResearchState.READING));
        assertTrue(statePath(context).contains(ResearchState.SELECTING));
        assertTrue(result.getEvidence().isEmpty());
        assertEquals(ResultKind.SYNTHESIZED, result.getKind());
        assertTrue(result.getCandidatesByRound().get(1).isEmpty());
    }

    @Test
    void scenarioI_plannerSelectsNothing_skipsReadingAndReflects() {
        // GIVEN: search returns candidates, but the planner selects none of them
        when(searchGateway.search(any(SearchQuery.class)))
                .thenReturn(CompletableFuture.completedFuture(candidates(5)));
        script(STAGE_PLAN, PLAN_SEARCH);
        script(STAGE_SELECT, "```json\n{\"selected_ids\": [], \"notes\": \"all results are off-topic\"}\n```");
        script(STAGE_REFLECT, REFLECT_CONCLUDE);
        script(STAGE_SYNTHESIZE, synthesis("No relevant sources were found"));
        RunContext context = context("Who won the 2026 chess olympiad?", settings(3));

        // WHEN
        ResearchResult result = controller.run(context);

        // THEN: the selection agent ran once, no reader and no fetch
        assertEquals(1, callsTo(STAGE_SELECT));
        assertEquals(0, callsTo(STAGE_READ));
        verifyNoInteractions(fetchPort);

        // AND: the round goes from SELECTING straight to REFLECTING
        List<ResearchState> path = statePath(context);
        assertFalse(path.contains(ResearchState.READING));
        int selecting = path.indexOf(ResearchState.SELECTING);
        assertEquals(ResearchState.REFLECTING, path.get(selecting + 1));
        assertEquals(1, callsTo(STAGE_REFLECT));
        assertTrue(result.getEvidence().isEmpty());
        assertEquals(ResultKind.SYNTHESIZED, result.getKind());
    }

    @Test
    void scenarioF_malformedSynthesis_endsWithRawOutputAndLedger() {
        // GIVEN
        when(searchGateway.search(any(SearchQuery.class)))
                .thenReturn(CompletableFuture.completedFuture(candidates(2)));
        script(STAGE_PLAN, PLAN_SEARCH);
        script(STAGE_SELECT, selection("r1", "r2"));
        script(STAGE_REFLECT, REFLECT_CONCLUDE);
        script(STAGE_SYNTHESIZE, "Team A won, obviously.", "Team A won. Trust me.");
        RunContext context = context("Who won the 2026 chess olympiad?", settings(3));

        // WHEN
        ResearchResult result = controller.run(context);

        // THEN: degraded terminal result, not an exception
        assertEquals(ResultKind.SYNTHESIS_FAILED, result.getKind());
        assertFalse(result.isSuccessful());
        assertNull(result.getFinalAnswer());
        assertEquals("Team A won. Trust me.", result.getRawSynthesisOutput());
        assertNotNull(result.getFailureReason());
        assertEquals(2, result.getEvidence().size());
        assertEquals(ResearchState.DONE, context.getTrace().currentState());
    }

    @Test
    void scenarioG_malformedPlan_synthesizesFromEmptyLedger() {
        // GIVEN
        script(STAGE_PLAN, "Let me search for that.", "Searching now.");
        script(STAGE_SYNTHESIZE, synthesis("I could not research this question"));
        RunContext context = context("Who won the 2026 chess olympiad?", settings(3));

        // WHEN
        ResearchResult result = controller.run(context);

        // THEN
        assertEquals(ResultKind.PARTIAL_SYNTHESIS, result.getKind());
        assertTrue(result.getFailureReason().startsWith("planning failed"));
        assertEquals(0, result.getRoundsCompleted());
        assertEquals(List.of(ResearchState.INIT, ResearchState.PLANNING, ResearchState.SYNTHESIZING,
                ResearchState.DONE), statePath(context));
        verifyNoInteractions(searchGateway);
    }

    @Test
    void scenarioH_agentCallBudgetExhausted_skipsReflectionAndSynthesizes() {
        // GIVEN: three agent calls allowed: plan, select, one reader
        when(searchGateway.search(any(SearchQuery.class)))
                .thenReturn(CompletableFuture.completedFuture(candidates(3)));
        script(STAGE_PLAN, PLAN_SEARCH);
        script(STAGE_SELECT, selection("r1"));
        script(STAGE_REFLECT, REFLECT_SEARCH_AGAIN);
        script(STAGE_SYNTHESIZE, synthesis("Team A won", "1:r1"));
        RunBudget budget = new RunBudget(CLOCK, null, 3, 0);
        RunContext context = context("Who won the 2026 chess olympiad?", settings(3), budget);

        // WHEN
        ResearchResult result = controller.run(context);

        // THEN
        assertEquals(0, callsTo(STAGE_REFLECT));
        assertEquals(ResultKind.PARTIAL_SYNTHESIS, result.getKind());
        assertEquals(1, errorsOf(result, ErrorKind.BUDGET_EXCEEDED).size());
        assertEquals("Team A won", result.getFinalAnswer().answer());
        assertEquals(4, result.getLlmCalls());
    }

    @Test
    void shouldClearRunIdFromMdcAfterRun() {
        script(STAGE_PLAN, "```json\n{\"action\": \"direct_answer\", \"direct_answer\": \"391\"}\n```");

        controller.run(context("What is 17 × 23?", settings(3)));

        assertNull(MDC.get(ResearchLoopController.MDC_RUN_ID));
    }
}
