package me.golemcore.seeker.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.seeker.domain.model.CandidateDocument;
import me.golemcore.seeker.domain.model.FinalAnswer;
import me.golemcore.seeker.domain.model.Freshness;
import me.golemcore.seeker.domain.model.LlmRequest;
import me.golemcore.seeker.domain.model.LlmResponse;
import me.golemcore.seeker.domain.model.Plan;
import me.golemcore.seeker.domain.model.Question;
import me.golemcore.seeker.domain.model.ReaderFindings;
import me.golemcore.seeker.domain.model.ReaderReport;
import me.golemcore.seeker.domain.model.ResearchSettings;
import me.golemcore.seeker.domain.model.RunBudget;
import me.golemcore.seeker.domain.model.RunContext;
import me.golemcore.seeker.domain.model.SearchQuery;
import me.golemcore.seeker.domain.model.SelectionSet;
import me.golemcore.seeker.domain.model.TraceEventType;
import me.golemcore.seeker.domain.protocol.ProtocolCodec;
import me.golemcore.seeker.infrastructure.config.SeekerProperties;
import me.golemcore.seeker.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.stubbing.OngoingStubbing;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PlannerStageTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private LlmPort llmPort;
    private PlannerStage planner;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        StructuredAgentInvoker invoker = new StructuredAgentInvoker(llmPort, new ProtocolCodec(),
                new SeekerProperties.LlmProperties());
        planner = new PlannerStage(invoker, objectMapper, Freshness.WEEK);
    }

    private static RunContext context(ResearchSettings settings) {
        return new RunContext("run1", new Question("Who won the 2026 chess olympiad?", settings),
                RunBudget.unlimited(CLOCK), CLOCK);
    }

    private void reply(String... contents) {
        OngoingStubbing<CompletableFuture<LlmResponse>> stubbing = when(llmPort.chat(any(LlmRequest.class)));
        for (String content : contents) {
            stubbing = stubbing.thenReturn(CompletableFuture.completedFuture(
                    LlmResponse.builder().content(content).build()));
        }
    }

    private JsonNode lastPayload() throws Exception {
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, atLeastOnce()).chat(captor.capture());
        LlmRequest request = captor.getValue();
        return objectMapper.readTree(request.getMessages().get(0).getContent());
    }

    private static List<CandidateDocument> candidates(int count) {
        List<CandidateDocument> docs = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            docs.add(new CandidateDocument("r" + i, "https://site" + i + ".com/page", "Title " + i,
                    "Snippet " + i, Map.of(CandidateDocument.META_AGE, i + " days ago")));
        }
        return docs;
    }

    @Test
    void shouldApplyDefaultRecencyAndCapResultsInPlan() throws Exception {
        reply("```json\n{\"action\": \"search_then_answer\", \"search\": {\"query\": \"chess olympiad 2026 winner\", \"max_results\": 50}}\n```");

        AgentOutcome<Plan> outcome = planner.plan(context(new ResearchSettings(3, 5, 10, 5, 0.0)));

        assertTrue(outcome.isSuccess());
        SearchQuery query = outcome.getValue().searchQuery();
        assertEquals(Freshness.WEEK, query.when());
        assertEquals(10, query.maxResults());
        assertEquals(10, lastPayload().get("max_results_limit").asInt());
    }

    @Test
    void shouldKeepRequestedRecencyAndSmallerLimit() {
        reply("```json\n{\"action\": \"search_then_answer\", \"search\": {\"query\": \"q\", \"when\": \"any\", \"max_results\": 4}}\n```");

        AgentOutcome<Plan> outcome = planner.plan(context(new ResearchSettings(3, 5, 10, 5, 0.0)));

        assertEquals(Freshness.ANY, outcome.getValue().searchQuery().when());
        assertEquals(4, outcome.getValue().searchQuery().maxResults());
    }

    @Test
    void shouldReturnEmptySelectionWithoutAgentCallWhenNoCandidates() {
        AgentOutcome<SelectionSet> outcome = planner.select(context(new ResearchSettings(3, 5, 10, 5, 0.0)),
                List.of());

        assertTrue(outcome.isSuccess());
        assertTrue(outcome.getValue().isEmpty());
        verifyNoInteractions(llmPort);
    }

    @Test
    void shouldDropUnknownDuplicateAndOverCapSelections() throws Exception {
        reply("```json\n{\"selected_ids\": [\"r2\", \"r9\", \"r2\", \"r1\", \"r4\", \"r5\"], \"notes\": \"best sources\"}\n```");
        RunContext context = context(new ResearchSettings(3, 5, 10, 3, 0.0));
        context.advanceRound();

        AgentOutcome<SelectionSet> outcome = planner.select(context, candidates(6));

        SelectionSet selection = outcome.getValue();
        assertEquals(List.of("r2", "r1", "r4"), selection.documents().stream().map(CandidateDocument::id).toList());
        assertEquals(List.of("r9", "r2", "r5"), selection.droppedIds());
        assertEquals("best sources", selection.notes());

        JsonNode payload = lastPayload();
        assertEquals(1, payload.get("round").asInt());
        assertEquals(6, payload.get("results").size());
        assertEquals("site1.com", payload.get("results").get(0).get("domain").asText());
        assertEquals("1 days ago", payload.get("results").get(0).get("age").asText());
    }

    @Test
    void shouldPassSearchedQueriesAndLedgerToReflection() throws Exception {
        reply("```json\n{\"action\": \"direct_answer\", \"notes\": \"enough evidence\"}\n```");
        RunContext context = context(new ResearchSettings(3, 5, 10, 5, 0.0));
        context.advanceRound();
        context.recordQuery(SearchQuery.of("chess olympiad 2026"));
        context.getLedger().append(ReaderReport.fetchFailed(1, candidates(1).get(0), "HTTP 404"));

        AgentOutcome<Plan> outcome = planner.reflect(context);

        assertTrue(outcome.isSuccess());
        JsonNode payload = lastPayload();
        assertEquals(3, payload.get("max_rounds").asInt());
        assertEquals("chess olympiad 2026", payload.get("searched_queries").get(0).asText());
        assertEquals("fetch_failed", payload.get("reports").get(0).get("status").asText());
    }

    @Test
    void shouldFilterEvidenceByFloorAndDropUnknownUsedResults() throws Exception {
        reply("""
                ```json
                {"answer": "Team A won.", "key_points": ["Team A won on tiebreaks"], "used_results": ["1:r1", "1:r7"]}
                ```
                """);
        RunContext context = context(new ResearchSettings(3, 5, 10, 5, 0.5));
        context.advanceRound();
        List<CandidateDocument> docs = candidates(3);
        context.getLedger().append(ReaderReport.ok(1, docs.get(0),
                new ReaderFindings("T1", "Team A won", List.of("tiebreaks"), 0.9, null)));
        context.getLedger().append(ReaderReport.ok(1, docs.get(1),
                new ReaderFindings("T2", "Unrelated", List.of(), 0.1, null)));
        context.getLedger().append(ReaderReport.fetchFailed(1, docs.get(2), "HTTP 500"));

        AgentOutcome<FinalAnswer> outcome = planner.synthesize(context);

        assertTrue(outcome.isSuccess());
        assertEquals("Team A won.", outcome.getValue().answer());
        assertEquals(List.of("1:r1"), outcome.getValue().usedResults());
        assertEquals(1, context.getTrace().eventsOfType(TraceEventType.INFO).size());

        JsonNode payload = lastPayload();
        assertEquals(1, payload.get("evidence").size());
        assertEquals("1:r1", payload.get("evidence").get(0).get("key").asText());
        assertEquals(1, payload.get("unreadable").size());
        assertEquals("1:r3", payload.get("unreadable").get(0).get("key").asText());
    }

    @Test
    void shouldReportSynthesisDecodeFailure() {
        reply("The answer is Team A.", "I already told you: Team A.");
        RunContext context = context(new ResearchSettings(3, 5, 10, 5, 0.0));

        AgentOutcome<FinalAnswer> outcome = planner.synthesize(context);

        assertEquals(AgentOutcome.Status.DECODE_FAILED, outcome.getStatus());
        assertEquals("I already told you: Team A.", outcome.getRawOutput());
    }
}
