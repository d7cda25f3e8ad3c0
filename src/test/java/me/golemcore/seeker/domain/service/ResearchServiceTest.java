package me.golemcore.seeker.domain.service;

import me.golemcore.seeker.domain.model.CandidateDocument;
import me.golemcore.seeker.domain.model.Freshness;
import me.golemcore.seeker.domain.model.Plan;
import me.golemcore.seeker.domain.model.PlanPreview;
import me.golemcore.seeker.domain.model.ResearchResult;
import me.golemcore.seeker.domain.model.ResearchSettings;
import me.golemcore.seeker.domain.model.RunContext;
import me.golemcore.seeker.domain.model.SearchQuery;
import me.golemcore.seeker.infrastructure.config.SeekerProperties;
import me.golemcore.seeker.port.outbound.SearchException;
import me.golemcore.seeker.port.outbound.SearchGatewayPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ResearchServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    private ResearchLoopController loopController;
    private PlannerStage plannerStage;
    private SearchGatewayPort searchGateway;
    private SeekerProperties properties;
    private ResearchService service;

    @BeforeEach
    void setUp() {
        loopController = mock(ResearchLoopController.class);
        plannerStage = mock(PlannerStage.class);
        searchGateway = mock(SearchGatewayPort.class);
        properties = new SeekerProperties();
        service = new ResearchService(loopController, plannerStage, searchGateway, properties, CLOCK);
    }

    @Test
    void shouldApplyOverridesOnTopOfConfiguredLimits() {
        ArgumentCaptor<RunContext> captor = ArgumentCaptor.forClass(RunContext.class);
        ResearchResult expected = ResearchResult.builder().build();
        when(loopController.run(captor.capture())).thenReturn(expected);

        ResearchResult result = service.research("Who won?", 1, null, 4, null);

        assertSame(expected, result);
        ResearchSettings settings = captor.getValue().getSettings();
        assertEquals(1, settings.roundCap());
        assertEquals(5, settings.concurrencyCap());
        assertEquals(4, settings.perRoundResultCap());
        assertEquals(5, settings.perRoundSelectionCap());
        assertEquals("Who won?", captor.getValue().getQuestion().text());
        assertEquals(8, captor.getValue().getRunId().length());
    }

    @Test
    void shouldRejectNonPositiveOverride() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> service.research("Who won?", null, 0, null, null));

        assertTrue(error.getMessage().contains("concurrency_cap"));
        verifyNoInteractions(loopController);
    }

    @Test
    void shouldGiveEachRunItsOwnBudget() {
        properties.getResearch().setMaxLlmCalls(7);
        ArgumentCaptor<RunContext> captor = ArgumentCaptor.forClass(RunContext.class);
        when(loopController.run(captor.capture())).thenReturn(ResearchResult.builder().build());

        service.research("first");
        service.research("second");

        List<RunContext> contexts = captor.getAllValues();
        assertNotSame(contexts.get(0).getBudget(), contexts.get(1).getBudget());
        assertNotEquals(contexts.get(0).getRunId(), contexts.get(1).getRunId());
    }

    @Test
    void shouldReturnPlanPreview() {
        Plan plan = Plan.directAnswer("391", null);
        when(plannerStage.plan(any(RunContext.class))).thenReturn(AgentOutcome.success(plan, "{raw}", 0));

        PlanPreview preview = service.plan("What is 17 × 23?");

        assertTrue(preview.success());
        assertSame(plan, preview.plan());
        assertEquals("{raw}", preview.rawOutput());
        assertNull(MDC.get(ResearchLoopController.MDC_RUN_ID));
    }

    @Test
    void shouldReportFailedPlan() {
        when(plannerStage.plan(any(RunContext.class)))
                .thenReturn(AgentOutcome.invocationFailed("Agent invocation failed: timeout", null, 0));

        PlanPreview preview = service.plan("Who won?");

        assertFalse(preview.success());
        assertNull(preview.plan());
        assertEquals("Agent invocation failed: timeout", preview.failureReason());
    }

    @Test
    void shouldApplySearchDefaults() {
        ArgumentCaptor<SearchQuery> captor = ArgumentCaptor.forClass(SearchQuery.class);
        when(searchGateway.search(captor.capture())).thenReturn(CompletableFuture.completedFuture(List.of()));

        service.search(SearchQuery.of("olympiad"));
        service.search(SearchQuery.of("olympiad").withWhen(Freshness.ANY).withMaxResults(50));
        service.search(SearchQuery.of("olympiad").withMaxResults(3));

        List<SearchQuery> queries = captor.getAllValues();
        assertEquals(Freshness.WEEK, queries.get(0).when());
        assertEquals(10, queries.get(0).maxResults());
        assertEquals(Freshness.ANY, queries.get(1).when());
        assertEquals(10, queries.get(1).maxResults());
        assertEquals(3, queries.get(2).maxResults());
    }

    @Test
    void shouldReturnCandidates() {
        CandidateDocument doc = new CandidateDocument("r1", "https://fide.com", "FIDE", "", Map.of());
        when(searchGateway.search(any(SearchQuery.class)))
                .thenReturn(CompletableFuture.completedFuture(List.of(doc)));

        assertEquals(List.of(doc), service.search(SearchQuery.of("fide")));
    }

    @Test
    void shouldUnwrapSearchFailure() {
        when(searchGateway.search(any(SearchQuery.class)))
                .thenReturn(CompletableFuture.failedFuture(new SearchException("Brave Search rate limit exceeded")));

        SearchException error = assertThrows(SearchException.class,
                () -> service.search(SearchQuery.of("olympiad")));

        assertEquals("Brave Search rate limit exceeded", error.getMessage());
    }

    @Test
    void shouldRejectBlankSearchQuery() {
        assertThrows(IllegalArgumentException.class, () -> service.search(SearchQuery.of(" ")));
        verifyNoInteractions(searchGateway);
    }
}
