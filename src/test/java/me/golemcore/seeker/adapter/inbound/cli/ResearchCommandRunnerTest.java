package me.golemcore.seeker.adapter.inbound.cli;

import me.golemcore.seeker.domain.model.CandidateDocument;
import me.golemcore.seeker.domain.model.FinalAnswer;
import me.golemcore.seeker.domain.model.Freshness;
import me.golemcore.seeker.domain.model.Plan;
import me.golemcore.seeker.domain.model.PlanPreview;
import me.golemcore.seeker.domain.model.ResearchResult;
import me.golemcore.seeker.domain.model.ResultKind;
import me.golemcore.seeker.domain.model.SearchQuery;
import me.golemcore.seeker.domain.service.ResearchService;
import me.golemcore.seeker.infrastructure.config.ResearchConfiguration;
import me.golemcore.seeker.port.outbound.SearchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ResearchCommandRunnerTest {

    private ResearchService researchService;
    private ByteArrayOutputStream output;
    private ResearchCommandRunner runner;

    @BeforeEach
    void setUp() {
        researchService = mock(ResearchService.class);
        output = new ByteArrayOutputStream();
        runner = new ResearchCommandRunner(researchService, ResearchConfiguration.objectMapper(),
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    private void run(String... args) {
        runner.run(new DefaultApplicationArguments(args));
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    void shouldPrintResearchResultAsJson() {
        when(researchService.research("What is 17 × 23?")).thenReturn(ResearchResult.builder()
                .runId("abc12345")
                .kind(ResultKind.DIRECT_ANSWER)
                .finalAnswer(FinalAnswer.direct("391"))
                .evidence(List.of())
                .trace(List.of())
                .build());

        run("run", "--question=What is 17 × 23?");

        assertEquals(ResearchCommandRunner.EXIT_OK, runner.getExitCode());
        assertTrue(printed().contains("\"answer\" : \"391\""));
        assertTrue(printed().contains("\"kind\" : \"DIRECT_ANSWER\""));
    }

    @Test
    void shouldExitWithFailureWhenSynthesisFailed() {
        when(researchService.research(any())).thenReturn(ResearchResult.builder()
                .kind(ResultKind.SYNTHESIS_FAILED)
                .rawSynthesisOutput("not json")
                .evidence(List.of())
                .trace(List.of())
                .build());

        run("run", "--question=Who won?");

        assertEquals(ResearchCommandRunner.EXIT_FAILURE, runner.getExitCode());
        assertTrue(printed().contains("not json"));
    }

    @Test
    void shouldRequireQuestion() {
        run("run");

        assertEquals(ResearchCommandRunner.EXIT_FAILURE, runner.getExitCode());
        assertTrue(printed().contains("--question is required"));
        verifyNoInteractions(researchService);
    }

    @Test
    void shouldPrintPlanPreview() {
        when(researchService.plan("Who won?")).thenReturn(new PlanPreview("abc12345", true,
                Plan.search(SearchQuery.of("olympiad winner").withWhen(Freshness.WEEK), "needs news"), null, "{}",
                List.of()));

        run("plan", "--question=Who won?");

        assertEquals(ResearchCommandRunner.EXIT_OK, runner.getExitCode());
        assertTrue(printed().contains("olympiad winner"));
        assertTrue(printed().contains("\"week\""));
    }

    @Test
    void shouldPassSearchOptions() {
        ArgumentCaptor<SearchQuery> captor = ArgumentCaptor.forClass(SearchQuery.class);
        when(researchService.search(captor.capture())).thenReturn(List.of(
                new CandidateDocument("r1", "https://fide.com/news", "FIDE", "", Map.of())));

        run("search", "--query=olympiad", "--when=day", "--max-results=3");

        assertEquals(ResearchCommandRunner.EXIT_OK, runner.getExitCode());
        SearchQuery query = captor.getValue();
        assertEquals("olympiad", query.query());
        assertEquals(Freshness.DAY, query.when());
        assertEquals(3, query.maxResults());
        assertTrue(printed().contains("https://fide.com/news"));
    }

    @Test
    void shouldRejectUnknownRecencyFilter() {
        run("search", "--query=olympiad", "--when=year");

        assertEquals(ResearchCommandRunner.EXIT_FAILURE, runner.getExitCode());
        assertTrue(printed().contains("--when must be one of"));
        verifyNoInteractions(researchService);
    }

    @Test
    void shouldRejectNonNumericMaxResults() {
        run("search", "--query=olympiad", "--max-results=ten");

        assertEquals(ResearchCommandRunner.EXIT_FAILURE, runner.getExitCode());
        assertTrue(printed().contains("--max-results must be a positive integer"));
    }

    @Test
    void shouldReportSearchFailure() {
        when(researchService.search(any())).thenThrow(new SearchException("Brave Search API key is not configured"));

        run("search", "--query=olympiad");

        assertEquals(ResearchCommandRunner.EXIT_FAILURE, runner.getExitCode());
        assertTrue(printed().contains("not configured"));
    }

    @Test
    void shouldPrintUsageForUnknownCommand() {
        run("dance");

        assertEquals(ResearchCommandRunner.EXIT_FAILURE, runner.getExitCode());
        assertTrue(printed().contains("Unknown command: dance"));
        assertTrue(printed().contains("Usage:"));
    }

    @Test
    void shouldPrintUsageWithoutCommand() {
        run();

        assertEquals(ResearchCommandRunner.EXIT_FAILURE, runner.getExitCode());
        assertTrue(printed().startsWith("Usage:"));
    }
}
