package me.golemcore.seeker.domain.model;

import me.golemcore.seeker.testsupport.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RunBudgetTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void shouldReportDeadline() {
        MutableClock clock = new MutableClock(NOW);
        RunBudget budget = new RunBudget(clock, Duration.ofSeconds(30), 0, 0);

        assertTrue(budget.exhaustedReason().isEmpty());
        assertEquals(Duration.ofSeconds(30), budget.remaining());

        clock.advance(Duration.ofSeconds(31));

        assertTrue(budget.isPastDeadline());
        assertEquals(Duration.ZERO, budget.remaining());
        assertEquals("run deadline reached", budget.exhaustedReason().orElseThrow());
    }

    @Test
    void shouldReportCallLimit() {
        RunBudget budget = new RunBudget(new MutableClock(NOW), null, 2, 0);

        budget.recordCall(null);
        assertTrue(budget.exhaustedReason().isEmpty());
        budget.recordCall(LlmUsage.of(10, 5));

        assertEquals(2, budget.getLlmCalls());
        assertEquals(15, budget.getTotalTokens());
        assertEquals("agent invocation limit reached (2)", budget.exhaustedReason().orElseThrow());
    }

    @Test
    void shouldReportTokenLimit() {
        RunBudget budget = new RunBudget(new MutableClock(NOW), null, 0, 100);

        budget.recordCall(LlmUsage.of(80, 30));

        assertEquals("token limit reached (100)", budget.exhaustedReason().orElseThrow());
    }

    @Test
    void shouldTreatZeroLimitsAsUnlimited() {
        RunBudget budget = RunBudget.unlimited(new MutableClock(NOW));
        for (int i = 0; i < 100; i++) {
            budget.recordCall(LlmUsage.of(1000, 1000));
        }

        assertNull(budget.remaining());
        assertTrue(budget.exhaustedReason().isEmpty());
    }
}
