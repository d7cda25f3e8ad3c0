package me.golemcore.seeker.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResearchSettingsTest {

    private static final ResearchSettings DEFAULTS = new ResearchSettings(3, 5, 10, 5, 0.0);

    @Test
    void shouldApplyOnlyGivenOverrides() {
        ResearchSettings settings = DEFAULTS.withOverrides(2, null, 8, null);

        assertEquals(2, settings.roundCap());
        assertEquals(5, settings.concurrencyCap());
        assertEquals(8, settings.perRoundResultCap());
        assertEquals(5, settings.perRoundSelectionCap());
    }

    @Test
    void shouldRejectNonPositiveOverride() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> DEFAULTS.withOverrides(0, null, null, null));

        assertTrue(e.getMessage().startsWith("round_cap must be a positive integer"));
    }

    @Test
    void shouldRejectBlankQuestion() {
        assertThrows(IllegalArgumentException.class, () -> new Question("  ", DEFAULTS));
        assertEquals("What is 17 × 23?", new Question("  What is 17 × 23? ", DEFAULTS).text());
    }
}
