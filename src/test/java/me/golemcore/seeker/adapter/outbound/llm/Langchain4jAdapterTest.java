package me.golemcore.seeker.adapter.outbound.llm;

import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.output.TokenUsage;
import me.golemcore.seeker.domain.model.LlmUsage;
import me.golemcore.seeker.infrastructure.config.SeekerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Langchain4jAdapterTest {

    private SeekerProperties properties;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new SeekerProperties();
        adapter = new Langchain4jAdapter(properties);
    }

    @Test
    void shouldResolveProviderFromModelPrefix() {
        assertEquals("anthropic", Langchain4jAdapter.providerOf("anthropic/claude-sonnet-4"));
        assertEquals("openai", Langchain4jAdapter.providerOf("OpenAI/gpt-4o"));
        assertEquals("openai", Langchain4jAdapter.providerOf("gpt-4o-mini"));
    }

    @Test
    void shouldStripProviderPrefix() {
        assertEquals("gpt-4o", Langchain4jAdapter.stripProviderPrefix("openai/gpt-4o"));
        assertEquals("gpt-4o", Langchain4jAdapter.stripProviderPrefix("gpt-4o"));
    }

    @Test
    void shouldDisableTemperatureForReasoningModels() {
        assertFalse(Langchain4jAdapter.supportsTemperature("o3-mini"));
        assertFalse(Langchain4jAdapter.supportsTemperature("gpt-5"));
        assertTrue(Langchain4jAdapter.supportsTemperature("gpt-4o"));
        assertTrue(Langchain4jAdapter.supportsTemperature("claude-sonnet-4"));
    }

    @Test
    void shouldBeUnavailableWithoutApiKeys() {
        assertFalse(adapter.isAvailable());
        assertEquals("langchain4j", adapter.getProviderId());
    }

    @Test
    void shouldBeAvailableWhenAnyProviderHasKey() {
        SeekerProperties.ProviderProperties openai = new SeekerProperties.ProviderProperties();
        openai.setApiKey("sk-test");
        properties.getLlm().getProviders().put("openai", openai);

        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldRejectModelOfUnconfiguredProvider() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> adapter.modelFor("anthropic/claude-sonnet-4", 1024));

        assertTrue(error.getMessage().contains("seeker.llm.providers.anthropic.api-key"));
    }

    @Test
    void shouldCacheModelsPerNameAndTokenLimit() {
        SeekerProperties.ProviderProperties openai = new SeekerProperties.ProviderProperties();
        openai.setApiKey("sk-test");
        properties.getLlm().getProviders().put("openai", openai);

        assertSame(adapter.modelFor("openai/gpt-4o", 1024), adapter.modelFor("openai/gpt-4o", 1024));
        assertNotSame(adapter.modelFor("openai/gpt-4o", 1024), adapter.modelFor("openai/gpt-4o", 2048));
    }

    @Test
    void shouldSurviveInitializationWithoutKeys() {
        adapter.initialize();

        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldDetectRateLimitAnywhereInCauseChain() {
        assertTrue(Langchain4jAdapter.isRateLimitError(new RateLimitException("slow down")));
        assertTrue(Langchain4jAdapter.isRateLimitError(
                new IllegalStateException("wrapped", new RuntimeException("HTTP 429 Too Many Requests"))));
        assertFalse(Langchain4jAdapter.isRateLimitError(new RuntimeException("invalid api key")));
    }

    @Test
    void shouldReadServerResetHint() {
        RuntimeException error = new RuntimeException("outer",
                new RuntimeException("{\"error\":\"rate_limit\",\"reset_seconds\": 12}"));

        assertEquals(12, Langchain4jAdapter.extractResetSeconds(error));
        assertEquals(-1, Langchain4jAdapter.extractResetSeconds(new RuntimeException("rate_limit")));
    }

    @Test
    void shouldGrowBackoffAndHonourLongerResetHint() {
        assertEquals(5_000, Langchain4jAdapter.backoffDelayMs(0, -1));
        assertEquals(20_000, Langchain4jAdapter.backoffDelayMs(2, -1));
        assertEquals(31_000, Langchain4jAdapter.backoffDelayMs(0, 30));
        assertEquals(40_000, Langchain4jAdapter.backoffDelayMs(3, 2));
    }

    @Test
    void shouldFillMissingTokenTotals() {
        LlmUsage usage = Langchain4jAdapter.usageOf(new TokenUsage(100, 40));

        assertEquals(new LlmUsage(100, 40, 140), usage);
        assertNull(Langchain4jAdapter.usageOf(null));
    }
}
