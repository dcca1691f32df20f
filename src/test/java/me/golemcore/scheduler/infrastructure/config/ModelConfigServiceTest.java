package me.golemcore.scheduler.infrastructure.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class ModelConfigServiceTest {

    private ModelConfigService service;

    @BeforeEach
    void setUp() {
        service = new ModelConfigService();
        service.init();
    }

    @Test
    void shouldLoadCatalogFromClasspath() {
        assertFalse(service.getConfig().getModels().isEmpty());
    }

    @Test
    void shouldResolveExactAndProviderPrefixedIds() {
        assertEquals("anthropic", service.getModelSettings("claude-sonnet-4").getProvider());
        assertEquals("anthropic", service.getModelSettings("anthropic/claude-sonnet-4").getProvider());
        assertEquals("claude-sonnet-4-20250514", service.getModelName("anthropic/claude-sonnet-4"));
    }

    @Test
    void shouldPreferLongestPrefixMatch() {
        ModelConfigService.ModelSettings settings = service.getModelSettings("gpt-4o-mini-2024-07-18");

        assertEquals(0, new BigDecimal("0.15").compareTo(settings.getPriceInPerMillion()));
    }

    @Test
    void shouldFallBackToDefaults() {
        ModelConfigService.ModelSettings settings = service.getModelSettings("unknown-model");

        assertSame(service.getConfig().getDefaults(), settings);
        assertEquals("unknown-model", service.getModelName("unknown-model"));
        assertSame(service.getConfig().getDefaults(), service.getModelSettings(null));
    }

    @Test
    void shouldTakeProviderFromExplicitPrefix() {
        assertEquals("azure", service.getProvider("azure/gpt-4o"));
        assertEquals("openai", service.getProvider("gpt-4o"));
    }

    @Test
    void shouldUseEmptyCatalogWhenResourceIsMissing() {
        ModelConfigService missing = new ModelConfigService("does-not-exist.json");
        missing.init();

        assertTrue(missing.getConfig().getModels().isEmpty());
        assertEquals("openai", missing.getProvider("some-model"));
    }
}
