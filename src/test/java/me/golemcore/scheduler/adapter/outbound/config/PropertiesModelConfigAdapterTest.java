package me.golemcore.scheduler.adapter.outbound.config;

import me.golemcore.scheduler.domain.model.IsolationScope;
import me.golemcore.scheduler.domain.model.ModelConfig;
import me.golemcore.scheduler.infrastructure.config.ModelConfigService;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class PropertiesModelConfigAdapterTest {

    private SchedulerProperties properties;
    private PropertiesModelConfigAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new SchedulerProperties();
        properties.getModels().setDefaultModel("openai/gpt-4o-mini");
        properties.getModels().getOverrides().put("acme", "anthropic/claude-sonnet-4");
        properties.getModels().getOverrides().put("acme:premium", "openai/gpt-4o");

        SchedulerProperties.ProviderProperties openai = new SchedulerProperties.ProviderProperties();
        openai.setApiKey("sk-openai");
        openai.setRequestTimeoutMs(15_000L);
        SchedulerProperties.ProviderProperties anthropic = new SchedulerProperties.ProviderProperties();
        anthropic.setApiKey("sk-ant");
        anthropic.setBaseUrl("https://proxy.example.com");
        properties.getProviders().put("openai", openai);
        properties.getProviders().put("anthropic", anthropic);

        ModelConfigService modelConfigService = new ModelConfigService();
        modelConfigService.init();
        adapter = new PropertiesModelConfigAdapter(properties, modelConfigService);
    }

    @Test
    void shouldUseDefaultModelForUnconfiguredTenant() {
        ModelConfig config = adapter.resolveModelConfig(IsolationScope.of("globex", "support"));

        assertEquals("openai", config.getProviderId());
        assertEquals("gpt-4o-mini", config.getModelName());
        assertEquals("sk-openai", config.getApiKey());
        assertEquals(15_000L, config.getTimeoutMs());
        assertEquals(0, new BigDecimal("0.15").compareTo(config.getPriceInPerMillion()));
    }

    @Test
    void shouldPreferTenantOverride() {
        ModelConfig config = adapter.resolveModelConfig(IsolationScope.of("acme", "support"));

        assertEquals("anthropic", config.getProviderId());
        assertEquals("claude-sonnet-4-20250514", config.getModelName());
        assertEquals("https://proxy.example.com", config.getBaseUrl());
        assertEquals(60_000L, config.getTimeoutMs());
    }

    @Test
    void shouldPreferAgentOverrideOverTenantOverride() {
        ModelConfig config = adapter.resolveModelConfig(IsolationScope.of("acme", "premium"));

        assertEquals("openai", config.getProviderId());
        assertEquals("gpt-4o", config.getModelName());
    }

    @Test
    void shouldLeaveCredentialsEmptyForUnknownProvider() {
        properties.getModels().setDefaultModel("mistral/mistral-large");

        ModelConfig config = adapter.resolveModelConfig(IsolationScope.of("globex", "support"));

        assertEquals("mistral", config.getProviderId());
        assertEquals("mistral-large", config.getModelName());
        assertNull(config.getApiKey());
        assertEquals(0, BigDecimal.ZERO.compareTo(config.getPriceInPerMillion()));
    }
}
