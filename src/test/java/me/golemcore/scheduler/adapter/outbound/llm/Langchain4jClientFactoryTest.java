package me.golemcore.scheduler.adapter.outbound.llm;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import me.golemcore.scheduler.domain.model.IsolationScope;
import me.golemcore.scheduler.domain.model.ModelConfig;
import me.golemcore.scheduler.port.outbound.ModelClient;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Langchain4jClientFactoryTest {

    private static final IsolationScope SCOPE = IsolationScope.of("acme", "support");

    private final Langchain4jClientFactory factory = new Langchain4jClientFactory();

    @Test
    void shouldSupportConfiguredProvidersButNotNone() {
        assertTrue(factory.supports("openai"));
        assertTrue(factory.supports("anthropic"));
        assertFalse(factory.supports(NoOpClientFactory.PROVIDER_NONE));
        assertFalse(factory.supports(" "));
        assertFalse(factory.supports(null));
    }

    @Test
    void shouldBuildOpenAiModel() {
        ModelClient client = factory.create(SCOPE, config("openai"));

        assertTrue(client.isAvailable());
        assertInstanceOf(OpenAiChatModel.class, client.unwrap(ChatModel.class));
    }

    @Test
    void shouldBuildAnthropicModel() {
        ModelClient client = factory.create(SCOPE, config(Langchain4jClientFactory.PROVIDER_ANTHROPIC));

        assertInstanceOf(AnthropicChatModel.class, client.unwrap(ChatModel.class));
    }

    @Test
    void shouldRequireApiKey() {
        ModelConfig config = config("openai").toBuilder().apiKey(" ").build();

        assertThrows(IllegalStateException.class, () -> factory.create(SCOPE, config));
    }

    @Test
    void shouldBecomeUnavailableWhenClosed() {
        ModelClient client = factory.create(SCOPE, config("openai"));

        client.close();

        assertFalse(client.isAvailable());
        assertThrows(IllegalStateException.class, () -> client.unwrap(String.class));
    }

    @Test
    void shouldProvideUnavailableNoOpClient() {
        NoOpClientFactory noOp = new NoOpClientFactory();

        ModelClient client = noOp.create(SCOPE, config(NoOpClientFactory.PROVIDER_NONE));

        assertTrue(noOp.supports(NoOpClientFactory.PROVIDER_NONE));
        assertFalse(client.isAvailable());
    }

    private static ModelConfig config(String provider) {
        return ModelConfig.builder()
                .providerId(provider)
                .modelName("test-model")
                .apiKey("sk-test")
                .build();
    }
}
