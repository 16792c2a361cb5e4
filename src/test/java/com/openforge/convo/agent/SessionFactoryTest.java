package com.openforge.convo.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.convo.config.ConvoProperties;
import com.openforge.convo.config.ProviderConfigResolver;
import com.openforge.convo.llm.exception.ConfigurationException;
import com.openforge.convo.llm.provider.ProviderRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionFactoryTest {

    private static final ConvoProperties.ProviderSettings GEMINI =
            new ConvoProperties.ProviderSettings("AIza-test-0123456789", null, 30_000, 2);
    private static final ConvoProperties.ProviderSettings OPENAI =
            new ConvoProperties.ProviderSettings("sk-test-0123456789", null, 30_000, 2);

    @Test
    @DisplayName("Defaults come from configuration; generation settings are carried over")
    void createsFromDefaults() {
        SessionFactory factory = factory("gemini-2.5-pro", "gemini-2.5-flash", Map.of("gemini", GEMINI));

        try (Session session = factory.create(null, new CancellationToken())) {
            assertEquals("gemini-2.5-pro", session.activeModel());
            assertEquals("gemini-2.5-flash", session.fallbackModel());
            assertEquals(12, session.getMaxTurns());
            assertEquals(0.2, session.getGenerationConfig().temperature());
            assertEquals(List.of("END"), session.getGenerationConfig().stopSequences());
            assertEquals(TurnState.AWAITING_MODEL, session.getState());
            assertEquals(8, session.getId().length());
        }
    }

    @Test
    @DisplayName("--model overrides the configured model")
    void modelOverride() {
        SessionFactory factory = factory("gemini-2.5-pro", "gemini-2.5-flash",
                Map.of("gemini", GEMINI, "openai", OPENAI));

        try (Session session = factory.create("gpt-4o", new CancellationToken())) {
            assertEquals("gpt-4o", session.activeModel());
        }
    }

    @Test
    @DisplayName("A primary model without a configured key fails before any request")
    void missingPrimaryKey() {
        SessionFactory factory = factory("gpt-4o", null, Map.of("gemini", GEMINI));

        assertThrows(ConfigurationException.class, () -> factory.create(null, new CancellationToken()));
    }

    @Test
    @DisplayName("An unusable fallback only disables fallback")
    void unusableFallback() {
        SessionFactory noKey = factory("gpt-4o", "claude-sonnet-4-20250514", Map.of("openai", OPENAI));
        SessionFactory same  = factory("gemini-2.5-pro", "gemini-2.5-pro", Map.of("gemini", GEMINI));

        try (Session a = noKey.create(null, new CancellationToken());
             Session b = same.create(null, new CancellationToken())) {
            assertNull(a.fallbackModel());
            assertNull(b.fallbackModel());
        }
    }

    @Test
    @DisplayName("A malformed base URL on the primary provider fails before the session opens")
    void malformedPrimaryBaseUrl() {
        SessionFactory factory = factory("gpt-4o", null, Map.of("openai",
                new ConvoProperties.ProviderSettings("sk-test-0123456789", "localhost:8080/v1", 30_000, 2)));

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> factory.create(null, new CancellationToken()));

        assertTrue(e.getMessage().contains("localhost:8080/v1"), e.getMessage());
    }

    @Test
    @DisplayName("A fallback provider with a malformed base URL disables fallback")
    void malformedFallbackBaseUrl() {
        SessionFactory factory = factory("gemini-2.5-pro", "gpt-4o", Map.of(
                "gemini", GEMINI,
                "openai", new ConvoProperties.ProviderSettings("sk-test-0123456789", "localhost:8080/v1", 30_000, 2)));

        try (Session session = factory.create(null, new CancellationToken())) {
            assertEquals("gemini-2.5-pro", session.activeModel());
            assertNull(session.fallbackModel());
        }
    }

    @Test
    @DisplayName("A non-positive timeout on the primary provider is a configuration error")
    void nonPositiveTimeout() {
        SessionFactory factory = factory("gemini-2.5-pro", null, Map.of("gemini",
                new ConvoProperties.ProviderSettings("AIza-test-0123456789", null, 0, 2)));

        assertThrows(ConfigurationException.class, () -> factory.create(null, new CancellationToken()));
    }

    private static SessionFactory factory(String model, String fallback,
                                          Map<String, ConvoProperties.ProviderSettings> providers) {
        ConvoProperties properties = new ConvoProperties(model, fallback, 12, false, "Be terse.",
                new ConvoProperties.Session(Duration.ofMinutes(5), Duration.ofSeconds(5)),
                new ConvoProperties.Generation(0.2, 1024, 0.9, null, List.of("END")),
                providers,
                new ConvoProperties.Tools(Path.of("."), 4, 1_048_576, 200));
        ProviderRegistry registry = new ProviderRegistry(HttpClient.newHttpClient(), new ObjectMapper(),
                RetryRegistry.ofDefaults(), CircuitBreakerRegistry.ofDefaults());
        return new SessionFactory(properties, registry, new ProviderConfigResolver(properties));
    }
}
