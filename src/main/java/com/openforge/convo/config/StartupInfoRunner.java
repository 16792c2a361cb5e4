package com.openforge.convo.config;

import com.openforge.convo.llm.provider.ProviderClassifier;
import com.openforge.convo.llm.provider.ProviderConfig;
import com.openforge.convo.llm.provider.ProviderId;
import com.openforge.convo.tool.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Logs a structured startup summary after the context is ready.
 *
 * Reported:
 *   - Models: primary and fallback, with the provider each routes to
 *   - Providers: every configured provider (API key masked)
 *   - Tools: workspace root and registered tool names
 *   - Runtime: Java version, session limits
 */
@Slf4j
@Component
@Order(0)
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final ConvoProperties        properties;
    private final ProviderConfigResolver configResolver;
    private final ToolRegistry           toolRegistry;

    @Override
    public void run(ApplicationArguments args) {
        String fallback = properties.fallbackModel() == null ? "(none)" : properties.fallbackModel();

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Convo  -  Startup Summary                   ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Models                                                  ║
                ║    Primary        : {}  [{}]
                ║    Fallback       : {}  [{}]
                ║    Streaming      : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Providers                                               ║
                {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Tools                                                   ║
                ║    Root           : {}
                ║    Registered     : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Runtime                                                 ║
                ║    Java Version   : {}
                ║    Max Turns      : {}   Timeout: {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                properties.model(), ProviderClassifier.classify(properties.model()),
                fallback, properties.fallbackModel() == null ? "-" : ProviderClassifier.classify(fallback),
                properties.streaming() ? "✔ enabled" : "✘ disabled",

                describeProviders(),

                properties.tools().root().toAbsolutePath().normalize(),
                toolRegistry.getFunctionDeclarations().stream()
                        .map(d -> d.name()).collect(Collectors.joining(", ")),

                System.getProperty("java.version"),
                properties.maxSessionTurns(), properties.session().timeout()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String describeProviders() {
        if (properties.providers().isEmpty()) {
            return "║    (none configured)";
        }
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, ConvoProperties.ProviderSettings> entry : properties.providers().entrySet()) {
            if (sb.length() > 0) sb.append('\n');
            sb.append("║    ").append(String.format("%-15s", entry.getKey())).append(": ")
              .append(describe(entry.getKey()));
        }
        return sb.toString();
    }

    private String describe(String key) {
        ProviderId provider;
        try {
            provider = ProviderId.valueOf(key.toUpperCase());
        } catch (IllegalArgumentException e) {
            return "✘ unknown provider";
        }
        ConvoProperties.ProviderSettings settings = properties.providers().get(key);
        if (provider.requiresApiKey() && (settings.apiKey() == null || settings.apiKey().isBlank())) {
            return "✘ no key";
        }
        ProviderConfig config = configResolver.resolve(provider);
        return "✔ " + config.baseUrl() + "  key=" + ProviderConfig.maskKey(config.apiKey());
    }
}
