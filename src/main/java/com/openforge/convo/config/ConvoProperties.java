package com.openforge.convo.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Externalised configuration, read once at startup from application.yml
 * under the "convo" prefix:
 *
 * convo:
 *   model: gemini-2.5-pro
 *   fallback-model: gemini-2.5-flash
 *   max-session-turns: 30
 *   streaming: true
 *   session:
 *     timeout: 5m
 *   generation:
 *     temperature: 0.7
 *     max-tokens: 2048
 *   providers:
 *     gemini:
 *       api-key: ${GEMINI_API_KEY:}
 *     deepseek:
 *       api-key: ${DEEPSEEK_API_KEY:}
 *       base-url: https://api.deepseek.com/v1
 *       timeout-ms: 30000
 *       max-retries: 2
 *   tools:
 *     root: .
 *     parallelism: 4
 *
 * Provider keys under "providers" are lower-case provider ids.
 */
@Validated
@ConfigurationProperties(prefix = "convo")
public record ConvoProperties(
        @NotBlank @DefaultValue("gemini-2.5-pro")   String model,
        @DefaultValue("gemini-2.5-flash")           String fallbackModel,
        @Min(1) @DefaultValue("30")                 int maxSessionTurns,
        @DefaultValue("true")                       boolean streaming,
        String                                      systemInstruction,
        @Valid @DefaultValue                        Session session,
        @Valid @DefaultValue                        Generation generation,
        Map<String, @Valid ProviderSettings>        providers,
        @Valid @DefaultValue                        Tools tools
) {

    public ConvoProperties {
        providers = providers == null ? Map.of() : Map.copyOf(providers);
    }

    public record Session(
            @NotNull @DefaultValue("5m")  Duration timeout,
            @NotNull @DefaultValue("5s")  Duration shutdownGrace
    ) {}

    public record Generation(
            @DecimalMin("0.0") @DecimalMax("2.0") @DefaultValue("0.7") Double temperature,
            @Min(1) @DefaultValue("2048")                            Integer maxTokens,
            @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("1.0") Double topP,
            Integer                                                  topK,
            List<String>                                             stopSequences
    ) {}

    public record ProviderSettings(
            String                          apiKey,
            String                          baseUrl,
            @Min(1) @DefaultValue("30000")  long timeoutMs,
            @Min(0) @DefaultValue("2")      int maxRetries
    ) {}

    public record Tools(
            @NotNull @DefaultValue(".")        Path root,
            @Min(1) @DefaultValue("4")         int parallelism,
            @Min(1) @DefaultValue("1048576")   long maxFileBytes,
            @Min(1) @DefaultValue("200")       int maxSearchResults
    ) {}
}
