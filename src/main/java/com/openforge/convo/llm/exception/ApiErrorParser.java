package com.openforge.convo.llm.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.convo.llm.provider.ProviderId;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * Turns a non-2xx provider response into the exception taxonomy.
 *
 * Body shapes handled (all best-effort, never throws while parsing):
 *
 *   {"error": {"code": 429, "message": "...", "status": "RESOURCE_EXHAUSTED"}}   Gemini, OpenAI
 *   [{"error": {...}}]                                                        Gemini array form
 *   {"type": "error", "error": {"type": "rate_limit_error", "message": "..."}}  Anthropic
 *   {"error": "model not found"}                                              Ollama
 *
 * Some proxies wrap a second error document inside error.message as a JSON
 * string.  That inner message is unwrapped once; if it does not parse, the
 * outer message is kept.
 */
@Slf4j
public class ApiErrorParser {

    private static final String QUOTA_METRIC_MARKER = "Quota exceeded for quota metric";
    private static final String PRO_METRIC_MARKER   = "Pro Requests";

    private final ObjectMapper objectMapper;

    public ApiErrorParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** Parsed error body: human message, numeric code (0 if absent), symbolic status (may be null). */
    public record ErrorBody(String message, int code, String status) {}

    // ── Public API ───────────────────────────────────────────────────────────

    public ApiException toException(ProviderId provider, int httpStatus, String body,
                                    Optional<String> retryAfterHeader) {
        ErrorBody parsed = parse(body).orElse(null);

        String message = parsed != null && parsed.message() != null
                ? parsed.message()
                : fallbackMessage(httpStatus, body);
        String status  = parsed == null ? null : parsed.status();
        int    code    = httpStatus;

        if (isQuotaExceeded(httpStatus, status, message)) {
            QuotaKind kind = message.contains(QUOTA_METRIC_MARKER) && message.contains(PRO_METRIC_MARKER)
                    ? QuotaKind.PRO
                    : QuotaKind.GENERIC;
            return new QuotaExceededException(provider, code, status, message, body, kind,
                    retryAfterHeader.flatMap(ApiErrorParser::parseRetryAfter).orElse(null));
        }
        return new ApiException(provider, code, status, message, body);
    }

    /**
     * Extracts the error document starting at the first '{' of {@code raw}
     * (or at a leading '[' for the array form).
     * Empty when no error document can be found.
     */
    public Optional<ErrorBody> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();

        int start = firstJsonStart(raw);
        if (start < 0) return Optional.empty();

        JsonNode root;
        try {
            root = objectMapper.readTree(raw.substring(start));
        } catch (JsonProcessingException e) {
            log.debug("[ApiErrorParser] Error body is not JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (root == null) return Optional.empty();
        if (root.isArray() && !root.isEmpty()) root = root.get(0);

        JsonNode error = root.get("error");
        if (error == null || error.isNull()) return Optional.empty();

        if (error.isTextual()) {
            return Optional.of(new ErrorBody(error.asText(), 0, null));
        }

        String message = error.path("message").asText(null);
        int    code    = error.path("code").asInt(0);
        String status  = error.hasNonNull("status")
                ? error.get("status").asText()
                : error.path("type").asText(null);

        if (message != null) {
            message = unwrapNested(message);
        }
        return Optional.of(new ErrorBody(message, code, status));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private String unwrapNested(String message) {
        String trimmed = message.trim();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) return message;
        try {
            JsonNode nested = objectMapper.readTree(trimmed);
            if (nested.isArray() && !nested.isEmpty()) nested = nested.get(0);
            JsonNode inner = nested.path("error").path("message");
            return inner.isTextual() ? inner.asText() : message;
        } catch (JsonProcessingException e) {
            return message;
        }
    }

    private static boolean isQuotaExceeded(int httpStatus, String status, String message) {
        return httpStatus == 429
                || "RESOURCE_EXHAUSTED".equals(status)
                || "rate_limit_error".equals(status)
                || (message != null && message.contains(QUOTA_METRIC_MARKER));
    }

    private static int firstJsonStart(String raw) {
        if (raw.stripLeading().startsWith("[")) return raw.indexOf('[');
        return raw.indexOf('{');
    }

    private static String fallbackMessage(int httpStatus, String body) {
        if (body == null || body.isBlank()) return "HTTP " + httpStatus;
        return body.length() > 2048 ? body.substring(0, 2048) : body;
    }

    static Optional<Duration> parseRetryAfter(String value) {
        try {
            return Optional.of(Duration.ofSeconds(Long.parseLong(value.trim())));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
