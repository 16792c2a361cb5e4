package com.openforge.convo.llm.fallback;

import com.openforge.convo.llm.exception.AbortedException;
import com.openforge.convo.llm.exception.ApiException;
import com.openforge.convo.llm.exception.LlmException;
import com.openforge.convo.llm.exception.QuotaExceededException;
import com.openforge.convo.llm.exception.QuotaKind;
import com.openforge.convo.llm.exception.TransportException;
import com.openforge.convo.llm.provider.ProviderId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class FallbackPolicyTest {

    private final FallbackPolicy policy = new FallbackPolicy();

    @Test
    @DisplayName("Pro quota on the active model switches to the fallback and records the notice")
    void proQuotaSwitches() {
        // Given
        Selection selection = new Selection("gemini-2.5-pro", "gemini-2.5-flash");

        // When
        FallbackDecision decision = policy.decide(selection, quota(QuotaKind.PRO), false);

        // Then
        assertTrue(decision.isSwitch());
        assertEquals(ErrorCategory.PRO_QUOTA, decision.category());
        assertEquals("gemini-2.5-pro", decision.fromModel());
        assertEquals("gemini-2.5-flash", decision.toModel());
        assertEquals("gemini-2.5-flash", selection.activeModel());
        assertNotNull(decision.notice());
    }

    @Test
    @DisplayName("Generic quota also switches, even when wrapped in another exception")
    void wrappedGenericQuotaSwitches() {
        Selection selection = new Selection("gemini-2.5-pro", "gemini-2.5-flash");
        LlmException wrapped = new LlmException("stream failed", quota(QuotaKind.GENERIC));

        FallbackDecision decision = policy.decide(selection, wrapped, false);

        assertTrue(decision.isSwitch());
        assertEquals(ErrorCategory.GENERIC_QUOTA, decision.category());
    }

    @Test
    @DisplayName("A second quota failure in the same turn fails")
    void onlyOncePerTurn() {
        Selection selection = new Selection("gemini-2.5-flash", "gemini-2.5-flash-lite");

        FallbackDecision decision = policy.decide(selection, quota(QuotaKind.GENERIC), true);

        assertFalse(decision.isSwitch());
        assertEquals("gemini-2.5-flash", selection.activeModel());
    }

    @Test
    @DisplayName("No fallback, or a fallback equal to the active model, fails")
    void noUsableFallback() {
        assertFalse(policy.decide(new Selection("gpt-4o", null), quota(QuotaKind.GENERIC), false).isSwitch());
        assertFalse(policy.decide(new Selection("gpt-4o", " "), quota(QuotaKind.GENERIC), false).isSwitch());
        assertFalse(policy.decide(new Selection("gpt-4o", "gpt-4o"), quota(QuotaKind.GENERIC), false).isSwitch());
    }

    @Test
    @DisplayName("Non-quota failures are never retried")
    void nonQuotaFails() {
        Selection selection = new Selection("gemini-2.5-pro", "gemini-2.5-flash");

        assertEquals(ErrorCategory.API, policy.decide(selection,
                new ApiException(ProviderId.GEMINI, 400, "INVALID_ARGUMENT", "bad", null), false).category());
        assertEquals(ErrorCategory.TRANSPORT, policy.decide(selection,
                new TransportException("reset", new IOException()), false).category());
        assertEquals(ErrorCategory.ABORT, policy.decide(selection,
                new AbortedException("cancelled"), false).category());
        assertEquals(ErrorCategory.FATAL, policy.decide(selection,
                new IllegalStateException("bug"), false).category());
        assertEquals("gemini-2.5-pro", selection.activeModel());
    }

    private static QuotaExceededException quota(QuotaKind kind) {
        return new QuotaExceededException(ProviderId.GEMINI, 429, "RESOURCE_EXHAUSTED",
                "Quota exceeded for quota metric 'Gemini 2.5 Pro Requests'", null, kind, null);
    }

    private static final class Selection implements ModelSelection {
        private       String active;
        private final String fallback;

        Selection(String active, String fallback) {
            this.active   = active;
            this.fallback = fallback;
        }

        @Override public String activeModel()   { return active; }
        @Override public String fallbackModel() { return fallback; }
        @Override public void switchActiveModel(String modelId) { this.active = modelId; }
    }
}
