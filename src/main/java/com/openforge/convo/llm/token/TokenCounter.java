package com.openforge.convo.llm.token;

import com.openforge.convo.llm.exception.AbortedException;
import com.openforge.convo.llm.exception.LlmException;
import com.openforge.convo.llm.model.ChatRequest;
import com.openforge.convo.llm.provider.ProviderAdapter;
import com.openforge.convo.llm.provider.ProviderClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Counts prompt tokens with the provider's own endpoint where one exists,
 * and with {@link TokenEstimator} everywhere else.  An aborted count is
 * rethrown, never replaced by an estimate.
 */
@Slf4j
@Component
public class TokenCounter {

    public int count(ProviderAdapter adapter, ChatRequest request) {
        if (!ProviderClassifier.supportsNativeTokenCounting(adapter.providerId())) {
            return TokenEstimator.estimate(request);
        }
        try {
            return adapter.countTokens(request);
        } catch (AbortedException e) {
            throw e;
        } catch (UnsupportedOperationException | LlmException e) {
            log.warn("[TokenCounter:{}] Native count failed, using estimate: {}",
                    adapter.providerId(), e.getMessage());
            return TokenEstimator.estimate(request);
        }
    }
}
