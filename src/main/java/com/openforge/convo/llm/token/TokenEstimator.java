package com.openforge.convo.llm.token;

import com.openforge.convo.llm.model.CanonicalMessage;
import com.openforge.convo.llm.model.ChatRequest;
import com.openforge.convo.llm.model.FunctionCallPart;
import com.openforge.convo.llm.model.FunctionResponsePart;
import com.openforge.convo.llm.model.Part;
import com.openforge.convo.llm.model.TextPart;

/**
 * Character-based token estimate: ceil(characters / 4).
 *
 * Characters are Unicode code points, so a surrogate pair counts once.
 * Function-call arguments and tool outputs count as their text rendering.
 * Pure and monotonic in the input length; never touches the network.
 */
public final class TokenEstimator {

    private static final int CHARS_PER_TOKEN = 4;

    private TokenEstimator() {
    }

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) return 0;
        return ceilDiv(text.codePointCount(0, text.length()));
    }

    public static int estimate(ChatRequest request) {
        long chars = 0;
        if (request.systemInstruction() != null) {
            chars += codePoints(request.systemInstruction());
        }
        for (CanonicalMessage message : request.messages()) {
            for (Part part : message.parts()) {
                chars += codePoints(render(part));
            }
        }
        return ceilDiv(chars);
    }

    private static String render(Part part) {
        if (part instanceof TextPart text) {
            return text.text();
        }
        if (part instanceof FunctionCallPart call) {
            return call.call().name() + String.valueOf(call.call().args());
        }
        if (part instanceof FunctionResponsePart response) {
            return response.result().contentForModel();
        }
        return "";
    }

    private static long codePoints(String s) {
        return s == null ? 0 : s.codePointCount(0, s.length());
    }

    private static int ceilDiv(long chars) {
        return (int) ((chars + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN);
    }
}
