package com.openforge.convo.llm.provider.ollama;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.convo.llm.exception.ApiErrorParser;
import com.openforge.convo.llm.provider.ProviderId;
import com.openforge.convo.llm.stream.ProviderDelta;
import com.openforge.convo.llm.stream.StreamShape;

import java.util.Optional;

/**
 * One NDJSON object per line:
 *
 *   {"message":{"role":"assistant","content":"Hel"},"done":false}
 *   {"message":{"role":"assistant","content":""},"done":true,"done_reason":"stop","prompt_eval_count":9,"eval_count":3}
 */
class OllamaStreamShape implements StreamShape<JsonNode> {

    private final OllamaAdapter  adapter;
    private final ApiErrorParser errorParser;

    OllamaStreamShape(OllamaAdapter adapter, ApiErrorParser errorParser) {
        this.adapter     = adapter;
        this.errorParser = errorParser;
    }

    @Override
    public ProviderDelta interpret(JsonNode line) {
        if (line.hasNonNull("error")) {
            throw errorParser.toException(ProviderId.OLLAMA, 500, line.toString(), Optional.empty());
        }
        JsonNode message = line.path("message");
        boolean  done    = line.path("done").asBoolean(false);
        return new ProviderDelta(
                message.path("content").asText(""),
                adapter.readToolCalls(message),
                done ? OllamaAdapter.readUsage(line) : null,
                done ? OllamaAdapter.mapDoneReason(line.path("done_reason").asText(null)) : null,
                done);
    }
}
