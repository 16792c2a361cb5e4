package com.openforge.convo.agent;

import com.openforge.convo.llm.fallback.ModelSelection;
import com.openforge.convo.llm.model.CanonicalMessage;
import com.openforge.convo.llm.model.GenerationConfig;
import com.openforge.convo.llm.provider.ProviderAdapters;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * One conversation: its history, its active model and the adapters it has
 * opened.  Driven by a single thread; only the cancellation token is touched
 * from elsewhere.
 *
 * Closing the session closes every adapter it used.
 */
@Slf4j
@Getter
public class Session implements ModelSelection, AutoCloseable {

    private final String                 id = UUID.randomUUID().toString().substring(0, 8);
    private final String                 fallbackModel;
    private final int                    maxTurns;
    private final boolean                streaming;
    private final String                 systemInstruction;
    private final GenerationConfig       generationConfig;
    private final CancellationToken      cancellation;
    private final ProviderAdapters       adapters;
    private final List<CanonicalMessage> history = new ArrayList<>();
    private final List<Turn>             turns   = new ArrayList<>();
    private volatile String              activeModel;
    private volatile TurnState           state   = TurnState.AWAITING_MODEL;
    private int                          callSequence;

    public Session(String model,
                   String fallbackModel,
                   int maxTurns,
                   boolean streaming,
                   String systemInstruction,
                   GenerationConfig generationConfig,
                   CancellationToken cancellation,
                   ProviderAdapters adapters) {
        this.activeModel       = model;
        this.fallbackModel     = fallbackModel;
        this.maxTurns          = maxTurns;
        this.streaming         = streaming;
        this.systemInstruction = systemInstruction;
        this.generationConfig  = generationConfig;
        this.cancellation      = cancellation;
        this.adapters          = adapters;
    }

    // ── ModelSelection ───────────────────────────────────────────────────────

    @Override
    public String activeModel() {
        return activeModel;
    }

    @Override
    public String fallbackModel() {
        return fallbackModel;
    }

    @Override
    public void switchActiveModel(String modelId) {
        log.info("[Session:{}] Active model {} -> {}", id, activeModel, modelId);
        this.activeModel = modelId;
    }

    // ── History and turns ────────────────────────────────────────────────────

    public List<CanonicalMessage> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public List<Turn> getTurns() {
        return Collections.unmodifiableList(turns);
    }

    void append(CanonicalMessage message) {
        history.add(message);
    }

    Turn beginTurn() {
        Turn turn = new Turn(turns.size(), history);
        turns.add(turn);
        return turn;
    }

    int turnCount() {
        return turns.size();
    }

    /** Next value for a synthesized tool-call id. */
    int nextCallSequence() {
        return callSequence++;
    }

    void transition(TurnState next) {
        log.debug("[Session:{}] {} -> {}", id, state, next);
        this.state = next;
    }

    @Override
    public void close() {
        adapters.close();
    }
}
