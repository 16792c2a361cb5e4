package com.openforge.convo.llm.fallback;

/** The part of a session the fallback policy may read and change. */
public interface ModelSelection {

    String activeModel();

    /** Null or blank when no fallback is available. */
    String fallbackModel();

    void switchActiveModel(String modelId);
}
