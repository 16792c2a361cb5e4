package com.openforge.convo.llm.model;

public record TextPart(String text) implements Part {

    public TextPart {
        text = text == null ? "" : text;
    }
}
