package com.memflow.memflow_backend.model.workflow;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum NodeType {
    START("start"),
    END("end"),
    LLM("llm"),
    AGENT("agent"),
    IF_ELSE("if-else"),
    TRANSFORM("transform"),
    KNOWLEDGE_RETRIEVAL("knowledge-retrieval"),
    ASSIGNER("assigner"),
    HTTP_REQUEST("http-request"),
    JINJA_RENDER("jinja-render"),
    PARAMETER_EXTRACTOR("parameter-extractor"),
    QUESTION_CLASSIFIER("question-classifier"),
    VARIABLE_AGGREGATOR("variable-aggregator"),
    CONDITION("condition");   // routed by the graph itself, never instantiated

    private final String tag;

    NodeType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /** Looks up a type by its configuration tag; {@code null} when the tag is unknown. */
    public static NodeType fromTag(String tag) {
        if (tag == null) return null;
        return Arrays.stream(values())
                .filter(t -> t.tag.equalsIgnoreCase(tag.trim()))
                .findFirst()
                .orElse(null);
    }
}
