package com.memflow.memflow_backend.model.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Partial text a node has emitted so far, in emission order.
 * {@code fullContent} is derived from the chunks and only written out.
 */
@JsonIgnoreProperties(value = "fullContent", allowGetters = true)
public class StreamingBuffer {

    private final List<String> chunks = new ArrayList<>();
    private final StringBuilder content = new StringBuilder();

    public StreamingBuffer() {
    }

    @JsonCreator
    public StreamingBuffer(@JsonProperty("chunks") List<String> chunks) {
        if (chunks != null) {
            chunks.forEach(this::append);
        }
    }

    public void append(String chunk) {
        chunks.add(chunk);
        content.append(chunk);
    }

    public List<String> getChunks() {
        return Collections.unmodifiableList(chunks);
    }

    public String getFullContent() {
        return content.toString();
    }
}
