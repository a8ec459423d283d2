package com.memflow.memflow_backend.model.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StreamingBufferTest {

    @Test
    @DisplayName("full content follows every appended chunk")
    void accumulatesChunks() {
        StreamingBuffer buffer = new StreamingBuffer();
        for (int i = 0; i < 10_000; i++) {
            buffer.append("tok ");
        }

        assertEquals(10_000, buffer.getChunks().size());
        assertEquals(40_000, buffer.getFullContent().length());
        assertTrue(buffer.getFullContent().startsWith("tok tok "));
        assertThrows(UnsupportedOperationException.class, () -> buffer.getChunks().add("x"));
    }

    @Test
    @DisplayName("a stored snapshot is rebuilt from its chunks")
    void readsBackFromSnapshot() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        StreamingBuffer buffer = new StreamingBuffer(List.of("Hel", "lo"));

        String json = mapper.writeValueAsString(buffer);
        StreamingBuffer restored = mapper.readValue(json, StreamingBuffer.class);

        assertTrue(json.contains("\"fullContent\":\"Hello\""));
        assertEquals(List.of("Hel", "lo"), restored.getChunks());
        assertEquals("Hello", restored.getFullContent());
    }
}
