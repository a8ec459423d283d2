package com.memflow.memflow_backend.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Bridges execution events through Redis Pub/Sub so all instances receive them.
 * When a run executes on instance A but the client is connected to instance B,
 * publishing to Redis lets instance B deliver the event to the client.
 * Registered by {@link com.memflow.memflow_backend.config.RedisWebSocketConfig}.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisWebSocketBridge implements MessageListener {

    public static final String REDIS_CHANNEL = "memflow:websocket:topic";

    private final StringRedisTemplate redisTemplate;
    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper objectMapper;

    public void publish(String destination, Map<String, Object> payload) {
        try {
            String json = objectMapper.writeValueAsString(new StompMessage(destination, payload));
            redisTemplate.convertAndSend(REDIS_CHANNEL, json);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize WebSocket message for {}", destination, e);
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        try {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            StompMessage stomp = objectMapper.readValue(body, StompMessage.class);
            log.debug("Forwarding Redis message to {}", stomp.destination());
            messagingTemplate.convertAndSend(stomp.destination(), stomp.payload());
        } catch (IOException e) {
            log.error("Failed to forward Redis message to WebSocket", e);
        }
    }

    record StompMessage(String destination, Map<String, Object> payload) {}
}
