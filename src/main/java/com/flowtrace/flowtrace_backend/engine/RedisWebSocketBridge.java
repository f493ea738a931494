package com.flowtrace.flowtrace_backend.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Relays STOMP messages through Redis Pub/Sub so every instance delivers them.
 * A trace pushed by the instance that owns a subscription reaches inspector clients connected to any other instance.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisWebSocketBridge implements MessageListener {

    private final StringRedisTemplate redisTemplate;
    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper objectMapper;
    private final ChannelTopic channel;

    public void publish(String destination, Map<String, Object> payload) {
        try {
            String json = objectMapper.writeValueAsString(new StompMessage(destination, payload));
            redisTemplate.convertAndSend(channel.getTopic(), json);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize WebSocket message for {}", destination, e);
        } catch (RuntimeException e) {
            // Redis down: this instance's own clients still get the message
            log.warn("Redis publish failed for {}, delivering locally: {}", destination, e.getMessage());
            messagingTemplate.convertAndSend(destination, payload);
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        try {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            StompMessage stomp = objectMapper.readValue(body, StompMessage.class);
            messagingTemplate.convertAndSend(stomp.destination(), stomp.payload());
        } catch (Exception e) {
            log.error("Failed to forward Redis message to WebSocket", e);
        }
    }

    record StompMessage(String destination, Map<String, Object> payload) {}
}
