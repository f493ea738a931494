package com.flowtrace.flowtrace_backend.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowtrace.flowtrace_backend.model.domain.Execution;
import com.flowtrace.flowtrace_backend.model.trace.ExecutionTrace;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Component
public class ExecutionEventPublisher {

    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectProvider<RedisWebSocketBridge> redisBridgeProvider;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final ObjectMapper objectMapper;

    // Inspector subscribes to /topic/execution/{executionId} for ledger notifications
    // and /topic/execution/{executionId}/trace for live traces
    private static final String TOPIC = "/topic/execution/";

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    public ExecutionEventPublisher(SimpMessagingTemplate messagingTemplate,
                                   ObjectProvider<RedisWebSocketBridge> redisBridgeProvider,
                                   ApplicationEventPublisher applicationEventPublisher,
                                   ObjectMapper objectMapper) {
        this.messagingTemplate = messagingTemplate;
        this.redisBridgeProvider = redisBridgeProvider;
        this.applicationEventPublisher = applicationEventPublisher;
        this.objectMapper = objectMapper;
    }

    /** Called by the ledger inside its transaction; listeners see the event once it commits. */
    public void executionChanged(Execution execution, ExecutionChange change, String step) {
        applicationEventPublisher.publishEvent(
                new ExecutionChangedEvent(execution.getId(), execution.getStatus(), change, step));
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void forwardToSubscribers(ExecutionChangedEvent event) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("executionId", event.executionId().toString());
        payload.put("status", event.status().wireName());
        payload.put("change", event.change().name());
        payload.put("step", event.step() != null ? event.step() : "");
        publish(TOPIC + event.executionId(), payload);
    }

    public void traceUpdated(UUID executionId, ExecutionTrace trace) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("type", "trace");
        payload.put("trace", objectMapper.convertValue(trace, JSON_OBJECT));
        publish(TOPIC + executionId + "/trace", payload);
    }

    public void traceFailed(UUID executionId, Throwable error) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("type", "error");
        payload.put("error", error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        publish(TOPIC + executionId + "/trace", payload);
    }

    private void publish(String destination, Map<String, Object> payload) {
        RedisWebSocketBridge bridge = redisBridgeProvider.getIfAvailable();
        log.debug("Publishing to destination={} via={}", destination, bridge != null ? "Redis" : "Direct");
        if (bridge != null) {
            bridge.publish(destination, payload);
        } else {
            messagingTemplate.convertAndSend(destination, payload);
        }
    }
}
