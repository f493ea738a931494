package com.flowtrace.flowtrace_backend.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowtrace.flowtrace_backend.model.domain.ExecutionStatus;
import com.flowtrace.flowtrace_backend.model.domain.WorkflowType;
import com.flowtrace.flowtrace_backend.model.trace.ExecutionSummary;
import com.flowtrace.flowtrace_backend.model.trace.ExecutionTrace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ExecutionEventPublisherTest {

    private static final UUID EXECUTION_ID = UUID.fromString("22222222-2222-2222-2222-222222222222");

    @Mock
    private SimpMessagingTemplate messagingTemplate;
    @Mock
    private ObjectProvider<RedisWebSocketBridge> redisBridgeProvider;
    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private ExecutionEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new ExecutionEventPublisher(messagingTemplate, redisBridgeProvider, applicationEventPublisher,
                new ObjectMapper().findAndRegisterModules());
    }

    @Test
    void traceUpdated_shouldSendTraceAsJsonObjectToTraceTopic() {
        publisher.traceUpdated(EXECUTION_ID, trace());

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq("/topic/execution/" + EXECUTION_ID + "/trace"), payload.capture());
        assertThat(payload.getValue()).asInstanceOf(MAP)
                .containsEntry("type", "trace")
                .extractingByKey("trace")
                .asInstanceOf(MAP)
                .containsKeys("summary", "campaigns", "warnings");
    }

    @Test
    void traceFailed_shouldFallBackToExceptionTypeWhenMessageMissing() {
        publisher.traceFailed(EXECUTION_ID, new IllegalStateException());

        verify(messagingTemplate).convertAndSend("/topic/execution/" + EXECUTION_ID + "/trace",
                (Object) Map.of("type", "error", "error", "IllegalStateException"));
    }

    private static ExecutionTrace trace() {
        Instant started = Instant.parse("2024-05-01T10:00:00Z");
        ExecutionSummary summary = new ExecutionSummary(EXECUTION_ID, UUID.randomUUID(), WorkflowType.PLANNING_ONLY,
                ExecutionStatus.RUNNING, started, null, 12.0,
                1, 0, 0, 0, 0, List.of("Planning"), List.of(), List.of(), List.of(), Map.of());
        return new ExecutionTrace(summary, List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
