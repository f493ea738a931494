package com.flowtrace.flowtrace_backend.controller;

import com.flowtrace.flowtrace_backend.exception.InvalidStateException;
import com.flowtrace.flowtrace_backend.exception.NotFoundException;
import com.flowtrace.flowtrace_backend.live.TraceBroadcaster;
import com.flowtrace.flowtrace_backend.live.TraceSubscription;
import com.flowtrace.flowtrace_backend.model.domain.ExecutionStatus;
import com.flowtrace.flowtrace_backend.model.domain.StepOutcome;
import com.flowtrace.flowtrace_backend.model.domain.WorkflowType;
import com.flowtrace.flowtrace_backend.model.trace.ExecutionFilter;
import com.flowtrace.flowtrace_backend.model.trace.ExecutionSummary;
import com.flowtrace.flowtrace_backend.model.trace.ExecutionTrace;
import com.flowtrace.flowtrace_backend.service.EntityStore;
import com.flowtrace.flowtrace_backend.service.ExecutionLedger;
import com.flowtrace.flowtrace_backend.service.SummaryProjector;
import com.flowtrace.flowtrace_backend.service.TraceAssembler;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {ExecutionController.class, ExecutionLedgerController.class})
class ExecutionControllerTest {

    private static final UUID EXECUTION_ID = UUID.fromString("22222222-2222-2222-2222-222222222222");
    private static final UUID INITIATIVE_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SummaryProjector summaryProjector;
    @MockBean
    private TraceAssembler traceAssembler;
    @MockBean
    private ExecutionLedger ledger;
    @MockBean
    private EntityStore entityStore;
    @MockBean
    private TraceBroadcaster broadcaster;

    @Test
    void getSummary_shouldRenderWireNames() throws Exception {
        when(summaryProjector.project(EXECUTION_ID)).thenReturn(summary(ExecutionStatus.COMPLETED));

        mockMvc.perform(get("/api/executions/{id}/summary", EXECUTION_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.workflowType").value("research-only"))
                .andExpect(jsonPath("$.researchEntries").value(3))
                .andExpect(jsonPath("$.durationSeconds").value(90.0));
    }

    @Test
    void getTrace_shouldReturn404ForUnknownExecution() throws Exception {
        when(traceAssembler.assemble(EXECUTION_ID)).thenThrow(NotFoundException.execution(EXECUTION_ID));

        mockMvc.perform(get("/api/executions/{id}", EXECUTION_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ERR-NF-001"));
    }

    @Test
    void getTrace_shouldIncludeWarningsAndPartialFlag() throws Exception {
        when(traceAssembler.assemble(EXECUTION_ID)).thenReturn(new ExecutionTrace(summary(ExecutionStatus.RUNNING),
                List.of(), List.of(), List.of(), List.of(), List.of(), List.of()));

        mockMvc.perform(get("/api/executions/{id}", EXECUTION_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.executionId").value(EXECUTION_ID.toString()))
                .andExpect(jsonPath("$.warnings").isEmpty());
    }

    @Test
    void listSummaries_shouldPassFilterThrough() throws Exception {
        when(summaryProjector.projectMany(any(ExecutionFilter.class))).thenReturn(List.of());

        mockMvc.perform(get("/api/executions/summaries")
                        .param("initiativeId", INITIATIVE_ID.toString())
                        .param("status", "failed")
                        .param("limit", "5"))
                .andExpect(status().isOk());

        verify(summaryProjector).projectMany(new ExecutionFilter(INITIATIVE_ID, ExecutionStatus.FAILED, 5));
    }

    @Test
    void listSummaries_shouldRejectUnknownStatus() throws Exception {
        mockMvc.perform(get("/api/executions/summaries").param("status", "paused"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("ERR-VAL-001"));
    }

    @Test
    void getCampaigns_shouldReturn404ForUnknownExecution() throws Exception {
        when(ledger.get(EXECUTION_ID)).thenThrow(NotFoundException.execution(EXECUTION_ID));

        mockMvc.perform(get("/api/executions/{id}/campaigns", EXECUTION_ID))
                .andExpect(status().isNotFound());
        Mockito.verifyNoInteractions(entityStore);
    }

    @Test
    void start_shouldReturnCreatedSummary() throws Exception {
        when(ledger.startExecution(eq(INITIATIVE_ID), eq(WorkflowType.RESEARCH_ONLY), anyMap())).thenReturn(EXECUTION_ID);
        when(summaryProjector.project(EXECUTION_ID)).thenReturn(summary(ExecutionStatus.RUNNING));

        mockMvc.perform(post("/api/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"initiativeId":"%s","workflowType":"research-only","metadata":{"trigger":"manual"}}
                                """.formatted(INITIATIVE_ID)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("running"));
    }

    @Test
    void recordStep_shouldAcceptOutcomeAliases() throws Exception {
        when(summaryProjector.project(EXECUTION_ID)).thenReturn(summary(ExecutionStatus.RUNNING));

        mockMvc.perform(post("/api/executions/{id}/steps", EXECUTION_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"step\":\"Research\",\"outcome\":\"success\"}"))
                .andExpect(status().isOk());

        verify(ledger).recordStepOutcome(EXECUTION_ID, "Research", StepOutcome.COMPLETED, null);
    }

    @Test
    void finalize_shouldReturn409ForConflictingStatus() throws Exception {
        when(ledger.finalizeExecution(EXECUTION_ID, ExecutionStatus.FAILED))
                .thenThrow(new InvalidStateException("Execution is already completed"));

        mockMvc.perform(post("/api/executions/{id}/finalize", EXECUTION_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"failed\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ERR-STATE-001"));
    }

    @Test
    void watch_shouldDescribeSubscription() throws Exception {
        UUID subscriptionId = UUID.randomUUID();
        TraceSubscription subscription = Mockito.mock(TraceSubscription.class);
        when(subscription.getId()).thenReturn(subscriptionId);
        when(subscription.getExecutionId()).thenReturn(EXECUTION_ID);
        when(subscription.isActive()).thenReturn(true);
        when(subscription.getInitialTrace()).thenReturn(new ExecutionTrace(summary(ExecutionStatus.RUNNING),
                List.of(), List.of(), List.of(), List.of(), List.of(), List.of()));
        when(broadcaster.start(EXECUTION_ID)).thenReturn(subscription);

        mockMvc.perform(post("/api/executions/{id}/watch", EXECUTION_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.subscriptionId").value(subscriptionId.toString()))
                .andExpect(jsonPath("$.active").value(true))
                .andExpect(jsonPath("$.trace.summary.status").value("running"));
    }

    @Test
    void unwatch_shouldReturn404WhenNothingIsBroadcasting() throws Exception {
        when(broadcaster.stop(EXECUTION_ID)).thenReturn(false);

        mockMvc.perform(delete("/api/executions/{id}/watch", EXECUTION_ID))
                .andExpect(status().isNotFound());
    }

    private static ExecutionSummary summary(ExecutionStatus status) {
        Instant started = Instant.parse("2024-05-01T10:00:00Z");
        return new ExecutionSummary(EXECUTION_ID, INITIATIVE_ID, WorkflowType.RESEARCH_ONLY, status,
                started, status.isTerminal() ? started.plusSeconds(90) : null, 90.0,
                0, 0, 0, 3, 0, List.of("Research"), List.of(), List.of(), List.of(), Map.of());
    }
}
