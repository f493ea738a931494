package com.flowtrace.flowtrace_backend.service;

import com.flowtrace.flowtrace_backend.config.FlowtraceProperties;
import com.flowtrace.flowtrace_backend.exception.NotFoundException;
import com.flowtrace.flowtrace_backend.model.domain.Campaign;
import com.flowtrace.flowtrace_backend.model.domain.EntityKind;
import com.flowtrace.flowtrace_backend.model.domain.ExecutionStatus;
import com.flowtrace.flowtrace_backend.model.domain.ResearchEntry;
import com.flowtrace.flowtrace_backend.model.domain.WorkflowType;
import com.flowtrace.flowtrace_backend.model.trace.ExecutionSummary;
import com.flowtrace.flowtrace_backend.model.trace.ExecutionTrace;
import com.flowtrace.flowtrace_backend.model.trace.TraceWarning;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TraceAssemblerTest {

    private static final UUID EXECUTION_ID = UUID.fromString("22222222-2222-2222-2222-222222222222");
    private static final UUID INITIATIVE_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");

    @Mock
    private SummaryProjector summaryProjector;
    @Mock
    private EntityStore entityStore;

    private TraceAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new TraceAssembler(summaryProjector, entityStore, Runnable::run, new FlowtraceProperties());
    }

    @Test
    void assemble_shouldFailWhenExecutionDoesNotExist() {
        when(summaryProjector.projectAsync(EXECUTION_ID))
                .thenReturn(CompletableFuture.failedFuture(NotFoundException.execution(EXECUTION_ID)));

        assertThatThrownBy(() -> assembler.assemble(EXECUTION_ID))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining(EXECUTION_ID.toString());
    }

    @Test
    void assemble_shouldReturnEmptyCollectionsWhenNothingWasProduced() {
        when(summaryProjector.projectAsync(EXECUTION_ID))
                .thenReturn(CompletableFuture.completedFuture(summary(ExecutionStatus.RUNNING, 0)));

        ExecutionTrace trace = assembler.assemble(EXECUTION_ID);

        assertThat(trace.campaigns()).isEmpty();
        assertThat(trace.adSets()).isEmpty();
        assertThat(trace.posts()).isEmpty();
        assertThat(trace.research()).isEmpty();
        assertThat(trace.mediaFiles()).isEmpty();
        assertThat(trace.isPartial()).isFalse();
    }

    @Test
    void assemble_shouldCollectEntitiesTaggedWithExecution() {
        ResearchEntry first = research("Competitor scan");
        ResearchEntry second = research("Audience trends");
        when(summaryProjector.projectAsync(EXECUTION_ID))
                .thenReturn(CompletableFuture.completedFuture(summary(ExecutionStatus.COMPLETED, 2)));
        when(entityStore.research(EXECUTION_ID)).thenReturn(List.of(second, first));

        ExecutionTrace trace = assembler.assemble(EXECUTION_ID);

        assertThat(trace.research()).containsExactly(second, first);
        assertThat(trace.summary().researchEntries()).isEqualTo(2);
        assertThat(trace.entityIds()).containsExactly(second.getId(), first.getId());
    }

    @Test
    void assemble_shouldDegradeFailedCollectionToWarning() {
        Campaign campaign = new Campaign();
        campaign.setId(UUID.randomUUID());
        campaign.setExecutionId(EXECUTION_ID);
        when(summaryProjector.projectAsync(EXECUTION_ID))
                .thenReturn(CompletableFuture.completedFuture(summary(ExecutionStatus.RUNNING, 0)));
        when(entityStore.campaigns(EXECUTION_ID)).thenReturn(List.of(campaign));
        when(entityStore.posts(EXECUTION_ID)).thenThrow(new IllegalStateException("connection reset"));

        ExecutionTrace trace = assembler.assemble(EXECUTION_ID);

        assertThat(trace.isPartial()).isTrue();
        assertThat(trace.campaigns()).containsExactly(campaign);
        assertThat(trace.posts()).isEmpty();
        assertThat(trace.warnings()).singleElement().satisfies(warning -> {
            assertThat(warning.kind()).isEqualTo(EntityKind.POST);
            assertThat(warning.code()).isEqualTo("ERR-FETCH-001");
            assertThat(warning.section()).isEqualTo("posts");
            assertThat(warning.message()).contains("connection reset");
        });
    }

    @Test
    void assemble_shouldListWarningsInSectionOrder() {
        when(summaryProjector.projectAsync(EXECUTION_ID))
                .thenReturn(CompletableFuture.completedFuture(summary(ExecutionStatus.RUNNING, 0)));
        when(entityStore.mediaFiles(EXECUTION_ID)).thenThrow(new IllegalStateException("bucket offline"));
        when(entityStore.adSets(EXECUTION_ID)).thenThrow(new IllegalStateException("timeout"));

        ExecutionTrace trace = assembler.assemble(EXECUTION_ID);

        assertThat(trace.warnings()).extracting(TraceWarning::kind)
                .containsExactly(EntityKind.AD_SET, EntityKind.MEDIA_FILE);
    }

    @Test
    void assemble_shouldGiveSameTraceWhenNothingChanged() {
        ResearchEntry entry = research("Keyword study");
        ExecutionSummary summary = summary(ExecutionStatus.COMPLETED, 1);
        when(summaryProjector.projectAsync(EXECUTION_ID)).thenReturn(CompletableFuture.completedFuture(summary));
        when(entityStore.research(EXECUTION_ID)).thenReturn(List.of(entry));

        assertThat(assembler.assemble(EXECUTION_ID)).isEqualTo(assembler.assemble(EXECUTION_ID));
    }

    private static ResearchEntry research(String topic) {
        ResearchEntry entry = new ResearchEntry();
        entry.setId(UUID.randomUUID());
        entry.setInitiativeId(INITIATIVE_ID);
        entry.setExecutionId(EXECUTION_ID);
        entry.setExecutionStep("Research");
        entry.setTopic(topic);
        return entry;
    }

    private static ExecutionSummary summary(ExecutionStatus status, long researchEntries) {
        Instant started = Instant.parse("2024-05-01T10:00:00Z");
        return new ExecutionSummary(EXECUTION_ID, INITIATIVE_ID, WorkflowType.RESEARCH_ONLY, status,
                started, status.isTerminal() ? started.plusSeconds(90) : null, 90.0,
                0, 0, 0, researchEntries, 0,
                List.of(), List.of(), List.of(), List.of(), Map.of());
    }
}
