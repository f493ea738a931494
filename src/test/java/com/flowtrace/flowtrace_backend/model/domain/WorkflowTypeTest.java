package com.flowtrace.flowtrace_backend.model.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowTypeTest {

    @Test
    void fromSlug_shouldAcceptSlugAliasAndEnumName() {
        assertThat(WorkflowType.fromSlug("full-campaign")).isEqualTo(WorkflowType.FULL_CAMPAIGN);
        assertThat(WorkflowType.fromSlug("full-cycle")).isEqualTo(WorkflowType.FULL_CAMPAIGN);
        assertThat(WorkflowType.fromSlug("FULL_CAMPAIGN")).isEqualTo(WorkflowType.FULL_CAMPAIGN);
        assertThat(WorkflowType.fromSlug(" content-only ")).isEqualTo(WorkflowType.CONTENT_CREATION_ONLY);
    }

    @Test
    void fromSlug_shouldRejectUnknownWorkflow() {
        assertThatThrownBy(() -> WorkflowType.fromSlug("ads-only"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ads-only");
    }

    @Test
    void isSatisfiedBy_shouldRequireEveryExpectedStepInAnyOrder() {
        assertThat(WorkflowType.RESEARCH_THEN_PLANNING.isSatisfiedBy(List.of("Research"))).isFalse();
        assertThat(WorkflowType.RESEARCH_THEN_PLANNING.isSatisfiedBy(List.of("Planning", "Research"))).isTrue();
        assertThat(WorkflowType.RESEARCH_ONLY.isSatisfiedBy(null)).isFalse();
    }

    @Test
    void stepOutcome_shouldAcceptEngineSynonyms() {
        assertThat(StepOutcome.fromWireName("succeeded")).isEqualTo(StepOutcome.COMPLETED);
        assertThat(StepOutcome.fromWireName("FAILURE")).isEqualTo(StepOutcome.FAILED);
    }
}
