package com.flowtrace.flowtrace_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Workflows the upstream orchestrator can run, each with the ordered steps it is expected to complete.
 * An execution becomes {@link ExecutionStatus#COMPLETED} on its own once every expected step has been recorded as completed.
 */
public enum WorkflowType {

    RESEARCH_ONLY("research-only", List.of(Steps.RESEARCH)),
    PLANNING_ONLY("planning-only", List.of(Steps.PLANNING)),
    CONTENT_CREATION_ONLY("content-creation-only", List.of(Steps.CONTENT_CREATION), "content-only"),
    RESEARCH_THEN_PLANNING("research-then-planning", List.of(Steps.RESEARCH, Steps.PLANNING)),
    PLANNING_THEN_CONTENT("planning-then-content", List.of(Steps.PLANNING, Steps.CONTENT_CREATION)),
    FULL_CAMPAIGN("full-campaign", List.of(Steps.RESEARCH, Steps.PLANNING, Steps.CONTENT_CREATION), "full-cycle");

    private final String slug;
    private final List<String> expectedSteps;
    private final List<String> aliases;

    WorkflowType(String slug, List<String> expectedSteps, String... aliases) {
        this.slug = slug;
        this.expectedSteps = expectedSteps;
        this.aliases = List.of(aliases);
    }

    @JsonValue
    public String getSlug() {
        return slug;
    }

    public List<String> getExpectedSteps() {
        return expectedSteps;
    }

    public boolean isSatisfiedBy(List<String> completedSteps) {
        return completedSteps != null && completedSteps.containsAll(expectedSteps);
    }

    /** Accepts the slug ("full-campaign"), an alias ("full-cycle") or the enum name ("FULL_CAMPAIGN"). */
    @JsonCreator
    public static WorkflowType fromSlug(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Workflow type is required");
        }
        String key = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(t -> t.slug.equals(key) || t.aliases.contains(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown workflow type: " + value));
    }

    public static final class Steps {
        public static final String RESEARCH = "Research";
        public static final String PLANNING = "Planning";
        public static final String CONTENT_CREATION = "Content Creation";

        private Steps() {}
    }
}
