package com.flowtrace.flowtrace_backend.config;

import com.flowtrace.flowtrace_backend.model.domain.ExecutionStatus;
import com.flowtrace.flowtrace_backend.model.domain.WorkflowType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Rewrites the execution_logs CHECK constraints on status and workflow_type from the current enums.
 * Needed when a workflow type is added after Hibernate created the original constraint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExecutionLogConstraintMigration {

    private final JdbcTemplate jdbcTemplate;

    @PostConstruct
    public void updateConstraints() {
        replaceCheck("execution_logs_workflow_type_check", "workflow_type", allowed(WorkflowType.values()));
        replaceCheck("execution_logs_status_check", "status", allowed(ExecutionStatus.values()));
    }

    private void replaceCheck(String constraint, String column, String allowed) {
        try {
            jdbcTemplate.execute("ALTER TABLE execution_logs DROP CONSTRAINT IF EXISTS " + constraint);
            jdbcTemplate.execute("ALTER TABLE execution_logs ADD CONSTRAINT " + constraint
                    + " CHECK (" + column + " IN ('" + allowed + "'))");
            log.debug("Updated {} to allow {}", constraint, allowed);
        } catch (Exception e) {
            log.warn("Could not update {} (constraint may already be correct): {}", constraint, e.getMessage());
        }
    }

    private static String allowed(Enum<?>[] values) {
        return String.join("', '", Arrays.stream(values).map(Enum::name).toList());
    }
}
