package com.flowtrace.flowtrace_backend.repository;

import com.flowtrace.flowtrace_backend.model.domain.TaggedEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Filter-by-execution queries every Entity Store table supports. Untagged rows never match.
 */
@NoRepositoryBean
public interface TaggedEntityRepository<T extends TaggedEntity> extends JpaRepository<T, UUID> {

    long countByExecutionId(UUID executionId);

    List<T> findByExecutionIdOrderByCreatedAtDesc(UUID executionId);

    @Query("select e.executionId as executionId, count(e) as total from #{#entityName} e "
            + "where e.executionId in :executionIds group by e.executionId")
    List<ExecutionCount> countGroupedByExecutionId(@Param("executionIds") Collection<UUID> executionIds);
}
