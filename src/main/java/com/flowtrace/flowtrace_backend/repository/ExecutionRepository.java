package com.flowtrace.flowtrace_backend.repository;

import com.flowtrace.flowtrace_backend.model.domain.Execution;
import com.flowtrace.flowtrace_backend.model.domain.ExecutionStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ExecutionRepository extends JpaRepository<Execution, UUID> {

    // Row lock so concurrent step signals for one run serialise
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from Execution e where e.id = :id")
    Optional<Execution> findByIdForUpdate(@Param("id") UUID id);

    // Newest-first pages for the execution picker
    List<Execution> findAllByOrderByStartedAtDesc(Pageable pageable);

    List<Execution> findByInitiativeIdOrderByStartedAtDesc(UUID initiativeId, Pageable pageable);

    List<Execution> findByStatusOrderByStartedAtDesc(ExecutionStatus status, Pageable pageable);

    List<Execution> findByInitiativeIdAndStatusOrderByStartedAtDesc(UUID initiativeId, ExecutionStatus status, Pageable pageable);
}
