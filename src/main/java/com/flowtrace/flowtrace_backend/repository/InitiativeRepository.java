package com.flowtrace.flowtrace_backend.repository;

import com.flowtrace.flowtrace_backend.model.domain.Initiative;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface InitiativeRepository extends JpaRepository<Initiative, UUID> {
}
