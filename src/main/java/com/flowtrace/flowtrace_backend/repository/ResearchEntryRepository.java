package com.flowtrace.flowtrace_backend.repository;

import com.flowtrace.flowtrace_backend.model.domain.ResearchEntry;

public interface ResearchEntryRepository extends TaggedEntityRepository<ResearchEntry> {
}
