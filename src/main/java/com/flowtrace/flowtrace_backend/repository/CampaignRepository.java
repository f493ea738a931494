package com.flowtrace.flowtrace_backend.repository;

import com.flowtrace.flowtrace_backend.model.domain.Campaign;

import java.util.UUID;

public interface CampaignRepository extends TaggedEntityRepository<Campaign> {

    boolean existsByIdAndInitiativeId(UUID id, UUID initiativeId);
}
