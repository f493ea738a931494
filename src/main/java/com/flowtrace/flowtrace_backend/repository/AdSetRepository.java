package com.flowtrace.flowtrace_backend.repository;

import com.flowtrace.flowtrace_backend.model.domain.AdSet;

import java.util.UUID;

public interface AdSetRepository extends TaggedEntityRepository<AdSet> {

    boolean existsByIdAndCampaignId(UUID id, UUID campaignId);
}
