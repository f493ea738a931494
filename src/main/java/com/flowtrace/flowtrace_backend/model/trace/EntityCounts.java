package com.flowtrace.flowtrace_backend.model.trace;

import com.flowtrace.flowtrace_backend.model.domain.EntityKind;

import java.util.Map;

/** Rows tagged with one execution, per entity kind. */
public record EntityCounts(long campaigns, long adSets, long posts, long researchEntries, long mediaFiles) {

    public static final EntityCounts EMPTY = new EntityCounts(0, 0, 0, 0, 0);

    public static EntityCounts from(Map<EntityKind, Long> byKind) {
        return new EntityCounts(
                byKind.getOrDefault(EntityKind.CAMPAIGN, 0L),
                byKind.getOrDefault(EntityKind.AD_SET, 0L),
                byKind.getOrDefault(EntityKind.POST, 0L),
                byKind.getOrDefault(EntityKind.RESEARCH_ENTRY, 0L),
                byKind.getOrDefault(EntityKind.MEDIA_FILE, 0L));
    }
}
