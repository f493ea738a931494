package com.flowtrace.flowtrace_backend.model.trace;

import com.flowtrace.flowtrace_backend.model.domain.AdSet;
import com.flowtrace.flowtrace_backend.model.domain.Campaign;
import com.flowtrace.flowtrace_backend.model.domain.MediaFile;
import com.flowtrace.flowtrace_backend.model.domain.Post;
import com.flowtrace.flowtrace_backend.model.domain.ResearchEntry;
import com.flowtrace.flowtrace_backend.model.domain.TaggedEntity;

import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Everything one execution produced, assembled on demand. Collections are newest-created first.
 * Has no persistence of its own.
 */
public record ExecutionTrace(
        ExecutionSummary    summary,
        List<Campaign>      campaigns,
        List<AdSet>         adSets,
        List<Post>          posts,
        List<ResearchEntry> research,
        List<MediaFile>     mediaFiles,
        List<TraceWarning>  warnings
) {

    public boolean isPartial() {
        return !warnings.isEmpty();
    }

    /** Ids of every entity in the trace, in collection order. */
    public List<UUID> entityIds() {
        return Stream.of(campaigns, adSets, posts, research, mediaFiles)
                .flatMap(List::stream)
                .map(TaggedEntity::getId)
                .toList();
    }
}
