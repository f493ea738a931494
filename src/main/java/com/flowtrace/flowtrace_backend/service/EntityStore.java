package com.flowtrace.flowtrace_backend.service;

import com.flowtrace.flowtrace_backend.config.FlowtraceProperties;
import com.flowtrace.flowtrace_backend.exception.ValidationException;
import com.flowtrace.flowtrace_backend.model.domain.AdSet;
import com.flowtrace.flowtrace_backend.model.domain.Campaign;
import com.flowtrace.flowtrace_backend.model.domain.EntityKind;
import com.flowtrace.flowtrace_backend.model.domain.Execution;
import com.flowtrace.flowtrace_backend.model.domain.MediaFile;
import com.flowtrace.flowtrace_backend.model.domain.Post;
import com.flowtrace.flowtrace_backend.model.domain.ResearchEntry;
import com.flowtrace.flowtrace_backend.model.domain.TaggedEntity;
import com.flowtrace.flowtrace_backend.repository.AdSetRepository;
import com.flowtrace.flowtrace_backend.repository.CampaignRepository;
import com.flowtrace.flowtrace_backend.repository.ExecutionCount;
import com.flowtrace.flowtrace_backend.repository.ExecutionRepository;
import com.flowtrace.flowtrace_backend.repository.MediaFileRepository;
import com.flowtrace.flowtrace_backend.repository.PostRepository;
import com.flowtrace.flowtrace_backend.repository.ResearchEntryRepository;
import com.flowtrace.flowtrace_backend.repository.TaggedEntityRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Access layer over the five Entity Store tables: filtered counts and newest-first lists by execution id,
 * plus the guarded write path that keeps execution tags pointing at real ledger rows.
 * Storage settings come in through the constructor, never from the environment.
 */
@Slf4j
@Component
public class EntityStore {

    private final CampaignRepository      campaignRepository;
    private final AdSetRepository         adSetRepository;
    private final PostRepository          postRepository;
    private final ResearchEntryRepository researchRepository;
    private final MediaFileRepository     mediaFileRepository;
    private final ExecutionRepository     executionRepository;
    private final FlowtraceProperties.Storage storage;
    private final Clock                   clock;

    private final Map<EntityKind, TaggedEntityRepository<? extends TaggedEntity>> repositories;

    public EntityStore(CampaignRepository campaignRepository,
                       AdSetRepository adSetRepository,
                       PostRepository postRepository,
                       ResearchEntryRepository researchRepository,
                       MediaFileRepository mediaFileRepository,
                       ExecutionRepository executionRepository,
                       FlowtraceProperties properties,
                       Clock clock) {
        this.campaignRepository = campaignRepository;
        this.adSetRepository = adSetRepository;
        this.postRepository = postRepository;
        this.researchRepository = researchRepository;
        this.mediaFileRepository = mediaFileRepository;
        this.executionRepository = executionRepository;
        this.storage = properties.getStorage();
        this.clock = clock;

        this.repositories = new EnumMap<>(EntityKind.class);
        repositories.put(EntityKind.CAMPAIGN, campaignRepository);
        repositories.put(EntityKind.AD_SET, adSetRepository);
        repositories.put(EntityKind.POST, postRepository);
        repositories.put(EntityKind.RESEARCH_ENTRY, researchRepository);
        repositories.put(EntityKind.MEDIA_FILE, mediaFileRepository);
    }

    public long count(EntityKind kind, UUID executionId) {
        return repositories.get(kind).countByExecutionId(executionId);
    }

    /** Counts for many executions in one grouped query. Executions with no rows are absent from the map. */
    public Map<UUID, Long> countByExecution(EntityKind kind, Collection<UUID> executionIds) {
        Map<UUID, Long> counts = new HashMap<>();
        if (executionIds.isEmpty()) {
            return counts;
        }
        for (ExecutionCount row : repositories.get(kind).countGroupedByExecutionId(executionIds)) {
            counts.put(row.getExecutionId(), row.getTotal());
        }
        return counts;
    }

    public List<Campaign> campaigns(UUID executionId) {
        return campaignRepository.findByExecutionIdOrderByCreatedAtDesc(executionId);
    }

    public List<AdSet> adSets(UUID executionId) {
        return adSetRepository.findByExecutionIdOrderByCreatedAtDesc(executionId);
    }

    public List<Post> posts(UUID executionId) {
        return postRepository.findByExecutionIdOrderByCreatedAtDesc(executionId);
    }

    public List<ResearchEntry> research(UUID executionId) {
        return researchRepository.findByExecutionIdOrderByCreatedAtDesc(executionId);
    }

    public List<MediaFile> mediaFiles(UUID executionId) {
        List<MediaFile> files = mediaFileRepository.findByExecutionIdOrderByCreatedAtDesc(executionId);
        files.forEach(this::resolvePublicUrl);
        return files;
    }

    /**
     * Saves a row after checking its tags: an execution tag must name a ledger row of the same initiative,
     * and ad sets and posts must point at an existing parent. A row without createdAt is stamped from the clock.
     */
    public <T extends TaggedEntity> T save(T entity) {
        if (entity.getInitiativeId() == null) {
            throw new ValidationException("initiativeId is required");
        }
        checkExecutionTag(entity);
        if (entity instanceof AdSet adSet) {
            checkParent(adSet);
        } else if (entity instanceof Post post) {
            checkParent(post);
        }
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(clock.instant());
        }
        T saved = repositoryFor(entity).save(entity);
        log.debug("Saved {} id={} executionId={} step={}",
                kindOf(saved), saved.getId(), saved.getExecutionId(), saved.getExecutionStep());
        return saved;
    }

    private void checkExecutionTag(TaggedEntity entity) {
        if (entity.getExecutionStep() != null && entity.getExecutionStep().isBlank()) {
            throw new ValidationException("executionStep must not be blank when present");
        }
        if (entity.getExecutionId() == null) {
            return;
        }
        Execution execution = executionRepository.findById(entity.getExecutionId())
                .orElseThrow(() -> new ValidationException("Unknown execution: " + entity.getExecutionId()));
        if (!execution.getInitiativeId().equals(entity.getInitiativeId())) {
            throw new ValidationException("Execution " + execution.getId() + " belongs to another initiative");
        }
    }

    private void checkParent(AdSet adSet) {
        if (adSet.getCampaignId() == null) {
            throw new ValidationException("An ad set needs a campaignId");
        }
        if (!campaignRepository.existsByIdAndInitiativeId(adSet.getCampaignId(), adSet.getInitiativeId())) {
            throw new ValidationException("Campaign not found for ad set: " + adSet.getCampaignId());
        }
    }

    private void checkParent(Post post) {
        if (post.getAdSetId() == null) {
            throw new ValidationException("A post needs an adSetId");
        }
        boolean parentExists = post.getCampaignId() != null
                ? adSetRepository.existsByIdAndCampaignId(post.getAdSetId(), post.getCampaignId())
                : adSetRepository.existsById(post.getAdSetId());
        if (!parentExists) {
            throw new ValidationException("Ad set not found for post: " + post.getAdSetId());
        }
    }

    private void resolvePublicUrl(MediaFile file) {
        if (file.getPublicUrl() != null && !file.getPublicUrl().isBlank()) {
            return;
        }
        String base = storage.getPublicBaseUrl();
        if (base == null || base.isBlank() || file.getStoragePath() == null) {
            return;
        }
        String path = file.getStoragePath().startsWith("/") ? file.getStoragePath().substring(1) : file.getStoragePath();
        String root = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        file.setPublicUrl(root + "/" + storage.getMediaBucket() + "/" + path);
    }

    @SuppressWarnings("unchecked")
    private <T extends TaggedEntity> TaggedEntityRepository<T> repositoryFor(T entity) {
        return (TaggedEntityRepository<T>) repositories.get(kindOf(entity));
    }

    static EntityKind kindOf(TaggedEntity entity) {
        if (entity instanceof Campaign) return EntityKind.CAMPAIGN;
        if (entity instanceof AdSet) return EntityKind.AD_SET;
        if (entity instanceof Post) return EntityKind.POST;
        if (entity instanceof ResearchEntry) return EntityKind.RESEARCH_ENTRY;
        if (entity instanceof MediaFile) return EntityKind.MEDIA_FILE;
        throw new IllegalArgumentException("Not an Entity Store type: " + entity.getClass().getSimpleName());
    }
}
