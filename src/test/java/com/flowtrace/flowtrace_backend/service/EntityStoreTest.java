package com.flowtrace.flowtrace_backend.service;

import com.flowtrace.flowtrace_backend.config.FlowtraceProperties;
import com.flowtrace.flowtrace_backend.exception.ValidationException;
import com.flowtrace.flowtrace_backend.model.domain.AdSet;
import com.flowtrace.flowtrace_backend.model.domain.Campaign;
import com.flowtrace.flowtrace_backend.model.domain.EntityKind;
import com.flowtrace.flowtrace_backend.model.domain.Execution;
import com.flowtrace.flowtrace_backend.model.domain.MediaFile;
import com.flowtrace.flowtrace_backend.model.domain.Post;
import com.flowtrace.flowtrace_backend.model.domain.WorkflowType;
import com.flowtrace.flowtrace_backend.repository.AdSetRepository;
import com.flowtrace.flowtrace_backend.repository.CampaignRepository;
import com.flowtrace.flowtrace_backend.repository.ExecutionRepository;
import com.flowtrace.flowtrace_backend.repository.MediaFileRepository;
import com.flowtrace.flowtrace_backend.repository.PostRepository;
import com.flowtrace.flowtrace_backend.repository.ResearchEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EntityStoreTest {

    private static final UUID INITIATIVE_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private CampaignRepository campaignRepository;
    @Mock
    private AdSetRepository adSetRepository;
    @Mock
    private PostRepository postRepository;
    @Mock
    private ResearchEntryRepository researchRepository;
    @Mock
    private MediaFileRepository mediaFileRepository;
    @Mock
    private ExecutionRepository executionRepository;

    private FlowtraceProperties properties;
    private EntityStore store;

    @BeforeEach
    void setUp() {
        properties = new FlowtraceProperties();
        properties.getStorage().setPublicBaseUrl("https://cdn.example.com/storage/");
        store = new EntityStore(campaignRepository, adSetRepository, postRepository, researchRepository,
                mediaFileRepository, executionRepository, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void save_shouldAcceptCampaignTaggedWithExecutionOfSameInitiative() {
        Execution execution = execution(INITIATIVE_ID);
        Campaign campaign = campaign(execution.getId(), "Planning");
        when(executionRepository.findById(execution.getId())).thenReturn(Optional.of(execution));
        when(campaignRepository.save(campaign)).thenReturn(campaign);

        assertThat(store.save(campaign)).isSameAs(campaign);
    }

    @Test
    void save_shouldAcceptUntaggedRow() {
        Campaign campaign = campaign(null, null);
        when(campaignRepository.save(campaign)).thenReturn(campaign);

        store.save(campaign);

        verify(executionRepository, never()).findById(any());
    }

    @Test
    void save_shouldStampCreatedAtFromClockOnlyWhenMissing() {
        Campaign fresh = campaign(null, null);
        Campaign imported = campaign(null, null);
        imported.setCreatedAt(NOW.minusSeconds(3600));
        when(campaignRepository.save(any(Campaign.class))).thenAnswer(invocation -> invocation.getArgument(0));

        assertThat(store.save(fresh).getCreatedAt()).isEqualTo(NOW);
        assertThat(store.save(imported).getCreatedAt()).isEqualTo(NOW.minusSeconds(3600));
    }

    @Test
    void save_shouldRejectExecutionOfAnotherInitiative() {
        Execution execution = execution(UUID.randomUUID());
        Campaign campaign = campaign(execution.getId(), "Planning");
        when(executionRepository.findById(execution.getId())).thenReturn(Optional.of(execution));

        assertThatThrownBy(() -> store.save(campaign))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("another initiative");
        verify(campaignRepository, never()).save(any());
    }

    @Test
    void save_shouldRejectUnknownExecution() {
        UUID missing = UUID.randomUUID();
        when(executionRepository.findById(missing)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.save(campaign(missing, "Planning")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining(missing.toString());
    }

    @Test
    void save_shouldRejectBlankStep() {
        assertThatThrownBy(() -> store.save(campaign(UUID.randomUUID(), "  ")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void save_shouldRequireParentCampaignForAdSet() {
        AdSet adSet = new AdSet();
        adSet.setInitiativeId(INITIATIVE_ID);
        adSet.setCampaignId(UUID.randomUUID());
        when(campaignRepository.existsByIdAndInitiativeId(adSet.getCampaignId(), INITIATIVE_ID)).thenReturn(false);

        assertThatThrownBy(() -> store.save(adSet)).isInstanceOf(ValidationException.class);
        verify(adSetRepository, never()).save(any());
    }

    @Test
    void save_shouldCheckAdSetBelongsToPostCampaign() {
        Post post = new Post();
        post.setInitiativeId(INITIATIVE_ID);
        post.setAdSetId(UUID.randomUUID());
        post.setCampaignId(UUID.randomUUID());
        when(adSetRepository.existsByIdAndCampaignId(post.getAdSetId(), post.getCampaignId())).thenReturn(true);
        when(postRepository.save(post)).thenReturn(post);

        assertThat(store.save(post)).isSameAs(post);
    }

    @Test
    void mediaFiles_shouldResolvePublicUrlFromStoragePath() {
        UUID executionId = UUID.randomUUID();
        MediaFile stored = new MediaFile();
        stored.setStoragePath("/initiative/banner.png");
        MediaFile hosted = new MediaFile();
        hosted.setStoragePath("initiative/video.mp4");
        hosted.setPublicUrl("https://video.example.com/v.mp4");
        when(mediaFileRepository.findByExecutionIdOrderByCreatedAtDesc(executionId))
                .thenReturn(new ArrayList<>(List.of(stored, hosted)));

        List<MediaFile> files = store.mediaFiles(executionId);

        assertThat(files.get(0).getPublicUrl())
                .isEqualTo("https://cdn.example.com/storage/generated-media/initiative/banner.png");
        assertThat(files.get(1).getPublicUrl()).isEqualTo("https://video.example.com/v.mp4");
    }

    @Test
    void countByExecution_shouldSkipQueryForEmptyInput() {
        assertThat(store.countByExecution(EntityKind.POST, List.of())).isEmpty();
        verify(postRepository, never()).countGroupedByExecutionId(anyCollection());
    }

    @Test
    void count_shouldDelegateToKindRepository() {
        UUID executionId = UUID.randomUUID();
        when(researchRepository.countByExecutionId(executionId)).thenReturn(4L);

        assertThat(store.count(EntityKind.RESEARCH_ENTRY, executionId)).isEqualTo(4L);
    }

    private static Execution execution(UUID initiativeId) {
        Execution execution = new Execution();
        execution.setId(UUID.randomUUID());
        execution.setInitiativeId(initiativeId);
        execution.setWorkflowType(WorkflowType.PLANNING_ONLY);
        return execution;
    }

    private static Campaign campaign(UUID executionId, String step) {
        Campaign campaign = new Campaign();
        campaign.setInitiativeId(INITIATIVE_ID);
        campaign.setExecutionId(executionId);
        campaign.setExecutionStep(step);
        campaign.setName("Spring launch");
        return campaign;
    }
}
