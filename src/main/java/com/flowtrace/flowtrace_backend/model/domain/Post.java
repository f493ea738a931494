package com.flowtrace.flowtrace_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One content item under an ad set. Media generated for it is not linked by key; see {@link MediaFile}.
 */
@Entity
@Table(name = "posts")
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Post extends TaggedEntity {

    @Column(name = "ad_set_id", nullable = false)
    private UUID adSetId;

    // denormalised from the ad set
    @Column(name = "campaign_id")
    private UUID campaignId;

    // image, video, carousel, story
    @Column(name = "post_type", nullable = false)
    private String postType;

    @Column(name = "text_content", columnDefinition = "text")
    private String textContent;

    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> hashtags;

    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> links;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "media_urls")
    private List<String> mediaUrls;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "media_metadata")
    private Map<String, Object> mediaMetadata;

    @Column(name = "scheduled_time")
    private Instant scheduledTime;

    @Column(name = "published_time")
    private Instant publishedTime;

    @Column(name = "facebook_post_id")
    private String facebookPostId;

    @Column(name = "instagram_post_id")
    private String instagramPostId;

    // draft, scheduled, published, failed
    private String status = "draft";

    @Column(name = "is_published")
    private boolean published;

    private int reach;
    private int impressions;
    private int engagement;
    private int clicks;

    @Column(name = "comments_count")
    private int commentsCount;

    private int shares;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "generation_metadata")
    private Map<String, Object> generationMetadata;
}
