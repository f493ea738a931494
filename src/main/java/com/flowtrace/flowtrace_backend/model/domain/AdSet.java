package com.flowtrace.flowtrace_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Targeting and budget group under exactly one campaign. */
@Entity
@Table(name = "ad_sets")
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class AdSet extends TaggedEntity {

    @Column(name = "campaign_id", nullable = false)
    private UUID campaignId;

    @Column(nullable = false)
    private String name;

    private String objective;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "target_audience")
    private Map<String, Object> targetAudience;

    // e.g. ig_feed, fb_feed
    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> placements;

    @Column(name = "daily_budget")
    private BigDecimal dailyBudget;

    @Column(name = "lifetime_budget")
    private BigDecimal lifetimeBudget;

    @Column(name = "spent_budget")
    private BigDecimal spentBudget = BigDecimal.ZERO;

    @Column(name = "bid_strategy")
    private String bidStrategy;

    @Column(name = "start_time")
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> schedule;

    @Column(name = "post_frequency")
    private Integer postFrequency;

    @Column(name = "post_volume")
    private Integer postVolume;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "creative_brief")
    private Map<String, Object> creativeBrief;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> materials;

    private String status = "draft";

    @Column(name = "is_active")
    private boolean active = true;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> metrics;

    @Column(name = "meta_ad_set_id")
    private String metaAdSetId;
}
