package com.flowtrace.flowtrace_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "campaigns")
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class Campaign extends TaggedEntity {

    @Column(nullable = false)
    private String name;

    // AWARENESS, ENGAGEMENT, TRAFFIC, CONVERSIONS
    @Column(nullable = false)
    private String objective;

    private String description;

    @Column(name = "budget_mode")
    private String budgetMode;

    @Column(name = "daily_budget")
    private BigDecimal dailyBudget;

    @Column(name = "lifetime_budget")
    private BigDecimal lifetimeBudget;

    @Column(name = "spent_budget")
    private BigDecimal spentBudget = BigDecimal.ZERO;

    @Column(name = "start_date")
    private Instant startDate;

    @Column(name = "end_date")
    private Instant endDate;

    private String status = "draft";

    @Column(name = "is_active")
    private boolean active = true;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> metrics;

    @Column(name = "meta_campaign_id")
    private String metaCampaignId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "execution_metadata")
    private Map<String, Object> executionMetadata;
}
