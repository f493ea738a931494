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

@Entity
@Table(name = "research")
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ResearchEntry extends TaggedEntity {

    // competitor, trend, hashtag, audience
    @Column(name = "research_type", nullable = false)
    private String researchType;

    @Column(nullable = false)
    private String topic;

    @Column(columnDefinition = "text")
    private String summary;

    @JdbcTypeCode(SqlTypes.JSON)
    private List<Map<String, Object>> insights;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw_data")
    private Map<String, Object> rawData;

    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> sources;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "search_queries")
    private List<String> searchQueries;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "relevance_score")
    private Map<String, Object> relevanceScore;

    @JdbcTypeCode(SqlTypes.JSON)
    private List<String> tags;

    @Column(name = "expires_at")
    private Instant expiresAt;
}
