package com.flowtrace.flowtrace_backend.model.domain;

/** The five Entity Store collections a trace is assembled from, with the section name shown to the inspector. */
public enum EntityKind {
    CAMPAIGN("campaigns"),
    AD_SET("ad sets"),
    POST("posts"),
    RESEARCH_ENTRY("research data"),
    MEDIA_FILE("media files");

    private final String section;

    EntityKind(String section) {
        this.section = section;
    }

    public String getSection() {
        return section;
    }
}
