package com.flowtrace.flowtrace_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.Map;

/**
 * Generated image or video asset. Belongs to an initiative and, through its execution tag, to a run;
 * there is no key to the post it was generated for.
 */
@Entity
@Table(name = "media_files")
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class MediaFile extends TaggedEntity {

    // image, video, reel
    @Column(name = "file_type", nullable = false)
    private String fileType;

    @Column(name = "storage_path", nullable = false, length = 500)
    private String storagePath;

    @Column(name = "public_url", length = 1000)
    private String publicUrl;

    @Column(name = "prompt_used", columnDefinition = "text")
    private String promptUsed;

    // width / height
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Integer> dimensions;

    @Column(name = "duration_seconds")
    private Integer durationSeconds;

    @Column(name = "file_size_bytes")
    private Long fileSizeBytes;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> metadata;
}
