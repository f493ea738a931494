package com.flowtrace.flowtrace_backend.repository;

import com.flowtrace.flowtrace_backend.model.domain.MediaFile;

public interface MediaFileRepository extends TaggedEntityRepository<MediaFile> {
}
