package com.flowtrace.flowtrace_backend.repository;

import com.flowtrace.flowtrace_backend.model.domain.Post;

public interface PostRepository extends TaggedEntityRepository<Post> {
}
