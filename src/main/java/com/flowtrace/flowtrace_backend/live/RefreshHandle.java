package com.flowtrace.flowtrace_backend.live;

@FunctionalInterface
public interface RefreshHandle {

    void cancel();
}
