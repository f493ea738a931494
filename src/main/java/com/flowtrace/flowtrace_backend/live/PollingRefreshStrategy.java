package com.flowtrace.flowtrace_backend.live;

import com.flowtrace.flowtrace_backend.config.FlowtraceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

@Slf4j
@Component
@ConditionalOnProperty(name = "flowtrace.live.strategy", havingValue = "POLLING", matchIfMissing = true)
public class PollingRefreshStrategy implements TraceRefreshStrategy {

    private final TaskScheduler scheduler;
    private final Duration      interval;

    public PollingRefreshStrategy(@Qualifier("liveViewScheduler") TaskScheduler scheduler,
                                  FlowtraceProperties properties) {
        this.scheduler = scheduler;
        this.interval = properties.getLive().getPollInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("flowtrace.live.poll-interval must be positive, got " + interval);
        }
    }

    @Override
    public RefreshHandle attach(UUID executionId, Runnable refresh) {
        ScheduledFuture<?> task = scheduler.scheduleAtFixedRate(refresh, Instant.now().plus(interval), interval);
        log.debug("Polling executionId={} every {}", executionId, interval);
        return () -> task.cancel(false);
    }
}
