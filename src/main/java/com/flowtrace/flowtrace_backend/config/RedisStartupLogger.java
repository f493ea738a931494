package com.flowtrace.flowtrace_backend.config;

import com.flowtrace.flowtrace_backend.engine.RedisWebSocketBridge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.stereotype.Component;

/**
 * Logs at startup whether live-view messages go through Redis or stay on this instance,
 * and which refresh strategy live views use.
 */
@Slf4j
@Component
public class RedisStartupLogger implements ApplicationRunner {

    private final ObjectProvider<RedisWebSocketBridge> bridgeProvider;
    private final ObjectProvider<RedisConnectionFactory> connectionFactoryProvider;
    private final FlowtraceProperties properties;

    public RedisStartupLogger(ObjectProvider<RedisWebSocketBridge> bridgeProvider,
                              ObjectProvider<RedisConnectionFactory> connectionFactoryProvider,
                              FlowtraceProperties properties) {
        this.bridgeProvider = bridgeProvider;
        this.connectionFactoryProvider = connectionFactoryProvider;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Live views refresh by {} (poll interval {})",
                properties.getLive().getStrategy(), properties.getLive().getPollInterval());

        if (bridgeProvider.getIfAvailable() == null) {
            log.info("Redis bridge disabled: live-view messages are delivered by this instance only");
            return;
        }
        RedisConnectionFactory factory = connectionFactoryProvider.getIfAvailable();
        if (factory == null) {
            log.warn("Redis bridge enabled but no RedisConnectionFactory; check spring.data.redis.url");
            return;
        }
        try (RedisConnection connection = factory.getConnection()) {
            connection.ping();
            log.info("Redis: connection OK, live-view messages go through channel {}",
                    properties.getRedisBridge().getChannel());
        } catch (Exception e) {
            log.warn("Redis: connection failed ({}); messages fall back to local delivery", e.getMessage());
        }
    }
}
