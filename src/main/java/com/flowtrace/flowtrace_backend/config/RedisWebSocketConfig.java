package com.flowtrace.flowtrace_backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowtrace.flowtrace_backend.engine.RedisWebSocketBridge;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * Relays ledger notifications and live traces between instances over one Redis channel.
 * Enabled by the "redis" profile, which also turns Redis auto-configuration back on.
 */
@Configuration
@ConditionalOnProperty(name = "flowtrace.redis-bridge.enabled", havingValue = "true")
public class RedisWebSocketConfig {

    @Bean
    public ChannelTopic inspectorRelayTopic(FlowtraceProperties properties) {
        return new ChannelTopic(properties.getRedisBridge().getChannel());
    }

    @Bean
    public RedisWebSocketBridge redisWebSocketBridge(
            StringRedisTemplate redisTemplate,
            SimpMessagingTemplate messagingTemplate,
            ObjectMapper objectMapper,
            ChannelTopic inspectorRelayTopic) {
        return new RedisWebSocketBridge(redisTemplate, messagingTemplate, objectMapper, inspectorRelayTopic);
    }

    @Bean
    public RedisMessageListenerContainer inspectorRelayListenerContainer(
            RedisConnectionFactory connectionFactory,
            RedisWebSocketBridge bridge,
            ChannelTopic inspectorRelayTopic) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(bridge, inspectorRelayTopic);
        return container;
    }
}
