package com.flowtrace.flowtrace_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "flowtrace")
public class FlowtraceProperties {

    private Summary summary = new Summary();
    private Fetch fetch = new Fetch();
    private Live live = new Live();
    private Storage storage = new Storage();
    private Cors cors = new Cors();
    private RedisBridge redisBridge = new RedisBridge();

    @Data
    public static class Summary {
        /** Page size used by summary listing when the caller gives none. */
        private int defaultPageSize = 50;
        /** Hard cap on one listing page; bounds the count fan-out. */
        private int maxPageSize = 100;
    }

    @Data
    public static class Fetch {
        private int poolSize = 8;
        /** Longest wait for a single sub-fetch during assembly or projection. */
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Live {
        private LiveStrategy strategy = LiveStrategy.POLLING;
        private Duration pollInterval = Duration.ofSeconds(5);
        /** Refresh failures in a row after which a subscription is torn down and the listener told. */
        private int maxConsecutiveFailures = 5;
        private int schedulerPoolSize = 2;
    }

    @Data
    public static class Storage {
        private String publicBaseUrl = "";
        private String mediaBucket = "generated-media";
    }

    @Data
    public static class Cors {
        /** Inspector UI origins, as patterns; applied to the REST API and the STOMP endpoint. */
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
    }

    @Data
    public static class RedisBridge {
        private boolean enabled = false;
        /** Pub/Sub channel shared by every instance relaying inspector messages. */
        private String channel = "flowtrace:websocket:topic";
    }

    public enum LiveStrategy {
        POLLING,
        EVENTS
    }
}
