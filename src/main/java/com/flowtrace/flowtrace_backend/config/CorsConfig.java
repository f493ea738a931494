package com.flowtrace.flowtrace_backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.List;

/** The inspector UI reads traces over /api and subscribes to live traces over /ws. */
@Configuration
public class CorsConfig {

    private static final List<HttpMethod> INSPECTOR_METHODS =
            List.of(HttpMethod.GET, HttpMethod.POST, HttpMethod.DELETE, HttpMethod.OPTIONS);

    @Bean
    public CorsFilter corsFilter(FlowtraceProperties properties) {
        return new CorsFilter(inspectorCorsSource(properties.getCors().getAllowedOrigins()));
    }

    static UrlBasedCorsConfigurationSource inspectorCorsSource(List<String> allowedOrigins) {
        CorsConfiguration config = new CorsConfiguration();
        allowedOrigins.stream()
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .forEach(config::addAllowedOriginPattern);
        INSPECTOR_METHODS.forEach(config::addAllowedMethod);
        config.addAllowedHeader("*");
        config.setAllowCredentials(true);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/**", config);
        source.registerCorsConfiguration("/ws/**", config);
        return source;
    }
}
