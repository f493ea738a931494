package com.flowtrace.flowtrace_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowtraceBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowtraceBackendApplication.class, args);
    }
}
