package com.modelgateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the model gateway: capability-aware routing across
 * LLM providers with circuit breaking, rate limiting and semantic caching.
 */
@SpringBootApplication
public class ModelGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelGatewayApplication.class, args);
    }
}
