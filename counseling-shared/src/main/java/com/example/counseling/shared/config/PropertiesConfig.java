package com.example.counseling.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PropertiesConfig {

    @Value("${pod.name:${POD_NAME:counseling-session-service-0}}")
    private String podName;

    @Bean
    @ConfigurationProperties(prefix = "counseling")
    public AppProperties appProperties() {
        AppProperties properties = new AppProperties();
        // The pod name comes from the environment; everything under counseling.* is bound by Spring.
        properties.setPodName(podName);
        return properties;
    }
}
