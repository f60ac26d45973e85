package com.example.chat.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PropertiesConfig {

    @Value("${pod.name:${POD_NAME:chat-realtime-0}}")
    private String podName;

    @Bean
    @ConfigurationProperties(prefix = "chat")
    public AppProperties appProperties() {
        AppProperties properties = new AppProperties();
        // chat.pod.id in application.yml still wins, binding runs after this
        properties.getPod().setId(podName);
        return properties;
    }
}
