package com.example.chat.realtime.websocket;

import com.example.chat.shared.config.AppProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import java.util.Map;

@Configuration
public class WebSocketConfig {

    /**
     * Maps {@code chat.websocket.path} ahead of the annotated controllers. The
     * WebSocketHandlerAdapter comes from the WebFlux configuration.
     */
    @Bean
    public HandlerMapping chatWebSocketHandlerMapping(ChatWebSocketHandler chatWebSocketHandler,
                                                      AppProperties appProperties) {
        return new SimpleUrlHandlerMapping(
                Map.of(appProperties.getWebsocket().getPath(), chatWebSocketHandler),
                Ordered.HIGHEST_PRECEDENCE);
    }
}
