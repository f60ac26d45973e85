package com.example.chat.realtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Realtime chat service for the game platform.
 *
 * Serves the WebSocket endpoint for room and direct messages, presence and game
 * notifications, plus the read-side HTTP surface for paginated history. Persistence,
 * block lookups and shared configuration come from the chat-shared module.
 */
@SpringBootApplication(scanBasePackages = "com.example.chat")
@EnableScheduling
public class ChatRealtimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatRealtimeApplication.class, args);
    }
}
