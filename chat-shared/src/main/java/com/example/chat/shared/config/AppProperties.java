package com.example.chat.shared.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
public class AppProperties {

    private final Pod pod = new Pod();
    private final RateLimit rateLimit = new RateLimit();
    private final Outbound outbound = new Outbound();
    private final Message message = new Message();
    private final History history = new History();
    private final Protocol protocol = new Protocol();
    private final Websocket websocket = new Websocket();
    private final Security security = new Security();
    private final Cache cache = new Cache();

    @Data
    public static class Pod {
        @NotBlank
        private String id = "chat-realtime-0";
    }

    /**
     * Inbound token buckets, one pair per connection. Chat commands and moderation
     * commands (block/unblock) draw from separate buckets.
     */
    @Data
    public static class RateLimit {
        @Positive
        private int capacity = 20;
        @Positive
        private double refillPerSecond = 10.0;
        @Positive
        private int moderationCapacity = 5;
        @Positive
        private double moderationRefillPerSecond = 0.2;
    }

    @Data
    public static class Outbound {
        @Positive
        private int queueDepth = 256;
    }

    @Data
    public static class Message {
        @Positive
        private int maxLength = 2000;
    }

    @Data
    public static class History {
        @Positive
        private int maxLimit = 100;
        @Positive
        private int defaultLimit = 50;
    }

    @Data
    public static class Protocol {
        @Positive
        private int maxMalformedCommands = 5;
    }

    @Data
    public static class Websocket {
        @NotBlank
        private String path = "/ws/chat";
        @NotNull
        private Duration shutdownGracePeriod = Duration.ofMillis(500);
        /** How long a closed connection's writer may keep flushing before the transport is closed under it. */
        @NotNull
        private Duration closeTimeout = Duration.ofSeconds(1);
    }

    @Data
    public static class Security {
        private final Jwt jwt = new Jwt();

        @Data
        public static class Jwt {
            @NotBlank
            private String secret = "dev-only-change-me-dev-only-change-me";
            @NotBlank
            private String issuer = "game-platform-auth";
        }
    }

    @Data
    public static class Cache {
        private final BlockLookups blockLookups = new BlockLookups();

        @Data
        public static class BlockLookups {
            @Positive
            private int maximumSize = 100000;
            @NotNull
            private Duration expireAfterWrite = Duration.ofMinutes(10);
        }
    }
}
