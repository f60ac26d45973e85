package com.example.chat.realtime.session;

import com.example.chat.realtime.flow.TokenBucket;
import com.example.chat.realtime.outbound.OutboundQueue;
import com.example.chat.shared.config.AppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Creates connections sized from {@code chat.rate-limit.*} and {@code chat.outbound.*}.
 */
@Component
@RequiredArgsConstructor
public class ChatConnectionFactory {

    private final AppProperties appProperties;

    public ChatConnection create() {
        AppProperties.RateLimit rateLimit = appProperties.getRateLimit();
        return new ChatConnection(
                UUID.randomUUID().toString(),
                OffsetDateTime.now(ZoneOffset.UTC),
                new OutboundQueue(appProperties.getOutbound().getQueueDepth()),
                new TokenBucket(rateLimit.getCapacity(), rateLimit.getRefillPerSecond()),
                new TokenBucket(rateLimit.getModerationCapacity(), rateLimit.getModerationRefillPerSecond()));
    }
}
