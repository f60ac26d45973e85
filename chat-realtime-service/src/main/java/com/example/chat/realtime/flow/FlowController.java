package com.example.chat.realtime.flow;

import com.example.chat.realtime.outbound.EnqueueResult;
import com.example.chat.realtime.outbound.FrameFactory;
import com.example.chat.realtime.outbound.OutboundFrame;
import com.example.chat.realtime.session.ChatCloseStatus;
import com.example.chat.realtime.session.ChatConnection;
import com.example.chat.realtime.session.ConnectionClosedEvent;
import com.example.chat.shared.config.MonitoringConfig;
import com.example.chat.shared.exception.ChatErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Inbound admission and outbound backpressure, both per connection.
 *
 * <p>Enqueueing never blocks and never throws: a connection that cannot keep up is
 * closed with {@code SlowConsumer} and the caller moves on to the next recipient. The
 * closed connection is announced with a {@link ConnectionClosedEvent} so it is
 * unregistered at once; a peer that stopped reading never lets its writer finish.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FlowController {

    private final FrameFactory frameFactory;
    private final MonitoringConfig.ChatMetricsCollector metricsCollector;
    private final ApplicationEventPublisher eventPublisher;

    public boolean tryAdmit(ChatConnection connection) {
        boolean admitted = connection.getInboundBudget().tryConsume();
        if (!admitted) {
            metricsCollector.incrementCounter("chat.commands.rejected", "kind", ChatErrorKind.RATE_LIMITED.getLabel());
        }
        return admitted;
    }

    /**
     * Block and unblock draw from their own, smaller budget.
     */
    public boolean tryAdmitModeration(ChatConnection connection) {
        boolean admitted = connection.getModerationBudget().tryConsume();
        if (!admitted) {
            metricsCollector.incrementCounter("chat.commands.rejected", "kind", ChatErrorKind.RATE_LIMITED.getLabel());
        }
        return admitted;
    }

    public EnqueueResult enqueue(ChatConnection connection, OutboundFrame frame) {
        if (frame == null) {
            return EnqueueResult.DROPPED;
        }
        long evictedBefore = connection.getOutbound().getEvictedCount();
        EnqueueResult result = connection.getOutbound().offer(frame);
        switch (result) {
            case ACCEPTED:
                metricsCollector.incrementCounter("chat.frames.enqueued", "status", "accepted");
                if (connection.getOutbound().getEvictedCount() > evictedBefore) {
                    metricsCollector.incrementCounter("chat.frames.enqueued", "status", "evicted");
                }
                break;
            case DROPPED:
                metricsCollector.incrementCounter("chat.frames.enqueued", "status", "dropped");
                log.debug("Dropped {} frame for connection {}: queue full of undroppable frames", frame.getType(), connection.getId());
                break;
            case SLOW_CONSUMER:
                closeSlowConsumer(connection, frame);
                break;
            default:
                break;
        }
        return result;
    }

    private void closeSlowConsumer(ChatConnection connection, OutboundFrame rejected) {
        boolean closedNow = connection.close(
                ChatCloseStatus.SLOW_CONSUMER,
                frameFactory.error(ChatErrorKind.SLOW_CONSUMER, "Outbound queue overflow"),
                true);
        if (closedNow) {
            metricsCollector.incrementCounter("chat.connections.closed", "reason", ChatErrorKind.SLOW_CONSUMER.getLabel());
            log.warn("Closing connection {} of user {}: outbound queue of {} frames overflowed on a {} frame",
                    connection.getId(), connection.getUserId(), connection.getOutbound().getCapacity(), rejected.getType());
            eventPublisher.publishEvent(new ConnectionClosedEvent(this, connection, ChatErrorKind.SLOW_CONSUMER));
        }
    }
}
