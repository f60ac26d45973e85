package com.example.chat.realtime.flow;

import com.example.chat.realtime.outbound.EnqueueResult;
import com.example.chat.realtime.outbound.FrameFactory;
import com.example.chat.realtime.session.ChatConnection;
import com.example.chat.realtime.session.ConnectionClosedEvent;
import com.example.chat.realtime.support.TestConnections;
import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.config.MonitoringConfig;
import com.example.chat.shared.exception.ChatErrorKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class FlowControllerTest {

    private final FrameFactory frameFactory = new FrameFactory(new ObjectMapper());
    private final List<Object> published = new CopyOnWriteArrayList<>();

    private AppProperties appProperties;
    private SimpleMeterRegistry meterRegistry;
    private FlowController flowController;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        appProperties.getOutbound().setQueueDepth(2);
        meterRegistry = new SimpleMeterRegistry();
        flowController = new FlowController(frameFactory,
                new MonitoringConfig.ChatMetricsCollector(meterRegistry), published::add);
    }

    @Test
    void overflowClosesOnceAndAnnouncesTheClose() {
        ChatConnection stalled = new TestConnections(appProperties).openStalled();
        flowController.enqueue(stalled, frameFactory.welcome("bob", stalled.getId()));
        flowController.enqueue(stalled, frameFactory.pong());

        assertThat(flowController.enqueue(stalled, frameFactory.error(ChatErrorKind.BLOCKED, "x")))
                .isEqualTo(EnqueueResult.ACCEPTED);
        assertThat(flowController.enqueue(stalled, frameFactory.error(ChatErrorKind.BLOCKED, "y")))
                .isEqualTo(EnqueueResult.SLOW_CONSUMER);
        assertThat(flowController.enqueue(stalled, frameFactory.error(ChatErrorKind.BLOCKED, "z")))
                .isEqualTo(EnqueueResult.CLOSED);

        assertThat(stalled.isClosed()).isTrue();
        assertThat(published).singleElement()
                .isInstanceOfSatisfying(ConnectionClosedEvent.class, event -> {
                    assertThat(event.getConnection()).isSameAs(stalled);
                    assertThat(event.getReason()).isEqualTo(ChatErrorKind.SLOW_CONSUMER);
                });
        assertThat(meterRegistry.counter("chat.connections.closed", "reason", "SlowConsumer").count()).isEqualTo(1.0);
    }

    @Test
    void unserializableFrameIsCountedAsDropped() {
        ChatConnection connection = new TestConnections(appProperties).openStalled();

        assertThat(flowController.enqueue(connection, null)).isEqualTo(EnqueueResult.DROPPED);
        assertThat(connection.isClosed()).isFalse();
        assertThat(published).isEmpty();
    }

    @Test
    void exhaustedBudgetIsCountedAsRateLimited() {
        appProperties.getRateLimit().setCapacity(1);
        appProperties.getRateLimit().setRefillPerSecond(0.001);
        ChatConnection connection = new TestConnections(appProperties).openStalled();

        assertThat(flowController.tryAdmit(connection)).isTrue();
        assertThat(flowController.tryAdmit(connection)).isFalse();
        assertThat(meterRegistry.counter("chat.commands.rejected", "kind", "RateLimited").count()).isEqualTo(1.0);
    }
}
