package com.example.chat.realtime.outbound;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class OutboundQueueTest {

    @Test
    void deliversOnlyWhatTheWriterRequests() {
        OutboundQueue queue = new OutboundQueue(8);
        queue.offer(chat("m1"));
        queue.offer(chat("m2"));
        queue.offer(chat("m3"));

        StepVerifier.create(queue.asFlux().map(OutboundFrame::getPayload), 1)
                .expectNext("m1")
                .thenRequest(1)
                .expectNext("m2")
                .then(() -> assertThat(queue.size()).isEqualTo(1))
                .thenRequest(5)
                .expectNext("m3")
                .then(() -> queue.offer(chat("m4")))
                .expectNext("m4")
                .then(() -> queue.close(null, false))
                .verifyComplete();
    }

    @Test
    void chatOverflowReportsSlowConsumer() {
        OutboundQueue queue = new OutboundQueue(3);
        for (int i = 0; i < 3; i++) {
            assertThat(queue.offer(chat("m" + i))).isEqualTo(EnqueueResult.ACCEPTED);
        }

        assertThat(queue.offer(chat("overflow"))).isEqualTo(EnqueueResult.SLOW_CONSUMER);
        assertThat(queue.size()).isEqualTo(3);
    }

    @Test
    void presenceEvictsOldestLowPriorityFrame() {
        OutboundQueue queue = new OutboundQueue(3);
        queue.offer(presence("p1"));
        queue.offer(chat("m1"));
        queue.offer(presence("p2"));

        assertThat(queue.offer(presence("p3"))).isEqualTo(EnqueueResult.ACCEPTED);

        assertThat(drain(queue)).containsExactly("m1", "p2", "p3");
        assertThat(queue.getEvictedCount()).isEqualTo(1);
    }

    @Test
    void presenceIsDroppedWhenNothingIsEvictable() {
        OutboundQueue queue = new OutboundQueue(2);
        queue.offer(chat("m1"));
        queue.offer(chat("m2"));

        assertThat(queue.offer(presence("p1"))).isEqualTo(EnqueueResult.DROPPED);
        assertThat(drain(queue)).containsExactly("m1", "m2");
    }

    @Test
    void tournamentAnnouncementIsNeverEvicted() {
        OutboundQueue queue = new OutboundQueue(3);
        queue.offer(presence("p1"));
        queue.offer(presence("p2"));
        queue.offer(presence("p3"));

        assertThat(queue.offer(notification("announce"))).isEqualTo(EnqueueResult.ACCEPTED);
        assertThat(queue.offer(presence("p4"))).isEqualTo(EnqueueResult.ACCEPTED);
        assertThat(queue.offer(presence("p5"))).isEqualTo(EnqueueResult.ACCEPTED);
        assertThat(queue.offer(presence("p6"))).isEqualTo(EnqueueResult.ACCEPTED);

        assertThat(drain(queue)).containsExactly("announce", "p5", "p6");
    }

    @Test
    void highPriorityOnQueueFullOfChatReportsSlowConsumer() {
        OutboundQueue queue = new OutboundQueue(2);
        queue.offer(chat("m1"));
        queue.offer(chat("m2"));

        assertThat(queue.offer(notification("announce"))).isEqualTo(EnqueueResult.SLOW_CONSUMER);
    }

    @Test
    void closeFlushesPendingThenFinalFrame() {
        OutboundQueue queue = new OutboundQueue(4);
        queue.offer(chat("m1"));
        queue.offer(chat("m2"));

        assertThat(queue.close(notification("bye"), false)).isTrue();
        assertThat(queue.close(null, false)).isFalse();
        assertThat(queue.offer(chat("late"))).isEqualTo(EnqueueResult.CLOSED);

        StepVerifier.create(queue.asFlux().map(OutboundFrame::getPayload))
                .expectNext("m1", "m2", "bye")
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void closeCanDiscardPending() {
        OutboundQueue queue = new OutboundQueue(4);
        queue.offer(chat("m1"));
        queue.offer(chat("m2"));

        queue.close(notification("error"), true);

        StepVerifier.create(queue.asFlux().map(OutboundFrame::getPayload))
                .expectNext("error")
                .verifyComplete();
    }

    @Test
    void cancelledWriterClosesTheQueue() {
        OutboundQueue queue = new OutboundQueue(4);

        StepVerifier.create(queue.asFlux())
                .thenCancel()
                .verify();

        assertThat(queue.isClosed()).isTrue();
        assertThat(queue.offer(chat("m1"))).isEqualTo(EnqueueResult.CLOSED);
    }

    private static List<String> drain(OutboundQueue queue) {
        queue.close(null, false);
        return queue.asFlux()
                .map(OutboundFrame::getPayload)
                .collect(Collectors.toList())
                .block(Duration.ofSeconds(5));
    }

    private static OutboundFrame chat(String payload) {
        return new OutboundFrame(FrameFactory.MESSAGE, payload, FramePriority.NORMAL);
    }

    private static OutboundFrame presence(String payload) {
        return new OutboundFrame(FrameFactory.PRESENCE, payload, FramePriority.LOW);
    }

    private static OutboundFrame notification(String payload) {
        return new OutboundFrame("tournamentAnnounce", payload, FramePriority.HIGH);
    }
}
