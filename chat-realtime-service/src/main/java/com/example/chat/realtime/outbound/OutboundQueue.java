package com.example.chat.realtime.outbound;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded per-connection buffer between producers (router, relay, registry) and the
 * WebSocket writer. Producers never block: a full queue either evicts the oldest
 * low-priority frame or reports {@link EnqueueResult#SLOW_CONSUMER}. The writer side
 * is a {@link Flux} that only pulls as many frames as the transport has requested.
 */
@Slf4j
public class OutboundQueue {

    private final int capacity;
    private final ArrayDeque<OutboundFrame> pending;
    private final Object lock = new Object();
    private final AtomicInteger wip = new AtomicInteger();

    // guarded by lock
    private FluxSink<OutboundFrame> sink;
    private boolean closed;
    private boolean completed;
    private long evictedCount;

    public OutboundQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.pending = new ArrayDeque<>(Math.min(capacity, 64));
    }

    /**
     * The frames of this queue, in order. Only one subscriber is supported.
     */
    public Flux<OutboundFrame> asFlux() {
        return Flux.create(this::attach);
    }

    public EnqueueResult offer(OutboundFrame frame) {
        EnqueueResult result;
        synchronized (lock) {
            if (closed) {
                return EnqueueResult.CLOSED;
            }
            if (pending.size() < capacity) {
                pending.addLast(frame);
                result = EnqueueResult.ACCEPTED;
            } else if (frame.getPriority() == FramePriority.NORMAL) {
                return EnqueueResult.SLOW_CONSUMER;
            } else if (evictOldestLowPriority()) {
                pending.addLast(frame);
                result = EnqueueResult.ACCEPTED;
            } else if (frame.getPriority() == FramePriority.LOW) {
                return EnqueueResult.DROPPED;
            } else {
                return EnqueueResult.SLOW_CONSUMER;
            }
        }
        drain();
        return result;
    }

    /**
     * Stops accepting frames. Pending frames are flushed unless {@code discardPending};
     * {@code finalFrame}, when given, is written last regardless of capacity. The flux
     * completes once everything has been written.
     *
     * @return false if the queue was already closed
     */
    public boolean close(OutboundFrame finalFrame, boolean discardPending) {
        synchronized (lock) {
            if (closed) {
                return false;
            }
            closed = true;
            if (discardPending) {
                pending.clear();
            }
            if (finalFrame != null) {
                pending.addLast(finalFrame);
            }
        }
        drain();
        return true;
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    public int size() {
        synchronized (lock) {
            return pending.size();
        }
    }

    public long getEvictedCount() {
        synchronized (lock) {
            return evictedCount;
        }
    }

    public int getCapacity() {
        return capacity;
    }

    private void attach(FluxSink<OutboundFrame> fluxSink) {
        synchronized (lock) {
            if (sink != null) {
                fluxSink.error(new IllegalStateException("Outbound queue already has a subscriber"));
                return;
            }
            sink = fluxSink;
        }
        fluxSink.onRequest(n -> drain());
        fluxSink.onDispose(this::detach);
        drain();
    }

    private void detach() {
        synchronized (lock) {
            closed = true;
            completed = true;
            pending.clear();
        }
    }

    private boolean evictOldestLowPriority() {
        Iterator<OutboundFrame> it = pending.iterator();
        while (it.hasNext()) {
            OutboundFrame candidate = it.next();
            if (candidate.getPriority() == FramePriority.LOW) {
                it.remove();
                evictedCount++;
                log.debug("Evicted {} frame to make room on a full outbound queue", candidate.getType());
                return true;
            }
        }
        return false;
    }

    private void drain() {
        if (wip.getAndIncrement() != 0) {
            return;
        }
        int missed = 1;
        do {
            while (true) {
                FluxSink<OutboundFrame> target;
                OutboundFrame next = null;
                boolean complete = false;
                synchronized (lock) {
                    target = sink;
                    if (target == null || completed) {
                        break;
                    }
                    if (!pending.isEmpty()) {
                        if (target.requestedFromDownstream() <= 0) {
                            break;
                        }
                        next = pending.pollFirst();
                    } else if (closed) {
                        completed = true;
                        complete = true;
                    } else {
                        break;
                    }
                }
                if (complete) {
                    target.complete();
                    break;
                }
                target.next(next);
            }
            missed = wip.addAndGet(-missed);
        } while (missed != 0);
    }
}
