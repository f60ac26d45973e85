package com.example.chat.realtime.session;

import com.example.chat.realtime.flow.TokenBucket;
import com.example.chat.realtime.outbound.OutboundFrame;
import com.example.chat.realtime.outbound.OutboundQueue;
import lombok.AccessLevel;
import lombok.Getter;
import org.springframework.web.reactive.socket.CloseStatus;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One live WebSocket session. The identity is bound once, on authentication.
 */
@Getter
public class ChatConnection {

    private final String id;
    private final OffsetDateTime createdAt;
    private final OutboundQueue outbound;
    private final TokenBucket inboundBudget;
    private final TokenBucket moderationBudget;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private final Set<String> rooms = ConcurrentHashMap.newKeySet();
    private final AtomicInteger malformedCommands = new AtomicInteger();
    @Getter(AccessLevel.NONE)
    private final Sinks.Empty<Void> closeSignal = Sinks.empty();

    private volatile String userId;
    private volatile CloseStatus closeStatus = CloseStatus.NORMAL;

    public ChatConnection(String id, OffsetDateTime createdAt, OutboundQueue outbound,
                          TokenBucket inboundBudget, TokenBucket moderationBudget) {
        this.id = id;
        this.createdAt = createdAt;
        this.outbound = outbound;
        this.inboundBudget = inboundBudget;
        this.moderationBudget = moderationBudget;
    }

    public ConnectionState getState() {
        return state.get();
    }

    /**
     * Binds the verified identity. Only valid while {@link ConnectionState#CONNECTING}.
     */
    public boolean authenticate(String verifiedUserId) {
        if (state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.AUTHENTICATED)) {
            this.userId = verifiedUserId;
            return true;
        }
        return false;
    }

    public boolean activate() {
        return state.compareAndSet(ConnectionState.AUTHENTICATED, ConnectionState.ACTIVE);
    }

    public boolean isActive() {
        return state.get() == ConnectionState.ACTIVE;
    }

    public boolean isClosed() {
        return state.get() == ConnectionState.CLOSED;
    }

    public Set<String> getRooms() {
        return Collections.unmodifiableSet(rooms);
    }

    public boolean isSubscribed(String room) {
        return rooms.contains(room);
    }

    boolean addRoom(String room) {
        return rooms.add(room);
    }

    boolean removeRoom(String room) {
        return rooms.remove(room);
    }

    public int recordMalformedCommand() {
        return malformedCommands.incrementAndGet();
    }

    /**
     * Moves to {@link ConnectionState#CLOSED} and closes the outbound queue; the writer
     * completes once {@code finalFrame} (if any) is flushed and the transport is closed
     * with {@code status}. Only the first call has any effect.
     *
     * @return true if this call closed the connection
     */
    public boolean close(CloseStatus status, OutboundFrame finalFrame, boolean discardPending) {
        ConnectionState previous = state.getAndSet(ConnectionState.CLOSED);
        if (previous == ConnectionState.CLOSED) {
            return false;
        }
        this.closeStatus = status;
        outbound.close(finalFrame, discardPending);
        closeSignal.tryEmitEmpty();
        return true;
    }

    /**
     * Completes once {@link #close} has been called, whether or not the writer has
     * drained.
     */
    public Mono<Void> closed() {
        return closeSignal.asMono();
    }

    @Override
    public String toString() {
        return "ChatConnection{id=" + id + ", userId=" + userId + ", state=" + state.get() + "}";
    }
}
