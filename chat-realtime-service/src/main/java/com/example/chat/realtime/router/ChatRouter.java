package com.example.chat.realtime.router;

import com.example.chat.realtime.auth.IdentityVerifier;
import com.example.chat.realtime.flow.FlowController;
import com.example.chat.realtime.outbound.FrameFactory;
import com.example.chat.realtime.outbound.OutboundFrame;
import com.example.chat.realtime.session.ChatCloseStatus;
import com.example.chat.realtime.session.ChatConnection;
import com.example.chat.realtime.session.ConnectionClosedEvent;
import com.example.chat.realtime.session.ConnectionState;
import com.example.chat.realtime.session.PresenceTransition;
import com.example.chat.realtime.session.SessionRegistry;
import com.example.chat.realtime.session.Unregistration;
import com.example.chat.shared.aspect.Monitored;
import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.config.MonitoringConfig;
import com.example.chat.shared.exception.ChatErrorKind;
import com.example.chat.shared.exception.ChatException;
import com.example.chat.shared.exception.UnauthorizedException;
import com.example.chat.shared.model.ChatMessage;
import com.example.chat.shared.service.BlockRegistry;
import com.example.chat.shared.service.HistoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.socket.CloseStatus;

import java.util.Collection;

/**
 * Per-connection protocol state machine and message fan-out.
 *
 * <p>Frames of one connection arrive here one at a time, in receipt order. Room and
 * DM sends hold a striped lock for their conversation across persist and fan-out, so
 * every recipient sees a conversation's messages in the order they were committed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("router")
public class ChatRouter {

    public static final String CONNECTION_ID_KEY = "connection_id";
    public static final String USER_ID_KEY = "user_id";

    private static final int DELIVERY_LOCK_STRIPES = 64;

    private final SessionRegistry sessionRegistry;
    private final FlowController flowController;
    private final FrameFactory frameFactory;
    private final CommandParser commandParser;
    private final IdentityVerifier identityVerifier;
    private final HistoryStore historyStore;
    private final BlockRegistry blockRegistry;
    private final AppProperties appProperties;
    private final MonitoringConfig.ChatMetricsCollector metricsCollector;

    private final Object[] deliveryLocks = newLocks(DELIVERY_LOCK_STRIPES);

    /**
     * Called once per transport session before any frame is read. With a handshake
     * token the connection is authenticated right away; without one it waits in
     * {@link ConnectionState#CONNECTING} for an {@code auth} frame.
     */
    public void open(ChatConnection connection, String handshakeToken) {
        MDC.put(CONNECTION_ID_KEY, connection.getId());
        try {
            if (handshakeToken == null || handshakeToken.isBlank()) {
                log.debug("Connection {} opened without credentials, awaiting auth frame", connection.getId());
                return;
            }
            authenticate(connection, handshakeToken);
        } finally {
            MDC.remove(CONNECTION_ID_KEY);
            MDC.remove(USER_ID_KEY);
        }
    }

    public void handleFrame(ChatConnection connection, String payload) {
        if (connection.isClosed()) {
            return;
        }
        MDC.put(CONNECTION_ID_KEY, connection.getId());
        if (connection.getUserId() != null) {
            MDC.put(USER_ID_KEY, connection.getUserId());
        }
        try {
            if (connection.getState() != ConnectionState.ACTIVE) {
                handleBeforeActivation(connection, payload);
                return;
            }
            ChatCommand command;
            try {
                command = commandParser.parse(payload);
            } catch (ChatException e) {
                handleMalformed(connection, e.getMessage());
                return;
            }
            dispatch(connection, command);
        } catch (ChatException e) {
            reject(connection, e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error handling frame on connection {}: {}", connection.getId(), e.getMessage(), e);
            reject(connection, ChatErrorKind.PERSISTENCE_FAILURE, "Command could not be processed, try again");
        } finally {
            MDC.remove(CONNECTION_ID_KEY);
            MDC.remove(USER_ID_KEY);
        }
    }

    /**
     * Tears a connection down after its transport closed or it was closed server-side.
     * Safe to call more than once and concurrently with fan-outs targeting it.
     */
    public void disconnect(ChatConnection connection) {
        connection.close(CloseStatus.NORMAL, null, false);
        Unregistration unregistration = sessionRegistry.unregister(connection.getId());
        if (unregistration.wentOffline()) {
            log.info("User {} is now offline", unregistration.getUserId());
            for (String room : unregistration.getPresenceRooms()) {
                announcePresence(room, unregistration.getUserId(), false);
            }
        }
    }

    @EventListener
    public void onConnectionClosed(ConnectionClosedEvent event) {
        log.debug("Unregistering connection {} closed with {}", event.getConnection().getId(), event.getReason().getLabel());
        disconnect(event.getConnection());
    }

    private void handleBeforeActivation(ChatConnection connection, String payload) {
        ChatCommand command;
        try {
            command = commandParser.parse(payload);
        } catch (ChatException e) {
            closeWithError(connection, ChatErrorKind.UNAUTHORIZED, "Authentication required");
            return;
        }
        if (command.getType() != CommandType.AUTH) {
            closeWithError(connection, ChatErrorKind.UNAUTHORIZED, "Authentication required");
            return;
        }
        authenticate(connection, command.getToken());
    }

    private void authenticate(ChatConnection connection, String token) {
        String userId;
        try {
            userId = identityVerifier.verify(token);
        } catch (UnauthorizedException e) {
            closeWithError(connection, ChatErrorKind.UNAUTHORIZED, e.getMessage());
            return;
        }
        if (!connection.authenticate(userId)) {
            return;
        }
        MDC.put(USER_ID_KEY, userId);
        PresenceTransition transition = sessionRegistry.register(connection);
        if (!connection.activate()) {
            // transport went away while we were verifying
            disconnect(connection);
            return;
        }
        if (transition == PresenceTransition.ONLINE) {
            log.info("User {} is now online", userId);
        }
        flowController.enqueue(connection, frameFactory.welcome(userId, connection.getId()));
    }

    private void dispatch(ChatConnection connection, ChatCommand command) {
        if (command.getType() == CommandType.AUTH) {
            throw new ChatException(ChatErrorKind.INVALID_MESSAGE, "Connection is already authenticated");
        }
        boolean admitted = command.getType().isModeration()
                ? flowController.tryAdmitModeration(connection)
                : flowController.tryAdmit(connection);
        if (!admitted) {
            reject(connection, ChatErrorKind.RATE_LIMITED, "Rate limit exceeded, command dropped");
            return;
        }

        switch (command.getType()) {
            case JOIN:
                join(connection, command.getRoom());
                break;
            case LEAVE:
                leave(connection, command.getRoom());
                break;
            case CHANNEL:
                sendToRoom(connection, command.getRoom(), command.getBody());
                break;
            case DM:
                sendDirect(connection, command.getTo(), command.getBody());
                break;
            case BLOCK:
                block(connection, command.getUserId());
                break;
            case UNBLOCK:
                unblock(connection, command.getUserId());
                break;
            case PING:
                flowController.enqueue(connection, frameFactory.pong());
                break;
            default:
                throw new ChatException(ChatErrorKind.MALFORMED_COMMAND, "Unsupported command: " + command.getType());
        }
    }

    private void join(ChatConnection connection, String room) {
        boolean firstAppearance = sessionRegistry.subscribe(connection.getId(), room);
        flowController.enqueue(connection, frameFactory.joined(room));
        log.debug("Connection {} joined room {}", connection.getId(), room);
        if (firstAppearance) {
            announcePresence(room, connection.getUserId(), true);
        }
    }

    private void leave(ChatConnection connection, String room) {
        sessionRegistry.unsubscribe(connection.getId(), room);
        flowController.enqueue(connection, frameFactory.left(room));
    }

    private void sendToRoom(ChatConnection connection, String room, String rawBody) {
        if (!connection.isSubscribed(room)) {
            throw new ChatException(ChatErrorKind.INVALID_MESSAGE, "Join room " + room + " before sending to it");
        }
        String body = validateBody(rawBody);
        ChatMessage draft = ChatMessage.builder()
                .senderId(connection.getUserId())
                .room(room)
                .body(body)
                .build();

        long start = System.currentTimeMillis();
        int recipients;
        synchronized (lockFor("room:" + room)) {
            ChatMessage saved = historyStore.append(draft);
            recipients = deliver(sessionRegistry.subscribersOf(room), frameFactory.message(saved), null);
        }
        metricsCollector.incrementCounter("chat.messages.persisted", "type", "channel");
        metricsCollector.recordTimer("chat.delivery.latency", System.currentTimeMillis() - start);
        log.debug("Room message from {} to {} delivered to {} connections", connection.getUserId(), room, recipients);
    }

    private void sendDirect(ChatConnection connection, String to, String rawBody) {
        String from = connection.getUserId();
        if (from.equals(to)) {
            throw new ChatException(ChatErrorKind.INVALID_MESSAGE, "Cannot send a direct message to yourself");
        }
        String body = validateBody(rawBody);
        if (blockRegistry.isBlocked(from, to)) {
            // same answer whichever side blocked
            throw new ChatException(ChatErrorKind.BLOCKED, "Message could not be delivered to " + to);
        }
        ChatMessage draft = ChatMessage.builder()
                .senderId(from)
                .recipientId(to)
                .body(body)
                .build();

        long start = System.currentTimeMillis();
        synchronized (lockFor(directKey(from, to))) {
            ChatMessage saved = historyStore.append(draft);
            OutboundFrame frame = frameFactory.message(saved);
            deliver(sessionRegistry.connectionsFor(to), frame, null);
            deliver(sessionRegistry.connectionsFor(from), frame, connection);
            flowController.enqueue(connection, frameFactory.sent(saved));
        }
        metricsCollector.incrementCounter("chat.messages.persisted", "type", "dm");
        metricsCollector.recordTimer("chat.delivery.latency", System.currentTimeMillis() - start);
    }

    private void block(ChatConnection connection, String target) {
        requireOther(connection, target, "Cannot block yourself");
        blockRegistry.add(connection.getUserId(), target);
        flowController.enqueue(connection, frameFactory.blocked(target));
    }

    private void unblock(ChatConnection connection, String target) {
        requireOther(connection, target, "Cannot unblock yourself");
        blockRegistry.remove(connection.getUserId(), target);
        flowController.enqueue(connection, frameFactory.unblocked(target));
    }

    private void announcePresence(String room, String userId, boolean online) {
        OutboundFrame frame = frameFactory.presence(userId, online);
        for (ChatConnection subscriber : sessionRegistry.subscribersOf(room)) {
            if (!userId.equals(subscriber.getUserId())) {
                flowController.enqueue(subscriber, frame);
            }
        }
    }

    private int deliver(Collection<ChatConnection> targets, OutboundFrame frame, ChatConnection skip) {
        int accepted = 0;
        for (ChatConnection target : targets) {
            if (target == skip) {
                continue;
            }
            if (flowController.enqueue(target, frame).isAccepted()) {
                accepted++;
            }
        }
        return accepted;
    }

    private String validateBody(String body) {
        String trimmed = body == null ? "" : body.trim();
        int maxLength = appProperties.getMessage().getMaxLength();
        if (trimmed.isEmpty()) {
            throw new ChatException(ChatErrorKind.INVALID_MESSAGE, "Message body is empty");
        }
        if (trimmed.length() > maxLength) {
            throw new ChatException(ChatErrorKind.INVALID_MESSAGE, "Message body exceeds " + maxLength + " characters");
        }
        return trimmed;
    }

    private static void requireOther(ChatConnection connection, String target, String message) {
        if (connection.getUserId().equals(target)) {
            throw new ChatException(ChatErrorKind.INVALID_MESSAGE, message);
        }
    }

    private void handleMalformed(ChatConnection connection, String reason) {
        int count = connection.recordMalformedCommand();
        int threshold = appProperties.getProtocol().getMaxMalformedCommands();
        if (count > threshold) {
            log.warn("Connection {} sent {} malformed commands, closing", connection.getId(), count);
            closeWithError(connection, ChatErrorKind.MALFORMED_COMMAND, "Too many malformed commands");
        } else {
            reject(connection, ChatErrorKind.MALFORMED_COMMAND, reason);
        }
    }

    private void reject(ChatConnection connection, ChatErrorKind kind, String message) {
        if (kind.isFatal()) {
            closeWithError(connection, kind, message);
            return;
        }
        if (kind == ChatErrorKind.RATE_LIMITED) {
            log.debug("Rate limited connection {} of user {}", connection.getId(), connection.getUserId());
        } else {
            log.warn("Rejected command on connection {}: {} - {}", connection.getId(), kind.getLabel(), message);
        }
        flowController.enqueue(connection, frameFactory.error(kind, message));
    }

    private void closeWithError(ChatConnection connection, ChatErrorKind kind, String message) {
        if (connection.close(ChatCloseStatus.forKind(kind), frameFactory.error(kind, message), false)) {
            metricsCollector.incrementCounter("chat.connections.closed", "reason", kind.getLabel());
            log.warn("Closing connection {}: {} - {}", connection.getId(), kind.getLabel(), message);
            disconnect(connection);
        }
    }

    private Object lockFor(String conversationKey) {
        return deliveryLocks[Math.floorMod(conversationKey.hashCode(), deliveryLocks.length)];
    }

    private static String directKey(String userA, String userB) {
        return userA.compareTo(userB) < 0 ? "dm:" + userA + "|" + userB : "dm:" + userB + "|" + userA;
    }

    private static Object[] newLocks(int stripes) {
        Object[] locks = new Object[stripes];
        for (int i = 0; i < stripes; i++) {
            locks[i] = new Object();
        }
        return locks;
    }
}
