package com.example.chat.realtime.session;

import com.example.chat.realtime.outbound.FrameFactory;
import com.example.chat.shared.config.AppProperties;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live connections of this instance, indexed by connection id, identity and room.
 *
 * <p>Every change that affects an identity (register, unregister, subscribe) runs inside
 * {@code identities.compute(userId, ...)}, so presence edges for one identity are
 * decided one at a time and never duplicated by concurrent connects and disconnects.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SessionRegistry {

    private final Map<String, ChatConnection> connections = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, IdentitySessions> identities = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> roomSubscribers = new ConcurrentHashMap<>();

    private final FrameFactory frameFactory;
    private final AppProperties appProperties;

    /**
     * Per-identity state, only touched inside {@code identities.compute}.
     */
    private static final class IdentitySessions {
        private final Set<String> connectionIds = new HashSet<>();
        // rooms this identity has announced itself in during the current online period
        private final Set<String> presenceRooms = new LinkedHashSet<>();
    }

    /**
     * Adds an authenticated connection.
     *
     * @return {@link PresenceTransition#ONLINE} if this is the identity's first live connection
     * @throws DuplicateConnectionException if the connection id is already registered
     */
    public PresenceTransition register(ChatConnection connection) {
        String userId = connection.getUserId();
        if (userId == null) {
            throw new IllegalStateException("Cannot register unauthenticated connection " + connection.getId());
        }
        if (connections.putIfAbsent(connection.getId(), connection) != null) {
            throw new DuplicateConnectionException(connection.getId());
        }
        AtomicReference<PresenceTransition> transition = new AtomicReference<>(PresenceTransition.NONE);
        identities.compute(userId, (key, sessions) -> {
            IdentitySessions current = sessions != null ? sessions : new IdentitySessions();
            if (current.connectionIds.isEmpty()) {
                transition.set(PresenceTransition.ONLINE);
            }
            current.connectionIds.add(connection.getId());
            return current;
        });
        log.info("Registered connection {} for user {} ({} connections on this pod)", connection.getId(), userId, connections.size());
        return transition.get();
    }

    /**
     * Removes a connection and its room subscriptions. Unknown ids are ignored.
     */
    public Unregistration unregister(String connectionId) {
        ChatConnection connection = connections.remove(connectionId);
        if (connection == null) {
            return Unregistration.unknown();
        }
        String userId = connection.getUserId();
        AtomicReference<Unregistration> outcome = new AtomicReference<>();
        identities.compute(userId, (key, sessions) -> {
            for (String room : connection.getRooms()) {
                removeSubscriber(room, connectionId);
            }
            if (sessions == null) {
                outcome.set(new Unregistration(userId, PresenceTransition.NONE, Set.of()));
                return null;
            }
            sessions.connectionIds.remove(connectionId);
            if (sessions.connectionIds.isEmpty()) {
                outcome.set(new Unregistration(userId, PresenceTransition.OFFLINE, Set.copyOf(sessions.presenceRooms)));
                return null;
            }
            outcome.set(new Unregistration(userId, PresenceTransition.NONE, Set.of()));
            return sessions;
        });
        log.info("Unregistered connection {} for user {}", connectionId, userId);
        return outcome.get();
    }

    /**
     * Subscribes a connection to a room.
     *
     * @return true if this is the first time the identity appears in the room during
     *         its current online period, i.e. room peers should see it come online
     */
    public boolean subscribe(String connectionId, String room) {
        ChatConnection connection = connections.get(connectionId);
        if (connection == null) {
            return false;
        }
        AtomicBoolean firstAppearance = new AtomicBoolean(false);
        identities.computeIfPresent(connection.getUserId(), (key, sessions) -> {
            // lost a race with unregister
            if (!sessions.connectionIds.contains(connectionId)) {
                return sessions;
            }
            connection.addRoom(room);
            roomSubscribers.compute(room, (r, subscribers) -> {
                Set<String> updated = subscribers != null ? subscribers : ConcurrentHashMap.newKeySet();
                updated.add(connectionId);
                return updated;
            });
            firstAppearance.set(sessions.presenceRooms.add(room));
            return sessions;
        });
        return firstAppearance.get();
    }

    public boolean unsubscribe(String connectionId, String room) {
        ChatConnection connection = connections.get(connectionId);
        if (connection == null) {
            return false;
        }
        AtomicBoolean removed = new AtomicBoolean(false);
        identities.computeIfPresent(connection.getUserId(), (key, sessions) -> {
            removed.set(connection.removeRoom(room));
            removeSubscriber(room, connectionId);
            return sessions;
        });
        return removed.get();
    }

    public List<ChatConnection> connectionsFor(String userId) {
        List<ChatConnection> result = new ArrayList<>();
        identities.computeIfPresent(userId, (key, sessions) -> {
            for (String connectionId : sessions.connectionIds) {
                ChatConnection connection = connections.get(connectionId);
                if (connection != null) {
                    result.add(connection);
                }
            }
            return sessions;
        });
        return result;
    }

    public boolean isOnline(String userId) {
        return identities.containsKey(userId);
    }

    /**
     * Snapshot of the room's subscribers. Connections closed after the snapshot is taken
     * simply reject the frames offered to them.
     */
    public List<ChatConnection> subscribersOf(String room) {
        Set<String> subscriberIds = roomSubscribers.get(room);
        if (subscriberIds == null) {
            return List.of();
        }
        List<ChatConnection> result = new ArrayList<>(subscriberIds.size());
        for (String connectionId : subscriberIds) {
            ChatConnection connection = connections.get(connectionId);
            if (connection != null) {
                result.add(connection);
            }
        }
        return result;
    }

    public int getConnectionCount() {
        return connections.size();
    }

    public int getOnlineUserCount() {
        return identities.size();
    }

    public int getRoomCount() {
        return roomSubscribers.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Commencing SessionRegistry graceful shutdown...");
        if (connections.isEmpty()) {
            log.info("SessionRegistry shutdown complete, no live connections.");
            return;
        }
        log.info("Sending shutdown notice to {} connected clients...", connections.size());
        for (ChatConnection connection : new ArrayList<>(connections.values())) {
            connection.close(ChatCloseStatus.SERVER_SHUTDOWN, frameFactory.serverShutdown(), false);
        }
        try {
            // give the writers a moment to flush the notice before the server stops
            Thread.sleep(appProperties.getWebsocket().getShutdownGracePeriod().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for shutdown notices to flush");
        }
        new ArrayList<>(connections.keySet()).forEach(this::unregister);
        log.info("SessionRegistry shutdown complete.");
    }

    private void removeSubscriber(String room, String connectionId) {
        roomSubscribers.computeIfPresent(room, (r, subscribers) -> {
            subscribers.remove(connectionId);
            return subscribers.isEmpty() ? null : subscribers;
        });
    }
}
