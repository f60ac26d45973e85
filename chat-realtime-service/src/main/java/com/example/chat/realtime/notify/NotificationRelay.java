package com.example.chat.realtime.notify;

import com.example.chat.realtime.flow.FlowController;
import com.example.chat.realtime.outbound.FrameFactory;
import com.example.chat.realtime.outbound.OutboundFrame;
import com.example.chat.realtime.session.ChatConnection;
import com.example.chat.realtime.session.SessionRegistry;
import com.example.chat.shared.aspect.Monitored;
import com.example.chat.shared.config.MonitoringConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pushes game notifications to every live connection of a user as high-priority frames.
 * Notifications bypass inbound rate limits. Nothing is queued for offline users.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("notification")
public class NotificationRelay {

    private final SessionRegistry sessionRegistry;
    private final FlowController flowController;
    private final FrameFactory frameFactory;
    private final MonitoringConfig.ChatMetricsCollector metricsCollector;

    /**
     * @return the number of connections the notification was queued on; 0 if the user is offline
     */
    public int notify(String userId, GameNotification notification) {
        List<ChatConnection> connections = sessionRegistry.connectionsFor(userId);
        if (connections.isEmpty()) {
            log.debug("User {} has no live connection, dropping {} notification", userId, notification.getType());
            metricsCollector.incrementCounter("chat.notifications", "type", notification.getType(), "status", "offline");
            return 0;
        }
        OutboundFrame frame = frameFactory.notification(notification);
        int delivered = 0;
        for (ChatConnection connection : connections) {
            if (flowController.enqueue(connection, frame).isAccepted()) {
                delivered++;
            }
        }
        metricsCollector.incrementCounter("chat.notifications", "type", notification.getType(), "status", "delivered");
        log.info("Relayed {} notification to user {} on {} of {} connections",
                notification.getType(), userId, delivered, connections.size());
        return delivered;
    }

    public int sendInvite(String toUserId, String fromUserId, String matchId) {
        return notify(toUserId, new MatchInvite(fromUserId, matchId));
    }

    /**
     * Announces the next match to both players.
     *
     * @return connections reached per player
     */
    public Map<String, Integer> announceTournamentMatch(TournamentAnnouncement announcement) {
        Map<String, Integer> delivered = new LinkedHashMap<>();
        delivered.put(announcement.getP1(), notify(announcement.getP1(), announcement));
        if (!announcement.getP2().equals(announcement.getP1())) {
            delivered.put(announcement.getP2(), notify(announcement.getP2(), announcement));
        }
        return delivered;
    }
}
