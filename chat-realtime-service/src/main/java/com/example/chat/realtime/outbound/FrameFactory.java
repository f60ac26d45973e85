package com.example.chat.realtime.outbound;

import com.example.chat.realtime.notify.GameNotification;
import com.example.chat.shared.exception.ChatErrorKind;
import com.example.chat.shared.model.ChatMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the JSON frames written to clients. Field order follows the wire format,
 * with {@code type} first.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FrameFactory {

    public static final String MESSAGE = "message";
    public static final String PRESENCE = "presence";
    public static final String ERROR = "error";
    public static final String WELCOME = "welcome";
    public static final String JOINED = "joined";
    public static final String LEFT = "left";
    public static final String SENT = "sent";
    public static final String BLOCKED = "blocked";
    public static final String UNBLOCKED = "unblocked";
    public static final String PONG = "pong";
    public static final String SERVER_SHUTDOWN = "serverShutdown";

    private final ObjectMapper objectMapper;
    private final Clock clock = Clock.systemUTC();

    /**
     * Generic method to create any frame.
     * @param type the wire type, also used for logging and metrics
     * @param priority eviction class of the frame once queued
     * @param data the payload object to be serialized to JSON
     * @return the frame, or null if serialization fails; {@code FlowController.enqueue}
     *         counts a null frame as {@link EnqueueResult#DROPPED}
     */
    public OutboundFrame createFrame(String type, FramePriority priority, Object data) {
        try {
            return new OutboundFrame(type, objectMapper.writeValueAsString(data), priority);
        } catch (JsonProcessingException e) {
            log.error("Error serializing payload for frame type {}: {}", type, e.getMessage());
            return null;
        }
    }

    public OutboundFrame message(ChatMessage message) {
        Map<String, Object> data = fields(MESSAGE);
        data.put("id", message.getId());
        data.put("from", message.getSenderId());
        if (message.isDirect()) {
            data.put("to", message.getRecipientId());
        } else {
            data.put("room", message.getRoom());
        }
        data.put("body", message.getBody());
        data.put("ts", timestamp(message.getCreatedAt()));
        return createFrame(MESSAGE, FramePriority.NORMAL, data);
    }

    public OutboundFrame sent(ChatMessage message) {
        Map<String, Object> data = fields(SENT);
        data.put("id", message.getId());
        data.put("to", message.getRecipientId());
        data.put("ts", timestamp(message.getCreatedAt()));
        return createFrame(SENT, FramePriority.LOW, data);
    }

    public OutboundFrame presence(String userId, boolean online) {
        Map<String, Object> data = fields(PRESENCE);
        data.put("userId", userId);
        data.put("online", online);
        return createFrame(PRESENCE, FramePriority.LOW, data);
    }

    public OutboundFrame notification(GameNotification notification) {
        return createFrame(notification.getType(), FramePriority.HIGH, notification);
    }

    public OutboundFrame error(ChatErrorKind kind, String message) {
        Map<String, Object> data = fields(ERROR);
        data.put("kind", kind.getLabel());
        data.put("message", message);
        return createFrame(ERROR, FramePriority.HIGH, data);
    }

    public OutboundFrame welcome(String userId, String connectionId) {
        Map<String, Object> data = fields(WELCOME);
        data.put("userId", userId);
        data.put("connectionId", connectionId);
        return createFrame(WELCOME, FramePriority.HIGH, data);
    }

    public OutboundFrame joined(String room) {
        Map<String, Object> data = fields(JOINED);
        data.put("room", room);
        return createFrame(JOINED, FramePriority.LOW, data);
    }

    public OutboundFrame left(String room) {
        Map<String, Object> data = fields(LEFT);
        data.put("room", room);
        return createFrame(LEFT, FramePriority.LOW, data);
    }

    public OutboundFrame blocked(String userId) {
        Map<String, Object> data = fields(BLOCKED);
        data.put("userId", userId);
        return createFrame(BLOCKED, FramePriority.LOW, data);
    }

    public OutboundFrame unblocked(String userId) {
        Map<String, Object> data = fields(UNBLOCKED);
        data.put("userId", userId);
        return createFrame(UNBLOCKED, FramePriority.LOW, data);
    }

    public OutboundFrame pong() {
        Map<String, Object> data = fields(PONG);
        data.put("ts", timestamp(OffsetDateTime.now(clock)));
        return createFrame(PONG, FramePriority.LOW, data);
    }

    public OutboundFrame serverShutdown() {
        Map<String, Object> data = fields(SERVER_SHUTDOWN);
        data.put("message", "Server is shutting down. Please reconnect momentarily.");
        return createFrame(SERVER_SHUTDOWN, FramePriority.HIGH, data);
    }

    private static Map<String, Object> fields(String type) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", type);
        return data;
    }

    private static String timestamp(OffsetDateTime value) {
        return value.withOffsetSameInstant(ZoneOffset.UTC).toString();
    }
}
