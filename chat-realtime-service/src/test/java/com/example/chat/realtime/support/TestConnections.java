package com.example.chat.realtime.support;

import com.example.chat.realtime.outbound.OutboundFrame;
import com.example.chat.realtime.session.ChatConnection;
import com.example.chat.realtime.session.ChatConnectionFactory;
import com.example.chat.shared.config.AppProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * A connection whose outbound frames are captured as they are written.
 */
public class TestConnections {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ChatConnectionFactory factory;

    public TestConnections(AppProperties appProperties) {
        this.factory = new ChatConnectionFactory(appProperties);
    }

    public Captured open() {
        ChatConnection connection = factory.create();
        Captured captured = new Captured(connection);
        connection.getOutbound().asFlux().subscribe(captured.frames::add);
        return captured;
    }

    /**
     * Opens a connection and leaves its writer unsubscribed, so frames pile up in the queue.
     */
    public ChatConnection openStalled() {
        return factory.create();
    }

    public static class Captured {
        private final ChatConnection connection;
        private final List<OutboundFrame> frames = new CopyOnWriteArrayList<>();

        Captured(ChatConnection connection) {
            this.connection = connection;
        }

        public ChatConnection connection() {
            return connection;
        }

        public List<JsonNode> frames() {
            return frames.stream().map(f -> parse(f.getPayload())).collect(Collectors.toList());
        }

        public List<JsonNode> framesOfType(String type) {
            return frames().stream().filter(f -> type.equals(f.path("type").asText())).collect(Collectors.toList());
        }

        public List<String> types() {
            return frames().stream().map(f -> f.path("type").asText()).collect(Collectors.toList());
        }

        public JsonNode last() {
            List<JsonNode> all = frames();
            return all.isEmpty() ? null : all.get(all.size() - 1);
        }

        public void clear() {
            frames.clear();
        }
    }

    private static JsonNode parse(String payload) {
        try {
            return MAPPER.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Frame is not JSON: " + payload, e);
        }
    }
}
