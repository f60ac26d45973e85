package com.example.chat.realtime.router;

import com.example.chat.shared.exception.ChatErrorKind;
import com.example.chat.shared.exception.ChatException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Schema validation of inbound frames. Anything that is not a JSON object with a known
 * {@code type} and its required string fields is a {@code MalformedCommand}. Body
 * length is not checked here.
 */
@Component
@RequiredArgsConstructor
public class CommandParser {

    public static final Pattern ROOM_NAME = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final ObjectMapper objectMapper;

    public ChatCommand parse(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw malformed("Frame is not valid JSON");
        }
        if (root == null || !root.isObject()) {
            throw malformed("Frame must be a JSON object");
        }
        String typeName = text(root, "type");
        CommandType type = CommandType.fromWireName(typeName);
        if (type == null) {
            throw malformed("Unknown command type: " + typeName);
        }

        ChatCommand.ChatCommandBuilder command = ChatCommand.builder().type(type);
        switch (type) {
            case AUTH:
                command.token(required(root, "token"));
                break;
            case JOIN:
            case LEAVE:
                command.room(room(root));
                break;
            case CHANNEL:
                command.room(room(root)).body(body(root));
                break;
            case DM:
                command.to(required(root, "to")).body(body(root));
                break;
            case BLOCK:
            case UNBLOCK:
                command.userId(required(root, "userId"));
                break;
            case PING:
            default:
                break;
        }
        return command.build();
    }

    private static String room(JsonNode root) {
        String room = required(root, "room");
        if (!ROOM_NAME.matcher(room).matches()) {
            throw malformed("Room names are 1-64 characters of letters, digits, '_' or '-'");
        }
        return room;
    }

    // empty bodies are let through so they surface as InvalidMessage
    private static String body(JsonNode root) {
        JsonNode node = root.get("body");
        if (node == null || !node.isTextual()) {
            throw malformed("Missing field: body");
        }
        return node.asText();
    }

    private static String required(JsonNode root, String field) {
        String value = text(root, field);
        if (value == null || value.isBlank()) {
            throw malformed("Missing field: " + field);
        }
        return value;
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    private static ChatException malformed(String message) {
        return new ChatException(ChatErrorKind.MALFORMED_COMMAND, message);
    }
}
