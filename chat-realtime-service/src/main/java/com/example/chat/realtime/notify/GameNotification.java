package com.example.chat.realtime.notify;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Out-of-band game event pushed to a user through the chat connection.
 * Serialized as-is into the frame, {@code type} included.
 */
public abstract class GameNotification {

    @JsonProperty("type")
    public abstract String getType();
}
