package com.example.chat.realtime.router;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A parsed inbound frame. Only the fields required by {@link #type} are set.
 */
@Getter
@Builder
@ToString(exclude = {"body", "token"})
public class ChatCommand {
    private final CommandType type;
    private final String room;
    private final String body;
    private final String to;
    private final String userId;
    private final String token;
}
