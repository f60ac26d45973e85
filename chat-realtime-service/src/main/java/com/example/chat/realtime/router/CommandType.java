package com.example.chat.realtime.router;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum CommandType {
    AUTH("auth"),
    JOIN("join"),
    LEAVE("leave"),
    CHANNEL("channel"),
    DM("dm"),
    BLOCK("block"),
    UNBLOCK("unblock"),
    PING("ping");

    private static final Map<String, CommandType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(CommandType::getWireName, Function.identity()));

    private final String wireName;

    CommandType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isModeration() {
        return this == BLOCK || this == UNBLOCK;
    }

    /**
     * @return the matching type, or null for an unknown name
     */
    public static CommandType fromWireName(String name) {
        return BY_WIRE_NAME.get(name);
    }
}
