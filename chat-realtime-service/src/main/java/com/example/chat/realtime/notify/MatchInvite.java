package com.example.chat.realtime.notify;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString
@JsonPropertyOrder({"type", "fromUserId", "matchId"})
public class MatchInvite extends GameNotification {

    public static final String TYPE = "invite";

    private final String fromUserId;
    private final String matchId;

    @Override
    public String getType() {
        return TYPE;
    }
}
