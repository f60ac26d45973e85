package com.example.chat.realtime.notify;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Next tournament match: players {@code p1} and {@code p2}, starting around {@code eta}.
 */
@Getter
@AllArgsConstructor
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "matchId", "p1", "p2", "eta"})
public class TournamentAnnouncement extends GameNotification {

    public static final String TYPE = "tournamentAnnounce";

    private final String matchId;
    private final String p1;
    private final String p2;
    private final String eta;

    @Override
    public String getType() {
        return TYPE;
    }
}
