package com.example.chat.realtime.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TournamentAnnounceRequest {
    @NotBlank(message = "matchId is required")
    private String matchId;
    @NotBlank(message = "p1 is required")
    private String p1;
    @NotBlank(message = "p2 is required")
    private String p2;
    private String eta;
}
