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
public class InviteRequest {
    @NotBlank(message = "toUserId is required")
    private String toUserId;
    @NotBlank(message = "fromUserId is required")
    private String fromUserId;
    @NotBlank(message = "matchId is required")
    private String matchId;
}
