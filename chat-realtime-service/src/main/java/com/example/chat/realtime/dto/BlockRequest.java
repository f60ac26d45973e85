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
public class BlockRequest {
    @NotBlank(message = "blockerId is required")
    private String blockerId;
    @NotBlank(message = "blockedId is required")
    private String blockedId;
}
