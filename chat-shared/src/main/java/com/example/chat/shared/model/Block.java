package com.example.chat.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Directed block relation. Enforcement is symmetric: either direction suppresses
 * DM delivery and DM history between the pair.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Block {
    private String blockerId;
    private String blockedId;
    private OffsetDateTime createdAt;
}
