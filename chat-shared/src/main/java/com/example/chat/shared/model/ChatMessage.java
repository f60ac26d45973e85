package com.example.chat.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.With;

import java.time.OffsetDateTime;

/**
 * A persisted chat record. Exactly one of {@code room} and {@code recipientId} is set:
 * a message is either a room broadcast or a direct message. Records are never updated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@With
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatMessage {
    private Long id;
    private String senderId;
    private String room;
    private String recipientId;
    private String body;
    private OffsetDateTime createdAt;

    @JsonIgnore
    public boolean isDirect() {
        return recipientId != null;
    }
}
