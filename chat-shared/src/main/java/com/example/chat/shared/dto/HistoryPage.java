package com.example.chat.shared.dto;

import com.example.chat.shared.model.ChatMessage;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * One page of history, newest first. {@code nextCursor} is present only when
 * older messages remain.
 */
@Data
@Builder
@AllArgsConstructor
public class HistoryPage {
    private final List<ChatMessage> messages;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final String nextCursor;

    private final boolean hasMore;

    public static HistoryPage empty() {
        return new HistoryPage(List.of(), null, false);
    }
}
