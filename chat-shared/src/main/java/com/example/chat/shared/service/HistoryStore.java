package com.example.chat.shared.service;

import com.example.chat.shared.dto.HistoryPage;
import com.example.chat.shared.model.ChatMessage;
import com.example.chat.shared.model.ConversationSummary;

import java.util.List;

/**
 * Durable, append-only log of room and direct messages.
 */
public interface HistoryStore {

    /**
     * Persists a message and assigns its id and timestamp. The returned record is the
     * stored one; callers deliver it only after this method returns.
     *
     * @throws com.example.chat.shared.exception.PersistenceFailureException if the write fails
     */
    ChatMessage append(ChatMessage draft);

    /**
     * Room history newest first. Not filtered by blocks.
     *
     * @param limit  page size, clamped to the configured bounds; null or non-positive selects the default
     * @param cursor token from a previous page's {@code nextCursor}, or null for the newest page
     */
    HistoryPage queryRoom(String room, Integer limit, String cursor);

    /**
     * Direct messages between {@code viewerId} and {@code otherUserId}. Empty while a block
     * exists between the two in either direction.
     */
    HistoryPage queryDirect(String viewerId, String otherUserId, Integer limit, String cursor);

    /**
     * The viewer's DM peers, most recent first, without peers blocked in either direction.
     *
     * @param limit clamped like page sizes
     */
    List<ConversationSummary> recentConversations(String viewerId, Integer limit);
}
