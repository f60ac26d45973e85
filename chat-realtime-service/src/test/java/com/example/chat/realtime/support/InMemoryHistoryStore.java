package com.example.chat.realtime.support;

import com.example.chat.shared.dto.HistoryPage;
import com.example.chat.shared.model.ChatMessage;
import com.example.chat.shared.model.ConversationSummary;
import com.example.chat.shared.service.HistoryStore;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

public class InMemoryHistoryStore implements HistoryStore {

    private final List<ChatMessage> messages = new ArrayList<>();
    private long nextId = 1;

    @Override
    public synchronized ChatMessage append(ChatMessage draft) {
        ChatMessage stored = draft.withId(nextId++).withCreatedAt(OffsetDateTime.now(ZoneOffset.UTC));
        messages.add(stored);
        return stored;
    }

    @Override
    public synchronized HistoryPage queryRoom(String room, Integer limit, String cursor) {
        throw new UnsupportedOperationException("not needed by router tests");
    }

    @Override
    public synchronized HistoryPage queryDirect(String viewerId, String otherUserId, Integer limit, String cursor) {
        throw new UnsupportedOperationException("not needed by router tests");
    }

    @Override
    public List<ConversationSummary> recentConversations(String viewerId, Integer limit) {
        throw new UnsupportedOperationException("not needed by router tests");
    }

    public synchronized List<ChatMessage> stored() {
        return new ArrayList<>(messages);
    }
}
