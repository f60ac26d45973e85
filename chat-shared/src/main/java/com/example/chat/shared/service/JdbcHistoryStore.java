package com.example.chat.shared.service;

import com.example.chat.shared.aspect.Monitored;
import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.dto.HistoryPage;
import com.example.chat.shared.exception.PersistenceFailureException;
import com.example.chat.shared.model.ChatMessage;
import com.example.chat.shared.model.ConversationSummary;
import com.example.chat.shared.model.HistoryCursor;
import com.example.chat.shared.repository.MessageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Service
@Slf4j
@Monitored("history")
public class JdbcHistoryStore implements HistoryStore {

    private final MessageRepository messageRepository;
    private final BlockRegistry blockRegistry;
    private final AppProperties appProperties;
    private final Clock clock;

    private final Object appendLock = new Object();
    private OffsetDateTime lastCreatedAt;

    @Autowired
    public JdbcHistoryStore(MessageRepository messageRepository, BlockRegistry blockRegistry, AppProperties appProperties) {
        this(messageRepository, blockRegistry, appProperties, Clock.systemUTC());
    }

    public JdbcHistoryStore(MessageRepository messageRepository, BlockRegistry blockRegistry,
                            AppProperties appProperties, Clock clock) {
        this.messageRepository = messageRepository;
        this.blockRegistry = blockRegistry;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    @Override
    public ChatMessage append(ChatMessage draft) {
        if ((draft.getRoom() == null) == (draft.getRecipientId() == null)) {
            throw new IllegalArgumentException("A chat message targets exactly one of room or recipient");
        }
        // timestamps stay strictly increasing so (createdAt, id) order matches commit order
        synchronized (appendLock) {
            OffsetDateTime createdAt = nextTimestamp();
            ChatMessage toStore = draft.withId(null).withCreatedAt(createdAt);
            try {
                long id = messageRepository.insert(toStore);
                lastCreatedAt = createdAt;
                log.debug("Appended message {} from {} to {}", id, draft.getSenderId(),
                        draft.isDirect() ? "user " + draft.getRecipientId() : "room " + draft.getRoom());
                return toStore.withId(id);
            } catch (DataAccessException e) {
                log.error("Failed to append message from {}: {}", draft.getSenderId(), e.getMessage());
                throw new PersistenceFailureException("Failed to persist chat message", e);
            }
        }
    }

    @Override
    public HistoryPage queryRoom(String room, Integer limit, String cursor) {
        HistoryCursor decoded = HistoryCursor.decode(cursor);
        int pageSize = clampLimit(limit);
        try {
            return toPage(messageRepository.findRoomPage(room, decoded, pageSize + 1), pageSize);
        } catch (DataAccessException e) {
            log.error("Failed to read history of room {}: {}", room, e.getMessage());
            throw new PersistenceFailureException("Failed to read room history", e);
        }
    }

    @Override
    public HistoryPage queryDirect(String viewerId, String otherUserId, Integer limit, String cursor) {
        HistoryCursor decoded = HistoryCursor.decode(cursor);
        if (blockRegistry.isBlocked(viewerId, otherUserId)) {
            log.debug("DM history between {} and {} hidden by block", viewerId, otherUserId);
            return HistoryPage.empty();
        }
        int pageSize = clampLimit(limit);
        try {
            return toPage(messageRepository.findDirectPage(viewerId, otherUserId, decoded, pageSize + 1), pageSize);
        } catch (DataAccessException e) {
            log.error("Failed to read DM history of {}: {}", viewerId, e.getMessage());
            throw new PersistenceFailureException("Failed to read direct message history", e);
        }
    }

    @Override
    public List<ConversationSummary> recentConversations(String viewerId, Integer limit) {
        try {
            return messageRepository.findConversations(viewerId, clampLimit(limit));
        } catch (DataAccessException e) {
            log.error("Failed to list conversations of {}: {}", viewerId, e.getMessage());
            throw new PersistenceFailureException("Failed to list conversations", e);
        }
    }

    int clampLimit(Integer requested) {
        AppProperties.History history = appProperties.getHistory();
        if (requested == null || requested <= 0) {
            return Math.min(history.getDefaultLimit(), history.getMaxLimit());
        }
        return Math.min(requested, history.getMaxLimit());
    }

    private HistoryPage toPage(List<ChatMessage> rows, int pageSize) {
        if (rows.size() <= pageSize) {
            return new HistoryPage(rows, null, false);
        }
        List<ChatMessage> page = rows.subList(0, pageSize);
        String nextCursor = HistoryCursor.after(page.get(page.size() - 1)).encode();
        return new HistoryPage(List.copyOf(page), nextCursor, true);
    }

    private OffsetDateTime nextTimestamp() {
        OffsetDateTime now = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
        if (lastCreatedAt != null && !now.isAfter(lastCreatedAt)) {
            return lastCreatedAt.plus(1, ChronoUnit.MICROS);
        }
        return now;
    }
}
