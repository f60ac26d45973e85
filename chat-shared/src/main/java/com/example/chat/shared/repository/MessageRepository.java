package com.example.chat.shared.repository;

import com.example.chat.shared.model.ChatMessage;
import com.example.chat.shared.model.ConversationSummary;
import com.example.chat.shared.model.HistoryCursor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

@Repository
public class MessageRepository {

    private static final String SELECT_COLUMNS = "SELECT id, sender_id, recipient_id, room, body, created_at FROM chat_messages";
    private static final String OLDER_THAN_CURSOR = " AND (created_at < ? OR (created_at = ? AND id < ?))";
    private static final String NEWEST_FIRST = " ORDER BY created_at DESC, id DESC LIMIT ?";

    private final JdbcTemplate jdbcTemplate;

    public MessageRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private final RowMapper<ChatMessage> messageRowMapper = new RowMapper<>() {
        @Override
        public ChatMessage mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ChatMessage.builder()
                    .id(rs.getLong("id"))
                    .senderId(rs.getString("sender_id"))
                    .recipientId(rs.getString("recipient_id"))
                    .room(rs.getString("room"))
                    .body(rs.getString("body"))
                    .createdAt(rs.getObject("created_at", OffsetDateTime.class))
                    .build();
        }
    };

    private final RowMapper<ConversationSummary> conversationRowMapper = (rs, rowNum) -> ConversationSummary.builder()
            .peerId(rs.getString("peer_id"))
            .lastMessageAt(rs.getObject("last_message_at", OffsetDateTime.class))
            .build();

    /**
     * Inserts the message and returns the generated id.
     */
    public long insert(ChatMessage message) {
        String sql = "INSERT INTO chat_messages (sender_id, recipient_id, room, body, created_at) VALUES (?, ?, ?, ?, ?)";
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, message.getSenderId());
            ps.setString(2, message.getRecipientId());
            ps.setString(3, message.getRoom());
            ps.setString(4, message.getBody());
            ps.setObject(5, message.getCreatedAt());
            return ps;
        }, keyHolder);
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No generated id returned for chat message insert");
        }
        return key.longValue();
    }

    /**
     * DM peers of {@code userId}, most recent exchange first. Peers blocked in either
     * direction are left out.
     */
    public List<ConversationSummary> findConversations(String userId, int limit) {
        String sql = """
            SELECT c.peer_id, MAX(c.created_at) AS last_message_at
            FROM (
                SELECT CASE WHEN sender_id = ? THEN recipient_id ELSE sender_id END AS peer_id, created_at
                FROM chat_messages
                WHERE room IS NULL AND (sender_id = ? OR recipient_id = ?)
            ) c
            WHERE NOT EXISTS (
                SELECT 1 FROM chat_blocks b
                WHERE (b.blocker_id = ? AND b.blocked_id = c.peer_id)
                   OR (b.blocker_id = c.peer_id AND b.blocked_id = ?)
            )
            GROUP BY c.peer_id
            ORDER BY last_message_at DESC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, conversationRowMapper, userId, userId, userId, userId, userId, limit);
    }

    /**
     * Room messages newest first, strictly older than {@code cursor} when one is given.
     */
    public List<ChatMessage> findRoomPage(String room, HistoryCursor cursor, int fetchSize) {
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append(" WHERE room = ?");
        args.add(room);
        appendCursor(sql, args, cursor);
        sql.append(NEWEST_FIRST);
        args.add(fetchSize);
        return jdbcTemplate.query(sql.toString(), messageRowMapper, args.toArray());
    }

    /**
     * Direct messages exchanged between the two users in either direction, newest first.
     */
    public List<ChatMessage> findDirectPage(String userA, String userB, HistoryCursor cursor, int fetchSize) {
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS)
                .append(" WHERE room IS NULL AND ((sender_id = ? AND recipient_id = ?) OR (sender_id = ? AND recipient_id = ?))");
        args.add(userA);
        args.add(userB);
        args.add(userB);
        args.add(userA);
        appendCursor(sql, args, cursor);
        sql.append(NEWEST_FIRST);
        args.add(fetchSize);
        return jdbcTemplate.query(sql.toString(), messageRowMapper, args.toArray());
    }

    private void appendCursor(StringBuilder sql, List<Object> args, HistoryCursor cursor) {
        if (cursor == null) {
            return;
        }
        sql.append(OLDER_THAN_CURSOR);
        args.add(cursor.getCreatedAt());
        args.add(cursor.getCreatedAt());
        args.add(cursor.getId());
    }
}
