package com.example.chat.shared.repository;

import com.example.chat.shared.model.Block;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;

@Repository
public class BlockRepository {

    private final JdbcTemplate jdbcTemplate;

    public BlockRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private final RowMapper<Block> blockRowMapper = new RowMapper<>() {
        @Override
        public Block mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Block.builder()
                    .blockerId(rs.getString("blocker_id"))
                    .blockedId(rs.getString("blocked_id"))
                    .createdAt(rs.getObject("created_at", OffsetDateTime.class))
                    .build();
        }
    };

    /**
     * Inserts the pair unless it already exists.
     *
     * @return 1 if a row was inserted, 0 if the pair was already present
     */
    public int insertIfAbsent(String blockerId, String blockedId) {
        String sql = """
            MERGE INTO chat_blocks AS t
            USING (
                SELECT
                    CAST(? AS VARCHAR(255)) AS blocker_id,
                    CAST(? AS VARCHAR(255)) AS blocked_id
            ) AS s ON t.blocker_id = s.blocker_id AND t.blocked_id = s.blocked_id
            WHEN NOT MATCHED THEN
                INSERT (blocker_id, blocked_id, created_at)
                VALUES (s.blocker_id, s.blocked_id, CURRENT_TIMESTAMP)
            """;
        return jdbcTemplate.update(sql, blockerId, blockedId);
    }

    public int delete(String blockerId, String blockedId) {
        return jdbcTemplate.update("DELETE FROM chat_blocks WHERE blocker_id = ? AND blocked_id = ?", blockerId, blockedId);
    }

    public boolean exists(String blockerId, String blockedId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM chat_blocks WHERE blocker_id = ? AND blocked_id = ?",
                Long.class, blockerId, blockedId);
        return count != null && count > 0;
    }

    public List<Block> findByBlocker(String blockerId) {
        return jdbcTemplate.query(
                "SELECT blocker_id, blocked_id, created_at FROM chat_blocks WHERE blocker_id = ? ORDER BY created_at DESC",
                blockRowMapper, blockerId);
    }
}
