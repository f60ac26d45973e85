package com.example.chat.realtime.health;

import com.example.chat.realtime.session.SessionRegistry;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Health of the chat core: live sessions, the history database and the block lookup cache.
 */
@Component
public class ChatHealthIndicator implements HealthIndicator {

    private final SessionRegistry sessionRegistry;
    private final JdbcTemplate jdbcTemplate;
    private final Cache<String, Boolean> blockLookupCache;

    public ChatHealthIndicator(SessionRegistry sessionRegistry,
                               JdbcTemplate jdbcTemplate,
                               Cache<String, Boolean> blockLookupCache) {
        this.sessionRegistry = sessionRegistry;
        this.jdbcTemplate = jdbcTemplate;
        this.blockLookupCache = blockLookupCache;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        boolean sessionsHealthy = checkSessions(details);
        boolean historyHealthy = checkHistoryStore(details);
        checkBlockCache(details);

        Health.Builder healthBuilder = sessionsHealthy && historyHealthy ? Health.up() : Health.down();
        return healthBuilder.withDetails(details).build();
    }

    private boolean checkSessions(Map<String, Object> details) {
        try {
            details.put("connections", sessionRegistry.getConnectionCount());
            details.put("onlineUsers", sessionRegistry.getOnlineUserCount());
            details.put("sessionStatus", "UP");
            return true;
        } catch (Exception e) {
            details.put("sessionStatus", "DOWN");
            details.put("sessionError", e.getMessage());
            return false;
        }
    }

    private boolean checkHistoryStore(Map<String, Object> details) {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            details.put("historyStatus", "UP");
            return true;
        } catch (Exception e) {
            details.put("historyStatus", "DOWN");
            details.put("historyError", e.getMessage());
            return false;
        }
    }

    private void checkBlockCache(Map<String, Object> details) {
        CacheStats stats = blockLookupCache.stats();
        details.put("blockCacheSize", blockLookupCache.estimatedSize());
        details.put("blockCacheHitRate", stats.hitRate());
    }
}
