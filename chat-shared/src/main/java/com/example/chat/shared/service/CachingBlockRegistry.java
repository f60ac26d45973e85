package com.example.chat.shared.service;

import com.example.chat.shared.aspect.Monitored;
import com.example.chat.shared.exception.PersistenceFailureException;
import com.example.chat.shared.model.Block;
import com.example.chat.shared.repository.BlockRepository;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Block registry backed by {@code chat_blocks}, with directed lookups cached in Caffeine.
 * A write invalidates its key before returning, so a send issued after block() returns
 * observes the block.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("blocks")
public class CachingBlockRegistry implements BlockRegistry {

    private final BlockRepository blockRepository;
    private final Cache<String, Boolean> blockLookupCache;

    @Override
    public boolean add(String blockerId, String blockedId) {
        requireDistinct(blockerId, blockedId);
        try {
            int inserted = blockRepository.insertIfAbsent(blockerId, blockedId);
            blockLookupCache.invalidate(key(blockerId, blockedId));
            if (inserted > 0) {
                log.info("User {} blocked {}", blockerId, blockedId);
            }
            return inserted > 0;
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to store block", e);
        }
    }

    @Override
    public boolean remove(String blockerId, String blockedId) {
        requireDistinct(blockerId, blockedId);
        try {
            int deleted = blockRepository.delete(blockerId, blockedId);
            blockLookupCache.invalidate(key(blockerId, blockedId));
            if (deleted > 0) {
                log.info("User {} unblocked {}", blockerId, blockedId);
            }
            return deleted > 0;
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to remove block", e);
        }
    }

    @Override
    public boolean isBlocked(String userA, String userB) {
        if (userA.equals(userB)) {
            return false;
        }
        return hasBlocked(userA, userB) || hasBlocked(userB, userA);
    }

    @Override
    public List<Block> blockedBy(String blockerId) {
        try {
            return blockRepository.findByBlocker(blockerId);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to list blocks", e);
        }
    }

    private boolean hasBlocked(String blockerId, String blockedId) {
        try {
            return blockLookupCache.get(key(blockerId, blockedId), k -> blockRepository.exists(blockerId, blockedId));
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to look up block", e);
        }
    }

    private static void requireDistinct(String blockerId, String blockedId) {
        if (blockerId.equals(blockedId)) {
            throw new IllegalArgumentException("A user cannot block themselves");
        }
    }

    private static String key(String blockerId, String blockedId) {
        return blockerId + "|" + blockedId;
    }
}
