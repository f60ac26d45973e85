package com.example.chat.shared.service;

import com.example.chat.shared.model.Block;

import java.util.List;

/**
 * Directed block relations with symmetric enforcement.
 */
public interface BlockRegistry {

    /**
     * @return true if the pair was newly blocked, false if it already was
     */
    boolean add(String blockerId, String blockedId);

    /**
     * @return true if a block was removed, false if none existed
     */
    boolean remove(String blockerId, String blockedId);

    /**
     * True if either user has blocked the other.
     */
    boolean isBlocked(String userA, String userB);

    List<Block> blockedBy(String blockerId);
}
