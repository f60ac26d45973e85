package com.example.chat.realtime.support;

import com.example.chat.shared.model.Block;
import com.example.chat.shared.service.BlockRegistry;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryBlockRegistry implements BlockRegistry {

    private final Set<String> pairs = ConcurrentHashMap.newKeySet();

    @Override
    public boolean add(String blockerId, String blockedId) {
        return pairs.add(blockerId + "|" + blockedId);
    }

    @Override
    public boolean remove(String blockerId, String blockedId) {
        return pairs.remove(blockerId + "|" + blockedId);
    }

    @Override
    public boolean isBlocked(String userA, String userB) {
        return pairs.contains(userA + "|" + userB) || pairs.contains(userB + "|" + userA);
    }

    @Override
    public List<Block> blockedBy(String blockerId) {
        return pairs.stream()
                .filter(pair -> pair.startsWith(blockerId + "|"))
                .map(pair -> Block.builder().blockerId(blockerId).blockedId(pair.substring(blockerId.length() + 1)).build())
                .collect(Collectors.toList());
    }
}
