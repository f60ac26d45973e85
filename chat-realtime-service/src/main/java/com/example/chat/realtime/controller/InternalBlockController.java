package com.example.chat.realtime.controller;

import com.example.chat.realtime.dto.BlockRequest;
import com.example.chat.shared.exception.ChatErrorKind;
import com.example.chat.shared.exception.ChatException;
import com.example.chat.shared.service.BlockRegistry;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.Map;

/**
 * Block writes issued by the platform's moderation tooling.
 */
@RestController
@RequestMapping("/api/internal/blocks")
@Slf4j
public class InternalBlockController {

    private final BlockRegistry blockRegistry;
    private final Scheduler jdbcScheduler;

    public InternalBlockController(BlockRegistry blockRegistry, @Qualifier("jdbcScheduler") Scheduler jdbcScheduler) {
        this.blockRegistry = blockRegistry;
        this.jdbcScheduler = jdbcScheduler;
    }

    @PostMapping
    public Mono<ResponseEntity<Map<String, Object>>> block(@Valid @RequestBody BlockRequest request) {
        log.info("Moderation block: {} blocks {}", request.getBlockerId(), request.getBlockedId());
        return Mono.fromCallable(() -> {
            requireDistinct(request);
            boolean created = blockRegistry.add(request.getBlockerId(), request.getBlockedId());
            return ResponseEntity.ok(Map.<String, Object>of("blocked", true, "created", created));
        }).subscribeOn(jdbcScheduler);
    }

    @DeleteMapping
    public Mono<ResponseEntity<Map<String, Object>>> unblock(@Valid @RequestBody BlockRequest request) {
        log.info("Moderation unblock: {} unblocks {}", request.getBlockerId(), request.getBlockedId());
        return Mono.fromCallable(() -> {
            requireDistinct(request);
            boolean removed = blockRegistry.remove(request.getBlockerId(), request.getBlockedId());
            return ResponseEntity.ok(Map.<String, Object>of("blocked", false, "removed", removed));
        }).subscribeOn(jdbcScheduler);
    }

    private static void requireDistinct(BlockRequest request) {
        if (request.getBlockerId().equals(request.getBlockedId())) {
            throw new ChatException(ChatErrorKind.INVALID_MESSAGE, "A user cannot block themselves");
        }
    }
}
