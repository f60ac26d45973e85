package com.example.chat.realtime.controller;

import com.example.chat.realtime.auth.BearerTokens;
import com.example.chat.realtime.auth.IdentityVerifier;
import com.example.chat.shared.exception.ChatErrorKind;
import com.example.chat.shared.exception.ChatException;
import com.example.chat.shared.model.Block;
import com.example.chat.shared.model.ConversationSummary;
import com.example.chat.shared.service.BlockRegistry;
import com.example.chat.shared.service.HistoryStore;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;

/**
 * The caller's own DM conversations and block list.
 */
@RestController
@RequestMapping("/api/chat")
@Slf4j
public class ConversationController {

    private final HistoryStore historyStore;
    private final BlockRegistry blockRegistry;
    private final IdentityVerifier identityVerifier;
    private final Scheduler jdbcScheduler;

    public ConversationController(HistoryStore historyStore,
                                  BlockRegistry blockRegistry,
                                  IdentityVerifier identityVerifier,
                                  @Qualifier("jdbcScheduler") Scheduler jdbcScheduler) {
        this.historyStore = historyStore;
        this.blockRegistry = blockRegistry;
        this.identityVerifier = identityVerifier;
        this.jdbcScheduler = jdbcScheduler;
    }

    @GetMapping("/conversations")
    @RateLimiter(name = "directoryLimiter", fallbackMethod = "conversationsFallback")
    public Mono<List<ConversationSummary>> conversations(@RequestParam(required = false) Integer limit,
                                                         ServerWebExchange exchange) {
        return Mono.fromCallable(() -> {
            String viewer = identityVerifier.verify(BearerTokens.fromHeaders(exchange.getRequest().getHeaders()));
            log.debug("Conversations of {} requested (limit={})", viewer, limit);
            return historyStore.recentConversations(viewer, limit);
        }).subscribeOn(jdbcScheduler);
    }

    @GetMapping("/blocks")
    @RateLimiter(name = "directoryLimiter", fallbackMethod = "blocksFallback")
    public Mono<List<Block>> blocks(ServerWebExchange exchange) {
        return Mono.fromCallable(() -> {
            String viewer = identityVerifier.verify(BearerTokens.fromHeaders(exchange.getRequest().getHeaders()));
            return blockRegistry.blockedBy(viewer);
        }).subscribeOn(jdbcScheduler);
    }

    public Mono<List<ConversationSummary>> conversationsFallback(Integer limit, ServerWebExchange exchange, RequestNotPermitted ex) {
        log.warn("Conversation list rate limit exceeded. IP: {}", exchange.getRequest().getRemoteAddress());
        return Mono.error(new ChatException(ChatErrorKind.RATE_LIMITED, "Too many requests. Please try again later."));
    }

    public Mono<List<Block>> blocksFallback(ServerWebExchange exchange, RequestNotPermitted ex) {
        log.warn("Block list rate limit exceeded. IP: {}", exchange.getRequest().getRemoteAddress());
        return Mono.error(new ChatException(ChatErrorKind.RATE_LIMITED, "Too many requests. Please try again later."));
    }
}
