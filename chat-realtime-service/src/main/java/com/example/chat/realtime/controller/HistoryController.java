package com.example.chat.realtime.controller;

import com.example.chat.realtime.auth.BearerTokens;
import com.example.chat.realtime.auth.IdentityVerifier;
import com.example.chat.realtime.router.CommandParser;
import com.example.chat.shared.dto.HistoryPage;
import com.example.chat.shared.exception.ChatErrorKind;
import com.example.chat.shared.exception.ChatException;
import com.example.chat.shared.service.HistoryStore;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Paginated history reads. The caller is identified by the bearer token; DM history is
 * always read from the caller's point of view.
 */
@RestController
@RequestMapping("/api/chat")
@Slf4j
public class HistoryController {

    private final HistoryStore historyStore;
    private final IdentityVerifier identityVerifier;
    private final Scheduler jdbcScheduler;

    public HistoryController(HistoryStore historyStore,
                             IdentityVerifier identityVerifier,
                             @Qualifier("jdbcScheduler") Scheduler jdbcScheduler) {
        this.historyStore = historyStore;
        this.identityVerifier = identityVerifier;
        this.jdbcScheduler = jdbcScheduler;
    }

    @GetMapping("/history")
    @RateLimiter(name = "historyLimiter", fallbackMethod = "historyFallback")
    public Mono<HistoryPage> roomHistory(@RequestParam String room,
                                         @RequestParam(required = false) Integer limit,
                                         @RequestParam(required = false) String cursor,
                                         ServerWebExchange exchange) {
        return Mono.fromCallable(() -> {
            String viewer = identityVerifier.verify(BearerTokens.fromHeaders(exchange.getRequest().getHeaders()));
            if (!CommandParser.ROOM_NAME.matcher(room).matches()) {
                throw new ChatException(ChatErrorKind.MALFORMED_COMMAND, "Invalid room name");
            }
            log.debug("Room history for {} requested by {} (limit={}, cursor={})", room, viewer, limit, cursor != null);
            return historyStore.queryRoom(room, limit, cursor);
        }).subscribeOn(jdbcScheduler);
    }

    @GetMapping("/dm/{peerUserId}")
    @RateLimiter(name = "historyLimiter", fallbackMethod = "directHistoryFallback")
    public Mono<HistoryPage> directHistory(@PathVariable String peerUserId,
                                           @RequestParam(required = false) Integer limit,
                                           @RequestParam(required = false) String cursor,
                                           ServerWebExchange exchange) {
        return Mono.fromCallable(() -> {
            String viewer = identityVerifier.verify(BearerTokens.fromHeaders(exchange.getRequest().getHeaders()));
            log.debug("DM history between {} and {} requested (limit={}, cursor={})", viewer, peerUserId, limit, cursor != null);
            return historyStore.queryDirect(viewer, peerUserId, limit, cursor);
        }).subscribeOn(jdbcScheduler);
    }

    public Mono<HistoryPage> historyFallback(String room, Integer limit, String cursor,
                                             ServerWebExchange exchange, RequestNotPermitted ex) {
        log.warn("History rate limit exceeded for room {}. IP: {}", room, exchange.getRequest().getRemoteAddress());
        return Mono.error(new ChatException(ChatErrorKind.RATE_LIMITED, "Too many history requests. Please try again later."));
    }

    public Mono<HistoryPage> directHistoryFallback(String peerUserId, Integer limit, String cursor,
                                                   ServerWebExchange exchange, RequestNotPermitted ex) {
        log.warn("History rate limit exceeded for DM history with {}. IP: {}", peerUserId, exchange.getRequest().getRemoteAddress());
        return Mono.error(new ChatException(ChatErrorKind.RATE_LIMITED, "Too many history requests. Please try again later."));
    }
}
