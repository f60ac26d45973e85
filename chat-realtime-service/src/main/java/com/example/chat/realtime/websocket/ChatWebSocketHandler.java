package com.example.chat.realtime.websocket;

import com.example.chat.realtime.auth.BearerTokens;
import com.example.chat.realtime.router.ChatRouter;
import com.example.chat.realtime.session.ChatConnection;
import com.example.chat.realtime.session.ChatConnectionFactory;
import com.example.chat.shared.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * Binds a WebSocket session to a {@link ChatConnection}.
 *
 * <p>Inbound frames are handed to the router one at a time on the router scheduler.
 * Outbound frames are pulled from the connection's bounded queue as fast as the
 * transport accepts them; when the queue completes the session is closed with the
 * connection's close status. If the writer has not drained within the close timeout
 * after the connection closed, the transport is closed anyway.
 */
@Component
@Slf4j
public class ChatWebSocketHandler implements WebSocketHandler {

    private final ChatConnectionFactory connectionFactory;
    private final ChatRouter chatRouter;
    private final Scheduler routerScheduler;
    private final Duration closeTimeout;

    public ChatWebSocketHandler(ChatConnectionFactory connectionFactory,
                                ChatRouter chatRouter,
                                @Qualifier("routerScheduler") Scheduler routerScheduler,
                                AppProperties appProperties) {
        this.connectionFactory = connectionFactory;
        this.chatRouter = chatRouter;
        this.routerScheduler = routerScheduler;
        this.closeTimeout = appProperties.getWebsocket().getCloseTimeout();
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        ChatConnection connection = connectionFactory.create();
        HandshakeInfo handshake = session.getHandshakeInfo();
        String token = BearerTokens.fromHandshake(handshake.getHeaders(), handshake.getUri());

        log.info("[CONNECT_START] WebSocket connection {} (session {}) from {}", connection.getId(), session.getId(),
                handshake.getRemoteAddress() != null ? handshake.getRemoteAddress().getAddress().getHostAddress() : "unknown");

        Mono<Void> inbound = Mono.fromRunnable(() -> chatRouter.open(connection, token))
                .subscribeOn(routerScheduler)
                .thenMany(session.receive()
                        .filter(message -> message.getType() == WebSocketMessage.Type.TEXT
                                || message.getType() == WebSocketMessage.Type.BINARY)
                        .map(WebSocketMessage::getPayloadAsText)
                        .concatMap(payload -> Mono.fromRunnable(() -> chatRouter.handleFrame(connection, payload))
                                .subscribeOn(routerScheduler)))
                .then()
                .doFinally(signal -> chatRouter.disconnect(connection));

        Mono<Void> writer = session.send(connection.getOutbound().asFlux()
                        .map(frame -> session.textMessage(frame.getPayload())))
                .then(Mono.defer(() -> session.close(connection.getCloseStatus())));
        // a peer that stopped reading never lets the writer finish
        Mono<Void> forcedClose = connection.closed()
                .then(Mono.delay(closeTimeout))
                .then(Mono.defer(() -> {
                    log.warn("Writer of connection {} did not drain within {}, closing transport", connection.getId(), closeTimeout);
                    return session.close(connection.getCloseStatus());
                }));
        Mono<Void> outbound = Mono.firstWithSignal(writer, forcedClose);

        return Mono.when(inbound, outbound)
                .doOnTerminate(() -> log.info("Cleanly disconnected connection {} for user {} ({})",
                        connection.getId(), connection.getUserId(), connection.getCloseStatus()))
                .onErrorResume(e -> {
                    log.warn("WebSocket connection {} terminated with error: {}", connection.getId(), e.getMessage());
                    chatRouter.disconnect(connection);
                    return Mono.empty();
                });
    }
}
