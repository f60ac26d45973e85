package com.example.chat.realtime.auth;

import org.springframework.http.HttpHeaders;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Extracts bearer credentials from HTTP requests and WebSocket handshakes.
 */
public final class BearerTokens {

    private static final String BEARER_PREFIX = "Bearer ";

    private BearerTokens() {
    }

    /**
     * @return the token from an {@code Authorization: Bearer} header, or null
     */
    public static String fromHeaders(HttpHeaders headers) {
        String authorization = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    /**
     * Browsers cannot set headers on a WebSocket handshake, so {@code ?token=} is accepted too.
     */
    public static String fromHandshake(HttpHeaders headers, URI uri) {
        String token = fromHeaders(headers);
        if (token != null) {
            return token;
        }
        String queryToken = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("token");
        return queryToken == null || queryToken.isBlank() ? null : queryToken;
    }
}
