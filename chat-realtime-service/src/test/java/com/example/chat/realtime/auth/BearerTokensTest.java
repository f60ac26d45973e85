package com.example.chat.realtime.auth;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class BearerTokensTest {

    @Test
    void readsAuthorizationHeader() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer abc.def.ghi");

        assertThat(BearerTokens.fromHeaders(headers)).isEqualTo("abc.def.ghi");
    }

    @Test
    void ignoresOtherSchemesAndEmptyTokens() {
        HttpHeaders basic = new HttpHeaders();
        basic.set(HttpHeaders.AUTHORIZATION, "Basic dXNlcjpwYXNz");
        HttpHeaders empty = new HttpHeaders();
        empty.set(HttpHeaders.AUTHORIZATION, "Bearer   ");

        assertThat(BearerTokens.fromHeaders(basic)).isNull();
        assertThat(BearerTokens.fromHeaders(empty)).isNull();
        assertThat(BearerTokens.fromHeaders(new HttpHeaders())).isNull();
    }

    @Test
    void handshakeFallsBackToQueryParameter() {
        URI uri = URI.create("ws://localhost:8081/ws/chat?token=abc.def.ghi");

        assertThat(BearerTokens.fromHandshake(new HttpHeaders(), uri)).isEqualTo("abc.def.ghi");
    }

    @Test
    void handshakeHeaderWinsOverQueryParameter() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "bearer from-header");
        URI uri = URI.create("ws://localhost:8081/ws/chat?token=from-query");

        assertThat(BearerTokens.fromHandshake(headers, uri)).isEqualTo("from-header");
        assertThat(BearerTokens.fromHandshake(new HttpHeaders(), URI.create("ws://localhost:8081/ws/chat"))).isNull();
    }
}
