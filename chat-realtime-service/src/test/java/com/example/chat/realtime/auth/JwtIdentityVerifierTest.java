package com.example.chat.realtime.auth;

import com.example.chat.realtime.support.TestTokens;
import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.exception.UnauthorizedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtIdentityVerifierTest {

    private static final String SECRET = "test-secret-test-secret-test-secret-0123";
    private static final String ISSUER = "game-platform-auth";

    private JwtIdentityVerifier verifier;

    @BeforeEach
    void setUp() {
        AppProperties appProperties = new AppProperties();
        appProperties.getSecurity().getJwt().setSecret(SECRET);
        appProperties.getSecurity().getJwt().setIssuer(ISSUER);
        verifier = new JwtIdentityVerifier(new SecurityConfig().jwtDecoder(appProperties));
    }

    @Test
    void validTokenYieldsSubject() {
        String token = TestTokens.sign(SECRET, ISSUER, "alice", Instant.now().plus(Duration.ofMinutes(5)));

        assertThat(verifier.verify(token)).isEqualTo("alice");
    }

    @Test
    void expiredTokenIsRejected() {
        String token = TestTokens.sign(SECRET, ISSUER, "alice", Instant.now().minus(Duration.ofMinutes(10)));

        assertThatThrownBy(() -> verifier.verify(token))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessage("Invalid credentials");
    }

    @Test
    void foreignIssuerIsRejected() {
        String token = TestTokens.sign(SECRET, "someone-else", "alice", Instant.now().plus(Duration.ofMinutes(5)));

        assertThatThrownBy(() -> verifier.verify(token)).isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        String token = TestTokens.sign("another-secret-another-secret-0123456789", ISSUER, "alice",
                Instant.now().plus(Duration.ofMinutes(5)));

        assertThatThrownBy(() -> verifier.verify(token)).isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void garbageAndBlankTokensAreRejected() {
        assertThatThrownBy(() -> verifier.verify("not-a-jwt")).isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> verifier.verify(" ")).isInstanceOf(UnauthorizedException.class)
                .hasMessage("Missing credentials");
        assertThatThrownBy(() -> verifier.verify(null)).isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void shortSecretIsRefused() {
        assertThatThrownBy(() -> SecurityConfig.hmacKey("too-short"))
                .isInstanceOf(IllegalStateException.class);
    }
}
