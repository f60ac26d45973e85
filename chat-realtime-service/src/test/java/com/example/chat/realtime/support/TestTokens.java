package com.example.chat.realtime.support;

import com.example.chat.realtime.auth.SecurityConfig;
import com.nimbusds.jose.jwk.source.ImmutableSecret;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

import java.time.Duration;
import java.time.Instant;

/**
 * Signs HS256 tokens the way the platform's auth service does.
 */
public final class TestTokens {

    public static final String DEFAULT_SECRET = "dev-only-change-me-dev-only-change-me";
    public static final String DEFAULT_ISSUER = "game-platform-auth";

    private TestTokens() {
    }

    public static String forUser(String userId) {
        return sign(DEFAULT_SECRET, DEFAULT_ISSUER, userId, Instant.now().plus(Duration.ofMinutes(5)));
    }

    public static String sign(String secret, String issuer, String subject, Instant expiresAt) {
        NimbusJwtEncoder encoder = new NimbusJwtEncoder(new ImmutableSecret<>(SecurityConfig.hmacKey(secret)));
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .issuer(issuer)
                .subject(subject)
                .issuedAt(expiresAt.minus(Duration.ofMinutes(15)))
                .expiresAt(expiresAt)
                .build();
        return encoder.encode(JwtEncoderParameters.from(JwsHeader.with(MacAlgorithm.HS256).build(), claims))
                .getTokenValue();
    }
}
