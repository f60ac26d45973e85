package com.example.chat.realtime.auth;

import com.example.chat.shared.exception.UnauthorizedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;

/**
 * Verifies HS256 access tokens issued by the platform's auth service. The JWT subject
 * is the user id.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtIdentityVerifier implements IdentityVerifier {

    private final JwtDecoder jwtDecoder;

    @Override
    public String verify(String token) {
        if (token == null || token.isBlank()) {
            throw new UnauthorizedException("Missing credentials");
        }
        try {
            Jwt jwt = jwtDecoder.decode(token.trim());
            String subject = jwt.getSubject();
            if (subject == null || subject.isBlank()) {
                throw new UnauthorizedException("Invalid credentials");
            }
            return subject;
        } catch (JwtException e) {
            // deliberately generic, the decoder's reason stays server-side at debug level
            log.warn("Rejected bearer token");
            log.debug("Token verification failure: {}", e.getMessage());
            throw new UnauthorizedException("Invalid credentials");
        }
    }
}
