package com.example.chat.realtime.auth;

/**
 * Turns a bearer credential into a user identity.
 */
public interface IdentityVerifier {

    /**
     * @return the verified user id
     * @throws com.example.chat.shared.exception.UnauthorizedException if the token is missing, invalid or expired
     */
    String verify(String token);
}
