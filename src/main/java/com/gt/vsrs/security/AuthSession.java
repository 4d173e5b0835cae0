package com.gt.vsrs.security;

import java.time.Instant;

// Authenticated caller identity. The access token is forwarded as-is to the data API.
public record AuthSession(String username, String accessToken, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public static boolean isValid(AuthSession session, Instant now) {
        return session != null
                && session.accessToken() != null
                && !session.accessToken().isBlank()
                && !session.isExpired(now);
    }
}
