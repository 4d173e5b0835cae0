package com.gt.vsrs.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.Key;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Date;

/**
 * Verifies access tokens issued by the identity provider. Tokens are HS256 signed with a shared, base64 encoded
 * secret. The data API accepts the same token, so a verified token is kept on the {@link AuthSession}.
 */
@Component
public class JwtService {

    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    private final String secret;
    private final long tokenExpirySec;

    public JwtService(@Value("${server.jwt.secret}") String secret,
                      @Value("${server.jwt.tokenExpirySec:3600}") long tokenExpirySec) {
        this.secret = secret;
        this.tokenExpirySec = tokenExpirySec;
    }

    // Throws io.jsonwebtoken.JwtException when the token is malformed, expired or wrongly signed
    public AuthSession toAuthSession(String token) {
        Claims claims = extractAllClaims(token);
        Date expiration = claims.getExpiration();

        return new AuthSession(claims.getSubject(), token, expiration == null ? null : expiration.toInstant());
    }

    public String generateToken(String username, Instant now) {
        Instant expiryDate = now.plus(tokenExpirySec, ChronoUnit.SECONDS);

        return Jwts.builder()
                .setSubject(username)
                .setIssuedAt(new Date(now.toEpochMilli()))
                .setExpiration(new Date(expiryDate.toEpochMilli()))
                .signWith(getSignKey(), SignatureAlgorithm.HS256).compact();
    }

    private Claims extractAllClaims(String token) {
        return Jwts.parserBuilder()
                .setSigningKey(getSignKey())
                .build()
                .parseClaimsJws(token)
                .getBody();
    }

    private Key getSignKey() {
        byte[] keyBytes = Base64.getDecoder().decode(this.secret);
        return Keys.hmacShaKeyFor(keyBytes);
    }
}
