package com.keepnotes.backend.service;

import com.keepnotes.backend.config.JwtProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Map;

/**
 * Issues and checks signed access tokens. The subject claim is the user's email.
 * <p>
 * Validation needs nothing but the key and the clock, so it never touches the database.
 */
@Slf4j
@Service
public class JwtService implements TokenService {

    private final Clock clock;
    private final Duration defaultTtl;
    private final SignatureAlgorithm algorithm;
    private final SecretKey key;
    private final JwtParser parser;

    public JwtService(JwtProperties properties, Clock clock) {
        this.clock = clock;
        this.defaultTtl = properties.expiration();
        this.algorithm = resolveAlgorithm(properties.algorithm());
        this.key = decodeKey(properties.secret());
        try {
            algorithm.assertValidSigningKey(key);
        } catch (io.jsonwebtoken.security.InvalidKeyException e) {
            throw new IllegalStateException("keepnotes.jwt.secret is too short for " + algorithm.getValue(), e);
        }
        this.parser = Jwts.parserBuilder()
                .setSigningKey(key)
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    @Override
    public String createToken(String subject) {
        return createToken(subject, Map.of(), defaultTtl);
    }

    @Override
    public String createToken(String subject, Map<String, Object> claims, Duration ttl) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be blank");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        Instant now = clock.instant();
        try {
            return Jwts.builder()
                    .setClaims(claims)
                    .setSubject(subject)
                    .setIssuedAt(Date.from(now))
                    .setExpiration(Date.from(now.plus(ttl)))
                    .signWith(key, algorithm)
                    .compact();
        } catch (JwtException | IllegalArgumentException e) {
            log.error("access token signing failed", e);
            throw new TokenSigningException("Failed to create access token", e);
        }
    }

    /**
     * Verifies signature, algorithm and expiry.
     *
     * @throws ExpiredTokenException if the token is authentic but past its expiry
     * @throws InvalidTokenException for anything else that fails to verify
     */
    @Override
    public Claims validateToken(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("token is empty");
        }
        Jws<Claims> jws;
        try {
            jws = parser.parseClaimsJws(token);
        } catch (ExpiredJwtException e) {
            throw new ExpiredTokenException("Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid token", e);
        }
        // a longer HMAC would still verify with our key; only the configured one is accepted
        if (!algorithm.getValue().equals(jws.getHeader().getAlgorithm())) {
            throw new InvalidTokenException("unexpected signing algorithm " + jws.getHeader().getAlgorithm());
        }
        Date expiration = jws.getBody().getExpiration();
        if (expiration == null) {
            throw new InvalidTokenException("token has no expiry");
        }
        // the parser still accepts now == exp; a token is valid only strictly before its expiry
        if (!clock.instant().isBefore(expiration.toInstant())) {
            throw new ExpiredTokenException("Token expired", null);
        }
        return jws.getBody();
    }

    private static SignatureAlgorithm resolveAlgorithm(String name) {
        SignatureAlgorithm alg;
        try {
            alg = SignatureAlgorithm.forName(name);
        } catch (JwtException e) {
            throw new IllegalStateException("unknown keepnotes.jwt.algorithm: " + name, e);
        }
        if (!alg.isHmac()) {
            throw new IllegalStateException("keepnotes.jwt.algorithm must be an HMAC algorithm: " + name);
        }
        return alg;
    }

    private static SecretKey decodeKey(String secretBase64) {
        try {
            return Keys.hmacShaKeyFor(Decoders.BASE64.decode(secretBase64));
        } catch (RuntimeException e) {
            throw new IllegalStateException("keepnotes.jwt.secret is not a usable Base64 HMAC key", e);
        }
    }
}
