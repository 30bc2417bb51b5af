package com.keepnotes.backend.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Token signing settings, bound once at startup from {@code keepnotes.jwt.*}.
 *
 * @param secret     Base64 encoded HMAC key ({@code JWT_SECRET}); there is no default
 * @param algorithm  JWS algorithm name, one of HS256, HS384, HS512
 * @param expiration access token lifetime; plain numbers are read as minutes
 */
@ConfigurationProperties(prefix = "keepnotes.jwt")
@Validated
public record JwtProperties(
        @NotBlank String secret,
        @NotBlank String algorithm,
        @NotNull @DurationUnit(ChronoUnit.MINUTES) Duration expiration) {

    @AssertTrue(message = "keepnotes.jwt.expiration must be positive")
    public boolean isExpirationPositive() {
        return expiration != null && !expiration.isZero() && !expiration.isNegative();
    }
}
