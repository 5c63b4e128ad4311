package com.sporehub.backend.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * app.auth.*
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.auth")
public class AuthProperties {

    /** HS256 key material, at least 32 bytes. */
    private String jwtSecret;

    /** Access token lifetime; a bare number is seconds ({@code JWT_EXPIRATION=3600}). */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration accessTtl = Duration.ofHours(1);

    private String issuer = "sporehub";
}
