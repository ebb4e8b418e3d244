package com.example.resourceapi.security.service;

import com.example.resourceapi.config.AppProperties;
import com.example.resourceapi.security.context.Token;
import com.example.resourceapi.security.dto.DevLoginResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Issues signed bearer tokens for local development and end-to-end testing.
 */
@Slf4j
@Service
public class DevTokenService {

    private final JwtEncoder jwtEncoder;
    private final AppProperties.Auth authConfig;
    private final Clock clock;

    @Autowired
    public DevTokenService(JwtEncoder jwtEncoder, AppProperties properties) {
        this(jwtEncoder, properties, Clock.systemUTC());
    }

    DevTokenService(JwtEncoder jwtEncoder, AppProperties properties, Clock clock) {
        this.jwtEncoder = jwtEncoder;
        this.authConfig = properties.getAuth();
        this.clock = clock;
    }

    public boolean isEnabled() {
        return authConfig.isDevLoginEnabled();
    }

    public DevLoginResponse issue(String subject, List<String> roles) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(authConfig.getTokenTtlMinutes(), ChronoUnit.MINUTES);

        JwtClaimsSet claims = JwtClaimsSet.builder()
                .issuer(authConfig.getIssuer())
                .subject(subject)
                .issuedAt(now)
                .expiresAt(expiresAt)
                .claim(Token.ROLES_CLAIM, roles)
                .build();

        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        String tokenValue = jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();

        log.info("Issued dev token: subject={}, roles={}, expiresAt={}", subject, roles, expiresAt);
        return new DevLoginResponse(tokenValue, "Bearer", expiresAt);
    }
}
