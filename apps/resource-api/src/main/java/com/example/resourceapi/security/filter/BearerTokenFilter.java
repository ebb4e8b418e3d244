package com.example.resourceapi.security.filter;

import com.example.resourceapi.security.context.Token;
import com.example.resourceapi.security.context.TokenHolder;
import com.example.resourceapi.security.exception.AuthenticationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Verifies the {@code Authorization: Bearer} token and publishes the caller's {@link Token}
 * into the Reactor context. Registered only inside the /api/** security chain.
 */
@Slf4j
@RequiredArgsConstructor
public class BearerTokenFilter implements WebFilter {

    private static final String BEARER_PREFIX = "bearer ";

    private final ReactiveJwtDecoder jwtDecoder;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String header = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);

        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return Mono.error(new AuthenticationException("Missing bearer token"));
        }

        String rawToken = header.substring(BEARER_PREFIX.length()).trim();
        if (rawToken.isEmpty()) {
            return Mono.error(new AuthenticationException("Empty bearer token"));
        }

        return jwtDecoder.decode(rawToken)
                .onErrorMap(JwtException.class,
                        e -> new AuthenticationException("Invalid bearer token", e))
                .map(Token::fromJwt)
                .flatMap(token -> {
                    if (token.userId() == null || token.userId().isBlank()) {
                        return Mono.error(new AuthenticationException("Token has no subject"));
                    }
                    log.debug("Bearer token accepted: user={}, roles={}", token.userId(), token.roles());
                    return chain.filter(exchange)
                            .contextWrite(TokenHolder.withToken(token));
                });
    }
}
