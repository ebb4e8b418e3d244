package com.example.resourceapi.security.filter;

import com.example.resourceapi.security.context.Token;
import com.example.resourceapi.security.context.TokenHolder;
import com.example.resourceapi.security.exception.AuthenticationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("BearerTokenFilter")
class BearerTokenFilterTest {

    @Mock
    private ReactiveJwtDecoder jwtDecoder;

    private BearerTokenFilter filter;

    @BeforeEach
    void setUp() {
        filter = new BearerTokenFilter(jwtDecoder);
    }

    private static MockServerWebExchange exchange(String authorization) {
        MockServerHttpRequest.BaseBuilder<?> request = MockServerHttpRequest.get("/api/grade");
        if (authorization != null) {
            request.header(HttpHeaders.AUTHORIZATION, authorization);
        }
        return MockServerWebExchange.from(request.build());
    }

    private static Jwt jwt(String subject, List<String> roles) {
        return Jwt.withTokenValue("token")
                .header("alg", "HS256")
                .subject(subject)
                .claim(Token.ROLES_CLAIM, roles)
                .issuedAt(Instant.now())
                .build();
    }

    @Test
    @DisplayName("should reject a request without Authorization header")
    void shouldRejectMissingHeader() {
        WebFilterChain chain = ex -> Mono.empty();

        StepVerifier.create(filter.filter(exchange(null), chain))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(AuthenticationException.class);
                    assertThat(error.getMessage()).contains("Missing");
                })
                .verify();

        verify(jwtDecoder, never()).decode(any());
    }

    @Test
    @DisplayName("should reject a non-bearer scheme")
    void shouldRejectBasicScheme() {
        StepVerifier.create(filter.filter(exchange("Basic dXNlcjpwYXNz"), ex -> Mono.empty()))
                .expectError(AuthenticationException.class)
                .verify();
    }

    @Test
    @DisplayName("should reject an empty bearer token")
    void shouldRejectEmptyToken() {
        StepVerifier.create(filter.filter(exchange("Bearer   "), ex -> Mono.empty()))
                .expectError(AuthenticationException.class)
                .verify();
    }

    @Test
    @DisplayName("should map decoder failures to authentication errors")
    void shouldMapInvalidToken() {
        when(jwtDecoder.decode("bad")).thenReturn(Mono.error(new BadJwtException("signature mismatch")));

        StepVerifier.create(filter.filter(exchange("Bearer bad"), ex -> Mono.empty()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(AuthenticationException.class);
                    assertThat(error.getCause()).isInstanceOf(BadJwtException.class);
                })
                .verify();
    }

    @Test
    @DisplayName("should publish the caller's token into the reactive context")
    void shouldPublishToken() {
        when(jwtDecoder.decode("good")).thenReturn(Mono.just(jwt("user-1", List.of("reader"))));
        AtomicReference<Token> seen = new AtomicReference<>();
        WebFilterChain chain = ex -> TokenHolder.getToken().doOnNext(seen::set).then();

        StepVerifier.create(filter.filter(exchange("bearer good"), chain))
                .verifyComplete();

        assertThat(seen.get().userId()).isEqualTo("user-1");
        assertThat(seen.get().roles()).containsExactly("reader");
    }

    @Test
    @DisplayName("should reject a token without subject")
    void shouldRejectMissingSubject() {
        when(jwtDecoder.decode("nosub")).thenReturn(Mono.just(jwt(" ", List.of())));

        StepVerifier.create(filter.filter(exchange("Bearer nosub"), ex -> Mono.empty()))
                .expectError(AuthenticationException.class)
                .verify();
    }
}
