package com.example.resourceapi.security.context;

import com.example.resourceapi.security.exception.AuthenticationException;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.function.Function;

public final class TokenHolder {

    private static final String TOKEN_KEY = Token.class.getName();

    private TokenHolder() {
        // Utility class
    }

    public static Mono<Token> getToken() {
        return Mono.deferContextual(ctx -> {
            if (ctx.hasKey(TOKEN_KEY)) {
                return Mono.just(ctx.get(TOKEN_KEY));
            }
            return Mono.error(new AuthenticationException(
                    "No Token found in reactive context"));
        });
    }

    public static Function<Context, Context> withToken(Token token) {
        return context -> context.put(TOKEN_KEY, token);
    }
}
