package com.example.resourceapi.security.resolver;

import com.example.resourceapi.security.annotation.ResolvedToken;
import com.example.resourceapi.security.context.Token;
import com.example.resourceapi.security.context.TokenHolder;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.BindingContext;
import org.springframework.web.reactive.result.method.HandlerMethodArgumentResolver;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

@Component
public class TokenArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(ResolvedToken.class)
                && parameter.getParameterType().equals(Token.class);
    }

    @Override
    public Mono<Object> resolveArgument(
            MethodParameter parameter,
            BindingContext bindingContext,
            ServerWebExchange exchange) {
        return TokenHolder.getToken()
                .cast(Object.class);
    }
}
