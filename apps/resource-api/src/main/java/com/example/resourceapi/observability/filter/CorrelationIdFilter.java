package com.example.resourceapi.observability.filter;

import com.example.resourceapi.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;

/**
 * WebFilter that ensures every request has a correlation ID.
 *
 * <p>The ID is taken from X-Correlation-Id (or X-Request-Id), generated when absent, echoed on the
 * response, written back onto the request for the audit breadcrumb, and exposed to logging through
 * the Reactor context and MDC.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CORRELATION_ID_KEY = "correlationId";
    public static final String REQUEST_PATH_KEY = "requestPath";
    public static final String REQUEST_METHOD_KEY = "requestMethod";

    private static final int MAX_CORRELATION_ID_LENGTH = 128;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String correlationId = extractOrGenerateCorrelationId(exchange.getRequest());
        String requestPath = exchange.getRequest().getPath().value();
        String requestMethod = exchange.getRequest().getMethod().name();

        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        ServerHttpRequest mutatedRequest = exchange.getRequest().mutate()
                .headers(headers -> headers.set(CORRELATION_ID_HEADER, correlationId))
                .build();

        ServerWebExchange mutatedExchange = exchange.mutate()
                .request(mutatedRequest)
                .build();

        return chain.filter(mutatedExchange)
                .contextWrite(Context.of(
                        CORRELATION_ID_KEY, correlationId,
                        REQUEST_PATH_KEY, requestPath,
                        REQUEST_METHOD_KEY, requestMethod
                ))
                .doFirst(() -> {
                    MDC.put(CORRELATION_ID_KEY, correlationId);
                    MDC.put(REQUEST_PATH_KEY, requestPath);
                    MDC.put(REQUEST_METHOD_KEY, requestMethod);
                    log.debug("Request started: {} {}", requestMethod, StringSanitizer.forLog(requestPath));
                })
                .doFinally(signalType -> {
                    log.debug("Request completed: {} {} - {}",
                            requestMethod, StringSanitizer.forLog(requestPath), signalType);
                    MDC.remove(CORRELATION_ID_KEY);
                    MDC.remove(REQUEST_PATH_KEY);
                    MDC.remove(REQUEST_METHOD_KEY);
                });
    }

    /**
     * Checks X-Correlation-Id first, then X-Request-Id, then generates a UUID.
     */
    private String extractOrGenerateCorrelationId(ServerHttpRequest request) {
        String correlationId = StringSanitizer.headerValue(
                request.getHeaders().getFirst(CORRELATION_ID_HEADER), MAX_CORRELATION_ID_LENGTH);
        if (correlationId != null && !correlationId.isEmpty()) {
            return correlationId;
        }

        String requestId = StringSanitizer.headerValue(
                request.getHeaders().getFirst(REQUEST_ID_HEADER), MAX_CORRELATION_ID_LENGTH);
        if (requestId != null && !requestId.isEmpty()) {
            return requestId;
        }

        return UUID.randomUUID().toString();
    }
}
