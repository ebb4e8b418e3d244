package com.example.resourceapi.observability.filter;

import com.example.resourceapi.common.util.ClientIpExtractor;
import com.example.resourceapi.common.util.StringSanitizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * WebFilter that logs every API request with its outcome and duration, and records a Micrometer timer
 * tagged by method, normalized URI, status and outcome.
 * Runs after CorrelationIdFilter so each log line carries the correlation ID from the MDC.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
public class RequestLoggingFilter implements WebFilter {

    private final MeterRegistry meterRegistry;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        // Health probes would drown out the API traffic
        String path = exchange.getRequest().getPath().value();
        if (path.startsWith("/actuator")) {
            return chain.filter(exchange);
        }

        Instant startTime = Instant.now();
        String method = exchange.getRequest().getMethod().name();
        // Logging only, so the unvalidated forwarded address is acceptable here
        String clientIp = ClientIpExtractor.extractSimple(exchange);

        return chain.filter(exchange)
                .doFirst(() -> {
                    MDC.put("clientIp", StringSanitizer.forLog(clientIp));
                    log.info("Incoming request: {} {}", method, StringSanitizer.forLog(path));
                })
                .doFinally(signalType -> {
                    Duration duration = Duration.between(startTime, Instant.now());
                    // No status set means the handler completed normally
                    HttpStatusCode status = exchange.getResponse().getStatusCode();
                    int statusCode = status != null ? status.value() : 200;

                    recordRequestMetrics(method, path, statusCode, duration);

                    MDC.put("responseStatus", String.valueOf(statusCode));
                    MDC.put("durationMs", String.valueOf(duration.toMillis()));

                    // Level follows the status class: 5xx error, 4xx warn, otherwise info
                    String sanitizedPath = StringSanitizer.forLog(path);
                    if (statusCode >= 500) {
                        log.error("Request completed: {} {} - {} in {}ms",
                                method, sanitizedPath, statusCode, duration.toMillis());
                    } else if (statusCode >= 400) {
                        log.warn("Request completed: {} {} - {} in {}ms",
                                method, sanitizedPath, statusCode, duration.toMillis());
                    } else {
                        log.info("Request completed: {} {} - {} in {}ms",
                                method, sanitizedPath, statusCode, duration.toMillis());
                    }

                    MDC.remove("clientIp");
                    MDC.remove("responseStatus");
                    MDC.remove("durationMs");
                });
    }

    /**
     * Records one sample on {@code http.server.requests.custom}.
     */
    private void recordRequestMetrics(String method, String path, int statusCode, Duration duration) {
        Timer.builder("http.server.requests.custom")
                .tag("method", method)
                .tag("uri", normalizePath(path))
                .tag("status", String.valueOf(statusCode))
                .tag("outcome", getOutcome(statusCode))
                .register(meterRegistry)
                .record(duration.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Replaces document ids with a placeholder to keep metric cardinality bounded, so
     * {@code /api/grade/65a1...} and {@code /api/grade/65b2...} share one timer.
     */
    static String normalizePath(String path) {
        return path
                // 24-hex ObjectIds
                .replaceAll("/[0-9a-fA-F]{24}(?=/|$)", "/{id}")
                // Numeric ids
                .replaceAll("/\\d+(?=/|$)", "/{id}")
                // /api/{resource}/{id} is the deepest route; cut anything below it
                .replaceAll("^(/[^/]+/[^/]+/[^/]+).*", "$1");
    }

    /**
     * Same outcome names as Spring's built-in {@code http.server.requests} metric.
     */
    private String getOutcome(int statusCode) {
        if (statusCode < 200) return "INFORMATIONAL";
        if (statusCode < 300) return "SUCCESS";
        if (statusCode < 400) return "REDIRECTION";
        if (statusCode < 500) return "CLIENT_ERROR";
        return "SERVER_ERROR";
    }
}
