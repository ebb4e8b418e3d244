package com.example.resourceapi.audit;

import com.example.resourceapi.common.util.ClientIpExtractor;
import com.example.resourceapi.common.util.StringSanitizer;
import com.example.resourceapi.observability.filter.CorrelationIdFilter;
import com.example.resourceapi.security.context.Token;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;

import java.time.Clock;
import java.util.UUID;

@Component
public class BreadcrumbFactory {

    private final Clock clock;

    public BreadcrumbFactory() {
        this(Clock.systemUTC());
    }

    BreadcrumbFactory(Clock clock) {
        this.clock = clock;
    }

    /**
     * Builds the audit record for the current request. The correlation id is the one
     * {@link CorrelationIdFilter} attached to the request, or a fresh UUID when the filter did not run.
     */
    public Breadcrumb create(Token token, ServerWebExchange exchange) {
        String correlationId = StringSanitizer.headerValue(
                exchange.getRequest().getHeaders().getFirst(CorrelationIdFilter.CORRELATION_ID_HEADER));
        if (correlationId == null || correlationId.isEmpty()) {
            correlationId = UUID.randomUUID().toString();
        }

        return new Breadcrumb(
                clock.instant(),
                token.userId(),
                ClientIpExtractor.extract(exchange),
                correlationId);
    }
}
