package com.example.resourceapi.exception;

import com.example.resourceapi.common.exception.ErrorKind;
import com.example.resourceapi.common.exception.ResourceException;
import com.example.resourceapi.security.exception.AuthenticationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.web.WebProperties;
import org.springframework.boot.autoconfigure.web.reactive.error.AbstractErrorWebExceptionHandler;
import org.springframework.boot.web.error.ErrorAttributeOptions;
import org.springframework.boot.web.reactive.error.ErrorAttributes;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Renders errors raised outside controllers, chiefly by the bearer token filter, in the same
 * {@link ErrorResponse} shape the controller advice uses.
 */
@Slf4j
@Component
@Order(-2)  // Higher priority than DefaultErrorWebExceptionHandler
public class GlobalErrorWebExceptionHandler extends AbstractErrorWebExceptionHandler {

    public GlobalErrorWebExceptionHandler(
            ErrorAttributes errorAttributes,
            WebProperties webProperties,
            ApplicationContext applicationContext,
            ServerCodecConfigurer serverCodecConfigurer) {
        super(errorAttributes, webProperties.getResources(), applicationContext);
        this.setMessageWriters(serverCodecConfigurer.getWriters());
    }

    @Override
    protected RouterFunction<ServerResponse> getRoutingFunction(ErrorAttributes errorAttributes) {
        return RouterFunctions.route(RequestPredicates.all(), this::renderErrorResponse);
    }

    private Mono<ServerResponse> renderErrorResponse(ServerRequest request) {
        Throwable error = getError(request);
        String path = request.path();

        // Missing or invalid bearer token -> 401
        if (error instanceof AuthenticationException) {
            log.warn("Authentication failed: path={}, error={}", path, error.getMessage());
            return createErrorResponse(HttpStatus.UNAUTHORIZED, "authentication_error",
                    "Authentication required", path);
        }

        if (error instanceof ResourceException resourceError) {
            ErrorKind kind = resourceError.getKind();
            log.warn("Resource error: path={}, kind={}, error={}", path, kind, error.getMessage());
            return createErrorResponse(kind.getStatus(), kind.getCode(),
                    error.getMessage(), path);
        }

        if (error instanceof ResponseStatusException statusException) {
            HttpStatus status = HttpStatus.resolve(statusException.getStatusCode().value());
            if (status == null) {
                status = HttpStatus.INTERNAL_SERVER_ERROR;
            }

            log.warn("Response status exception: path={}, status={}, reason={}",
                    path, status, statusException.getReason());

            return createErrorResponse(status, "request_error",
                    statusException.getReason() != null ? statusException.getReason() : status.getReasonPhrase(),
                    path);
        }

        Map<String, Object> errorAttributes = getErrorAttributes(request, ErrorAttributeOptions.defaults());
        int status = (int) errorAttributes.getOrDefault("status", 500);

        log.error("Unhandled error: path={}, status={}, error={}",
                path, status, error.getMessage(), error);

        return createErrorResponse(
                HttpStatus.valueOf(status),
                ErrorKind.INTERNAL.getCode(),
                "An unexpected error occurred",
                path
        );
    }

    private Mono<ServerResponse> createErrorResponse(HttpStatus status, String error, String message, String path) {
        ErrorResponse body = ErrorResponse.of(status.value(), error, message, path);

        return ServerResponse.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromValue(body));
    }
}
