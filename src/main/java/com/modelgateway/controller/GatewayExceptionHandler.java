package com.modelgateway.controller;

import com.modelgateway.exception.AllProvidersUnavailableException;
import com.modelgateway.exception.GatewayErrorCode;
import com.modelgateway.exception.GatewayException;
import com.modelgateway.model.dto.ApiErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Maps gateway failures to HTTP responses with a JSON error body.
 */
@Slf4j
@RestControllerAdvice
public class GatewayExceptionHandler {

    @ExceptionHandler(GatewayException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGateway(GatewayException ex) {
        ApiErrorResponse body = errorBody(ex);
        ResponseEntity.BodyBuilder response = ResponseEntity.status(body.getStatus());
        if (body.getRetryAfterSeconds() != null) {
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(body.getRetryAfterSeconds()));
        }
        return Mono.just(response.body(body));
    }

    /**
     * Error body for a gateway failure. Also used for the terminal error event
     * of a stream, whose HTTP status is already committed.
     */
    static ApiErrorResponse errorBody(GatewayException ex) {
        HttpStatus status = statusFor(ex.getCode());
        ApiErrorResponse.ApiErrorResponseBuilder body = ApiErrorResponse.builder()
                .status(status.value())
                .code(ex.getCode().name())
                .message(ex.getMessage());

        if (ex instanceof AllProvidersUnavailableException) {
            Duration retryAfter = ((AllProvidersUnavailableException) ex).getRetryAfter();
            if (retryAfter != null) {
                // Round up; Retry-After is whole seconds
                body.retryAfterSeconds(Math.max(1, (retryAfter.toMillis() + 999) / 1000));
            }
        }

        if (status.is5xxServerError()) {
            log.warn("[API] {} {}: {}", status.value(), ex.getCode(), ex.getMessage());
        } else {
            log.info("[API] {} {}: {}", status.value(), ex.getCode(), ex.getMessage());
        }
        return body.build();
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleBadInput(ServerWebInputException ex) {
        log.warn("[API] Bad request: {}", ex.getReason());
        return Mono.just(ResponseEntity.badRequest().body(ApiErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .code(GatewayErrorCode.INVALID_REQUEST.name())
                .message(ex.getReason())
                .build()));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiErrorResponse.builder()
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .message("Internal server error")
                .build()));
    }

    static HttpStatus statusFor(GatewayErrorCode code) {
        switch (code) {
            case CAPABILITY_UNAVAILABLE:
            case MODEL_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case ALL_PROVIDERS_UNAVAILABLE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case PROVIDER_TRANSIENT:
                return HttpStatus.BAD_GATEWAY;
            case PROVIDER_PERMANENT:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case QUEUE_REJECTED:
                return HttpStatus.TOO_MANY_REQUESTS;
            case REQUEST_EXPIRED:
                return HttpStatus.GATEWAY_TIMEOUT;
            case INVALID_REQUEST:
                return HttpStatus.BAD_REQUEST;
            case INVALID_CATALOG:
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
