package com.neohoods.bridge.config;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import com.neohoods.bridge.exceptions.CodedError;
import com.neohoods.bridge.exceptions.CodedErrorException;
import com.neohoods.bridge.exceptions.MatrixApiException;
import com.neohoods.bridge.model.ErrorResponse;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(CodedErrorException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleCodedErrorException(CodedErrorException ex) {
        return Mono.deferContextual(ctx -> {
            String traceId = ctx.getOrDefault(TraceIdFilter.TRACE_ID_CONTEXT_KEY, generateTraceId());
            HttpStatus status = ex.getError().getStatus();
            if (status.is5xxServerError()) {
                logError(traceId, ex);
            } else {
                log.warn("Request rejected - TraceId: {} - Code: {} - Variables: {}", traceId,
                        ex.getError().getCode(), ex.getVariables());
            }

            ErrorResponse error = ErrorResponse.builder()
                    .code(ex.getError().getCode())
                    .message(ex.getError().getDefaultMessage())
                    .traceId(traceId)
                    .variables(ex.getVariables())
                    .build();

            return Mono.just(new ResponseEntity<>(error, status));
        });
    }

    @ExceptionHandler(MatrixApiException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleMatrixApiException(MatrixApiException ex) {
        return Mono.deferContextual(ctx -> {
            String traceId = ctx.getOrDefault(TraceIdFilter.TRACE_ID_CONTEXT_KEY, generateTraceId());
            logError(traceId, ex);

            CodedError coded = ex.isAuthFailure() ? CodedError.AUTHENTICATION_FAILED : CodedError.MATRIX_UPSTREAM_ERROR;
            ErrorResponse error = ErrorResponse.builder()
                    .code(coded.getCode())
                    .message(coded.getDefaultMessage())
                    .traceId(traceId)
                    .build();
            if (ex.getErrcode() != null) {
                error.setVariables(Map.of("errcode", ex.getErrcode()));
            }

            return Mono.just(new ResponseEntity<>(error, coded.getStatus()));
        });
    }

    @ExceptionHandler(TimeoutException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleTimeoutException(TimeoutException ex) {
        return Mono.deferContextual(ctx -> {
            String traceId = ctx.getOrDefault(TraceIdFilter.TRACE_ID_CONTEXT_KEY, generateTraceId());
            log.warn("Request deadline exceeded - TraceId: {} - {}", traceId, ex.getMessage());

            ErrorResponse error = ErrorResponse.builder()
                    .code(CodedError.REQUEST_TIMEOUT.getCode())
                    .message(CodedError.REQUEST_TIMEOUT.getDefaultMessage())
                    .traceId(traceId)
                    .build();

            return Mono.just(new ResponseEntity<>(error, CodedError.REQUEST_TIMEOUT.getStatus()));
        });
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(ServerWebInputException ex) {
        return Mono.deferContextual(ctx -> {
            String traceId = ctx.getOrDefault(TraceIdFilter.TRACE_ID_CONTEXT_KEY, generateTraceId());
            log.warn("Invalid request body - TraceId: {} - {}", traceId, ex.getReason());

            ErrorResponse error = ErrorResponse.builder()
                    .code(CodedError.INVALID_INPUT.getCode())
                    .message(CodedError.INVALID_INPUT.getDefaultMessage())
                    .traceId(traceId)
                    .build();

            return Mono.just(new ResponseEntity<>(error, HttpStatus.BAD_REQUEST));
        });
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleException(Exception ex) {
        return Mono.deferContextual(ctx -> {
            String traceId = ctx.getOrDefault(TraceIdFilter.TRACE_ID_CONTEXT_KEY, generateTraceId());
            logError(traceId, ex);

            ErrorResponse error = ErrorResponse.builder()
                    .code(CodedError.INTERNAL_ERROR.getCode())
                    .message("An unexpected error occurred")
                    .traceId(traceId)
                    .build();

            return Mono.just(new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR));
        });
    }

    private String generateTraceId() {
        return UUID.randomUUID().toString();
    }

    private void logError(String traceId, Exception ex) {
        log.error("Error occurred - TraceId: {} - Message: {}", traceId, ex.getMessage(), ex);
    }
}
