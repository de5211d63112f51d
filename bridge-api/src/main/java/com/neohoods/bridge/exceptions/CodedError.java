package com.neohoods.bridge.exceptions;

import org.springframework.http.HttpStatus;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum CodedError {
        // Authentication errors
        AUTHENTICATION_FAILED("AUTH001", "Matrix authentication failed", HttpStatus.UNAUTHORIZED),
        ADMIN_TOKEN_INVALID("AUTH002", "Invalid admin token", HttpStatus.UNAUTHORIZED),
        ADMIN_FORBIDDEN("AUTH003", "Admin API only available from localhost", HttpStatus.FORBIDDEN),

        // Resolution errors
        INVALID_SENDER("RES001", "Sender is not resolvable to a Matrix user", HttpStatus.BAD_REQUEST),
        INVALID_RECIPIENT("RES002", "Recipient is not resolvable to a Matrix user or room", HttpStatus.BAD_REQUEST),
        MAPPING_NOT_FOUND("RES003", "Mapping not found", HttpStatus.NOT_FOUND),

        // Validation errors
        INVALID_INPUT("VAL001", "Invalid input provided", HttpStatus.BAD_REQUEST),
        INVALID_MAPPING("VAL002", "Mapping number is required", HttpStatus.BAD_REQUEST),

        // Upstream and system errors
        MATRIX_UPSTREAM_ERROR("SYS001", "Matrix homeserver request failed", HttpStatus.BAD_GATEWAY),
        EXTERNAL_AUTH_ERROR("SYS002", "External authentication service error", HttpStatus.BAD_GATEWAY),
        PUSH_STORAGE_ERROR("SYS003", "Push token storage error", HttpStatus.INTERNAL_SERVER_ERROR),
        REQUEST_TIMEOUT("SYS005", "Request deadline exceeded", HttpStatus.GATEWAY_TIMEOUT),
        INTERNAL_ERROR("SYS004", "An internal error occurred", HttpStatus.INTERNAL_SERVER_ERROR);

        private final String code;
        private final String defaultMessage;
        private final HttpStatus status;
}
