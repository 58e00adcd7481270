package com.switchboard.exception;

import org.springframework.http.HttpStatus;

/**
 * Closed failure taxonomy. Every error that leaves a provider adapter maps to exactly one kind.
 */
public enum ErrorKind {

    CONFIGURATION(HttpStatus.INTERNAL_SERVER_ERROR, "configuration_error"),
    VALIDATION(HttpStatus.BAD_REQUEST, "invalid_request_error"),
    UNSUPPORTED_OPERATION(HttpStatus.NOT_IMPLEMENTED, "unsupported_operation"),
    COMMUNICATION(HttpStatus.BAD_GATEWAY, "upstream_communication_error"),
    UPSTREAM_JOB_FAILED(HttpStatus.BAD_GATEWAY, "upstream_job_failed"),
    UPSTREAM_JOB_CANCELED(HttpStatus.BAD_GATEWAY, "upstream_job_canceled"),
    TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "timeout"),
    // 499 has no HttpStatus constant; resolved by value in the exception handler
    CANCELED(null, "request_canceled");

    private final HttpStatus status;
    private final String type;

    ErrorKind(HttpStatus status, String type) {
        this.status = status;
        this.type = type;
    }

    public int statusCode() {
        return status != null ? status.value() : 499;
    }

    public String type() {
        return type;
    }
}
