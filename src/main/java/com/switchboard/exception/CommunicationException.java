package com.switchboard.exception;

import lombok.Getter;

/**
 * Transport failure, non-2xx upstream response or undecodable response body.
 * Keeps the upstream HTTP status when there was one so the retry policy can classify it.
 */
@Getter
public class CommunicationException extends GatewayException {

    /** Upstream HTTP status, or {@code null} for transport-level failures. */
    private final Integer statusCode;

    private final boolean transientFailure;

    public CommunicationException(String message) {
        this(message, null, null, null, null);
    }

    public CommunicationException(String message, Throwable cause) {
        this(message, null, null, null, cause);
    }

    public CommunicationException(String message, Integer statusCode, Throwable cause) {
        this(message, statusCode, null, null, cause);
    }

    public CommunicationException(String message, Integer statusCode, String provider, String operation,
                                  Throwable cause) {
        this(message, statusCode, statusCode == null || statusCode >= 500 || statusCode == 429,
                provider, operation, cause);
    }

    private CommunicationException(String message, Integer statusCode, boolean transientFailure,
                                   String provider, String operation, Throwable cause) {
        super(message, provider, operation, cause);
        this.statusCode = statusCode;
        this.transientFailure = transientFailure;
    }

    /**
     * A response arrived but could not be decoded. Retrying will not change the payload.
     */
    public static CommunicationException malformedResponse(String message, Throwable cause) {
        return new CommunicationException(message, null, false, null, null, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.COMMUNICATION;
    }

    /**
     * Transport failures, 5xx and 429 are worth another attempt.
     */
    public boolean isTransient() {
        return transientFailure;
    }

    @Override
    public CommunicationException tagged(String provider, String operation) {
        CommunicationException copy = new CommunicationException(
                getRawMessage(), statusCode, transientFailure, providerOr(provider), operationOr(operation), getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
