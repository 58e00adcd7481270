package com.switchboard.exception;

/**
 * Malformed unified request.
 */
public class RequestValidationException extends GatewayException {

    public RequestValidationException(String message) {
        this(message, null, null, null);
    }

    public RequestValidationException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public RequestValidationException(String message, String provider, String operation, Throwable cause) {
        super(message, provider, operation, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.VALIDATION;
    }

    @Override
    public RequestValidationException tagged(String provider, String operation) {
        RequestValidationException copy = new RequestValidationException(
                getRawMessage(), providerOr(provider), operationOr(operation), getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
