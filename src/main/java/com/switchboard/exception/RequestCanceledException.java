package com.switchboard.exception;

/**
 * The caller canceled the operation.
 */
public class RequestCanceledException extends GatewayException {

    public RequestCanceledException(String message) {
        this(message, null, null, null);
    }

    public RequestCanceledException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public RequestCanceledException(String message, String provider, String operation, Throwable cause) {
        super(message, provider, operation, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CANCELED;
    }

    @Override
    public RequestCanceledException tagged(String provider, String operation) {
        RequestCanceledException copy = new RequestCanceledException(
                getRawMessage(), providerOr(provider), operationOr(operation), getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
