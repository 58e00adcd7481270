package com.switchboard.exception;

/**
 * An operation or poll loop exceeded its time bound.
 */
public class OperationTimeoutException extends GatewayException {

    public OperationTimeoutException(String message) {
        this(message, null, null, null);
    }

    public OperationTimeoutException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public OperationTimeoutException(String message, String provider, String operation, Throwable cause) {
        super(message, provider, operation, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.TIMEOUT;
    }

    @Override
    public OperationTimeoutException tagged(String provider, String operation) {
        OperationTimeoutException copy = new OperationTimeoutException(
                getRawMessage(), providerOr(provider), operationOr(operation), getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
