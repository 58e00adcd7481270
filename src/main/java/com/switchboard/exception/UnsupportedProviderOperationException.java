package com.switchboard.exception;

/**
 * Operation not supported by the provider or model.
 */
public class UnsupportedProviderOperationException extends GatewayException {

    public UnsupportedProviderOperationException(String message) {
        this(message, null, null, null);
    }

    public UnsupportedProviderOperationException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public UnsupportedProviderOperationException(String message, String provider, String operation, Throwable cause) {
        super(message, provider, operation, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.UNSUPPORTED_OPERATION;
    }

    @Override
    public UnsupportedProviderOperationException tagged(String provider, String operation) {
        UnsupportedProviderOperationException copy = new UnsupportedProviderOperationException(
                getRawMessage(), providerOr(provider), operationOr(operation), getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
