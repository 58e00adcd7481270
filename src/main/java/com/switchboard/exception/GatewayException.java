package com.switchboard.exception;

import lombok.Getter;

/**
 * Base class of the gateway failure taxonomy.
 * Carries the provider and operation that produced the failure for diagnosability.
 */
@Getter
public abstract class GatewayException extends RuntimeException {

    private final String provider;
    private final String operation;

    protected GatewayException(String message, String provider, String operation, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.operation = operation;
    }

    public abstract ErrorKind getKind();

    /**
     * Copy of this failure tagged with the given provider and operation.
     * Tags already present are kept.
     */
    public abstract GatewayException tagged(String provider, String operation);

    protected String providerOr(String fallback) {
        return provider != null ? provider : fallback;
    }

    protected String operationOr(String fallback) {
        return operation != null ? operation : fallback;
    }

    @Override
    public String getMessage() {
        String base = super.getMessage();
        if (provider == null && operation == null) {
            return base;
        }
        return "[" + (provider != null ? provider : "?") + "/" + (operation != null ? operation : "?") + "] " + base;
    }

    /**
     * Message without the provider/operation prefix.
     */
    public String getRawMessage() {
        return super.getMessage();
    }
}
