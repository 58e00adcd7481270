package com.switchboard.exception;

/**
 * Missing or invalid credentials or required configuration. Never retried.
 */
public class ConfigurationException extends GatewayException {

    public ConfigurationException(String message) {
        this(message, null, null, null);
    }

    public ConfigurationException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public ConfigurationException(String message, String provider, String operation, Throwable cause) {
        super(message, provider, operation, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.CONFIGURATION;
    }

    @Override
    public ConfigurationException tagged(String provider, String operation) {
        ConfigurationException copy = new ConfigurationException(
                getRawMessage(), providerOr(provider), operationOr(operation), getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
