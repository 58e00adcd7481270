package com.switchboard.exception;

import lombok.Getter;

/**
 * An asynchronous upstream job reached the failed state. The message is the upstream-supplied error.
 */
@Getter
public class UpstreamJobFailedException extends GatewayException {

    private final String jobId;

    public UpstreamJobFailedException(String jobId, String message) {
        this(jobId, message, null, null);
    }

    public UpstreamJobFailedException(String jobId, String message, String provider, String operation) {
        super(message, provider, operation, null);
        this.jobId = jobId;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.UPSTREAM_JOB_FAILED;
    }

    @Override
    public UpstreamJobFailedException tagged(String provider, String operation) {
        UpstreamJobFailedException copy = new UpstreamJobFailedException(
                jobId, getRawMessage(), providerOr(provider), operationOr(operation));
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
