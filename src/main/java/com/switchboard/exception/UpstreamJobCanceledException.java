package com.switchboard.exception;

import lombok.Getter;

/**
 * An asynchronous upstream job was canceled on the upstream side.
 * Distinct from {@link RequestCanceledException}, which is caller-initiated.
 */
@Getter
public class UpstreamJobCanceledException extends GatewayException {

    private final String jobId;

    public UpstreamJobCanceledException(String jobId) {
        this(jobId, null, null);
    }

    public UpstreamJobCanceledException(String jobId, String provider, String operation) {
        super("Job " + jobId + " was canceled by upstream", provider, operation, null);
        this.jobId = jobId;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.UPSTREAM_JOB_CANCELED;
    }

    @Override
    public UpstreamJobCanceledException tagged(String provider, String operation) {
        UpstreamJobCanceledException copy = new UpstreamJobCanceledException(
                jobId, providerOr(provider), operationOr(operation));
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
