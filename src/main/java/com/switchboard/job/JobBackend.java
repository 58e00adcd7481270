package com.switchboard.job;

import reactor.core.publisher.Mono;

/**
 * Upstream that runs work as asynchronous jobs: submit once, then read status until terminal.
 */
public interface JobBackend {

    String getName();

    /**
     * Submit the job. The returned observation is the job's first status.
     */
    Mono<PredictionJob> submit(JobRequest request);

    Mono<PredictionJob> poll(String jobId);

    /**
     * Ask the upstream to stop the job. Callers treat this as best effort.
     */
    Mono<Void> cancel(String jobId);
}
