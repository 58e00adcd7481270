package com.switchboard.job;

import com.switchboard.config.SwitchboardProperties;
import com.switchboard.exception.OperationTimeoutException;
import com.switchboard.exception.RequestCanceledException;
import com.switchboard.exception.UpstreamJobCanceledException;
import com.switchboard.exception.UpstreamJobFailedException;
import com.switchboard.model.ChatCompletionChunk;
import com.switchboard.model.ChatCompletionResponse;
import com.switchboard.resilience.CancellationToken;
import com.switchboard.streaming.ChunkFactory;
import com.switchboard.streaming.SyntheticChunker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Drives submit/poll job APIs to completion.
 *
 * <p>Status is read every {@code interval} until the job is terminal. The whole wait is bounded
 * by {@code maxDuration}. Caller cancellation and timeout both stop polling at once and send a
 * best-effort cancel for the upstream job.
 */
@Slf4j
@Component
public class JobPollingEngine {

    private final Duration interval;
    private final Duration maxDuration;
    private final SyntheticChunker chunker;

    @Autowired
    public JobPollingEngine(SwitchboardProperties properties, SyntheticChunker chunker) {
        this(properties.getPolling().getInterval(), properties.getPolling().getMaxDuration(), chunker);
    }

    public JobPollingEngine(Duration interval, Duration maxDuration, SyntheticChunker chunker) {
        this.interval = interval;
        this.maxDuration = maxDuration;
        this.chunker = chunker;
    }

    /**
     * Submit and wait for the terminal status.
     *
     * @return the succeeded job
     */
    public Mono<PredictionJob> run(JobBackend backend, JobRequest request, CancellationToken cancellation) {
        return Mono.defer(() -> {
            AtomicReference<String> jobId = new AtomicReference<>();
            Mono<PredictionJob> job = backend.submit(request)
                    .doOnNext(submitted -> {
                        jobId.set(submitted.getId());
                        log.info("Submitted {} job {} for model {}", backend.getName(), submitted.getId(),
                                request.model());
                    })
                    .flatMap(submitted -> follow(backend, submitted));
            return bounded(backend, job, jobId, cancellation);
        });
    }

    public <T> Mono<T> run(JobBackend backend, JobRequest request, Function<PredictionJob, T> mapper,
                           CancellationToken cancellation) {
        return run(backend, request, cancellation).map(mapper);
    }

    /**
     * Stream a job's result: a role chunk as soon as the job is accepted, then the final text
     * split into synthetic chunks, then the terminal chunk.
     */
    public Flux<ChatCompletionChunk> stream(JobBackend backend, JobRequest request,
                                            Function<PredictionJob, ChatCompletionResponse> mapper,
                                            CancellationToken cancellation) {
        return Flux.defer(() -> {
            ChunkFactory chunks = ChunkFactory.create(null, request.model());
            AtomicReference<String> jobId = new AtomicReference<>();
            Flux<ChatCompletionChunk> flux = backend.submit(request)
                    .flatMapMany(submitted -> {
                        jobId.set(submitted.getId());
                        log.info("Submitted {} streaming job {} for model {}", backend.getName(),
                                submitted.getId(), request.model());
                        Mono<ChatCompletionResponse> result = bounded(backend, follow(backend, submitted), jobId,
                                cancellation)
                                .map(mapper)
                                .map(response -> response.toBuilder()
                                        .id(chunks.getId())
                                        .model(request.model())
                                        .build());
                        return Flux.just(chunks.role())
                                .concatWith(result.flatMapMany(response -> chunker.stream(response, true,
                                        cancellation)));
                    });
            return cancellation.guard(flux, backend.getName() + " job stream");
        });
    }

    private Mono<PredictionJob> follow(JobBackend backend, PredictionJob job) {
        switch (job.getStatus()) {
            case SUCCEEDED:
                log.info("{} job {} succeeded", backend.getName(), job.getId());
                return Mono.just(job);
            case FAILED:
                log.warn("{} job {} failed: {}", backend.getName(), job.getId(), job.getError());
                return Mono.error(new UpstreamJobFailedException(job.getId(),
                        job.getError() != null ? job.getError() : "Job failed without an error message"));
            case CANCELED:
                return Mono.error(new UpstreamJobCanceledException(job.getId()));
            default:
                log.debug("{} job {} is {}, polling again in {}", backend.getName(), job.getId(),
                        job.getStatus(), interval);
                return Mono.delay(interval)
                        .then(Mono.defer(() -> backend.poll(job.getId())))
                        .flatMap(next -> follow(backend, next));
        }
    }

    private Mono<PredictionJob> bounded(JobBackend backend, Mono<PredictionJob> job, AtomicReference<String> jobId,
                                        CancellationToken cancellation) {
        return cancellation.guard(job, backend.getName() + " job")
                .timeout(maxDuration, Mono.defer(() -> Mono.error(new OperationTimeoutException(
                        "Job " + jobId.get() + " did not finish within " + maxDuration))))
                .doOnError(error -> {
                    if (error instanceof RequestCanceledException || error instanceof OperationTimeoutException) {
                        cancelUpstream(backend, jobId.get());
                    }
                });
    }

    private void cancelUpstream(JobBackend backend, String jobId) {
        if (jobId == null) {
            return;
        }
        log.info("Canceling {} job {}", backend.getName(), jobId);
        backend.cancel(jobId)
                .subscribe(
                        ignored -> { },
                        error -> log.warn("Best-effort cancel of {} job {} failed: {}",
                                backend.getName(), jobId, error.getMessage()));
    }
}
