package com.switchboard.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.capability.CapabilityService;
import com.switchboard.job.JobPollingEngine;
import com.switchboard.resilience.RetryPolicy;
import com.switchboard.streaming.SyntheticChunker;
import lombok.Getter;
import org.springframework.stereotype.Component;

/**
 * Shared collaborators every provider client needs.
 */
@Getter
@Component
public class ClientSupport {

    private final RetryPolicy retryPolicy;
    private final CapabilityService capabilities;
    private final SyntheticChunker chunker;
    private final JobPollingEngine jobEngine;
    private final ObjectMapper objectMapper;

    public ClientSupport(RetryPolicy retryPolicy, CapabilityService capabilities, SyntheticChunker chunker,
                         JobPollingEngine jobEngine, ObjectMapper objectMapper) {
        this.retryPolicy = retryPolicy;
        this.capabilities = capabilities;
        this.chunker = chunker;
        this.jobEngine = jobEngine;
        this.objectMapper = objectMapper;
    }
}
