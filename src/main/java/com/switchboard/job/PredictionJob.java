package com.switchboard.job;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One observation of an upstream job.
 */
@Value
@Builder(toBuilder = true)
public class PredictionJob {

    String id;
    JobStatus status;
    JsonNode input;
    JsonNode output;
    String error;
    Instant createdAt;
}
