package com.switchboard.job;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Model plus provider-specific input document for a job submission.
 */
public record JobRequest(String model, JsonNode input) {
}
