package com.switchboard.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a credential check against a provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthenticationResult {

    @JsonProperty("provider")
    private String provider;

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("message")
    private String message;

    @JsonProperty("details")
    private String details;

    @JsonProperty("response_time_ms")
    private Long responseTimeMs;

    public static AuthenticationResult success(String provider, String message, long responseTimeMs) {
        return new AuthenticationResult(provider, true, message, null, responseTimeMs);
    }

    public static AuthenticationResult failure(String provider, String message, String details) {
        return new AuthenticationResult(provider, false, message, details, null);
    }
}
