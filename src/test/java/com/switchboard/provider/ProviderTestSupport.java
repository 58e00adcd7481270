package com.switchboard.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.capability.CapabilityService;
import com.switchboard.config.JacksonConfiguration;
import com.switchboard.config.SwitchboardProperties;
import com.switchboard.job.JobPollingEngine;
import com.switchboard.model.ChatCompletionRequest;
import com.switchboard.model.Message;
import com.switchboard.model.ProviderCredentials;
import com.switchboard.resilience.RetryPolicy;
import com.switchboard.streaming.SyntheticChunker;

import java.time.Duration;
import java.util.List;
import java.util.Random;

/**
 * Collaborators for adapter tests: fast retries, no synthetic delay, short polling.
 */
public final class ProviderTestSupport {

    public static final ObjectMapper MAPPER = JacksonConfiguration.configure(new ObjectMapper());

    private ProviderTestSupport() {
    }

    public static ClientSupport clientSupport() {
        return clientSupport(new SwitchboardProperties());
    }

    public static ClientSupport clientSupport(SwitchboardProperties properties) {
        SyntheticChunker chunker = new SyntheticChunker(8, Duration.ZERO);
        RetryPolicy retryPolicy = new RetryPolicy(2, Duration.ofMillis(1), Duration.ofMillis(5),
                attempt -> { }, new Random(7));
        JobPollingEngine jobEngine = new JobPollingEngine(Duration.ofMillis(5), Duration.ofSeconds(5), chunker);
        return new ClientSupport(retryPolicy, new CapabilityService(properties), chunker, jobEngine, MAPPER);
    }

    public static ProviderSettings settings(String name, String apiKey) {
        return ProviderSettings.enabled(name, ProviderCredentials.builder().apiKey(apiKey).build());
    }

    public static ChatCompletionRequest chat(String model, String userText) {
        return ChatCompletionRequest.builder()
                .model(model)
                .messages(List.of(Message.of(Message.ROLE_USER, userText)))
                .build();
    }
}
