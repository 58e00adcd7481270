package com.switchboard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for Switchboard.
 */
@Data
@Component
@ConfigurationProperties(prefix = "switchboard")
public class SwitchboardProperties {

    private Map<String, ProviderConfig> providers = new HashMap<>();
    private HttpConfig http = new HttpConfig();
    private ResilienceConfig resilience = new ResilienceConfig();
    private PollingConfig polling = new PollingConfig();
    private StreamingConfig streaming = new StreamingConfig();
    private CacheConfig cache = new CacheConfig();
    private RealtimeConfig realtime = new RealtimeConfig();

    /**
     * Explicit capability entries, keyed by provider then model id.
     */
    private Map<String, Map<String, CapabilityEntry>> capabilities = new HashMap<>();

    @Data
    public static class ProviderConfig {
        private boolean enabled = false;
        private String baseUrl;
        private String apiKey;
        private String secret;
        private String region;
        private String apiVersion;
        private List<String> models = new ArrayList<>();
    }

    @Data
    public static class HttpConfig {
        private Duration timeout = Duration.ofSeconds(60);
        private Duration connectTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class ResilienceConfig {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
    }

    @Data
    public static class PollingConfig {
        private Duration interval = Duration.ofSeconds(2);
        private Duration maxDuration = Duration.ofMinutes(10);
    }

    @Data
    public static class StreamingConfig {
        private int chunkSize = 8;
        private Duration chunkDelay = Duration.ofMillis(20);
    }

    @Data
    public static class CacheConfig {
        private int maxSize = 500;
        private Duration modelsTtl = Duration.ofMinutes(10);
    }

    @Data
    public static class RealtimeConfig {
        private Duration connectTimeout = Duration.ofSeconds(15);
        private Map<String, ErrorPolicyConfig> errorPolicies = new HashMap<>();
    }

    /**
     * Realtime error classification data for one provider. Codes not listed fall back to the translator defaults.
     */
    @Data
    public static class ErrorPolicyConfig {
        private List<String> criticalCodes = new ArrayList<>();
        private List<String> warningCodes = new ArrayList<>();
        private List<String> terminalCodes = new ArrayList<>();
    }

    @Data
    public static class CapabilityEntry {
        private boolean chat = true;
        private boolean streaming = true;
        private boolean vision = false;
        private boolean functionCalling = false;
        private boolean embeddings = false;
        private boolean imageGeneration = false;
        private boolean videoGeneration = false;
        private boolean textToSpeech = false;
        private boolean realtimeAudio = false;
        private Integer maxInputTokens;
        private Integer maxOutputTokens;
    }
}
