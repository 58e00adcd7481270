package com.switchboard.model;

import com.switchboard.config.SwitchboardProperties;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable credential set for one provider.
 */
@Value
@Builder
public class ProviderCredentials {

    String apiKey;
    String secret;
    String baseUrl;
    String region;
    String apiVersion;

    public static ProviderCredentials from(SwitchboardProperties.ProviderConfig config) {
        if (config == null) {
            return ProviderCredentials.builder().build();
        }
        return ProviderCredentials.builder()
                .apiKey(config.getApiKey())
                .secret(config.getSecret())
                .baseUrl(config.getBaseUrl())
                .region(config.getRegion())
                .apiVersion(config.getApiVersion())
                .build();
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String baseUrlOr(String defaultBaseUrl) {
        String url = baseUrl != null && !baseUrl.isBlank() ? baseUrl : defaultBaseUrl;
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public String toString() {
        return "ProviderCredentials(apiKey=" + (hasApiKey() ? "****" : "<none>")
                + ", baseUrl=" + baseUrl + ", region=" + region + ", apiVersion=" + apiVersion + ")";
    }
}
