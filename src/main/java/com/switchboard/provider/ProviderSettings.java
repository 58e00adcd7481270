package com.switchboard.provider;

import com.switchboard.config.SwitchboardProperties;
import com.switchboard.model.ProviderCredentials;

import java.util.List;

/**
 * Name, activation flag, credentials and static model list of one provider.
 */
public record ProviderSettings(String name, boolean enabled, ProviderCredentials credentials, List<String> models) {

    public static ProviderSettings of(SwitchboardProperties properties, String name) {
        SwitchboardProperties.ProviderConfig config = properties.getProviders().get(name);
        if (config == null) {
            return new ProviderSettings(name, false, ProviderCredentials.builder().build(), List.of());
        }
        return new ProviderSettings(name, config.isEnabled(), ProviderCredentials.from(config),
                config.getModels() != null ? List.copyOf(config.getModels()) : List.of());
    }

    /**
     * Enabled settings built directly from credentials.
     */
    public static ProviderSettings enabled(String name, ProviderCredentials credentials) {
        return new ProviderSettings(name, true, credentials, List.of());
    }
}
