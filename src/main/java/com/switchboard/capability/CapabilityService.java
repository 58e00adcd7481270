package com.switchboard.capability;

import com.switchboard.config.SwitchboardProperties;
import com.switchboard.exception.UnsupportedProviderOperationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Answers what a provider/model pair can do.
 *
 * <p>Explicit entries under {@code switchboard.capabilities} win; otherwise the answer is
 * inferred from the model id. Lookups never touch the network.
 */
@Slf4j
@Service
public class CapabilityService {

    private static final List<String> VISION_MARKERS = List.of("vision", "gpt-4o", "claude-3", "gemini");
    private static final List<String> IMAGE_MARKERS = List.of("dall-e", "flux", "sdxl", "stable-diffusion");
    private static final List<String> VIDEO_MARKERS = List.of("video", "veo", "minimax");
    private static final List<String> REALTIME_MARKERS = List.of("realtime", "ultravox");

    private final Map<String, Map<String, SwitchboardProperties.CapabilityEntry>> entries;

    public CapabilityService(SwitchboardProperties properties) {
        this.entries = properties.getCapabilities();
    }

    public CapabilityDescriptor getCapabilities(String provider, String modelId) {
        SwitchboardProperties.CapabilityEntry entry = findEntry(provider, modelId);
        if (entry != null) {
            return CapabilityDescriptor.from(entry);
        }
        return infer(modelId);
    }

    /**
     * Fails when the model cannot perform the operation.
     *
     * @return the descriptor that allowed it
     * @throws UnsupportedProviderOperationException before any request is sent
     */
    public CapabilityDescriptor require(String provider, String modelId, Operation operation) {
        CapabilityDescriptor capabilities = getCapabilities(provider, modelId);
        if (!capabilities.supports(operation)) {
            log.debug("Capability gate rejected {} for {}/{}", operation, provider, modelId);
            throw new UnsupportedProviderOperationException(
                    "Model '" + modelId + "' does not support " + operation.label(),
                    provider, operation.label(), null);
        }
        return capabilities;
    }

    private SwitchboardProperties.CapabilityEntry findEntry(String provider, String modelId) {
        if (provider == null || modelId == null) {
            return null;
        }
        Map<String, SwitchboardProperties.CapabilityEntry> models = entries.get(provider);
        if (models == null) {
            return null;
        }
        SwitchboardProperties.CapabilityEntry entry = models.get(modelId);
        if (entry != null) {
            return entry;
        }
        return models.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(modelId))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }

    static CapabilityDescriptor infer(String modelId) {
        String id = modelId == null ? "" : modelId.toLowerCase(Locale.ROOT);

        if (id.contains("embed")) {
            return CapabilityDescriptor.builder().embeddings(true).build();
        }
        if (containsAny(id, IMAGE_MARKERS)) {
            return CapabilityDescriptor.builder().imageGeneration(true).build();
        }
        if (containsAny(id, VIDEO_MARKERS)) {
            return CapabilityDescriptor.builder().videoGeneration(true).build();
        }
        if (id.contains("tts")) {
            return CapabilityDescriptor.builder().textToSpeech(true).build();
        }
        if (containsAny(id, REALTIME_MARKERS)) {
            return CapabilityDescriptor.builder().realtimeAudio(true).build();
        }

        boolean vision = containsAny(id, VISION_MARKERS);
        return CapabilityDescriptor.builder()
                .chat(true)
                .streaming(true)
                .vision(vision)
                .functionCalling(vision || id.startsWith("gpt-") || id.startsWith("claude"))
                .build();
    }

    private static boolean containsAny(String id, List<String> markers) {
        return markers.stream().anyMatch(id::contains);
    }
}
