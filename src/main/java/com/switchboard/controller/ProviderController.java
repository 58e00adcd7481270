package com.switchboard.controller;

import com.switchboard.capability.CapabilityDescriptor;
import com.switchboard.model.AuthenticationResult;
import com.switchboard.model.ModelInfo;
import com.switchboard.resilience.CancellationToken;
import com.switchboard.service.ProviderService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Provider administration: registered adapters, capabilities and credential checks.
 */
@Slf4j
@RestController
@RequestMapping("/v1/providers")
public class ProviderController {

    private final ProviderService providerService;

    public ProviderController(ProviderService providerService) {
        this.providerService = providerService;
    }

    @GetMapping
    public List<Map<String, Object>> listProviders() {
        return providerService.getProviders().stream()
                .map(provider -> Map.<String, Object>of("name", provider.getName(), "enabled", provider.isEnabled()))
                .toList();
    }

    @GetMapping("/{name}/capabilities")
    public CapabilityDescriptor getCapabilities(@PathVariable String name, @RequestParam String model) {
        return providerService.getCapabilities(name, model);
    }

    @GetMapping("/{name}/models")
    public Mono<List<ModelInfo>> listModels(@PathVariable String name) {
        CancellationToken cancellation = CancellationToken.create();
        return Mono.defer(() -> providerService.listModels(providerService.requireProvider(name), cancellation))
                .doOnCancel(cancellation::cancel);
    }

    /**
     * Always 200; whether the credentials work is in the body.
     */
    @PostMapping("/{name}/verify")
    public Mono<ResponseEntity<AuthenticationResult>> verify(@PathVariable String name) {
        log.info("Credential verification requested for {}", name);
        CancellationToken cancellation = CancellationToken.create();
        return providerService.verifyAuthentication(name, cancellation)
                .map(ResponseEntity::ok)
                .doOnCancel(cancellation::cancel);
    }
}
