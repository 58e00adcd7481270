package com.switchboard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

/**
 * Pooled transport clients shared by all provider adapters. Configuration is read-only after startup.
 */
@Configuration
public class WebClientConfiguration {

    private final SwitchboardProperties properties;

    public WebClientConfiguration(SwitchboardProperties properties) {
        this.properties = properties;
    }

    @Bean(destroyMethod = "dispose")
    public ConnectionProvider providerConnectionProvider() {
        return ConnectionProvider.builder("switchboard-upstream")
                .maxConnections(500)
                .pendingAcquireMaxCount(1000)
                .build();
    }

    @Bean
    public WebClient webClient(ConnectionProvider providerConnectionProvider, ObjectMapper objectMapper) {
        HttpClient httpClient = HttpClient.create(providerConnectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                        (int) properties.getHttp().getConnectTimeout().toMillis())
                .responseTimeout(properties.getHttp().getTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> {
                    codecs.defaultCodecs().maxInMemorySize(16 * 1024 * 1024);
                    codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(objectMapper));
                    codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(objectMapper));
                })
                .build();
    }

    @Bean
    public WebSocketClient realtimeWebSocketClient() {
        return new ReactorNettyWebSocketClient(HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                        (int) properties.getRealtime().getConnectTimeout().toMillis()));
    }
}
