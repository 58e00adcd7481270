package com.switchboard.realtime;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * An open text-frame WebSocket.
 */
public interface RealtimeConnection {

    Mono<Void> send(String frame);

    /**
     * Inbound frames; completes when the socket closes.
     */
    Flux<String> receive();

    Mono<Void> close();

    boolean isOpen();
}
