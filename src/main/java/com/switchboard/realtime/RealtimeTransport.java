package com.switchboard.realtime;

import org.springframework.http.HttpHeaders;
import reactor.core.publisher.Mono;

import java.net.URI;

public interface RealtimeTransport {

    Mono<RealtimeConnection> connect(URI uri, HttpHeaders headers, String subprotocol);
}
