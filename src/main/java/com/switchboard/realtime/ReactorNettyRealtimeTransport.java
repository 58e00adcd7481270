package com.switchboard.realtime;

import com.switchboard.config.SwitchboardProperties;
import com.switchboard.exception.CommunicationException;
import com.switchboard.exception.OperationTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * WebSocket transport on Reactor Netty. The session handler runs for the lifetime of the socket;
 * sinks bridge it to the pull-style {@link RealtimeConnection}.
 */
@Slf4j
@Component
public class ReactorNettyRealtimeTransport implements RealtimeTransport {

    private final WebSocketClient client;
    private final Duration connectTimeout;

    @Autowired
    public ReactorNettyRealtimeTransport(WebSocketClient realtimeWebSocketClient, SwitchboardProperties properties) {
        this(realtimeWebSocketClient, properties.getRealtime().getConnectTimeout());
    }

    public ReactorNettyRealtimeTransport(WebSocketClient client, Duration connectTimeout) {
        this.client = client;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public Mono<RealtimeConnection> connect(URI uri, HttpHeaders headers, String subprotocol) {
        return Mono.defer(() -> {
            NettyConnection connection = new NettyConnection();
            WebSocketHandler handler = new WebSocketHandler() {
                @Override
                public List<String> getSubProtocols() {
                    return subprotocol != null ? List.of(subprotocol) : List.of();
                }

                @Override
                public Mono<Void> handle(WebSocketSession session) {
                    return connection.attach(session);
                }
            };

            Disposable socket = client.execute(uri, headers, handler)
                    .subscribe(null, error -> connection.fail(error, uri), connection::closed);

            return connection.opened.asMono()
                    .timeout(connectTimeout)
                    .doOnError(e -> socket.dispose())
                    .doOnCancel(socket::dispose)
                    .onErrorMap(TimeoutException.class, e -> new OperationTimeoutException(
                            "WebSocket connect to " + uri.getHost() + " timed out after " + connectTimeout, e))
                    .thenReturn((RealtimeConnection) connection)
                    .doOnNext(ignored -> log.debug("WebSocket open: {}", uri.getHost()));
        });
    }

    static final class NettyConnection implements RealtimeConnection {

        private final Sinks.Empty<Void> opened = Sinks.empty();
        private final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
        private final Sinks.Many<String> inbound = Sinks.many().unicast().onBackpressureBuffer();
        private volatile WebSocketSession session;

        Mono<Void> attach(WebSocketSession session) {
            this.session = session;
            Mono<Void> send = session.send(outbound.asFlux().map(session::textMessage));
            Mono<Void> receive = session.receive()
                    .map(WebSocketMessage::getPayloadAsText)
                    .doOnNext(inbound::tryEmitNext)
                    .doOnComplete(this::remoteClosed)
                    .then();
            opened.tryEmitEmpty();
            return Mono.when(send, receive);
        }

        /**
         * The provider closed the socket. Ending the outbound side lets the handler complete normally.
         */
        private void remoteClosed() {
            inbound.tryEmitComplete();
            synchronized (outbound) {
                outbound.tryEmitComplete();
            }
        }

        void fail(Throwable error, URI uri) {
            CommunicationException failure = new CommunicationException(
                    "WebSocket failure on " + uri.getHost() + ": " + error.getMessage(), error);
            opened.tryEmitError(failure);
            inbound.tryEmitError(failure);
        }

        void closed() {
            opened.tryEmitEmpty();
            inbound.tryEmitComplete();
        }

        @Override
        public Mono<Void> send(String frame) {
            return Mono.fromRunnable(() -> {
                Sinks.EmitResult result;
                synchronized (outbound) {
                    result = outbound.tryEmitNext(frame);
                }
                if (result.isFailure()) {
                    throw new CommunicationException("WebSocket is not writable: " + result);
                }
            });
        }

        @Override
        public Flux<String> receive() {
            return inbound.asFlux();
        }

        @Override
        public Mono<Void> close() {
            return Mono.defer(() -> {
                synchronized (outbound) {
                    outbound.tryEmitComplete();
                }
                WebSocketSession current = session;
                return current != null ? current.close() : Mono.empty();
            });
        }

        @Override
        public boolean isOpen() {
            WebSocketSession current = session;
            return current != null && current.isOpen();
        }
    }
}
