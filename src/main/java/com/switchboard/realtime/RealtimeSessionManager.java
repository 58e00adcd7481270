package com.switchboard.realtime;

import com.switchboard.config.SwitchboardProperties;
import com.switchboard.exception.CommunicationException;
import com.switchboard.exception.ConfigurationException;
import com.switchboard.exception.GatewayErrors;
import com.switchboard.exception.UnsupportedProviderOperationException;
import com.switchboard.model.ProviderCredentials;
import com.switchboard.resilience.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Opens, reconfigures and closes realtime sessions and hands out their duplex streams.
 */
@Slf4j
@Service
public class RealtimeSessionManager {

    static final String OPERATION = "realtime";

    private final Map<String, RealtimeTranslator> translators;
    private final RealtimeTransport transport;
    private final SwitchboardProperties properties;
    private final Map<String, RealtimeSession> sessions = new ConcurrentHashMap<>();

    public RealtimeSessionManager(List<RealtimeTranslator> translators, RealtimeTransport transport,
                                  SwitchboardProperties properties) {
        this.translators = translators.stream()
                .collect(Collectors.toUnmodifiableMap(RealtimeTranslator::getProvider, Function.identity()));
        this.transport = transport;
        this.properties = properties;
    }

    public Set<String> getProviders() {
        return translators.keySet();
    }

    public Optional<RealtimeSession> getSession(String id) {
        return Optional.ofNullable(sessions.get(id));
    }

    public Collection<RealtimeSession> getSessions() {
        return sessions.values();
    }

    /**
     * Connect with the credentials configured under {@code switchboard.providers.<provider>}.
     */
    public Mono<RealtimeSession> createSession(String provider, SessionConfig config) {
        return Mono.defer(() -> {
            SwitchboardProperties.ProviderConfig providerConfig = properties.getProviders().get(provider);
            if (providerConfig == null) {
                return Mono.error(new ConfigurationException(
                        "No credentials configured for realtime provider " + provider, provider, OPERATION, null));
            }
            return createSession(provider, config, ProviderCredentials.from(providerConfig));
        });
    }

    public Mono<RealtimeSession> createSession(String provider, SessionConfig config, ProviderCredentials credentials) {
        return Mono.defer(() -> {
            RealtimeTranslator translator = translators.get(provider);
            if (translator == null) {
                return Mono.error(new UnsupportedProviderOperationException(
                        "Provider " + provider + " has no realtime support", provider, OPERATION, null));
            }
            if (credentials == null || !credentials.hasApiKey()) {
                return Mono.error(new ConfigurationException(
                        "API key is required for realtime provider " + provider, provider, OPERATION, null));
            }

            RealtimeSession session = new RealtimeSession(UUID.randomUUID().toString(), provider, config, translator);
            log.info("Opening realtime session {} to {}: model={}", session.getId(), provider, config.getModel());

            return transport.connect(translator.endpoint(config, credentials), translator.headers(credentials),
                            translator.subprotocol())
                    .flatMap(connection -> {
                        session.attach(connection);
                        return sendAll(connection, translator.initializationMessages(config))
                                .onErrorResume(error -> connection.close()
                                        .onErrorResume(closeError -> Mono.empty())
                                        .then(Mono.error(error)));
                    })
                    .then(Mono.fromCallable(() -> {
                        session.transition(SessionState.CONNECTING, SessionState.CONNECTED);
                        sessions.put(session.getId(), session);
                        log.info("Realtime session {} connected", session.getId());
                        return session;
                    }))
                    .doOnError(error -> {
                        session.advanceTo(SessionState.CLOSED);
                        log.error("Realtime session {} to {} failed to open: {}", session.getId(), provider,
                                error.getMessage());
                    })
                    .onErrorMap(error -> GatewayErrors.wrap(error, provider, OPERATION));
        });
    }

    public Mono<Void> updateSession(RealtimeSession session, SessionConfig config) {
        return Mono.defer(() -> {
            if (!session.getState().canSend()) {
                return Mono.error(notOpen(session));
            }
            String frame = session.getTranslator().sessionUpdate(config);
            return session.getConnection().send(frame)
                    .doOnSuccess(ignored -> {
                        session.updateConfig(config);
                        log.debug("Realtime session {} reconfigured", session.getId());
                    });
        }).onErrorMap(error -> GatewayErrors.wrap(error, session.getProvider(), OPERATION));
    }

    /**
     * Idempotent. A failure to close the socket is logged, never raised: the session ends up CLOSED either way.
     */
    public Mono<Void> closeSession(RealtimeSession session) {
        return Mono.defer(() -> {
            SessionState previous = session.advanceTo(SessionState.CLOSING);
            if (previous == SessionState.CLOSING || previous == SessionState.CLOSED) {
                return Mono.empty();
            }
            RealtimeConnection connection = session.getConnection();
            Mono<Void> close = connection != null ? connection.close() : Mono.empty();
            return close
                    .doOnError(error -> log.warn("Error closing realtime session {}: {}", session.getId(),
                            error.getMessage()))
                    .onErrorResume(error -> Mono.empty())
                    .doFinally(signal -> {
                        session.advanceTo(SessionState.CLOSED);
                        sessions.remove(session.getId());
                        log.info("Realtime session {} closed", session.getId());
                    });
        });
    }

    /**
     * Duplex audio stream over an open session. Receiving stops when the token fires.
     */
    public RealtimeDuplexStream streamAudio(RealtimeSession session, CancellationToken cancellation) {
        if (session.getState() == SessionState.CONNECTING || session.getConnection() == null) {
            throw notOpen(session);
        }
        return new RealtimeDuplexStream(session, this, cancellation);
    }

    static CommunicationException notOpen(RealtimeSession session) {
        return new CommunicationException("Realtime session " + session.getId() + " is " + session.getState(),
                null, session.getProvider(), OPERATION, null);
    }

    private static Mono<Void> sendAll(RealtimeConnection connection, List<String> frames) {
        return Flux.fromIterable(frames).concatMap(connection::send).then();
    }
}
