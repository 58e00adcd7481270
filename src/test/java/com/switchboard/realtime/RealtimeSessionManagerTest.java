package com.switchboard.realtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.config.SwitchboardProperties;
import com.switchboard.exception.CommunicationException;
import com.switchboard.exception.ConfigurationException;
import com.switchboard.exception.RequestCanceledException;
import com.switchboard.exception.RequestValidationException;
import com.switchboard.exception.UnsupportedProviderOperationException;
import com.switchboard.model.ProviderCredentials;
import com.switchboard.realtime.translator.OpenAiRealtimeTranslator;
import com.switchboard.resilience.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RealtimeSessionManagerTest {

    private static final ProviderCredentials CREDENTIALS = ProviderCredentials.builder().apiKey("sk-rt").build();

    private final ObjectMapper mapper = new ObjectMapper();
    private ScriptedTransport transport;
    private SwitchboardProperties properties;
    private RealtimeSessionManager manager;

    /**
     * In-memory socket: records outbound frames and lets the test push inbound ones.
     */
    static final class ScriptedConnection implements RealtimeConnection {

        final List<String> sent = new CopyOnWriteArrayList<>();
        final Sinks.Many<String> inbound = Sinks.many().unicast().onBackpressureBuffer();
        final AtomicInteger closes = new AtomicInteger();
        volatile boolean failSends;

        @Override
        public Mono<Void> send(String frame) {
            return Mono.defer(() -> {
                if (failSends) {
                    return Mono.error(new CommunicationException("socket write failed"));
                }
                sent.add(frame);
                return Mono.empty();
            });
        }

        @Override
        public Flux<String> receive() {
            return inbound.asFlux();
        }

        @Override
        public Mono<Void> close() {
            return Mono.fromRunnable(() -> {
                closes.incrementAndGet();
                inbound.tryEmitComplete();
            });
        }

        @Override
        public boolean isOpen() {
            return closes.get() == 0;
        }

        void push(String frame) {
            inbound.tryEmitNext(frame);
        }
    }

    static final class ScriptedTransport implements RealtimeTransport {

        final ScriptedConnection connection = new ScriptedConnection();
        volatile URI uri;
        volatile HttpHeaders headers;
        volatile String subprotocol;
        volatile RuntimeException failure;

        @Override
        public Mono<RealtimeConnection> connect(URI uri, HttpHeaders headers, String subprotocol) {
            this.uri = uri;
            this.headers = headers;
            this.subprotocol = subprotocol;
            return failure != null ? Mono.error(failure) : Mono.just(connection);
        }
    }

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        properties = new SwitchboardProperties();
        manager = new RealtimeSessionManager(List.of(new OpenAiRealtimeTranslator(mapper)), transport, properties);
    }

    private RealtimeSession open(SessionConfig config) {
        return manager.createSession("openai", config, CREDENTIALS).block(Duration.ofSeconds(5));
    }

    @Test
    void testCreateSessionConnectsAndConfigures() throws Exception {
        RealtimeSession session = open(SessionConfig.builder().voice("alloy").build());

        assertNotNull(session);
        assertEquals(SessionState.CONNECTED, session.getState());
        assertEquals("openai", session.getProvider());
        assertTrue(manager.getSession(session.getId()).isPresent());
        assertEquals("wss://api.openai.com/v1/realtime?model=gpt-4o-realtime-preview", transport.uri.toString());
        assertEquals("Bearer sk-rt", transport.headers.getFirst(HttpHeaders.AUTHORIZATION));
        assertEquals("openai-beta.realtime-v1", transport.subprotocol);
        assertEquals(1, transport.connection.sent.size());
        assertEquals("session.update", mapper.readTree(transport.connection.sent.get(0)).path("type").asText());
    }

    @Test
    void testUnknownProvider() {
        StepVerifier.create(manager.createSession("acme", SessionConfig.builder().build(), CREDENTIALS))
                .expectError(UnsupportedProviderOperationException.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void testMissingApiKey() {
        StepVerifier.create(manager.createSession("openai", SessionConfig.builder().build(),
                        ProviderCredentials.builder().build()))
                .expectError(ConfigurationException.class)
                .verify(Duration.ofSeconds(5));
        assertNull(transport.uri);
    }

    @Test
    void testConfiguredCredentialsAreUsed() {
        SwitchboardProperties.ProviderConfig config = new SwitchboardProperties.ProviderConfig();
        config.setApiKey("sk-from-config");
        properties.getProviders().put("openai", config);

        RealtimeSession session = manager.createSession("openai", SessionConfig.builder().build())
                .block(Duration.ofSeconds(5));

        assertNotNull(session);
        assertEquals("Bearer sk-from-config", transport.headers.getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void testNoConfiguredCredentials() {
        StepVerifier.create(manager.createSession("openai", SessionConfig.builder().build()))
                .expectError(ConfigurationException.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void testConnectFailureLeavesNoSession() {
        transport.failure = new CommunicationException("handshake refused", 403, null);

        StepVerifier.create(manager.createSession("openai", SessionConfig.builder().build(), CREDENTIALS))
                .expectErrorSatisfies(error -> {
                    CommunicationException failure = assertInstanceOf(CommunicationException.class, error);
                    assertEquals("openai", failure.getProvider());
                    assertEquals("realtime", failure.getOperation());
                })
                .verify(Duration.ofSeconds(5));
        assertTrue(manager.getSessions().isEmpty());
    }

    @Test
    void testInitializationFailureClosesSocket() {
        transport.connection.failSends = true;

        StepVerifier.create(manager.createSession("openai", SessionConfig.builder().build(), CREDENTIALS))
                .expectError(CommunicationException.class)
                .verify(Duration.ofSeconds(5));
        assertEquals(1, transport.connection.closes.get());
        assertTrue(manager.getSessions().isEmpty());
    }

    @Test
    void testSendingMakesSessionActive() throws Exception {
        RealtimeSession session = open(SessionConfig.builder().build());
        RealtimeDuplexStream stream = manager.streamAudio(session, CancellationToken.NONE);

        stream.send(RealtimeMessage.AudioFrame.input(new byte[]{1, 2})).block(Duration.ofSeconds(5));

        assertEquals(SessionState.ACTIVE, session.getState());
        assertEquals("input_audio_buffer.append",
                mapper.readTree(transport.connection.sent.get(1)).path("type").asText());
    }

    @Test
    void testCompleteSendsEndOfInputAndBlocksFurtherInput() throws Exception {
        RealtimeSession session = open(SessionConfig.builder().build());
        RealtimeDuplexStream stream = manager.streamAudio(session, CancellationToken.NONE);

        stream.complete().block(Duration.ofSeconds(5));
        stream.complete().block(Duration.ofSeconds(5));

        List<String> sent = transport.connection.sent;
        assertEquals(3, sent.size());
        assertEquals("input_audio_buffer.commit", mapper.readTree(sent.get(1)).path("type").asText());
        assertEquals("response.create", mapper.readTree(sent.get(2)).path("type").asText());
        StepVerifier.create(stream.send(RealtimeMessage.AudioFrame.input(new byte[]{1})))
                .expectError(RequestValidationException.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void testReceiveTranslatesUntilSocketCloses() {
        RealtimeSession session = open(SessionConfig.builder().build());
        RealtimeDuplexStream stream = manager.streamAudio(session, CancellationToken.NONE);
        ScriptedConnection connection = transport.connection;

        StepVerifier.create(stream.receive())
                .then(() -> connection.push("{\"type\":\"response.text.delta\",\"delta\":\"Hi\"}"))
                .assertNext(message -> assertEquals(new RealtimeMessage.TextOutput("Hi", true), message))
                .then(() -> connection.push("not json"))
                .assertNext(message -> {
                    RealtimeError error = ((RealtimeMessage.ErrorMessage) message).error();
                    assertEquals("malformed_frame", error.code());
                    assertFalse(error.terminal());
                })
                .then(() -> connection.push("{\"type\":\"response.done\"}"))
                .assertNext(message -> assertEquals("status", message.kind()))
                .then(connection.inbound::tryEmitComplete)
                .verifyComplete();

        assertEquals(SessionState.CLOSED, session.getState());
        assertTrue(manager.getSession(session.getId()).isEmpty());
    }

    @Test
    void testDroppedSocketClosesSession() {
        RealtimeSession session = open(SessionConfig.builder().build());
        RealtimeDuplexStream stream = manager.streamAudio(session, CancellationToken.NONE);
        ScriptedConnection connection = transport.connection;

        StepVerifier.create(stream.receive())
                .then(() -> connection.push("{\"type\":\"response.text.delta\",\"delta\":\"Hi\"}"))
                .expectNextCount(1)
                .then(() -> connection.inbound.tryEmitError(new CommunicationException("connection reset")))
                .expectErrorSatisfies(error -> {
                    CommunicationException failure = assertInstanceOf(CommunicationException.class, error);
                    assertEquals("openai", failure.getProvider());
                })
                .verify(Duration.ofSeconds(5));

        assertEquals(SessionState.CLOSED, session.getState());
        assertEquals(1, connection.closes.get());
        assertTrue(manager.getSession(session.getId()).isEmpty());
    }

    @Test
    void testTerminalErrorEndsStreamAndClosesSession() {
        RealtimeSession session = open(SessionConfig.builder().build());
        RealtimeDuplexStream stream = manager.streamAudio(session, CancellationToken.NONE);
        ScriptedConnection connection = transport.connection;

        StepVerifier.create(stream.receive())
                .then(() -> connection.push("{\"type\":\"error\",\"error\":{\"type\":\"server_error\","
                        + "\"message\":\"transient\"}}"))
                .assertNext(message -> assertFalse(((RealtimeMessage.ErrorMessage) message).error().terminal()))
                .then(() -> connection.push("{\"type\":\"error\",\"error\":{\"code\":\"insufficient_quota\","
                        + "\"message\":\"quota\"}}"))
                .assertNext(message -> assertTrue(((RealtimeMessage.ErrorMessage) message).error().terminal()))
                .verifyComplete();

        assertEquals(SessionState.CLOSED, session.getState());
        assertEquals(1, connection.closes.get());
    }

    @Test
    void testCancellationClosesSession() {
        RealtimeSession session = open(SessionConfig.builder().build());
        CancellationToken token = CancellationToken.create();
        RealtimeDuplexStream stream = manager.streamAudio(session, token);

        StepVerifier.create(stream.receive())
                .then(token::cancel)
                .expectError(RequestCanceledException.class)
                .verify(Duration.ofSeconds(5));

        assertEquals(SessionState.CLOSED, session.getState());
        assertEquals(1, transport.connection.closes.get());
    }

    @Test
    void testCloseIsIdempotent() {
        RealtimeSession session = open(SessionConfig.builder().build());

        manager.closeSession(session).block(Duration.ofSeconds(5));
        manager.closeSession(session).block(Duration.ofSeconds(5));

        assertEquals(SessionState.CLOSED, session.getState());
        assertEquals(1, transport.connection.closes.get());
        StepVerifier.create(manager.updateSession(session, SessionConfig.builder().build()))
                .expectError(CommunicationException.class)
                .verify(Duration.ofSeconds(5));
        StepVerifier.create(manager.streamAudio(session, CancellationToken.NONE)
                        .send(RealtimeMessage.AudioFrame.input(new byte[]{1})))
                .expectError(CommunicationException.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void testUpdateSessionSendsFrameAndKeepsConfig() throws Exception {
        RealtimeSession session = open(SessionConfig.builder().build());
        SessionConfig updated = SessionConfig.builder().voice("verse").build();

        manager.updateSession(session, updated).block(Duration.ofSeconds(5));

        assertSame(updated, session.getConfig());
        assertEquals("verse", mapper.readTree(transport.connection.sent.get(1)).path("session").path("voice").asText());
    }

    @Test
    void testStateOrdering() {
        assertTrue(SessionState.CONNECTED.canSend());
        assertTrue(SessionState.ACTIVE.canSend());
        assertFalse(SessionState.CONNECTING.canSend());
        assertFalse(SessionState.CLOSING.canSend());
        assertFalse(SessionState.CLOSED.canSend());
    }
}
