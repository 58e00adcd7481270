package com.switchboard.realtime.translator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.model.ProviderCredentials;
import com.switchboard.realtime.ErrorSeverity;
import com.switchboard.realtime.RealtimeError;
import com.switchboard.realtime.RealtimeMessage;
import com.switchboard.realtime.SessionConfig;
import com.switchboard.realtime.TurnDetectionConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UltravoxRealtimeTranslatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private UltravoxRealtimeTranslator translator;

    @BeforeEach
    void setUp() {
        translator = new UltravoxRealtimeTranslator(mapper);
    }

    @Test
    void testConnectionDetails() {
        ProviderCredentials credentials = ProviderCredentials.builder().apiKey("uv").build();

        assertEquals("wss://api.ultravox.ai/v1/realtime?model=ultravox-v2",
                translator.endpoint(SessionConfig.builder().build(), credentials).toString());
        assertEquals("1.0", translator.headers(credentials).getFirst("X-Ultravox-Version"));
        assertEquals("ultravox.v1", translator.subprotocol());
    }

    @Test
    void testSessionConfigFrame() throws Exception {
        SessionConfig config = SessionConfig.builder()
                .instructions("You are a receptionist.")
                .turnDetection(TurnDetectionConfig.builder().threshold(0.4).build())
                .build();

        List<String> init = translator.initializationMessages(config);

        assertEquals(1, init.size());
        JsonNode frame = mapper.readTree(init.get(0));
        assertEquals("session_config", frame.path("type").asText());
        JsonNode data = frame.path("data");
        assertEquals("You are a receptionist.", data.path("systemPrompt").asText());
        assertEquals(24000, data.path("audioConfig").path("sampleRate").asInt());
        assertTrue(data.path("turnDetection").path("enabled").asBoolean());
        assertEquals("nova", data.path("responseConfig").path("voice").asText());
    }

    @Test
    void testEndOfInputDependsOnVad() throws Exception {
        assertTrue(translator.endOfInput(SessionConfig.builder().turnDetection(TurnDetectionConfig.serverVad())
                .build()).isEmpty());
        List<String> explicit = translator.endOfInput(SessionConfig.builder().build());
        assertEquals("generate", mapper.readTree(explicit.get(0)).path("type").asText());
    }

    @Test
    void testOutboundAudioAndFunctionResult() throws Exception {
        JsonNode audio = mapper.readTree(translator.toProviderWire(RealtimeMessage.AudioFrame.input(new byte[]{1})));
        assertEquals("audio", audio.path("type").asText());
        assertEquals(24000, audio.path("data").path("sampleRate").asInt());

        JsonNode result = mapper.readTree(translator.toProviderWire(
                new RealtimeMessage.FunctionResponse("fc_1", "42")));
        assertEquals("function_result", result.path("type").asText());
        assertEquals("fc_1", result.path("data").path("callId").asText());
    }

    @Test
    void testInboundMessages() {
        String audio = Base64.getEncoder().encodeToString(new byte[]{5});
        RealtimeMessage.AudioFrame frame = (RealtimeMessage.AudioFrame) translator.fromProviderWire(
                "{\"type\":\"audio_chunk\",\"data\":{\"audio\":\"" + audio + "\",\"sampleRate\":16000}}").get(0);
        assertEquals(16000, frame.sampleRate());

        RealtimeMessage.TextOutput last = (RealtimeMessage.TextOutput) translator.fromProviderWire(
                "{\"type\":\"text_chunk\",\"data\":{\"text\":\"Bye\",\"final\":true}}").get(0);
        assertFalse(last.partial());

        RealtimeMessage.FunctionCall call = (RealtimeMessage.FunctionCall) translator.fromProviderWire(
                "{\"type\":\"function_call\",\"data\":{\"callId\":\"f1\",\"name\":\"book\","
                        + "\"arguments\":{\"day\":\"mon\"}}}").get(0);
        assertEquals("{\"day\":\"mon\"}", call.arguments());

        assertEquals(2, translator.fromProviderWire(
                "{\"type\":\"generation_complete\",\"usage\":{\"tokens\":3}}").size());
        assertTrue(translator.fromProviderWire("{\"type\":\"heartbeat\"}").isEmpty());
    }

    @Test
    void testAuthenticationFailureIsCriticalAndTerminal() {
        RealtimeError error = ((RealtimeMessage.ErrorMessage) translator.fromProviderWire(
                "{\"type\":\"error\",\"data\":{\"code\":\"authentication_failed\",\"message\":\"bad key\"}}")
                .get(0)).error();

        assertEquals(ErrorSeverity.CRITICAL, error.severity());
        assertTrue(error.terminal());
        assertEquals(ErrorSeverity.WARNING, translator.classifyError("rate_limit", null).severity());
    }
}
