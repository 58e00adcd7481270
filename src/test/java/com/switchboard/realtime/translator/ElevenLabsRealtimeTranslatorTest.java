package com.switchboard.realtime.translator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.model.ProviderCredentials;
import com.switchboard.realtime.ErrorSeverity;
import com.switchboard.realtime.RealtimeError;
import com.switchboard.realtime.RealtimeMessage;
import com.switchboard.realtime.SessionConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ElevenLabsRealtimeTranslatorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private ElevenLabsRealtimeTranslator translator;

    @BeforeEach
    void setUp() {
        translator = new ElevenLabsRealtimeTranslator(mapper);
    }

    @Test
    void testConnectionDetails() {
        ProviderCredentials credentials = ProviderCredentials.builder().apiKey("xi").build();

        assertEquals("wss://api.elevenlabs.io/v1/convai/conversation?agent_id=agent-7",
                translator.endpoint(SessionConfig.builder().model("agent-7").build(), credentials).toString());
        assertEquals("xi", translator.headers(credentials).getFirst("xi-api-key"));
        assertNull(translator.subprotocol());
    }

    @Test
    void testInitializationConfiguresThenStarts() throws Exception {
        List<String> init = translator.initializationMessages(SessionConfig.builder().voice("rachel").build());

        assertEquals(2, init.size());
        JsonNode config = mapper.readTree(init.get(0));
        assertEquals("conversation_config", config.path("type").asText());
        assertEquals("rachel", config.path("config").path("voice_id").asText());
        assertEquals("en", config.path("config").path("language").asText());
        assertFalse(config.path("config").path("interruption_config").path("enabled").asBoolean());
        assertEquals("conversation_start", mapper.readTree(init.get(1)).path("type").asText());
    }

    @Test
    void testAudioInputIsSixteenKilohertz() throws Exception {
        JsonNode frame = mapper.readTree(translator.toProviderWire(RealtimeMessage.AudioFrame.input(new byte[]{1, 2})));

        assertEquals("audio_input", frame.path("type").asText());
        assertEquals(16000, frame.path("audio").path("sample_rate").asInt());
    }

    @Test
    void testTurnCompleteReportsSynthesisUsage() throws Exception {
        List<RealtimeMessage> messages = translator.fromProviderWire(
                "{\"type\":\"turn_complete\",\"metrics\":{\"characters_synthesized\":120,\"duration_ms\":900}}");

        assertEquals(2, messages.size());
        RealtimeMessage.StatusMessage usage = (RealtimeMessage.StatusMessage) messages.get(1);
        assertEquals("usage_update", usage.status());
        JsonNode detail = mapper.readTree(usage.detail());
        assertEquals(120, detail.path("characters").asInt());
        assertEquals(900, detail.path("duration_ms").asInt());

        assertEquals(1, translator.fromProviderWire("{\"type\":\"turn_complete\"}").size());
    }

    @Test
    void testInboundMessages() {
        assertEquals("session_started", ((RealtimeMessage.StatusMessage) translator.fromProviderWire(
                "{\"type\":\"conversation_started\"}").get(0)).status());
        assertEquals("interrupted", ((RealtimeMessage.StatusMessage) translator.fromProviderWire(
                "{\"type\":\"interruption\"}").get(0)).status());
        assertTrue(((RealtimeMessage.TextOutput) translator.fromProviderWire(
                "{\"type\":\"text_output\",\"text\":\"Hi\",\"is_partial\":true}").get(0)).partial());

        RealtimeMessage.FunctionCall call = (RealtimeMessage.FunctionCall) translator.fromProviderWire(
                "{\"type\":\"tool_call\",\"tool_call_id\":\"t1\",\"tool_name\":\"weather\","
                        + "\"arguments\":\"{}\"}").get(0);
        assertEquals("weather", call.name());
    }

    @Test
    void testQuotaErrorsEndTheSession() {
        RealtimeError error = ((RealtimeMessage.ErrorMessage) translator.fromProviderWire(
                "{\"type\":\"error\",\"error\":{\"code\":\"quota_exceeded\",\"message\":\"Out of credits\"}}")
                .get(0)).error();

        assertTrue(error.terminal());
        assertEquals("Out of credits", error.message());
        assertEquals(ErrorSeverity.CRITICAL, translator.classifyError("authentication_error", null).severity());
        assertEquals(ErrorSeverity.WARNING, translator.classifyError("rate_limit_exceeded", null).severity());
    }
}
