package com.switchboard.realtime;

import com.switchboard.model.ProviderCredentials;
import org.springframework.http.HttpHeaders;

import java.net.URI;
import java.util.List;

/**
 * Converts between unified realtime messages and one provider's WebSocket frames.
 */
public interface RealtimeTranslator {

    String getProvider();

    URI endpoint(SessionConfig config, ProviderCredentials credentials);

    HttpHeaders headers(ProviderCredentials credentials);

    /**
     * WebSocket subprotocol to negotiate, or {@code null}.
     */
    String subprotocol();

    /**
     * Frames sent right after the socket opens, in order.
     */
    List<String> initializationMessages(SessionConfig config);

    /**
     * Frame that reconfigures a live session.
     */
    String sessionUpdate(SessionConfig config);

    /**
     * Frames that tell the provider no more input audio is coming. May be empty.
     */
    List<String> endOfInput(SessionConfig config);

    /**
     * @throws com.switchboard.exception.RequestValidationException for messages the provider cannot receive
     */
    String toProviderWire(RealtimeMessage message);

    /**
     * One provider frame to zero or more unified messages. Unknown frame types yield an empty list.
     *
     * @throws com.switchboard.exception.CommunicationException when the frame is not valid JSON
     */
    List<RealtimeMessage> fromProviderWire(String frame);

    RealtimeError classifyError(String code, String message);
}
