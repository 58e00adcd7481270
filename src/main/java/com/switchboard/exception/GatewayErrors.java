package com.switchboard.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.springframework.core.codec.CodecException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

/**
 * Normalizes raw transport, codec and SDK failures into the gateway taxonomy.
 */
public final class GatewayErrors {

    private static final int MAX_BODY_IN_MESSAGE = 500;

    private GatewayErrors() {
    }

    /**
     * Map any throwable to a {@link GatewayException} tagged with provider and operation.
     * Gateway exceptions keep their kind; everything else becomes a communication error.
     */
    public static GatewayException wrap(Throwable error, String provider, String operation) {
        return classify(error).tagged(provider, operation);
    }

    public static GatewayException classify(Throwable error) {
        if (error instanceof GatewayException gatewayException) {
            return gatewayException;
        }

        if (error instanceof WebClientResponseException responseException) {
            return new CommunicationException(
                    "Upstream returned " + responseException.getStatusCode().value() + ": "
                            + truncate(responseException.getResponseBodyAsString()),
                    responseException.getStatusCode().value(),
                    responseException);
        }

        if (error instanceof WebClientRequestException || error instanceof IOException) {
            return new CommunicationException("Transport failure: " + error.getMessage(), error);
        }

        if (error instanceof TimeoutException) {
            return new CommunicationException("Upstream did not respond in time", error);
        }

        if (error instanceof CodecException || error instanceof JsonProcessingException) {
            return CommunicationException.malformedResponse("Malformed upstream response: " + error.getMessage(), error);
        }

        if (error instanceof CancellationException) {
            return new RequestCanceledException("Operation was canceled", error);
        }

        // async SDK clients wrap the real failure
        if (error instanceof CompletionException && error.getCause() != null) {
            return classify(error.getCause());
        }

        return new CommunicationException("Unexpected upstream failure: " + error.getMessage(), error);
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_BODY_IN_MESSAGE ? body.substring(0, MAX_BODY_IN_MESSAGE) + "..." : body;
    }
}
