package com.switchboard.realtime;

/**
 * Closed set of messages exchanged with a realtime session, independent of the provider wire format.
 */
public sealed interface RealtimeMessage {

    String kind();

    /**
     * Raw audio. {@code output} is true for audio produced by the provider.
     */
    record AudioFrame(byte[] data, int sampleRate, int channels, boolean output) implements RealtimeMessage {

        public static AudioFrame input(byte[] data) {
            return new AudioFrame(data, 24000, 1, false);
        }

        @Override
        public String kind() {
            return "audio";
        }
    }

    record TextInput(String text) implements RealtimeMessage {
        @Override
        public String kind() {
            return "text_input";
        }
    }

    /**
     * Text or transcript produced by the provider. {@code partial} marks an incremental delta.
     */
    record TextOutput(String text, boolean partial) implements RealtimeMessage {
        @Override
        public String kind() {
            return "text_output";
        }
    }

    record FunctionCall(String callId, String name, String arguments) implements RealtimeMessage {
        @Override
        public String kind() {
            return "function_call";
        }
    }

    record FunctionResponse(String callId, String output) implements RealtimeMessage {
        @Override
        public String kind() {
            return "function_response";
        }
    }

    /**
     * Asks the provider to generate a response now. Both fields are optional.
     */
    record ResponseRequest(String instructions, Double temperature) implements RealtimeMessage {

        public static ResponseRequest now() {
            return new ResponseRequest(null, null);
        }

        @Override
        public String kind() {
            return "response_request";
        }
    }

    record StatusMessage(String status, String detail) implements RealtimeMessage {
        @Override
        public String kind() {
            return "status";
        }
    }

    record ErrorMessage(RealtimeError error) implements RealtimeMessage {
        @Override
        public String kind() {
            return "error";
        }
    }
}
