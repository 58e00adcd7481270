package com.switchboard.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Message content: either plain text or an ordered list of typed blocks (text, image).
 * On the wire this is a JSON string or a JSON array.
 */
@JsonSerialize(using = MessageContent.Serializer.class)
@JsonDeserialize(using = MessageContent.Deserializer.class)
public sealed interface MessageContent permits MessageContent.Text, MessageContent.Blocks {

    static MessageContent text(String text) {
        return new Text(text);
    }

    static MessageContent blocks(List<ContentBlock> blocks) {
        return new Blocks(List.copyOf(blocks));
    }

    /**
     * Concatenated text, ignoring non-text blocks.
     */
    String asText();

    boolean hasImages();

    record Text(String text) implements MessageContent {

        @Override
        public String asText() {
            return text != null ? text : "";
        }

        @Override
        public boolean hasImages() {
            return false;
        }
    }

    record Blocks(List<ContentBlock> blocks) implements MessageContent {

        @Override
        public String asText() {
            return blocks.stream()
                    .filter(ContentBlock::isText)
                    .map(ContentBlock::getText)
                    .collect(Collectors.joining());
        }

        @Override
        public boolean hasImages() {
            return blocks.stream().anyMatch(ContentBlock::isImage);
        }
    }

    class Serializer extends JsonSerializer<MessageContent> {

        @Override
        public void serialize(MessageContent value, JsonGenerator gen, SerializerProvider serializers)
                throws IOException {
            if (value instanceof Text text) {
                gen.writeString(text.text());
            } else if (value instanceof Blocks blocks) {
                serializers.defaultSerializeValue(blocks.blocks(), gen);
            }
        }
    }

    class Deserializer extends JsonDeserializer<MessageContent> {

        @Override
        public MessageContent deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            JsonToken token = parser.currentToken();
            if (token == JsonToken.VALUE_STRING) {
                return new Text(parser.getText());
            }
            if (token == JsonToken.START_ARRAY) {
                ContentBlock[] blocks = context.readValue(parser, ContentBlock[].class);
                return new Blocks(Arrays.asList(blocks));
            }
            return (MessageContent) context.handleUnexpectedToken(MessageContent.class, parser);
        }
    }
}
