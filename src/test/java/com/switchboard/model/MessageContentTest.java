package com.switchboard.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.config.JacksonConfiguration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageContentTest {

    private final ObjectMapper mapper = JacksonConfiguration.configure(new ObjectMapper());

    @Test
    void testStringContent() throws Exception {
        Message message = mapper.readValue("{\"role\":\"user\",\"content\":\"hello\"}", Message.class);

        assertInstanceOf(MessageContent.Text.class, message.getContent());
        assertEquals("hello", message.getText());
        assertFalse(message.getContent().hasImages());
        assertEquals("{\"role\":\"user\",\"content\":\"hello\"}", mapper.writeValueAsString(message));
    }

    @Test
    void testBlockContent() throws Exception {
        Message message = mapper.readValue("{\"role\":\"user\",\"content\":["
                + "{\"type\":\"text\",\"text\":\"What is \"},"
                + "{\"type\":\"image_url\",\"image_url\":{\"url\":\"https://example.com/cat.png\"}},"
                + "{\"type\":\"text\",\"text\":\"this?\"}]}", Message.class);

        assertInstanceOf(MessageContent.Blocks.class, message.getContent());
        assertEquals("What is this?", message.getText());
        assertTrue(message.getContent().hasImages());
        assertTrue(mapper.writeValueAsString(message).contains("\"image_url\":{\"url\":\"https://example.com/cat.png\"}"));
    }

    @Test
    void testMissingContentReadsAsEmpty() {
        Message message = Message.builder().role(Message.ROLE_ASSISTANT).build();

        assertEquals("", message.getText());
        assertEquals("", MessageContent.text(null).asText());
        assertEquals("ab", MessageContent.blocks(List.of(ContentBlock.text("a"), ContentBlock.text("b"))).asText());
    }
}
