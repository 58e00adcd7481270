package com.switchboard.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobOutputExtractorTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testTokenArrayIsConcatenated() throws Exception {
        JsonNode output = mapper.readTree("[\"Hel\", \"lo\", \" world\"]");

        assertEquals("Hello world", JobOutputExtractor.extractText(output));
    }

    @Test
    void testObjectPrefersTextField() throws Exception {
        assertEquals("answer", JobOutputExtractor.extractText(mapper.readTree("{\"meta\":1,\"text\":\"answer\"}")));
        assertEquals("out", JobOutputExtractor.extractText(mapper.readTree("{\"output\":[\"o\",\"ut\"]}")));
    }

    @Test
    void testNullOutputIsEmpty() {
        assertEquals("", JobOutputExtractor.extractText(null));
    }

    @Test
    void testStringsFromImageOutput() throws Exception {
        JsonNode output = mapper.readTree("[\"https://cdn/a.png\", \"https://cdn/b.png\"]");

        assertEquals(List.of("https://cdn/a.png", "https://cdn/b.png"), JobOutputExtractor.extractStrings(output));
    }

    @Test
    void testWireStatusMapping() {
        assertEquals(JobStatus.STARTING, JobStatus.fromWire("queued"));
        assertEquals(JobStatus.SUCCEEDED, JobStatus.fromWire("succeeded"));
        assertEquals(JobStatus.FAILED, JobStatus.fromWire("error"));
        assertEquals(JobStatus.CANCELED, JobStatus.fromWire("cancelled"));
        assertEquals(JobStatus.PROCESSING, JobStatus.fromWire("processing"));
        assertEquals(JobStatus.PROCESSING, JobStatus.fromWire(null));
        assertTrue(JobStatus.CANCELED.isTerminal());
        assertFalse(JobStatus.STARTING.isTerminal());
    }
}
