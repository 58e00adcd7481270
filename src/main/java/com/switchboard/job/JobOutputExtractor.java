package com.switchboard.job;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Reads job output that may be a string, a list of fragments or a structured document.
 */
public final class JobOutputExtractor {

    private JobOutputExtractor() {
    }

    /**
     * All text in encounter order, concatenated. Missing output yields an empty string.
     */
    public static String extractText(JsonNode output) {
        StringBuilder text = new StringBuilder();
        collectText(output, text);
        return text.toString();
    }

    /**
     * Every string found in the output, in encounter order. Used for image and file URLs.
     */
    public static List<String> extractStrings(JsonNode output) {
        List<String> values = new ArrayList<>();
        collectStrings(output, values);
        return values;
    }

    private static void collectText(JsonNode node, StringBuilder text) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return;
        }
        if (node.isTextual()) {
            text.append(node.asText());
        } else if (node.isArray()) {
            node.forEach(element -> collectText(element, text));
        } else if (node.isObject()) {
            JsonNode preferred = node.has("text") ? node.get("text") : node.get("output");
            if (preferred != null) {
                collectText(preferred, text);
                return;
            }
            Iterator<JsonNode> values = node.elements();
            while (values.hasNext()) {
                collectText(values.next(), text);
            }
        }
    }

    private static void collectStrings(JsonNode node, List<String> values) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return;
        }
        if (node.isTextual()) {
            values.add(node.asText());
        } else if (node.isContainerNode()) {
            node.forEach(element -> collectStrings(element, values));
        }
    }
}
