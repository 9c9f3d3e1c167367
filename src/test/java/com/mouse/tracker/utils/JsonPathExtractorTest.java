package com.mouse.tracker.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class JsonPathExtractorTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void extractsNestedValue() {
        Optional<JsonNode> result = JsonPathExtractor.extract(mapper, "{\"data\":{\"item\":{\"models\":[1,2]}}}", "data.item.models");

        assertThat(result).isPresent();
        assertThat(result.get().isArray()).isTrue();
        assertThat(result.get().toString()).isEqualTo("[1,2]");
    }

    @Test
    void missingSegmentIsAMiss() {
        assertThat(JsonPathExtractor.extract(mapper, "{\"data\":{}}", "data.item.models")).isEmpty();
    }

    @Test
    void nullAtEndOfPathIsAMiss() {
        assertThat(JsonPathExtractor.extract(mapper, "{\"data\":{\"item\":{\"models\":null}}}", "data.item.models")).isEmpty();
    }

    @Test
    void arraysAreNotTraversed() {
        assertThat(JsonPathExtractor.extract(mapper, "{\"data\":[{\"item\":1}]}", "data.item")).isEmpty();
    }

    @Test
    void blankPathNeverSucceeds() {
        assertThat(JsonPathExtractor.extract(mapper, "{\"a\":1}", "")).isEmpty();
        assertThat(JsonPathExtractor.extract(mapper, "{\"a\":1}", "  ")).isEmpty();
        assertThat(JsonPathExtractor.extract(mapper, "{\"a\":1}", null)).isEmpty();
    }

    @Test
    void nonJsonBodyIsAMiss() {
        assertThat(JsonPathExtractor.extract(mapper, "<html>nope</html>", "data")).isEmpty();
        assertThat(JsonPathExtractor.extract(mapper, null, "data")).isEmpty();
    }

    @Test
    void scalarAndFalseValuesAreValidPayloads() throws Exception {
        JsonNode root = mapper.readTree("{\"data\":{\"count\":0,\"ok\":false}}");
        assertThat(JsonPathExtractor.extract(root, "data.count")).map(JsonNode::asInt).contains(0);
        assertThat(JsonPathExtractor.extract(root, "data.ok")).map(JsonNode::asBoolean).contains(false);
    }
}
