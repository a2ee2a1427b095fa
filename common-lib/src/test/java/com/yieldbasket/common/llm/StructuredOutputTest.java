package com.yieldbasket.common.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yieldbasket.common.exception.MalformedModelOutputException;
import com.yieldbasket.common.model.Signal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class StructuredOutputTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("fenced JSON is accepted and fields are typed")
    void fencedJson() {
        JsonNode node = StructuredOutput.parseObject(mapper,
            "```json\n{\"signal\":\"bullish\",\"confidence\":0.7,\"evidence\":[\"a\",\"b\"],"
                + "\"weights\":{\"SOL\":0.6,\"USDC\":0.4}}\n```");

        assertEquals(Signal.BULLISH, StructuredOutput.requireEnum(node, "signal", Signal.class));
        assertEquals(0.7, StructuredOutput.requireUnitInterval(node, "confidence"));
        assertEquals(List.of("a", "b"), StructuredOutput.requireTextList(node, "evidence"));
        assertEquals(Map.of("SOL", 0.6, "USDC", 0.4), StructuredOutput.requireWeights(node, "weights", true, 1e-6));
    }

    @Test
    @DisplayName("prose, out-of-range confidence and unknown enums are all rejected")
    void rejectsMalformed() {
        assertThatThrownBy(() -> StructuredOutput.parseObject(mapper, "I think it will go up"))
            .isInstanceOf(MalformedModelOutputException.class);

        JsonNode node = StructuredOutput.parseObject(mapper, "{\"signal\":\"MOON\",\"confidence\":1.4}");
        assertThrows(MalformedModelOutputException.class, () -> StructuredOutput.requireEnum(node, "signal", Signal.class));
        assertThrows(MalformedModelOutputException.class, () -> StructuredOutput.requireUnitInterval(node, "confidence"));
        assertThrows(MalformedModelOutputException.class, () -> StructuredOutput.requireTextList(node, "evidence"));
    }

    @Test
    @DisplayName("weights that do not sum to one are rejected when required")
    void weightsSum() {
        JsonNode node = StructuredOutput.parseObject(mapper, "{\"weights\":{\"SOL\":0.6,\"USDC\":0.3}}");
        assertThrows(MalformedModelOutputException.class,
            () -> StructuredOutput.requireWeights(node, "weights", true, 1e-6));
        assertEquals(2, StructuredOutput.requireWeights(node, "weights", false, 1e-6).size());
    }
}
