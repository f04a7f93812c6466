package com.flaglang.core;

import com.flaglang.interpreter.EvaluationContext;
import com.flaglang.value.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EvaluationContextFactory.
 */
class EvaluationContextFactoryTest {

    @Test
    @DisplayName("Should build variables from a JSON object")
    void shouldBuildFromJson() {
        EvaluationContext context = EvaluationContextFactory.fromJson("""
                {"countryCode": "NL", "age": 30, "beta": true,
                 "roles": ["admin", "dev"], "account": {"plan": "pro"}, "removed": null}
                """);

        assertEquals(new Value.TextValue("NL"), context.lookup("countryCode").orElseThrow());
        assertEquals(new Value.NumberValue(30), context.lookup("age").orElseThrow());
        assertEquals(Value.BooleanValue.TRUE, context.lookup("beta").orElseThrow());
        assertEquals(List.of("admin", "dev"), context.lookup("roles").orElseThrow().toJava());
        assertEquals(Map.of("plan", "pro"), context.lookup("account").orElseThrow().toJava());
        assertFalse(context.contains("removed"));
    }

    @Test
    @DisplayName("Should return empty context for blank payload")
    void shouldHandleBlankPayload() {
        assertTrue(EvaluationContextFactory.fromJson(null).getVariables().isEmpty());
        assertTrue(EvaluationContextFactory.fromJson("  ").getVariables().isEmpty());
    }

    @Test
    @DisplayName("Should let extra variables override payload members")
    void shouldMergeExtraVariables() {
        EvaluationContext context = EvaluationContextFactory.fromJson(
                "{\"region\": \"eu\", \"tier\": \"free\"}", Map.of("tier", "gold"));

        assertEquals(new Value.TextValue("eu"), context.lookup("region").orElseThrow());
        assertEquals(new Value.TextValue("gold"), context.lookup("tier").orElseThrow());
    }

    @Test
    @DisplayName("Should reject invalid or non-object JSON")
    void shouldRejectInvalidJson() {
        assertThrows(IllegalArgumentException.class, () -> EvaluationContextFactory.fromJson("{not json"));
        assertThrows(IllegalArgumentException.class, () -> EvaluationContextFactory.fromJson("[1, 2]"));
    }
}
