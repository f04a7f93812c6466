package com.flaglang.interpreter;

import com.flaglang.ast.Expression;
import com.flaglang.ast.FeatureFlag;
import com.flaglang.ast.Program;
import com.flaglang.ast.SimpleFeatureFlagBody;
import com.flaglang.exception.InterpreterException;
import com.flaglang.lang.FlagLanguage;
import com.flaglang.value.Value;
import com.flaglang.value.Value.BooleanValue;
import com.flaglang.value.Value.DateValue;
import com.flaglang.value.Value.NumberValue;
import com.flaglang.value.Value.TextValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Interpreter.
 */
class InterpreterTest {

    private static final Instant NOW = Instant.parse("2025-06-15T10:00:00Z");

    private Interpreter interpreter;

    @BeforeEach
    void setUp() {
        interpreter = new Interpreter(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private EvaluationResult evaluate(String source, Map<String, ?> variables) {
        FeatureFlag flag = FlagLanguage.parse(source).features().get(0);
        return interpreter.interpretFeatureFlag(flag, EvaluationContext.of(variables));
    }

    private Value value(String expression, Map<String, ?> variables) {
        return evaluate("FF-test -> " + expression, variables).value();
    }

    @Test
    @DisplayName("Should report simple flags as matched")
    void shouldMatchSimpleFlag() {
        EvaluationResult result = evaluate("FF-on -> true", Map.of());

        assertEquals(new EvaluationResult("FF-on", BooleanValue.TRUE, true), result);
    }

    @Test
    @DisplayName("Should pick the first matching rule")
    void shouldPickFirstMatchingRule() {
        String source = """
                FF-y {
                  countryCode == "NL" -> true
                  countryCode == "US" -> false
                  false
                }
                """;

        EvaluationResult nl = evaluate(source, Map.of("countryCode", "NL"));
        assertEquals(BooleanValue.TRUE, nl.value());
        assertTrue(nl.matched());

        EvaluationResult fr = evaluate(source, Map.of("countryCode", "FR"));
        assertEquals(BooleanValue.FALSE, fr.value());
        assertFalse(fr.matched());
    }

    @Test
    @DisplayName("Should return false unmatched when no rule matches and no default exists")
    void shouldReturnImplicitFalse() {
        EvaluationResult result = evaluate("FF-a { x > 10 -> \"big\" }", Map.of("x", 3));

        assertEquals(BooleanValue.FALSE, result.value());
        assertFalse(result.matched());
    }

    @Test
    @DisplayName("Should skip rules whose condition fails to evaluate")
    void shouldSkipFailingConditions() {
        String source = """
                FF-a {
                  missing == 1 -> "first"
                  1 > "one" -> "second"
                  tier == "gold" -> "third"
                  "default"
                }
                """;

        EvaluationResult result = evaluate(source, Map.of("tier", "gold"));

        assertEquals(new TextValue("third"), result.value());
        assertTrue(result.matched());
    }

    @Test
    @DisplayName("Should fall back to default when every condition fails")
    void shouldUseDefaultWhenAllConditionsFail() {
        EvaluationResult result = evaluate("FF-a { missing -> 1  2 }", Map.of());

        assertEquals(new NumberValue(2), result.value());
        assertFalse(result.matched());
    }

    @Test
    @DisplayName("Should propagate value errors naming the flag")
    void shouldPropagateValueErrors() {
        InterpreterException simple = assertThrows(InterpreterException.class,
                () -> evaluate("FF-broken -> missing", Map.of()));
        assertEquals("FF-broken", simple.getFlagName());
        assertTrue(simple.getMessage().contains("Undefined identifier: missing"), simple.getMessage());

        InterpreterException ruleValue = assertThrows(InterpreterException.class,
                () -> evaluate("FF-b { true -> missing }", Map.of()));
        assertEquals("FF-b", ruleValue.getFlagName());

        InterpreterException defaultValue = assertThrows(InterpreterException.class,
                () -> evaluate("FF-c { false -> 1  missing }", Map.of()));
        assertEquals("FF-c", defaultValue.getFlagName());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "1 == 1                         | true",
            "1 = 1.0                        | true",
            "1 == \"1\"                     | false",
            "\"a\" != \"b\"                 | true",
            "3 >= 3 and 2 < 3               | true",
            "\"apple\" < \"banana\"         | true",
            "false or 0                     | false",
            "not \"\"                       | true",
            "not not 5                      | true",
            "(1, 2) == (1, 2)               | true",
            "2 in (1, 2, 3)                 | true",
            "\"b\" in (\"a\", \"c\")        | false",
            "\"ell\" in \"hello\"           | true",
            "2024-01-01 < 2024-02-01        | true",
            "2024-01-01 == \"2024-01-01\"   | true",
            "2024-02-30 == 2024-02-30       | false",
            "json({\"a\": 1}) == json({\"a\": 1}) | true"
    })
    @DisplayName("Should evaluate operators")
    void shouldEvaluateOperators(String expression, boolean expected) {
        assertEquals(BooleanValue.of(expected), value(expression, Map.of()));
    }

    @Test
    @DisplayName("Should resolve identifiers from the context")
    void shouldResolveIdentifiers() {
        Map<String, Object> variables = Map.of(
                "tier", "premium",
                "countryCode", "BE",
                "age", 21,
                "betaUsers", List.of("u1", "u2"),
                "userId", "u2"
        );

        assertEquals(BooleanValue.TRUE,
                value("tier == \"premium\" and countryCode in (\"NL\", \"BE\")", variables));
        assertEquals(BooleanValue.TRUE, value("age >= 18", variables));
        assertEquals(BooleanValue.TRUE, value("userId in betaUsers", variables));
    }

    @Test
    @DisplayName("Should look up bare words in list literals")
    void shouldLookUpListIdentifiers() {
        assertEquals(BooleanValue.TRUE,
                value("model in (ms, mx)", Map.of("model", "S", "ms", "S", "mx", "X")));

        assertThrows(InterpreterException.class, () -> value("model in (ms, mx)", Map.of("model", "S")));
    }

    @Test
    @DisplayName("Should read NOW() from the injected clock")
    void shouldReadClock() {
        assertEquals(new DateValue(NOW), value("NOW()", Map.of()));
        assertEquals(BooleanValue.TRUE, value("NOW() > 2025-06-15 and NOW() < 2025-06-16", Map.of()));
        assertEquals(BooleanValue.TRUE, value("now() == \"2025-06-15\"", Map.of()));
    }

    @Test
    @DisplayName("Should order NOW() on the system clock against a date string")
    void shouldOrderSystemNowAgainstString() {
        Interpreter systemClock = new Interpreter();
        Expression expression = ((SimpleFeatureFlagBody) FlagLanguage.parse("FF-a -> NOW() > \"2020-01-01\"")
                .features().get(0).body()).value();

        assertEquals(BooleanValue.TRUE, systemClock.evaluateExpression(expression, EvaluationContext.empty()));
    }

    @Test
    @DisplayName("Should evaluate a date literal to its calendar day")
    void shouldEvaluateDateLiteral() {
        DateValue date = assertInstanceOf(DateValue.class, value("2024-02-22", Map.of()));

        assertTrue(date.isValid());
        assertEquals("2024-02-22", date.calendarDay());
    }

    @Test
    @DisplayName("Should treat negative zero from the context as zero")
    void shouldTreatNegativeZeroAsZero() {
        Map<String, Object> variables = Map.of("x", -0.0);

        assertEquals(BooleanValue.FALSE, value("x < 0", variables));
        assertEquals(BooleanValue.TRUE, value("x >= 0 and x == 0", variables));
    }

    @Test
    @DisplayName("Should reject NaN in the context")
    void shouldRejectNaNInContext() {
        assertThrows(IllegalArgumentException.class, () -> EvaluationContext.of(Map.of("x", Double.NaN)));
    }

    @Test
    @DisplayName("Should return JSON objects as object values")
    void shouldReturnJson() {
        Value value = value("json({\"variant\": \"B\", \"weights\": [1, 2]})", Map.of());

        assertEquals(Map.of("variant", "B", "weights", List.of(1.0, 2.0)), value.toJava());
    }

    @Test
    @DisplayName("Should refuse to compare incompatible types")
    void shouldRefuseIncompatibleComparison() {
        Value condition = assertDoesNotThrow(() -> evaluate("FF-a { 1 > \"x\" -> true }", Map.of()).value());
        assertEquals(BooleanValue.FALSE, condition);

        InterpreterException e = assertThrows(InterpreterException.class, () -> value("1 > \"x\"", Map.of()));
        assertTrue(e.getMessage().contains("Cannot compare values of types number and string"), e.getMessage());
    }

    @Test
    @DisplayName("Should evaluate every flag of a program in order without mutating it")
    void shouldEvaluateProgram() {
        Program program = FlagLanguage.parse("FF-a -> 1\nFF-b { x -> \"yes\" \"no\" }\nFF-a -> 3");
        EvaluationContext context = EvaluationContext.of(Map.of("x", true));

        List<EvaluationResult> first = interpreter.interpretProgram(program, context);
        List<EvaluationResult> second = interpreter.interpretProgram(program, context);

        assertEquals(List.of(
                new EvaluationResult("FF-a", new NumberValue(1), true),
                new EvaluationResult("FF-b", new TextValue("yes"), true),
                new EvaluationResult("FF-a", new NumberValue(3), true)
        ), first);
        assertEquals(first, second);
    }

    @Test
    @DisplayName("Should evaluate bare expressions without a flag name")
    void shouldEvaluateExpression() {
        Program program = FlagLanguage.parse("FF-a -> missing");
        FeatureFlag flag = program.features().get(0);
        SimpleFeatureFlagBody body = (SimpleFeatureFlagBody) flag.body();

        InterpreterException e = assertThrows(InterpreterException.class,
                () -> interpreter.evaluateExpression(body.value(), EvaluationContext.empty()));
        assertNull(e.getFlagName());
        assertEquals("Undefined identifier: missing", e.getMessage());
    }
}
