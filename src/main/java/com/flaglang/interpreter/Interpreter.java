package com.flaglang.interpreter;

import com.flaglang.ast.ComplexFeatureFlagBody;
import com.flaglang.ast.Expression;
import com.flaglang.ast.ExpressionVisitor;
import com.flaglang.ast.FeatureFlag;
import com.flaglang.ast.Program;
import com.flaglang.ast.Rule;
import com.flaglang.ast.SimpleFeatureFlagBody;
import com.flaglang.exception.InterpreterException;
import com.flaglang.value.Value;
import com.flaglang.value.Value.BooleanValue;
import com.flaglang.value.Value.DateValue;
import com.flaglang.value.Value.ListValue;
import com.flaglang.value.Value.NumberValue;
import com.flaglang.value.Value.TextValue;
import com.flaglang.value.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates parsed feature flags against an {@link EvaluationContext}.
 * <p>
 * The interpreter holds no per-evaluation state and never mutates the tree, so a
 * single instance can evaluate shared programs from several threads.
 * <p>
 * Errors raised by a rule condition skip that rule. Errors raised by a value
 * (simple body, matched rule value or default) propagate as
 * {@link InterpreterException} naming the flag.
 */
public class Interpreter {

    private static final Logger log = LoggerFactory.getLogger(Interpreter.class);

    private final Clock clock;

    public Interpreter() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock Clock read by {@code NOW()}
     */
    public Interpreter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Evaluate every feature flag of a program in declaration order.
     */
    public List<EvaluationResult> interpretProgram(Program program, EvaluationContext context) {
        List<EvaluationResult> results = new ArrayList<>(program.features().size());
        for (FeatureFlag feature : program.features()) {
            results.add(interpretFeatureFlag(feature, context));
        }
        return results;
    }

    /**
     * Evaluate a single feature flag.
     *
     * @throws InterpreterException if the selected value cannot be evaluated
     */
    public EvaluationResult interpretFeatureFlag(FeatureFlag feature, EvaluationContext context) {
        try {
            if (feature.body() instanceof SimpleFeatureFlagBody simple) {
                return EvaluationResult.matched(feature.name(), evaluateExpression(simple.value(), context));
            }
            return interpretComplexBody(feature.name(), (ComplexFeatureFlagBody) feature.body(), context);
        } catch (InterpreterException e) {
            throw new InterpreterException("Error interpreting feature flag '" + feature.name() + "': "
                    + e.getMessage(), feature.name(), e);
        }
    }

    /**
     * Evaluate one expression.
     *
     * @throws InterpreterException on undefined identifiers, incomparable types or invalid 'in' operands
     */
    public Value evaluateExpression(Expression expression, EvaluationContext context) {
        return expression.accept(new Evaluation(context));
    }

    private EvaluationResult interpretComplexBody(String name, ComplexFeatureFlagBody body,
                                                  EvaluationContext context) {
        for (Rule rule : body.rules()) {
            if (conditionHolds(name, rule, context)) {
                return EvaluationResult.matched(name, evaluateExpression(rule.value(), context));
            }
        }

        Value fallback = body.getDefaultValue()
                .map(expression -> evaluateExpression(expression, context))
                .orElse(BooleanValue.FALSE);
        return EvaluationResult.unmatched(name, fallback);
    }

    private boolean conditionHolds(String name, Rule rule, EvaluationContext context) {
        try {
            return Values.isTruthy(evaluateExpression(rule.condition(), context));
        } catch (InterpreterException e) {
            log.debug("Skipping rule at {} in feature flag '{}': {}", rule.position(), name, e.getMessage());
            return false;
        }
    }

    /**
     * Structural walk over one expression tree with a fixed context.
     */
    private final class Evaluation implements ExpressionVisitor<Value> {

        private final EvaluationContext context;

        private Evaluation(EvaluationContext context) {
            this.context = context;
        }

        @Override
        public Value visitBoolean(Expression.BooleanLiteral expression) {
            return BooleanValue.of(expression.value());
        }

        @Override
        public Value visitNumber(Expression.NumberLiteral expression) {
            return new NumberValue(expression.value());
        }

        @Override
        public Value visitString(Expression.StringLiteral expression) {
            return new TextValue(expression.value());
        }

        @Override
        public Value visitDate(Expression.DateLiteral expression) {
            return DateValue.ofIsoDate(expression.value());
        }

        @Override
        public Value visitIdentifier(Expression.Identifier expression) {
            return context.lookup(expression.name())
                    .orElseThrow(() -> new InterpreterException("Undefined identifier: " + expression.name()));
        }

        @Override
        public Value visitJson(Expression.JsonLiteral expression) {
            return expression.value();
        }

        @Override
        public Value visitNow(Expression.NowCall expression) {
            return new DateValue(clock.instant());
        }

        @Override
        public Value visitBinary(Expression.BinaryExpression expression) {
            Value left = expression.left().accept(this);
            Value right = expression.right().accept(this);

            return switch (expression.operator()) {
                case EQUALS, ASSIGN -> BooleanValue.of(Values.areEqual(left, right));
                case NOT_EQUALS -> BooleanValue.of(!Values.areEqual(left, right));
                case GREATER_THAN -> BooleanValue.of(Values.compare(left, right) > 0);
                case GREATER_EQUAL -> BooleanValue.of(Values.compare(left, right) >= 0);
                case LESS_THAN -> BooleanValue.of(Values.compare(left, right) < 0);
                case LESS_EQUAL -> BooleanValue.of(Values.compare(left, right) <= 0);
                case AND -> BooleanValue.of(Values.isTruthy(left) && Values.isTruthy(right));
                case OR -> BooleanValue.of(Values.isTruthy(left) || Values.isTruthy(right));
                case IN -> BooleanValue.of(Values.contains(left, right));
            };
        }

        @Override
        public Value visitUnary(Expression.UnaryExpression expression) {
            Value operand = expression.operand().accept(this);
            return switch (expression.operator()) {
                case NOT -> BooleanValue.of(!Values.isTruthy(operand));
            };
        }

        @Override
        public Value visitList(Expression.ListExpression expression) {
            List<Value> elements = new ArrayList<>(expression.elements().size());
            for (Expression element : expression.elements()) {
                elements.add(element.accept(this));
            }
            return new ListValue(elements);
        }

        @Override
        public Value visitGroup(Expression.GroupExpression expression) {
            return expression.inner().accept(this);
        }
    }
}
