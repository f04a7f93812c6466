package com.flaglang.lang;

import com.flaglang.ast.BinaryOperator;
import com.flaglang.ast.ComplexFeatureFlagBody;
import com.flaglang.ast.Expression;
import com.flaglang.ast.FeatureFlag;
import com.flaglang.ast.FeatureFlagBody;
import com.flaglang.ast.Position;
import com.flaglang.ast.Program;
import com.flaglang.ast.Rule;
import com.flaglang.ast.SimpleFeatureFlagBody;
import com.flaglang.ast.UnaryOperator;
import com.flaglang.exception.ParseException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for feature flag source.
 * Converts tokens into a {@link Program} using recursive descent parsing.
 * Fails fast on the first structural error; no partial program is returned.
 * <p>
 * Grammar (precedence: or &lt; and &lt; equality &lt; comparison &lt; not &lt; primary):
 * <pre>
 * program     := feature* EOF
 * feature     := FLAG_NAME ( '->' expression | '{' body '}' )
 * body        := ( expression '->' expression )* expression?
 * expression  := or
 * or          := and ('or' and)*
 * and         := equality ('and' equality)*
 * equality    := comparison (('==' | '!=' | '=') comparison)*
 * comparison  := unary (('&gt;' | '&lt;' | '&gt;=' | '&lt;=' | 'in') unary)*
 * unary       := 'not' unary | primary
 * primary     := BOOLEAN | NUMBER | STRING | DATE | IDENTIFIER
 *              | json | 'now' '(' ')' | '(' expression ')' | '(' list ')'
 * list        := expression (',' expression)*
 * </pre>
 * A parenthesis opens a list when {@link ListLiteralClassifier} finds a top-level comma
 * and no top-level operator before the matching ')'.
 */
public final class Parser {

    private static final Map<TokenType, BinaryOperator> BINARY_OPERATORS = new EnumMap<>(Map.of(
            TokenType.OR, BinaryOperator.OR,
            TokenType.AND, BinaryOperator.AND,
            TokenType.EQUALS, BinaryOperator.EQUALS,
            TokenType.ASSIGN, BinaryOperator.ASSIGN,
            TokenType.NOT_EQUALS, BinaryOperator.NOT_EQUALS,
            TokenType.GREATER_THAN, BinaryOperator.GREATER_THAN,
            TokenType.LESS_THAN, BinaryOperator.LESS_THAN,
            TokenType.GREATER_EQUAL, BinaryOperator.GREATER_EQUAL,
            TokenType.LESS_EQUAL, BinaryOperator.LESS_EQUAL,
            TokenType.IN, BinaryOperator.IN
    ));

    private static final TokenType[] EQUALITY = {
            TokenType.EQUALS, TokenType.NOT_EQUALS, TokenType.ASSIGN
    };

    private static final TokenType[] COMPARISON = {
            TokenType.GREATER_THAN, TokenType.GREATER_EQUAL,
            TokenType.LESS_THAN, TokenType.LESS_EQUAL, TokenType.IN
    };

    private static final TokenType[] EXPRESSION_START = {
            TokenType.BOOLEAN_TRUE, TokenType.BOOLEAN_FALSE, TokenType.NUMBER, TokenType.STRING,
            TokenType.DATE, TokenType.JSON_FUNC, TokenType.NOW_FUNC, TokenType.LEFT_PAREN,
            TokenType.IDENTIFIER, TokenType.NOT
    };

    private final TokenStream stream;
    private final JsonLiteralParser jsonParser;

    /**
     * @param tokens Tokens produced by {@link Scanner}; comments and newlines are ignored
     */
    public Parser(List<Token> tokens) {
        this.stream = new TokenStream(tokens);
        this.jsonParser = new JsonLiteralParser(stream);
    }

    /**
     * Parse the token stream into a program.
     *
     * @return Parsed program
     * @throws ParseException on the first structural error
     */
    public Program parse() {
        Position position = stream.peek().position();
        List<FeatureFlag> features = new ArrayList<>();

        while (!stream.isAtEnd()) {
            features.add(parseFeatureFlag());
        }

        return new Program(features, position);
    }

    private FeatureFlag parseFeatureFlag() {
        Token name = stream.consume(TokenType.FEATURE_FLAG_NAME, "Expected feature flag name");

        FeatureFlagBody body;
        if (stream.match(TokenType.ARROW)) {
            Position position = stream.previous().position();
            body = new SimpleFeatureFlagBody(parseExpression(), position);
        } else if (stream.match(TokenType.LEFT_BRACE)) {
            body = parseComplexBody(stream.previous().position());
        } else {
            throw stream.error("Expected \"->\" or \"{\" after feature flag name");
        }

        return new FeatureFlag(name.text(), body, name.position());
    }

    private ComplexFeatureFlagBody parseComplexBody(Position position) {
        List<Rule> rules = new ArrayList<>();
        Expression defaultValue = null;

        while (!stream.check(TokenType.RIGHT_BRACE) && !stream.isAtEnd()) {
            if (defaultValue != null) {
                throw stream.error("Default value must be the last entry in a feature flag body");
            }
            if (!canStartExpression()) {
                throw stream.error("Expected expression or rule");
            }

            Expression expression = parseExpression();
            if (stream.match(TokenType.ARROW)) {
                rules.add(new Rule(expression, parseExpression(), expression.position()));
            } else {
                defaultValue = expression;
            }
        }

        stream.consume(TokenType.RIGHT_BRACE, "Expected \"}\" after feature flag body");
        return new ComplexFeatureFlagBody(rules, defaultValue, position);
    }

    private Expression parseExpression() {
        return parseOr();
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (stream.match(TokenType.OR)) {
            left = new Expression.BinaryExpression(left, BinaryOperator.OR, parseAnd(), left.position());
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseEquality();
        while (stream.match(TokenType.AND)) {
            left = new Expression.BinaryExpression(left, BinaryOperator.AND, parseEquality(), left.position());
        }
        return left;
    }

    private Expression parseEquality() {
        Expression left = parseComparison();
        while (stream.match(EQUALITY)) {
            BinaryOperator operator = operator(stream.previous());
            left = new Expression.BinaryExpression(left, operator, parseComparison(), left.position());
        }
        return left;
    }

    private Expression parseComparison() {
        Expression left = parseUnary();
        while (stream.match(COMPARISON)) {
            BinaryOperator operator = operator(stream.previous());
            left = new Expression.BinaryExpression(left, operator, parseUnary(), left.position());
        }
        return left;
    }

    private Expression parseUnary() {
        if (stream.match(TokenType.NOT)) {
            Position position = stream.previous().position();
            return new Expression.UnaryExpression(UnaryOperator.NOT, parseUnary(), position);
        }
        return parsePrimary();
    }

    private Expression parsePrimary() {
        if (stream.match(TokenType.BOOLEAN_TRUE)) {
            return new Expression.BooleanLiteral(true, stream.previous().position());
        }
        if (stream.match(TokenType.BOOLEAN_FALSE)) {
            return new Expression.BooleanLiteral(false, stream.previous().position());
        }
        if (stream.match(TokenType.NUMBER)) {
            Token token = stream.previous();
            return new Expression.NumberLiteral(Double.parseDouble(token.text()), token.position());
        }
        if (stream.match(TokenType.STRING)) {
            Token token = stream.previous();
            return new Expression.StringLiteral(token.text(), token.position());
        }
        if (stream.match(TokenType.DATE)) {
            Token token = stream.previous();
            return new Expression.DateLiteral(token.text(), token.position());
        }
        if (stream.match(TokenType.JSON_FUNC)) {
            return jsonParser.parse();
        }
        if (stream.match(TokenType.NOW_FUNC)) {
            Position position = stream.previous().position();
            stream.consume(TokenType.LEFT_PAREN, "Expected \"(\" after NOW");
            stream.consume(TokenType.RIGHT_PAREN, "Expected \")\" after NOW(");
            return new Expression.NowCall(position);
        }
        if (stream.match(TokenType.LEFT_PAREN)) {
            Position position = stream.previous().position();
            if (ListLiteralClassifier.isListLiteral(stream.tokens(), stream.index())) {
                return parseList(position);
            }
            Expression inner = parseExpression();
            stream.consume(TokenType.RIGHT_PAREN, "Expected \")\" after expression");
            return new Expression.GroupExpression(inner, position);
        }
        if (stream.match(TokenType.IDENTIFIER)) {
            Token token = stream.previous();
            return new Expression.Identifier(token.text(), token.position());
        }

        throw stream.error("Unexpected token " + stream.peek().type());
    }

    private Expression parseList(Position position) {
        List<Expression> elements = new ArrayList<>();
        elements.add(parseExpression());
        while (stream.match(TokenType.COMMA)) {
            elements.add(parseExpression());
        }
        stream.consume(TokenType.RIGHT_PAREN, "Expected \")\" after list elements");
        return new Expression.ListExpression(elements, position);
    }

    private boolean canStartExpression() {
        for (TokenType type : EXPRESSION_START) {
            if (stream.check(type)) {
                return true;
            }
        }
        return false;
    }

    private static BinaryOperator operator(Token token) {
        return BINARY_OPERATORS.get(token.type());
    }
}
