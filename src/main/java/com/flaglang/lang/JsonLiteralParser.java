package com.flaglang.lang;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.flaglang.ast.Expression;
import com.flaglang.ast.Position;
import com.flaglang.exception.ParseException;
import com.flaglang.value.JsonValues;
import com.flaglang.value.Value;

/**
 * Parser for the JSON literal inside {@code json(...)}.
 * <p>
 * Grammar:
 * <pre>
 * json    := 'json' '(' object ')'
 * object  := '{' (STRING ':' value (',' STRING ':' value)*)? '}'
 * value   := STRING | NUMBER | 'true' | 'false' | array
 * array   := '[' (element (',' element)*)? ']'
 * element := STRING | NUMBER | 'true' | 'false' | IDENTIFIER
 * </pre>
 * Identifiers inside arrays are read as strings. Nested objects and nested arrays are
 * rejected. The assembled text is decoded with Jackson.
 */
final class JsonLiteralParser {

    private final TokenStream stream;

    JsonLiteralParser(TokenStream stream) {
        this.stream = stream;
    }

    /**
     * Parse the remainder of a json(...) call. The json token has already been consumed.
     */
    Expression.JsonLiteral parse() {
        Position position = stream.previous().position();
        stream.consume(TokenType.LEFT_PAREN, "Expected \"(\" after json");
        Position objectStart = stream.peek().position();
        String json = readObject();
        stream.consume(TokenType.RIGHT_PAREN, "Expected \")\" after json object");

        try {
            // readObject always yields an object document
            Value.ObjectValue object = (Value.ObjectValue) JsonValues.parse(json);
            return new Expression.JsonLiteral(object, position);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ParseException("Invalid JSON object: " + e.getMessage(), objectStart, e);
        }
    }

    private String readObject() {
        if (!stream.match(TokenType.LEFT_BRACE)) {
            throw stream.error("Expected \"{\" to start JSON object");
        }

        StringBuilder json = new StringBuilder("{");
        boolean first = true;

        while (!stream.check(TokenType.RIGHT_BRACE) && !stream.isAtEnd()) {
            if (!first) {
                stream.consume(TokenType.COMMA, "Expected \",\" between JSON object properties");
                json.append(',');
            }
            first = false;

            Token key = stream.consume(TokenType.STRING, "Expected string key in JSON object");
            json.append(quote(key.text()));
            stream.consume(TokenType.COLON, "Expected \":\" after JSON object key");
            json.append(':');
            json.append(readValue());
        }

        stream.consume(TokenType.RIGHT_BRACE, "Expected \"}\" to close JSON object");
        return json.append('}').toString();
    }

    private String readValue() {
        if (stream.match(TokenType.STRING)) {
            return quote(stream.previous().text());
        }
        if (stream.match(TokenType.NUMBER)) {
            return stream.previous().text();
        }
        if (stream.match(TokenType.BOOLEAN_TRUE)) {
            return "true";
        }
        if (stream.match(TokenType.BOOLEAN_FALSE)) {
            return "false";
        }
        if (stream.check(TokenType.LEFT_BRACKET)) {
            return readArray();
        }
        if (stream.check(TokenType.LEFT_BRACE)) {
            throw stream.error("Nested JSON objects are not supported");
        }
        throw stream.error("Invalid JSON value");
    }

    private String readArray() {
        stream.consume(TokenType.LEFT_BRACKET, "Expected \"[\" to start JSON array");
        StringBuilder json = new StringBuilder("[");

        if (!stream.check(TokenType.RIGHT_BRACKET)) {
            json.append(readArrayElement());
            while (stream.match(TokenType.COMMA)) {
                json.append(',').append(readArrayElement());
            }
        }

        stream.consume(TokenType.RIGHT_BRACKET, "Expected \"]\" to close JSON array");
        return json.append(']').toString();
    }

    private String readArrayElement() {
        if (stream.match(TokenType.STRING, TokenType.IDENTIFIER)) {
            return quote(stream.previous().text());
        }
        if (stream.match(TokenType.NUMBER)) {
            return stream.previous().text();
        }
        if (stream.match(TokenType.BOOLEAN_TRUE)) {
            return "true";
        }
        if (stream.match(TokenType.BOOLEAN_FALSE)) {
            return "false";
        }
        if (stream.check(TokenType.LEFT_BRACKET)) {
            throw stream.error("Nested JSON arrays are not supported");
        }
        if (stream.check(TokenType.LEFT_BRACE)) {
            throw stream.error("Nested JSON objects are not supported");
        }
        throw stream.error("Unexpected token in JSON array: " + stream.peek().type());
    }

    private static String quote(String text) {
        return '"' + new String(JsonStringEncoder.getInstance().quoteAsString(text)) + '"';
    }
}
