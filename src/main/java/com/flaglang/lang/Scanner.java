package com.flaglang.lang;

import com.flaglang.exception.LexException;

import java.util.ArrayList;
import java.util.List;

import static com.flaglang.lang.LanguageConfig.*;

/**
 * Scanner for feature flag source.
 * Converts input text into a sequence of tokens in a single left-to-right pass.
 * <p>
 * Comments and newlines are kept as tokens; whitespace between tokens is skipped.
 * The only backtracking point is the date lookahead after a four-digit number.
 */
public final class Scanner {

    private final String input;
    private final int length;
    private int pos;
    private int line;
    private int column;

    private int tokenStart;
    private int tokenLine;
    private int tokenColumn;

    public Scanner(String input) {
        this.input = input;
        this.length = input.length();
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, always terminated by an EOF token
     * @throws LexException on an unterminated string or block comment, or an unexpected character
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        pos = 0;
        line = 1;
        column = 1;

        while (!isAtEnd()) {
            char c = peek();

            // Skip whitespace
            if (c != Operators.NEWLINE && Character.isWhitespace(c)) {
                advance();
                continue;
            }

            tokenStart = pos;
            tokenLine = line;
            tokenColumn = column;

            switch (c) {
                case Operators.NEWLINE -> {
                    advance();
                    tokens.add(token(TokenType.NEWLINE, "\n"));
                }
                case Operators.LEFT_BRACE -> tokens.add(single(TokenType.LEFT_BRACE));
                case Operators.RIGHT_BRACE -> tokens.add(single(TokenType.RIGHT_BRACE));
                case Operators.LEFT_PAREN -> tokens.add(single(TokenType.LEFT_PAREN));
                case Operators.RIGHT_PAREN -> tokens.add(single(TokenType.RIGHT_PAREN));
                case Operators.LEFT_BRACKET -> tokens.add(single(TokenType.LEFT_BRACKET));
                case Operators.RIGHT_BRACKET -> tokens.add(single(TokenType.RIGHT_BRACKET));
                case Operators.COMMA -> tokens.add(single(TokenType.COMMA));
                case Operators.COLON -> tokens.add(single(TokenType.COLON));
                case Operators.MINUS -> {
                    advance();
                    if (match(Operators.GREATER)) {
                        tokens.add(token(TokenType.ARROW, "->"));
                    } else {
                        throw error("Unexpected character '-'");
                    }
                }
                case Operators.EQUALS -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(token(TokenType.EQUALS, "=="));
                    } else {
                        tokens.add(token(TokenType.ASSIGN, "="));
                    }
                }
                case Operators.BANG -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(token(TokenType.NOT_EQUALS, "!="));
                    } else {
                        throw error("Unexpected character '!'");
                    }
                }
                case Operators.GREATER -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(token(TokenType.GREATER_EQUAL, ">="));
                    } else {
                        tokens.add(token(TokenType.GREATER_THAN, ">"));
                    }
                }
                case Operators.LESS -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(token(TokenType.LESS_EQUAL, "<="));
                    } else {
                        tokens.add(token(TokenType.LESS_THAN, "<"));
                    }
                }
                case Operators.SLASH -> {
                    advance();
                    if (match(Operators.SLASH)) {
                        tokens.add(readLineComment());
                    } else if (match(Operators.STAR)) {
                        tokens.add(readBlockComment());
                    } else {
                        throw error("Unexpected character '/'");
                    }
                }
                case Operators.QUOTE -> tokens.add(readString());
                default -> {
                    if (isFlagNameStart()) {
                        tokens.add(readFlagName());
                    } else if (isIdentifierStart(c)) {
                        tokens.add(readIdentifierOrKeyword());
                    } else if (isDigit(c)) {
                        tokens.add(readNumberOrDate());
                    } else {
                        throw error("Unexpected character '" + c + "'");
                    }
                }
            }
        }

        tokenStart = pos;
        tokenLine = line;
        tokenColumn = column;
        tokens.add(token(TokenType.EOF, ""));
        return tokens;
    }

    private Token readFlagName() {
        // "FF" plus the '-' or '_' separator
        advance();
        advance();
        advance();
        while (!isAtEnd() && isFlagNamePart(peek())) {
            advance();
        }
        return token(TokenType.FEATURE_FLAG_NAME, lexeme());
    }

    private Token readIdentifierOrKeyword() {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }

        String text = lexeme();

        // json( and now( are function markers, a bare word otherwise
        TokenType function = function(text);
        if (function != null && !isAtEnd() && peek() == Operators.LEFT_PAREN) {
            return token(function, text);
        }

        return token(keywordOrIdentifier(text), text);
    }

    private Token readNumberOrDate() {
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }

        boolean integral = true;
        if (peek(0) == Operators.DOT && isDigit(peek(1))) {
            integral = false;
            advance();
            while (!isAtEnd() && isDigit(peek())) {
                advance();
            }
        }

        if (integral && pos - tokenStart == 4 && peek(0) == Operators.MINUS) {
            Token date = tryReadDate();
            if (date != null) {
                return date;
            }
        }

        return token(TokenType.NUMBER, lexeme());
    }

    /**
     * Speculatively extend a four-digit number into a YYYY-MM-DD date.
     * Rewinds to just after the number when the pattern does not match.
     */
    private Token tryReadDate() {
        int savedPos = pos;
        int savedLine = line;
        int savedColumn = column;

        if (peek(0) == Operators.MINUS && isDigit(peek(1)) && isDigit(peek(2))
                && peek(3) == Operators.MINUS && isDigit(peek(4)) && isDigit(peek(5))) {
            for (int i = 0; i < 6; i++) {
                advance();
            }
            return token(TokenType.DATE, lexeme());
        }

        pos = savedPos;
        line = savedLine;
        column = savedColumn;
        return null;
    }

    private Token readString() {
        advance(); // opening quote
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != Operators.QUOTE) {
            char c = advance();

            if (c == Operators.BACKSLASH) {
                if (isAtEnd()) {
                    break;
                }
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }

        if (isAtEnd()) {
            throw new LexException("Unterminated string", tokenLine, tokenColumn);
        }

        advance(); // closing quote
        return token(TokenType.STRING, sb.toString());
    }

    private Token readLineComment() {
        while (!isAtEnd() && peek() != Operators.NEWLINE) {
            advance();
        }
        return token(TokenType.COMMENT, lexeme());
    }

    private Token readBlockComment() {
        while (!isAtEnd()) {
            if (peek(0) == Operators.STAR && peek(1) == Operators.SLASH) {
                advance();
                advance();
                return token(TokenType.COMMENT, lexeme());
            }
            advance();
        }
        throw new LexException("Unterminated block comment", tokenLine, tokenColumn);
    }

    private Token single(TokenType type) {
        advance();
        return token(type, lexeme());
    }

    private Token token(TokenType type, String text) {
        return new Token(type, text, lexeme(), tokenLine, tokenColumn, tokenStart, pos);
    }

    private String lexeme() {
        return input.substring(tokenStart, pos);
    }

    private boolean isFlagNameStart() {
        if (!input.startsWith(FLAG_PREFIX, pos)) {
            return false;
        }
        char separator = peek(FLAG_PREFIX.length());
        return separator == Operators.MINUS || separator == Operators.UNDERSCORE;
    }

    private boolean isFlagNamePart(char c) {
        return isIdentifierPart(c) || c == Operators.MINUS;
    }

    private boolean isIdentifierStart(char c) {
        return isAsciiLetter(c) || c == Operators.UNDERSCORE;
    }

    private boolean isIdentifierPart(char c) {
        return isAsciiLetter(c) || isDigit(c) || c == Operators.UNDERSCORE;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == Operators.NEWLINE) {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        advance();
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < length ? input.charAt(index) : '\0';
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private LexException error(String message) {
        return new LexException(message, tokenLine, tokenColumn);
    }
}
