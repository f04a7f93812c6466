package com.flaglang.lang;

import java.util.Locale;
import java.util.Map;

/**
 * Keywords, function names and operator symbols of the feature flag language.
 */
public final class LanguageConfig {

    private LanguageConfig() {
    }

    /**
     * Keywords mapped to token types. Matched case-insensitively.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            // Logical
            Map.entry("and", TokenType.AND),
            Map.entry("or", TokenType.OR),
            Map.entry("not", TokenType.NOT),

            // Collection
            Map.entry("in", TokenType.IN),

            // Literals
            Map.entry("true", TokenType.BOOLEAN_TRUE),
            Map.entry("false", TokenType.BOOLEAN_FALSE)
    );

    /**
     * Identifiers that become function tokens when immediately followed by '('.
     */
    public static final Map<String, TokenType> FUNCTIONS = Map.of(
            "json", TokenType.JSON_FUNC,
            "now", TokenType.NOW_FUNC
    );

    /**
     * Prefix every feature flag name starts with, followed by '-' or '_'.
     */
    public static final String FLAG_PREFIX = "FF";

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_BRACE = '{';
        public static final char RIGHT_BRACE = '}';
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char LEFT_BRACKET = '[';
        public static final char RIGHT_BRACKET = ']';
        public static final char COMMA = ',';
        public static final char COLON = ':';
        public static final char EQUALS = '=';
        public static final char BANG = '!';
        public static final char GREATER = '>';
        public static final char LESS = '<';
        public static final char MINUS = '-';
        public static final char SLASH = '/';
        public static final char STAR = '*';
        public static final char QUOTE = '"';
        public static final char BACKSLASH = '\\';
        public static final char DOT = '.';
        public static final char UNDERSCORE = '_';
        public static final char NEWLINE = '\n';

        private Operators() {
        }
    }

    static TokenType keywordOrIdentifier(String word) {
        return KEYWORDS.getOrDefault(word.toLowerCase(Locale.ROOT), TokenType.IDENTIFIER);
    }

    static TokenType function(String word) {
        return FUNCTIONS.get(word.toLowerCase(Locale.ROOT));
    }
}
