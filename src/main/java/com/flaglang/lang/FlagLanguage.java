package com.flaglang.lang;

import com.flaglang.ast.Program;

import java.util.List;

/**
 * Facade for turning feature flag source into tokens and programs.
 * <p>
 * Supports:
 * <ul>
 *   <li>Simple flags: {@code FF-name -> value}</li>
 *   <li>Complex flags: {@code FF-name { condition -> value ... default }}</li>
 *   <li>Logical operators: and, or, not</li>
 *   <li>Comparisons: ==, =, !=, &gt;, &gt;=, &lt;, &lt;=, in</li>
 *   <li>Literals: booleans, numbers, strings, YYYY-MM-DD dates, lists, json({...})</li>
 *   <li>NOW() for the current time</li>
 *   <li>Line and block comments</li>
 * </ul>
 */
public final class FlagLanguage {

    private FlagLanguage() {
    }

    /**
     * Tokenize source text, keeping comments and newlines.
     */
    public static List<Token> scan(String source) {
        return new Scanner(source).scanTokens();
    }

    /**
     * Parse a token list produced by {@link #scan(String)}.
     */
    public static Program parse(List<Token> tokens) {
        return new Parser(tokens).parse();
    }

    /**
     * Scan and parse source text.
     */
    public static Program parse(String source) {
        return parse(scan(source));
    }
}
