package com.flaglang.exception;

import com.flaglang.ast.Position;

/**
 * Exception thrown on the first structural violation found by the parser.
 */
public class ParseException extends FlagLangException {

    private final Position position;

    public ParseException(String message, Position position) {
        super(message + " at line " + position.line() + ", column " + position.column());
        this.position = position;
    }

    public ParseException(String message, Position position, Throwable cause) {
        super(message + " at line " + position.line() + ", column " + position.column(), cause);
        this.position = position;
    }

    public Position getPosition() {
        return position;
    }
}
