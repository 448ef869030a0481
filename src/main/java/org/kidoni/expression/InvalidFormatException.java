package org.kidoni.expression;

/**
 * The input is not structurally an expression: empty or unknown tokens, a missing {@code )},
 * trailing input, or an operator standing on its own.
 */
public class InvalidFormatException extends ParseException {
    public InvalidFormatException(final String message, final int position) {
        super(message, position);
    }
}
