package org.kidoni.expression;

import java.util.OptionalInt;

/**
 * Thrown by {@link Parser} when its input is not a valid expression. The position, when known, is
 * the character offset in the input where the problem was found.
 */
public class ParseException extends RuntimeException {
    private final int position;

    public ParseException(final String message) {
        this(message, -1);
    }

    public ParseException(final String message, final int position) {
        super(position < 0 ? message : message + " at pos " + position);
        this.position = position;
    }

    public OptionalInt getPosition() {
        return position < 0 ? OptionalInt.empty() : OptionalInt.of(position);
    }
}
