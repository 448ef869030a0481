package org.kidoni.expression;

/**
 * A bracketed group is well formed but does not describe a valid operation: it has no operator or
 * more than one, the operator is out of place, or the operand count does not fit the operator.
 * The position is that of the group's opening bracket.
 */
public class InvalidOperationException extends ParseException {
    public InvalidOperationException(final String message, final int position) {
        super(message, position);
    }
}
