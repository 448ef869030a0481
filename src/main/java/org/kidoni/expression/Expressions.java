package org.kidoni.expression;

/**
 * Entry points for turning text into an {@link Expr}.
 */
public final class Expressions {
    private Expressions() {
    }

    /**
     * Parses a fully bracketed expression with operators first, e.g. {@code (+ x (* 2 y))}.
     *
     * @throws ParseException if the input is not a valid prefix expression
     */
    public static Expr parsePrefix(final String input) {
        return new Parser(input, Notation.PREFIX).parse();
    }

    /**
     * Parses a fully bracketed expression with operators last, e.g. {@code (x (2 y *) +)}.
     *
     * @throws ParseException if the input is not a valid postfix expression
     */
    public static Expr parsePostfix(final String input) {
        return new Parser(input, Notation.POSTFIX).parse();
    }

    /**
     * Parses unbracketed postfix input without validation. See {@link StackParser}.
     */
    public static Expr parse(final String input) {
        return new StackParser().parse(input);
    }
}
