package org.kidoni.expression;

/**
 * A top-level item inside a bracketed group: either a finished operand or an operator symbol that
 * the enclosing group has yet to apply.
 */
sealed interface Token {
    record Operand(Expr expr) implements Token {
    }

    record Symbol(Operator operator, int position) implements Token {
    }
}
