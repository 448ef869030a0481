package org.kidoni.expression;

/**
 * Where the operator sits inside a bracketed group.
 */
public enum Notation {
    PREFIX,
    POSTFIX;

    /**
     * Index the operator must have among the group's top-level tokens.
     */
    int operatorIndex(final int operandCount) {
        return this == PREFIX ? 0 : operandCount;
    }
}
