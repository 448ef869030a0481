package org.kidoni.expression;

import java.util.List;

import static org.kidoni.expression.Operator.ADD;
import static org.kidoni.expression.Operator.DIVIDE;
import static org.kidoni.expression.Operator.LOG;
import static org.kidoni.expression.Operator.MEAN;
import static org.kidoni.expression.Operator.MULTIPLY;
import static org.kidoni.expression.Operator.NEGATE;
import static org.kidoni.expression.Operator.POW;
import static org.kidoni.expression.Operator.SUBTRACT;

/**
 * Derivative rules for each {@link Operator}. Every rule receives the undifferentiated operands
 * and builds a new tree, differentiating operands where the rule calls for it.
 */
final class Derivatives {
    private Derivatives() {
    }

    static Expr sum(final String variable, final List<Expr> operands) {
        return ADD.apply(operands.get(0).diff(variable), operands.get(1).diff(variable));
    }

    static Expr difference(final String variable, final List<Expr> operands) {
        return SUBTRACT.apply(operands.get(0).diff(variable), operands.get(1).diff(variable));
    }

    static Expr negation(final String variable, final List<Expr> operands) {
        return NEGATE.apply(operands.get(0).diff(variable));
    }

    // x' * y + x * y'
    static Expr product(final String variable, final List<Expr> operands) {
        Expr x = operands.get(0);
        Expr y = operands.get(1);
        return ADD.apply(
                MULTIPLY.apply(x.diff(variable), y),
                MULTIPLY.apply(x, y.diff(variable)));
    }

    // (x' * y - x * y') / (y * y)
    static Expr quotient(final String variable, final List<Expr> operands) {
        Expr x = operands.get(0);
        Expr y = operands.get(1);
        return DIVIDE.apply(
                SUBTRACT.apply(
                        MULTIPLY.apply(x.diff(variable), y),
                        MULTIPLY.apply(x, y.diff(variable))),
                MULTIPLY.apply(y, y));
    }

    // x^(y - 1) * (y * x' + x * y' * ln x)
    static Expr power(final String variable, final List<Expr> operands) {
        Expr x = operands.get(0);
        Expr y = operands.get(1);
        return MULTIPLY.apply(
                POW.apply(x, SUBTRACT.apply(y, Expr.Const.ONE)),
                ADD.apply(
                        MULTIPLY.apply(y, x.diff(variable)),
                        MULTIPLY.apply(MULTIPLY.apply(x, y.diff(variable)), ln(x))));
    }

    // (ln x * y' * (1 / y) - ln y * x' * (1 / x)) / (ln x * ln x)
    static Expr logarithm(final String variable, final List<Expr> operands) {
        Expr x = operands.get(0);
        Expr y = operands.get(1);
        return DIVIDE.apply(
                SUBTRACT.apply(
                        MULTIPLY.apply(
                                MULTIPLY.apply(ln(x), y.diff(variable)),
                                DIVIDE.apply(Expr.Const.ONE, y)),
                        MULTIPLY.apply(
                                MULTIPLY.apply(ln(y), x.diff(variable)),
                                DIVIDE.apply(Expr.Const.ONE, x))),
                MULTIPLY.apply(ln(x), ln(x)));
    }

    /**
     * Derivative of the left-folded sum, divided by the operand count.
     */
    static Expr mean(final String variable, final List<Expr> operands) {
        Expr sum = Expr.Const.ZERO;
        for (Expr operand : operands) {
            sum = ADD.apply(sum, operand);
        }
        return DIVIDE.apply(sum.diff(variable), new Expr.Const(operands.size()));
    }

    /**
     * Rewrites to {@code mean(x_i * x_i) - mean(x_i) * mean(x_i)} and differentiates that.
     */
    static Expr variance(final String variable, final List<Expr> operands) {
        List<Expr> squares = operands.stream()
                .map(Derivatives::square)
                .toList();
        return SUBTRACT.apply(MEAN.apply(squares), square(MEAN.apply(operands))).diff(variable);
    }

    private static Expr square(final Expr x) {
        return MULTIPLY.apply(x, x);
    }

    private static Expr ln(final Expr x) {
        return LOG.apply(Expr.Const.E, x);
    }
}
