package org.kidoni.expression;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable expression tree over the variables {@code x}, {@code y} and {@code z}.
 * <p>
 * Every node can be evaluated, rendered in three flavors and differentiated. Trees are never
 * modified; differentiation builds a new tree.
 */
public sealed interface Expr {
    /**
     * Recognized variable names. A variable's position in this list is the index of its value
     * in the array passed to {@link #evaluate(double[])}.
     */
    List<String> VARIABLES = List.of("x", "y", "z");

    double evaluate(double[] values);

    default double evaluate(final double x, final double y, final double z) {
        return evaluate(new double[]{x, y, z});
    }

    /**
     * Fully parenthesized rendering with each operator before its operands.
     */
    String prefix();

    /**
     * Fully parenthesized rendering with each operator after its operands.
     */
    String postfix();

    Expr diff(String variable);

    /**
     * Operands followed by the operator symbol, without parentheses. Used by every node no
     * matter which notation it was parsed from.
     */
    @Override
    String toString();

    record Const(double value) implements Expr {
        public static final Const ZERO = new Const(0);
        public static final Const ONE = new Const(1);
        public static final Const TWO = new Const(2);
        public static final Const E = new Const(Math.E);

        @Override
        public double evaluate(final double[] values) {
            return value;
        }

        @Override
        public String prefix() {
            return toString();
        }

        @Override
        public String postfix() {
            return toString();
        }

        @Override
        public Expr diff(final String variable) {
            return ZERO;
        }

        @Override
        public String toString() {
            if (Double.isFinite(value) && value == Math.rint(value)) {
                return new BigDecimal(value).toBigInteger().toString();
            }
            return Double.toString(value);
        }
    }

    record Variable(String name) implements Expr {
        public Variable {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public double evaluate(final double[] values) {
            int index = VARIABLES.indexOf(name);
            if (index < 0) {
                throw new IllegalStateException("unknown variable: " + name);
            }
            if (index >= values.length) {
                throw new IllegalArgumentException("no value given for variable " + name);
            }
            return values[index];
        }

        @Override
        public String prefix() {
            return name;
        }

        @Override
        public String postfix() {
            return name;
        }

        @Override
        public Expr diff(final String variable) {
            return name.equals(variable) ? Const.ONE : Const.ZERO;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * An operator applied to its operands. The operand count must fit the operator's arity.
     */
    record Operation(Operator operator, List<Expr> operands) implements Expr {
        public Operation {
            Objects.requireNonNull(operator, "operator");
            if (!operator.accepts(operands.size())) {
                throw new IllegalArgumentException(
                        "Invalid amount of arguments (" + operands.size() + ") for operation " + operator);
            }
            operands = List.copyOf(operands);
        }

        @Override
        public double evaluate(final double[] values) {
            double[] args = new double[operands.size()];
            for (int i = 0; i < args.length; i++) {
                args[i] = operands.get(i).evaluate(values);
            }
            return operator.evaluate(args);
        }

        @Override
        public String prefix() {
            return "(" + operator.symbol() + " " + join(Expr::prefix) + ")";
        }

        @Override
        public String postfix() {
            return "(" + join(Expr::postfix) + " " + operator.symbol() + ")";
        }

        @Override
        public Expr diff(final String variable) {
            return operator.differentiate(variable, operands);
        }

        @Override
        public String toString() {
            return join(Expr::toString) + " " + operator.symbol();
        }

        private String join(final Function<Expr, String> renderer) {
            return operands.stream().map(renderer).collect(Collectors.joining(" "));
        }
    }
}
