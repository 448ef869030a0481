package org.kidoni.expression;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The fixed set of operators an {@link Expr.Operation} may carry.
 * <p>
 * Arity follows from the evaluation function a constant is declared with: unary functions take
 * one operand, binary functions two, and functions over the whole argument array any positive
 * number ({@link #VARIADIC}).
 */
public enum Operator {
    ADD("+", (x, y) -> x + y, Derivatives::sum),
    SUBTRACT("-", (x, y) -> x - y, Derivatives::difference),
    NEGATE("negate", (double x) -> -x, Derivatives::negation),
    MULTIPLY("*", (x, y) -> x * y, Derivatives::product),
    DIVIDE("/", (x, y) -> x / y, Derivatives::quotient),
    POW("pow", Math::pow, Derivatives::power),
    LOG("log", (x, y) -> Math.log(Math.abs(y)) / Math.log(Math.abs(x)), Derivatives::logarithm),
    MEAN("mean", Statistics::mean, Derivatives::mean),
    VAR("var", Statistics::variance, Derivatives::variance);

    public static final int VARIADIC = 0;

    private static final Map<String, Operator> BY_SYMBOL = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(Operator::symbol, Function.identity()));

    private final String symbol;
    private final int arity;
    private final Evaluator evaluator;
    private final DerivativeRule derivativeRule;

    Operator(final String symbol, final DoubleUnaryOperator function, final DerivativeRule derivativeRule) {
        this(symbol, 1, args -> function.applyAsDouble(args[0]), derivativeRule);
    }

    Operator(final String symbol, final DoubleBinaryOperator function, final DerivativeRule derivativeRule) {
        this(symbol, 2, args -> function.applyAsDouble(args[0], args[1]), derivativeRule);
    }

    Operator(final String symbol, final Evaluator function, final DerivativeRule derivativeRule) {
        this(symbol, VARIADIC, function, derivativeRule);
    }

    Operator(final String symbol, final int arity, final Evaluator evaluator, final DerivativeRule derivativeRule) {
        this.symbol = symbol;
        this.arity = arity;
        this.evaluator = evaluator;
        this.derivativeRule = derivativeRule;
    }

    public static Optional<Operator> forSymbol(final String symbol) {
        return Optional.ofNullable(BY_SYMBOL.get(symbol));
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Exact operand count, or {@link #VARIADIC} for operators that accept one or more.
     */
    public int arity() {
        return arity;
    }

    public boolean isVariadic() {
        return arity == VARIADIC;
    }

    public boolean accepts(final int operandCount) {
        return operandCount > 0 && (isVariadic() || operandCount == arity);
    }

    public Expr.Operation apply(final Expr... operands) {
        return apply(Arrays.asList(operands));
    }

    /**
     * @throws IllegalArgumentException if the operand count does not fit this operator's arity
     */
    public Expr.Operation apply(final List<? extends Expr> operands) {
        return new Expr.Operation(this, List.copyOf(operands));
    }

    public double evaluate(final double[] args) {
        return evaluator.evaluate(args);
    }

    /**
     * Derivative of this operator applied to {@code operands}, with respect to {@code variable}.
     * The operands are the undifferentiated subtrees.
     */
    public Expr differentiate(final String variable, final List<Expr> operands) {
        return derivativeRule.differentiate(variable, operands);
    }

    @Override
    public String toString() {
        return symbol;
    }

    @FunctionalInterface
    interface Evaluator {
        double evaluate(double[] args);
    }

    @FunctionalInterface
    interface DerivativeRule {
        Expr differentiate(String variable, List<Expr> operands);
    }
}
