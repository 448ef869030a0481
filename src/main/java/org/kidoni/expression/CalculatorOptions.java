package org.kidoni.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command line of {@link Calculator}:
 * <pre>
 *  [--notation=prefix|postfix|flat] [--diff=VAR] EXPRESSION [X [Y [Z]]]
 * </pre>
 * The notation defaults to the {@value #NOTATION_ENV} environment variable, then to prefix.
 * {@code diffVariable} is {@code null} when no derivative was asked for; {@code values} holds one
 * value per variable.
 */
public record CalculatorOptions(Syntax syntax, String diffVariable, String expression, List<Double> values) {
    public static final String NOTATION_ENV = "EXPRESSION_NOTATION";

    private static final String NOTATION_OPTION = "--notation=";
    private static final String DIFF_OPTION = "--diff=";

    public CalculatorOptions {
        values = List.copyOf(values);
    }

    public enum Syntax {
        PREFIX,
        POSTFIX,
        FLAT;

        static Syntax of(final String name) {
            try {
                return valueOf(name.strip().toUpperCase(Locale.ROOT));
            }
            catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unknown notation: " + name, e);
            }
        }

        public Expr parse(final String input) {
            return switch (this) {
                case PREFIX -> Expressions.parsePrefix(input);
                case POSTFIX -> Expressions.parsePostfix(input);
                case FLAT -> Expressions.parse(input);
            };
        }
    }

    /**
     * @throws IllegalArgumentException on a malformed command line
     */
    public static CalculatorOptions parse(final String[] args, final Map<String, String> env) {
        String notation = env.get(NOTATION_ENV);
        Syntax syntax = notation != null ? Syntax.of(notation) : Syntax.PREFIX;
        String diffVariable = null;
        List<String> positional = new ArrayList<>();

        for (String arg : args) {
            if (arg.startsWith(NOTATION_OPTION)) {
                syntax = Syntax.of(arg.substring(NOTATION_OPTION.length()));
            }
            else if (arg.startsWith(DIFF_OPTION)) {
                diffVariable = arg.substring(DIFF_OPTION.length());
                if (!Expr.VARIABLES.contains(diffVariable)) {
                    throw new IllegalArgumentException("unknown variable: " + diffVariable);
                }
            }
            else {
                positional.add(arg);
            }
        }

        if (positional.isEmpty()) {
            throw new IllegalArgumentException("expression missing");
        }
        if (positional.size() > 1 + Expr.VARIABLES.size()) {
            throw new IllegalArgumentException("at most " + Expr.VARIABLES.size() + " variable values expected");
        }

        List<Double> values = new ArrayList<>(Collections.nCopies(Expr.VARIABLES.size(), 0.0));
        for (int i = 1; i < positional.size(); i++) {
            try {
                values.set(i - 1, Double.parseDouble(positional.get(i)));
            }
            catch (NumberFormatException e) {
                throw new IllegalArgumentException("not a number: " + positional.get(i), e);
            }
        }

        return new CalculatorOptions(syntax, diffVariable, positional.get(0), values);
    }
}
