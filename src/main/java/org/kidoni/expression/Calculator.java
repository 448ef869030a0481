package org.kidoni.expression;

import java.io.PrintStream;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses one expression from the command line, evaluates it and prints its renderings and,
 * optionally, its derivative.
 */
public class Calculator {
    private static final Logger LOGGER = LoggerFactory.getLogger(Calculator.class);

    static final int PARSE_ERROR = 1;
    static final int USAGE_ERROR = 2;

    public static void main(String[] args) {
        int status = run(args, System.getenv(), System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(final String[] args, final Map<String, String> env, final PrintStream out, final PrintStream err) {
        final CalculatorOptions options;
        try {
            options = CalculatorOptions.parse(args, env);
        }
        catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println("usage: Calculator [--notation=prefix|postfix|flat] [--diff=x|y|z] EXPRESSION [X [Y [Z]]]");
            return USAGE_ERROR;
        }

        final Expr expr;
        try {
            expr = options.syntax().parse(options.expression());
        }
        catch (ParseException e) {
            LOGGER.debug("cannot parse |{}|", options.expression(), e);
            err.println(e.getMessage());
            return PARSE_ERROR;
        }

        if (expr == null) {
            err.println("nothing to evaluate");
            return PARSE_ERROR;
        }

        print(expr, options, out);
        return 0;
    }

    private static void print(final Expr expr, final CalculatorOptions options, final PrintStream out) {
        double[] values = options.values().stream().mapToDouble(Double::doubleValue).toArray();

        out.println("value: " + expr.evaluate(values));
        out.println("prefix: " + expr.prefix());
        out.println("postfix: " + expr.postfix());

        String variable = options.diffVariable();
        if (variable != null) {
            Expr derivative = expr.diff(variable);
            out.println("d/d" + variable + ": " + derivative);
            out.println("d/d" + variable + " value: " + derivative.evaluate(values));
        }
    }
}
