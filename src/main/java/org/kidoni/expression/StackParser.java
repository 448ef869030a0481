package org.kidoni.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lenient parser for unbracketed postfix input such as {@code "x 2 * 3 +"}.
 * <p>
 * Tokens are separated by whitespace and reduced on an operand stack. A fixed-arity operator takes
 * that many operands off the top of the stack; a variadic operator takes the whole stack. Tokens
 * that are not variables, integers or operators are skipped, as are operators that find too few
 * operands. No error is ever raised: malformed input yields whatever the stack holds.
 */
public class StackParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(StackParser.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");

    /**
     * @return the expression at the bottom of the stack, or {@code null} if no token produced one
     */
    public Expr parse(final String input) {
        List<Expr> stack = new ArrayList<>();

        for (String token : WHITESPACE.split(input.strip())) {
            Optional<Operator> operator = Operator.forSymbol(token);
            if (operator.isPresent()) {
                reduce(operator.get(), stack);
            }
            else if (Expr.VARIABLES.contains(token)) {
                stack.add(new Expr.Variable(token));
            }
            else if (INTEGER.matcher(token).matches()) {
                stack.add(new Expr.Const(Double.parseDouble(token)));
            }
            else if (!token.isEmpty()) {
                LOGGER.debug("skipping unknown token |{}|", token);
            }
        }

        if (stack.size() > 1) {
            LOGGER.debug("{} items left on the stack, returning the first", stack.size());
        }
        return stack.isEmpty() ? null : stack.get(0);
    }

    private static void reduce(final Operator operator, final List<Expr> stack) {
        int count = operator.isVariadic() ? stack.size() : operator.arity();
        if (count == 0 || count > stack.size()) {
            LOGGER.debug("skipping {}: {} operands on the stack", operator, stack.size());
            return;
        }

        List<Expr> top = stack.subList(stack.size() - count, stack.size());
        Expr.Operation operation = operator.apply(top);
        top.clear();
        stack.add(operation);
    }
}
