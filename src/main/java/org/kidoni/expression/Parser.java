package org.kidoni.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.Character.isWhitespace;

/**
 * Parser for fully bracketed expressions in prefix or postfix notation.
 * <p>
 * Grammar (prefix; postfix puts {@code Operator} last inside the brackets instead):
 * <pre>
 *  Expression: WS* Token WS*
 *  Token: Operation | Variable | Integer
 *  Operation: '(' WS* Operator (WS* Token)+ WS* ')'
 *  Variable: 'x' | 'y' | 'z'
 *  Integer: '[+-]?[0-9]+'
 *  Operator: '+' | '-' | '*' | '/' | 'negate' | 'pow' | 'log' | 'mean' | 'var'
 *  WS: whitespace, optional next to a bracket
 * </pre>
 * A parser instance holds a cursor into its input and is used once.
 */
public class Parser {
    private static final Logger LOGGER = LoggerFactory.getLogger(Parser.class);

    private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");

    private final String input;
    private final Notation notation;
    private int position;

    public Parser(final String input, final Notation notation) {
        assert input != null;
        this.input = input;
        this.notation = notation;
    }

    public Expr parse() {
        LOGGER.debug("parsing {} expression |{}|", notation, input);

        skipWhitespace();
        Token token = parseToken();
        skipWhitespace();

        if (position < input.length()) {
            throw new InvalidFormatException("Expected end of expression", position);
        }
        if (token instanceof Token.Symbol symbol) {
            throw new InvalidFormatException("Invalid expression which contains only operation", symbol.position());
        }

        return ((Token.Operand) token).expr();
    }

    private Token parseToken() {
        if (position < input.length() && input.charAt(position) == '(') {
            return new Token.Operand(parseOperation());
        }

        int start = position;
        while (position < input.length() && isLiteralChar(input.charAt(position))) {
            position++;
        }
        String literal = input.substring(start, position);
        LOGGER.trace("token |{}| at {}", literal, start);

        if (literal.isEmpty()) {
            throw new InvalidFormatException("Empty token", start);
        }
        if (Expr.VARIABLES.contains(literal)) {
            return new Token.Operand(new Expr.Variable(literal));
        }
        if (INTEGER.matcher(literal).matches()) {
            return new Token.Operand(new Expr.Const(Double.parseDouble(literal)));
        }

        Optional<Operator> operator = Operator.forSymbol(literal);
        if (operator.isPresent()) {
            return new Token.Symbol(operator.get(), start);
        }

        throw new InvalidFormatException("Unknown token: " + literal, start);
    }

    private Expr parseOperation() {
        int start = position;
        List<Expr> operands = new ArrayList<>();
        List<Token.Symbol> symbols = new ArrayList<>();
        List<Integer> symbolIndexes = new ArrayList<>();

        position++;
        skipWhitespace();
        while (position < input.length() && input.charAt(position) != ')') {
            Token token = parseToken();
            if (token instanceof Token.Symbol symbol) {
                symbols.add(symbol);
                symbolIndexes.add(operands.size());
            }
            else {
                operands.add(((Token.Operand) token).expr());
            }
            skipWhitespace();
        }

        if (position >= input.length()) {
            throw new InvalidFormatException(") expected", position);
        }
        position++;

        if (symbols.size() != 1) {
            throw new InvalidOperationException("Invalid expression (expected one operation per (...) block "
                    + "but parsed " + symbols.size() + " operations)", start);
        }

        Operator operator = symbols.get(0).operator();
        if (symbolIndexes.get(0) != notation.operatorIndex(operands.size())) {
            throw new InvalidOperationException("Invalid operation position (operation: " + operator + ")", start);
        }
        if (!operator.accepts(operands.size())) {
            throw new InvalidOperationException(
                    "Invalid amount of arguments (" + operands.size() + ") for operation " + operator, start);
        }

        return operator.apply(operands);
    }

    private void skipWhitespace() {
        while (position < input.length() && isWhitespace(input.charAt(position))) {
            position++;
        }
    }

    private static boolean isLiteralChar(final char c) {
        return !isWhitespace(c) && c != '(' && c != ')';
    }
}
