package org.kidoni.expression;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.kidoni.expression.Expressions.parsePostfix;
import static org.kidoni.expression.Expressions.parsePrefix;

class ParserTest {
    private static final Expr X = new Expr.Variable("x");
    private static final Expr Y = new Expr.Variable("y");

    @Test
    void parseLeaves() {
        assertEquals(X, parsePrefix("x"));
        assertEquals(new Expr.Const(42), parsePrefix(" 42 "));
        assertEquals(new Expr.Const(-7), parsePostfix("-7"));
        assertEquals(new Expr.Const(3), parsePostfix("+3"));
    }

    @Test
    void parseSimplePrefixExpression() {
        var expression = parsePrefix("(+ x 1)");

        var operation = assertInstanceOf(Expr.Operation.class, expression);
        assertEquals(Operator.ADD, operation.operator());
        assertEquals(List.of(X, new Expr.Const(1)), operation.operands());
        assertEquals(6, expression.evaluate(5, 0, 0));
    }

    @Test
    void parseSimplePostfixExpression() {
        var expression = parsePostfix("(x y *)");

        var operation = assertInstanceOf(Expr.Operation.class, expression);
        assertEquals(Operator.MULTIPLY, operation.operator());
        assertEquals(List.of(X, Y), operation.operands());
        assertEquals(6, expression.evaluate(2, 3, 0));
    }

    @Test
    void parseNestedExpression() {
        var expected = Operator.ADD.apply(X, Operator.MULTIPLY.apply(new Expr.Const(2), Y));

        assertEquals(expected, parsePrefix("(+ x (* 2 y))"));
        assertEquals(expected, parsePostfix("(x (2 y *) +)"));
    }

    @Test
    void whitespaceIsOptionalNextToBrackets() {
        var expected = parsePrefix("(+ x (* 2 y))");

        assertEquals(expected, parsePrefix("(+ x(* 2 y))"));
        assertEquals(expected, parsePrefix("  (  +   x\t(*\n2 y )  )  "));
        assertEquals(parsePostfix("(x (2 y *) +)"), parsePostfix("(x(2 y *)+)"));
    }

    @Test
    void parseVariadicOperations() {
        assertEquals(2.5, parsePostfix("(2 3 mean)").evaluate(0, 0, 0));
        assertEquals(5, parsePrefix("(mean x)").evaluate(5, 0, 0));
        assertEquals(14, parsePrefix("(var 2 5 11)").evaluate(0, 0, 0));
        assertEquals(4, parsePostfix("(x y z 4 mean)").evaluate(1, 4, 7));
    }

    @Test
    void parseUnaryOperation() {
        assertEquals(-3, parsePrefix("(negate (+ x 1))").evaluate(2, 0, 0));
        assertEquals(-3, parsePostfix("((x 1 +) negate)").evaluate(2, 0, 0));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "x",
            "-5",
            "(+ x 1)",
            "(negate (- x y))",
            "(pow (log 2 z) (/ x 3))",
            "(mean x y z (* 2 x) -1)",
            "(var (mean x) (negate y) 10)",
            "(+ x 1000000000000000)",
            "(* y -123456789012345678901)",
    })
    void prefixIsStableUnderReparse(final String input) {
        var prefix = parsePrefix(input).prefix();

        assertEquals(prefix, parsePrefix(prefix).prefix());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "y",
            "(x 1 +)",
            "((x y -) negate)",
            "((2 z log) (x 3 /) pow)",
            "(x y z (2 x *) -1 mean)",
            "(x 20000000000000000 *)",
    })
    void postfixIsStableUnderReparse(final String input) {
        var postfix = parsePostfix(input).postfix();

        assertEquals(postfix, parsePostfix(postfix).postfix());
    }

    @Test
    void largeIntegersRenderWithoutExponent() {
        assertEquals("(+ x 1000000000000000)", parsePrefix("(+ x 1000000000000000)").prefix());
        assertEquals("(x 20000000000000000 *)", parsePostfix("(x 20000000000000000 *)").postfix());
    }

    @Test
    void toStringIgnoresNotation() {
        assertEquals("x 2 y * +", parsePrefix("(+ x (* 2 y))").toString());
        assertEquals("x 2 y * +", parsePostfix("(x (2 y *) +)").toString());
    }

    @Test
    void missingClosingBracket() {
        var e = assertThrows(InvalidFormatException.class, () -> parsePrefix("(+ x y"));
        assertEquals(6, e.getPosition().orElseThrow());
        assertEquals(") expected at pos 6", e.getMessage());

        e = assertThrows(InvalidFormatException.class, () -> parsePrefix("(+ x (* y z)"));
        assertEquals(12, e.getPosition().orElseThrow());
    }

    @Test
    void emptyInput() {
        var e = assertThrows(InvalidFormatException.class, () -> parsePrefix(""));
        assertEquals(0, e.getPosition().orElseThrow());

        e = assertThrows(InvalidFormatException.class, () -> parsePostfix("   "));
        assertEquals("Empty token at pos 3", e.getMessage());
    }

    @Test
    void unknownToken() {
        var e = assertThrows(InvalidFormatException.class, () -> parsePrefix("(+ x w)"));
        assertEquals("Unknown token: w at pos 5", e.getMessage());

        e = assertThrows(InvalidFormatException.class, () -> parsePrefix("(+ 2.5 x)"));
        assertEquals(3, e.getPosition().orElseThrow());

        e = assertThrows(InvalidFormatException.class, () -> parsePrefix("(+x 1)"));
        assertEquals("Unknown token: +x at pos 1", e.getMessage());
    }

    @Test
    void trailingInput() {
        var e = assertThrows(InvalidFormatException.class, () -> parsePrefix("(+ x y) z"));
        assertEquals("Expected end of expression at pos 8", e.getMessage());

        assertThrows(InvalidFormatException.class, () -> parsePrefix("x)"));
    }

    @Test
    void operatorWithoutBrackets() {
        var e = assertThrows(InvalidFormatException.class, () -> parsePrefix(" +"));
        assertEquals(1, e.getPosition().orElseThrow());
    }

    @Test
    void wrongArgumentCount() {
        var e = assertThrows(InvalidOperationException.class, () -> parsePrefix("(+ x)"));
        assertEquals("Invalid amount of arguments (1) for operation + at pos 0", e.getMessage());

        assertThrows(InvalidOperationException.class, () -> parsePrefix("(negate x y)"));
        assertThrows(InvalidOperationException.class, () -> parsePostfix("(x y z pow)"));
        assertThrows(InvalidOperationException.class, () -> parsePrefix("(negate)"));
        assertThrows(InvalidOperationException.class, () -> parsePostfix("(mean)"));
    }

    @Test
    void wrongOperatorPosition() {
        var e = assertThrows(InvalidOperationException.class, () -> parsePrefix("(x + y)"));
        assertEquals("Invalid operation position (operation: +) at pos 0", e.getMessage());

        assertThrows(InvalidOperationException.class, () -> parsePrefix("(x y +)"));
        assertThrows(InvalidOperationException.class, () -> parsePostfix("(+ x y)"));
        assertThrows(InvalidOperationException.class, () -> parsePostfix("(x + y)"));
    }

    @Test
    void oneOperatorPerGroup() {
        var e = assertThrows(InvalidOperationException.class, () -> parsePrefix("(+ - x y)"));
        assertEquals("Invalid expression (expected one operation per (...) block but parsed 2 operations) at pos 0",
                e.getMessage());

        e = assertThrows(InvalidOperationException.class, () -> parsePrefix("(+ x (y))"));
        assertEquals(5, e.getPosition().orElseThrow());

        assertThrows(InvalidOperationException.class, () -> parsePostfix("()"));
    }

    @Test
    void parseErrorsShareABaseType() {
        assertInstanceOf(ParseException.class, assertThrows(InvalidFormatException.class, () -> parsePrefix("(")));
        assertInstanceOf(ParseException.class, assertThrows(InvalidOperationException.class, () -> parsePrefix("(x)")));
    }
}
