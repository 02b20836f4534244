package org.fungrim.lite.transpiler;

import org.fungrim.lite.expr.IntegerAtom;
import org.fungrim.lite.expr.Symbol;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.fungrim.lite.expr.Builtins.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Expression shape predicates")
class ExprShapesTest {

    private static final Symbol a = Symbol.of("a");
    private static final Symbol b = Symbol.of("b");
    private static final Symbol x = Symbol.of("x");

    @Nested
    @DisplayName("needsParensInMul")
    class NeedsParensInMul {

        @Test
        @DisplayName("Negative integers are parenthesized, positive ones are not")
        void negativeIntegers() {
            // THEN: Only the sign decides for integer atoms
            assertTrue(ExprShapes.needsParensInMul(IntegerAtom.of(-5)));
            assertFalse(ExprShapes.needsParensInMul(IntegerAtom.of(5)));
        }

        @Test
        @DisplayName("Sums and differences are parenthesized, products are not")
        void sumsAndDifferences() {
            // THEN: Add and Sub need parentheses inside a product
            assertTrue(ExprShapes.needsParensInMul(ADD.call(a, b)));
            assertTrue(ExprShapes.needsParensInMul(SUB.call(a, b)));
            assertFalse(ExprShapes.needsParensInMul(MUL.call(a, b)));
        }

        @Test
        @DisplayName("Unary negation is not parenthesized")
        void unaryNegation() {
            // THEN: Neg(a) is left bare
            assertFalse(ExprShapes.needsParensInMul(NEG.call(a)));
        }
    }

    @Nested
    @DisplayName("showExponentialAsPower")
    class ShowExponentialAsPower {

        @Test
        @DisplayName("Atoms and elementary arithmetic print as a power of e")
        void atomsAndArithmetic() {
            // THEN: x, -(2 x^2) and sqrt(|x|) all qualify
            assertTrue(ExprShapes.showExponentialAsPower(x));
            assertTrue(ExprShapes.showExponentialAsPower(MUL.call(2, POW.call(x, 2)).neg()));
            assertTrue(ExprShapes.showExponentialAsPower(SQRT.call(ABS.call(x))));
        }

        @Test
        @DisplayName("Other heads fall back to exp")
        void otherHeadsFallBackToExp() {
            // THEN: A function call anywhere in the exponent disqualifies it
            assertFalse(ExprShapes.showExponentialAsPower(SIN.call(x)));
            assertFalse(ExprShapes.showExponentialAsPower(ADD.call(x, LOG.call(x))));
        }

        @Test
        @DisplayName("A division needs an atomic denominator and no division beneath it")
        void divisions() {
            // THEN: (x+1)/2 qualifies; 1/(x+1) and (1/2)/3 do not
            assertTrue(ExprShapes.showExponentialAsPower(DIV.call(ADD.call(x, 1), 2)));
            assertFalse(ExprShapes.showExponentialAsPower(DIV.call(1, ADD.call(x, 1))));
            assertFalse(ExprShapes.showExponentialAsPower(DIV.call(DIV.call(1, 2), 3)));
            assertTrue(ExprShapes.showExponentialAsPower(MUL.call(DIV.call(1, 2), DIV.call(x, 3))));
        }
    }

    @Nested
    @DisplayName("canRenderAsPlainText")
    class CanRenderAsPlainText {

        @Test
        @DisplayName("Integers, decimals and integer ratios qualify")
        void numericShapes() {
            // THEN: Symbolic ratios do not
            assertTrue(ExprShapes.canRenderAsPlainText(IntegerAtom.of(3)));
            assertTrue(ExprShapes.canRenderAsPlainText(DECIMAL.call("2.5")));
            assertTrue(ExprShapes.canRenderAsPlainText(DIV.call(3, 4)));
            assertFalse(ExprShapes.canRenderAsPlainText(DIV.call(x, 4)));
        }

        @Test
        @DisplayName("Containers qualify only when every element does")
        void containersAreAllOrNothing() {
            // THEN: One symbolic element disqualifies the whole tuple
            assertTrue(ExprShapes.canRenderAsPlainText(SET.call(1, DECIMAL.call("2.5"), DIV.call(1, 2))));
            assertFalse(ExprShapes.canRenderAsPlainText(TUPLE.call(1, x)));
        }
    }
}
