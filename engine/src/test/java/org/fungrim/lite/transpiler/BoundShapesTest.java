package org.fungrim.lite.transpiler;

import org.fungrim.lite.expr.IntegerAtom;
import org.fungrim.lite.expr.MalformedExprException;
import org.fungrim.lite.expr.Symbol;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.fungrim.lite.expr.Builtins.*;
import static org.junit.jupiter.api.Assertions.*;

class BoundShapesTest {

    private static final Symbol f = Symbol.of("f");
    private static final Symbol n = Symbol.of("n");
    private static final Symbol x = Symbol.of("x");

    // ==================== Iteration bounds ====================

    @Test
    @DisplayName("A Tuple second argument is a range bound")
    void testRangeBound() {
        // WHEN: A sum ranges over Tuple(n, 1, x)
        IterationBound bound = IterationBound.of(SUM.call(f.call(n), TUPLE.call(n, 1, x)));

        // THEN: It is a Range with both ends
        assertEquals(new IterationBound.Range(n, IntegerAtom.of(1), x), bound);
    }

    @Test
    @DisplayName("A bare variable is an Over bound, a variable plus predicate a Such bound")
    void testOverAndSuchBounds() {
        // WHEN: Sums over a bare variable and over a predicate
        IterationBound over = IterationBound.of(SUM.call(f.call(n), n));
        IterationBound such = IterationBound.of(SUM.call(f.call(n), n, ODD.call(n)));

        // THEN: Each shape maps to its own variant
        assertEquals(new IterationBound.Over(n), over);
        assertEquals(new IterationBound.Such(n, ODD.call(n)), such);
    }

    @Test
    @DisplayName("An iteration with no bound is malformed")
    void testMissingBound() {
        // THEN: A lone summand is rejected
        assertThrows(MalformedExprException.class, () -> IterationBound.of(SUM.call(f.call(n))));
    }

    // ==================== Derivatives ====================

    @Test
    @DisplayName("Tuple derivative specs carry the point and a small order")
    void testTupleDerivative() {
        // WHEN: A third derivative at 0
        DerivativeSpec spec = DerivativeSpec.of(DERIVATIVE.call(f.call(x), TUPLE.call(x, 0, 3)));

        // THEN: The order is small and the point differs from the variable
        assertEquals(3, spec.smallOrder());
        assertFalse(spec.evaluatedAtVariable());
    }

    @Test
    @DisplayName("Flat derivative specs default to first order")
    void testFlatDerivative() {
        // WHEN: Derivatives written as (f, x, x) and (f, x, x, n)
        DerivativeSpec firstOrder = DerivativeSpec.of(DERIVATIVE.call(f.call(x), x, x));
        DerivativeSpec symbolicOrder = DerivativeSpec.of(DERIVATIVE.call(f.call(x), x, x, n));

        // THEN: The first is order 1 at the variable; a symbolic order is not small
        assertEquals(IntegerAtom.of(1), firstOrder.order());
        assertTrue(firstOrder.evaluatedAtVariable());
        assertEquals(-1, symbolicOrder.smallOrder());
    }

    @Test
    @DisplayName("A derivative without a point is malformed")
    void testMissingPoint() {
        // THEN: Derivative(f(x), x) is rejected
        assertThrows(MalformedExprException.class, () -> DerivativeSpec.of(DERIVATIVE.call(f.call(x), x)));
    }
}
