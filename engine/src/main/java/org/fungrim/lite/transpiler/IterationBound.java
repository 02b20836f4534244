package org.fungrim.lite.transpiler;

import org.fungrim.lite.expr.Application;
import org.fungrim.lite.expr.Builtins;
import org.fungrim.lite.expr.Expr;
import org.fungrim.lite.expr.MalformedExprException;

/**
 * The bound of a big operator (sum, product, integral, extremum).
 *
 * Three shapes are accepted:
 * - Range: Tuple(n, a, b) as the bound argument, n running from a to b
 * - Over: a bare variable, n ranging over an implicit domain
 * - Such: a variable followed by a predicate, n ranging over P(n)
 */
public sealed interface IterationBound permits IterationBound.Range, IterationBound.Over, IterationBound.Such {

    Expr variable();

    record Range(Expr variable, Expr low, Expr high) implements IterationBound {
    }

    record Over(Expr variable) implements IterationBound {
    }

    record Such(Expr variable, Expr predicate) implements IterationBound {
    }

    /**
     * Reads the bound of op(f, bound...) where the bound starts at argument 1:
     * op(f, Tuple(n, a, b)), op(f, n) or op(f, n, P(n)).
     */
    static IterationBound of(Application app) {
        if (app.arity() == 2) {
            Expr bound = app.arg(1);
            if (bound.hasHead(Builtins.TUPLE)) {
                return range(app, bound);
            }
            return new Over(bound);
        }
        if (app.arity() == 3) {
            return new Such(app.arg(1), app.arg(2));
        }
        throw MalformedExprException.arity(app, "2 or 3");
    }

    /**
     * Reads a mandatory Tuple(n, a, b) range.
     */
    static Range range(Application owner, Expr tuple) {
        if (!tuple.hasHead(Builtins.TUPLE) || tuple.args().size() != 3) {
            throw new MalformedExprException(owner.head().toSourceString()
                    + " expects a Tuple(variable, low, high) bound but got " + tuple.toSourceString());
        }
        return new Range(tuple.args().get(0), tuple.args().get(1), tuple.args().get(2));
    }
}
