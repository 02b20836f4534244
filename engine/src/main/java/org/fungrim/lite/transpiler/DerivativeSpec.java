package org.fungrim.lite.transpiler;

import org.fungrim.lite.expr.Application;
import org.fungrim.lite.expr.Builtins;
import org.fungrim.lite.expr.Expr;
import org.fungrim.lite.expr.IntegerAtom;
import org.fungrim.lite.expr.MalformedExprException;

/**
 * A derivative of {@code function} with respect to {@code variable}, of the
 * given order, evaluated at {@code point}.
 *
 * Accepted argument shapes:
 * - D(f, Tuple(x, point, order))
 * - D(f, x, point)            (order 1)
 * - D(f, x, point, order)
 */
record DerivativeSpec(Expr function, Expr variable, Expr point, Expr order) {

    static DerivativeSpec of(Application app) {
        switch (app.arity()) {
            case 2 -> {
                Expr spec = app.arg(1);
                if (!spec.hasHead(Builtins.TUPLE) || spec.args().size() != 3) {
                    throw new MalformedExprException(app.head().toSourceString()
                            + " expects a Tuple(variable, point, order) but got " + spec.toSourceString());
                }
                return new DerivativeSpec(app.arg(0), spec.args().get(0), spec.args().get(1), spec.args().get(2));
            }
            case 3 -> {
                return new DerivativeSpec(app.arg(0), app.arg(1), app.arg(2), IntegerAtom.of(1));
            }
            case 4 -> {
                return new DerivativeSpec(app.arg(0), app.arg(1), app.arg(2), app.arg(3));
            }
            default -> throw MalformedExprException.arity(app, "2, 3 or 4");
        }
    }

    /**
     * @return The order when it is an integer in [0, 3], else -1
     */
    int smallOrder() {
        if (order instanceof IntegerAtom i && i.between(0, 3)) {
            return i.value().intValue();
        }
        return -1;
    }

    boolean evaluatedAtVariable() {
        return variable.equals(point);
    }
}
