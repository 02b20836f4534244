package org.fungrim.lite.transpiler;

import org.fungrim.lite.expr.Application;
import org.fungrim.lite.expr.Expr;
import org.fungrim.lite.expr.IntegerAtom;

import static org.fungrim.lite.expr.Builtins.*;

/**
 * Shape predicates that drive parenthesization and plain-text shortcuts.
 */
public final class ExprShapes {

    private ExprShapes() {
        // Static utility class
    }

    /**
     * Whether a factor must be parenthesized inside a product: negative
     * integers and top-level sums or differences.
     *
     * Unary Pos/Neg factors are not parenthesized. That boundary is known to
     * be incomplete (-a b prints without parentheses) and is kept as is.
     */
    public static boolean needsParensInMul(Expr expr) {
        if (expr instanceof IntegerAtom i) {
            return i.signum() < 0;
        }
        return expr.hasHead(ADD, SUB);
    }

    /**
     * Whether Exp(x) should print as e^{x} rather than \exp(x).
     *
     * True for atoms and for trees built only from elementary arithmetic
     * (Pos, Neg, Add, Sub, Mul, Div, Pow, Abs, Sqrt). A division needs an
     * atomic denominator, and no division may occur beneath another one.
     */
    public static boolean showExponentialAsPower(Expr expr) {
        return showExponentialAsPower(expr, true);
    }

    private static boolean showExponentialAsPower(Expr expr, boolean allowDiv) {
        if (expr.isAtom()) {
            return true;
        }
        Application app = (Application) expr;
        if (app.hasHead(DIV)) {
            if (!allowDiv || app.arity() == 0 || !app.arg(app.arity() - 1).isAtom()) {
                return false;
            }
            allowDiv = false;
        }
        if (!app.hasHead(POS, NEG, ADD, SUB, MUL, DIV, POW, ABS, SQRT)) {
            return false;
        }
        for (Expr arg : app.args()) {
            if (!showExponentialAsPower(arg, allowDiv)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Whether an expression can be shown as plain HTML text instead of
     * typeset math: integers, decimals, integer ratios, and tuples or sets
     * whose elements all qualify. A container with a single non-qualifying
     * element is typeset as a whole.
     */
    public static boolean canRenderAsPlainText(Expr expr) {
        if (expr.isInteger()) {
            return true;
        }
        if (expr.hasHead(DECIMAL)) {
            return true;
        }
        if (isIntegerRatio(expr)) {
            return true;
        }
        if (expr.hasHead(TUPLE, SET)) {
            return expr.args().stream().allMatch(ExprShapes::canRenderAsPlainText);
        }
        return false;
    }

    static boolean isIntegerRatio(Expr expr) {
        return expr.hasHead(DIV) && expr.args().size() == 2
                && expr.args().get(0).isInteger() && expr.args().get(1).isInteger();
    }

    static boolean isNonNegativeInteger(Expr expr) {
        return expr instanceof IntegerAtom i && i.signum() >= 0;
    }
}
