package org.fungrim.lite.expr;

/**
 * Visitor interface for traversing expression trees.
 *
 * @param <T> The return type of the visitor methods
 */
public interface ExprVisitor<T> {

    T visitSymbol(Symbol symbol);

    T visitInteger(IntegerAtom integer);

    T visitText(TextAtom text);

    /**
     * Visit a function application. Implementations decide whether and how
     * to recurse into the head and arguments.
     */
    T visitApplication(Application application);
}
