package org.fungrim.lite.symbol;

import org.fungrim.lite.expr.Symbol;

import java.util.Objects;

/**
 * Rendering metadata of one registered symbol.
 *
 * @param symbol                The canonical symbol
 * @param variable              true for bindable variables (x, alpha, ...)
 * @param kind                  The rendering class when the symbol is used as a head
 * @param infixSpelling         LaTeX operator joining the arguments, or null
 * @param subscriptCallSpelling LaTeX letter for F_{n}(x) rendering, or null
 * @param indexedForm           Subscripted-number spelling such as B_{n}, or null
 */
public record SymbolInfo(
        Symbol symbol,
        boolean variable,
        OperatorKind kind,
        String infixSpelling,
        String subscriptCallSpelling,
        IndexedForm indexedForm) {

    public SymbolInfo {
        Objects.requireNonNull(symbol, "Symbol cannot be null");
        Objects.requireNonNull(kind, "Kind cannot be null");
    }

    /**
     * A symbol rendered as letter_{arg0,arg1,...}.
     *
     * @param letter The LaTeX letter
     * @param arity  The number of subscript arguments
     */
    public record IndexedForm(String letter, int arity) {
    }
}
