package org.fungrim.lite.symbol;

import org.fungrim.lite.expr.Symbol;

import java.util.Optional;

/**
 * Read access to symbol documentation, used by definition listings.
 */
@FunctionalInterface
public interface SymbolDescriptions {

    Optional<SymbolDescription> description(Symbol symbol);
}
