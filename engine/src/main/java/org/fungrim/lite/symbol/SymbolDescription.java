package org.fungrim.lite.symbol;

import org.fungrim.lite.expr.Expr;
import org.fungrim.lite.expr.Symbol;

import java.util.List;
import java.util.Objects;

/**
 * Documentation attached to a symbol for definition listings.
 *
 * @param symbol          The described symbol
 * @param example         An example expression showing the notation
 * @param domain          Domain sets (may be empty)
 * @param codomain        Codomain set, or null
 * @param description     Short prose description
 * @param domainTable     ID of the entry holding the domain table, or null
 * @param longDescription A Description expression, or null
 */
public record SymbolDescription(
        Symbol symbol,
        Expr example,
        List<Expr> domain,
        Expr codomain,
        String description,
        String domainTable,
        Expr longDescription) {

    public SymbolDescription {
        Objects.requireNonNull(symbol, "Symbol cannot be null");
        Objects.requireNonNull(example, "Example cannot be null");
        Objects.requireNonNull(description, "Description cannot be null");
        domain = domain == null ? List.of() : List.copyOf(domain);
    }

    public static SymbolDescription of(Symbol symbol, Expr example, String description) {
        return new SymbolDescription(symbol, example, List.of(), null, description, null, null);
    }
}
