package org.fungrim.lite.expr;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * A named atom. Two symbols are equal iff their names are equal; {@link #of}
 * additionally shares one instance per name.
 *
 * @param name The symbol name, matched exactly (no namespacing)
 */
public record Symbol(String name) implements Expr {

    private static final Map<String, Symbol> internCache = new ConcurrentHashMap<>(1024);

    public Symbol {
        requireNonNull(name, "Symbol name cannot be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Symbol name cannot be empty");
        }
    }

    public static Symbol of(String name) {
        return internCache.computeIfAbsent(name, Symbol::new);
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitSymbol(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
