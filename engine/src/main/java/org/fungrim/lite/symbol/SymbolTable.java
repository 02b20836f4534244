package org.fungrim.lite.symbol;

import org.fungrim.lite.expr.Expr;
import org.fungrim.lite.expr.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of symbols and their rendering metadata.
 *
 * A table is populated once through its {@link Builder} and is read-only
 * afterwards, so renderers can share it freely. Lookup is by exact name.
 * Symbols that were never registered still render, through the generic
 * operator-name spelling.
 */
public final class SymbolTable {

    private static final Logger LOG = LoggerFactory.getLogger(SymbolTable.class);

    private final Map<String, SymbolInfo> byName;
    private final Map<Expr, String> latexOverrides;
    private final Set<Symbol> excludedFromDefinitions;

    private SymbolTable(Builder builder) {
        Map<String, SymbolInfo> infos = new LinkedHashMap<>();
        for (Map.Entry<String, Boolean> e : builder.names.entrySet()) {
            String name = e.getKey();
            Symbol symbol = Symbol.of(name);
            infos.put(name, new SymbolInfo(
                    symbol,
                    e.getValue(),
                    resolveKind(builder, symbol),
                    builder.infix.get(symbol),
                    builder.subscriptCall.get(symbol),
                    builder.indexed.get(symbol)));
        }
        this.byName = Collections.unmodifiableMap(infos);
        this.latexOverrides = Map.copyOf(builder.latex);
        this.excludedFromDefinitions = Set.copyOf(builder.excluded);
    }

    private static OperatorKind resolveKind(Builder builder, Symbol symbol) {
        if (builder.infix.containsKey(symbol)) {
            return OperatorKind.INFIX;
        }
        if (builder.subscriptCall.containsKey(symbol)) {
            return OperatorKind.SUBSCRIPT_CALL;
        }
        return OperatorKind.forName(symbol.name());
    }

    /**
     * @return The shared table holding the standard builtins and variables
     */
    public static SymbolTable standard() {
        return StandardHolder.INSTANCE;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Lookup ====================

    /**
     * Returns the canonical symbol registered under a name.
     *
     * @throws IllegalArgumentException if nothing is registered under the name
     */
    public Symbol symbol(String name) {
        SymbolInfo info = byName.get(name);
        if (info == null) {
            throw new IllegalArgumentException("Symbol not registered: " + name);
        }
        return info.symbol();
    }

    public Optional<Symbol> find(String name) {
        return Optional.ofNullable(byName.get(name)).map(SymbolInfo::symbol);
    }

    public Optional<SymbolInfo> info(Expr expr) {
        if (expr instanceof Symbol s) {
            return Optional.ofNullable(byName.get(s.name()));
        }
        return Optional.empty();
    }

    public boolean isRegistered(Expr expr) {
        return info(expr).isPresent();
    }

    public boolean isVariable(Expr expr) {
        return info(expr).map(SymbolInfo::variable).orElse(false);
    }

    /**
     * @return The rendering class of a head; GENERIC for unregistered symbols and non-symbol heads
     */
    public OperatorKind kind(Expr head) {
        return info(head).map(SymbolInfo::kind).orElse(OperatorKind.GENERIC);
    }

    /**
     * @return The fixed LaTeX spelling of a whole expression, or null
     */
    public String latexOverride(Expr expr) {
        return latexOverrides.get(expr);
    }

    public String infixSpelling(Expr head) {
        return info(head).map(SymbolInfo::infixSpelling).orElse(null);
    }

    public String subscriptCallSpelling(Expr head) {
        return info(head).map(SymbolInfo::subscriptCallSpelling).orElse(null);
    }

    public SymbolInfo.IndexedForm indexedForm(Expr head) {
        return info(head).map(SymbolInfo::indexedForm).orElse(null);
    }

    /**
     * Core logical and set symbols are left out of per-entry definition listings.
     */
    public boolean isExcludedFromDefinitions(Symbol symbol) {
        return excludedFromDefinitions.contains(symbol);
    }

    public List<Symbol> builtins() {
        return byName.values().stream().filter(i -> !i.variable()).map(SymbolInfo::symbol).toList();
    }

    public List<Symbol> variables() {
        return byName.values().stream().filter(SymbolInfo::variable).map(SymbolInfo::symbol).toList();
    }

    public int size() {
        return byName.size();
    }

    // ==================== Builder ====================

    /**
     * Collects registrations. Registering a name twice is harmless; the same
     * name always denotes the same symbol.
     */
    public static final class Builder {

        private final Map<String, Boolean> names = new LinkedHashMap<>();
        private final Map<Expr, String> latex = new HashMap<>();
        private final Map<Symbol, String> infix = new HashMap<>();
        private final Map<Symbol, String> subscriptCall = new HashMap<>();
        private final Map<Symbol, SymbolInfo.IndexedForm> indexed = new HashMap<>();
        private final Set<Symbol> excluded = new LinkedHashSet<>();

        private Builder() {
        }

        /**
         * Registers whitespace-separated builtin names.
         */
        public Builder registerBuiltins(String names) {
            for (String name : split(names)) {
                this.names.putIfAbsent(name, false);
            }
            return this;
        }

        public Builder registerBuiltins(Collection<Symbol> symbols) {
            for (Symbol symbol : symbols) {
                names.putIfAbsent(symbol.name(), false);
            }
            return this;
        }

        /**
         * Registers whitespace-separated names as bindable variables.
         */
        public Builder registerVariables(String names) {
            for (String name : split(names)) {
                this.names.put(name, true);
            }
            return this;
        }

        public Builder latex(Expr expr, String spelling) {
            latex.put(expr, spelling);
            return this;
        }

        public Builder infix(Symbol symbol, String spelling) {
            names.putIfAbsent(symbol.name(), false);
            infix.put(symbol, spelling);
            return this;
        }

        public Builder subscriptCall(Symbol symbol, String spelling) {
            names.putIfAbsent(symbol.name(), false);
            subscriptCall.put(symbol, spelling);
            return this;
        }

        public Builder indexed(Symbol symbol, String letter, int arity) {
            names.putIfAbsent(symbol.name(), false);
            indexed.put(symbol, new SymbolInfo.IndexedForm(letter, arity));
            return this;
        }

        public Builder excludeFromDefinitions(Symbol... symbols) {
            excluded.addAll(List.of(symbols));
            return this;
        }

        public SymbolTable build() {
            SymbolTable table = new SymbolTable(this);
            LOG.debug("Symbol table built: {} symbols ({} variables), {} infix, {} subscript-call, {} fixed spellings",
                    table.size(), table.variables().size(), infix.size(), subscriptCall.size(), latex.size());
            return table;
        }

        private static List<String> split(String names) {
            List<String> result = new ArrayList<>();
            for (String name : names.trim().split("\\s+")) {
                if (!name.isEmpty()) {
                    result.add(name);
                }
            }
            return result;
        }
    }

    private static final class StandardHolder {
        private static final SymbolTable INSTANCE = StandardSymbols.install(builder()).build();
    }
}
