package org.fungrim.lite.kb;

import org.fungrim.lite.expr.Application;
import org.fungrim.lite.expr.Expr;
import org.fungrim.lite.expr.MalformedExprException;
import org.fungrim.lite.expr.Symbol;
import org.fungrim.lite.expr.TextAtom;
import org.fungrim.lite.source.SourceFormParser;
import org.fungrim.lite.symbol.SymbolDescription;
import org.fungrim.lite.symbol.SymbolDescriptions;
import org.fungrim.lite.symbol.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static org.fungrim.lite.expr.Builtins.*;

/**
 * A collection of entries, topics and symbol descriptions.
 *
 * Populated through a {@link Builder}, either programmatically or by loading
 * source documents, and read-only once built.
 */
public final class KnowledgeBase implements SymbolDescriptions {

    private static final Logger LOG = LoggerFactory.getLogger(KnowledgeBase.class);

    private final Map<String, Application> entries;
    private final List<Topic> topics;
    private final Map<Symbol, SymbolDescription> descriptions;

    private KnowledgeBase(Builder builder) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(builder.entries));
        this.topics = List.copyOf(builder.topics);
        this.descriptions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.descriptions));
    }

    public static Builder builder() {
        return new Builder(SymbolTable.standard());
    }

    public static Builder builder(SymbolTable symbols) {
        return new Builder(symbols);
    }

    // ==================== Lookup ====================

    public List<Application> entries() {
        return List.copyOf(entries.values());
    }

    public Optional<Application> entry(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    public List<Topic> topics() {
        return topics;
    }

    public Optional<Topic> topic(String title) {
        return topics.stream().filter(t -> t.title().equals(title)).findFirst();
    }

    /**
     * @return Described symbols in the order they were first described
     */
    public List<Symbol> describedSymbols() {
        return List.copyOf(descriptions.keySet());
    }

    @Override
    public Optional<SymbolDescription> description(Symbol symbol) {
        return Optional.ofNullable(descriptions.get(symbol));
    }

    public Optional<Expr> longDescription(Symbol symbol) {
        return description(symbol).map(SymbolDescription::longDescription);
    }

    public Optional<String> domainTable(Symbol symbol) {
        return description(symbol).map(SymbolDescription::domainTable);
    }

    // ==================== Builder ====================

    public static final class Builder {

        private final SymbolTable symbols;
        private final Map<String, Application> entries = new LinkedHashMap<>();
        private final List<Topic> topics = new ArrayList<>();
        private final Map<Symbol, SymbolDescription> descriptions = new LinkedHashMap<>();

        private Builder(SymbolTable symbols) {
            this.symbols = Objects.requireNonNull(symbols, "Symbol table cannot be null");
        }

        /**
         * Builds and registers Entry(args...). A SymbolDefinition child
         * describes its symbol, with this entry as the domain table.
         *
         * @throws MalformedExprException if the entry has no ID(text)
         * @throws IllegalStateException  if the id is already registered
         */
        public Application makeEntry(Object... args) {
            Application entry = ENTRY.call(args);
            String id = Entries.id(entry);
            if (entries.containsKey(id)) {
                throw new IllegalStateException("Duplicate entry id: " + id);
            }
            entry.argWithHead(SYMBOL_DEFINITION).ifPresent(definition -> {
                if (definition.arity() != 3 || !(definition.arg(0) instanceof Symbol symbol)
                        || !(definition.arg(2) instanceof TextAtom text)) {
                    throw new MalformedExprException("SymbolDefinition expects (symbol, example, text) but got "
                            + definition.toSourceString());
                }
                SymbolDescription previous = descriptions.get(symbol);
                put(new SymbolDescription(symbol, definition.arg(1), List.of(), null, text.value(), id,
                        previous == null ? null : previous.longDescription()));
            });
            entries.put(id, entry);
            LOG.debug("Registered entry {}", id);
            return entry;
        }

        /**
         * Builds and registers Topic(args...).
         *
         * @throws MalformedExprException if the topic has no Title(text)
         */
        public Topic defineTopic(Object... args) {
            Topic topic = new Topic(TOPIC.call(args));
            topics.add(topic);
            LOG.debug("Registered topic '{}' with {} entries", topic.title(), topic.entryIds().size());
            return topic;
        }

        public Builder describe(Symbol symbol, Expr example, List<Expr> domain, Expr codomain, String description) {
            SymbolDescription previous = descriptions.get(symbol);
            put(new SymbolDescription(symbol, example, domain, codomain, description,
                    previous == null ? null : previous.domainTable(),
                    previous == null ? null : previous.longDescription()));
            return this;
        }

        /**
         * Describes a symbol without domain sets. A null domain table or long
         * description keeps whatever an earlier description of the symbol set.
         *
         * @param domainTable     Id of the entry holding the domain table, or null
         * @param longDescription A Description(...) expression, or null
         */
        public Builder describe(Symbol symbol, Expr example, String description, String domainTable, Expr longDescription) {
            SymbolDescription previous = descriptions.get(symbol);
            if (previous != null) {
                if (domainTable == null) {
                    domainTable = previous.domainTable();
                }
                if (longDescription == null) {
                    longDescription = previous.longDescription();
                }
            }
            put(new SymbolDescription(symbol, example, List.of(), null, description, domainTable, longDescription));
            return this;
        }

        private void put(SymbolDescription description) {
            descriptions.put(description.symbol(), description);
            LOG.debug("Described symbol {}", description.symbol());
        }

        /**
         * Registers every top-level Entry and Topic of a source document.
         *
         * @throws MalformedExprException if a top-level expression is neither
         */
        public Builder load(String sourceText) {
            for (Expr expr : SourceFormParser.parseDocument(sourceText, symbols)) {
                if (expr.hasHead(ENTRY)) {
                    makeEntry(expr.args().toArray());
                } else if (expr.hasHead(TOPIC)) {
                    defineTopic(expr.args().toArray());
                } else {
                    throw new MalformedExprException("Expected Entry or Topic at top level but got "
                            + expr.toSourceString());
                }
            }
            return this;
        }

        public KnowledgeBase build() {
            KnowledgeBase kb = new KnowledgeBase(this);
            LOG.debug("Knowledge base built: {} entries, {} topics, {} described symbols",
                    entries.size(), topics.size(), descriptions.size());
            return kb;
        }
    }
}
