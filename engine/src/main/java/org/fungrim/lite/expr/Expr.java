package org.fungrim.lite.expr;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Sealed interface representing a symbolic expression.
 *
 * An expression is either an atom or a function application:
 * - Symbol: a named atom (ConstPi, x, GammaFunction, ...)
 * - IntegerAtom: an arbitrary-precision integer
 * - TextAtom: an opaque string (prose, file paths, identifiers)
 * - Application: head(arg0, arg1, ...), where the head is itself an expression
 *
 * Expressions are immutable. Equality and hashing are structural, so any
 * expression can be used as a map key and results computed from it can be
 * cached for the life of the process.
 *
 * The arithmetic methods (plus, times, ...) only build trees with the
 * canonical operator symbols as heads; nothing is ever evaluated.
 */
public sealed interface Expr permits Symbol, IntegerAtom, TextAtom, Application {

    /**
     * Accept method for the expression visitor pattern.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this expression
     */
    <T> T accept(ExprVisitor<T> visitor);

    // ==================== Coercion ====================

    /**
     * Coerces a raw value into an expression.
     * An Expr passes through unchanged, integral numbers become IntegerAtom
     * and strings become TextAtom.
     *
     * @param value The value to coerce
     * @return The corresponding expression
     * @throws IllegalArgumentException if the value has no expression form
     */
    static Expr of(Object value) {
        if (value instanceof Expr e) {
            return e;
        }
        if (value instanceof BigInteger b) {
            return new IntegerAtom(b);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return IntegerAtom.of(((Number) value).longValue());
        }
        if (value instanceof String s) {
            return new TextAtom(s);
        }
        throw new IllegalArgumentException(
                "Cannot build an expression from " + (value == null ? "null" : value.getClass().getName()));
    }

    /**
     * Builds the application head(args...).
     */
    static Application apply(Object head, Object... args) {
        List<Expr> parts = new ArrayList<>(args.length + 1);
        parts.add(of(head));
        for (Object arg : args) {
            parts.add(of(arg));
        }
        return new Application(parts);
    }

    // ==================== Structure ====================

    default boolean isAtom() {
        return !(this instanceof Application);
    }

    default boolean isSymbol() {
        return this instanceof Symbol;
    }

    default boolean isInteger() {
        return this instanceof IntegerAtom;
    }

    default boolean isText() {
        return this instanceof TextAtom;
    }

    /**
     * @return The head of an application, or null for an atom
     */
    default Expr head() {
        return null;
    }

    /**
     * @return The arguments of an application, or null for an atom
     */
    default List<Expr> args() {
        return null;
    }

    /**
     * @return true if this is an application whose head is one of the given heads
     */
    default boolean hasHead(Expr... heads) {
        return false;
    }

    /**
     * Returns the first argument that is an application with the given head.
     * Atoms have no arguments and always return empty.
     */
    default Optional<Application> argWithHead(Expr head) {
        return Optional.empty();
    }

    /**
     * Applies this expression, as a head, to the given arguments.
     */
    default Application call(Object... args) {
        return apply(this, args);
    }

    // ==================== Arithmetic construction ====================

    default Application plus(Object other) {
        return apply(Builtins.ADD, this, of(other));
    }

    default Application minus(Object other) {
        return apply(Builtins.SUB, this, of(other));
    }

    default Application times(Object other) {
        return apply(Builtins.MUL, this, of(other));
    }

    default Application dividedBy(Object other) {
        return apply(Builtins.DIV, this, of(other));
    }

    default Application pow(Object other) {
        return apply(Builtins.POW, this, of(other));
    }

    default Application pos() {
        return apply(Builtins.POS, this);
    }

    default Application neg() {
        return apply(Builtins.NEG, this);
    }

    default Application abs() {
        return apply(Builtins.ABS, this);
    }

    // ==================== Traversal ====================

    /**
     * Returns all symbol leaves in depth-first, left-to-right order with
     * duplicates removed, keeping the first occurrence of each.
     */
    default List<Symbol> allSymbols() {
        LinkedHashSet<Symbol> seen = new LinkedHashSet<>();
        collectSymbols(this, seen);
        return List.copyOf(seen);
    }

    private static void collectSymbols(Expr expr, LinkedHashSet<Symbol> into) {
        if (expr instanceof Symbol s) {
            into.add(s);
        } else if (expr instanceof Application app) {
            for (Expr part : app.parts()) {
                collectSymbols(part, into);
            }
        }
    }

    /**
     * Canonical source-syntax form: symbols bare, integers in decimal, text
     * double-quoted, applications as head(arg, arg, ...).
     */
    default String toSourceString() {
        return accept(SourceFormWriter.INSTANCE);
    }
}
