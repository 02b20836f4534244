package org.fungrim.lite.transpiler;

import org.fungrim.lite.expr.Expr;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memo table of rendered LaTeX keyed by (expression, inSmall).
 *
 * Expressions are immutable and rendering is a pure function of them, so
 * entries are never invalidated. Each {@link LatexGenerator} owns one cache;
 * sharing a single generator gives process-wide memoization.
 * Rendering recurses into the cache, so lookups and stores are separate calls
 * rather than a computeIfAbsent.
 */
final class LatexCache {

    private final Map<Expr, String> normal = new ConcurrentHashMap<>();
    private final Map<Expr, String> small = new ConcurrentHashMap<>();

    String get(Expr expr, boolean inSmall) {
        return (inSmall ? small : normal).get(expr);
    }

    void put(Expr expr, boolean inSmall, String latex) {
        (inSmall ? small : normal).putIfAbsent(expr, latex);
    }

    int size() {
        return normal.size() + small.size();
    }
}
