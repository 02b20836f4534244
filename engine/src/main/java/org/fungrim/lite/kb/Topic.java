package org.fungrim.lite.kb;

import org.fungrim.lite.expr.Application;
import org.fungrim.lite.expr.Expr;
import org.fungrim.lite.expr.MalformedExprException;
import org.fungrim.lite.expr.TextAtom;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static org.fungrim.lite.expr.Builtins.*;

/**
 * A Topic(...) expression: a titled, sectioned listing of entry ids.
 */
public final class Topic {

    private final Application expr;

    public Topic(Application expr) {
        this.expr = Objects.requireNonNull(expr, "Topic expression cannot be null");
        if (!expr.hasHead(TOPIC)) {
            throw new MalformedExprException("Expected a Topic but got " + expr.head().toSourceString());
        }
        Entries.title(expr);
    }

    public String title() {
        return Entries.title(expr);
    }

    /**
     * @return All ids listed in Entries(...) children, in order
     */
    public List<String> entryIds() {
        List<String> ids = new ArrayList<>();
        for (Expr child : expr.args()) {
            if (child.hasHead(ENTRIES)) {
                for (Expr id : child.args()) {
                    ids.add(text(id));
                }
            }
        }
        return ids;
    }

    /**
     * @return Titles of the Section(...) children, in order
     */
    public List<String> sections() {
        List<String> sections = new ArrayList<>();
        for (Expr child : expr.args()) {
            if (child.hasHead(SECTION) && !child.args().isEmpty()) {
                sections.add(text(child.args().get(0)));
            }
        }
        return sections;
    }

    private static String text(Expr expr) {
        if (expr instanceof TextAtom t) {
            return t.value();
        }
        throw new MalformedExprException("Expected a text atom in topic but got " + expr.toSourceString());
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Topic that && expr.equals(that.expr));
    }

    @Override
    public int hashCode() {
        return expr.hashCode();
    }

    @Override
    public String toString() {
        return "Topic[" + title() + "]";
    }
}
