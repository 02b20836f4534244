package org.fungrim.lite.kb;

import org.fungrim.lite.expr.Application;
import org.fungrim.lite.expr.Expr;
import org.fungrim.lite.expr.MalformedExprException;
import org.fungrim.lite.expr.TextAtom;

import static org.fungrim.lite.expr.Builtins.ID;
import static org.fungrim.lite.expr.Builtins.TITLE;

/**
 * Accessors for the tagged children of entries and topics.
 */
public final class Entries {

    private Entries() {
        // Static utility class
    }

    /**
     * @return The text of the entry's ID(...) child
     * @throws MalformedExprException if there is no ID(text) child
     */
    public static String id(Expr entry) {
        return tagText(entry, ID);
    }

    /**
     * @return The text of the Title(...) child
     * @throws MalformedExprException if there is no Title(text) child
     */
    public static String title(Expr expr) {
        return tagText(expr, TITLE);
    }

    private static String tagText(Expr expr, Expr tag) {
        Application child = expr.argWithHead(tag).orElseThrow(() -> new MalformedExprException(
                "No " + tag.toSourceString() + " in " + abbreviate(expr.toSourceString())));
        if (child.arity() != 1 || !(child.arg(0) instanceof TextAtom text)) {
            throw new MalformedExprException(tag.toSourceString() + " expects one text argument but got "
                    + child.toSourceString());
        }
        return text.value();
    }

    private static String abbreviate(String source) {
        return source.length() <= 120 ? source : source.substring(0, 117) + "...";
    }
}
