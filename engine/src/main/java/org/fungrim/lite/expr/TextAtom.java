package org.fungrim.lite.expr;

import static java.util.Objects.requireNonNull;

/**
 * An opaque text atom. The value is stored verbatim; quotes and underscores
 * are escaped by whoever emits it.
 *
 * @param value The text
 */
public record TextAtom(String value) implements Expr {

    public TextAtom {
        requireNonNull(value, "Text value cannot be null");
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitText(this);
    }

    @Override
    public String toString() {
        return toSourceString();
    }
}
