package org.fungrim.lite.expr;

import java.math.BigInteger;

import static java.util.Objects.requireNonNull;

/**
 * An arbitrary-precision integer atom.
 *
 * @param value The integer value
 */
public record IntegerAtom(BigInteger value) implements Expr {

    public IntegerAtom {
        requireNonNull(value, "Integer value cannot be null");
    }

    public static IntegerAtom of(long value) {
        return new IntegerAtom(BigInteger.valueOf(value));
    }

    public int signum() {
        return value.signum();
    }

    /**
     * @return true if the value lies in [low, high]
     */
    public boolean between(long low, long high) {
        return value.compareTo(BigInteger.valueOf(low)) >= 0 && value.compareTo(BigInteger.valueOf(high)) <= 0;
    }

    public boolean isValue(long v) {
        return value.equals(BigInteger.valueOf(v));
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitInteger(this);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
