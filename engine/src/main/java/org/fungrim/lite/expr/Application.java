package org.fungrim.lite.expr;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A function application head(arg0, arg1, ...).
 *
 * The part list always holds at least the head; an application with no
 * arguments is valid. Argument order is significant.
 */
public final class Application implements Expr {

    private final List<Expr> parts;
    private volatile int hashCodeCache;
    private volatile boolean hashCodeCalculated = false;

    public Application(List<Expr> parts) {
        this.parts = List.copyOf(parts);
        if (this.parts.isEmpty()) {
            throw new IllegalArgumentException("An application needs at least a head");
        }
    }

    public Application(Expr... parts) {
        this(Arrays.asList(parts));
    }

    /**
     * @return All parts: the head followed by the arguments
     */
    public List<Expr> parts() {
        return parts;
    }

    @Override
    public Expr head() {
        return parts.get(0);
    }

    @Override
    public List<Expr> args() {
        return parts.subList(1, parts.size());
    }

    public Expr arg(int index) {
        return parts.get(index + 1);
    }

    public int arity() {
        return parts.size() - 1;
    }

    @Override
    public boolean hasHead(Expr... heads) {
        Expr head = head();
        for (Expr h : heads) {
            if (h.equals(head)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Optional<Application> argWithHead(Expr head) {
        for (Expr arg : args()) {
            if (arg.hasHead(head)) {
                return Optional.of((Application) arg);
            }
        }
        return Optional.empty();
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitApplication(this);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Application that && this.hashCode() == that.hashCode() && parts.equals(that.parts));
    }

    @Override
    public int hashCode() {
        if (!hashCodeCalculated) {
            hashCodeCache = parts.hashCode();
            hashCodeCalculated = true;
        }
        return hashCodeCache;
    }

    @Override
    public String toString() {
        return toSourceString();
    }
}
