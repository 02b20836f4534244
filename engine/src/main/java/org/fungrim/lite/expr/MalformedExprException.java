package org.fungrim.lite.expr;

/**
 * Exception thrown when an expression does not have the shape its head
 * requires: a wrong argument count for a fixed-shape template, or a missing
 * or misplaced sub-tag. It signals an authoring bug in the expression data.
 */
public class MalformedExprException extends RuntimeException {

    public MalformedExprException(String message) {
        super(message);
    }

    public MalformedExprException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Builds the error for an application whose argument count does not match.
     *
     * @param application The offending application
     * @param expected    Human-readable expected arity ("2", "3 or 4", ...)
     */
    public static MalformedExprException arity(Application application, String expected) {
        return new MalformedExprException(application.head().toSourceString() + " expects " + expected
                + " argument(s) but got " + application.arity() + ": " + abbreviate(application.toSourceString()));
    }

    private static String abbreviate(String source) {
        return source.length() <= 200 ? source : source.substring(0, 197) + "...";
    }
}
