package org.fungrim.lite.expr;

import java.util.stream.Collectors;

/**
 * Writes expressions in canonical source syntax.
 *
 * Text atoms are double-quoted with embedded quotes backslash-escaped. The
 * arguments of an Entry are placed one per line so corpus listings stay
 * readable; every other application is written head(arg, arg, ...).
 */
final class SourceFormWriter implements ExprVisitor<String> {

    static final SourceFormWriter INSTANCE = new SourceFormWriter();

    private static final String ENTRY_SEPARATOR = ",\n    ";

    private SourceFormWriter() {
    }

    @Override
    public String visitSymbol(Symbol symbol) {
        return symbol.name();
    }

    @Override
    public String visitInteger(IntegerAtom integer) {
        return integer.value().toString();
    }

    @Override
    public String visitText(TextAtom text) {
        return '"' + text.value().replace("\"", "\\\"") + '"';
    }

    @Override
    public String visitApplication(Application application) {
        String separator = Builtins.ENTRY.equals(application.head()) ? ENTRY_SEPARATOR : ", ";
        return application.head().accept(this)
                + application.args().stream().map(arg -> arg.accept(this)).collect(Collectors.joining(separator, "(", ")"));
    }
}
