package org.fungrim.lite.source;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.fungrim.lite.expr.Expr;
import org.fungrim.lite.expr.Symbol;
import org.fungrim.lite.symbol.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads expressions written in the canonical term syntax produced by
 * {@link Expr#toSourceString()}.
 */
public final class SourceFormParser {

    private static final Logger LOG = LoggerFactory.getLogger(SourceFormParser.class);

    private SourceFormParser() {
        // Static utility class
    }

    /**
     * Parses exactly one expression.
     *
     * @param text The source text
     * @return The parsed expression
     * @throws SourceParseException if the text is not a single well-formed expression
     */
    public static Expr parse(String text) {
        FormulaSourceParser parser = newParser(text);
        return new SourceFormBuilder().visit(parser.singleExpression());
    }

    /**
     * Parses a document of zero or more top-level expressions.
     *
     * @throws SourceParseException if parsing fails
     */
    public static List<Expr> parseDocument(String text) {
        FormulaSourceParser parser = newParser(text);
        return List.copyOf(new SourceFormBuilder().document(parser.document()));
    }

    /**
     * Parses a document and warns about symbols the table does not know.
     */
    public static List<Expr> parseDocument(String text, SymbolTable symbols) {
        List<Expr> document = parseDocument(text);
        Set<Symbol> unknown = new LinkedHashSet<>();
        for (Expr expr : document) {
            for (Symbol symbol : expr.allSymbols()) {
                if (!symbols.isRegistered(symbol)) {
                    unknown.add(symbol);
                }
            }
        }
        if (!unknown.isEmpty()) {
            LOG.warn("Document references {} unregistered symbol(s): {}", unknown.size(), unknown);
        }
        return document;
    }

    private static FormulaSourceParser newParser(String text) {
        if (text == null) {
            throw new SourceParseException("Source text cannot be null");
        }
        FormulaSourceLexer lexer = new FormulaSourceLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new ErrorListener());

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        FormulaSourceParser parser = new FormulaSourceParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(new ErrorListener());
        return parser;
    }

    /**
     * Error listener that converts ANTLR errors to SourceParseException.
     */
    private static class ErrorListener extends BaseErrorListener {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                int line, int charPositionInLine, String msg,
                RecognitionException e) {
            throw new SourceParseException(msg, line, charPositionInLine);
        }
    }
}
