package org.fungrim.lite.source;

import org.fungrim.lite.expr.Expr;
import org.fungrim.lite.expr.IntegerAtom;
import org.fungrim.lite.expr.Symbol;
import org.fungrim.lite.expr.TextAtom;
import org.fungrim.lite.symbol.SymbolTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.fungrim.lite.expr.Builtins.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Source form parser")
class SourceFormParserTest {

    private static final Symbol f = Symbol.of("f");
    private static final Symbol x = Symbol.of("x");

    @Nested
    @DisplayName("Expressions")
    class Expressions {

        @Test
        @DisplayName("Atoms parse to their kinds")
        void atoms() {
            // THEN: Symbols, signed integers and text with escaped quotes or LaTeX are read back
            assertEquals(x, SourceFormParser.parse("x"));
            assertEquals(IntegerAtom.of(-42), SourceFormParser.parse("-42"));
            assertEquals(new TextAtom("a\"b"), SourceFormParser.parse("\"a\\\"b\""));
            assertEquals(new TextAtom("\\mathbb{C}"), SourceFormParser.parse("\"\\mathbb{C}\""));
        }

        @Test
        @DisplayName("Calls nest, chain and allow a trailing comma")
        void calls() {
            // THEN: Nested, chained, trailing-comma and empty calls all parse
            assertEquals(EQUAL.call(GAMMA_FUNCTION.call(1), 1), SourceFormParser.parse("Equal(GammaFunction(1), 1)"));
            assertEquals(f.call(1).call(x), SourceFormParser.parse("f(1)(x)"));
            assertEquals(ENTRIES.call("a", "b"), SourceFormParser.parse("Entries(\"a\", \"b\",)"));
            assertEquals(f.call(), SourceFormParser.parse("f()"));
        }

        @Test
        @DisplayName("Comments and whitespace are skipped")
        void comments() {
            // WHEN: Comments appear before and inside a call
            Expr parsed = SourceFormParser.parse("# leading comment\nf(x,   # trailing\n  1)");

            // THEN: Only the call remains
            assertEquals(f.call(x, 1), parsed);
        }

        @Test
        @DisplayName("Writing then reading gives back the same expression")
        void roundTrip() {
            // GIVEN: An entry with a sum, a decimal and quoted text
            Expr entry = ENTRY.call(ID.call("0abc12"),
                    FORMULA.call(EQUAL.call(SUM.call(f.call(Symbol.of("n")), TUPLE.call(Symbol.of("n"), 1, -3)), DECIMAL.call("1.5e-3"))),
                    DESCRIPTION.call("Says \"hi\"", SOURCE_FORM.call(x)));

            // WHEN: We print and re-parse it
            Expr parsed = SourceFormParser.parse(entry.toSourceString());

            // THEN: The result is structurally equal
            assertEquals(entry, parsed);
        }
    }

    @Nested
    @DisplayName("Documents")
    class Documents {

        @Test
        @DisplayName("A document holds several top-level expressions")
        void multipleTopLevelExpressions() {
            // WHEN: Two expressions separated by blank lines
            List<Expr> document = SourceFormParser.parseDocument("f(x)\n\ng(1)\n");

            // THEN: Both are returned in order
            assertEquals(List.of(f.call(x), Symbol.of("g").call(1)), document);
        }

        @Test
        @DisplayName("A document of comments only is empty")
        void emptyDocument() {
            // THEN: Nothing is returned
            assertTrue(SourceFormParser.parseDocument("  # nothing here\n").isEmpty());
        }

        @Test
        @DisplayName("Unregistered symbols are tolerated")
        void unregisteredSymbols() {
            // WHEN: The document uses a symbol the table does not know
            List<Expr> document = SourceFormParser.parseDocument("NotAThing(x)", SymbolTable.standard());

            // THEN: It still parses
            assertEquals(1, document.size());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("A syntax error reports its line and column")
        void syntaxErrorLocation() {
            // GIVEN: A missing comma before y on line 2
            String text = "f(x\n  y)";

            // WHEN: We parse it
            SourceParseException e = assertThrows(SourceParseException.class, () -> SourceFormParser.parse(text));

            // THEN: The error points at y
            assertTrue(e.hasLocation(), e.getMessage());
            assertEquals(2, e.getLine());
            assertEquals(2, e.getColumn());
        }

        @Test
        @DisplayName("An unknown character is a located lexer error")
        void unknownCharacter() {
            // WHEN: The input contains @
            SourceParseException e = assertThrows(SourceParseException.class, () -> SourceFormParser.parse("f(@)"));

            // THEN: The error points at it
            assertEquals(1, e.getLine());
            assertEquals(2, e.getColumn());
        }

        @Test
        @DisplayName("A single expression may not be followed by more input")
        void trailingInputIsRejected() {
            // THEN: A second call is rejected
            assertThrows(SourceParseException.class, () -> SourceFormParser.parse("f(x) g(x)"));
        }

        @Test
        @DisplayName("An unterminated call is rejected")
        void unterminatedCall() {
            // THEN: A missing closing parenthesis fails
            assertThrows(SourceParseException.class, () -> SourceFormParser.parse("f(x"));
        }

        @Test
        @DisplayName("Null input fails without a location")
        void nullText() {
            // WHEN: We parse null
            SourceParseException e = assertThrows(SourceParseException.class, () -> SourceFormParser.parse(null));

            // THEN: There is no line or column to report
            assertFalse(e.hasLocation());
        }
    }
}
