package org.fungrim.lite.expr;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.fungrim.lite.expr.Builtins.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Expression term model")
class ExprTest {

    private static final Symbol f = Symbol.of("f");
    private static final Symbol g = Symbol.of("g");
    private static final Symbol x = Symbol.of("x");
    private static final Symbol y = Symbol.of("y");

    @Nested
    @DisplayName("Equality and hashing")
    class Equality {

        @Test
        @DisplayName("Structurally equal trees are equal and hash alike")
        void structuralEquality() {
            // GIVEN: The same tree built from constants and from fresh lookups
            Application a = Expr.apply(f, x, Expr.apply(g, 1, "t"));
            Application b = Expr.apply(Symbol.of("f"), Symbol.of("x"), Expr.apply(Symbol.of("g"), BigInteger.ONE, "t"));

            // THEN: They are equal both ways and hash alike
            assertEquals(a, b);
            assertEquals(b, a);
            assertEquals(a.hashCode(), b.hashCode());
        }

        @Test
        @DisplayName("Arity, head and argument order all matter")
        void contentSensitive() {
            // THEN: Changing any part breaks equality
            assertNotEquals(Expr.apply(f, x), Expr.apply(f, x, y));
            assertNotEquals(Expr.apply(f, x), Expr.apply(g, x));
            assertNotEquals(Expr.apply(f, x, y), Expr.apply(f, y, x));
        }

        @Test
        @DisplayName("Atoms of different kinds are never equal")
        void variantsDiffer() {
            // THEN: Same spelling, different kind
            assertNotEquals(IntegerAtom.of(1), new TextAtom("1"));
            assertNotEquals(Symbol.of("a"), new TextAtom("a"));
            assertNotEquals(Expr.apply(f), f);
        }

        @Test
        @DisplayName("Symbol.of shares one instance per name")
        void symbolsAreInterned() {
            // THEN: A fresh lookup returns the builtin constant
            assertSame(Symbol.of("GammaFunction"), GAMMA_FUNCTION);
        }

        @Test
        @DisplayName("Expressions work as map keys")
        void usableAsKeys() {
            // GIVEN: A map keyed by f(x)
            var map = new java.util.HashMap<Expr, String>();
            map.put(Expr.apply(f, x), "fx");

            // THEN: An equal, separately built key finds the value
            assertEquals("fx", map.get(Expr.apply(Symbol.of("f"), Symbol.of("x"))));
        }
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Coercion promotes raw values and passes expressions through")
        void coercion() {
            // THEN: Integers and strings become atoms, expressions are unchanged
            assertEquals(IntegerAtom.of(42), Expr.of(42));
            assertEquals(IntegerAtom.of(42), Expr.of(42L));
            assertEquals(new TextAtom("hi"), Expr.of("hi"));
            assertSame(x, Expr.of(x));
        }

        @Test
        @DisplayName("Coercing an unsupported value is rejected")
        void coercionRejectsOthers() {
            // THEN: Doubles and null have no atom
            assertThrows(IllegalArgumentException.class, () -> Expr.of(1.5));
            assertThrows(IllegalArgumentException.class, () -> Expr.of(null));
        }

        @Test
        @DisplayName("Empty symbol names are rejected")
        void emptySymbolName() {
            // THEN: A symbol needs a name
            assertThrows(IllegalArgumentException.class, () -> new Symbol(""));
        }

        @Test
        @DisplayName("A head without arguments is a valid application")
        void zeroArgumentApplication() {
            // WHEN: We call f with no arguments
            Application app = f.call();

            // THEN: It is an application with an empty argument list
            assertFalse(app.isAtom());
            assertEquals(f, app.head());
            assertTrue(app.args().isEmpty());
            assertEquals("f()", app.toSourceString());
        }

        @Test
        @DisplayName("Arithmetic builders use the canonical operator heads")
        void arithmeticBuilders() {
            // THEN: Each builder produces the matching operator application
            assertEquals(Expr.apply(ADD, x, 1), x.plus(1));
            assertEquals(Expr.apply(SUB, x, y), x.minus(y));
            assertEquals(Expr.apply(MUL, 2, x), IntegerAtom.of(2).times(x));
            assertEquals(Expr.apply(DIV, x, 2), x.dividedBy(2));
            assertEquals(Expr.apply(POW, x, 2), x.pow(2));
            assertEquals(Expr.apply(NEG, x), x.neg());
            assertEquals(Expr.apply(POS, x), x.pos());
            assertEquals(Expr.apply(ABS, x), x.abs());
        }

        @Test
        @DisplayName("Atoms have no head and no arguments")
        void atomAccessors() {
            // THEN: Head and argument accessors are empty on atoms
            assertNull(x.head());
            assertNull(IntegerAtom.of(3).args());
            assertFalse(x.hasHead(x));
            assertTrue(new TextAtom("t").argWithHead(ID).isEmpty());
        }
    }

    @Nested
    @DisplayName("Traversal")
    class Traversal {

        @Test
        @DisplayName("allSymbols keeps first-occurrence order without duplicates")
        void allSymbolsOrder() {
            // THEN: The repeated x is listed once, where it first appears
            assertEquals(List.of(f, x, y), Expr.apply(f, x, y, x).allSymbols());
        }

        @Test
        @DisplayName("allSymbols descends depth first, left to right")
        void allSymbolsDepthFirst() {
            // GIVEN: Gamma(x) = y Gamma(y)
            Application expr = Expr.apply(EQUAL, Expr.apply(GAMMA_FUNCTION, x), Expr.apply(MUL, y, Expr.apply(GAMMA_FUNCTION, y)));

            // THEN: Symbols come out in depth-first order
            assertEquals(List.of(EQUAL, GAMMA_FUNCTION, x, MUL, y), expr.allSymbols());
        }

        @Test
        @DisplayName("argWithHead finds the first tagged child")
        void argWithHead() {
            // GIVEN: An entry with two formulas
            Application entry = ENTRY.call(ID.call("abc"), FORMULA.call(1), FORMULA.call(2));

            // THEN: The first formula is found; absent tags give an empty result
            assertEquals(FORMULA.call(1), entry.argWithHead(FORMULA).orElseThrow());
            assertTrue(entry.argWithHead(REFERENCES).isEmpty());
        }
    }

    @Nested
    @DisplayName("Source form")
    class SourceForm {

        @Test
        @DisplayName("Atoms print as literals")
        void atoms() {
            // THEN: Integers are decimal, symbols bare, text quoted with escaped quotes
            assertEquals("42", IntegerAtom.of(42).toSourceString());
            assertEquals("-7", IntegerAtom.of(-7).toSourceString());
            assertEquals("ConstPi", CONST_PI.toSourceString());
            assertEquals("\"a\\\"b\"", new TextAtom("a\"b").toSourceString());
        }

        @Test
        @DisplayName("Applications print as head(arg, arg)")
        void applications() {
            // THEN: Arguments are comma-separated inside parentheses
            assertEquals("Equal(GammaFunction(1), 1)", EQUAL.call(GAMMA_FUNCTION.call(1), 1).toSourceString());
        }

        @Test
        @DisplayName("Entry arguments are placed one per line")
        void entryLayout() {
            // GIVEN: An entry with an ID and a formula
            Application entry = ENTRY.call(ID.call("e68d11"), FORMULA.call(EQUAL.call(x, 1)));

            // THEN: Each argument starts a new indented line
            assertEquals("Entry(ID(\"e68d11\"),\n    Formula(Equal(x, 1)))", entry.toSourceString());
        }
    }
}
