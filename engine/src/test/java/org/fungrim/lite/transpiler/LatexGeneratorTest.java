package org.fungrim.lite.transpiler;

import org.fungrim.lite.expr.Expr;
import org.fungrim.lite.expr.IntegerAtom;
import org.fungrim.lite.expr.MalformedExprException;
import org.fungrim.lite.expr.Symbol;
import org.fungrim.lite.expr.TextAtom;
import org.fungrim.lite.symbol.SymbolTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.fungrim.lite.expr.Builtins.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LaTeX generation")
class LatexGeneratorTest {

    private static final Symbol a = Symbol.of("a");
    private static final Symbol b = Symbol.of("b");
    private static final Symbol f = Symbol.of("f");
    private static final Symbol k = Symbol.of("k");
    private static final Symbol n = Symbol.of("n");
    private static final Symbol x = Symbol.of("x");
    private static final Symbol z = Symbol.of("z");
    private static final Symbol N = Symbol.of("N");
    private static final Symbol P = Symbol.of("P");
    private static final Symbol Q = Symbol.of("Q");

    private LatexGenerator latex;

    @BeforeEach
    void setUp() {
        latex = new LatexGenerator(SymbolTable.standard());
    }

    @Nested
    @DisplayName("Atoms")
    class Atoms {

        @Test
        @DisplayName("Variables print as letters, Greek names as commands")
        void variables() {
            // THEN: Single letters stay bare, Greek names become commands
            assertEquals("x", latex.latex(x));
            assertEquals("\\alpha", latex.latex(Symbol.of("alpha")));
            assertEquals("\\varepsilon", latex.latex(Symbol.of("epsilon")));
        }

        @Test
        @DisplayName("Builtins use their fixed spelling, others an operator name")
        void builtins() {
            // THEN: Registered spellings win; other names fall back to \operatorname
            assertEquals("\\pi", latex.latex(CONST_PI));
            assertEquals("\\operatorname{Zeros}", latex.latex(ZEROS));
            assertEquals("\\operatorname{MyFunction}", latex.latex(Symbol.of("MyFunction")));
        }

        @Test
        @DisplayName("Integers print in decimal and text is quoted with escaped underscores")
        void literals() {
            // THEN: Integers are decimal and text is quoted
            assertEquals("-12", latex.latex(IntegerAtom.of(-12)));
            assertEquals("\\text{``a\\_b''}", latex.latex(new TextAtom("a_b")));
        }
    }

    @Nested
    @DisplayName("Arithmetic")
    class Arithmetic {

        @Test
        @DisplayName("Gamma(1) = 1 uses the registered Gamma spelling")
        void gammaOfOne() {
            // THEN: The call gets tight spacing and the infix = is spaced
            assertEquals("\\Gamma\\!\\left(1\\right) = 1", latex.latex(EQUAL.call(GAMMA_FUNCTION.call(1), 1)));
        }

        @Test
        @DisplayName("Sums and negated differences")
        void addAndSub() {
            // THEN: A negated subtrahend is parenthesized
            assertEquals("a + b", latex.latex(a.plus(b)));
            assertEquals("a - \\left(-b\\right)", latex.latex(a.minus(b.neg())));
            assertEquals("-a", latex.latex(a.neg()));
        }

        @Test
        @DisplayName("Products parenthesize sums and negative integers")
        void products() {
            // THEN: Only compound or negative factors get parentheses
            assertEquals("\\left(a + b\\right) x", latex.latex(a.plus(b).times(x)));
            assertEquals("\\left(-2\\right) x", latex.latex(IntegerAtom.of(-2).times(x)));
            assertEquals("2 x", latex.latex(IntegerAtom.of(2).times(x)));
        }

        @Test
        @DisplayName("Fractions stack in display and slash in compact positions")
        void fractions() {
            // THEN: A compact fraction becomes a slash
            assertEquals("\\frac{1}{2}", latex.latex(DIV.call(1, 2)));
            assertEquals("{x}^{1 / 2}", latex.latex(x.pow(DIV.call(1, 2))));
            assertEquals("\\left( a + b \\right) / 2", latex.latex(DIV.call(a.plus(b), 2), true));
        }

        @Test
        @DisplayName("Powers of trigonometric calls attach the exponent to the function")
        void trigPower() {
            // THEN: The exponent sits on \sin
            assertEquals("\\sin^{2}\\!\\left(x\\right)", latex.latex(POW.call(SIN.call(x), 2)));
        }

        @Test
        @DisplayName("Simple bases take the exponent directly, others are parenthesized")
        void powerBases() {
            // THEN: Atoms take the exponent directly, sums and negatives are wrapped
            assertEquals("{x}^{2}", latex.latex(x.pow(2)));
            assertEquals("{3}^{n}", latex.latex(IntegerAtom.of(3).pow(n)));
            assertEquals("{\\left(x + 1\\right)}^{2}", latex.latex(x.plus(1).pow(2)));
            assertEquals("{\\left(-1\\right)}^{n}", latex.latex(IntegerAtom.of(-1).pow(n)));
        }

        @Test
        @DisplayName("Subscript-call powers keep the index in the subscript")
        void subscriptCallPower() {
            // THEN: Exponent follows the subscript
            assertEquals("P_{n}^{2}\\!\\left(x\\right)", latex.latex(POW.call(LEGENDRE_POLYNOMIAL.call(n, x), 2)));
        }

        @Test
        @DisplayName("Exp prints as a power of e only for arithmetic exponents")
        void exponential() {
            // THEN: e^{...} for arithmetic, \exp otherwise
            assertEquals("{e}^{x + 1}", latex.latex(EXP.call(x.plus(1))));
            assertEquals("\\exp\\!\\left(\\sin\\!\\left(x\\right)\\right)", latex.latex(EXP.call(SIN.call(x))));
        }

        @Test
        @DisplayName("Factorials parenthesize compound arguments")
        void factorials() {
            // THEN: Compound arguments are parenthesized
            assertEquals("n !", latex.latex(FACTORIAL.call(n)));
            assertEquals("\\left(n - 1\\right)!", latex.latex(FACTORIAL.call(n.minus(1))));
            assertEquals("n !!", latex.latex(DOUBLE_FACTORIAL.call(n)));
        }

        @Test
        @DisplayName("Decimal literals expand their exponent")
        void decimals() {
            // THEN: Scientific notation becomes a power of ten
            assertEquals("0.8856", latex.latex(DECIMAL.call("0.8856")));
            assertEquals("1.5 \\cdot 10^{10}", latex.latex(DECIMAL.call("1.5e+10")));
        }
    }

    @Nested
    @DisplayName("Calls")
    class Calls {

        @Test
        @DisplayName("Generic calls use tight spacing except in compact positions")
        void genericCall() {
            // GIVEN: A call to an unregistered function
            Expr call = Symbol.of("Frob").call(x, 1);

            // THEN: Compact positions drop the \! spacing
            assertEquals("\\operatorname{Frob}\\!\\left(x, 1\\right)", latex.latex(call));
            assertEquals("\\operatorname{Frob}\\left(x, 1\\right)", latex.latex(call, true));
        }

        @Test
        @DisplayName("Infix operators join their arguments")
        void infix() {
            // THEN: Chained arguments share the operator
            assertEquals("x \\in \\mathbb{C}", latex.latex(ELEMENT.call(x, CC)));
            assertEquals("a < b < x", latex.latex(LESS.call(a, b, x)));
        }

        @Test
        @DisplayName("Subscript calls move the first argument into the subscript")
        void subscriptCall() {
            // THEN: The first argument becomes the subscript
            assertEquals("P_{n}\\!\\left(x\\right)", latex.latex(LEGENDRE_POLYNOMIAL.call(n, x)));
        }

        @Test
        @DisplayName("Indexed numbers print as subscripted letters")
        void indexed() {
            // THEN: Indices join with commas
            assertEquals("B_{n}", latex.latex(BERNOULLI_B.call(n)));
            assertEquals("\\rho_{n, k}", latex.latex(DIRICHLET_L_ZERO.call(n, k)));
            assertEquals("x_{n,k}", latex.latex(LEGENDRE_POLYNOMIAL_ZERO.call(n, k)));
        }

        @Test
        @DisplayName("Bessel functions subscript their order")
        void bessel() {
            // THEN: The order is subscripted and derivatives are primed
            assertEquals("J_{n}\\!\\left(z\\right)", latex.latex(BESSEL_J.call(n, z)));
            assertEquals("J''_{n}\\!\\left(z\\right)", latex.latex(BESSEL_J_DERIVATIVE.call(n, z, 2)));
        }
    }

    @Nested
    @DisplayName("Calculus")
    class Calculus {

        @Test
        @DisplayName("First derivative uses one prime")
        void firstDerivative() {
            // THEN: Order 1 at the variable is a prime
            assertEquals("f'(x)", latex.latex(DERIVATIVE.call(f.call(x), TUPLE.call(x, x, 1))));
        }

        @Test
        @DisplayName("Fourth derivative uses a superscript order")
        void fourthDerivative() {
            // WHEN: The order is past the prime glyphs
            String tex = latex.latex(DERIVATIVE.call(f.call(x), TUPLE.call(x, x, 4)));

            // THEN: A parenthesized superscript order replaces the primes
            assertEquals("{f}^{(4)}(x)", tex);
            assertFalse(tex.contains("''''"));
        }

        @Test
        @DisplayName("Derivatives of expressions are evaluated at a point when it differs")
        void derivativeAtPoint() {
            // THEN: A point other than the variable adds an evaluation bracket
            assertEquals("\\left[ \\frac{d}{d x}\\, x + 1 \\right]_{x = 0}",
                    latex.latex(DERIVATIVE.call(x.plus(1), TUPLE.call(x, 0, 1))));
            assertEquals("\\frac{d^{2}}{{d x}^{2}} x + 1",
                    latex.latex(DERIVATIVE.call(x.plus(1), x, x, 2)));
        }

        @Test
        @DisplayName("Sums read range and predicate bounds")
        void sums() {
            // THEN: Ranges print both bounds, predicates go in the subscript
            assertEquals("\\sum_{n=1}^{N} f\\!\\left(n\\right)", latex.latex(SUM.call(f.call(n), TUPLE.call(n, 1, N))));
            assertEquals("\\prod_{P\\left(n\\right)} f\\!\\left(n\\right)",
                    latex.latex(PRODUCT.call(f.call(n), n, P.call(n))));
            assertEquals("\\sum_{n} f\\!\\left(n\\right)", latex.latex(SUM.call(f.call(n), n)));
        }

        @Test
        @DisplayName("Integrals need a Tuple range")
        void integrals() {
            // THEN: Range bounds are required
            assertEquals("\\int_{0}^{1} f\\!\\left(x\\right) \\, dx", latex.latex(INTEGRAL.call(f.call(x), TUPLE.call(x, 0, 1))));
            assertThrows(MalformedExprException.class, () -> latex.latex(INTEGRAL.call(f.call(x), x)));
        }

        @Test
        @DisplayName("Limits mark one-sided approaches")
        void limits() {
            // THEN: A right limit marks the point with a plus
            assertEquals("\\lim_{x \\to 0} f\\!\\left(x\\right)", latex.latex(LIMIT.call(f.call(x), x, 0)));
            assertEquals("\\lim_{x \\to {0}^{+}} f\\!\\left(x\\right)", latex.latex(RIGHT_LIMIT.call(f.call(x), x, 0)));
        }
    }

    @Nested
    @DisplayName("Logic")
    class Logic {

        @Test
        @DisplayName("And spells out its connective unless compact")
        void and() {
            // THEN: Compact positions use a comma
            assertEquals("P \\,\\mathbin{\\operatorname{and}}\\, Q", latex.latex(AND.call(P, Q)));
            assertEquals("P,\\,Q", latex.latex(AND.call(P, Q), true));
        }

        @Test
        @DisplayName("Nested connectives are parenthesized")
        void nested() {
            // THEN: The inner And is wrapped
            assertEquals("\\left(P \\,\\mathbin{\\operatorname{and}}\\, Q\\right) \\,\\mathbin{\\operatorname{or}}\\, a",
                    latex.latex(OR.call(AND.call(P, Q), a)));
        }
    }

    @Nested
    @DisplayName("Errors and caching")
    class ErrorsAndCaching {

        @Test
        @DisplayName("Fixed templates reject the wrong number of arguments")
        void arity() {
            // WHEN: Binomial gets one argument
            MalformedExprException e = assertThrows(MalformedExprException.class,
                    () -> latex.latex(BINOMIAL.call(n)));

            // THEN: The message names the expected arity
            assertTrue(e.getMessage().startsWith("Binomial expects 2"), e.getMessage());
        }

        @Test
        @DisplayName("Results are memoized per expression and compactness")
        void memoized() {
            // GIVEN: An expression rendered once
            Expr expr = x.plus(1);
            String first = latex.latex(expr);
            int cached = latex.cachedCount();

            // WHEN: An equal expression is rendered again
            // THEN: The cached string is returned and nothing new is stored
            assertSame(first, latex.latex(x.plus(1)));
            assertEquals(cached, latex.cachedCount());

            // WHEN: The compact form is rendered
            // THEN: It gets its own cache slot
            latex.latex(expr, true);
            assertTrue(latex.cachedCount() > cached);
        }

        @Test
        @DisplayName("Custom tables supply their own spellings")
        void customTable() {
            // GIVEN: A table that spells Foo as \phi
            Symbol foo = Symbol.of("Foo");
            SymbolTable custom = SymbolTable.builder().registerBuiltins("Foo").latex(foo, "\\phi").build();

            // THEN: A generator over it uses the custom spelling
            assertEquals("\\phi\\!\\left(1\\right)", new LatexGenerator(custom).latex(foo.call(1)));
        }
    }
}
