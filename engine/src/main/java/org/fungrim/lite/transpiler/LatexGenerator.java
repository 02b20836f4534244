package org.fungrim.lite.transpiler;

import org.fungrim.lite.expr.Application;
import org.fungrim.lite.expr.Expr;
import org.fungrim.lite.expr.IntegerAtom;
import org.fungrim.lite.expr.MalformedExprException;
import org.fungrim.lite.expr.Symbol;
import org.fungrim.lite.expr.TextAtom;
import org.fungrim.lite.symbol.OperatorKind;
import org.fungrim.lite.symbol.SymbolInfo;
import org.fungrim.lite.symbol.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import static org.fungrim.lite.expr.Builtins.*;

/**
 * Transpiles an expression tree into a LaTeX string.
 *
 * Rendering dispatches on the head's {@link OperatorKind}, resolved by the
 * symbol table when the head was registered. Heads without a template fall
 * through to call notation f(a, b). The {@code inSmall} flag marks subscript,
 * superscript and exponent positions: it suppresses spacing commands and turns
 * stacked fractions into inline slashes.
 *
 * Results are memoized per (expression, inSmall) for the life of the
 * generator.
 */
public final class LatexGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(LatexGenerator.class);

    private static final String AND_JOIN = " \\,\\mathbin{\\operatorname{and}}\\, ";
    private static final String OR_JOIN = " \\,\\mathbin{\\operatorname{or}}\\, ";

    private static final Map<Symbol, String> EXTREMUM_NAMES = Map.ofEntries(
            Map.entry(MINIMUM, "\\min"),
            Map.entry(MAXIMUM, "\\max"),
            Map.entry(ARG_MIN, "\\operatorname{arg\\,min}"),
            Map.entry(ARG_MIN_UNIQUE, "\\operatorname{arg\\,min*}"),
            Map.entry(ARG_MAX, "\\operatorname{arg\\,max}"),
            Map.entry(ARG_MAX_UNIQUE, "\\operatorname{arg\\,max*}"),
            Map.entry(INFIMUM, "\\operatorname{inf}"),
            Map.entry(SUPREMUM, "\\operatorname{sup}"),
            Map.entry(ZEROS, "\\operatorname{zeros}\\,"),
            Map.entry(UNIQUE_ZERO, "\\operatorname{zero*}\\,"),
            Map.entry(SOLUTIONS, "\\operatorname{solutions}\\,"),
            Map.entry(UNIQUE_SOLUTION, "\\operatorname{solution*}\\,"));

    private static final Map<Symbol, String> BESSEL_LETTERS = Map.of(
            BESSEL_J, "J",
            BESSEL_I, "I",
            BESSEL_Y, "Y",
            BESSEL_K, "K",
            HANKEL_H1, "H^{(1)}",
            HANKEL_H2, "H^{(2)}",
            BESSEL_J_DERIVATIVE, "J",
            BESSEL_I_DERIVATIVE, "I",
            BESSEL_Y_DERIVATIVE, "Y",
            BESSEL_K_DERIVATIVE, "K");

    private final SymbolTable symbols;
    private final LatexCache cache = new LatexCache();

    public LatexGenerator(SymbolTable symbols) {
        this.symbols = Objects.requireNonNull(symbols, "Symbol table cannot be null");
    }

    public SymbolTable symbols() {
        return symbols;
    }

    /**
     * Generates display-context LaTeX for an expression.
     */
    public String latex(Expr expr) {
        return latex(expr, false);
    }

    /**
     * Generates LaTeX for an expression.
     *
     * @param expr    The expression
     * @param inSmall true inside a subscript, superscript or other compact position
     * @return The LaTeX source
     * @throws MalformedExprException if a recognized head has the wrong shape
     */
    public String latex(Expr expr, boolean inSmall) {
        String cached = cache.get(expr, inSmall);
        if (cached != null) {
            return cached;
        }
        String tex = generate(expr, inSmall);
        cache.put(expr, inSmall, tex);
        return tex;
    }

    int cachedCount() {
        return cache.size();
    }

    // ==================== Dispatch ====================

    private String generate(Expr expr, boolean inSmall) {
        String fixed = symbols.latexOverride(expr);
        if (fixed != null) {
            return fixed;
        }
        if (expr instanceof Symbol symbol) {
            return symbolLatex(symbol);
        }
        if (expr instanceof IntegerAtom integer) {
            return integer.value().toString();
        }
        if (expr instanceof TextAtom text) {
            return "\\text{``" + text.value().replace("_", "\\_") + "''}";
        }
        Application app = (Application) expr;
        OperatorKind kind = symbols.kind(app.head());
        return switch (kind) {
            case GENERIC -> call(app, inSmall);
            case INFIX -> infix(app, inSmall);
            case SUBSCRIPT_CALL -> subscriptCall(app, inSmall);

            case EXP -> exp(app, inSmall);
            case DIV -> div(app, inSmall);
            case POS -> "+" + unary(app, inSmall);
            case NEG -> "-" + unary(app, inSmall);
            case ADD -> String.join(" + ", args(app, inSmall));
            case SUB -> sub(app, inSmall);
            case MUL -> mul(app, inSmall);
            case POW -> pow(app, inSmall);
            case SQRT -> "\\sqrt{" + unary(app, inSmall) + "}";
            case ABS -> "\\left|" + unary(app, inSmall) + "\\right|";
            case FLOOR -> "\\left\\lfloor " + unary(app, inSmall) + " \\right\\rfloor";
            case CEIL -> "\\left\\lceil " + unary(app, inSmall) + " \\right\\rceil";
            case CONJUGATE -> "\\overline{" + unary(app, inSmall) + "}";
            case DECIMAL -> decimal(app);

            case INTEGRAL -> integral(app, inSmall);
            case INDEFINITE_INTEGRAL_EQUAL -> indefiniteIntegral(app, inSmall);
            case SUM_PRODUCT -> sumProduct(app, inSmall);
            case DIVISOR_SUM_PRODUCT -> divisorSumProduct(app, inSmall);
            case PRIME_SUM_PRODUCT -> primeSumProduct(app, inSmall);
            case LIMIT -> limit(app);
            case EXTREMUM -> extremum(app, inSmall);
            case COMPLEX_ZERO_MULTIPLICITY -> pointOperator(app, inSmall, "\\operatorname{ord}");
            case RESIDUE -> pointOperator(app, inSmall, "\\operatorname{Res}");
            case DERIVATIVE -> derivative(app, inSmall);
            case ASYMPTOTIC_TO -> {
                List<String> a = fixed(app, 4, inSmall);
                yield a.get(0) + " \\sim " + a.get(1) + ", \\; " + a.get(2) + " \\to " + a.get(3);
            }

            case TUPLE -> "\\left(" + String.join(", ", args(app, inSmall)) + "\\right)";
            case SET -> "\\left\\{" + String.join(", ", args(app, inSmall)) + "\\right\\}";
            case LIST -> "\\left[" + String.join(", ", args(app, inSmall)) + "\\right]";
            case PARENTHESES -> "\\left(" + latex(single(app), false) + "\\right)";
            case BRACKETS -> "\\left[" + latex(single(app), false) + "\\right]";
            case BRACES -> "\\left\\{" + latex(single(app), false) + "\\right\\}";
            case CALL -> {
                List<String> a = args(app, inSmall);
                if (a.isEmpty()) {
                    throw MalformedExprException.arity(app, "at least 1");
                }
                yield a.get(0) + "\\!\\left(" + String.join(", ", a.subList(1, a.size())) + "\\right)";
            }
            case SUBSCRIPT -> {
                requireArity(app, 2);
                yield "{" + latex(app.arg(0), inSmall) + "}_{" + latex(app.arg(1), true) + "}";
            }
            case WHERE -> {
                List<String> a = args(app, inSmall);
                if (a.isEmpty()) {
                    throw MalformedExprException.arity(app, "at least 1");
                }
                yield a.get(0) + "\\; \\text{ where } " + String.join(",\\,", a.subList(1, a.size()));
            }
            case SET_BUILDER -> {
                List<String> a = fixed(app, 3, inSmall);
                yield "\\left\\{ " + a.get(0) + " : " + a.get(2) + " \\right\\}";
            }
            case CARDINALITY -> "\\# " + unary(app, inSmall);
            case CASES -> cases(app, inSmall);
            case MATRIX_2X2 -> {
                List<String> a = fixed(app, 4, inSmall);
                yield "\\begin{pmatrix} " + a.get(0) + " & " + a.get(1) + " \\\\ " + a.get(2) + " & " + a.get(3)
                        + " \\end{pmatrix}";
            }
            case MATRIX_2X1 -> {
                List<String> a = fixed(app, 2, inSmall);
                yield "\\begin{pmatrix} " + a.get(0) + " \\\\ " + a.get(1) + " \\end{pmatrix}";
            }
            case MATRIX_FUNCTION -> {
                if (app.arity() >= 1 && app.arg(0).hasHead(MATRIX2X2)) {
                    yield latex(app.head(), false) + unary(app, inSmall);
                }
                yield call(app, inSmall);
            }

            case INDEXED -> indexed(app, inSmall);
            case FIBONACCI -> "F_{" + latex(single(app), true) + "}";

            case BESSEL -> {
                requireArity(app, 2);
                yield BESSEL_LETTERS.get(app.head()) + "_{" + latex(app.arg(0), true) + "}"
                        + "\\!\\left(" + latex(app.arg(1), inSmall) + "\\right)";
            }
            case BESSEL_DERIVATIVE -> {
                requireArity(app, 3);
                yield withDerivativeOrder(BESSEL_LETTERS.get(app.head()), app.arg(2), inSmall)
                        + "_{" + latex(app.arg(0), true) + "}" + "\\!\\left(" + latex(app.arg(1), inSmall) + "\\right)";
            }
            case COULOMB_FG -> {
                requireArity(app, 3);
                String letter = app.hasHead(COULOMB_F) ? "F" : "G";
                yield letter + "_{" + latex(app.arg(0), true) + "," + latex(app.arg(1), true) + "}\\!\\left("
                        + latex(app.arg(2), false) + "\\right)";
            }
            case COULOMB_H -> coulombH(app);
            case COULOMB_C -> {
                requireArity(app, 2);
                yield "C_{" + latex(app.arg(0), true) + "}\\!\\left(" + latex(app.arg(1), false) + "\\right)";
            }
            case COULOMB_SIGMA -> {
                requireArity(app, 2);
                yield "\\sigma_{" + latex(app.arg(0), true) + "}\\!\\left(" + latex(app.arg(1), false) + "\\right)";
            }
            case FACTORIAL -> factorial(app, inSmall);
            case RISING_FACTORIAL -> {
                List<String> a = fixed(app, 2, inSmall);
                yield "\\left(" + a.get(0) + "\\right)_{" + a.get(1) + "}";
            }
            case FALLING_FACTORIAL -> {
                List<String> a = fixed(app, 2, inSmall);
                yield "\\left(" + a.get(0) + "\\right)^{\\underline{" + a.get(1) + "}}";
            }
            case BINOMIAL -> {
                List<String> a = fixed(app, 2, inSmall);
                yield "{" + a.get(0) + " \\choose " + a.get(1) + "}";
            }
            case STIRLING_CYCLE -> {
                List<String> a = fixed(app, 2, inSmall);
                yield "\\left[{" + a.get(0) + " \\atop " + a.get(1) + "}\\right]";
            }
            case STIRLING_S1 -> {
                List<String> a = fixed(app, 2, inSmall);
                yield "s\\!\\left(" + a.get(0) + ", " + a.get(1) + "\\right)";
            }
            case STIRLING_S2 -> {
                List<String> a = fixed(app, 2, inSmall);
                yield "\\left\\{{" + a.get(0) + " \\atop " + a.get(1) + "}\\right\\}";
            }
            case LAMBERT_W -> lambertW(app, inSmall);
            case KRONECKER_DELTA -> {
                requireArity(app, 2);
                yield "\\delta_{(" + latex(app.arg(0), true) + "," + latex(app.arg(1), true) + ")}";
            }
            case RESIDUE_SYMBOL -> {
                List<String> a = fixed(app, 2, inSmall);
                yield "\\left( \\frac{" + a.get(0) + "}{" + a.get(1) + "} \\right)";
            }
            case HYPERGEOMETRIC_U_STAR_REMAINDER -> {
                List<String> a = fixed(app, 4, inSmall);
                yield "R_{" + a.get(0) + "}\\!\\left(" + a.get(1) + "," + a.get(2) + "," + a.get(3) + "\\right)";
            }
            case STIELTJES_GAMMA -> {
                if (app.arity() == 1) {
                    yield "\\gamma_{" + latex(app.arg(0), true) + "}";
                }
                if (app.arity() == 2) {
                    yield "\\gamma_{" + latex(app.arg(0), true) + "}\\!\\left(" + latex(app.arg(1), inSmall) + "\\right)";
                }
                yield call(app, inSmall);
            }
            case STIRLING_SERIES_REMAINDER -> {
                List<String> a = fixed(app, 2, inSmall);
                yield "R_{" + a.get(0) + "}\\!\\left(" + a.get(1) + "\\right)";
            }

            case AND -> and(app, inSmall);
            case OR -> or(app, inSmall);
            case NOT -> " \\operatorname{not} \\left(" + unary(app, inSmall) + "\\right)";
            case IMPLIES -> args(app, inSmall).stream()
                    .map(s -> "\\left(" + s + "\\right)").collect(Collectors.joining(" \\implies "));
            case EQUIVALENT -> args(app, inSmall).stream()
                    .map(s -> "\\left(" + s + "\\right)").collect(Collectors.joining(" \\iff "));
            case EQUAL_AND_ELEMENT -> {
                List<String> a = fixed(app, 3, inSmall);
                yield a.get(0) + " = " + a.get(1) + " \\in " + a.get(2);
            }
            case FOR_ALL -> {
                List<String> a = fixed(app, 3, inSmall);
                yield "\\text{for all } " + a.get(0) + ": " + a.get(1) + ", " + a.get(2);
            }
            case EXISTS -> {
                List<String> a = fixed(app, 2, inSmall);
                yield "\\text{there exists } " + a.get(0) + ": " + a.get(1);
            }

            case CONGRUENT_MOD -> {
                List<String> a = fixed(app, 3, inSmall);
                yield a.get(0) + " \\equiv " + a.get(1) + " \\pmod {" + a.get(2) + "}";
            }
            case ODD -> unary(app, inSmall) + " \\text{ odd}";
            case EVEN -> unary(app, inSmall) + " \\text{ even}";
            case ZZ_GREATER_EQUAL -> "\\mathbb{Z}_{\\ge " + unary(app, inSmall) + "}";
            case ZZ_LESS_EQUAL -> {
                Expr bound = single(app);
                if (bound instanceof IntegerAtom n) {
                    yield "\\{" + n.value() + ", " + n.value().subtract(BigInteger.ONE) + ", \\ldots\\}";
                }
                yield "\\mathbb{Z}_{\\le " + latex(bound, inSmall) + "}";
            }
            case ZZ_BETWEEN -> {
                List<String> a = fixed(app, 2, inSmall);
                if (app.arg(0) instanceof IntegerAtom n) {
                    yield "\\{" + a.get(0) + ", " + n.value().add(BigInteger.ONE) + ", \\ldots " + a.get(1) + "\\}";
                }
                yield "\\{" + a.get(0) + ", " + a.get(0) + " + 1, \\ldots " + a.get(1) + "\\}";
            }
            case INTERVAL -> interval(app, inSmall);
            case REAL_BALL -> {
                requireArity(app, 2);
                yield "\\left[" + latex(app.arg(0), true) + " \\pm " + latex(app.arg(1), true) + "\\right]";
            }
            case LATTICE -> "\\Lambda_{(" + String.join(", ", args(app, inSmall)) + ")}";
            case DIRICHLET_CHARACTER -> {
                List<String> a = args(app, inSmall);
                if (a.size() == 2) {
                    yield "\\chi_{" + a.get(0) + "}(" + a.get(1) + ", \\cdot)";
                }
                if (a.size() == 3) {
                    yield "\\chi_{" + a.get(0) + "}(" + a.get(1) + ", " + a.get(2) + ")";
                }
                throw MalformedExprException.arity(app, "2 or 3");
            }
            case PRIMITIVE_DIRICHLET_CHARACTERS -> "G_{" + unary(app, inSmall) + "}^{\\text{primitive}}";
            case GAUSS_SUM -> {
                List<String> a = fixed(app, 2, inSmall);
                yield "G_{" + a.get(0) + "}\\!\\left(" + a.get(1) + "\\right)";
            }
            case DISCRETE_LOG -> {
                requireArity(app, 3);
                yield "\\log_{" + latex(app.arg(1), true) + "}\\!\\left(" + latex(app.arg(0), inSmall) + "\\right) \\bmod "
                        + latex(app.arg(2), inSmall);
            }

            case MODULAR_GROUP_ACTION -> {
                List<String> a = fixed(app, 2, inSmall);
                yield a.get(0) + " \\circ " + a.get(1);
            }
            case QUADRATIC_FORMS -> "\\mathcal{Q}^{*}_{" + unary(app, inSmall) + "}";
            case FORMAL_POWER_SERIES -> {
                List<String> a = fixed(app, 2, inSmall);
                yield a.get(0) + "[[" + a.get(1) + "]]";
            }
            case FORMAL_LAURENT_SERIES -> {
                List<String> a = fixed(app, 2, inSmall);
                yield a.get(0) + "(\\!(" + a.get(1) + ")\\!)";
            }
            case SERIES_COEFFICIENT -> {
                List<String> a = fixed(app, 3, inSmall);
                yield "[{" + a.get(1) + "}^{" + a.get(2) + "}] " + a.get(0);
            }
            case FORMAL_GENERATOR -> {
                List<String> a = fixed(app, 2, inSmall);
                yield a.get(0) + " \\text{ is the generator of } " + a.get(1);
            }
            case Q_SERIES_COEFFICIENT -> {
                // fun, tau, q, n, qdef
                List<String> a = fixed(app, 5, inSmall);
                yield "[" + a.get(2) + "^{" + a.get(3) + "}] " + a.get(0) + " \\; \\left(" + a.get(4) + "\\right)";
            }
            case EQUAL_Q_SERIES_ELLIPSIS -> {
                // fun, tau, q, series, qdef
                List<String> a = fixed(app, 5, inSmall);
                yield a.get(0) + " = " + a.get(3) + " + \\ldots \\; \\text{ where } " + a.get(4);
            }

            case DESCRIPTION -> description(app);
        };
    }

    // ==================== Atoms ====================

    private String symbolLatex(Symbol symbol) {
        SymbolInfo info = symbols.info(symbol).orElse(null);
        if (info != null && info.variable()) {
            String name = symbol.name();
            if (name.length() == 1) {
                return name;
            }
            if (name.equals("epsilon")) {
                return "\\varepsilon";
            }
            return "\\" + name;
        }
        if (info == null) {
            LOG.trace("Unregistered symbol {} rendered as an operator name", symbol.name());
        }
        return "\\operatorname{" + symbol.name() + "}";
    }

    // ==================== Generic and table-driven forms ====================

    private String call(Application app, boolean inSmall) {
        String spacer = inSmall ? "" : "\\!";
        return latex(app.head(), false) + spacer + "\\left(" + String.join(", ", args(app, inSmall)) + "\\right)";
    }

    private String infix(Application app, boolean inSmall) {
        return String.join(" " + symbols.infixSpelling(app.head()) + " ", args(app, inSmall));
    }

    // F(n, x, ...) -> F_n(x, ...)
    private String subscriptCall(Application app, boolean inSmall) {
        if (app.arity() < 1) {
            throw MalformedExprException.arity(app, "at least 1");
        }
        List<String> rest = new ArrayList<>();
        for (Expr arg : app.args().subList(1, app.arity())) {
            rest.add(latex(arg, inSmall));
        }
        return symbols.subscriptCallSpelling(app.head()) + "_{" + latex(app.arg(0), true) + "}"
                + "\\!\\left(" + String.join(", ", rest) + "\\right)";
    }

    private String indexed(Application app, boolean inSmall) {
        SymbolInfo.IndexedForm form = symbols.indexedForm(app.head());
        if (form == null) {
            return call(app, inSmall);
        }
        List<String> a = fixed(app, form.arity(), inSmall);
        String separator = app.hasHead(DIRICHLET_L_ZERO) ? ", " : ",";
        return form.letter() + "_{" + String.join(separator, a) + "}";
    }

    // ==================== Arithmetic ====================

    private String exp(Application app, boolean inSmall) {
        Expr exponent = single(app);
        if (ExprShapes.showExponentialAsPower(exponent)) {
            return latex(POW.call(CONST_E, exponent), inSmall);
        }
        return call(app, inSmall);
    }

    private String div(Application app, boolean inSmall) {
        requireArity(app, 2);
        Expr num = app.arg(0);
        Expr den = app.arg(1);
        if (inSmall) {
            String numStr = latex(num, true);
            String denStr = latex(den, true);
            if (ExprShapes.needsParensInMul(num)) {
                numStr = "\\left( " + numStr + " \\right)";
            }
            if (ExprShapes.needsParensInMul(den)) {
                denStr = "\\left( " + denStr + " \\right)";
            }
            return numStr + " / " + denStr;
        }
        return "\\frac{" + latex(num, false) + "}{" + latex(den, false) + "}";
    }

    private String sub(Application app, boolean inSmall) {
        List<String> a = args(app, inSmall);
        for (int i = 1; i < a.size(); i++) {
            if (app.arg(i).hasHead(NEG, SUB)) {
                a.set(i, "\\left(" + a.get(i) + "\\right)");
            }
        }
        return String.join(" - ", a);
    }

    private String mul(Application app, boolean inSmall) {
        List<String> a = args(app, inSmall);
        for (int i = 0; i < a.size(); i++) {
            if (ExprShapes.needsParensInMul(app.arg(i))) {
                a.set(i, "\\left(" + a.get(i) + "\\right)");
            }
        }
        return String.join(" ", a);
    }

    private String pow(Application app, boolean inSmall) {
        requireArity(app, 2);
        Expr base = app.arg(0);
        Expr expo = app.arg(1);
        // Powers of named functions attach the exponent to the function symbol: \sin^{2}(x)
        if (base instanceof Application call) {
            if (call.hasHead(SIN, COS, CSC, TAN, SINH, COSH, TANH, DEDEKIND_ETA) && call.arity() >= 1) {
                return latex(call.head(), false) + "^{" + latex(expo, true) + "}"
                        + "\\!\\left(" + latex(call.arg(0), inSmall) + "\\right)";
            }
            if (call.hasHead(FIBONACCI) && call.arity() == 1) {
                return "F_{" + latex(call.arg(0), inSmall) + "}^{" + latex(expo, true) + "}";
            }
            if (call.hasHead(JACOBI_THETA1, JACOBI_THETA2, JACOBI_THETA3, JACOBI_THETA4) && call.arity() == 2) {
                return latex(call.head(), false) + "^{" + latex(expo, true) + "}\\!\\left("
                        + latex(call.arg(0), false) + ", " + latex(call.arg(1), false) + "\\right)";
            }
            String subscriptSpelling = symbols.subscriptCallSpelling(call.head());
            if (subscriptSpelling != null && call.arity() == 2) {
                return subscriptSpelling + "_{" + latex(call.arg(0), true) + "}^{" + latex(expo, true) + "}"
                        + "\\!\\left(" + latex(call.arg(1), inSmall) + "\\right)";
            }
        }
        String baseStr = latex(base, inSmall);
        String expoStr = latex(expo, true);
        if (base.isSymbol() || ExprShapes.isNonNegativeInteger(base)
                || base.hasHead(ABS, BINOMIAL, PRIME_NUMBER, MATRIX2X2, PARENTHESES, BRACES, BRACKETS)) {
            return "{" + baseStr + "}^{" + expoStr + "}";
        }
        return "{\\left(" + baseStr + "\\right)}^{" + expoStr + "}";
    }

    private String factorial(Application app, boolean inSmall) {
        Expr arg = single(app);
        String bang = app.hasHead(DOUBLE_FACTORIAL) ? "!!" : "!";
        String argStr = latex(arg, inSmall);
        if (arg.isSymbol() || ExprShapes.isNonNegativeInteger(arg)) {
            return argStr + " " + bang;
        }
        return "\\left(" + argStr + "\\right)" + bang;
    }

    private String decimal(Application app) {
        Expr arg = single(app);
        if (!(arg instanceof TextAtom digits)) {
            throw new MalformedExprException("Decimal expects a text argument but got " + arg.toSourceString());
        }
        String text = digits.value();
        int e = text.indexOf('e');
        if (e >= 0) {
            String mantissa = text.substring(0, e);
            String exponent = stripLeadingPlus(text.substring(e + 1));
            return mantissa + " \\cdot 10^{" + exponent + "}";
        }
        return text;
    }

    static String stripLeadingPlus(String s) {
        int i = 0;
        while (i < s.length() && s.charAt(i) == '+') {
            i++;
        }
        return s.substring(i);
    }

    // ==================== Calculus ====================

    private String integral(Application app, boolean inSmall) {
        requireArity(app, 2);
        IterationBound.Range range = IterationBound.range(app, app.arg(1));
        return "\\int_{" + latex(range.low(), true) + "}^{" + latex(range.high(), true) + "} "
                + latex(app.arg(0), inSmall) + " \\, d" + latex(range.variable(), false);
    }

    // IndefiniteIntegralEqual(f(z), g(z), z[, c])
    private String indefiniteIntegral(Application app, boolean inSmall) {
        if (app.arity() != 3 && app.arity() != 4) {
            throw MalformedExprException.arity(app, "3 or 4");
        }
        List<String> a = args(app, inSmall);
        String body = "\\int " + a.get(0) + " \\, d" + a.get(2) + " = " + a.get(1) + " + \\mathcal{C}";
        if (app.arity() == 4 && !app.arg(2).equals(app.arg(3))) {
            body += ", " + a.get(2) + " = " + a.get(3);
        }
        return body;
    }

    private String sumProduct(Application app, boolean inSmall) {
        String op = app.hasHead(SUM) ? "\\sum" : "\\prod";
        IterationBound bound = IterationBound.of(app);
        String summand = latex(app.arg(0), inSmall);
        if (bound instanceof IterationBound.Range range) {
            return op + "_{" + latex(range.variable(), false) + "=" + latex(range.low(), true) + "}^{"
                    + latex(range.high(), true) + "} " + summand;
        }
        if (bound instanceof IterationBound.Such such) {
            return op + "_{" + latex(such.predicate(), true) + "} " + summand;
        }
        return op + "_{" + latex(bound.variable(), false) + "} " + summand;
    }

    // DivisorSum(f(d), d, n[, P(d)])
    private String divisorSumProduct(Application app, boolean inSmall) {
        if (app.arity() != 3 && app.arity() != 4) {
            throw MalformedExprException.arity(app, "3 or 4");
        }
        String op = app.hasHead(DIVISOR_SUM) ? "\\sum" : "\\prod";
        String condition = latex(app.arg(1), false) + " \\mid " + latex(app.arg(2), true);
        if (app.arity() == 4) {
            condition += ",\\, " + latex(app.arg(3), true);
        }
        return op + "_{" + condition + "} " + latex(app.arg(0), inSmall);
    }

    // PrimeSum(f(p), p[, P(p)])
    private String primeSumProduct(Application app, boolean inSmall) {
        String op = app.hasHead(PRIME_SUM) ? "\\sum" : "\\prod";
        if (app.arity() == 2) {
            return op + "_{" + latex(app.arg(1), false) + "} " + latex(app.arg(0), inSmall);
        }
        if (app.arity() == 3) {
            return op + "_{" + latex(app.arg(2), true) + "} " + latex(app.arg(0), inSmall);
        }
        throw MalformedExprException.arity(app, "2 or 3");
    }

    // Limit(f(x), x, point[, condition])
    private String limit(Application app) {
        if (app.arity() != 3 && app.arity() != 4) {
            throw MalformedExprException.arity(app, "3 or 4");
        }
        String condition = app.arity() == 4 ? ", " + latex(app.arg(3), true) : "";
        String var = latex(app.arg(1), false);
        Expr point = app.arg(2);
        String pointStr = latex(point, true);
        String formula = latex(app.arg(0), false);
        if (!point.isAtom() && !point.hasHead(ABS)) {
            formula = "\\left[ " + formula + " \\right]";
        }
        if (app.hasHead(LEFT_LIMIT)) {
            return "\\lim_{" + var + " \\to {" + pointStr + "}^{-}" + condition + "} " + formula;
        }
        if (app.hasHead(RIGHT_LIMIT)) {
            return "\\lim_{" + var + " \\to {" + pointStr + "}^{+}" + condition + "} " + formula;
        }
        return "\\lim_{" + var + " \\to " + pointStr + condition + "} " + formula;
    }

    // Minimum(f(x), x, P(x)) and friends; Minimum(S) for a plain set
    private String extremum(Application app, boolean inSmall) {
        String op = EXTREMUM_NAMES.get(app.head());
        if (app.arity() == 1 && app.hasHead(MINIMUM, MAXIMUM, SUPREMUM, INFIMUM)) {
            return op + "\\left(" + latex(app.arg(0), inSmall) + "\\right)";
        }
        requireArity(app, 3);
        IterationBound.Such bound = (IterationBound.Such) IterationBound.of(app);
        Expr formula = app.arg(0);
        String formulaStr = formula.hasHead(ADD, SUB)
                ? "\\left(" + latex(formula, false) + "\\right)"
                : latex(formula, false);
        return "\\mathop{" + op + "}\\limits_{" + latex(bound.predicate(), true) + "} " + formulaStr;
    }

    // ComplexZeroMultiplicity(f(z), z, point), Residue(f(z), z, point)
    private String pointOperator(Application app, boolean inSmall, String op) {
        List<String> a = fixed(app, 3, inSmall);
        if (app.arg(1).equals(app.arg(2))) {
            return "\\mathop{" + op + "}\\limits_{" + a.get(2) + "} " + a.get(0);
        }
        return "\\mathop{" + op + "}\\limits_{" + a.get(1) + "=" + a.get(2) + "} " + a.get(0);
    }

    private String derivative(Application app, boolean inSmall) {
        DerivativeSpec d = DerivativeSpec.of(app);
        int small = d.smallOrder();
        if (d.function() instanceof Application f) {
            Expr fHead = f.head();
            // f(x) differentiated in x: prime notation f'(point)
            if (fHead.isSymbol() && !f.hasHead(EXP, SQRT) && f.args().equals(List.of(d.variable()))) {
                String fStr = latex(fHead, false);
                String pointStr = latex(d.point(), true);
                if (small >= 0) {
                    return fStr + "'".repeat(small) + "(" + pointStr + ")";
                }
                return "{" + fStr + "}^{(" + latex(d.order(), false) + ")}(" + pointStr + ")";
            }
            // F(n, x) differentiated in x: F'_n(point)
            String subscriptSpelling = symbols.subscriptCallSpelling(fHead);
            if (subscriptSpelling != null && f.arity() == 2 && f.arg(1).equals(d.variable())) {
                String index = latex(f.arg(0), true);
                String pointStr = latex(d.point(), true);
                if (small >= 0) {
                    return subscriptSpelling + "'".repeat(small) + "_{" + index + "}(" + pointStr + ")";
                }
                return "{" + subscriptSpelling + "}^{(" + latex(d.order(), false) + ")}_{" + index + "}(" + pointStr + ")";
            }
        }
        String varStr = latex(d.variable(), false);
        String orderStr = latex(d.order(), false);
        String body = latex(d.function(), inSmall);
        boolean firstOrder = d.order() instanceof IntegerAtom i && i.isValue(1);
        String operator = firstOrder
                ? "\\frac{d}{d " + varStr + "}\\, " + body
                : "\\frac{d^{" + orderStr + "}}{{d " + varStr + "}^{" + orderStr + "}} " + body;
        if (d.evaluatedAtVariable()) {
            return operator;
        }
        return "\\left[ " + operator + " \\right]_{" + varStr + " = " + latex(d.point(), true) + "}";
    }

    /**
     * Attaches a derivative order to a function letter: W, W', W'', W''' or W^{(r)}.
     */
    private String withDerivativeOrder(String letter, Expr order, boolean inSmall) {
        if (order instanceof IntegerAtom r && r.between(0, 3)) {
            return letter + "'".repeat(r.value().intValue());
        }
        return letter + "^{(" + latex(order, inSmall) + ")}";
    }

    // ==================== Special functions ====================

    // CoulombH(omega, l, eta, z)
    private String coulombH(Application app) {
        requireArity(app, 4);
        Expr omega = app.arg(0);
        String omegaStr;
        if (omega instanceof IntegerAtom w) {
            omegaStr = w.isValue(-1) ? "-" : "+";
        } else {
            omegaStr = latex(omega, true);
        }
        return "H^{" + omegaStr + "}_{" + latex(app.arg(1), true) + "," + latex(app.arg(2), true) + "}\\!\\left("
                + latex(app.arg(3), false) + "\\right)";
    }

    // LambertW(k, z[, r])
    private String lambertW(Application app, boolean inSmall) {
        if (app.arity() == 2) {
            return "W_{" + latex(app.arg(0), true) + "}\\!\\left(" + latex(app.arg(1), inSmall) + "\\right)";
        }
        if (app.arity() == 3) {
            return withDerivativeOrder("W", app.arg(2), inSmall) + "_{" + latex(app.arg(0), true) + "}"
                    + "\\!\\left(" + latex(app.arg(1), inSmall) + "\\right)";
        }
        throw MalformedExprException.arity(app, "2 or 3");
    }

    private String interval(Application app, boolean inSmall) {
        List<String> a = fixed(app, 2, inSmall);
        String open = app.hasHead(CLOSED_INTERVAL, CLOSED_OPEN_INTERVAL) ? "\\left[" : "\\left(";
        String close = app.hasHead(CLOSED_INTERVAL, OPEN_CLOSED_INTERVAL) ? "\\right]" : "\\right)";
        return open + a.get(0) + ", " + a.get(1) + close;
    }

    // ==================== Logic ====================

    private String and(Application app, boolean inSmall) {
        List<String> a = args(app, inSmall);
        for (int i = 0; i < a.size(); i++) {
            if (app.arg(i).hasHead(AND, OR)) {
                a.set(i, "\\left(" + a.get(i) + "\\right)");
            }
        }
        return String.join(inSmall ? ",\\," : AND_JOIN, a);
    }

    private String or(Application app, boolean inSmall) {
        List<String> a = args(app, inSmall);
        for (int i = 0; i < a.size(); i++) {
            if (app.arg(i).hasHead(AND, OR, NOT)) {
                a.set(i, "\\left(" + a.get(i) + "\\right)");
            }
        }
        return String.join(OR_JOIN, a);
    }

    // Cases(Tuple(value, condition), ..., Tuple(value, Otherwise))
    private String cases(Application app, boolean inSmall) {
        StringBuilder sb = new StringBuilder("\\begin{cases} ");
        for (Expr arg : app.args()) {
            if (!arg.hasHead(TUPLE) || arg.args().size() != 2) {
                throw new MalformedExprException("Cases expects Tuple(value, condition) arguments but got "
                        + arg.toSourceString());
            }
            Expr value = arg.args().get(0);
            Expr condition = arg.args().get(1);
            String conditionStr = OTHERWISE.equals(condition) ? "\\text{otherwise}" : latex(condition, inSmall);
            sb.append(latex(value, inSmall)).append(", & ").append(conditionStr).append("\\\\");
        }
        return sb.append(" \\end{cases}").toString();
    }

    private String description(Application app) {
        StringBuilder sb = new StringBuilder();
        for (Expr arg : app.args()) {
            if (arg instanceof TextAtom text) {
                sb.append("\\text{ ").append(text.value()).append(" }");
            } else {
                sb.append(latex(arg, false));
            }
        }
        return sb.toString();
    }

    // ==================== Helpers ====================

    private List<String> args(Application app, boolean inSmall) {
        List<String> result = new ArrayList<>(app.arity());
        for (Expr arg : app.args()) {
            result.add(latex(arg, inSmall));
        }
        return result;
    }

    private List<String> fixed(Application app, int arity, boolean inSmall) {
        requireArity(app, arity);
        return args(app, inSmall);
    }

    private String unary(Application app, boolean inSmall) {
        return latex(single(app), inSmall);
    }

    private static Expr single(Application app) {
        requireArity(app, 1);
        return app.arg(0);
    }

    private static void requireArity(Application app, int arity) {
        if (app.arity() != arity) {
            throw MalformedExprException.arity(app, String.valueOf(arity));
        }
    }
}
