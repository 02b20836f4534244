package org.fungrim.lite.symbol;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rendering class of a head symbol.
 *
 * Each kind claims the builtin names it renders; the symbol table resolves a
 * symbol's kind once, at registration. INFIX and SUBSCRIPT_CALL are assigned
 * from the symbol table's spelling tables rather than by name, and GENERIC
 * covers every head without a bespoke template.
 */
public enum OperatorKind {

    GENERIC,
    INFIX,
    SUBSCRIPT_CALL,

    // ===== Arithmetic =====
    EXP("Exp"),
    DIV("Div"),
    POS("Pos"),
    NEG("Neg"),
    ADD("Add"),
    SUB("Sub"),
    MUL("Mul"),
    POW("Pow"),
    SQRT("Sqrt"),
    ABS("Abs"),
    FLOOR("Floor"),
    CEIL("Ceil"),
    CONJUGATE("Conjugate"),
    DECIMAL("Decimal"),

    // ===== Calculus =====
    INTEGRAL("Integral"),
    INDEFINITE_INTEGRAL_EQUAL("IndefiniteIntegralEqual", "RealIndefiniteIntegralEqual", "ComplexIndefiniteIntegralEqual"),
    SUM_PRODUCT("Sum", "Product"),
    DIVISOR_SUM_PRODUCT("DivisorSum", "DivisorProduct"),
    PRIME_SUM_PRODUCT("PrimeSum", "PrimeProduct"),
    LIMIT("Limit", "SequenceLimit", "RealLimit", "LeftLimit", "RightLimit", "ComplexLimit", "MeromorphicLimit"),
    EXTREMUM("Minimum", "Maximum", "ArgMin", "ArgMax", "ArgMinUnique", "ArgMaxUnique",
            "Supremum", "Infimum", "Zeros", "UniqueZero", "Solutions", "UniqueSolution"),
    COMPLEX_ZERO_MULTIPLICITY("ComplexZeroMultiplicity"),
    RESIDUE("Residue"),
    DERIVATIVE("Derivative", "RealDerivative", "ComplexDerivative", "ComplexBranchDerivative", "MeromorphicDerivative"),
    ASYMPTOTIC_TO("AsymptoticTo"),

    // ===== Collections and grouping =====
    TUPLE("Tuple"),
    SET("Set"),
    LIST("List"),
    PARENTHESES("Parentheses"),
    BRACKETS("Brackets"),
    BRACES("Braces"),
    CALL("Call"),
    SUBSCRIPT("Subscript"),
    WHERE("Where"),
    SET_BUILDER("SetBuilder"),
    CARDINALITY("Cardinality"),
    CASES("Cases"),
    MATRIX_2X2("Matrix2x2"),
    MATRIX_2X1("Matrix2x1"),
    MATRIX_FUNCTION("Spectrum", "Det"),

    // ===== Indexed numbers =====
    INDEXED("BernoulliB", "BellNumber", "HarmonicNumber", "PrimeNumber", "RiemannZetaZero", "DirichletLZero",
            "LegendrePolynomialZero", "GaussLegendreWeight", "GeneralizedBernoulliB", "LambertWPuiseuxCoefficient",
            "BernsteinEllipse", "ConreyGenerator", "DirichletGroup"),
    FIBONACCI("Fibonacci"),

    // ===== Special functions =====
    BESSEL("BesselJ", "BesselY", "BesselI", "BesselK", "HankelH1", "HankelH2"),
    BESSEL_DERIVATIVE("BesselJDerivative", "BesselYDerivative", "BesselIDerivative", "BesselKDerivative"),
    COULOMB_FG("CoulombF", "CoulombG"),
    COULOMB_H("CoulombH"),
    COULOMB_C("CoulombC"),
    COULOMB_SIGMA("CoulombSigma"),
    FACTORIAL("Factorial", "DoubleFactorial"),
    RISING_FACTORIAL("RisingFactorial"),
    FALLING_FACTORIAL("FallingFactorial"),
    BINOMIAL("Binomial"),
    STIRLING_CYCLE("StirlingCycle"),
    STIRLING_S1("StirlingS1"),
    STIRLING_S2("StirlingS2"),
    LAMBERT_W("LambertW"),
    KRONECKER_DELTA("KroneckerDelta"),
    RESIDUE_SYMBOL("LegendreSymbol", "JacobiSymbol", "KroneckerSymbol"),
    HYPERGEOMETRIC_U_STAR_REMAINDER("HypergeometricUStarRemainder"),
    STIELTJES_GAMMA("StieltjesGamma"),
    STIRLING_SERIES_REMAINDER("StirlingSeriesRemainder"),

    // ===== Logic =====
    AND("And"),
    OR("Or"),
    NOT("Not"),
    IMPLIES("Implies"),
    EQUIVALENT("Equivalent"),
    EQUAL_AND_ELEMENT("EqualAndElement"),
    FOR_ALL("ForAll"),
    EXISTS("Exists"),

    // ===== Number theory and sets =====
    CONGRUENT_MOD("CongruentMod"),
    ODD("Odd"),
    EVEN("Even"),
    ZZ_GREATER_EQUAL("ZZGreaterEqual"),
    ZZ_LESS_EQUAL("ZZLessEqual"),
    ZZ_BETWEEN("ZZBetween"),
    INTERVAL("ClosedInterval", "OpenInterval", "ClosedOpenInterval", "OpenClosedInterval"),
    REAL_BALL("RealBall"),
    LATTICE("Lattice"),
    DIRICHLET_CHARACTER("DirichletCharacter"),
    PRIMITIVE_DIRICHLET_CHARACTERS("PrimitiveDirichletCharacters"),
    GAUSS_SUM("GaussSum"),
    DISCRETE_LOG("DiscreteLog"),

    // ===== Modular forms and series =====
    MODULAR_GROUP_ACTION("ModularGroupAction"),
    QUADRATIC_FORMS("PrimitiveReducedPositiveIntegralBinaryQuadraticForms"),
    FORMAL_POWER_SERIES("FormalPowerSeries"),
    FORMAL_LAURENT_SERIES("FormalLaurentSeries"),
    SERIES_COEFFICIENT("SeriesCoefficient"),
    FORMAL_GENERATOR("FormalGenerator"),
    Q_SERIES_COEFFICIENT("QSeriesCoefficient"),
    EQUAL_Q_SERIES_ELLIPSIS("EqualQSeriesEllipsis"),

    // ===== Prose =====
    DESCRIPTION("Description");

    private static final Map<String, OperatorKind> BY_NAME = new HashMap<>();

    static {
        for (OperatorKind kind : values()) {
            for (String name : kind.names) {
                OperatorKind previous = BY_NAME.put(name, kind);
                if (previous != null) {
                    throw new IllegalStateException("Symbol " + name + " claimed by both " + previous + " and " + kind);
                }
            }
        }
    }

    private final List<String> names;

    OperatorKind(String... names) {
        this.names = List.of(names);
    }

    /**
     * @return The symbol names this kind renders (empty for table-driven kinds)
     */
    public List<String> names() {
        return names;
    }

    /**
     * Resolves the kind claimed for a symbol name, or GENERIC when none is.
     */
    public static OperatorKind forName(String name) {
        return BY_NAME.getOrDefault(name, GENERIC);
    }
}
