package org.fungrim.lite.expr;

import java.util.List;

/**
 * Canonical builtin symbols.
 *
 * Symbols are compared by name, so these constants are equal to any symbol
 * of the same name built elsewhere (parsed from source, looked up in a
 * symbol table). Rendering metadata for them lives in the symbol table.
 */
public final class Builtins {

    private Builtins() {
    }

    // ==================== Core math builtins ====================

    public static final Symbol TRUE = Symbol.of("True_");
    public static final Symbol FALSE = Symbol.of("False_");

    public static final Symbol PARENTHESES = Symbol.of("Parentheses");
    public static final Symbol BRACKETS = Symbol.of("Brackets");
    public static final Symbol BRACES = Symbol.of("Braces");

    public static final Symbol ELLIPSIS = Symbol.of("Ellipsis");
    public static final Symbol CALL = Symbol.of("Call");
    public static final Symbol SUBSCRIPT = Symbol.of("Subscript");

    public static final Symbol UNKNOWN = Symbol.of("Unknown");
    public static final Symbol UNDEFINED = Symbol.of("Undefined");

    public static final Symbol WHERE = Symbol.of("Where");

    public static final Symbol SET = Symbol.of("Set");
    public static final Symbol LIST = Symbol.of("List");
    public static final Symbol TUPLE = Symbol.of("Tuple");

    public static final Symbol SET_BUILDER = Symbol.of("SetBuilder");

    public static final Symbol POWER_SET = Symbol.of("PowerSet");

    public static final Symbol UNION = Symbol.of("Union");
    public static final Symbol INTERSECTION = Symbol.of("Intersection");
    public static final Symbol SET_MINUS = Symbol.of("SetMinus");
    public static final Symbol NOT = Symbol.of("Not");
    public static final Symbol AND = Symbol.of("And");
    public static final Symbol OR = Symbol.of("Or");
    public static final Symbol EQUIVALENT = Symbol.of("Equivalent");
    public static final Symbol IMPLIES = Symbol.of("Implies");

    public static final Symbol CARDINALITY = Symbol.of("Cardinality");

    public static final Symbol ELEMENT = Symbol.of("Element");
    public static final Symbol NOT_ELEMENT = Symbol.of("NotElement");
    public static final Symbol SUBSET = Symbol.of("Subset");
    public static final Symbol SUBSET_EQUAL = Symbol.of("SubsetEqual");

    public static final Symbol FOR_ALL = Symbol.of("ForAll");
    public static final Symbol EXISTS = Symbol.of("Exists");

    public static final Symbol EQUAL_AND_ELEMENT = Symbol.of("EqualAndElement");

    public static final Symbol RINGS = Symbol.of("Rings");
    public static final Symbol COMMUTATIVE_RINGS = Symbol.of("CommutativeRings");
    public static final Symbol FIELDS = Symbol.of("Fields");

    public static final Symbol PP = Symbol.of("PP");
    public static final Symbol ZZ = Symbol.of("ZZ");
    public static final Symbol QQ = Symbol.of("QQ");
    public static final Symbol RR = Symbol.of("RR");
    public static final Symbol CC = Symbol.of("CC");
    public static final Symbol HH = Symbol.of("HH");
    public static final Symbol ALGEBRAIC_NUMBERS = Symbol.of("AlgebraicNumbers");

    public static final Symbol ZZ_GREATER_EQUAL = Symbol.of("ZZGreaterEqual");
    public static final Symbol ZZ_LESS_EQUAL = Symbol.of("ZZLessEqual");
    public static final Symbol ZZ_BETWEEN = Symbol.of("ZZBetween");

    public static final Symbol CLOSED_INTERVAL = Symbol.of("ClosedInterval");
    public static final Symbol OPEN_INTERVAL = Symbol.of("OpenInterval");
    public static final Symbol CLOSED_OPEN_INTERVAL = Symbol.of("ClosedOpenInterval");
    public static final Symbol OPEN_CLOSED_INTERVAL = Symbol.of("OpenClosedInterval");

    public static final Symbol REAL_BALL = Symbol.of("RealBall");

    public static final Symbol UNIT_CIRCLE = Symbol.of("UnitCircle");

    public static final Symbol OPEN_DISK = Symbol.of("OpenDisk");
    public static final Symbol CLOSED_DISK = Symbol.of("ClosedDisk");
    public static final Symbol BERNSTEIN_ELLIPSE = Symbol.of("BernsteinEllipse");

    public static final Symbol INTERIOR_CLOSURE = Symbol.of("InteriorClosure");
    public static final Symbol INTERIOR = Symbol.of("Interior");

    public static final Symbol DECIMAL = Symbol.of("Decimal");

    public static final Symbol EQUAL = Symbol.of("Equal");
    public static final Symbol UNEQUAL = Symbol.of("Unequal");
    public static final Symbol GREATER = Symbol.of("Greater");
    public static final Symbol GREATER_EQUAL = Symbol.of("GreaterEqual");
    public static final Symbol LESS = Symbol.of("Less");
    public static final Symbol LESS_EQUAL = Symbol.of("LessEqual");

    public static final Symbol POS = Symbol.of("Pos");
    public static final Symbol NEG = Symbol.of("Neg");
    public static final Symbol ADD = Symbol.of("Add");
    public static final Symbol SUB = Symbol.of("Sub");
    public static final Symbol MUL = Symbol.of("Mul");
    public static final Symbol DIV = Symbol.of("Div");
    public static final Symbol MOD = Symbol.of("Mod");
    public static final Symbol INV = Symbol.of("Inv");
    public static final Symbol POW = Symbol.of("Pow");

    public static final Symbol CONGRUENT_MOD = Symbol.of("CongruentMod");
    public static final Symbol ODD = Symbol.of("Odd");
    public static final Symbol EVEN = Symbol.of("Even");

    public static final Symbol MAX = Symbol.of("Max");
    public static final Symbol MIN = Symbol.of("Min");
    public static final Symbol SIGN = Symbol.of("Sign");
    public static final Symbol CSGN = Symbol.of("Csgn");
    public static final Symbol ABS = Symbol.of("Abs");
    public static final Symbol FLOOR = Symbol.of("Floor");
    public static final Symbol CEIL = Symbol.of("Ceil");
    public static final Symbol ARG = Symbol.of("Arg");
    public static final Symbol RE = Symbol.of("Re");
    public static final Symbol IM = Symbol.of("Im");
    public static final Symbol CONJUGATE = Symbol.of("Conjugate");

    public static final Symbol NEAREST_DECIMAL = Symbol.of("NearestDecimal");

    public static final Symbol MINIMUM = Symbol.of("Minimum");
    public static final Symbol MAXIMUM = Symbol.of("Maximum");
    public static final Symbol ARG_MIN = Symbol.of("ArgMin");
    public static final Symbol ARG_MAX = Symbol.of("ArgMax");
    public static final Symbol ARG_MIN_UNIQUE = Symbol.of("ArgMinUnique");
    public static final Symbol ARG_MAX_UNIQUE = Symbol.of("ArgMaxUnique");

    public static final Symbol SOLUTIONS = Symbol.of("Solutions");
    public static final Symbol UNIQUE_SOLUTION = Symbol.of("UniqueSolution");

    public static final Symbol SUPREMUM = Symbol.of("Supremum");
    public static final Symbol INFIMUM = Symbol.of("Infimum");

    public static final Symbol LIMIT = Symbol.of("Limit");
    public static final Symbol SEQUENCE_LIMIT = Symbol.of("SequenceLimit");
    public static final Symbol REAL_LIMIT = Symbol.of("RealLimit");
    public static final Symbol LEFT_LIMIT = Symbol.of("LeftLimit");
    public static final Symbol RIGHT_LIMIT = Symbol.of("RightLimit");
    public static final Symbol COMPLEX_LIMIT = Symbol.of("ComplexLimit");
    public static final Symbol MEROMORPHIC_LIMIT = Symbol.of("MeromorphicLimit");

    public static final Symbol DERIVATIVE = Symbol.of("Derivative");
    public static final Symbol REAL_DERIVATIVE = Symbol.of("RealDerivative");
    public static final Symbol COMPLEX_DERIVATIVE = Symbol.of("ComplexDerivative");
    public static final Symbol COMPLEX_BRANCH_DERIVATIVE = Symbol.of("ComplexBranchDerivative");
    public static final Symbol MEROMORPHIC_DERIVATIVE = Symbol.of("MeromorphicDerivative");

    public static final Symbol SUM = Symbol.of("Sum");
    public static final Symbol PRODUCT = Symbol.of("Product");

    public static final Symbol PRIME_SUM = Symbol.of("PrimeSum");
    public static final Symbol DIVISOR_SUM = Symbol.of("DivisorSum");
    public static final Symbol PRIME_PRODUCT = Symbol.of("PrimeProduct");
    public static final Symbol DIVISOR_PRODUCT = Symbol.of("DivisorProduct");

    public static final Symbol INTEGRAL = Symbol.of("Integral");

    public static final Symbol INDEFINITE_INTEGRAL_EQUAL = Symbol.of("IndefiniteIntegralEqual");
    public static final Symbol REAL_INDEFINITE_INTEGRAL_EQUAL = Symbol.of("RealIndefiniteIntegralEqual");
    public static final Symbol COMPLEX_INDEFINITE_INTEGRAL_EQUAL = Symbol.of("ComplexIndefiniteIntegralEqual");

    public static final Symbol ASYMPTOTIC_TO = Symbol.of("AsymptoticTo");

    public static final Symbol FORMAL_GENERATOR = Symbol.of("FormalGenerator");

    public static final Symbol FORMAL_POWER_SERIES = Symbol.of("FormalPowerSeries");
    public static final Symbol FORMAL_LAURENT_SERIES = Symbol.of("FormalLaurentSeries");
    public static final Symbol SERIES_COEFFICIENT = Symbol.of("SeriesCoefficient");

    public static final Symbol HOLOMORPHIC_DOMAIN = Symbol.of("HolomorphicDomain");
    public static final Symbol POLES = Symbol.of("Poles");
    public static final Symbol BRANCH_POINTS = Symbol.of("BranchPoints");
    public static final Symbol BRANCH_CUTS = Symbol.of("BranchCuts");
    public static final Symbol ESSENTIAL_SINGULARITIES = Symbol.of("EssentialSingularities");
    public static final Symbol ZEROS = Symbol.of("Zeros");
    public static final Symbol UNIQUE_ZERO = Symbol.of("UniqueZero");
    public static final Symbol ANALYTIC_CONTINUATION = Symbol.of("AnalyticContinuation");

    public static final Symbol COMPLEX_ZERO_MULTIPLICITY = Symbol.of("ComplexZeroMultiplicity");

    public static final Symbol RESIDUE = Symbol.of("Residue");

    public static final Symbol INFINITY = Symbol.of("Infinity");
    public static final Symbol UNSIGNED_INFINITY = Symbol.of("UnsignedInfinity");

    public static final Symbol SQRT = Symbol.of("Sqrt");
    public static final Symbol NTH_ROOT = Symbol.of("NthRoot");
    public static final Symbol LOG = Symbol.of("Log");
    public static final Symbol LOG_BASE = Symbol.of("LogBase");
    public static final Symbol EXP = Symbol.of("Exp");

    public static final Symbol SIN = Symbol.of("Sin");
    public static final Symbol COS = Symbol.of("Cos");
    public static final Symbol TAN = Symbol.of("Tan");
    public static final Symbol SEC = Symbol.of("Sec");
    public static final Symbol COT = Symbol.of("Cot");
    public static final Symbol CSC = Symbol.of("Csc");

    public static final Symbol ASIN = Symbol.of("Asin");
    public static final Symbol ACOS = Symbol.of("Acos");
    public static final Symbol ATAN = Symbol.of("Atan");
    public static final Symbol ATAN2 = Symbol.of("Atan2");
    public static final Symbol ASEC = Symbol.of("Asec");
    public static final Symbol ACOT = Symbol.of("Acot");
    public static final Symbol ACSC = Symbol.of("Acsc");

    public static final Symbol SINH = Symbol.of("Sinh");
    public static final Symbol COSH = Symbol.of("Cosh");
    public static final Symbol TANH = Symbol.of("Tanh");
    public static final Symbol SECH = Symbol.of("Sech");
    public static final Symbol COTH = Symbol.of("Coth");
    public static final Symbol CSCH = Symbol.of("Csch");

    public static final Symbol ASINH = Symbol.of("Asinh");
    public static final Symbol ACOSH = Symbol.of("Acosh");
    public static final Symbol ATANH = Symbol.of("Atanh");
    public static final Symbol ASECH = Symbol.of("Asech");
    public static final Symbol ACOTH = Symbol.of("Acoth");
    public static final Symbol ACSCH = Symbol.of("Acsch");

    public static final Symbol SINC = Symbol.of("Sinc");
    public static final Symbol LAMBERT_W = Symbol.of("LambertW");
    public static final Symbol LAMBERT_W_PUISEUX_COEFFICIENT = Symbol.of("LambertWPuiseuxCoefficient");

    public static final Symbol CONST_PI = Symbol.of("ConstPi");
    public static final Symbol CONST_E = Symbol.of("ConstE");
    public static final Symbol CONST_GAMMA = Symbol.of("ConstGamma");
    public static final Symbol CONST_I = Symbol.of("ConstI");
    public static final Symbol GOLDEN_RATIO = Symbol.of("GoldenRatio");

    public static final Symbol BINOMIAL = Symbol.of("Binomial");
    public static final Symbol FACTORIAL = Symbol.of("Factorial");
    public static final Symbol DOUBLE_FACTORIAL = Symbol.of("DoubleFactorial");
    public static final Symbol GAMMA_FUNCTION = Symbol.of("GammaFunction");
    public static final Symbol LOG_GAMMA = Symbol.of("LogGamma");
    public static final Symbol DIGAMMA_FUNCTION = Symbol.of("DigammaFunction");
    public static final Symbol POLY_GAMMA = Symbol.of("PolyGamma");
    public static final Symbol RISING_FACTORIAL = Symbol.of("RisingFactorial");
    public static final Symbol FALLING_FACTORIAL = Symbol.of("FallingFactorial");
    public static final Symbol HARMONIC_NUMBER = Symbol.of("HarmonicNumber");
    public static final Symbol STIRLING_SERIES_REMAINDER = Symbol.of("StirlingSeriesRemainder");

    public static final Symbol ERF = Symbol.of("Erf");
    public static final Symbol ERFC = Symbol.of("Erfc");
    public static final Symbol ERFI = Symbol.of("Erfi");

    public static final Symbol UPPER_GAMMA = Symbol.of("UpperGamma");
    public static final Symbol LOWER_GAMMA = Symbol.of("LowerGamma");

    public static final Symbol BERNOULLI_B = Symbol.of("BernoulliB");
    public static final Symbol BERNOULLI_POLYNOMIAL = Symbol.of("BernoulliPolynomial");
    public static final Symbol EULER_E = Symbol.of("EulerE");
    public static final Symbol EULER_POLYNOMIAL = Symbol.of("EulerPolynomial");

    public static final Symbol STIRLING_CYCLE = Symbol.of("StirlingCycle");
    public static final Symbol STIRLING_S1 = Symbol.of("StirlingS1");
    public static final Symbol STIRLING_S2 = Symbol.of("StirlingS2");
    public static final Symbol BELL_NUMBER = Symbol.of("BellNumber");

    public static final Symbol RIEMANN_ZETA = Symbol.of("RiemannZeta");
    public static final Symbol RIEMANN_ZETA_ZERO = Symbol.of("RiemannZetaZero");

    public static final Symbol BESSEL_J = Symbol.of("BesselJ");
    public static final Symbol BESSEL_I = Symbol.of("BesselI");
    public static final Symbol BESSEL_Y = Symbol.of("BesselY");
    public static final Symbol BESSEL_K = Symbol.of("BesselK");
    public static final Symbol HANKEL_H1 = Symbol.of("HankelH1");
    public static final Symbol HANKEL_H2 = Symbol.of("HankelH2");

    public static final Symbol BESSEL_J_DERIVATIVE = Symbol.of("BesselJDerivative");
    public static final Symbol BESSEL_I_DERIVATIVE = Symbol.of("BesselIDerivative");
    public static final Symbol BESSEL_Y_DERIVATIVE = Symbol.of("BesselYDerivative");
    public static final Symbol BESSEL_K_DERIVATIVE = Symbol.of("BesselKDerivative");

    public static final Symbol COULOMB_F = Symbol.of("CoulombF");
    public static final Symbol COULOMB_G = Symbol.of("CoulombG");
    public static final Symbol COULOMB_H = Symbol.of("CoulombH");
    public static final Symbol COULOMB_C = Symbol.of("CoulombC");
    public static final Symbol COULOMB_SIGMA = Symbol.of("CoulombSigma");

    public static final Symbol HYPERGEOMETRIC0_F1 = Symbol.of("Hypergeometric0F1");
    public static final Symbol HYPERGEOMETRIC1_F1 = Symbol.of("Hypergeometric1F1");
    public static final Symbol HYPERGEOMETRIC2_F1 = Symbol.of("Hypergeometric2F1");
    public static final Symbol HYPERGEOMETRIC2_F0 = Symbol.of("Hypergeometric2F0");
    public static final Symbol HYPERGEOMETRIC3_F2 = Symbol.of("Hypergeometric3F2");

    public static final Symbol HYPERGEOMETRIC_U = Symbol.of("HypergeometricU");
    public static final Symbol HYPERGEOMETRIC_U_STAR = Symbol.of("HypergeometricUStar");

    public static final Symbol HYPERGEOMETRIC0_F1_REGULARIZED = Symbol.of("Hypergeometric0F1Regularized");
    public static final Symbol HYPERGEOMETRIC1_F1_REGULARIZED = Symbol.of("Hypergeometric1F1Regularized");
    public static final Symbol HYPERGEOMETRIC2_F1_REGULARIZED = Symbol.of("Hypergeometric2F1Regularized");
    public static final Symbol HYPERGEOMETRIC2_F0_REGULARIZED = Symbol.of("Hypergeometric2F0Regularized");
    public static final Symbol HYPERGEOMETRIC3_F2_REGULARIZED = Symbol.of("Hypergeometric3F2Regularized");

    public static final Symbol HYPERGEOMETRIC_U_STAR_REMAINDER = Symbol.of("HypergeometricUStarRemainder");

    public static final Symbol AIRY_AI = Symbol.of("AiryAi");
    public static final Symbol AIRY_BI = Symbol.of("AiryBi");
    public static final Symbol AIRY_AI_PRIME = Symbol.of("AiryAiPrime");
    public static final Symbol AIRY_BI_PRIME = Symbol.of("AiryBiPrime");

    public static final Symbol LEGENDRE_POLYNOMIAL = Symbol.of("LegendrePolynomial");
    public static final Symbol LEGENDRE_POLYNOMIAL_ZERO = Symbol.of("LegendrePolynomialZero");
    public static final Symbol GAUSS_LEGENDRE_WEIGHT = Symbol.of("GaussLegendreWeight");

    public static final Symbol HERMITE_POLYNOMIAL = Symbol.of("HermitePolynomial");

    public static final Symbol CHEBYSHEV_T = Symbol.of("ChebyshevT");
    public static final Symbol CHEBYSHEV_U = Symbol.of("ChebyshevU");

    public static final Symbol DEDEKIND_ETA = Symbol.of("DedekindEta");
    public static final Symbol EULER_Q_SERIES = Symbol.of("EulerQSeries");
    public static final Symbol DEDEKIND_ETA_EPSILON = Symbol.of("DedekindEtaEpsilon");
    public static final Symbol DEDEKIND_SUM = Symbol.of("DedekindSum");

    public static final Symbol JACOBI_THETA1 = Symbol.of("JacobiTheta1");
    public static final Symbol JACOBI_THETA2 = Symbol.of("JacobiTheta2");
    public static final Symbol JACOBI_THETA3 = Symbol.of("JacobiTheta3");
    public static final Symbol JACOBI_THETA4 = Symbol.of("JacobiTheta4");

    public static final Symbol DIVIDES = Symbol.of("Divides");

    public static final Symbol GCD = Symbol.of("GCD");
    public static final Symbol LCM = Symbol.of("LCM");
    public static final Symbol XGCD = Symbol.of("XGCD");
    public static final Symbol DIVISOR_SIGMA = Symbol.of("DivisorSigma");
    public static final Symbol MOEBIUS_MU = Symbol.of("MoebiusMu");
    public static final Symbol TOTIENT = Symbol.of("Totient");

    public static final Symbol LEGENDRE_SYMBOL = Symbol.of("LegendreSymbol");
    public static final Symbol JACOBI_SYMBOL = Symbol.of("JacobiSymbol");
    public static final Symbol KRONECKER_SYMBOL = Symbol.of("KroneckerSymbol");

    public static final Symbol FIBONACCI = Symbol.of("Fibonacci");

    public static final Symbol PARTITIONS_P = Symbol.of("PartitionsP");
    public static final Symbol HARDY_RAMANUJAN_A = Symbol.of("HardyRamanujanA");

    public static final Symbol KRONECKER_DELTA = Symbol.of("KroneckerDelta");

    public static final Symbol LATTICE = Symbol.of("Lattice");

    public static final Symbol WEIERSTRASS_P = Symbol.of("WeierstrassP");
    public static final Symbol WEIERSTRASS_ZETA = Symbol.of("WeierstrassZeta");
    public static final Symbol WEIERSTRASS_SIGMA = Symbol.of("WeierstrassSigma");

    public static final Symbol PRIME_NUMBER = Symbol.of("PrimeNumber");
    public static final Symbol PRIME_PI = Symbol.of("PrimePi");

    public static final Symbol RIEMANN_HYPOTHESIS = Symbol.of("RiemannHypothesis");

    public static final Symbol LOG_INTEGRAL = Symbol.of("LogIntegral");

    public static final Symbol MATRIX2X2 = Symbol.of("Matrix2x2");
    public static final Symbol MATRIX2X1 = Symbol.of("Matrix2x1");

    public static final Symbol SPECTRUM = Symbol.of("Spectrum");
    public static final Symbol DET = Symbol.of("Det");

    public static final Symbol SL2_Z = Symbol.of("SL2Z");
    public static final Symbol PSL2_Z = Symbol.of("PSL2Z");
    public static final Symbol MODULAR_GROUP_ACTION = Symbol.of("ModularGroupAction");
    public static final Symbol MODULAR_GROUP_FUNDAMENTAL_DOMAIN = Symbol.of("ModularGroupFundamentalDomain");

    public static final Symbol MODULAR_LAMBDA_FUNDAMENTAL_DOMAIN = Symbol.of("ModularLambdaFundamentalDomain");

    public static final Symbol MODULAR_J = Symbol.of("ModularJ");
    public static final Symbol MODULAR_LAMBDA = Symbol.of("ModularLambda");

    public static final Symbol PRIMITIVE_REDUCED_POSITIVE_INTEGRAL_BINARY_QUADRATIC_FORMS = Symbol.of("PrimitiveReducedPositiveIntegralBinaryQuadraticForms");

    public static final Symbol HILBERT_CLASS_POLYNOMIAL = Symbol.of("HilbertClassPolynomial");

    public static final Symbol DIRICHLET_CHARACTER = Symbol.of("DirichletCharacter");
    public static final Symbol DIRICHLET_GROUP = Symbol.of("DirichletGroup");
    public static final Symbol PRIMITIVE_DIRICHLET_CHARACTERS = Symbol.of("PrimitiveDirichletCharacters");

    public static final Symbol CONREY_GENERATOR = Symbol.of("ConreyGenerator");

    public static final Symbol DISCRETE_LOG = Symbol.of("DiscreteLog");

    public static final Symbol CASES = Symbol.of("Cases");
    public static final Symbol OTHERWISE = Symbol.of("Otherwise");

    public static final Symbol HURWITZ_ZETA = Symbol.of("HurwitzZeta");
    public static final Symbol DIRICHLET_L = Symbol.of("DirichletL");
    public static final Symbol GENERALIZED_BERNOULLI_B = Symbol.of("GeneralizedBernoulliB");

    public static final Symbol STIELTJES_GAMMA = Symbol.of("StieltjesGamma");

    public static final Symbol DIRICHLET_L_ZERO = Symbol.of("DirichletLZero");

    public static final Symbol GENERALIZED_RIEMANN_HYPOTHESIS = Symbol.of("GeneralizedRiemannHypothesis");

    public static final Symbol DIRICHLET_LAMBDA = Symbol.of("DirichletLambda");
    public static final Symbol GAUSS_SUM = Symbol.of("GaussSum");
    public static final Symbol JACOBI_SUM = Symbol.of("JacobiSum");

    public static final Symbol EISENSTEIN_G = Symbol.of("EisensteinG");
    public static final Symbol EISENSTEIN_E = Symbol.of("EisensteinE");

    public static final Symbol ELLIPTIC_K = Symbol.of("EllipticK");
    public static final Symbol ELLIPTIC_E = Symbol.of("EllipticE");

    public static final Symbol Q_SERIES_COEFFICIENT = Symbol.of("QSeriesCoefficient");
    public static final Symbol EQUAL_Q_SERIES_ELLIPSIS = Symbol.of("EqualQSeriesEllipsis");

    public static final Symbol BETA_FUNCTION = Symbol.of("BetaFunction");
    public static final Symbol INCOMPLETE_BETA = Symbol.of("IncompleteBeta");
    public static final Symbol INCOMPLETE_BETA_REGULARIZED = Symbol.of("IncompleteBetaRegularized");

    // ==================== Entry and topic structure ====================

    public static final Symbol ENTRY = Symbol.of("Entry");
    public static final Symbol FORMULA = Symbol.of("Formula");
    public static final Symbol ID = Symbol.of("ID");
    public static final Symbol ASSUMPTIONS = Symbol.of("Assumptions");
    public static final Symbol REFERENCES = Symbol.of("References");
    public static final Symbol VARIABLES = Symbol.of("Variables");
    public static final Symbol DOMAIN_CODOMAIN = Symbol.of("DomainCodomain");

    public static final Symbol DESCRIPTION = Symbol.of("Description");
    public static final Symbol TABLE = Symbol.of("Table");
    public static final Symbol TABLE_RELATION = Symbol.of("TableRelation");
    public static final Symbol TABLE_HEADINGS = Symbol.of("TableHeadings");
    public static final Symbol TABLE_COLUMN_HEADINGS = Symbol.of("TableColumnHeadings");
    public static final Symbol TABLE_SPLIT = Symbol.of("TableSplit");
    public static final Symbol TABLE_SECTION = Symbol.of("TableSection");

    public static final Symbol TOPIC = Symbol.of("Topic");
    public static final Symbol TITLE = Symbol.of("Title");
    public static final Symbol DEFINITIONS_TABLE = Symbol.of("DefinitionsTable");
    public static final Symbol SECTION = Symbol.of("Section");
    public static final Symbol SUBSECTION = Symbol.of("Subsection");
    public static final Symbol SEE_TOPICS = Symbol.of("SeeTopics");
    public static final Symbol ENTRIES = Symbol.of("Entries");
    public static final Symbol ENTRY_REFERENCE = Symbol.of("EntryReference");

    public static final Symbol SOURCE_FORM = Symbol.of("SourceForm");
    public static final Symbol SYMBOL_DEFINITION = Symbol.of("SymbolDefinition");

    public static final Symbol IMAGE = Symbol.of("Image");
    public static final Symbol IMAGE_SOURCE = Symbol.of("ImageSource");

    /**
     * Every builtin above, in declaration order.
     */
    public static final List<Symbol> ALL = List.of(
            TRUE, FALSE, PARENTHESES, BRACKETS, BRACES, ELLIPSIS, CALL, SUBSCRIPT, UNKNOWN, UNDEFINED, WHERE,
            SET, LIST, TUPLE, SET_BUILDER, POWER_SET, UNION, INTERSECTION, SET_MINUS, NOT, AND, OR,
            EQUIVALENT, IMPLIES, CARDINALITY, ELEMENT, NOT_ELEMENT, SUBSET, SUBSET_EQUAL, FOR_ALL, EXISTS,
            EQUAL_AND_ELEMENT, RINGS, COMMUTATIVE_RINGS, FIELDS, PP, ZZ, QQ, RR, CC, HH, ALGEBRAIC_NUMBERS,
            ZZ_GREATER_EQUAL, ZZ_LESS_EQUAL, ZZ_BETWEEN, CLOSED_INTERVAL, OPEN_INTERVAL,
            CLOSED_OPEN_INTERVAL, OPEN_CLOSED_INTERVAL, REAL_BALL, UNIT_CIRCLE, OPEN_DISK, CLOSED_DISK,
            BERNSTEIN_ELLIPSE, INTERIOR_CLOSURE, INTERIOR, DECIMAL, EQUAL, UNEQUAL, GREATER, GREATER_EQUAL,
            LESS, LESS_EQUAL, POS, NEG, ADD, SUB, MUL, DIV, MOD, INV, POW, CONGRUENT_MOD, ODD, EVEN, MAX,
            MIN, SIGN, CSGN, ABS, FLOOR, CEIL, ARG, RE, IM, CONJUGATE, NEAREST_DECIMAL, MINIMUM, MAXIMUM,
            ARG_MIN, ARG_MAX, ARG_MIN_UNIQUE, ARG_MAX_UNIQUE, SOLUTIONS, UNIQUE_SOLUTION, SUPREMUM, INFIMUM,
            LIMIT, SEQUENCE_LIMIT, REAL_LIMIT, LEFT_LIMIT, RIGHT_LIMIT, COMPLEX_LIMIT, MEROMORPHIC_LIMIT,
            DERIVATIVE, REAL_DERIVATIVE, COMPLEX_DERIVATIVE, COMPLEX_BRANCH_DERIVATIVE,
            MEROMORPHIC_DERIVATIVE, SUM, PRODUCT, PRIME_SUM, DIVISOR_SUM, PRIME_PRODUCT, DIVISOR_PRODUCT,
            INTEGRAL, INDEFINITE_INTEGRAL_EQUAL, REAL_INDEFINITE_INTEGRAL_EQUAL,
            COMPLEX_INDEFINITE_INTEGRAL_EQUAL, ASYMPTOTIC_TO, FORMAL_GENERATOR, FORMAL_POWER_SERIES,
            FORMAL_LAURENT_SERIES, SERIES_COEFFICIENT, HOLOMORPHIC_DOMAIN, POLES, BRANCH_POINTS, BRANCH_CUTS,
            ESSENTIAL_SINGULARITIES, ZEROS, UNIQUE_ZERO, ANALYTIC_CONTINUATION, COMPLEX_ZERO_MULTIPLICITY,
            RESIDUE, INFINITY, UNSIGNED_INFINITY, SQRT, NTH_ROOT, LOG, LOG_BASE, EXP, SIN, COS, TAN, SEC,
            COT, CSC, ASIN, ACOS, ATAN, ATAN2, ASEC, ACOT, ACSC, SINH, COSH, TANH, SECH, COTH, CSCH, ASINH,
            ACOSH, ATANH, ASECH, ACOTH, ACSCH, SINC, LAMBERT_W, LAMBERT_W_PUISEUX_COEFFICIENT, CONST_PI,
            CONST_E, CONST_GAMMA, CONST_I, GOLDEN_RATIO, BINOMIAL, FACTORIAL, DOUBLE_FACTORIAL,
            GAMMA_FUNCTION, LOG_GAMMA, DIGAMMA_FUNCTION, POLY_GAMMA, RISING_FACTORIAL, FALLING_FACTORIAL,
            HARMONIC_NUMBER, STIRLING_SERIES_REMAINDER, ERF, ERFC, ERFI, UPPER_GAMMA, LOWER_GAMMA,
            BERNOULLI_B, BERNOULLI_POLYNOMIAL, EULER_E, EULER_POLYNOMIAL, STIRLING_CYCLE, STIRLING_S1,
            STIRLING_S2, BELL_NUMBER, RIEMANN_ZETA, RIEMANN_ZETA_ZERO, BESSEL_J, BESSEL_I, BESSEL_Y,
            BESSEL_K, HANKEL_H1, HANKEL_H2, BESSEL_J_DERIVATIVE, BESSEL_I_DERIVATIVE, BESSEL_Y_DERIVATIVE,
            BESSEL_K_DERIVATIVE, COULOMB_F, COULOMB_G, COULOMB_H, COULOMB_C, COULOMB_SIGMA,
            HYPERGEOMETRIC0_F1, HYPERGEOMETRIC1_F1, HYPERGEOMETRIC2_F1, HYPERGEOMETRIC2_F0,
            HYPERGEOMETRIC3_F2, HYPERGEOMETRIC_U, HYPERGEOMETRIC_U_STAR, HYPERGEOMETRIC0_F1_REGULARIZED,
            HYPERGEOMETRIC1_F1_REGULARIZED, HYPERGEOMETRIC2_F1_REGULARIZED, HYPERGEOMETRIC2_F0_REGULARIZED,
            HYPERGEOMETRIC3_F2_REGULARIZED, HYPERGEOMETRIC_U_STAR_REMAINDER, AIRY_AI, AIRY_BI, AIRY_AI_PRIME,
            AIRY_BI_PRIME, LEGENDRE_POLYNOMIAL, LEGENDRE_POLYNOMIAL_ZERO, GAUSS_LEGENDRE_WEIGHT,
            HERMITE_POLYNOMIAL, CHEBYSHEV_T, CHEBYSHEV_U, DEDEKIND_ETA, EULER_Q_SERIES, DEDEKIND_ETA_EPSILON,
            DEDEKIND_SUM, JACOBI_THETA1, JACOBI_THETA2, JACOBI_THETA3, JACOBI_THETA4, DIVIDES, GCD, LCM,
            XGCD, DIVISOR_SIGMA, MOEBIUS_MU, TOTIENT, LEGENDRE_SYMBOL, JACOBI_SYMBOL, KRONECKER_SYMBOL,
            FIBONACCI, PARTITIONS_P, HARDY_RAMANUJAN_A, KRONECKER_DELTA, LATTICE, WEIERSTRASS_P,
            WEIERSTRASS_ZETA, WEIERSTRASS_SIGMA, PRIME_NUMBER, PRIME_PI, RIEMANN_HYPOTHESIS, LOG_INTEGRAL,
            MATRIX2X2, MATRIX2X1, SPECTRUM, DET, SL2_Z, PSL2_Z, MODULAR_GROUP_ACTION,
            MODULAR_GROUP_FUNDAMENTAL_DOMAIN, MODULAR_LAMBDA_FUNDAMENTAL_DOMAIN, MODULAR_J, MODULAR_LAMBDA,
            PRIMITIVE_REDUCED_POSITIVE_INTEGRAL_BINARY_QUADRATIC_FORMS, HILBERT_CLASS_POLYNOMIAL,
            DIRICHLET_CHARACTER, DIRICHLET_GROUP, PRIMITIVE_DIRICHLET_CHARACTERS, CONREY_GENERATOR,
            DISCRETE_LOG, CASES, OTHERWISE, HURWITZ_ZETA, DIRICHLET_L, GENERALIZED_BERNOULLI_B,
            STIELTJES_GAMMA, DIRICHLET_L_ZERO, GENERALIZED_RIEMANN_HYPOTHESIS, DIRICHLET_LAMBDA, GAUSS_SUM,
            JACOBI_SUM, EISENSTEIN_G, EISENSTEIN_E, ELLIPTIC_K, ELLIPTIC_E, Q_SERIES_COEFFICIENT,
            EQUAL_Q_SERIES_ELLIPSIS, BETA_FUNCTION, INCOMPLETE_BETA, INCOMPLETE_BETA_REGULARIZED, ENTRY,
            FORMULA, ID, ASSUMPTIONS, REFERENCES, VARIABLES, DOMAIN_CODOMAIN, DESCRIPTION, TABLE,
            TABLE_RELATION, TABLE_HEADINGS, TABLE_COLUMN_HEADINGS, TABLE_SPLIT, TABLE_SECTION, TOPIC, TITLE,
            DEFINITIONS_TABLE, SECTION, SUBSECTION, SEE_TOPICS, ENTRIES, ENTRY_REFERENCE, SOURCE_FORM,
            SYMBOL_DEFINITION, IMAGE, IMAGE_SOURCE);
}
