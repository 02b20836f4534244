package org.fungrim.lite.symbol;

import static org.fungrim.lite.expr.Builtins.*;

/**
 * The standard symbol set: every builtin, the single-letter and Greek
 * variables, and the LaTeX spelling tables.
 */
final class StandardSymbols {

    private StandardSymbols() {
    }

    static final String LATIN_VARIABLES =
            "a b c d e f g h i j k l m n o p q r s t u v w x y z "
            + "A B C D E F G H I J K L M N O P Q R S T U V W X Y Z";

    static final String GREEK_VARIABLES =
            "alpha beta gamma delta epsilon zeta eta theta iota kappa mu nu xi pi rho sigma tau phi chi psi omega ell "
            + "Alpha Beta Gamma Delta Epsilon Zeta Eta Theta Iota Kappa Mu Nu Xi Pi Rho Sigma Tau Phi Chi Psi Omega";

    static SymbolTable.Builder install(SymbolTable.Builder builder) {
        builder.registerBuiltins(ALL)
                .registerVariables(LATIN_VARIABLES)
                .registerVariables(GREEK_VARIABLES);
        infix(builder);
        subscriptCalls(builder);
        indexed(builder);
        spellings(builder);
        builder.excludeFromDefinitions(SET, LIST, TUPLE, AND, OR, IMPLIES, EQUIVALENT, NOT,
                ELEMENT, NOT_ELEMENT, UNION, INTERSECTION, SET_MINUS, SUBSET, SUBSET_EQUAL);
        return builder;
    }

    // ===== a OP b OP c =====
    private static void infix(SymbolTable.Builder builder) {
        builder
                .infix(MOD, "\\bmod")
                .infix(ELEMENT, "\\in")
                .infix(NOT_ELEMENT, "\\notin")
                .infix(SET_MINUS, "\\setminus")
                .infix(UNION, "\\cup")
                .infix(INTERSECTION, "\\cap")
                .infix(LESS, "<")
                .infix(LESS_EQUAL, "\\le")
                .infix(GREATER, ">")
                .infix(GREATER_EQUAL, "\\ge")
                .infix(EQUAL, "=")
                .infix(UNEQUAL, "\\ne")
                .infix(SUBSET, "\\subset")
                .infix(SUBSET_EQUAL, "\\subseteq")
                .infix(DIVIDES, "\\mid");
    }

    // ===== F(n, x) -> F_n(x) =====
    private static void subscriptCalls(SymbolTable.Builder builder) {
        builder
                .subscriptCall(BERNOULLI_POLYNOMIAL, "B")
                .subscriptCall(LEGENDRE_POLYNOMIAL, "P")
                .subscriptCall(CHEBYSHEV_T, "T")
                .subscriptCall(CHEBYSHEV_U, "U")
                .subscriptCall(HERMITE_POLYNOMIAL, "H")
                .subscriptCall(HILBERT_CLASS_POLYNOMIAL, "H")
                .subscriptCall(EISENSTEIN_G, "G")
                .subscriptCall(EISENSTEIN_E, "E")
                .subscriptCall(DIVISOR_SIGMA, "\\sigma")
                .subscriptCall(INCOMPLETE_BETA, "\\mathrm{B}")
                .subscriptCall(INCOMPLETE_BETA_REGULARIZED, "I")
                .subscriptCall(POLY_GAMMA, "\\psi");
    }

    // ===== Subscripted numbers: B_{n}, p_{n}, x_{n,k} =====
    private static void indexed(SymbolTable.Builder builder) {
        builder
                .indexed(BERNOULLI_B, "B", 1)
                .indexed(BELL_NUMBER, "B", 1)
                .indexed(HARMONIC_NUMBER, "H", 1)
                .indexed(PRIME_NUMBER, "p", 1)
                .indexed(RIEMANN_ZETA_ZERO, "\\rho", 1)
                .indexed(LAMBERT_W_PUISEUX_COEFFICIENT, "{\\mu}", 1)
                .indexed(BERNSTEIN_ELLIPSE, "\\mathcal{E}", 1)
                .indexed(CONREY_GENERATOR, "g", 1)
                .indexed(DIRICHLET_GROUP, "G", 1)
                .indexed(DIRICHLET_L_ZERO, "\\rho", 2)
                .indexed(LEGENDRE_POLYNOMIAL_ZERO, "x", 2)
                .indexed(GAUSS_LEGENDRE_WEIGHT, "w", 2)
                .indexed(GENERALIZED_BERNOULLI_B, "B", 2);
    }

    // ===== Fixed spellings of whole expressions =====
    private static void spellings(SymbolTable.Builder builder) {
        builder
                .latex(CONST_PI, "\\pi")
                .latex(CONST_I, "i")
                .latex(CONST_E, "e")
                .latex(CONST_GAMMA, "\\gamma")
                .latex(GOLDEN_RATIO, "\\varphi")
                .latex(INFINITY, "\\infty")
                .latex(UNSIGNED_INFINITY, "{\\tilde \\infty}")
                .latex(GAMMA_FUNCTION, "\\Gamma")
                .latex(LOG_GAMMA, "\\log \\Gamma")
                .latex(UPPER_GAMMA, "\\Gamma")
                .latex(ERF, "\\operatorname{erf}")
                .latex(ERFC, "\\operatorname{erfc}")
                .latex(ERFI, "\\operatorname{erfi}")
                .latex(DIGAMMA_FUNCTION, "\\psi")
                .latex(DEDEKIND_ETA, "\\eta")
                .latex(DEDEKIND_ETA_EPSILON, "\\varepsilon")
                .latex(DEDEKIND_SUM, "s")
                .latex(MODULAR_J, "j")
                .latex(MODULAR_LAMBDA, "\\lambda")
                .latex(JACOBI_THETA1, "\\theta_1")
                .latex(JACOBI_THETA2, "\\theta_2")
                .latex(JACOBI_THETA3, "\\theta_3")
                .latex(JACOBI_THETA4, "\\theta_4")
                .latex(WEIERSTRASS_P, "\\wp")
                .latex(WEIERSTRASS_SIGMA, "\\sigma")
                .latex(WEIERSTRASS_ZETA, "\\zeta")
                .latex(ELLIPTIC_K, "K")
                .latex(ELLIPTIC_E, "E")
                .latex(EULER_Q_SERIES, "\\phi")
                .latex(PARTITIONS_P, "p")
                .latex(MOEBIUS_MU, "\\mu")
                .latex(HARDY_RAMANUJAN_A, "A")
                .latex(SIN, "\\sin")
                .latex(SINH, "\\sinh")
                .latex(COS, "\\cos")
                .latex(COSH, "\\cosh")
                .latex(TAN, "\\tan")
                .latex(TANH, "\\tanh")
                .latex(COT, "\\cot")
                .latex(COTH, "\\coth")
                .latex(SEC, "\\sec")
                .latex(SECH, "\\sech")
                .latex(CSC, "\\csc")
                .latex(CSCH, "\\csch")
                .latex(EXP, "\\exp")
                .latex(LOG, "\\log")
                .latex(ATAN, "\\operatorname{atan}")
                .latex(ACOS, "\\operatorname{acos}")
                .latex(ASIN, "\\operatorname{asin}")
                .latex(ACOT, "\\operatorname{acot}")
                .latex(ATANH, "\\operatorname{atanh}")
                .latex(ACOSH, "\\operatorname{acosh}")
                .latex(ASINH, "\\operatorname{asinh}")
                .latex(ACOTH, "\\operatorname{acoth}")
                .latex(ATAN2, "\\operatorname{atan2}")
                .latex(SINC, "\\operatorname{sinc}")
                .latex(HYPERGEOMETRIC0_F1, "\\,{}_0F_1")
                .latex(HYPERGEOMETRIC1_F1, "\\,{}_1F_1")
                .latex(HYPERGEOMETRIC2_F1, "\\,{}_2F_1")
                .latex(HYPERGEOMETRIC2_F0, "\\,{}_2F_0")
                .latex(HYPERGEOMETRIC3_F2, "\\,{}_3F_2")
                .latex(HYPERGEOMETRIC_U, "U")
                .latex(HYPERGEOMETRIC_U_STAR, "U^{*}")
                .latex(HYPERGEOMETRIC0_F1_REGULARIZED, "\\,{}_0{\\textbf F}_1")
                .latex(HYPERGEOMETRIC1_F1_REGULARIZED, "\\,{}_1{\\textbf F}_1")
                .latex(HYPERGEOMETRIC2_F1_REGULARIZED, "\\,{}_2{\\textbf F}_1")
                .latex(HYPERGEOMETRIC2_F0_REGULARIZED, "\\,{}_2{\\textbf F}_0")
                .latex(HYPERGEOMETRIC3_F2_REGULARIZED, "\\,{}_3{\\textbf F}_2")
                .latex(AIRY_AI, "\\operatorname{Ai}")
                .latex(AIRY_BI, "\\operatorname{Bi}")
                .latex(AIRY_AI_PRIME, "\\operatorname{Ai}'")
                .latex(AIRY_BI_PRIME, "\\operatorname{Bi}'")
                .latex(LOG_INTEGRAL, "\\operatorname{li}")
                .latex(GCD, "\\gcd")
                .latex(LCM, "\\operatorname{lcm}")
                .latex(XGCD, "\\operatorname{xgcd}")
                .latex(TOTIENT, "\\varphi")
                .latex(SIGN, "\\operatorname{sgn}")
                .latex(CSGN, "\\operatorname{csgn}")
                .latex(ARG, "\\arg")
                .latex(MIN, "\\min")
                .latex(MAX, "\\max")
                .latex(PP, "\\mathbb{P}")
                .latex(ZZ, "\\mathbb{Z}")
                .latex(QQ, "\\mathbb{Q}")
                .latex(RR, "\\mathbb{R}")
                .latex(CC, "\\mathbb{C}")
                .latex(HH, "\\mathbb{H}")
                .latex(ALGEBRAIC_NUMBERS, "\\overline{\\mathbb{Q}}")
                .latex(UNIT_CIRCLE, "\\mathbb{T}")
                .latex(PRIME_PI, "\\pi")
                .latex(SL2_Z, "\\operatorname{SL}_2(\\mathbb{Z})")
                .latex(PSL2_Z, "\\operatorname{PSL}_2(\\mathbb{Z})")
                .latex(MODULAR_GROUP_FUNDAMENTAL_DOMAIN, "\\mathcal{F}")
                .latex(MODULAR_LAMBDA_FUNDAMENTAL_DOMAIN, "\\mathcal{F}_{\\lambda}")
                .latex(POWER_SET, "\\mathscr{P}")
                .latex(ELLIPSIS, "\\ldots")
                .latex(SPECTRUM, "\\operatorname{spec}")
                .latex(DET, "\\operatorname{det}")
                .latex(RIEMANN_HYPOTHESIS, "\\operatorname{RH}")
                .latex(GENERALIZED_RIEMANN_HYPOTHESIS, "\\operatorname{GRH}")
                .latex(RIEMANN_ZETA, "\\zeta")
                .latex(HURWITZ_ZETA, "\\zeta")
                .latex(DIRICHLET_L, "L")
                .latex(DIRICHLET_LAMBDA, "\\Lambda")
                .latex(BETA_FUNCTION, "\\mathrm{B}");
    }
}
