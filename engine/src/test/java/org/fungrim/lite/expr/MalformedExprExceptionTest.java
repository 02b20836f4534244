package org.fungrim.lite.expr;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.fungrim.lite.expr.Builtins.BINOMIAL;
import static org.junit.jupiter.api.Assertions.*;

class MalformedExprExceptionTest {

    @Test
    @DisplayName("Arity errors name the head, the expectation and the actual count")
    void testArityMessage() {
        // GIVEN: A binomial with one argument instead of two
        Application binomial = BINOMIAL.call(Symbol.of("n"));

        // WHEN: We build the arity error
        MalformedExprException e = MalformedExprException.arity(binomial, "2");

        // THEN: The message carries the head, both counts and the source form
        assertEquals("Binomial expects 2 argument(s) but got 1: Binomial(n)", e.getMessage());
    }

    @Test
    @DisplayName("Long expressions are abbreviated in error messages")
    void testLongSourcesAreAbbreviated() {
        // GIVEN: An application whose source form is several hundred characters
        Object[] args = new Object[100];
        for (int i = 0; i < args.length; i++) {
            args[i] = 123456;
        }

        // WHEN: We build the arity error
        MalformedExprException e = MalformedExprException.arity(BINOMIAL.call(args), "2");

        // THEN: The source is cut off with an ellipsis
        assertTrue(e.getMessage().endsWith("..."));
        assertTrue(e.getMessage().length() < 300, "Message should be bounded but was " + e.getMessage().length());
    }
}
