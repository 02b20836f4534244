package org.fungrim.lite.transpiler;

/**
 * Converts a LaTeX string into a renderable math fragment.
 * Implementations decide the target engine; the HTML generator only passes
 * LaTeX source and the display/inline choice.
 */
@FunctionalInterface
public interface MathTypesetter {

    /**
     * @param latex   The LaTeX source of the formula
     * @param display true for display (block) mode, false for inline mode
     * @return The HTML fragment standing for the typeset formula
     */
    String typeset(String latex, boolean display);
}
