package org.fungrim.lite.transpiler;

import org.fungrim.lite.expr.Symbol;
import org.fungrim.lite.symbol.SymbolTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.fungrim.lite.expr.Builtins.*;
import static org.junit.jupiter.api.Assertions.*;

class MathJaxScriptTypesetterTest {

    private static final Symbol a = Symbol.of("a");
    private static final Symbol b = Symbol.of("b");
    private static final Symbol c = Symbol.of("c");
    private static final Symbol d = Symbol.of("d");

    @Test
    @DisplayName("Inline and display modes select the script type")
    void testInlineAndDisplayScripts() {
        // WHEN
        String inline = MathJaxScriptTypesetter.INSTANCE.typeset("x^2", false);
        String display = MathJaxScriptTypesetter.INSTANCE.typeset("x^2", true);

        // THEN
        assertEquals("<script type=\"math/tex\">x^2</script>", inline);
        assertEquals("<script type=\"math/tex; mode=display\">x^2</script>", display);
    }

    @Test
    @DisplayName("Relations and column separators reach MathJax unchanged")
    void testMarkupCharactersPassThrough() {
        // WHEN
        String less = MathJaxScriptTypesetter.INSTANCE.typeset("a < b", false);
        String columns = MathJaxScriptTypesetter.INSTANCE.typeset("a & b", false);

        // THEN
        assertEquals("<script type=\"math/tex\">a < b</script>", less);
        assertEquals("<script type=\"math/tex\">a & b</script>", columns);
    }

    @Test
    @DisplayName("A closing tag sequence cannot end the script early")
    void testClosingTagIsBroken() {
        // WHEN
        String html = MathJaxScriptTypesetter.INSTANCE.typeset("\\text{</script>}", false);

        // THEN
        assertEquals("<script type=\"math/tex\">\\text{<\\/script>}</script>", html);
    }

    @Test
    @DisplayName("Rendered comparisons and matrices keep raw operators")
    void testGeneratedHtmlKeepsOperators() {
        // GIVEN
        HtmlGenerator html = new HtmlGenerator(new LatexGenerator(SymbolTable.standard()),
                MathJaxScriptTypesetter.INSTANCE, RenderSettings.defaults());

        // WHEN
        String less = html.html(LESS.call(a, b));
        String matrix = html.html(MATRIX2X2.call(a, b, c, d));

        // THEN
        assertEquals("<script type=\"math/tex\">a < b</script>", less);
        assertTrue(matrix.contains("a & b \\\\ c & d"), matrix);
        assertFalse(matrix.contains("&amp;"), matrix);
    }
}
