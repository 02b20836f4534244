package org.fungrim.lite.transpiler;

/**
 * Emits MathJax script blocks; typesetting happens client side.
 */
public final class MathJaxScriptTypesetter implements MathTypesetter {

    public static final MathJaxScriptTypesetter INSTANCE = new MathJaxScriptTypesetter();

    private MathJaxScriptTypesetter() {
    }

    @Override
    public String typeset(String latex, boolean display) {
        String type = display ? "math/tex; mode=display" : "math/tex";
        return "<script type=\"" + type + "\">" + escape(latex) + "</script>";
    }

    /**
     * Script content is not entity-decoded by browsers, so only a closing
     * tag sequence needs breaking up.
     */
    static String escape(String latex) {
        return latex.replace("</", "<\\/");
    }
}
