package org.fungrim.lite.transpiler;

import org.fungrim.lite.expr.Application;
import org.fungrim.lite.expr.Expr;
import org.fungrim.lite.expr.IntegerAtom;
import org.fungrim.lite.expr.MalformedExprException;
import org.fungrim.lite.expr.Symbol;
import org.fungrim.lite.expr.TextAtom;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.fungrim.lite.expr.Builtins.*;

/**
 * Renders expressions as HTML fragments.
 *
 * Mathematical content goes through the LaTeX generator and then the
 * {@link MathTypesetter}. Structural heads (Table, Image, References,
 * Assumptions, Description, SymbolDefinition, Formula) are laid out as HTML
 * directly. In avoid-LaTeX mode, simple numeric shapes are written as plain
 * text.
 */
public final class HtmlGenerator {

    private static final String GREY_LABEL = "<span style=\"font-size:85%; color:#888\">";
    private static final String DASH = " <span style=\"color:#888\">&mdash;</span> ";

    private final LatexGenerator latex;
    private final MathTypesetter typesetter;
    private final RenderSettings settings;

    public HtmlGenerator(LatexGenerator latex, MathTypesetter typesetter, RenderSettings settings) {
        this.latex = Objects.requireNonNull(latex, "LaTeX generator cannot be null");
        this.typesetter = Objects.requireNonNull(typesetter, "Typesetter cannot be null");
        this.settings = Objects.requireNonNull(settings, "Settings cannot be null");
    }

    public LatexGenerator latexGenerator() {
        return latex;
    }

    public MathTypesetter typesetter() {
        return typesetter;
    }

    public RenderSettings settings() {
        return settings;
    }

    public String html(Expr expr) {
        return html(expr, false, false, false);
    }

    public String html(Expr expr, boolean display) {
        return html(expr, display, false, false);
    }

    /**
     * Renders an expression as HTML.
     *
     * @param expr       The expression
     * @param display    Typeset in display mode rather than inline
     * @param avoidLatex Write simple numeric shapes as plain text
     * @param single     The entry is shown on its own page
     * @return The HTML fragment
     */
    public String html(Expr expr, boolean display, boolean avoidLatex, boolean single) {
        if (expr.isAtom()) {
            if (avoidLatex && expr instanceof IntegerAtom integer) {
                return integer.value().toString();
            }
            return math(expr, display);
        }
        Application app = (Application) expr;
        if (avoidLatex) {
            String plain = plainText(app, display);
            if (plain != null) {
                return plain;
            }
        }
        if (app.hasHead(TABLE)) {
            return table(app);
        }
        if (app.hasHead(FORMULA)) {
            if (app.arity() < 1) {
                throw MalformedExprException.arity(app, "at least 1");
            }
            return typesetter.typeset(latex.latex(app.arg(0)), false);
        }
        if (app.hasHead(REFERENCES)) {
            return references(app);
        }
        if (app.hasHead(ASSUMPTIONS)) {
            return assumptions(app);
        }
        if (app.hasHead(DESCRIPTION)) {
            return description(app, display);
        }
        if (app.hasHead(SYMBOL_DEFINITION)) {
            return symbolDefinition(app);
        }
        if (app.hasHead(IMAGE)) {
            return image(app);
        }
        return math(app, display);
    }

    private String math(Expr expr, boolean display) {
        return typesetter.typeset(latex.latex(expr), display);
    }

    // ==================== Plain text ====================

    private String plainText(Application app, boolean display) {
        if (app.hasHead(DECIMAL) && app.arity() == 1 && app.arg(0) instanceof TextAtom digits) {
            String text = digits.value();
            int e = text.indexOf('e');
            if (e >= 0) {
                String exponent = LatexGenerator.stripLeadingPlus(text.substring(e + 1));
                return text.substring(0, e) + " &middot; 10<sup>" + exponent + "</sup>";
            }
            return text;
        }
        if (ExprShapes.isIntegerRatio(app)) {
            return ((IntegerAtom) app.arg(0)).value() + "/" + ((IntegerAtom) app.arg(1)).value();
        }
        if (app.hasHead(NEG) && app.arity() == 1 && ExprShapes.canRenderAsPlainText(app.arg(0))) {
            return "-" + html(app.arg(0), display, true, false);
        }
        if (app.hasHead(TUPLE, SET) && ExprShapes.canRenderAsPlainText(app)) {
            String inner = app.args().stream()
                    .map(a -> html(a, display, true, false))
                    .collect(Collectors.joining(", "));
            return app.hasHead(TUPLE) ? "(" + inner + ")" : "{" + inner + "}";
        }
        return null;
    }

    // ==================== Structural forms ====================

    // Image(Description(...), ImageSource("path"))
    private String image(Application app) {
        if (app.arity() != 2) {
            throw MalformedExprException.arity(app, "2");
        }
        String path = imageSource(app.arg(1));
        String dir = settings.imageDir();
        StringBuilder sb = new StringBuilder();
        sb.append("<div style=\"text-align:center; margin:0.6em 0.4em 0.0em 0.2em\">");
        sb.append(GREY_LABEL).append("Image:</span> ");
        sb.append(html(app.arg(0)));
        sb.append("<button style=\"margin:0 0 0 0.3em\" onclick=\"toggleBig('").append(path).append("', '")
                .append(dir).append(path).append("_small.svg', '").append(dir).append(path).append(".svg')\">Big &#x1F50D;</button>");
        sb.append("<div style=\"text-align:center; padding-right:1em;\">");
        sb.append("<img id=\"").append(path).append("\", src=\"").append(dir).append(path)
                .append("_small.svg\" style=\"width:").append(settings.thumbnailWidth())
                .append("; max-width:100%; margin-top:0.3em; margin-bottom:0px\"/>");
        sb.append("</div>");
        sb.append("</div>");
        return sb.toString();
    }

    static String imageSource(Expr source) {
        if (!source.hasHead(IMAGE_SOURCE) || source.args().size() != 1 || !(source.args().get(0) instanceof TextAtom)) {
            throw new MalformedExprException("Image expects an ImageSource(text) but got " + source.toSourceString());
        }
        return ((TextAtom) source.args().get(0)).value();
    }

    /**
     * Lays out Table(TableRelation?, TableHeadings?, TableColumnHeadings?, TableSplit?, List(rows...)).
     * With TableSplit(k) the rows are spread over k side-by-side tables; the
     * first k-1 take n/k rows each and the last takes the remainder.
     */
    private String table(Application app) {
        Optional<Application> relation = app.argWithHead(TABLE_RELATION);
        Optional<Application> headings = app.argWithHead(TABLE_HEADINGS);
        Optional<Application> rowHeadings = app.argWithHead(TABLE_COLUMN_HEADINGS);
        Application data = app.argWithHead(LIST)
                .orElseThrow(() -> new MalformedExprException("Table has no List of rows: " + app.toSourceString()));
        int split = app.argWithHead(TABLE_SPLIT).map(HtmlGenerator::splitCount).orElse(1);

        List<Expr> rows = data.args();
        int cols;
        if (headings.isPresent()) {
            cols = headings.get().arity();
        } else {
            cols = rows.isEmpty() || rows.get(0).isAtom() ? 0 : rows.get(0).args().size();
        }
        int num = rows.size();
        int perGroup = num / split;

        StringBuilder sb = new StringBuilder();
        sb.append("<div style=\"overflow-x:auto;\">");
        sb.append("<table align=\"center\" style=\"border:0; background-color:#fff;\">");
        sb.append("<tr style=\"border:0; background-color:#fff\">");
        int rowIndex = 0;
        for (int group = 0; group < split; group++) {
            sb.append("<td style=\"border:0; background-color:#fff; vertical-align:top;\">");
            sb.append("<table style=\"float: left; margin-right: 1em;\">");
            headings.ifPresent(h -> {
                sb.append("<tr>");
                for (Expr heading : h.args()) {
                    // nowrap keeps headings such as "n \ k" on one line
                    sb.append("<th style=\"white-space:nowrap;\">").append(html(heading, false, true, false)).append("</th>");
                }
                sb.append("</tr>");
            });
            int end = group == split - 1 ? num : perGroup * (group + 1);
            for (Expr row : rows.subList(perGroup * group, end)) {
                sb.append("<tr>");
                if (row instanceof Application section && section.hasHead(TABLE_SECTION)) {
                    if (section.arity() != 1) {
                        throw MalformedExprException.arity(section, "1");
                    }
                    sb.append("<td colspan=\"").append(cols).append("\" style=\"text-align:center; font-weight: bold\">")
                            .append(text(section.arg(0))).append("</td>");
                } else {
                    if (rowHeadings.isPresent()) {
                        if (rowIndex >= rowHeadings.get().arity()) {
                            throw MalformedExprException.arity(rowHeadings.get(), "at least " + (rowIndex + 1));
                        }
                        sb.append("<th>").append(html(rowHeadings.get().arg(rowIndex), false, true, false)).append("</th>");
                    }
                    if (row.isAtom()) {
                        throw new MalformedExprException("Table row must be an application but got " + row.toSourceString());
                    }
                    for (Expr cell : row.args()) {
                        sb.append("<td>").append(html(cell, false, true, false)).append("</td>");
                    }
                }
                sb.append("</tr>");
                rowIndex++;
            }
            sb.append("</table>");
            sb.append("</td>");
        }
        sb.append("</tr></table></div>");
        relation.ifPresent(rel -> {
            if (rel.arity() != 2) {
                throw MalformedExprException.arity(rel, "2");
            }
            sb.append("<div style=\"text-align:center; margin-top: 0.5em\">");
            sb.append(html(DESCRIPTION.call("Table data:", rel.arg(0), " such that ", rel.arg(1)), true));
            sb.append("</div>");
        });
        return sb.toString();
    }

    private static int splitCount(Application split) {
        if (split.arity() != 1 || !(split.arg(0) instanceof IntegerAtom count) || count.signum() <= 0) {
            throw new MalformedExprException("TableSplit expects a positive integer but got " + split.toSourceString());
        }
        return count.value().intValueExact();
    }

    private String references(Application app) {
        StringBuilder sb = new StringBuilder();
        sb.append("<div class=\"entrysubhead\">References:</div>");
        sb.append("<ul>");
        for (Expr ref : app.args()) {
            sb.append("<li>").append(text(ref)).append("</li>");
        }
        sb.append("</ul>");
        return sb.toString();
    }

    private String assumptions(Application app) {
        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (Expr alternative : app.args()) {
            sb.append("<div style=\"text-align:center; margin:0.8em\">");
            sb.append("<span style=\"font-size:85%; color:#888; margin-right:0.8em\">")
                    .append(first ? "Assumptions" : "Alternative assumptions").append(":</span>");
            sb.append(html(alternative, false));
            sb.append("</div>");
            first = false;
        }
        return sb.toString();
    }

    /**
     * Joins text and formula fragments into a sentence. A text fragment
     * starting with ',', '.' or ';' attaches to the preceding fragment.
     */
    private String description(Application app, boolean display) {
        StringBuilder sb = new StringBuilder();
        if (display) {
            sb.append("<div style=\"text-align:center; margin:0.6em\">");
        }
        for (Expr arg : app.args()) {
            if (arg instanceof TextAtom t) {
                String text = t.value();
                if (!text.isEmpty() && ",.;".indexOf(text.charAt(0)) >= 0) {
                    stripTrailingWhitespace(sb);
                }
                sb.append(text);
            } else if (arg instanceof Application form && form.hasHead(SOURCE_FORM)) {
                if (form.arity() != 1) {
                    throw MalformedExprException.arity(form, "1");
                }
                sb.append("<tt>").append(form.arg(0).toSourceString()).append("</tt>");
            } else if (arg instanceof Application ref && ref.hasHead(ENTRY_REFERENCE)) {
                if (ref.arity() != 1) {
                    throw MalformedExprException.arity(ref, "1");
                }
                String id = text(ref.arg(0));
                sb.append("<a href=\"").append(settings.entryDir()).append(id).append("/\">").append(id).append("</a>");
            } else {
                sb.append(html(arg, false, true, false));
            }
            sb.append(' ');
        }
        if (display) {
            sb.append("</div>");
        }
        return sb.toString();
    }

    private static void stripTrailingWhitespace(StringBuilder sb) {
        int len = sb.length();
        while (len > 0 && Character.isWhitespace(sb.charAt(len - 1))) {
            len--;
        }
        sb.setLength(len);
    }

    // SymbolDefinition(symbol, example, "description")
    private String symbolDefinition(Application app) {
        if (app.arity() != 3) {
            throw MalformedExprException.arity(app, "3");
        }
        if (!(app.arg(0) instanceof Symbol symbol)) {
            throw new MalformedExprException("SymbolDefinition expects a symbol but got " + app.arg(0).toSourceString());
        }
        StringBuilder sb = new StringBuilder();
        sb.append("<div style=\"text-align:center; margin:0.6em\">");
        sb.append(GREY_LABEL).append("Symbol:</span> ");
        sb.append("<tt><a href=\"").append(settings.symbolDir()).append(symbol.name()).append("/\">")
                .append(symbol.name()).append("</a></tt>");
        sb.append(DASH);
        sb.append(html(app.arg(1)));
        sb.append(DASH);
        sb.append(text(app.arg(2)));
        sb.append("</div>");
        return sb.toString();
    }

    static String text(Expr expr) {
        if (expr instanceof TextAtom t) {
            return t.value();
        }
        throw new MalformedExprException("Expected a text atom but got " + expr.toSourceString());
    }
}
