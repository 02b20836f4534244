package org.fungrim.lite.transpiler;

import org.fungrim.lite.expr.Application;
import org.fungrim.lite.expr.Expr;
import org.fungrim.lite.expr.MalformedExprException;
import org.fungrim.lite.expr.Symbol;
import org.fungrim.lite.symbol.SymbolDescription;
import org.fungrim.lite.symbol.SymbolDescriptions;
import org.fungrim.lite.symbol.SymbolTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static org.fungrim.lite.expr.Builtins.*;

/**
 * Assembles the HTML block of a whole entry: the headline item, a
 * collapsible details panel, the TeX listing, the definitions table and the
 * source dump.
 */
public final class EntryHtmlRenderer {

    private static final String DASH = " <span style=\"color:#888\">&mdash;</span> ";

    private final HtmlGenerator html;
    private final SymbolDescriptions descriptions;

    public EntryHtmlRenderer(HtmlGenerator html, SymbolDescriptions descriptions) {
        this.html = Objects.requireNonNull(html, "HTML generator cannot be null");
        this.descriptions = Objects.requireNonNull(descriptions, "Descriptions cannot be null");
    }

    public String entryHtml(Application entry) {
        return entryHtml(entry, false, false);
    }

    /**
     * Renders an Entry(ID(...), ...) expression.
     *
     * @param entry          The entry
     * @param single         The entry is shown on its own page (details always open)
     * @param defaultVisible Open the details panel by default in list mode
     * @throws MalformedExprException if the entry has no ID or no displayable item
     */
    public String entryHtml(Application entry, boolean single, boolean defaultVisible) {
        if (!entry.hasHead(ENTRY)) {
            throw new MalformedExprException("Expected an Entry but got " + entry.head().toSourceString());
        }
        RenderSettings settings = html.settings();
        String id = HtmlGenerator.text(entry.argWithHead(ID)
                .filter(a -> a.arity() == 1)
                .orElseThrow(() -> new MalformedExprException("Entry has no ID: " + entry.toSourceString()))
                .arg(0));

        List<Expr> items = new ArrayList<>();
        List<String> imageSources = new ArrayList<>();
        for (Expr arg : entry.args()) {
            if (arg.hasHead(ID, VARIABLES)) {
                continue;
            }
            items.add(arg);
            if (arg.hasHead(IMAGE)) {
                Application source = arg.argWithHead(IMAGE_SOURCE)
                        .orElseThrow(() -> new MalformedExprException("Image has no ImageSource in entry " + id));
                imageSources.add(HtmlGenerator.imageSource(source));
            }
        }
        if (items.isEmpty()) {
            throw new MalformedExprException("Entry " + id + " has nothing to display");
        }

        StringBuilder sb = new StringBuilder();
        sb.append("<div class=\"entry\">");
        if (single) {
            sb.append("<div style=\"padding-top:0.4em\">");
        } else {
            sb.append("<div style=\"float:left; margin-top:0.0em; margin-right:0.3em\">");
            sb.append("<a href=\"").append(settings.entryDir()).append(id)
                    .append("/\" style=\"margin-left:3pt; font-size:85%\">").append(id).append("</a> <span></span><br/>");
            sb.append("<button style=\"margin-top:0.2em; margin-bottom: 0.1em;\" onclick=\"toggleVisible('")
                    .append(id).append(":info')\">Details</button>");
            sb.append("</div>");
            sb.append("<div>");
        }

        sb.append(html.html(items.get(0), true, false, single));
        sb.append("</div>");

        String visibility;
        if (single) {
            visibility = "";
        } else {
            visibility = defaultVisible ? "display:visible; " : "display:none; ";
        }
        sb.append("<div id=\"").append(id).append(":info\" style=\"").append(visibility).append("padding: 1em; clear:both\">");

        if (!imageSources.isEmpty()) {
            appendDownloads(sb, settings.imageDir() + imageSources.get(0));
        }

        for (Expr item : items.subList(1, items.size())) {
            sb.append(html.html(item, true));
            sb.append("\n\n");
        }

        List<String> tex = new ArrayList<>();
        for (Expr arg : entry.args()) {
            if (arg.hasHead(FORMULA, ASSUMPTIONS)) {
                for (Expr formula : arg.args()) {
                    tex.add(html.latexGenerator().latex(formula));
                }
            }
        }
        if (!tex.isEmpty()) {
            sb.append("<div class=\"entrysubhead\">TeX:</div>");
            sb.append("<pre>").append(String.join("\n\n", tex)).append("</pre>");
        }

        SymbolTable symbols = html.latexGenerator().symbols();
        List<Symbol> defined = entry.allSymbols().stream()
                .filter(s -> !symbols.isExcludedFromDefinitions(s))
                .toList();
        sb.append("<div class=\"entrysubhead\">Definitions:</div>");
        sb.append(definitionsTableHtml(defined, true));

        sb.append("<div class=\"entrysubhead\">Source code for this entry:</div>");
        sb.append("<pre>").append(entry.toSourceString()).append("</pre>");

        sb.append("</div></div>\n");
        return sb.toString();
    }

    private static void appendDownloads(StringBuilder sb, String base) {
        sb.append("<div style=\"text-align:center; margin-top:0; margin-bottom:1.1em\">");
        sb.append("<span style=\"font-size:85%; color:#888\">Download:</span> ");
        sb.append("<a href=\"").append(base).append("_small.png\">png (small)</a>").append(DASH);
        sb.append("<a href=\"").append(base).append("_medium.png\">png (medium)</a>").append(DASH);
        sb.append("<a href=\"").append(base).append("_large.png\">png (large)</a>").append(DASH);
        sb.append("<a href=\"").append(base).append("_small.pdf\">pdf (small)</a>").append(DASH);
        sb.append("<a href=\"").append(base).append(".pdf\">pdf (medium/large)</a>").append(DASH);
        sb.append("<a href=\"").append(base).append("_small.svg\">svg (small)</a>").append(DASH);
        sb.append("<a href=\"").append(base).append(".svg\">svg (medium/large)</a>");
        sb.append("</div>");
    }

    /**
     * Lists the described symbols among {@code symbols}; undescribed ones are skipped.
     */
    public String definitionsTableHtml(List<Symbol> symbols, boolean center) {
        String symbolDir = html.settings().symbolDir();
        StringBuilder sb = new StringBuilder();
        sb.append(center ? "<table style=\"margin: 0 auto\">" : "<table>");
        sb.append("<tr><th>Fungrim symbol</th> <th>Notation</th> <th>Short description</th></tr>");
        for (Symbol symbol : symbols) {
            Optional<SymbolDescription> found = descriptions.description(symbol);
            if (found.isEmpty()) {
                continue;
            }
            SymbolDescription d = found.get();
            sb.append("<tr><td><tt><a href=\"").append(symbolDir).append(symbol.name()).append("/\">")
                    .append(symbol.name()).append("</a></tt>");
            sb.append("<td>").append(html.typesetter().typeset(html.latexGenerator().latex(d.example()), false)).append("</td>");
            sb.append("<td>").append(d.description()).append("</td></tr>");
        }
        sb.append("</table>");
        return sb.toString();
    }
}
