package org.fungrim.lite.source;

import org.fungrim.lite.expr.Application;
import org.fungrim.lite.expr.Expr;
import org.fungrim.lite.expr.IntegerAtom;
import org.fungrim.lite.expr.Symbol;
import org.fungrim.lite.expr.TextAtom;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds expressions from the parse tree of the term syntax.
 */
final class SourceFormBuilder extends FormulaSourceBaseVisitor<Expr> {

    List<Expr> document(FormulaSourceParser.DocumentContext ctx) {
        List<Expr> result = new ArrayList<>(ctx.expression().size());
        for (FormulaSourceParser.ExpressionContext expression : ctx.expression()) {
            result.add(visit(expression));
        }
        return result;
    }

    @Override
    public Expr visitSingleExpression(FormulaSourceParser.SingleExpressionContext ctx) {
        return visit(ctx.expression());
    }

    // f(a)(b) applies f(a) to b
    @Override
    public Expr visitExpression(FormulaSourceParser.ExpressionContext ctx) {
        Expr result = visit(ctx.atom());
        for (FormulaSourceParser.CallSuffixContext call : ctx.callSuffix()) {
            List<Expr> parts = new ArrayList<>(call.expression().size() + 1);
            parts.add(result);
            for (FormulaSourceParser.ExpressionContext arg : call.expression()) {
                parts.add(visit(arg));
            }
            result = new Application(parts);
        }
        return result;
    }

    @Override
    public Expr visitSymbolAtom(FormulaSourceParser.SymbolAtomContext ctx) {
        return Symbol.of(ctx.IDENTIFIER().getText());
    }

    @Override
    public Expr visitIntegerAtom(FormulaSourceParser.IntegerAtomContext ctx) {
        return new IntegerAtom(new BigInteger(ctx.INTEGER().getText()));
    }

    @Override
    public Expr visitTextAtom(FormulaSourceParser.TextAtomContext ctx) {
        String quoted = ctx.STRING().getText();
        return new TextAtom(unescape(quoted.substring(1, quoted.length() - 1)));
    }

    /**
     * Undoes the writer's quote escaping. Other backslash pairs stay verbatim.
     */
    static String unescape(String body) {
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char next = body.charAt(i + 1);
                if (next != '"') {
                    sb.append(c);
                }
                sb.append(next);
                i++;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
