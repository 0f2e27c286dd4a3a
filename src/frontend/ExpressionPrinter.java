package frontend;

import frontend.grammar.QuilParser;
import frontend.grammar.QuilParserBaseVisitor;

/**
 * Canonical text of an expression. Nothing is evaluated: real literals are normalised
 * through {@link Double#toString(double)} so that {@code 1e6} and {@code 1000000}
 * render alike.
 */
class ExpressionPrinter extends QuilParserBaseVisitor<String> {
    static final ExpressionPrinter INSTANCE = new ExpressionPrinter();

    static String print(QuilParser.ExpressionContext ctx) {
        return INSTANCE.visit(ctx);
    }

    @Override
    public String visitParenExp(QuilParser.ParenExpContext ctx) {
        return "(" + visit(ctx.expression()) + ")";
    }

    @Override
    public String visitNegExp(QuilParser.NegExpContext ctx) {
        return "-" + visit(ctx.expression());
    }

    @Override
    public String visitMulExp(QuilParser.MulExpContext ctx) {
        return visit(ctx.expression(0)) + " " + ctx.op.getText() + " " + visit(ctx.expression(1));
    }

    @Override
    public String visitAddExp(QuilParser.AddExpContext ctx) {
        return visit(ctx.expression(0)) + " " + ctx.op.getText() + " " + visit(ctx.expression(1));
    }

    @Override
    public String visitNumberExp(QuilParser.NumberExpContext ctx) {
        return Double.toString(Double.parseDouble(ctx.getText()));
    }

    @Override
    public String visitPiExp(QuilParser.PiExpContext ctx) {
        return "pi";
    }
}
