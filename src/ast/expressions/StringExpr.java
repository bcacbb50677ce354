package ast.expressions;

import ast.SrcLoc;

public class StringExpr extends Expression {

    private final String value;

    public StringExpr(int id, SrcLoc loc, String value) {
        super(id, loc);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.STRING;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> v) {
        return v.visitString(this);
    }
}
