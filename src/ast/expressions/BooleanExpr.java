package ast.expressions;

import ast.SrcLoc;

public class BooleanExpr extends Expression {

    private final boolean value;

    public BooleanExpr(int id, SrcLoc loc, boolean value) {
        super(id, loc);
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.BOOLEAN;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> v) {
        return v.visitBoolean(this);
    }
}
