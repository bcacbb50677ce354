package ast.expressions;

import ast.SrcLoc;

public class NullExpr extends Expression {

    public NullExpr(int id, SrcLoc loc) {
        super(id, loc);
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.NULL;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> v) {
        return v.visitNull(this);
    }
}
