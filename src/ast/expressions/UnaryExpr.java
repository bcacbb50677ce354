package ast.expressions;

import ast.SrcLoc;

public class UnaryExpr extends Expression {

    private final String op;
    private final Expression operand;

    public UnaryExpr(int id, SrcLoc loc, String op, Expression operand) {
        super(id, loc);
        this.op = op;
        this.operand = operand;
    }

    public String getOp() {
        return op;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.OP_UNARY;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> v) {
        return v.visitUnary(this);
    }
}
