package ast.expressions;

import ast.SrcLoc;

/**
 * Binary operation, e.g. {@code a + b} or {@code x > 10}
 */
public class BinaryExpr extends Expression {

    /**
     * Operator as written in the source, e.g. "+", "&&", "&gt;="
     */
    private final String op;
    private final Expression left;
    private final Expression right;

    public BinaryExpr(int id, SrcLoc loc, String op, Expression left, Expression right) {
        super(id, loc);
        this.op = op;
        this.left = left;
        this.right = right;
    }

    public String getOp() {
        return op;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.OP_BINARY;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> v) {
        return v.visitBinary(this);
    }
}
