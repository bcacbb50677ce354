package ast.expressions;

import ast.SrcLoc;

/**
 * Ternary {@code condition ? thenBranch : elseBranch}
 */
public class ConditionalExpr extends Expression {

    private final Expression condition;
    private final Expression thenBranch;
    private final Expression elseBranch;

    public ConditionalExpr(int id, SrcLoc loc, Expression condition, Expression thenBranch, Expression elseBranch) {
        super(id, loc);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getThenBranch() {
        return thenBranch;
    }

    public Expression getElseBranch() {
        return elseBranch;
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.CONDITIONAL;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> v) {
        return v.visitConditional(this);
    }
}
