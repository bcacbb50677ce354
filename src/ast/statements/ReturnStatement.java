package ast.statements;

import ast.SrcLoc;
import ast.expressions.Expression;

public class ReturnStatement extends Statement {

    /**
     * Returned value, null for a bare {@code return;}
     */
    private final Expression expression;

    public ReturnStatement(int id, SrcLoc loc, Expression expression) {
        super(id, loc);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.RETURN;
    }

    @Override
    public <R> R accept(StatementVisitor<R> v) {
        return v.visitReturn(this);
    }
}
