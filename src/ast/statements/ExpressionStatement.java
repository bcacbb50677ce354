package ast.statements;

import ast.SrcLoc;
import ast.expressions.Expression;

/**
 * Expression evaluated for its side effects, e.g. {@code send(params);}
 */
public class ExpressionStatement extends Statement {

    private final Expression expression;

    public ExpressionStatement(int id, SrcLoc loc, Expression expression) {
        super(id, loc);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.EXPRESSION;
    }

    @Override
    public <R> R accept(StatementVisitor<R> v) {
        return v.visitExpression(this);
    }
}
