package ast.statements;

import ast.SrcLoc;
import ast.expressions.Expression;

/**
 * {@code path = expression;} where the path is an identifier or a field access
 */
public class AssignStatement extends Statement {

    private final Expression path;
    private final Expression expression;

    public AssignStatement(int id, SrcLoc loc, Expression path, Expression expression) {
        super(id, loc);
        this.path = path;
        this.expression = expression;
    }

    public Expression getPath() {
        return path;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.ASSIGN;
    }

    @Override
    public <R> R accept(StatementVisitor<R> v) {
        return v.visitAssign(this);
    }
}
