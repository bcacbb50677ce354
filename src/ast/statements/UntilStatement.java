package ast.statements;

import java.util.List;

import ast.SrcLoc;
import ast.expressions.Expression;

/**
 * {@code do { statements } until (condition);}
 */
public class UntilStatement extends LoopStatement {

    private final Expression condition;

    public UntilStatement(int id, SrcLoc loc, Expression condition, List<Statement> statements) {
        super(id, loc, statements);
        this.condition = condition;
    }

    public Expression getCondition() {
        return condition;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.UNTIL;
    }

    @Override
    public <R> R accept(StatementVisitor<R> v) {
        return v.visitUntil(this);
    }
}
