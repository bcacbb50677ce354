package ast.statements;

import java.util.List;

import ast.SrcLoc;
import ast.expressions.Expression;

/**
 * {@code while (condition) { statements }}
 */
public class WhileStatement extends LoopStatement {

    private final Expression condition;

    public WhileStatement(int id, SrcLoc loc, Expression condition, List<Statement> statements) {
        super(id, loc, statements);
        this.condition = condition;
    }

    public Expression getCondition() {
        return condition;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.WHILE;
    }

    @Override
    public <R> R accept(StatementVisitor<R> v) {
        return v.visitWhile(this);
    }
}
