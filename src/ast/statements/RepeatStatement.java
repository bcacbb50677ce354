package ast.statements;

import java.util.List;

import ast.SrcLoc;
import ast.expressions.Expression;

/**
 * {@code repeat (iterations) { statements }}
 */
public class RepeatStatement extends LoopStatement {

    private final Expression iterations;

    public RepeatStatement(int id, SrcLoc loc, Expression iterations, List<Statement> statements) {
        super(id, loc, statements);
        this.iterations = iterations;
    }

    public Expression getIterations() {
        return iterations;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.REPEAT;
    }

    @Override
    public <R> R accept(StatementVisitor<R> v) {
        return v.visitRepeat(this);
    }
}
