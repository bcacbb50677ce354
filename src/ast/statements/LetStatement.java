package ast.statements;

import ast.SrcLoc;
import ast.expressions.Expression;

/**
 * {@code let name = expression;}
 */
public class LetStatement extends Statement {

    private final String name;
    private final Expression expression;

    public LetStatement(int id, SrcLoc loc, String name, Expression expression) {
        super(id, loc);
        this.name = name;
        this.expression = expression;
    }

    public String getName() {
        return name;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.LET;
    }

    @Override
    public <R> R accept(StatementVisitor<R> v) {
        return v.visitLet(this);
    }
}
