package ast.statements;

import ast.SrcLoc;
import ast.expressions.Expression;

/**
 * {@code path op= expression;}, e.g. {@code self.counter += 1;}
 */
public class AugmentedAssignStatement extends Statement {

    private final String op;
    private final Expression path;
    private final Expression expression;

    public AugmentedAssignStatement(int id, SrcLoc loc, String op, Expression path, Expression expression) {
        super(id, loc);
        this.op = op;
        this.path = path;
        this.expression = expression;
    }

    /**
     * @return the binary operator, without the trailing "="
     */
    public String getOp() {
        return op;
    }

    public Expression getPath() {
        return path;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.AUGMENTED_ASSIGN;
    }

    @Override
    public <R> R accept(StatementVisitor<R> v) {
        return v.visitAugmentedAssign(this);
    }
}
