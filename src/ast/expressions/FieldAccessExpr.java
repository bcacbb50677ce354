package ast.expressions;

import ast.SrcLoc;

/**
 * Access of a field of a struct or of the contract, e.g. {@code self.balance}
 */
public class FieldAccessExpr extends Expression {

    private final Expression aggregate;
    private final String field;

    public FieldAccessExpr(int id, SrcLoc loc, Expression aggregate, String field) {
        super(id, loc);
        this.aggregate = aggregate;
        this.field = field;
    }

    public Expression getAggregate() {
        return aggregate;
    }

    public String getField() {
        return field;
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.FIELD_ACCESS;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> v) {
        return v.visitFieldAccess(this);
    }
}
