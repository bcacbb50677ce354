package ast.expressions;

import ast.SrcLoc;

/**
 * Reference to a variable, constant or function by name
 */
public class IdExpr extends Expression {

    private final String text;

    public IdExpr(int id, SrcLoc loc, String text) {
        super(id, loc);
        this.text = text;
    }

    public String getText() {
        return text;
    }

    /**
     * @return true if this is the receiver of contract methods
     */
    public boolean isSelf() {
        return "self".equals(text);
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.ID;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> v) {
        return v.visitId(this);
    }
}
