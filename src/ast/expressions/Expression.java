package ast.expressions;

import ast.AstNode;
import ast.SrcLoc;

/**
 * Expression of the source language. Analyses inspect expressions through an {@link ExpressionVisitor}, so a new
 * expression shape cannot be added without every visitor handling it.
 */
public abstract class Expression extends AstNode {

    protected Expression(int id, SrcLoc loc) {
        super(id, loc);
    }

    /**
     * @return tag identifying the shape of this expression
     */
    public abstract ExpressionKind kind();

    /**
     * Dispatch to the visitor method for this kind of expression
     *
     * @param v
     *            visitor
     * @return result of the visitor method
     */
    public abstract <R> R accept(ExpressionVisitor<R> v);
}
