package ast.statements;

import java.util.Collections;
import java.util.List;

import ast.AstNode;
import ast.SrcLoc;

/**
 * Statement of the source language. Analyses dispatch on statements through a {@link StatementVisitor}.
 */
public abstract class Statement extends AstNode {

    protected Statement(int id, SrcLoc loc) {
        super(id, loc);
    }

    /**
     * @return tag identifying the shape of this statement
     */
    public abstract StatementKind kind();

    /**
     * Dispatch to the visitor method for this kind of statement
     *
     * @param v
     *            visitor
     * @return result of the visitor method
     */
    public abstract <R> R accept(StatementVisitor<R> v);

    /**
     * Statement lists nested in this statement (branches, loop bodies), in source order
     *
     * @return nested statement lists, empty for simple statements
     */
    public List<List<Statement>> getNestedBlocks() {
        return Collections.emptyList();
    }
}
