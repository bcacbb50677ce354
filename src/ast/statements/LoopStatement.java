package ast.statements;

import java.util.Collections;
import java.util.List;

import ast.SrcLoc;

/**
 * Statement that executes its body repeatedly
 */
public abstract class LoopStatement extends Statement {

    private final List<Statement> statements;

    protected LoopStatement(int id, SrcLoc loc, List<Statement> statements) {
        super(id, loc);
        this.statements = Collections.unmodifiableList(statements);
    }

    /**
     * @return loop body
     */
    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    public List<List<Statement>> getNestedBlocks() {
        return Collections.singletonList(statements);
    }
}
