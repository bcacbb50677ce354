package ast.statements;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ast.SrcLoc;

/**
 * {@code try { statements } catch (catchName) { catchStatements }}, the catch clause is optional
 */
public class TryStatement extends Statement {

    private final List<Statement> statements;
    /**
     * Name bound to the exit code in the catch clause, null if there is no catch clause
     */
    private final String catchName;
    /**
     * Statements of the catch clause, null if there is no catch clause
     */
    private final List<Statement> catchStatements;

    public TryStatement(int id, SrcLoc loc, List<Statement> statements, String catchName,
                        List<Statement> catchStatements) {
        super(id, loc);
        this.statements = Collections.unmodifiableList(statements);
        this.catchName = catchName;
        this.catchStatements = catchStatements == null ? null : Collections.unmodifiableList(catchStatements);
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public String getCatchName() {
        return catchName;
    }

    public List<Statement> getCatchStatements() {
        return catchStatements;
    }

    public boolean hasCatch() {
        return catchStatements != null;
    }

    @Override
    public List<List<Statement>> getNestedBlocks() {
        List<List<Statement>> blocks = new ArrayList<>(2);
        blocks.add(statements);
        if (catchStatements != null) {
            blocks.add(catchStatements);
        }
        return blocks;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.TRY;
    }

    @Override
    public <R> R accept(StatementVisitor<R> v) {
        return v.visitTry(this);
    }
}
