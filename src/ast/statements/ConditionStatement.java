package ast.statements;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ast.SrcLoc;
import ast.expressions.Expression;

/**
 * {@code if (condition) { trueStatements } else { falseStatements }}
 */
public class ConditionStatement extends Statement {

    private final Expression condition;
    private final List<Statement> trueStatements;
    /**
     * Statements of the else branch, null if there is no else branch
     */
    private final List<Statement> falseStatements;

    public ConditionStatement(int id, SrcLoc loc, Expression condition, List<Statement> trueStatements,
                              List<Statement> falseStatements) {
        super(id, loc);
        this.condition = condition;
        this.trueStatements = Collections.unmodifiableList(trueStatements);
        this.falseStatements = falseStatements == null ? null : Collections.unmodifiableList(falseStatements);
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getTrueStatements() {
        return trueStatements;
    }

    public List<Statement> getFalseStatements() {
        return falseStatements;
    }

    @Override
    public List<List<Statement>> getNestedBlocks() {
        List<List<Statement>> blocks = new ArrayList<>(2);
        blocks.add(trueStatements);
        if (falseStatements != null) {
            blocks.add(falseStatements);
        }
        return blocks;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.CONDITION;
    }

    @Override
    public <R> R accept(StatementVisitor<R> v) {
        return v.visitCondition(this);
    }
}
