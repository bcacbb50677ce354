package ast.statements;

import java.util.List;

import ast.SrcLoc;
import ast.expressions.Expression;

/**
 * {@code foreach (keyName, valueName in map) { statements }}
 */
public class ForEachStatement extends LoopStatement {

    private final String keyName;
    private final String valueName;
    private final Expression map;

    public ForEachStatement(int id, SrcLoc loc, String keyName, String valueName, Expression map,
                            List<Statement> statements) {
        super(id, loc, statements);
        this.keyName = keyName;
        this.valueName = valueName;
        this.map = map;
    }

    public String getKeyName() {
        return keyName;
    }

    public String getValueName() {
        return valueName;
    }

    public Expression getMap() {
        return map;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.FOREACH;
    }

    @Override
    public <R> R accept(StatementVisitor<R> v) {
        return v.visitForEach(this);
    }
}
