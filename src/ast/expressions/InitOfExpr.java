package ast.expressions;

import java.util.Collections;
import java.util.List;

import ast.SrcLoc;

/**
 * {@code initOf Contract(args)}: the initial state of another contract
 */
public class InitOfExpr extends Expression {

    private final String contract;
    private final List<Expression> args;

    public InitOfExpr(int id, SrcLoc loc, String contract, List<Expression> args) {
        super(id, loc);
        this.contract = contract;
        this.args = Collections.unmodifiableList(args);
    }

    public String getContract() {
        return contract;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.INIT_OF;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> v) {
        return v.visitInitOf(this);
    }
}
