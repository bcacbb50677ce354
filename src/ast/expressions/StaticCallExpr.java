package ast.expressions;

import java.util.Collections;
import java.util.List;

import ast.SrcLoc;

/**
 * Call of a free function, e.g. {@code now()} or {@code send(params)}
 */
public class StaticCallExpr extends Expression {

    private final String function;
    private final List<Expression> args;

    public StaticCallExpr(int id, SrcLoc loc, String function, List<Expression> args) {
        super(id, loc);
        this.function = function;
        this.args = Collections.unmodifiableList(args);
    }

    public String getFunction() {
        return function;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.STATIC_CALL;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> v) {
        return v.visitStaticCall(this);
    }
}
