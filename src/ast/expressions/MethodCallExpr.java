package ast.expressions;

import java.util.Collections;
import java.util.List;

import ast.SrcLoc;

/**
 * Call of a method on a receiver, e.g. {@code self.reply(body)} or {@code m.set(k, v)}
 */
public class MethodCallExpr extends Expression {

    private final Expression self;
    private final String method;
    private final List<Expression> args;

    public MethodCallExpr(int id, SrcLoc loc, Expression self, String method, List<Expression> args) {
        super(id, loc);
        this.self = self;
        this.method = method;
        this.args = Collections.unmodifiableList(args);
    }

    /**
     * @return receiver expression
     */
    public Expression getSelf() {
        return self;
    }

    public String getMethod() {
        return method;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.METHOD_CALL;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> v) {
        return v.visitMethodCall(this);
    }
}
