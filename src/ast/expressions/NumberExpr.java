package ast.expressions;

import java.math.BigInteger;

import ast.SrcLoc;

/**
 * Integer literal, the language only has arbitrary precision integers
 */
public class NumberExpr extends Expression {

    private final BigInteger value;

    public NumberExpr(int id, SrcLoc loc, BigInteger value) {
        super(id, loc);
        this.value = value;
    }

    public BigInteger getValue() {
        return value;
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.NUMBER;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> v) {
        return v.visitNumber(this);
    }
}
