package ast.expressions;

/**
 * Visitor with one method per expression kind
 *
 * @param <R>
 *            result of visiting an expression
 */
public interface ExpressionVisitor<R> {

    R visitId(IdExpr e);

    R visitNumber(NumberExpr e);

    R visitBoolean(BooleanExpr e);

    R visitString(StringExpr e);

    R visitNull(NullExpr e);

    R visitBinary(BinaryExpr e);

    R visitUnary(UnaryExpr e);

    R visitFieldAccess(FieldAccessExpr e);

    R visitStaticCall(StaticCallExpr e);

    R visitMethodCall(MethodCallExpr e);

    R visitConditional(ConditionalExpr e);

    R visitStructInstance(StructInstanceExpr e);

    R visitInitOf(InitOfExpr e);
}
