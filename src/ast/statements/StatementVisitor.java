package ast.statements;

/**
 * Visitor with one method per statement kind
 *
 * @param <R>
 *            result of visiting a statement
 */
public interface StatementVisitor<R> {

    R visitLet(LetStatement s);

    R visitAssign(AssignStatement s);

    R visitAugmentedAssign(AugmentedAssignStatement s);

    R visitExpression(ExpressionStatement s);

    R visitReturn(ReturnStatement s);

    R visitCondition(ConditionStatement s);

    R visitWhile(WhileStatement s);

    R visitUntil(UntilStatement s);

    R visitRepeat(RepeatStatement s);

    R visitForEach(ForEachStatement s);

    R visitTry(TryStatement s);
}
