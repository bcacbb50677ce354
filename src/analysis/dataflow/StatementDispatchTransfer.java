package analysis.dataflow;

import analysis.cfg.BasicBlock;
import ast.statements.AssignStatement;
import ast.statements.AugmentedAssignStatement;
import ast.statements.ConditionStatement;
import ast.statements.ExpressionStatement;
import ast.statements.ForEachStatement;
import ast.statements.LetStatement;
import ast.statements.RepeatStatement;
import ast.statements.ReturnStatement;
import ast.statements.Statement;
import ast.statements.StatementVisitor;
import ast.statements.TryStatement;
import ast.statements.UntilStatement;
import ast.statements.WhileStatement;

/**
 * Transfer function that dispatches based on the kind of statement being processed. Every handler returns its input
 * unchanged unless overridden.
 *
 * @param <S>
 *            type of the data-flow states
 */
public abstract class StatementDispatchTransfer<S> implements Transfer<S> {

    @Override
    public final S transfer(final S in, final BasicBlock bb, Statement stmt) {
        return stmt.accept(new StatementVisitor<S>() {

            @Override
            public S visitLet(LetStatement s) {
                return transferLet(s, in, bb);
            }

            @Override
            public S visitAssign(AssignStatement s) {
                return transferAssign(s, in, bb);
            }

            @Override
            public S visitAugmentedAssign(AugmentedAssignStatement s) {
                return transferAugmentedAssign(s, in, bb);
            }

            @Override
            public S visitExpression(ExpressionStatement s) {
                return transferExpression(s, in, bb);
            }

            @Override
            public S visitReturn(ReturnStatement s) {
                return transferReturn(s, in, bb);
            }

            @Override
            public S visitCondition(ConditionStatement s) {
                return transferCondition(s, in, bb);
            }

            @Override
            public S visitWhile(WhileStatement s) {
                return transferWhile(s, in, bb);
            }

            @Override
            public S visitUntil(UntilStatement s) {
                return transferUntil(s, in, bb);
            }

            @Override
            public S visitRepeat(RepeatStatement s) {
                return transferRepeat(s, in, bb);
            }

            @Override
            public S visitForEach(ForEachStatement s) {
                return transferForEach(s, in, bb);
            }

            @Override
            public S visitTry(TryStatement s) {
                return transferTry(s, in, bb);
            }
        });
    }

    /**
     * Data-flow transfer function for a local variable definition
     *
     * @param s
     *            statement to process
     * @param in
     *            state before the statement
     * @param bb
     *            basic block containing the statement
     * @return state after the statement
     */
    protected S transferLet(LetStatement s, S in, BasicBlock bb) {
        return in;
    }

    /**
     * Data-flow transfer function for an assignment to a variable or a field path
     *
     * @param s
     *            statement to process
     * @param in
     *            state before the statement
     * @param bb
     *            basic block containing the statement
     * @return state after the statement
     */
    protected S transferAssign(AssignStatement s, S in, BasicBlock bb) {
        return in;
    }

    /**
     * Data-flow transfer function for a compound assignment such as <code>x += e</code>
     *
     * @param s
     *            statement to process
     * @param in
     *            state before the statement
     * @param bb
     *            basic block containing the statement
     * @return state after the statement
     */
    protected S transferAugmentedAssign(AugmentedAssignStatement s, S in, BasicBlock bb) {
        return in;
    }

    protected S transferExpression(ExpressionStatement s, S in, BasicBlock bb) {
        return in;
    }

    protected S transferReturn(ReturnStatement s, S in, BasicBlock bb) {
        return in;
    }

    /**
     * Data-flow transfer function for the condition of an <code>if</code>. The branches are separate blocks.
     *
     * @param s
     *            statement to process
     * @param in
     *            state before the statement
     * @param bb
     *            basic block containing the statement
     * @return state after evaluating the condition
     */
    protected S transferCondition(ConditionStatement s, S in, BasicBlock bb) {
        return in;
    }

    protected S transferWhile(WhileStatement s, S in, BasicBlock bb) {
        return in;
    }

    protected S transferUntil(UntilStatement s, S in, BasicBlock bb) {
        return in;
    }

    protected S transferRepeat(RepeatStatement s, S in, BasicBlock bb) {
        return in;
    }

    /**
     * Data-flow transfer function for the header of a <code>foreach</code>, which binds the key and value variables
     *
     * @param s
     *            statement to process
     * @param in
     *            state before the statement
     * @param bb
     *            basic block containing the statement
     * @return state after the statement
     */
    protected S transferForEach(ForEachStatement s, S in, BasicBlock bb) {
        return in;
    }

    protected S transferTry(TryStatement s, S in, BasicBlock bb) {
        return in;
    }
}
