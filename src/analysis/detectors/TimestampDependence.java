package analysis.detectors;

import java.util.ArrayList;
import java.util.List;

import analysis.cfg.BasicBlock;
import analysis.cfg.Cfg;
import analysis.cfg.CompilationUnit;
import analysis.cfg.CompilationUnit.CfgCallback;
import analysis.dataflow.AnalysisKind;
import analysis.dataflow.AnalysisResult;
import analysis.dataflow.StatementDispatchTransfer;
import analysis.dataflow.WorklistSolver;
import analysis.dataflow.util.SharedSet;
import analysis.dataflow.util.SharedSetLattice;
import ast.AstUtil;
import ast.AstUtil.ExpressionPredicate;
import ast.Stdlib;
import ast.expressions.Expression;
import ast.expressions.IdExpr;
import ast.statements.AssignStatement;
import ast.statements.AugmentedAssignStatement;
import ast.statements.LetStatement;
import ast.statements.Statement;

/**
 * Reports statements whose behavior depends on the block timestamp, either through a direct call to {@code now()} or
 * through a local variable computed from it. Timestamps are chosen by validators and are visible to everyone, so they
 * make poor sources of randomness and can be nudged to flip a condition.
 * <p>
 * Tainted variables are computed by a forward data-flow analysis over each function.
 */
public class TimestampDependence extends Detector {

    @Override
    public Severity getSeverity() {
        return Severity.LOW;
    }

    @Override
    public List<Warning> check(final CompilationUnit cu) {
        final List<Warning> warnings = new ArrayList<>();
        cu.forEachCFG(new CfgCallback() {

            @Override
            public void visit(Cfg cfg) {
                final AnalysisResult<SharedSet<String>> result = computeTaint(cu, cfg, getMaxIterations());
                cfg.forEachBasicBlock(cu.getAst(), new Cfg.BasicBlockCallback() {

                    @Override
                    public void visit(Statement stmt, BasicBlock bb) {
                        SharedSet<String> tainted = result.getInState(bb.getIdx());
                        if (tainted != null && usesTimestamp(stmt, tainted)) {
                            warnings.add(makeWarning(describe(stmt), stmt.getLoc(),
                                                     "Block timestamps are predictable and publicly visible. Do not"
                                                             + " use them for randomness or critical conditions."));
                        }
                    }
                });
            }
        });
        return warnings;
    }

    /**
     * Compute the set of local variables derived from the timestamp before and after each block
     *
     * @param cu
     *            compilation unit
     * @param cfg
     *            function to analyze
     * @param maxIterations
     *            budget of block visits
     * @return tainted variable names for each block
     */
    public static AnalysisResult<SharedSet<String>> computeTaint(CompilationUnit cu, Cfg cfg, int maxIterations) {
        WorklistSolver<SharedSet<String>> solver = new WorklistSolver<>(cu,
                                                                        cfg,
                                                                        new NowTaintTransfer(),
                                                                        new SharedSetLattice<String>(),
                                                                        AnalysisKind.FORWARD);
        return solver.setMaxIterations(maxIterations).solve();
    }

    /**
     * Whether the expressions of a statement (not those of nested statements) read the timestamp
     */
    private static boolean usesTimestamp(Statement stmt, SharedSet<String> tainted) {
        List<Expression> used;
        if (stmt instanceof AssignStatement) {
            // The target is written not read
            used = new ArrayList<>(1);
            used.add(((AssignStatement) stmt).getExpression());
        }
        else {
            used = AstUtil.getTopLevelExpressions(stmt);
        }
        for (Expression e : used) {
            if (isTainted(e, tainted)) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Statement stmt) {
        switch (stmt.kind()) {
        case CONDITION:
            return "Tainted timestamp used in a condition";
        case RETURN:
            return "Returning a tainted timestamp";
        case WHILE:
        case UNTIL:
        case REPEAT:
            return "Loop condition depends on tainted timestamp";
        case ASSIGN:
        case AUGMENTED_ASSIGN:
            return "Assignment uses now() or a tainted variable";
        case LET:
            return "Variable declaration uses now() or a tainted variable";
        default:
            return "Time-dependent usage found";
        }
    }

    /**
     * @return whether e calls {@code now()} or reads a tainted variable
     */
    static boolean isTainted(Expression e, final SharedSet<String> tainted) {
        return AstUtil.findInExpression(e, new ExpressionPredicate() {

            @Override
            public boolean matches(Expression sub) {
                if (Stdlib.isDatetimeCall(sub)) {
                    return true;
                }
                if (sub instanceof IdExpr) {
                    String text = ((IdExpr) sub).getText();
                    return text.equals("now") || tainted.contains(text);
                }
                return false;
            }
        }) != null;
    }

    /**
     * Variables defined or assigned from a tainted expression become tainted. Taint is never removed.
     */
    static class NowTaintTransfer extends StatementDispatchTransfer<SharedSet<String>> {

        @Override
        protected SharedSet<String> transferLet(LetStatement s, SharedSet<String> in, BasicBlock bb) {
            return isTainted(s.getExpression(), in) ? in.add(s.getName()) : in;
        }

        @Override
        protected SharedSet<String> transferAssign(AssignStatement s, SharedSet<String> in, BasicBlock bb) {
            return taintTarget(s.getPath(), s.getExpression(), in);
        }

        @Override
        protected SharedSet<String> transferAugmentedAssign(AugmentedAssignStatement s, SharedSet<String> in,
                                                            BasicBlock bb) {
            return taintTarget(s.getPath(), s.getExpression(), in);
        }

        private static SharedSet<String> taintTarget(Expression path, Expression rhs, SharedSet<String> in) {
            if (path instanceof IdExpr && isTainted(rhs, in)) {
                return in.add(((IdExpr) path).getText());
            }
            return in;
        }
    }
}
