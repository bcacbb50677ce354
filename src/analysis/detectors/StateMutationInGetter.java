package analysis.detectors;

import java.util.ArrayList;
import java.util.List;

import analysis.callgraph.CGNode;
import analysis.callgraph.CallGraph;
import analysis.callgraph.CallGraphBuilder;
import analysis.callgraph.Effect;
import analysis.cfg.CompilationUnit;
import ast.AstUtil;
import ast.AstUtil.ExpressionCallback;
import ast.AstUtil.StatementCallback;
import ast.ContractDef;
import ast.FunctionDef;
import ast.expressions.Expression;
import ast.expressions.MethodCallExpr;
import ast.expressions.StaticCallExpr;
import ast.statements.Statement;

/**
 * Reports getters that modify contract state, directly or through the functions they call. Getters run off-chain and
 * their writes are discarded.
 */
public class StateMutationInGetter extends Detector {

    private static final String SUGGESTION = "Consider moving state-modifying logic to a non-getter function";

    @Override
    public Severity getSeverity() {
        return Severity.INFO;
    }

    @Override
    public List<Warning> check(CompilationUnit cu) {
        List<Warning> warnings = new ArrayList<>();
        CallGraph cg = cu.getCallGraph();
        for (ContractDef contract : cu.getAst().getContracts()) {
            for (FunctionDef decl : contract.getDeclarations()) {
                if (decl.isGetter() && decl.hasBody()) {
                    checkGetter(cg, contract.getName(), decl, warnings);
                }
            }
        }
        return warnings;
    }

    private void checkGetter(final CallGraph cg, final String contractName, FunctionDef getter,
                             final List<Warning> warnings) {
        Integer nodeId = cg.getNodeIdByAstId(getter.getId());
        if (nodeId != null && cg.getNode(nodeId).hasDirectEffect(Effect.STATE_WRITE)) {
            warnings.add(makeWarning("Getter " + getter.getName() + " writes contract fields "
                    + cg.getNode(nodeId).getFieldsWritten(), getter.getLoc(), SUGGESTION));
        }

        AstUtil.forEachStatement(getter.getStatements(), new StatementCallback() {

            @Override
            public void visit(Statement s) {
                for (Expression top : AstUtil.getTopLevelExpressions(s)) {
                    AstUtil.forEachExpression(top, new ExpressionCallback() {

                        @Override
                        public void visit(Expression e) {
                            if (!(e instanceof StaticCallExpr) && !(e instanceof MethodCallExpr)) {
                                return;
                            }
                            String callee = CallGraphBuilder.getCalleeName(e, contractName);
                            Integer calleeId = cg.getNodeIdByName(callee);
                            if (calleeId == null) {
                                return;
                            }
                            CGNode node = cg.getNode(calleeId);
                            if (node.hasEffect(Effect.STATE_WRITE)) {
                                warnings.add(makeWarning("Getter calls state-mutating function: " + callee,
                                                         e.getLoc(),
                                                         SUGGESTION));
                            }
                        }
                    });
                }
            }
        });
    }
}
