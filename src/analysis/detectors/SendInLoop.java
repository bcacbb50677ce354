package analysis.detectors;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

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
import ast.Stdlib;
import ast.expressions.Expression;
import ast.expressions.MethodCallExpr;
import ast.expressions.StaticCallExpr;
import ast.statements.LoopStatement;
import ast.statements.Statement;

/**
 * Reports messages sent from inside a loop, either directly or by calling a function that sends. The number of
 * iterations is often controlled by the caller, so such loops can drain the contract's balance or run out of gas
 * half way through.
 */
public class SendInLoop extends Detector {

    private static final String SUGGESTION = "Consider refactoring to avoid sending messages inside loops";

    @Override
    public Severity getSeverity() {
        return Severity.MEDIUM;
    }

    @Override
    public List<Warning> check(CompilationUnit cu) {
        final List<Warning> warnings = new ArrayList<>();
        final CallGraph cg = cu.getCallGraph();
        for (final FunctionDef f : cu.getAst().getAllFunctions(false)) {
            if (!f.hasBody()) {
                continue;
            }
            ContractDef contract = cu.getAst().getDeclaringContract(f);
            final String contractName = contract == null ? null : contract.getName();
            final Set<Integer> processedLoops = new HashSet<>();
            AstUtil.forEachStatement(f.getStatements(), new StatementCallback() {

                @Override
                public void visit(Statement s) {
                    if (!(s instanceof LoopStatement) || processedLoops.contains(s.getId())) {
                        return;
                    }
                    markNestedLoops((LoopStatement) s, processedLoops);
                    checkLoop((LoopStatement) s, contractName, cg, warnings);
                }
            });
        }
        return warnings;
    }

    /**
     * Loops nested in an analyzed loop are covered by it
     */
    private static void markNestedLoops(LoopStatement loop, final Set<Integer> processed) {
        processed.add(loop.getId());
        AstUtil.forEachStatement(loop.getStatements(), new StatementCallback() {

            @Override
            public void visit(Statement s) {
                if (s instanceof LoopStatement) {
                    processed.add(s.getId());
                }
            }
        });
    }

    private void checkLoop(LoopStatement loop, final String contractName, final CallGraph cg,
                           final List<Warning> warnings) {
        AstUtil.forEachExpression(loop, true, new ExpressionCallback() {

            @Override
            public void visit(Expression e) {
                if (Stdlib.isSendCall(e)) {
                    warnings.add(makeWarning("Send function called inside a loop", e.getLoc(), SUGGESTION));
                    return;
                }
                if (!(e instanceof StaticCallExpr) && !(e instanceof MethodCallExpr)) {
                    return;
                }
                String callee = CallGraphBuilder.getCalleeName(e, contractName);
                Integer nodeId = cg.getNodeIdByName(callee);
                if (nodeId == null) {
                    return;
                }
                CGNode node = cg.getNode(nodeId);
                if (node.isDefined() && node.hasEffect(Effect.SEND)) {
                    warnings.add(makeWarning("Function that sends a message called inside a loop: " + callee,
                                             e.getLoc(),
                                             SUGGESTION));
                }
            }
        });
    }
}
