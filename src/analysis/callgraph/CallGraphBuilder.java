package analysis.callgraph;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import util.IdxGenerator;
import util.Logger;
import ast.AstStore;
import ast.AstUtil;
import ast.AstUtil.ExpressionCallback;
import ast.AstUtil.StatementCallback;
import ast.ContractDef;
import ast.FunctionDef;
import ast.Stdlib;
import ast.expressions.Expression;
import ast.expressions.FieldAccessExpr;
import ast.expressions.IdExpr;
import ast.expressions.MethodCallExpr;
import ast.expressions.StaticCallExpr;
import ast.statements.AssignStatement;
import ast.statements.AugmentedAssignStatement;
import ast.statements.Statement;

/**
 * Builds the call graph of a program from its syntax trees: one node per function, method, receiver and initializer,
 * one edge per call site, and the effects of each function's own statements.
 */
public class CallGraphBuilder {

    private final AstStore ast;
    private final IdxGenerator idxGen;
    private final Logger logger;

    public CallGraphBuilder(AstStore ast, IdxGenerator idxGen, Logger logger) {
        this.ast = ast;
        this.idxGen = idxGen;
        this.logger = logger;
    }

    /**
     * Build the call graph, standard library code included
     *
     * @return new call graph
     */
    public CallGraph build() {
        CallGraph cg = new CallGraph(idxGen);
        for (FunctionDef f : ast.getFunctions()) {
            cg.addNode(f.getQualifiedName(null), f.getId(), f.getLoc());
        }
        for (ContractDef c : ast.getContracts()) {
            for (FunctionDef f : c.getDeclarations()) {
                cg.addNode(f.getQualifiedName(c.getName()), f.getId(), f.getLoc());
            }
        }

        for (FunctionDef f : ast.getFunctions()) {
            analyzeFunction(cg, f, null);
        }
        for (ContractDef c : ast.getContracts()) {
            for (FunctionDef f : c.getDeclarations()) {
                analyzeFunction(cg, f, c.getName());
            }
        }
        logger.info("Call graph: " + cg.getNodes().size() + " nodes, " + cg.getEdges().size() + " edges");
        return cg;
    }

    private void analyzeFunction(final CallGraph cg, FunctionDef f, final String contractName) {
        if (!f.hasBody()) {
            return;
        }
        final int callerId = cg.getNodeIdByAstId(f.getId());
        AstUtil.forEachStatement(f.getStatements(), new StatementCallback() {

            @Override
            public void visit(Statement s) {
                processStatement(cg, s, callerId, contractName);
            }
        });
    }

    private void processStatement(final CallGraph cg, Statement s, final int callerId, final String contractName) {
        Set<String> written = findStateWrites(s);
        if (!written.isEmpty()) {
            cg.addEffect(callerId, Effect.STATE_WRITE, written);
        }
        ExpressionCallback callback = new ExpressionCallback() {

            @Override
            public void visit(Expression e) {
                processExpression(cg, e, callerId, contractName);
            }
        };
        // The assigned path is not a read
        if (s instanceof AssignStatement) {
            AstUtil.forEachExpression(((AssignStatement) s).getExpression(), callback);
        }
        else if (s instanceof AugmentedAssignStatement) {
            AstUtil.forEachExpression(((AugmentedAssignStatement) s).getExpression(), callback);
        }
        else {
            AstUtil.forEachExpression(s, false, callback);
        }
    }

    private void processExpression(CallGraph cg, Expression e, int callerId, String contractName) {
        if (e instanceof StaticCallExpr || e instanceof MethodCallExpr) {
            String calleeName = getCalleeName(e, contractName);
            CGNode callee = cg.findOrAddNode(calleeName);
            if (!callee.isDefined()) {
                logger.debug("Call to " + calleeName + " without a definition at " + e.getLoc());
            }
            cg.addEdge(callerId, callee.getIdx(), e.getLoc());
        }
        if (e instanceof StaticCallExpr) {
            String function = ((StaticCallExpr) e).getFunction();
            if (Stdlib.DATETIME_FUNCTIONS.contains(function)) {
                cg.addEffect(callerId, Effect.ACCESS_DATETIME);
            }
            else if (Stdlib.PRG_USE_FUNCTIONS.contains(function)) {
                cg.addEffect(callerId, Effect.PRG_USE);
            }
            else if (Stdlib.PRG_INIT_FUNCTIONS.contains(function)) {
                cg.addEffect(callerId, Effect.PRG_SEED_INIT);
            }
        }
        if (Stdlib.isSendCall(e)) {
            cg.addEffect(callerId, Effect.SEND);
        }
        if (e instanceof FieldAccessExpr) {
            String field = AstUtil.getSelfField(e);
            if (field != null) {
                cg.addEffect(callerId, Effect.STATE_READ, Collections.singletonList(field));
            }
        }
    }

    /**
     * Qualified name of the function called by a call expression. Methods called on {@code self} belong to the
     * enclosing contract; methods called on other values are extension functions and resolve to the bare method
     * name.
     *
     * @param call
     *            static or method call
     * @param contractName
     *            enclosing contract, null in free functions
     * @return name of the callee
     */
    public static String getCalleeName(Expression call, String contractName) {
        if (call instanceof StaticCallExpr) {
            return ((StaticCallExpr) call).getFunction();
        }
        MethodCallExpr mc = (MethodCallExpr) call;
        Expression self = mc.getSelf();
        if (self instanceof IdExpr && ((IdExpr) self).isSelf() && contractName != null) {
            return contractName + "::" + mc.getMethod();
        }
        return mc.getMethod();
    }

    /**
     * Contract fields written by a statement, not counting nested statements
     */
    private static Set<String> findStateWrites(Statement s) {
        final Set<String> fields = new LinkedHashSet<>();
        if (s instanceof AssignStatement || s instanceof AugmentedAssignStatement) {
            Expression path = s instanceof AssignStatement ? ((AssignStatement) s).getPath()
                    : ((AugmentedAssignStatement) s).getPath();
            String field = AstUtil.getSelfField(path);
            if (field != null) {
                fields.add(field);
            }
        }
        AstUtil.forEachExpression(s, false, new ExpressionCallback() {

            @Override
            public void visit(Expression e) {
                if (e instanceof MethodCallExpr) {
                    String field = Stdlib.findMutatedField((MethodCallExpr) e);
                    if (field != null) {
                        fields.add(field);
                    }
                }
            }
        });
        return fields;
    }
}
