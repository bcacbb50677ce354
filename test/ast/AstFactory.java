package ast;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import util.IdxGenerator;
import util.Logger;
import analysis.cfg.CompilationUnit;
import analysis.cfg.IrBuilder;
import ast.expressions.BinaryExpr;
import ast.expressions.Expression;
import ast.expressions.FieldAccessExpr;
import ast.expressions.IdExpr;
import ast.expressions.MethodCallExpr;
import ast.expressions.NumberExpr;
import ast.expressions.StaticCallExpr;
import ast.statements.AssignStatement;
import ast.statements.AugmentedAssignStatement;
import ast.statements.ConditionStatement;
import ast.statements.ExpressionStatement;
import ast.statements.ForEachStatement;
import ast.statements.LetStatement;
import ast.statements.RepeatStatement;
import ast.statements.ReturnStatement;
import ast.statements.Statement;
import ast.statements.TryStatement;
import ast.statements.WhileStatement;

/**
 * Builds AST fragments for tests. Every node gets a fresh id and its id as line number.
 */
public class AstFactory {

    private int nextId = 1;

    private SrcLoc loc(int id) {
        return new SrcLoc("test.tact", id, 1);
    }

    private int id() {
        return nextId++;
    }

    public IdExpr id(String text) {
        int i = id();
        return new IdExpr(i, loc(i), text);
    }

    public IdExpr self() {
        return id("self");
    }

    public NumberExpr num(long value) {
        int i = id();
        return new NumberExpr(i, loc(i), BigInteger.valueOf(value));
    }

    public BinaryExpr bin(String op, Expression left, Expression right) {
        int i = id();
        return new BinaryExpr(i, loc(i), op, left, right);
    }

    public StaticCallExpr call(String function, Expression... args) {
        int i = id();
        return new StaticCallExpr(i, loc(i), function, Arrays.asList(args));
    }

    public MethodCallExpr method(Expression receiver, String method, Expression... args) {
        int i = id();
        return new MethodCallExpr(i, loc(i), receiver, method, Arrays.asList(args));
    }

    public FieldAccessExpr field(Expression aggregate, String name) {
        int i = id();
        return new FieldAccessExpr(i, loc(i), aggregate, name);
    }

    /**
     * @return <code>self.name</code>
     */
    public FieldAccessExpr selfField(String name) {
        return field(self(), name);
    }

    public LetStatement let(String name, Expression e) {
        int i = id();
        return new LetStatement(i, loc(i), name, e);
    }

    public AssignStatement assign(Expression path, Expression e) {
        int i = id();
        return new AssignStatement(i, loc(i), path, e);
    }

    public AugmentedAssignStatement augAssign(String op, Expression path, Expression e) {
        int i = id();
        return new AugmentedAssignStatement(i, loc(i), op, path, e);
    }

    public ExpressionStatement expr(Expression e) {
        int i = id();
        return new ExpressionStatement(i, loc(i), e);
    }

    public ReturnStatement ret(Expression e) {
        int i = id();
        return new ReturnStatement(i, loc(i), e);
    }

    public ConditionStatement ifThen(Expression cond, List<Statement> trueStmts) {
        int i = id();
        return new ConditionStatement(i, loc(i), cond, trueStmts, null);
    }

    public ConditionStatement ifElse(Expression cond, List<Statement> trueStmts, List<Statement> falseStmts) {
        int i = id();
        return new ConditionStatement(i, loc(i), cond, trueStmts, falseStmts);
    }

    public WhileStatement whileLoop(Expression cond, Statement... body) {
        int i = id();
        return new WhileStatement(i, loc(i), cond, Arrays.asList(body));
    }

    public RepeatStatement repeat(Expression n, Statement... body) {
        int i = id();
        return new RepeatStatement(i, loc(i), n, Arrays.asList(body));
    }

    public ForEachStatement forEach(String key, String value, Expression map, Statement... body) {
        int i = id();
        return new ForEachStatement(i, loc(i), key, value, map, Arrays.asList(body));
    }

    public TryStatement tryCatch(List<Statement> body, String catchName, List<Statement> catchStmts) {
        int i = id();
        return new TryStatement(i, loc(i), body, catchName, catchStmts);
    }

    public static List<Statement> stmts(Statement... statements) {
        return new ArrayList<>(Arrays.asList(statements));
    }

    public FunctionDef function(String name, Statement... body) {
        int i = id();
        return new FunctionDef(i, loc(i), FunctionDef.Kind.FUNCTION, name, Collections.<String> emptyList(),
                               Arrays.asList(body), false, ItemOrigin.USER);
    }

    public FunctionDef stdlibFunction(String name) {
        int i = id();
        return new FunctionDef(i, loc(i), FunctionDef.Kind.FUNCTION, name, Collections.<String> emptyList(), null,
                               false, ItemOrigin.STDLIB);
    }

    public FunctionDef getter(String name, Statement... body) {
        int i = id();
        return new FunctionDef(i, loc(i), FunctionDef.Kind.FUNCTION, name, Collections.<String> emptyList(),
                               Arrays.asList(body), true, ItemOrigin.USER);
    }

    public FunctionDef init(Statement... body) {
        int i = id();
        return new FunctionDef(i, loc(i), FunctionDef.Kind.CONTRACT_INIT, null, Collections.<String> emptyList(),
                               Arrays.asList(body), false, ItemOrigin.USER);
    }

    public FunctionDef receiver(Statement... body) {
        int i = id();
        return new FunctionDef(i, loc(i), FunctionDef.Kind.RECEIVER, null, Collections.singletonList("msg"),
                               Arrays.asList(body), false, ItemOrigin.USER);
    }

    public ContractDef contract(String name, List<String> fields, FunctionDef... declarations) {
        int i = id();
        return new ContractDef(i, loc(i), name, fields, Arrays.asList(declarations), ItemOrigin.USER);
    }

    public static AstStore store(List<FunctionDef> functions, List<ContractDef> contracts) {
        return new AstStore("test", functions, contracts);
    }

    public static AstStore store(FunctionDef... functions) {
        return store(Arrays.asList(functions), Collections.<ContractDef> emptyList());
    }

    /**
     * Build the control-flow graphs and the call graph of a program
     */
    public static CompilationUnit build(AstStore ast) {
        return new IrBuilder(ast, new IdxGenerator(), Logger.quiet()).build();
    }
}
