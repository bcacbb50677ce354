package util.print;

import java.io.IOException;
import java.io.Writer;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import analysis.cfg.BasicBlock;
import ast.AstStore;
import ast.FunctionDef;
import ast.expressions.BinaryExpr;
import ast.expressions.BooleanExpr;
import ast.expressions.ConditionalExpr;
import ast.expressions.Expression;
import ast.expressions.ExpressionVisitor;
import ast.expressions.FieldAccessExpr;
import ast.expressions.IdExpr;
import ast.expressions.InitOfExpr;
import ast.expressions.MethodCallExpr;
import ast.expressions.NullExpr;
import ast.expressions.NumberExpr;
import ast.expressions.StaticCallExpr;
import ast.expressions.StringExpr;
import ast.expressions.StructInstanceExpr;
import ast.expressions.UnaryExpr;
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
 * Source-like strings for AST nodes. Compound statements print only their header, their bodies live in other basic
 * blocks.
 */
public class PrettyPrinter {

    /**
     * Methods of this class are static
     */
    private PrettyPrinter() {
    }

    private static final ExpressionVisitor<String> EXPRESSION = new ExpressionVisitor<String>() {

        @Override
        public String visitId(IdExpr e) {
            return e.getText();
        }

        @Override
        public String visitNumber(NumberExpr e) {
            return e.getValue().toString();
        }

        @Override
        public String visitBoolean(BooleanExpr e) {
            return String.valueOf(e.getValue());
        }

        @Override
        public String visitString(StringExpr e) {
            return "\"" + e.getValue() + "\"";
        }

        @Override
        public String visitNull(NullExpr e) {
            return "null";
        }

        @Override
        public String visitBinary(BinaryExpr e) {
            return "(" + expressionString(e.getLeft()) + " " + e.getOp() + " " + expressionString(e.getRight()) + ")";
        }

        @Override
        public String visitUnary(UnaryExpr e) {
            return e.getOp() + expressionString(e.getOperand());
        }

        @Override
        public String visitFieldAccess(FieldAccessExpr e) {
            return expressionString(e.getAggregate()) + "." + e.getField();
        }

        @Override
        public String visitStaticCall(StaticCallExpr e) {
            return e.getFunction() + "(" + argsString(e.getArgs()) + ")";
        }

        @Override
        public String visitMethodCall(MethodCallExpr e) {
            return expressionString(e.getSelf()) + "." + e.getMethod() + "(" + argsString(e.getArgs()) + ")";
        }

        @Override
        public String visitConditional(ConditionalExpr e) {
            return expressionString(e.getCondition()) + " ? " + expressionString(e.getThenBranch()) + " : "
                    + expressionString(e.getElseBranch());
        }

        @Override
        public String visitStructInstance(StructInstanceExpr e) {
            StringBuilder sb = new StringBuilder(e.getType() + "{");
            Iterator<Map.Entry<String, Expression>> iter = e.getFields().entrySet().iterator();
            while (iter.hasNext()) {
                Map.Entry<String, Expression> field = iter.next();
                sb.append(field.getKey() + ": " + expressionString(field.getValue()));
                if (iter.hasNext()) {
                    sb.append(", ");
                }
            }
            return sb.append("}").toString();
        }

        @Override
        public String visitInitOf(InitOfExpr e) {
            return "initOf " + e.getContract() + "(" + argsString(e.getArgs()) + ")";
        }
    };

    private static final StatementVisitor<String> STATEMENT = new StatementVisitor<String>() {

        @Override
        public String visitLet(LetStatement s) {
            return "let " + s.getName() + " = " + expressionString(s.getExpression());
        }

        @Override
        public String visitAssign(AssignStatement s) {
            return expressionString(s.getPath()) + " = " + expressionString(s.getExpression());
        }

        @Override
        public String visitAugmentedAssign(AugmentedAssignStatement s) {
            return expressionString(s.getPath()) + " " + s.getOp() + "= " + expressionString(s.getExpression());
        }

        @Override
        public String visitExpression(ExpressionStatement s) {
            return expressionString(s.getExpression());
        }

        @Override
        public String visitReturn(ReturnStatement s) {
            return s.getExpression() == null ? "return" : "return " + expressionString(s.getExpression());
        }

        @Override
        public String visitCondition(ConditionStatement s) {
            return "if (" + expressionString(s.getCondition()) + ")";
        }

        @Override
        public String visitWhile(WhileStatement s) {
            return "while (" + expressionString(s.getCondition()) + ")";
        }

        @Override
        public String visitUntil(UntilStatement s) {
            return "do until (" + expressionString(s.getCondition()) + ")";
        }

        @Override
        public String visitRepeat(RepeatStatement s) {
            return "repeat (" + expressionString(s.getIterations()) + ")";
        }

        @Override
        public String visitForEach(ForEachStatement s) {
            return "foreach (" + s.getKeyName() + ", " + s.getValueName() + " of " + expressionString(s.getMap())
                    + ")";
        }

        @Override
        public String visitTry(TryStatement s) {
            return s.hasCatch() ? "try catch (" + s.getCatchName() + ")" : "try";
        }
    };

    public static String expressionString(Expression e) {
        return e.accept(EXPRESSION);
    }

    /**
     * @param s
     *            statement
     * @return source-like string for s without its nested statements
     */
    public static String statementString(Statement s) {
        return s.accept(STATEMENT);
    }

    private static String argsString(List<Expression> args) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(expressionString(args.get(i)));
        }
        return sb.toString();
    }

    /**
     * @param f
     *            function definition
     * @return signature of f, e.g. "fun transfer(to, amount)"
     */
    public static String functionString(FunctionDef f) {
        StringBuilder sb = new StringBuilder();
        if (f.isGetter()) {
            sb.append("get ");
        }
        switch (f.getKind()) {
        case CONTRACT_INIT:
            sb.append("init");
            break;
        case RECEIVER:
            sb.append("receive");
            break;
        default:
            sb.append("fun " + f.getName());
        }
        sb.append("(");
        Iterator<String> iter = f.getParams().iterator();
        while (iter.hasNext()) {
            sb.append(iter.next());
            if (iter.hasNext()) {
                sb.append(", ");
            }
        }
        return sb.append(")").toString();
    }

    /**
     * Write the statements of a basic block
     *
     * @param ast
     *            store holding the statements
     * @param bb
     *            basic block to write
     * @param writer
     *            writer to write to
     * @param prefix
     *            prepended to each statement (e.g. "\t" to indent)
     * @param postfix
     *            appended to each statement (e.g. "\n" to place each statement on a new line)
     * @throws IOException
     *             writer issues
     */
    public static void writeBasicBlock(AstStore ast, BasicBlock bb, Writer writer, String prefix, String postfix)
            throws IOException {
        for (int id : bb.getStmtIds()) {
            Statement s = ast.getStatement(id);
            writer.write(prefix + (s == null ? "<missing #" + id + ">" : statementString(s)) + postfix);
        }
    }
}
