package ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;

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
 * Traversal helpers over statements and expressions
 */
public class AstUtil {

    /**
     * Methods of this class are static
     */
    private AstUtil() {
        // Intentionally blank
    }

    /**
     * Called for every expression visited by a traversal
     */
    public static interface ExpressionCallback {
        void visit(Expression e);
    }

    /**
     * Called for every statement visited by a traversal
     */
    public static interface StatementCallback {
        void visit(Statement s);
    }

    /**
     * Condition used to search an expression tree
     */
    public static interface ExpressionPredicate {
        boolean matches(Expression e);
    }

    /**
     * Direct subexpressions of an expression
     */
    private static final ExpressionVisitor<List<Expression>> CHILDREN = new ExpressionVisitor<List<Expression>>() {

        @Override
        public List<Expression> visitId(IdExpr e) {
            return Collections.emptyList();
        }

        @Override
        public List<Expression> visitNumber(NumberExpr e) {
            return Collections.emptyList();
        }

        @Override
        public List<Expression> visitBoolean(BooleanExpr e) {
            return Collections.emptyList();
        }

        @Override
        public List<Expression> visitString(StringExpr e) {
            return Collections.emptyList();
        }

        @Override
        public List<Expression> visitNull(NullExpr e) {
            return Collections.emptyList();
        }

        @Override
        public List<Expression> visitBinary(BinaryExpr e) {
            List<Expression> l = new ArrayList<>(2);
            l.add(e.getLeft());
            l.add(e.getRight());
            return l;
        }

        @Override
        public List<Expression> visitUnary(UnaryExpr e) {
            return Collections.singletonList(e.getOperand());
        }

        @Override
        public List<Expression> visitFieldAccess(FieldAccessExpr e) {
            return Collections.singletonList(e.getAggregate());
        }

        @Override
        public List<Expression> visitStaticCall(StaticCallExpr e) {
            return e.getArgs();
        }

        @Override
        public List<Expression> visitMethodCall(MethodCallExpr e) {
            List<Expression> l = new ArrayList<>(e.getArgs().size() + 1);
            l.add(e.getSelf());
            l.addAll(e.getArgs());
            return l;
        }

        @Override
        public List<Expression> visitConditional(ConditionalExpr e) {
            List<Expression> l = new ArrayList<>(3);
            l.add(e.getCondition());
            l.add(e.getThenBranch());
            l.add(e.getElseBranch());
            return l;
        }

        @Override
        public List<Expression> visitStructInstance(StructInstanceExpr e) {
            return new ArrayList<>(e.getFields().values());
        }

        @Override
        public List<Expression> visitInitOf(InitOfExpr e) {
            return e.getArgs();
        }
    };

    /**
     * Expressions appearing directly in a statement, not in the statements nested in it
     */
    private static final StatementVisitor<List<Expression>> TOP_LEVEL = new StatementVisitor<List<Expression>>() {

        @Override
        public List<Expression> visitLet(LetStatement s) {
            return Collections.singletonList(s.getExpression());
        }

        @Override
        public List<Expression> visitAssign(AssignStatement s) {
            List<Expression> l = new ArrayList<>(2);
            l.add(s.getPath());
            l.add(s.getExpression());
            return l;
        }

        @Override
        public List<Expression> visitAugmentedAssign(AugmentedAssignStatement s) {
            List<Expression> l = new ArrayList<>(2);
            l.add(s.getPath());
            l.add(s.getExpression());
            return l;
        }

        @Override
        public List<Expression> visitExpression(ExpressionStatement s) {
            return Collections.singletonList(s.getExpression());
        }

        @Override
        public List<Expression> visitReturn(ReturnStatement s) {
            if (s.getExpression() == null) {
                return Collections.emptyList();
            }
            return Collections.singletonList(s.getExpression());
        }

        @Override
        public List<Expression> visitCondition(ConditionStatement s) {
            return Collections.singletonList(s.getCondition());
        }

        @Override
        public List<Expression> visitWhile(WhileStatement s) {
            return Collections.singletonList(s.getCondition());
        }

        @Override
        public List<Expression> visitUntil(UntilStatement s) {
            return Collections.singletonList(s.getCondition());
        }

        @Override
        public List<Expression> visitRepeat(RepeatStatement s) {
            return Collections.singletonList(s.getIterations());
        }

        @Override
        public List<Expression> visitForEach(ForEachStatement s) {
            return Collections.singletonList(s.getMap());
        }

        @Override
        public List<Expression> visitTry(TryStatement s) {
            return Collections.emptyList();
        }
    };

    /**
     * @param e
     *            expression
     * @return direct subexpressions of e in evaluation order
     */
    public static List<Expression> getChildren(Expression e) {
        return e.accept(CHILDREN);
    }

    /**
     * @param s
     *            statement
     * @return expressions appearing in s itself, excluding the statements nested in s
     */
    public static List<Expression> getTopLevelExpressions(Statement s) {
        return s.accept(TOP_LEVEL);
    }

    /**
     * Visit e and all its subexpressions, parents before children
     */
    public static void forEachExpression(Expression e, ExpressionCallback callback) {
        LinkedList<Expression> stack = new LinkedList<>();
        stack.push(e);
        while (!stack.isEmpty()) {
            Expression current = stack.pop();
            callback.visit(current);
            List<Expression> children = getChildren(current);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    /**
     * Visit every expression of a statement
     *
     * @param s
     *            statement
     * @param includeNested
     *            whether to also visit the expressions of statements nested in s (branches, loop bodies)
     * @param callback
     *            called for each expression
     */
    public static void forEachExpression(Statement s, boolean includeNested, final ExpressionCallback callback) {
        if (!includeNested) {
            for (Expression e : getTopLevelExpressions(s)) {
                forEachExpression(e, callback);
            }
            return;
        }
        forEachStatement(Collections.singletonList(s), new StatementCallback() {

            @Override
            public void visit(Statement nested) {
                for (Expression e : getTopLevelExpressions(nested)) {
                    forEachExpression(e, callback);
                }
            }
        });
    }

    /**
     * Visit every statement in the list and every statement nested in them, in source order
     */
    public static void forEachStatement(List<Statement> statements, StatementCallback callback) {
        for (Statement s : statements) {
            callback.visit(s);
            for (List<Statement> nested : s.getNestedBlocks()) {
                forEachStatement(nested, callback);
            }
        }
    }

    /**
     * Find the first subexpression (in the order of {@link #forEachExpression(Expression, ExpressionCallback)})
     * satisfying the predicate
     *
     * @return matching expression or null if there is none
     */
    public static Expression findInExpression(Expression e, ExpressionPredicate p) {
        LinkedList<Expression> stack = new LinkedList<>();
        stack.push(e);
        while (!stack.isEmpty()) {
            Expression current = stack.pop();
            if (p.matches(current)) {
                return current;
            }
            List<Expression> children = getChildren(current);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return null;
    }

    /**
     * Find the first expression in a statement, including nested statements, satisfying the predicate
     *
     * @return matching expression or null if there is none
     */
    public static Expression findInStatement(Statement s, final ExpressionPredicate p) {
        final List<Expression> found = new ArrayList<>(1);
        forEachExpression(s, true, new ExpressionCallback() {

            @Override
            public void visit(Expression e) {
                if (found.isEmpty() && p.matches(e)) {
                    found.add(e);
                }
            }
        });
        return found.isEmpty() ? null : found.get(0);
    }

    /**
     * Turn a chain of field accesses such as {@code self.a.b} into the list of names {@code [self, a, b]}
     *
     * @param e
     *            expression
     * @return list of names or null if e is not an identifier or a chain of field accesses on one
     */
    public static List<String> tryExtractPath(Expression e) {
        LinkedList<String> path = new LinkedList<>();
        Expression current = e;
        while (current instanceof FieldAccessExpr) {
            FieldAccessExpr fa = (FieldAccessExpr) current;
            path.addFirst(fa.getField());
            current = fa.getAggregate();
        }
        if (!(current instanceof IdExpr)) {
            return null;
        }
        path.addFirst(((IdExpr) current).getText());
        return path;
    }

    /**
     * @return whether e is the identifier {@code self}
     */
    public static boolean isSelf(Expression e) {
        return e instanceof IdExpr && ((IdExpr) e).isSelf();
    }

    /**
     * If e is a field of the contract ({@code self.field}, possibly followed by further accesses), return the name of
     * the contract field
     *
     * @param e
     *            expression
     * @return name of the accessed contract field, or null
     */
    public static String getSelfField(Expression e) {
        List<String> path = tryExtractPath(e);
        if (path == null || path.size() < 2 || !"self".equals(path.get(0))) {
            return null;
        }
        return path.get(1);
    }

    /**
     * @return names of all identifiers used in e
     */
    public static List<String> collectIdentifiers(Expression e) {
        final List<String> ids = new ArrayList<>();
        forEachExpression(e, new ExpressionCallback() {

            @Override
            public void visit(Expression sub) {
                if (sub instanceof IdExpr) {
                    ids.add(((IdExpr) sub).getText());
                }
            }
        });
        return ids;
    }
}
