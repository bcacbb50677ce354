package ast;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import util.IdxGenerator;
import util.Logger;
import ast.expressions.BinaryExpr;
import ast.expressions.BooleanExpr;
import ast.expressions.ConditionalExpr;
import ast.expressions.Expression;
import ast.expressions.ExpressionKind;
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
import ast.statements.StatementKind;
import ast.statements.TryStatement;
import ast.statements.UntilStatement;
import ast.statements.WhileStatement;

/**
 * Reads the AST document produced by the compiler frontend.
 * <p>
 * The document is an object with a {@code project} name and two arrays, {@code functions} and {@code contracts}.
 * Every node may carry an {@code id}; nodes without one get a fresh identifier that does not collide with any
 * identifier used in the document. Two nodes with the same explicit identifier are an error.
 */
public class AstReader {

    /**
     * Counter kind used for generated node identifiers
     */
    private static final String AST_IDX = "ast";

    private final IdxGenerator idxGen;
    private final Logger logger;
    /**
     * Identifiers appearing explicitly in the document being read
     */
    private final Set<Integer> explicitIds = new HashSet<>();
    /**
     * Identifiers already assigned to a node
     */
    private final Set<Integer> assignedIds = new HashSet<>();

    public AstReader(IdxGenerator idxGen, Logger logger) {
        this.idxGen = idxGen;
        this.logger = logger;
    }

    /**
     * Read an AST document from a file
     *
     * @param file
     *            JSON file
     * @return the syntax trees in the file
     * @throws IOException
     *             if the file cannot be read
     * @throws AstFormatException
     *             if the document is malformed
     */
    public AstStore read(Path file) throws IOException {
        String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        JSONObject doc;
        try {
            doc = new JSONObject(text);
        }
        catch (JSONException e) {
            throw new AstFormatException("Invalid JSON in " + file + ": " + e.getMessage(), e);
        }
        return read(doc);
    }

    /**
     * Read an AST document
     *
     * @param doc
     *            parsed JSON document
     * @return the syntax trees in the document
     * @throws AstFormatException
     *             if the document is malformed
     */
    public AstStore read(JSONObject doc) {
        explicitIds.clear();
        assignedIds.clear();
        collectIds(doc);

        String project = doc.optString("project", "unnamed");
        List<FunctionDef> functions = new ArrayList<>();
        Set<String> functionNames = new HashSet<>();
        JSONArray fs = doc.optJSONArray("functions");
        if (fs != null) {
            for (int i = 0; i < fs.length(); i++) {
                FunctionDef f = readFunction(objectAt(fs, i, "functions"));
                checkUnique(functionNames, f.getUniqueName(), "function");
                functions.add(f);
            }
        }
        List<ContractDef> contracts = new ArrayList<>();
        Set<String> contractNames = new HashSet<>();
        JSONArray cs = doc.optJSONArray("contracts");
        if (cs != null) {
            for (int i = 0; i < cs.length(); i++) {
                ContractDef c = readContract(objectAt(cs, i, "contracts"));
                checkUnique(contractNames, c.getName(), "contract");
                contracts.add(c);
            }
        }
        logger.info("Read project " + project + ": " + functions.size() + " functions, " + contracts.size()
                + " contracts");
        return new AstStore(project, functions, contracts);
    }

    /**
     * Record every explicit identifier in the document so generated ones can avoid them
     */
    private void collectIds(Object json) {
        if (json instanceof JSONObject) {
            JSONObject o = (JSONObject) json;
            if (o.has("id") && o.opt("id") instanceof Number) {
                explicitIds.add(((Number) o.opt("id")).intValue());
            }
            for (String key : o.keySet()) {
                collectIds(o.opt(key));
            }
        }
        else if (json instanceof JSONArray) {
            JSONArray a = (JSONArray) json;
            for (int i = 0; i < a.length(); i++) {
                collectIds(a.opt(i));
            }
        }
    }

    private int readId(JSONObject o) {
        int id;
        if (o.has("id")) {
            Object raw = o.opt("id");
            if (!(raw instanceof Number)) {
                throw new AstFormatException("Key \"id\" must be an integer, found " + raw);
            }
            id = ((Number) raw).intValue();
            if (!assignedIds.add(id)) {
                throw new AstFormatException("Duplicate node id " + id);
            }
            return id;
        }
        do {
            id = idxGen.next(AST_IDX);
        } while (explicitIds.contains(id) || !assignedIds.add(id));
        return id;
    }

    private static SrcLoc readLoc(JSONObject o) {
        JSONObject loc = o.optJSONObject("loc");
        if (loc == null) {
            return SrcLoc.NONE;
        }
        return new SrcLoc(loc.has("file") ? loc.optString("file") : null, loc.optInt("line", 0), loc.optInt("column",
                                                                                                              0));
    }

    private static ItemOrigin readOrigin(JSONObject o) {
        String name = o.optString("origin", ItemOrigin.USER.getJsonName());
        ItemOrigin origin = ItemOrigin.fromJsonName(name);
        if (origin == null) {
            throw new AstFormatException("Unknown origin \"" + name + "\"");
        }
        return origin;
    }

    /**
     * CFGs and call graph nodes are keyed by these names
     */
    private static void checkUnique(Set<String> seen, String name, String what) {
        if (!seen.add(name)) {
            throw new AstFormatException("Duplicate " + what + " name \"" + name + "\"");
        }
    }

    private ContractDef readContract(JSONObject o) {
        int id = readId(o);
        String name = requireString(o, "name");
        List<String> fields = readStrings(o, "fields");
        List<FunctionDef> declarations = new ArrayList<>();
        Set<String> methodNames = new HashSet<>();
        JSONArray ds = o.optJSONArray("declarations");
        if (ds != null) {
            for (int i = 0; i < ds.length(); i++) {
                FunctionDef f = readFunction(objectAt(ds, i, "declarations"));
                checkUnique(methodNames, f.getUniqueName(), "method in contract " + name);
                declarations.add(f);
            }
        }
        return new ContractDef(id, readLoc(o), name, fields, declarations, readOrigin(o));
    }

    private FunctionDef readFunction(JSONObject o) {
        int id = readId(o);
        String kindName = o.optString("kind", FunctionDef.Kind.FUNCTION.getJsonName());
        FunctionDef.Kind kind = FunctionDef.Kind.fromJsonName(kindName);
        if (kind == null) {
            throw new AstFormatException("Unknown function kind \"" + kindName + "\"");
        }
        String name = o.optString("name", "");
        if (name.isEmpty() && kind == FunctionDef.Kind.FUNCTION) {
            throw new AstFormatException("Missing key \"name\" in function_def");
        }
        List<Statement> body = o.has("statements") && !o.isNull("statements") ? readStatements(o, "statements")
                : null;
        return new FunctionDef(id,
                               readLoc(o),
                               kind,
                               name,
                               readStrings(o, "params"),
                               body,
                               o.optBoolean("getter", false),
                               readOrigin(o));
    }

    private List<Statement> readStatements(JSONObject o, String key) {
        JSONArray a = o.optJSONArray(key);
        if (a == null) {
            throw new AstFormatException("Missing statement list \"" + key + "\"");
        }
        List<Statement> stmts = new ArrayList<>(a.length());
        for (int i = 0; i < a.length(); i++) {
            stmts.add(readStatement(objectAt(a, i, key)));
        }
        return stmts;
    }

    private List<Statement> readOptionalStatements(JSONObject o, String key) {
        if (!o.has(key) || o.isNull(key)) {
            return null;
        }
        return readStatements(o, key);
    }

    /**
     * Read one statement, dispatching on its kind tag
     */
    private Statement readStatement(JSONObject o) {
        String kindName = requireString(o, "kind");
        StatementKind kind = StatementKind.fromJsonName(kindName);
        if (kind == null) {
            throw new AstFormatException("Unknown statement kind \"" + kindName + "\"");
        }
        int id = readId(o);
        SrcLoc loc = readLoc(o);
        switch (kind) {
        case LET:
            return new LetStatement(id, loc, requireString(o, "name"), readExpression(o, "expression"));
        case ASSIGN:
            return new AssignStatement(id, loc, readExpression(o, "path"), readExpression(o, "expression"));
        case AUGMENTED_ASSIGN:
            return new AugmentedAssignStatement(id,
                                                loc,
                                                requireString(o, "op"),
                                                readExpression(o, "path"),
                                                readExpression(o, "expression"));
        case EXPRESSION:
            return new ExpressionStatement(id, loc, readExpression(o, "expression"));
        case RETURN:
            return new ReturnStatement(id, loc, readOptionalExpression(o, "expression"));
        case CONDITION:
            return new ConditionStatement(id,
                                          loc,
                                          readExpression(o, "condition"),
                                          readStatements(o, "trueStatements"),
                                          readOptionalStatements(o, "falseStatements"));
        case WHILE:
            return new WhileStatement(id, loc, readExpression(o, "condition"), readStatements(o, "statements"));
        case UNTIL:
            return new UntilStatement(id, loc, readExpression(o, "condition"), readStatements(o, "statements"));
        case REPEAT:
            return new RepeatStatement(id, loc, readExpression(o, "iterations"), readStatements(o, "statements"));
        case FOREACH:
            return new ForEachStatement(id,
                                        loc,
                                        requireString(o, "keyName"),
                                        requireString(o, "valueName"),
                                        readExpression(o, "map"),
                                        readStatements(o, "statements"));
        case TRY:
            List<Statement> catchStatements = readOptionalStatements(o, "catchStatements");
            String catchName = catchStatements == null ? null : o.optString("catchName", null);
            return new TryStatement(id, loc, readStatements(o, "statements"), catchName, catchStatements);
        default:
            throw new AstFormatException("Unhandled statement kind " + kind);
        }
    }

    private Expression readExpression(JSONObject parent, String key) {
        JSONObject o = parent.optJSONObject(key);
        if (o == null) {
            throw new AstFormatException("Missing expression \"" + key + "\"");
        }
        return readExpression(o);
    }

    private Expression readOptionalExpression(JSONObject parent, String key) {
        if (!parent.has(key) || parent.isNull(key)) {
            return null;
        }
        return readExpression(parent, key);
    }

    private List<Expression> readExpressions(JSONObject o, String key) {
        JSONArray a = o.optJSONArray(key);
        List<Expression> exprs = new ArrayList<>();
        if (a == null) {
            return exprs;
        }
        for (int i = 0; i < a.length(); i++) {
            exprs.add(readExpression(objectAt(a, i, key)));
        }
        return exprs;
    }

    /**
     * Read one expression, dispatching on its kind tag
     */
    private Expression readExpression(JSONObject o) {
        String kindName = requireString(o, "kind");
        ExpressionKind kind = ExpressionKind.fromJsonName(kindName);
        if (kind == null) {
            throw new AstFormatException("Unknown expression kind \"" + kindName + "\"");
        }
        int id = readId(o);
        SrcLoc loc = readLoc(o);
        switch (kind) {
        case ID:
            return new IdExpr(id, loc, requireString(o, "text"));
        case NUMBER:
            return new NumberExpr(id, loc, readBigInteger(o));
        case BOOLEAN:
            if (!(o.opt("value") instanceof Boolean)) {
                throw new AstFormatException("Key \"value\" of boolean must be true or false");
            }
            return new BooleanExpr(id, loc, o.getBoolean("value"));
        case STRING:
            return new StringExpr(id, loc, requireString(o, "value"));
        case NULL:
            return new NullExpr(id, loc);
        case OP_BINARY:
            return new BinaryExpr(id,
                                  loc,
                                  requireString(o, "op"),
                                  readExpression(o, "left"),
                                  readExpression(o, "right"));
        case OP_UNARY:
            return new UnaryExpr(id, loc, requireString(o, "op"), readExpression(o, "operand"));
        case FIELD_ACCESS:
            return new FieldAccessExpr(id, loc, readExpression(o, "aggregate"), requireString(o, "field"));
        case STATIC_CALL:
            return new StaticCallExpr(id, loc, requireString(o, "function"), readExpressions(o, "args"));
        case METHOD_CALL:
            return new MethodCallExpr(id,
                                      loc,
                                      readExpression(o, "self"),
                                      requireString(o, "method"),
                                      readExpressions(o, "args"));
        case CONDITIONAL:
            return new ConditionalExpr(id,
                                       loc,
                                       readExpression(o, "condition"),
                                       readExpression(o, "thenBranch"),
                                       readExpression(o, "elseBranch"));
        case STRUCT_INSTANCE:
            LinkedHashMap<String, Expression> fields = new LinkedHashMap<>();
            JSONArray fs = o.optJSONArray("fields");
            if (fs != null) {
                for (int i = 0; i < fs.length(); i++) {
                    JSONObject f = objectAt(fs, i, "fields");
                    fields.put(requireString(f, "name"), readExpression(f, "initializer"));
                }
            }
            return new StructInstanceExpr(id, loc, requireString(o, "type"), fields);
        case INIT_OF:
            return new InitOfExpr(id, loc, requireString(o, "contract"), readExpressions(o, "args"));
        default:
            throw new AstFormatException("Unhandled expression kind " + kind);
        }
    }

    private static BigInteger readBigInteger(JSONObject o) {
        Object raw = o.opt("value");
        if (raw == null) {
            throw new AstFormatException("Missing key \"value\" in number");
        }
        try {
            return new BigInteger(raw.toString());
        }
        catch (NumberFormatException e) {
            throw new AstFormatException("Key \"value\" of number is not an integer: " + raw, e);
        }
    }

    private static String requireString(JSONObject o, String key) {
        Object raw = o.opt(key);
        if (!(raw instanceof String)) {
            throw new AstFormatException("Missing string key \"" + key + "\"");
        }
        return (String) raw;
    }

    private static List<String> readStrings(JSONObject o, String key) {
        List<String> strings = new ArrayList<>();
        JSONArray a = o.optJSONArray(key);
        if (a == null) {
            return strings;
        }
        for (int i = 0; i < a.length(); i++) {
            Object raw = a.opt(i);
            if (!(raw instanceof String)) {
                throw new AstFormatException("Entries of \"" + key + "\" must be strings, found " + raw);
            }
            strings.add((String) raw);
        }
        return strings;
    }

    private static JSONObject objectAt(JSONArray a, int i, String key) {
        JSONObject o = a.optJSONObject(i);
        if (o == null) {
            throw new AstFormatException("Entry " + i + " of \"" + key + "\" is not an object");
        }
        return o;
    }
}
