package util.print;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;

import util.Logger;
import analysis.callgraph.CGEdge;
import analysis.callgraph.CGNode;
import analysis.callgraph.CallGraph;
import analysis.callgraph.Effect;
import analysis.cfg.BasicBlock;
import analysis.cfg.Cfg;
import analysis.cfg.CfgEdge;
import analysis.cfg.CompilationUnit;
import analysis.cfg.Contract;
import ast.AstStore;
import ast.FunctionDef;
import ast.ItemOrigin;
import ast.statements.Statement;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Serializes the control-flow graphs and the call graph of a compilation unit as JSON
 */
public class IRJsonWriter implements JSONSerializable {

    private final CompilationUnit cu;
    /**
     * Whether to include standard library code
     */
    private final boolean includeStdlib;

    public IRJsonWriter(CompilationUnit cu, boolean includeStdlib) {
        this.cu = cu;
        this.includeStdlib = includeStdlib;
    }

    @Override
    public JSONObject toJSON() {
        JSONObject json = new JSONObject();
        json.put("project", cu.getProjectName());

        JSONArray functions = new JSONArray();
        for (Cfg cfg : cu.getFunctions().values()) {
            if (includeStdlib || cfg.getOrigin() != ItemOrigin.STDLIB) {
                functions.put(toJSON(cfg, cu.getAst()));
            }
        }
        json.put("functions", functions);

        JSONArray contracts = new JSONArray();
        for (Contract c : cu.getContracts().values()) {
            if (!includeStdlib && c.getOrigin() == ItemOrigin.STDLIB) {
                continue;
            }
            JSONObject contract = new JSONObject();
            contract.put("idx", c.getIdx());
            contract.put("name", c.getName());
            contract.put("origin", c.getOrigin().getJsonName());
            JSONArray methods = new JSONArray();
            for (Cfg cfg : c.getMethods().values()) {
                methods.put(toJSON(cfg, cu.getAst()));
            }
            contract.put("methods", methods);
            contracts.put(contract);
        }
        json.put("contracts", contracts);
        json.put("callGraph", toJSON(cu.getCallGraph()));
        return json;
    }

    @Override
    public void writeJSON(Writer out, int indent) throws JSONException {
        toJSON().write(out, indent, 0);
    }

    /**
     * Serialize one control-flow graph
     *
     * @param cfg
     *            graph to serialize
     * @param ast
     *            store holding the statements, used to print them
     * @return {@link JSONObject} containing the serialized form
     */
    public static JSONObject toJSON(Cfg cfg, AstStore ast) {
        JSONObject json = new JSONObject();
        json.put("idx", cfg.getIdx());
        json.put("name", cfg.getName());
        json.put("kind", cfg.getKind().name());
        json.put("origin", cfg.getOrigin().getJsonName());
        json.put("astId", cfg.getAstId());
        FunctionDef f = ast.getFunction(cfg.getAstId());
        if (f != null) {
            json.put("signature", PrettyPrinter.functionString(f));
        }

        JSONArray blocks = new JSONArray();
        for (BasicBlock bb : cfg.getBasicBlocks()) {
            JSONObject block = new JSONObject();
            block.put("idx", bb.getIdx());
            block.put("kind", bb.getKind().name());
            JSONArray stmts = new JSONArray();
            for (int id : bb.getStmtIds()) {
                JSONObject stmt = new JSONObject();
                stmt.put("id", id);
                Statement s = ast.getStatement(id);
                if (s != null) {
                    stmt.put("code", PrettyPrinter.statementString(s));
                }
                stmts.put(stmt);
            }
            block.put("stmts", stmts);
            block.put("callees", new JSONArray(bb.getCallees()));
            blocks.put(block);
        }
        json.put("blocks", blocks);

        JSONArray edges = new JSONArray();
        for (CfgEdge e : cfg.getEdges()) {
            edges.put(edgeJSON(e.getIdx(), e.getSrc(), e.getDst()));
        }
        json.put("edges", edges);
        return json;
    }

    /**
     * Serialize a call graph
     *
     * @param cg
     *            call graph
     * @return {@link JSONObject} containing the serialized form
     */
    public static JSONObject toJSON(CallGraph cg) {
        JSONArray nodes = new JSONArray();
        for (CGNode n : cg.getNodes().values()) {
            JSONObject node = new JSONObject();
            node.put("idx", n.getIdx());
            node.put("name", n.getName());
            node.put("astId", n.getAstId() == null ? JSONObject.NULL : n.getAstId());
            JSONArray effects = new JSONArray();
            for (Effect e : n.getEffects()) {
                effects.put(e.name());
            }
            node.put("effects", effects);
            node.put("fieldsRead", new JSONArray(n.getFieldsRead()));
            node.put("fieldsWritten", new JSONArray(n.getFieldsWritten()));
            nodes.put(node);
        }
        JSONArray edges = new JSONArray();
        for (CGEdge e : cg.getEdges().values()) {
            edges.put(edgeJSON(e.getIdx(), e.getSrc(), e.getDst()));
        }
        JSONObject json = new JSONObject();
        json.put("nodes", nodes);
        json.put("edges", edges);
        return json;
    }

    private static JSONObject edgeJSON(int idx, int src, int dst) {
        JSONObject json = new JSONObject();
        json.put("idx", idx);
        json.put("src", src);
        json.put("dst", dst);
        return json;
    }

    /**
     * Write the JSON form of a compilation unit to "&lt;project&gt;.json" in the given directory
     *
     * @param cu
     *            compilation unit to write
     * @param includeStdlib
     *            whether to include standard library code
     * @param dir
     *            output directory
     * @param logger
     *            reports where the file was written
     * @return whether the file was written
     */
    public static boolean writeToFile(CompilationUnit cu, boolean includeStdlib, String dir, Logger logger) {
        String fullFilename = dir + File.separator + cu.getProjectName() + ".json";
        try (Writer out = new BufferedWriter(new FileWriter(fullFilename))) {
            new IRJsonWriter(cu, includeStdlib).writeJSON(out, 2);
            logger.info("JSON written to: " + fullFilename);
            return true;
        }
        catch (IOException | JSONException e) {
            logger.error("Could not write JSON to file, " + fullFilename + ", " + e.getMessage());
            return false;
        }
    }
}
