package util.print;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;

import analysis.cfg.Cfg;
import analysis.cfg.CompilationUnit;
import ast.AstFactory;
import ast.ContractDef;
import ast.FunctionDef;
import ast.statements.Statement;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Test;

public class TestPrinters {

    private final AstFactory f = new AstFactory();

    @Test
    public void statements() {
        assertEquals("let x = (a + 1)", PrettyPrinter.statementString(f.let("x", f.bin("+", f.id("a"), f.num(1)))));
        assertEquals("self.owner = sender()",
                     PrettyPrinter.statementString(f.assign(f.selfField("owner"), f.call("sender"))));
        assertEquals("self.m.set(k, 2)",
                     PrettyPrinter.expressionString(f.method(f.selfField("m"), "set", f.id("k"), f.num(2))));
        assertEquals("while ((i < 3))",
                     PrettyPrinter.statementString(f.whileLoop(f.bin("<", f.id("i"), f.num(3)),
                                                               f.expr(f.call("tick")))));
        assertEquals("return", PrettyPrinter.statementString(f.ret(null)));
        assertEquals("try", PrettyPrinter.statementString(f.tryCatch(AstFactory.stmts(), null, null)));
        assertEquals("foreach (k, v of m)", PrettyPrinter.statementString(f.forEach("k", "v", f.id("m"))));
    }

    @Test
    public void functions() {
        assertEquals("fun main()", PrettyPrinter.functionString(f.function("main")));
        assertEquals("receive(msg)", PrettyPrinter.functionString(f.receiver()));
        assertEquals("get fun total()", PrettyPrinter.functionString(f.getter("total")));
    }

    @Test
    public void cfgDot() throws Exception {
        Statement loop = f.whileLoop(f.id("c"), f.expr(f.call("say", f.num(1))));
        Statement cond = f.ifThen(f.id("d"), AstFactory.stmts(f.ret(f.num(0))));
        CompilationUnit cu = AstFactory.build(AstFactory.store(f.function("main", loop, cond)));
        Cfg cfg = cu.findFunctionCfgByName("main");

        StringWriter out = new StringWriter();
        new CFGWriter(cfg, cu.getAst()).writeVerbose(out, "", "\\l");
        String dot = out.toString();
        assertTrue(dot.startsWith("digraph G {"));
        assertTrue(dot.contains("label=\"main\""));
        assertTrue(dot.contains("ENTRY"));
        assertTrue(dot.contains("LOOP_HEADER"));
        assertTrue(dot.contains("say(1)"));
        assertTrue(dot.contains("[label=\"LOOP\"]"));
        assertTrue(dot.contains("[label=\"BRANCH\"]"));

        StringWriter terse = new StringWriter();
        new CFGWriter(cfg, cu.getAst()).write(terse, "", "\\l");
        assertFalse(terse.toString().contains("say(1)"));
    }

    @Test
    public void escaping() {
        assertEquals("say \\\"hi\\\"\\l", CFGWriter.escapeDot("say \"hi\"\n"));
    }

    @Test
    public void callGraphDot() throws Exception {
        FunctionDef pay = f.function("pay", f.expr(f.call("send", f.id("p"))));
        FunctionDef main = f.function("main", f.expr(f.call("pay")));
        CompilationUnit cu = AstFactory.build(AstFactory.store(pay, main));

        StringWriter out = new StringWriter();
        new CallGraphWriter(cu.getCallGraph()).write(out);
        String dot = out.toString();
        assertTrue(dot.startsWith("digraph CallGraph {"));
        assertTrue(dot.contains("main\\nSEND"));
        // send has no definition
        assertTrue(dot.contains("label=\"send\", style=dashed"));
        int mainNode = cu.getCallGraph().getNodeIdByName("main");
        int payNode = cu.getCallGraph().getNodeIdByName("pay");
        assertTrue(dot.contains("n" + mainNode + " -> n" + payNode + ";"));
    }

    @Test
    public void json() {
        FunctionDef lib = f.stdlibFunction("now");
        FunctionDef main = f.function("main", f.let("t", f.call("now")), f.ret(f.id("t")));
        FunctionDef getter = f.getter("owner", f.ret(f.selfField("owner")));
        ContractDef c = f.contract("C", Collections.singletonList("owner"), getter);
        CompilationUnit cu = AstFactory.build(AstFactory.store(Arrays.asList(lib, main),
                                                               Collections.singletonList(c)));

        JSONObject json = new IRJsonWriter(cu, false).toJSON();
        assertEquals("test", json.getString("project"));
        JSONArray functions = json.getJSONArray("functions");
        assertEquals(1, functions.length());
        JSONObject mainJson = functions.getJSONObject(0);
        assertEquals("main", mainJson.getString("name"));
        assertEquals("FUNCTION", mainJson.getString("kind"));
        assertEquals("fun main()", mainJson.getString("signature"));
        JSONArray blocks = mainJson.getJSONArray("blocks");
        assertEquals(2, blocks.length());
        assertEquals("CALL", blocks.getJSONObject(0).getString("kind"));
        assertEquals("let t = now()", blocks.getJSONObject(0).getJSONArray("stmts").getJSONObject(0).getString("code"));
        assertEquals(cu.findFunctionCfgByName("now").getIdx(), blocks.getJSONObject(0).getJSONArray("callees").getInt(0));
        assertEquals(1, mainJson.getJSONArray("edges").length());

        JSONObject contract = json.getJSONArray("contracts").getJSONObject(0);
        assertEquals("C", contract.getString("name"));
        assertEquals("METHOD", contract.getJSONArray("methods").getJSONObject(0).getString("kind"));

        JSONArray nodes = json.getJSONObject("callGraph").getJSONArray("nodes");
        boolean found = false;
        for (int i = 0; i < nodes.length(); i++) {
            JSONObject n = nodes.getJSONObject(i);
            if (n.getString("name").equals("C::owner")) {
                found = true;
                assertEquals("owner", n.getJSONArray("fieldsRead").getString(0));
                assertEquals("STATE_READ", n.getJSONArray("effects").getString(0));
            }
        }
        assertTrue(found);

        assertEquals(2, new IRJsonWriter(cu, true).toJSON().getJSONArray("functions").length());
    }
}
