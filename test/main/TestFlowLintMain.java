package main;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import ast.TestAstReader;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestFlowLintMain {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

    private int run(String... args) throws Exception {
        return FlowLintMain.run(args, new PrintStream(bytes, true, "UTF-8"));
    }

    private String output() {
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    }

    private static String sample() throws Exception {
        return TestAstReader.resource("sample.json").toString();
    }

    @Test
    public void detectPrintsWarnings() throws Exception {
        assertEquals(FlowLintMain.EXIT_WARNINGS, run("-i", sample(), "-o", "0"));
        String out = output();
        assertTrue(out.contains("[LOW] TimestampDependence"));
        assertTrue(out.contains("[MEDIUM] SendInLoop"));
        assertTrue(out.contains("[INFO] StateMutationInGetter"));
        assertTrue(out.contains("Help: "));
    }

    @Test
    public void detectJson() throws Exception {
        assertEquals(FlowLintMain.EXIT_WARNINGS, run("-i", sample(), "-o", "0", "-json", "-d", "SendInLoop"));
        JSONArray warnings = new JSONArray(output());
        assertEquals(2, warnings.length());
        JSONObject first = warnings.getJSONObject(0);
        assertEquals("SendInLoop", first.getString("detector"));
        assertEquals("sample.tact", first.getJSONObject("loc").getString("file"));
    }

    @Test
    public void noWarnings() throws Exception {
        File input = tmp.newFile("clean.json");
        Files.write(input.toPath(), ("{\"project\": \"clean\", \"functions\": [{\"kind\": \"function_def\","
                + " \"name\": \"f\", \"statements\": [{\"kind\": \"statement_return\"}]}]}").getBytes(StandardCharsets.UTF_8));
        assertEquals(FlowLintMain.EXIT_OK, run("-i", input.getPath(), "-o", "0"));
        assertEquals("", output());
    }

    @Test
    public void budgetExhausted() throws Exception {
        assertEquals(FlowLintMain.EXIT_ERROR, run("-i", sample(), "-o", "0", "-maxIterations", "1", "-d",
                                                  "TimestampDependence"));
    }

    @Test
    public void errors() throws Exception {
        assertEquals(FlowLintMain.EXIT_ERROR, run("-o", "0"));
        assertEquals(FlowLintMain.EXIT_ERROR, run("-i", new File(tmp.getRoot(), "missing.json").getPath(), "-o", "0"));
        assertEquals(FlowLintMain.EXIT_ERROR, run("-i", sample(), "-o", "0", "-d", "NoSuchDetector"));

        File broken = tmp.newFile("broken.json");
        Files.write(broken.toPath(), "{\"functions\": [{\"kind\": \"nope\"}]}".getBytes(StandardCharsets.UTF_8));
        assertEquals(FlowLintMain.EXIT_ERROR, run("-i", broken.getPath(), "-o", "0"));

        File twice = tmp.newFile("twice.json");
        Files.write(twice.toPath(), ("{\"functions\": [{\"kind\": \"function_def\", \"name\": \"foo\","
                + " \"statements\": []}, {\"kind\": \"function_def\", \"name\": \"foo\", \"statements\": []}]}")
                .getBytes(StandardCharsets.UTF_8));
        assertEquals(FlowLintMain.EXIT_ERROR, run("-i", twice.getPath(), "-o", "0"));
    }

    @Test
    public void help() throws Exception {
        assertEquals(FlowLintMain.EXIT_OK, run("-h"));
        assertTrue(output().contains("Supported analyses"));
    }

    @Test
    public void cfgFiles() throws Exception {
        File dir = tmp.newFolder("cfg");
        assertEquals(FlowLintMain.EXIT_OK, run("-i", sample(), "-o", "0", "-n", "cfg", "-out", dir.getPath()));
        assertTrue(new File(dir, "cfg_pay.dot").exists());
        assertTrue(new File(dir, "cfg_bid.dot").exists());
        assertTrue(new File(dir, "cfg_init_21.dot").exists());
        assertEquals(5, dir.list().length);

        File withStdlib = tmp.newFolder("cfgStdlib");
        run("-i", sample(), "-o", "0", "-n", "cfg", "-includeStdlib", "-out", withStdlib.getPath());
        assertTrue(new File(withStdlib, "cfg_now.dot").exists());
    }

    @Test
    public void callGraphAndJsonFiles() throws Exception {
        File dir = tmp.newFolder("out");
        assertEquals(FlowLintMain.EXIT_OK, run("-i", sample(), "-o", "0", "-n", "callgraph", "-out", dir.getPath()));
        String dot = new String(Files.readAllBytes(new File(dir, "callgraph.dot").toPath()), StandardCharsets.UTF_8);
        assertTrue(dot.contains("Auction::refundAll"));

        assertEquals(FlowLintMain.EXIT_OK, run("-i", sample(), "-o", "0", "-n", "json", "-out", dir.getPath()));
        String text = new String(Files.readAllBytes(new File(dir, "sample.json").toPath()), StandardCharsets.UTF_8);
        JSONObject json = new JSONObject(text);
        assertEquals("sample", json.getString("project"));
        assertEquals(1, json.getJSONArray("contracts").length());
    }

    @Test
    public void unwritableOutputDirectory() throws Exception {
        String missing = new File(tmp.getRoot(), "no/such/dir").getPath();
        assertEquals(FlowLintMain.EXIT_ERROR, run("-i", sample(), "-o", "0", "-n", "cfg", "-out", missing));
        assertEquals(FlowLintMain.EXIT_ERROR, run("-i", sample(), "-o", "0", "-n", "callgraph", "-out", missing));
        assertEquals(FlowLintMain.EXIT_ERROR, run("-i", sample(), "-o", "0", "-n", "json", "-out", missing));
    }
}
