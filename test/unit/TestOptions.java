package unit;

import java.util.Arrays;

import junit.framework.TestCase;
import main.FlowLintMain;
import main.FlowLintOptions;
import analysis.dataflow.WorklistSolver;

import com.beust.jcommander.ParameterException;

/**
 * Test the setting of options for the main method in {@link FlowLintMain}
 */
public class TestOptions extends TestCase {

    public static void testOutputLevel() {
        String[] args = { "-output", "2" };
        FlowLintOptions o = FlowLintOptions.getOptions(args);
        assertEquals(2, o.getOutputLevel());

        String[] args2 = {};
        FlowLintOptions o2 = FlowLintOptions.getOptions(args2);
        assertEquals(1, o2.getOutputLevel());

        String[] args3 = { "-o", "3" };
        FlowLintOptions o3 = FlowLintOptions.getOptions(args3);
        assertEquals(3, o3.getOutputLevel());
    }

    public static void testNegativeOutputLevel() {
        String[] args = { "-output", "-1" };
        try {
            FlowLintOptions.getOptions(args);
        }
        catch (ParameterException e) {
            // Expected
            return;
        }
        fail("Negative output level should throw ParameterException");
    }

    public static void testInput() {
        String[] args = { "-input", "project.json" };
        assertEquals("project.json", FlowLintOptions.getOptions(args).getInput());

        String[] args2 = { "-i", "other.json" };
        assertEquals("other.json", FlowLintOptions.getOptions(args2).getInput());
    }

    public static void testNoInput() {
        String[] args = {};
        FlowLintOptions o = FlowLintOptions.getOptions(args);
        try {
            o.getInput();
        }
        catch (ParameterException e) {
            // Expected
            return;
        }
        fail("Missing input should throw ParameterException");
    }

    public static void testAnalysisName() {
        String[] args = {};
        assertEquals("detect", FlowLintOptions.getOptions(args).getAnalysisName());

        String[] args2 = { "-n", "callgraph" };
        assertEquals("callgraph", FlowLintOptions.getOptions(args2).getAnalysisName());

        String[] args3 = { "-analysisName", "json" };
        assertEquals("json", FlowLintOptions.getOptions(args3).getAnalysisName());
    }

    public static void testInvalidAnalysisName() {
        String[] args = { "-n", "pointsto" };
        try {
            FlowLintOptions.getOptions(args);
        }
        catch (ParameterException e) {
            assertTrue(e.getMessage().contains("pointsto"));
            return;
        }
        fail("Unknown analysis should throw ParameterException");
    }

    public static void testDetectors() {
        String[] args = {};
        assertTrue(FlowLintOptions.getOptions(args).getDetectors().isEmpty());

        String[] args2 = { "-d", "SendInLoop,TimestampDependence" };
        assertEquals(Arrays.asList("SendInLoop", "TimestampDependence"), FlowLintOptions.getOptions(args2)
                                                                                         .getDetectors());
    }

    public static void testMaxIterations() {
        String[] args = {};
        assertEquals(WorklistSolver.UNBOUNDED, FlowLintOptions.getOptions(args).getMaxIterations());

        String[] args2 = { "-maxIterations", "500" };
        assertEquals(500, FlowLintOptions.getOptions(args2).getMaxIterations());

        String[] args3 = { "-maxIterations", "many" };
        try {
            FlowLintOptions.getOptions(args3);
        }
        catch (ParameterException e) {
            // Expected
            return;
        }
        fail("Non-numeric budget should throw ParameterException");
    }

    public static void testFlags() {
        String[] args = {};
        FlowLintOptions o = FlowLintOptions.getOptions(args);
        assertFalse(o.printJson());
        assertFalse(o.includeStdlib());
        assertFalse(o.shouldPrintUseage());
        assertEquals(".", o.getOutputDir());

        String[] args2 = { "-json", "-includeStdlib", "-h", "-out", "build" };
        FlowLintOptions o2 = FlowLintOptions.getOptions(args2);
        assertTrue(o2.printJson());
        assertTrue(o2.includeStdlib());
        assertTrue(o2.shouldPrintUseage());
        assertEquals("build", o2.getOutputDir());
    }

    public static void testUseage() {
        String useage = FlowLintOptions.getUseage();
        assertTrue(useage.contains("-input"));
        assertTrue(useage.contains("callgraph"));
        assertTrue(useage.contains("StateMutationInGetter"));
    }
}
