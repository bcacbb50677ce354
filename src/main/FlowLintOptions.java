package main;

import java.util.ArrayList;
import java.util.List;

import analysis.dataflow.WorklistSolver;
import analysis.detectors.Detectors;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

public final class FlowLintOptions {

    /**
     * JSON AST produced by the frontend
     */
    @Parameter(names = { "-input", "-i" }, description = "JSON file containing the AST of the project to analyze")
    private String input;

    /**
     * Output folder default is the current directory
     */
    @Parameter(names = { "-out" }, description = "Output directory for DOT and JSON files, default is the current directory.")
    private String outputDir = ".";

    /**
     * Flag for printing useage information
     */
    @Parameter(names = { "-h", "-help", "-useage", "--help" }, description = "Print useage information", help = true)
    private boolean help = false;

    /**
     * Level of output
     */
    @Parameter(names = { "-output", "-o" }, validateWith = FlowLintOptions.NonNegativeValidator.class, description = "Level of output (0 quiet, 1 warnings, 2 info, 3 debug)")
    private Integer outputLevel = 1;

    /**
     * Name of the analysis to be run
     */
    @Parameter(names = { "-n", "-analysisName" }, validateWith = FlowLintOptions.AnalysisNameValidator.class, description = "Name of the analysis to run.")
    private String analysisName = "detect";

    /**
     * Detectors to run, all if empty
     */
    @Parameter(names = { "-detectors", "-d" }, description = "Comma separated names of the detectors to run, default is all of them.")
    private List<String> detectors = new ArrayList<>();

    @Parameter(names = { "-includeStdlib" }, description = "If set, standard library code is dumped along with the project")
    private boolean includeStdlib = false;

    /**
     * If set then warnings are printed as a JSON array
     */
    @Parameter(names = { "-json" }, description = "If set, print warnings as JSON")
    private boolean json = false;

    /**
     * Budget of block visits for each data-flow analysis
     */
    @Parameter(names = { "-maxIterations" }, validateWith = FlowLintOptions.NonNegativeValidator.class, description = "Maximum number of basic block visits for each data-flow analysis, default is no limit")
    private Integer maxIterations = null;

    /**
     * Validate the requested analysis name
     */
    public static class AnalysisNameValidator implements IParameterValidator {

        @Override
        public void validate(String name, String value) throws ParameterException {
            switch (value) {
            case "detect":
            case "cfg":
            case "callgraph":
            case "json":
                return;
            default:
                throw new ParameterException("Invalid analysis name: " + value + "\n" + analysisNameUsage());
            }
        }
    }

    /**
     * Validate integer options that cannot be negative
     */
    public static class NonNegativeValidator implements IParameterValidator {

        @Override
        public void validate(String name, String value) throws ParameterException {
            int n;
            try {
                n = Integer.parseInt(value);
            }
            catch (NumberFormatException e) {
                throw new ParameterException("Parameter " + name + " should be an integer (found " + value + ")");
            }
            if (n < 0) {
                throw new ParameterException("Parameter " + name + " should be non-negative (found " + value + ")");
            }
        }
    }

    private FlowLintOptions() {
        // Do not instantiate
    }

    /**
     * Parse the options for the given args
     *
     * @param args
     *            arguments to parse
     * @return Options object with the parsed options available via getters
     * @throws ParameterException
     *             if the arguments are invalid
     */
    public static FlowLintOptions getOptions(String[] args) {
        FlowLintOptions o = new FlowLintOptions();
        JCommander jc = new JCommander();
        jc.addObject(o);
        jc.parse(args);
        return o;
    }

    public String getInput() {
        if (input == null) {
            throw new ParameterException("Must specify an input file with -input.");
        }
        return input;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public boolean shouldPrintUseage() {
        return help;
    }

    public int getOutputLevel() {
        return outputLevel;
    }

    public String getAnalysisName() {
        return analysisName;
    }

    public List<String> getDetectors() {
        return detectors;
    }

    public boolean includeStdlib() {
        return includeStdlib;
    }

    public boolean printJson() {
        return json;
    }

    /**
     * @return maximum number of block visits for each data-flow analysis or {@link WorklistSolver#UNBOUNDED}
     */
    public int getMaxIterations() {
        return maxIterations == null ? WorklistSolver.UNBOUNDED : maxIterations;
    }

    public static String getUseage() {
        StringBuilder sb = new StringBuilder();
        FlowLintOptions o = new FlowLintOptions();
        JCommander jc = new JCommander();
        jc.addObject(o);
        jc.setProgramName("flowlint");
        jc.getUsageFormatter().usage(sb);
        return sb.toString() + "\n" + analysisNameUsage() + "\n" + detectorUsage();
    }

    /**
     * Print the supported analysis names
     *
     * @return String containing the documentation
     */
    static String analysisNameUsage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Supported analyses:\n");
        sb.append("\tdetect - runs the detectors and prints the warnings (default)\n");
        sb.append("\tcfg - prints the cfg for all functions to the output folder prepended with : \"cfg_\"\n");
        sb.append("\tcallgraph - prints the call graph to the output folder as \"callgraph.dot\"\n");
        sb.append("\tjson - prints the cfgs and the call graph to the output folder as \"<project>.json\"\n");
        return sb.toString();
    }

    private static String detectorUsage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Detectors:\n");
        for (String name : Detectors.getNames()) {
            sb.append("\t" + name + "\n");
        }
        return sb.toString();
    }
}
