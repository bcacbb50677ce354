package main;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import util.IdxGenerator;
import util.Logger;
import util.print.CFGWriter;
import util.print.CallGraphWriter;
import util.print.IRJsonWriter;
import analysis.cfg.Cfg;
import analysis.cfg.CompilationUnit;
import analysis.cfg.IrBuilder;
import analysis.dataflow.FixpointNotReachedException;
import analysis.detectors.Detector;
import analysis.detectors.Detectors;
import analysis.detectors.Warning;
import ast.AstFormatException;
import ast.AstReader;
import ast.AstStore;

import org.json.JSONArray;

import com.beust.jcommander.ParameterException;

/**
 * Run one of the selected analyses, see usage
 */
public class FlowLintMain {

    /**
     * Exit code when the analysis ran and found nothing
     */
    public static final int EXIT_OK = 0;
    /**
     * Exit code when detectors reported warnings
     */
    public static final int EXIT_WARNINGS = 1;
    /**
     * Exit code for bad arguments, unreadable input or a failed analysis
     */
    public static final int EXIT_ERROR = 2;

    /**
     * Run one of the selected analyses
     *
     * @param args
     *            options and parameters see useage (pass in "-h") for details
     */
    public static void main(String[] args) {
        int code = run(args, System.out);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * Run the analysis selected by the arguments
     *
     * @param args
     *            command line arguments
     * @param out
     *            where warnings are printed
     * @return exit code
     */
    public static int run(String[] args, PrintStream out) {
        FlowLintOptions options;
        try {
            options = FlowLintOptions.getOptions(args);
            if (options.shouldPrintUseage()) {
                out.println(FlowLintOptions.getUseage());
                return EXIT_OK;
            }
            options.getInput();
        }
        catch (ParameterException e) {
            System.err.println(e.getMessage());
            System.err.println(FlowLintOptions.getUseage());
            return EXIT_ERROR;
        }

        Logger logger = new Logger(options.getOutputLevel());
        IdxGenerator idxGen = new IdxGenerator();
        CompilationUnit cu;
        try {
            AstStore ast = new AstReader(idxGen, logger).read(Paths.get(options.getInput()));
            cu = new IrBuilder(ast, idxGen, logger).build();
        }
        catch (IOException e) {
            logger.error("Could not read " + options.getInput() + ": " + e.getMessage());
            return EXIT_ERROR;
        }
        catch (AstFormatException e) {
            logger.error("Malformed AST in " + options.getInput() + ": " + e.getMessage());
            return EXIT_ERROR;
        }

        String dir = options.getOutputDir();
        switch (options.getAnalysisName()) {
        case "detect":
            return detect(cu, options, logger, out);
        case "cfg":
            boolean written = true;
            for (Cfg cfg : cu.getAllCfgs(options.includeStdlib())) {
                written &= CFGWriter.writeToFile(cfg, cu.getAst(), dir, logger);
            }
            return written ? EXIT_OK : EXIT_ERROR;
        case "callgraph":
            return CallGraphWriter.writeToFile(cu.getCallGraph(), dir, logger) ? EXIT_OK : EXIT_ERROR;
        case "json":
            return IRJsonWriter.writeToFile(cu, options.includeStdlib(), dir, logger) ? EXIT_OK : EXIT_ERROR;
        default:
            throw new IllegalArgumentException("Unknown analysis " + options.getAnalysisName());
        }
    }

    /**
     * Run the selected detectors and print their warnings
     */
    private static int detect(CompilationUnit cu, FlowLintOptions options, Logger logger, PrintStream out) {
        List<Detector> detectors;
        try {
            detectors = Detectors.create(options.getDetectors());
        }
        catch (IllegalArgumentException e) {
            logger.error(e.getMessage());
            return EXIT_ERROR;
        }

        List<Warning> warnings = new ArrayList<>();
        boolean failed = false;
        for (Detector d : detectors) {
            d.setMaxIterations(options.getMaxIterations());
            logger.info("Running " + d.getId());
            try {
                warnings.addAll(d.check(cu));
            }
            catch (FixpointNotReachedException e) {
                logger.error(d.getId() + " did not terminate: " + e.getMessage());
                failed = true;
            }
        }

        if (options.printJson()) {
            JSONArray json = new JSONArray();
            for (Warning w : warnings) {
                json.put(w.toJSON());
            }
            out.println(json.toString(2));
        }
        else {
            for (Warning w : warnings) {
                out.println(w);
            }
        }
        logger.info(warnings.size() + " warnings from " + detectors.size() + " detectors");

        if (failed) {
            return EXIT_ERROR;
        }
        return warnings.isEmpty() ? EXIT_OK : EXIT_WARNINGS;
    }
}
