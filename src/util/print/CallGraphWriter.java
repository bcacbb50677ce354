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

/**
 * Write out a call graph in graphviz dot format. Functions that are called but not defined in the program are drawn
 * dashed.
 */
public class CallGraphWriter {

    private final CallGraph cg;

    public CallGraphWriter(CallGraph cg) {
        this.cg = cg;
    }

    /**
     * Write out the call graph to the given writer
     *
     * @param writer
     *            writer to write to
     * @throws IOException
     *             writer issues
     */
    public void write(Writer writer) throws IOException {
        writer.write("digraph CallGraph {\n" + "node [shape=box];\n" + "graph [fontsize=10]" + ";\n"
                + "node [fontsize=10]" + ";\n" + "edge [fontsize=10]" + ";\n");
        for (CGNode n : cg.getNodes().values()) {
            String style = n.isDefined() ? "" : ", style=dashed";
            writer.write("\tn" + n.getIdx() + " [label=\"" + CFGWriter.escapeDot(nodeLabel(n)) + "\"" + style
                    + "];\n");
        }
        for (CGEdge e : cg.getEdges().values()) {
            writer.write("\tn" + e.getSrc() + " -> n" + e.getDst() + ";\n");
        }
        writer.write("}\n");
    }

    private static String nodeLabel(CGNode n) {
        StringBuilder sb = new StringBuilder(n.getName());
        for (Effect e : n.getEffects()) {
            sb.append("\\n" + e);
        }
        return sb.toString();
    }

    /**
     * Write the call graph to "callgraph.dot" in the given directory
     *
     * @param cg
     *            call graph to write
     * @param dir
     *            output directory
     * @param logger
     *            reports where the file was written
     * @return whether the file was written
     */
    public static boolean writeToFile(CallGraph cg, String dir, Logger logger) {
        String fullFilename = dir + File.separator + "callgraph.dot";
        try (Writer out = new BufferedWriter(new FileWriter(fullFilename))) {
            new CallGraphWriter(cg).write(out);
            logger.info("DOT written to: " + fullFilename);
            return true;
        }
        catch (IOException e) {
            logger.error("Could not write DOT to file, " + fullFilename + ", " + e.getMessage());
            return false;
        }
    }
}
