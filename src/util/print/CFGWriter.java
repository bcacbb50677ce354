package util.print;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.HashMap;
import java.util.Map;

import util.Logger;
import analysis.cfg.BasicBlock;
import analysis.cfg.BasicBlockKind;
import analysis.cfg.Cfg;
import analysis.cfg.CfgEdge;
import ast.AstStore;

/**
 * Write out a control flow graph for a specific function
 */
public class CFGWriter {

    /**
     * Graph to be written
     */
    private final Cfg cfg;
    /**
     * Statements of the graph
     */
    private final AstStore ast;
    /**
     * If true then code will be included in CFG, otherwise it will just be basic block numbers
     */
    private boolean verbose;
    /**
     * Holds the string representation of the basic blocks
     */
    private final Map<BasicBlock, String> bbStrings = new HashMap<>();
    /**
     * String to prepend to statements
     */
    private String prefix;
    /**
     * String to append to statements
     */
    private String postfix;

    /**
     * Create a writer for the given control flow graph
     *
     * @param cfg
     *            graph to be printed
     * @param ast
     *            store holding the statements of the graph
     */
    public CFGWriter(Cfg cfg, AstStore ast) {
        this.cfg = cfg;
        this.ast = ast;
    }

    /**
     * Write out the graph in graphviz dot format to the given writer
     *
     * @param writer
     *            writer to write the code to
     * @param prefix
     *            prepended to each statement (e.g. "\t" to indent)
     * @param postfix
     *            append this string to each statement (e.g. "\n" to place each statement on a new line)
     * @throws IOException
     *             writer issues
     */
    public final void write(Writer writer, String prefix, String postfix) throws IOException {
        this.prefix = prefix;
        this.postfix = postfix;
        double spread = 1.0;
        writer.write("digraph G {\n" + "node [shape=record];\n" + "nodesep=" + spread + ";\n" + "ranksep=" + spread
                                        + ";\n" + "graph [fontsize=10, label=\"" + escapeDot(cfg.getName()) + "\"]"
                                        + ";\n" + "node [fontsize=10]" + ";\n" + "edge [fontsize=10]" + ";\n");

        writeGraph(writer);

        writer.write("\n};\n");
    }

    /**
     * Write out the graph in graphviz dot format with the code for the basic block written on each node.
     *
     * @param writer
     *            writer to write the code to
     * @param prefix
     *            prepended to each statement (e.g. "\t" to indent)
     * @param postfix
     *            append this string to each statement (e.g. "\n" to place each statement on a new line)
     * @throws IOException
     *             writer issues
     */
    public final void writeVerbose(Writer writer, String prefix, String postfix) throws IOException {
        this.verbose = true;
        write(writer, prefix, postfix);
    }

    /**
     * Write the graph to a dot file in the given directory with the filename equal to the function name prepended
     * with "cfg_"
     *
     * @param cfg
     *            graph to write
     * @param ast
     *            store holding the statements of the graph
     * @param dir
     *            output directory
     * @param logger
     *            reports where the file was written
     * @return whether the file was written
     */
    public static final boolean writeToFile(Cfg cfg, AstStore ast, String dir, Logger logger) {
        CFGWriter writer = new CFGWriter(cfg, ast);
        String fullFilename = dir + File.separator + "cfg_" + cfg.getName().replace("::", "_") + ".dot";
        try (Writer out = new BufferedWriter(new FileWriter(fullFilename))) {
            writer.writeVerbose(out, "", "\\l");
            logger.info("DOT written to: " + fullFilename);
            return true;
        }
        catch (IOException e) {
            logger.error("Could not write DOT to file, " + fullFilename + ", " + e.getMessage());
            return false;
        }
    }

    /**
     * Write all the edges in the CFG to the given writer
     *
     * @param writer
     *            writer to write the graph to
     * @throws IOException
     *             writer issues
     */
    private void writeGraph(Writer writer) throws IOException {
        for (BasicBlock bb : cfg.getBasicBlocks()) {
            // Blocks without edges still show up
            writer.write("\t\"" + getStringForBasicBlock(bb) + "\";\n");
        }
        for (CfgEdge e : cfg.getEdges()) {
            BasicBlock src = cfg.getBasicBlock(e.getSrc());
            BasicBlock dst = cfg.getBasicBlock(e.getDst());
            String edgeLabel = "[label=\"" + getEdgeLabel(src, dst) + "\"]";
            writer.write("\t\"" + getStringForBasicBlock(src) + "\" -> \"" + getStringForBasicBlock(dst) + "\" "
                    + edgeLabel + ";\n");
        }
    }

    /**
     * Get the string representation of the basic block
     *
     * @param bb
     *            basic block to get a string for
     * @return string for <code>bb</code>
     * @throws IOException
     *             writer issues
     */
    private String getStringForBasicBlock(BasicBlock bb) throws IOException {
        String bbString = bbStrings.get(bb);
        if (bbString == null) {
            StringBuilder sb = new StringBuilder();
            sb.append("BB" + bb.getIdx() + "\\l");
            if (bb == cfg.getEntry()) {
                sb.append("ENTRY\\l");
            }
            if (bb.getKind() != BasicBlockKind.REGULAR) {
                sb.append(bb.getKind() + "\\l");
            }

            if (verbose) {
                StringWriter code = new StringWriter();
                PrettyPrinter.writeBasicBlock(ast, bb, code, prefix, postfix);
                sb.append(code);
            }
            bbString = escapeDot(sb.toString());
            bbStrings.put(bb, bbString);
        }
        return bbString;
    }

    /**
     * Properly escape the string so it will be properly formatted in dot
     *
     * @param s
     *            string to escape
     * @return dot-safe string
     */
    static String escapeDot(String s) {
        return s.replace("\"", "\\\"").replace("\n", "\\l");
    }

    /**
     * Label of an edge: "LOOP" for back edges into a loop header, "BRANCH" for edges leaving a branch, empty otherwise
     */
    private static String getEdgeLabel(BasicBlock src, BasicBlock dst) {
        if (dst.getKind() == BasicBlockKind.LOOP_HEADER && dst.getIdx() < src.getIdx()) {
            return "LOOP";
        }
        if (src.getKind() == BasicBlockKind.BRANCH) {
            return "BRANCH";
        }
        return "";
    }
}
