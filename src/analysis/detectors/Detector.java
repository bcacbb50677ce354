package analysis.detectors;

import java.util.List;

import analysis.cfg.CompilationUnit;
import analysis.dataflow.WorklistSolver;
import ast.SrcLoc;

/**
 * Check that looks for one kind of problem in a compilation unit. Detectors must not modify the compilation unit.
 */
public abstract class Detector {

    /**
     * Budget of block visits for each data-flow analysis run by this detector
     */
    private int maxIterations = WorklistSolver.UNBOUNDED;

    /**
     * @return name of this detector as used on the command line
     */
    public String getId() {
        return getClass().getSimpleName();
    }

    public abstract Severity getSeverity();

    public int getMaxIterations() {
        return maxIterations;
    }

    /**
     * @param maxIterations
     *            maximum number of block visits per data-flow analysis, {@link WorklistSolver#UNBOUNDED} for no limit
     */
    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    /**
     * Run this detector
     *
     * @param cu
     *            compilation unit to check
     * @return problems found, in the order they were found
     */
    public abstract List<Warning> check(CompilationUnit cu);

    /**
     * Create a warning reported by this detector with its default severity
     *
     * @param description
     *            what is wrong
     * @param loc
     *            where
     * @param suggestion
     *            how to fix it, null if there is nothing to suggest
     * @return new warning
     */
    protected final Warning makeWarning(String description, SrcLoc loc, String suggestion) {
        return new Warning(getId(), description, loc, getSeverity(), suggestion);
    }

    @Override
    public String toString() {
        return getId();
    }
}
