package analysis.dataflow;

/**
 * Direction in which facts flow through a control-flow graph
 */
public enum AnalysisKind {
    /**
     * From the entry to the exits, a block's input is the join of its predecessors' outputs
     */
    FORWARD,
    /**
     * From the exits to the entry, a block's input is the join of its successors' outputs
     */
    BACKWARD;
}
