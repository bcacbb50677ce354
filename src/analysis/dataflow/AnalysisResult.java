package analysis.dataflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * States computed by a solver for the blocks of one control-flow graph
 *
 * @param <S>
 *            type of the data-flow states
 */
public class AnalysisResult<S> {

    /**
     * Input and output of a basic block
     *
     * @param <S>
     *            type of the data-flow states
     */
    public static class AnalysisRecord<S> {

        /**
         * Join of the data-flow predecessors' outputs
         */
        private final S input;
        /**
         * State after the last statement of the block
         */
        private final S output;

        public AnalysisRecord(S input, S output) {
            this.input = input;
            this.output = output;
        }

        public S getInput() {
            return input;
        }

        public S getOutput() {
            return output;
        }

        @Override
        public String toString() {
            return "IN: " + input + " OUT: " + output;
        }
    }

    /**
     * Record for each block index, in construction order
     */
    private final Map<Integer, AnalysisRecord<S>> records;
    private final Map<Integer, S> states;
    /**
     * Number of times the solver analyzed a block
     */
    private final int numberOfVisits;

    public AnalysisResult(Map<Integer, AnalysisRecord<S>> records, int numberOfVisits) {
        this.records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
        Map<Integer, S> outs = new LinkedHashMap<>();
        for (Map.Entry<Integer, AnalysisRecord<S>> e : records.entrySet()) {
            outs.put(e.getKey(), e.getValue().getOutput());
        }
        this.states = Collections.unmodifiableMap(outs);
        this.numberOfVisits = numberOfVisits;
    }

    /**
     * @param bbIdx
     *            block index
     * @return state after the block, null if the block is not part of the analyzed graph
     */
    public S getState(int bbIdx) {
        return states.get(bbIdx);
    }

    /**
     * @param bbIdx
     *            block index
     * @return state before the block, null if the block is not part of the analyzed graph
     */
    public S getInState(int bbIdx) {
        AnalysisRecord<S> r = records.get(bbIdx);
        return r == null ? null : r.getInput();
    }

    public AnalysisRecord<S> getRecord(int bbIdx) {
        return records.get(bbIdx);
    }

    /**
     * @return unmodifiable map from block index to the state after it, in construction order
     */
    public Map<Integer, S> getStates() {
        return states;
    }

    public int getNumberOfVisits() {
        return numberOfVisits;
    }

    @Override
    public String toString() {
        return records.toString();
    }
}
