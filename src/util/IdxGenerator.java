package util;

import java.util.HashMap;
import java.util.Map;

/**
 * Generates unique indices for IR entities (basic blocks, edges, CFGs, call graph nodes, AST nodes). Each kind of
 * entity has its own counter. One generator is created per analysis run and handed to the builders.
 */
public class IdxGenerator {

    /**
     * Last index handed out for each kind of entity
     */
    private final Map<String, Integer> counters = new HashMap<>();

    /**
     * Get the next index for the given kind, indices start at 1
     *
     * @param kind
     *            kind of entity, e.g. "cfg_bb"
     * @return fresh index for that kind
     */
    public int next(String kind) {
        Integer current = counters.get(kind);
        int next = current == null ? 1 : current + 1;
        counters.put(kind, next);
        return next;
    }

    /**
     * Forget all previously generated indices
     */
    public void reset() {
        counters.clear();
    }
}
