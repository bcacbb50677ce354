package analysis.callgraph;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

import ast.SrcLoc;

/**
 * Function, method, receiver or initializer in the call graph. Nodes for callees that are not defined in the analyzed
 * program (e.g. native functions) have no AST identifier.
 */
public final class CGNode {

    private final int idx;
    /**
     * Qualified name, {@code Contract::method} for contract members
     */
    private final String name;
    /**
     * AST identifier of the definition, null if the function is not defined in the program
     */
    private final Integer astId;
    private final SrcLoc loc;
    /**
     * Effects of the statements of this function itself
     */
    private final EnumSet<Effect> directEffects = EnumSet.noneOf(Effect.class);
    private final Set<String> fieldsRead = new LinkedHashSet<>();
    private final Set<String> fieldsWritten = new LinkedHashSet<>();
    /**
     * Graph this node belongs to, used to answer transitive queries
     */
    private final CallGraph graph;

    CGNode(int idx, String name, Integer astId, SrcLoc loc, CallGraph graph) {
        this.idx = idx;
        this.name = name;
        this.astId = astId;
        this.loc = loc == null ? SrcLoc.NONE : loc;
        this.graph = graph;
    }

    public int getIdx() {
        return idx;
    }

    public String getName() {
        return name;
    }

    public Integer getAstId() {
        return astId;
    }

    public SrcLoc getLoc() {
        return loc;
    }

    /**
     * Record an effect; field names are kept for state reads and writes
     */
    void addEffect(Effect effect, Iterable<String> fields) {
        directEffects.add(effect);
        if (fields == null) {
            return;
        }
        for (String f : fields) {
            if (effect == Effect.STATE_READ) {
                fieldsRead.add(f);
            }
            else if (effect == Effect.STATE_WRITE) {
                fieldsWritten.add(f);
            }
            else {
                throw new IllegalArgumentException("Fields can only be recorded for state access, not " + effect);
            }
        }
    }

    /**
     * @return whether this function or anything it calls, directly or transitively, has the effect
     */
    public boolean hasEffect(Effect effect) {
        return graph.getEffectSummary(this).contains(effect);
    }

    /**
     * @return whether this function or anything it calls has at least one of the effects
     */
    public boolean hasAnyEffect(Effect... effects) {
        Set<Effect> summary = graph.getEffectSummary(this);
        for (Effect e : effects) {
            if (summary.contains(e)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return whether the statements of this function itself have the effect
     */
    public boolean hasDirectEffect(Effect effect) {
        return directEffects.contains(effect);
    }

    /**
     * @return unmodifiable set of the effects of this function and everything it calls
     */
    public Set<Effect> getEffects() {
        return graph.getEffectSummary(this);
    }

    EnumSet<Effect> getDirectEffects() {
        return directEffects;
    }

    /**
     * @return contract fields read by the statements of this function
     */
    public Set<String> getFieldsRead() {
        return Collections.unmodifiableSet(fieldsRead);
    }

    /**
     * @return contract fields written by the statements of this function
     */
    public Set<String> getFieldsWritten() {
        return Collections.unmodifiableSet(fieldsWritten);
    }

    public boolean isDefined() {
        return astId != null;
    }

    @Override
    public String toString() {
        return name + "#" + idx;
    }
}
