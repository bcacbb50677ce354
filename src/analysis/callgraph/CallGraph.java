package analysis.callgraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import util.IdxGenerator;
import ast.SrcLoc;

import com.ibm.wala.util.graph.Graph;
import com.ibm.wala.util.graph.impl.InvertedGraph;
import com.ibm.wala.util.graph.impl.SlowSparseNumberedGraph;
import com.ibm.wala.util.graph.traverse.SCCIterator;

/**
 * Whole-program graph of calls between functions, annotated with effect summaries. Cycles (recursion) are allowed.
 * <p>
 * The effects of a node are the effects of its own statements plus those of every node reachable from it. They are
 * computed for all nodes at once, over the strongly connected components of the graph with callees first, and
 * recomputed after the graph changes.
 */
public class CallGraph {

    private static final String NODE_IDX = "cg_node";
    private static final String EDGE_IDX = "cg_edge";

    private final IdxGenerator idxGen;
    private final Map<Integer, CGNode> nodes = new LinkedHashMap<>();
    private final Map<Integer, CGEdge> edges = new LinkedHashMap<>();
    private final Map<String, Integer> nameToNode = new HashMap<>();
    private final Map<Integer, Integer> astIdToNode = new HashMap<>();
    /**
     * Outgoing edges of each node
     */
    private final Map<Integer, List<CGEdge>> outEdges = new HashMap<>();
    /**
     * Incoming edges of each node
     */
    private final Map<Integer, List<CGEdge>> inEdges = new HashMap<>();
    /**
     * Same graph as a WALA graph, used to find strongly connected components
     */
    private final SlowSparseNumberedGraph<CGNode> graph = SlowSparseNumberedGraph.make();
    /**
     * Transitive effects of every node, null if the graph changed since they were computed
     */
    private Map<CGNode, Set<Effect>> summaries;

    public CallGraph(IdxGenerator idxGen) {
        this.idxGen = idxGen;
    }

    /**
     * Add a node for a function defined in the program
     *
     * @param name
     *            qualified name
     * @param astId
     *            AST identifier of the definition, null if the function is not defined in the program
     * @param loc
     *            location of the definition
     * @return the new node
     * @throws IllegalArgumentException
     *             if a node with the same name already exists
     */
    public CGNode addNode(String name, Integer astId, SrcLoc loc) {
        if (nameToNode.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate call graph node " + name);
        }
        CGNode n = new CGNode(idxGen.next(NODE_IDX), name, astId, loc, this);
        nodes.put(n.getIdx(), n);
        nameToNode.put(name, n.getIdx());
        if (astId != null) {
            astIdToNode.put(astId, n.getIdx());
        }
        outEdges.put(n.getIdx(), new ArrayList<CGEdge>());
        inEdges.put(n.getIdx(), new ArrayList<CGEdge>());
        graph.addNode(n);
        summaries = null;
        return n;
    }

    /**
     * Get the node with the given name, adding a node without a definition if there is none
     *
     * @param name
     *            qualified name
     * @return existing or new node
     */
    public CGNode findOrAddNode(String name) {
        Integer id = nameToNode.get(name);
        if (id != null) {
            return nodes.get(id);
        }
        return addNode(name, null, SrcLoc.NONE);
    }

    /**
     * Add a call edge
     *
     * @param src
     *            caller node id
     * @param dst
     *            callee node id
     * @param callSite
     *            location of the call
     * @return the new edge
     * @throws IllegalArgumentException
     *             if either node is not in the graph
     */
    public CGEdge addEdge(int src, int dst, SrcLoc callSite) {
        CGNode srcNode = nodes.get(src);
        CGNode dstNode = nodes.get(dst);
        if (srcNode == null || dstNode == null) {
            throw new IllegalArgumentException("Cannot add call edge from " + src + " to " + dst
                    + ": node(s) not found");
        }
        CGEdge e = new CGEdge(idxGen.next(EDGE_IDX), src, dst, callSite);
        edges.put(e.getIdx(), e);
        outEdges.get(src).add(e);
        inEdges.get(dst).add(e);
        graph.addEdge(srcNode, dstNode);
        summaries = null;
        return e;
    }

    /**
     * Record an effect of the statements of a node
     *
     * @param nodeId
     *            node id
     * @param effect
     *            effect
     * @param fields
     *            contract fields read or written, only for {@link Effect#STATE_READ} and {@link Effect#STATE_WRITE};
     *            may be null
     */
    public void addEffect(int nodeId, Effect effect, Collection<String> fields) {
        CGNode n = nodes.get(nodeId);
        if (n == null) {
            throw new IllegalArgumentException("Unknown call graph node " + nodeId);
        }
        n.addEffect(effect, fields);
        summaries = null;
    }

    public void addEffect(int nodeId, Effect effect) {
        addEffect(nodeId, effect, null);
    }

    /**
     * @return id of the node with the given qualified name, or null if there is none
     */
    public Integer getNodeIdByName(String name) {
        return nameToNode.get(name);
    }

    /**
     * @return id of the node for the function with the given AST identifier, or null if there is none
     */
    public Integer getNodeIdByAstId(int astId) {
        return astIdToNode.get(astId);
    }

    /**
     * @return the node or null if there is none with this id
     */
    public CGNode getNode(int nodeId) {
        return nodes.get(nodeId);
    }

    /**
     * @return unmodifiable map of all nodes by id, in insertion order
     */
    public Map<Integer, CGNode> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    /**
     * @return unmodifiable map of all edges by id, in insertion order
     */
    public Map<Integer, CGEdge> getEdges() {
        return Collections.unmodifiableMap(edges);
    }

    /**
     * @return call edges leaving the node, empty for unknown nodes
     */
    public List<CGEdge> getOutEdges(int nodeId) {
        List<CGEdge> out = outEdges.get(nodeId);
        return out == null ? Collections.<CGEdge> emptyList() : Collections.unmodifiableList(out);
    }

    /**
     * @return call edges entering the node, empty for unknown nodes
     */
    public List<CGEdge> getInEdges(int nodeId) {
        List<CGEdge> in = inEdges.get(nodeId);
        return in == null ? Collections.<CGEdge> emptyList() : Collections.unmodifiableList(in);
    }

    /**
     * Whether a call path leads from one node to another. Every node is connected to itself.
     *
     * @param from
     *            source node id
     * @param to
     *            destination node id
     * @return true if there is a path, false otherwise or if either node is unknown
     */
    public boolean areConnected(int from, int to) {
        if (!nodes.containsKey(from) || !nodes.containsKey(to)) {
            return false;
        }
        LinkedList<Integer> queue = new LinkedList<>();
        Set<Integer> visited = new HashSet<>();
        queue.add(from);
        visited.add(from);
        while (!queue.isEmpty()) {
            int current = queue.removeFirst();
            if (current == to) {
                return true;
            }
            for (CGEdge e : outEdges.get(current)) {
                if (visited.add(e.getDst())) {
                    queue.addLast(e.getDst());
                }
            }
        }
        return false;
    }

    /**
     * @return view of the call graph as a WALA graph; must not be modified
     */
    public Graph<CGNode> getGraph() {
        return graph;
    }

    /**
     * Transitive effects of a node
     */
    Set<Effect> getEffectSummary(CGNode n) {
        if (summaries == null) {
            summaries = computeSummaries();
        }
        Set<Effect> s = summaries.get(n);
        return s == null ? Collections.<Effect> emptySet() : s;
    }

    private Map<CGNode, Set<Effect>> computeSummaries() {
        Map<CGNode, EnumSet<Effect>> working = new HashMap<>();
        for (CGNode n : nodes.values()) {
            working.put(n, EnumSet.copyOf(n.getDirectEffects()));
        }

        // Callees come before their callers in the inverted graph
        List<Set<CGNode>> sccs = new ArrayList<>();
        SCCIterator<CGNode> iter = new SCCIterator<>(new InvertedGraph<>(graph));
        while (iter.hasNext()) {
            sccs.add(iter.next());
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (Set<CGNode> scc : sccs) {
                EnumSet<Effect> effects = EnumSet.noneOf(Effect.class);
                for (CGNode member : scc) {
                    effects.addAll(working.get(member));
                    for (CGEdge e : outEdges.get(member.getIdx())) {
                        effects.addAll(working.get(nodes.get(e.getDst())));
                    }
                }
                for (CGNode member : scc) {
                    if (!working.get(member).equals(effects)) {
                        working.put(member, EnumSet.copyOf(effects));
                        changed = true;
                    }
                }
            }
        }

        Map<CGNode, Set<Effect>> result = new HashMap<>();
        for (Map.Entry<CGNode, EnumSet<Effect>> entry : working.entrySet()) {
            result.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
        }
        return result;
    }
}
