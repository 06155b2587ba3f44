package com.vidnyan.calltree.domain.graph;

import com.vidnyan.calltree.domain.model.CallEdge;
import com.vidnyan.calltree.domain.model.FunctionRecord;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Global call graph over function names.
 * <p>
 * Stored as an arena: every name gets a stable integer id (names in sorted
 * order) and edges refer to ids. Names called but never defined are leaf nodes
 * with no definitions. Several definitions of one name (e.g. static helpers in
 * different files) share a node whose outgoing edges are their union.
 * Immutable and thread-safe once built.
 */
@Slf4j
public final class CallGraph {

    /**
     * A function name and everything known about it.
     */
    public record Node(int id, String name, List<FunctionRecord> definitions, List<Edge> outgoing) {

        public Node {
            definitions = List.copyOf(definitions);
            outgoing = List.copyOf(outgoing);
        }

        public boolean isDefined() {
            return !definitions.isEmpty();
        }
    }

    /**
     * Directed edge between node ids, carrying the merged call metadata.
     */
    public record Edge(int from, int to, CallEdge call) {
    }

    private final List<Node> nodes;
    private final Map<String, Integer> index;
    private final List<List<Edge>> incoming;

    private CallGraph(List<Node> nodes, Map<String, Integer> index) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.index = Collections.unmodifiableMap(index);
        List<List<Edge>> in = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            in.add(new ArrayList<>());
        }
        for (Node node : nodes) {
            for (Edge edge : node.outgoing()) {
                in.get(edge.to()).add(edge);
            }
        }
        this.incoming = in;
    }

    public static CallGraph empty() {
        return new CallGraph(List.of(), Map.of());
    }

    /**
     * Merge function records from all files into one graph. Single writer:
     * call only after every worker has finished.
     */
    public static CallGraph build(Collection<FunctionRecord> records) {
        Map<String, List<FunctionRecord>> byName = new TreeMap<>();
        for (FunctionRecord record : records) {
            byName.computeIfAbsent(record.name(), k -> new ArrayList<>()).add(record);
        }

        Set<String> names = new TreeSet<>(byName.keySet());
        for (FunctionRecord record : records) {
            names.addAll(record.edges().keySet());
        }

        Map<String, Integer> index = new HashMap<>();
        for (String name : names) {
            index.put(name, index.size());
        }

        List<Node> nodes = new ArrayList<>(names.size());
        for (String name : names) {
            int id = index.get(name);
            List<FunctionRecord> definitions = byName.getOrDefault(name, List.of());
            warnOnConflictingDefinitions(name, definitions);

            Map<String, CallEdge> merged = new LinkedHashMap<>();
            for (FunctionRecord definition : definitions) {
                for (CallEdge edge : definition.calls()) {
                    merged.merge(edge.callee(), edge, CallEdge::combine);
                }
            }
            List<Edge> outgoing = new ArrayList<>(merged.size());
            for (CallEdge edge : merged.values()) {
                outgoing.add(new Edge(id, index.get(edge.callee()), edge));
            }
            nodes.add(new Node(id, name, definitions, outgoing));
        }

        CallGraph graph = new CallGraph(nodes, index);
        log.debug("Call graph built: {}", graph.stats());
        return graph;
    }

    private static void warnOnConflictingDefinitions(String name, List<FunctionRecord> definitions) {
        if (definitions.size() < 2) {
            return;
        }
        Set<Path> files = new LinkedHashSet<>();
        boolean external = false;
        for (FunctionRecord definition : definitions) {
            files.add(definition.sourcePath());
            external |= !definition.key().isStatic();
        }
        if (external && files.size() > 1) {
            log.warn("Function {} is defined in {} files, merging its calls: {}", name, files.size(), files);
        } else {
            log.debug("Function {} has {} definitions, merging its calls", name, definitions.size());
        }
    }

    public int size() {
        return nodes.size();
    }

    public List<Node> nodes() {
        return nodes;
    }

    public Node node(int id) {
        return nodes.get(id);
    }

    public Optional<Node> node(String name) {
        Integer id = index.get(name);
        return id == null ? Optional.empty() : Optional.of(nodes.get(id));
    }

    public boolean contains(String name) {
        return index.containsKey(name);
    }

    /**
     * True if the name has at least one definition (not just a leaf callee).
     */
    public boolean isDefined(String name) {
        return node(name).map(Node::isDefined).orElse(false);
    }

    /**
     * Get all outgoing edges of a function.
     */
    public List<Edge> getOutgoing(String name) {
        return node(name).map(Node::outgoing).orElse(List.of());
    }

    /**
     * Get all incoming edges of a function.
     */
    public List<Edge> getIncoming(String name) {
        Integer id = index.get(name);
        return id == null ? List.of() : Collections.unmodifiableList(incoming.get(id));
    }

    public Optional<CallEdge> edge(String caller, String callee) {
        return getOutgoing(caller).stream()
                .map(Edge::call)
                .filter(e -> e.callee().equals(callee))
                .findFirst();
    }

    public List<String> getCallees(String name) {
        return getOutgoing(name).stream().map(e -> nodes.get(e.to()).name()).toList();
    }

    public List<String> getCallers(String name) {
        return getIncoming(name).stream().map(e -> nodes.get(e.from()).name()).toList();
    }

    /**
     * Every function record, grouped by name in node order.
     */
    public List<FunctionRecord> functions() {
        return nodes.stream().flatMap(n -> n.definitions().stream()).toList();
    }

    /**
     * Find all names reachable from a start function.
     */
    public Set<String> findReachable(String start) {
        Objects.requireNonNull(start, "start");
        Set<String> visited = new LinkedHashSet<>();
        Integer startId = index.get(start);
        if (startId == null) {
            return visited;
        }
        boolean[] seen = new boolean[nodes.size()];
        Queue<Integer> queue = new ArrayDeque<>();
        queue.add(startId);
        seen[startId] = true;
        while (!queue.isEmpty()) {
            Node node = nodes.get(queue.poll());
            visited.add(node.name());
            for (Edge edge : node.outgoing()) {
                if (!seen[edge.to()]) {
                    seen[edge.to()] = true;
                    queue.add(edge.to());
                }
            }
        }
        return visited;
    }

    /**
     * Get statistics.
     */
    public Stats stats() {
        int defined = 0;
        int edges = 0;
        int rte = 0;
        int conditional = 0;
        int loop = 0;
        for (Node node : nodes) {
            if (node.isDefined()) {
                defined++;
            }
            for (Edge edge : node.outgoing()) {
                edges++;
                if (edge.call().rte()) {
                    rte++;
                }
                if (edge.call().conditional()) {
                    conditional++;
                }
                if (edge.call().loop()) {
                    loop++;
                }
            }
        }
        return new Stats(nodes.size(), defined, nodes.size() - defined, edges, rte, conditional, loop);
    }

    public record Stats(
        int nodeCount,
        int definedCount,
        int unresolvedCount,
        int edgeCount,
        int rteEdgeCount,
        int conditionalEdgeCount,
        int loopEdgeCount
    ) {}
}
