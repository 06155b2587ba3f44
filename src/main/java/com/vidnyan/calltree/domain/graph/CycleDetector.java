package com.vidnyan.calltree.domain.graph;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds recursion in a {@link CallGraph}.
 * <p>
 * Reports every elementary cycle. Roots are taken in name order; from each root
 * a depth-first search runs with fresh state over the strongly connected
 * component that holds the root, restricted to nodes that sort after it. An edge
 * back to the root closes a cycle. A node is blocked while it is on the path and
 * stays blocked as long as it cannot reach the root, so dead ends are not walked
 * twice. Each distinct cycle is reported once, in canonical form.
 * <p>
 * Both traversals keep explicit stacks, so call-chain length never reaches the
 * JVM stack. Read-only, so it needs no locking.
 */
@Slf4j
public final class CycleDetector {

    private CycleDetector() {
    }

    public static List<Cycle> detect(CallGraph graph) {
        int n = graph.size();
        int[][] successors = new int[n][];
        for (CallGraph.Node node : graph.nodes()) {
            successors[node.id()] = node.outgoing().stream()
                    .mapToInt(CallGraph.Edge::to)
                    .distinct()
                    .sorted()
                    .toArray();
        }

        Set<Cycle> cycles = new LinkedHashSet<>();
        // ids are assigned in name order, so numeric order is name order
        int start = 0;
        while (start < n) {
            int[] component = leastRecursiveComponent(successors, start);
            if (component == null) {
                break;
            }
            boolean[] member = new boolean[n];
            for (int id : component) {
                member[id] = true;
            }
            int root = component[0];
            circuits(graph, successors, root, member, cycles);
            start = root + 1;
        }

        log.debug("Cycle detection found {} cycle(s) in {} nodes", cycles.size(), n);
        return List.copyOf(cycles);
    }

    /**
     * Every cycle through {@code root} inside {@code member}, found from a fresh
     * path and fresh blocking state.
     */
    private static void circuits(CallGraph graph, int[][] successors, int root, boolean[] member, Set<Cycle> cycles) {
        boolean[] blocked = new boolean[member.length];
        Map<Integer, Set<Integer>> waiting = new HashMap<>();
        List<Integer> path = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();

        stack.push(new Frame(root));
        path.add(root);
        blocked[root] = true;

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            int[] next = successors[frame.node];
            if (frame.index < next.length) {
                int target = next[frame.index++];
                if (!member[target]) {
                    continue;
                }
                if (target == root) {
                    List<String> members = new ArrayList<>(path.size());
                    for (int id : path) {
                        members.add(graph.node(id).name());
                    }
                    cycles.add(Cycle.of(members));
                    frame.found = true;
                } else if (!blocked[target]) {
                    stack.push(new Frame(target));
                    path.add(target);
                    blocked[target] = true;
                }
                continue;
            }

            stack.pop();
            path.remove(path.size() - 1);
            if (frame.found) {
                unblock(frame.node, blocked, waiting);
                if (!stack.isEmpty()) {
                    stack.peek().found = true;
                }
            } else {
                for (int target : next) {
                    if (member[target]) {
                        waiting.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(frame.node);
                    }
                }
            }
        }
    }

    private static void unblock(int node, boolean[] blocked, Map<Integer, Set<Integer>> waiting) {
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(node);
        while (!pending.isEmpty()) {
            int current = pending.pop();
            blocked[current] = false;
            Set<Integer> dependants = waiting.remove(current);
            if (dependants == null) {
                continue;
            }
            for (int dependant : dependants) {
                if (blocked[dependant]) {
                    pending.push(dependant);
                }
            }
        }
    }

    /**
     * Tarjan's strongly connected components over the nodes numbered
     * {@code start} and above. Returns the members, ascending, of the component
     * with the smallest id among those that can recurse (more than one member,
     * or a self-call), or null when there is none.
     */
    private static int[] leastRecursiveComponent(int[][] successors, int start) {
        int n = successors.length;
        int[] index = new int[n];
        int[] low = new int[n];
        Arrays.fill(index, -1);
        boolean[] onStack = new boolean[n];
        Deque<Integer> components = new ArrayDeque<>();
        Deque<int[]> work = new ArrayDeque<>();
        int counter = 0;
        int[] best = null;

        for (int origin = start; origin < n; origin++) {
            if (index[origin] != -1) {
                continue;
            }
            index[origin] = low[origin] = counter++;
            components.push(origin);
            onStack[origin] = true;
            work.push(new int[]{origin, 0});

            while (!work.isEmpty()) {
                int[] frame = work.peek();
                int current = frame[0];
                if (frame[1] < successors[current].length) {
                    int target = successors[current][frame[1]++];
                    if (target < start) {
                        continue;
                    }
                    if (index[target] == -1) {
                        index[target] = low[target] = counter++;
                        components.push(target);
                        onStack[target] = true;
                        work.push(new int[]{target, 0});
                    } else if (onStack[target]) {
                        low[current] = Math.min(low[current], index[target]);
                    }
                    continue;
                }

                work.pop();
                if (!work.isEmpty()) {
                    int parent = work.peek()[0];
                    low[parent] = Math.min(low[parent], low[current]);
                }
                if (low[current] != index[current]) {
                    continue;
                }
                List<Integer> popped = new ArrayList<>();
                int id;
                do {
                    id = components.pop();
                    onStack[id] = false;
                    popped.add(id);
                } while (id != current);

                boolean recursive = popped.size() > 1
                        || Arrays.binarySearch(successors[current], current) >= 0;
                if (!recursive) {
                    continue;
                }
                int[] component = popped.stream().mapToInt(Integer::intValue).sorted().toArray();
                if (best == null || component[0] < best[0]) {
                    best = component;
                }
            }
        }
        return best;
    }

    private static final class Frame {
        private final int node;
        private int index;
        private boolean found;

        private Frame(int node) {
            this.node = node;
        }
    }
}
