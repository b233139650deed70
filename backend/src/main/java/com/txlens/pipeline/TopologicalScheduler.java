package com.txlens.pipeline;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Kahn's algorithm over a {@link DependencyGraph}. Ties are broken FIFO: initially eligible tools in
 * registration order, then in the order they became eligible.
 */
public final class TopologicalScheduler {

    private TopologicalScheduler() {}

    /**
     * @return every node exactly once, each after all of its dependencies
     * @throws PipelineConstructionException CYCLE when some tools can never become eligible
     */
    public static List<String> schedule(DependencyGraph graph) {
        Map<String, Integer> inDegree = graph.inDegreeSnapshot();
        Deque<String> queue = new ArrayDeque<>();
        for (String name : graph.nodes()) {
            if (inDegree.get(name) == 0) {
                queue.addLast(name);
            }
        }

        List<String> order = new ArrayList<>(graph.size());
        while (!queue.isEmpty()) {
            String current = queue.pollFirst();
            order.add(current);
            for (String dependent : graph.dependentsOf(current)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    queue.addLast(dependent);
                }
            }
        }

        if (order.size() != graph.size()) {
            Set<String> unresolved = new LinkedHashSet<>();
            for (String name : graph.nodes()) {
                if (inDegree.get(name) > 0) {
                    unresolved.add(name);
                }
            }
            throw PipelineConstructionException.cycle(List.copyOf(unresolved), findCycle(graph, unresolved));
        }
        return List.copyOf(order);
    }

    /**
     * Every unresolved tool has at least one unresolved dependency, so following those edges from any
     * unresolved tool must revisit a tool.
     */
    static List<String> findCycle(DependencyGraph graph, Set<String> unresolved) {
        if (unresolved.isEmpty()) {
            return List.of();
        }
        List<String> path = new ArrayList<>();
        Map<String, Integer> positions = new HashMap<>();
        String current = unresolved.iterator().next();
        while (current != null && !positions.containsKey(current)) {
            positions.put(current, path.size());
            path.add(current);
            current = firstUnresolvedDependency(graph, current, unresolved);
        }
        if (current == null) {
            return List.copyOf(unresolved);
        }
        List<String> cycle = new ArrayList<>(path.subList(positions.get(current), path.size()));
        cycle.add(current);
        return cycle;
    }

    private static String firstUnresolvedDependency(DependencyGraph graph, String name, Set<String> unresolved) {
        for (String dep : graph.dependenciesOf(name)) {
            if (unresolved.contains(dep)) {
                return dep;
            }
        }
        return null;
    }
}
