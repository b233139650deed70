package com.txlens.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Directed graph over registered tools: an edge runs from each dependency to its dependent.
 * Built from scratch on every registration; node order is registration order, which is what makes
 * scheduling reproducible.
 */
public final class DependencyGraph {

    private final List<String> nodes;
    private final Map<String, List<String>> dependencies;
    private final Map<String, List<String>> dependents;
    private final Map<String, Integer> inDegree;

    private DependencyGraph(List<String> nodes, Map<String, List<String>> dependencies,
                            Map<String, List<String>> dependents, Map<String, Integer> inDegree) {
        this.nodes = nodes;
        this.dependencies = dependencies;
        this.dependents = dependents;
        this.inDegree = inDegree;
    }

    /**
     * Builds the graph and checks dependency closure.
     *
     * @param tools registered tools by name, in registration order
     * @throws PipelineConstructionException MISSING_DEPENDENCY naming the dependent and the missing tool
     */
    public static DependencyGraph build(Map<String, ? extends Tool> tools) {
        List<String> nodes = new ArrayList<>(tools.keySet());
        Map<String, List<String>> dependencies = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new LinkedHashMap<>();
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String name : nodes) {
            dependents.put(name, new ArrayList<>());
            inDegree.put(name, 0);
        }
        for (Map.Entry<String, ? extends Tool> entry : tools.entrySet()) {
            String name = entry.getKey();
            List<String> deps = declaredDependencies(entry.getValue());
            for (String dep : deps) {
                if (!tools.containsKey(dep)) {
                    throw PipelineConstructionException.missingDependency(name, dep);
                }
                dependents.get(dep).add(name);
                inDegree.merge(name, 1, Integer::sum);
            }
            dependencies.put(name, deps);
        }
        return new DependencyGraph(List.copyOf(nodes), dependencies, dependents, inDegree);
    }

    /** Duplicates collapse; null lists mean no dependencies. */
    static List<String> declaredDependencies(Tool tool) {
        List<String> declared = tool.getDependencies();
        if (declared == null || declared.isEmpty()) {
            return List.of();
        }
        return List.copyOf(new LinkedHashSet<>(declared));
    }

    public List<String> nodes() {
        return nodes;
    }

    public List<String> dependenciesOf(String name) {
        return dependencies.getOrDefault(name, List.of());
    }

    public List<String> dependentsOf(String name) {
        return Collections.unmodifiableList(dependents.getOrDefault(name, List.of()));
    }

    public int inDegreeOf(String name) {
        return inDegree.getOrDefault(name, 0);
    }

    /** Mutable copy of the in-degree table for the scheduler to consume. */
    public Map<String, Integer> inDegreeSnapshot() {
        return new LinkedHashMap<>(inDegree);
    }

    public int size() {
        return nodes.size();
    }
}
