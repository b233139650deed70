package com.txlens.pipeline;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DependencyGraphTest {

    @Test
    void build_edgesRunFromDependencyToDependent() {
        DependencyGraph graph = DependencyGraph.build(tools(
                StubTool.of("fetch"),
                StubTool.of("decode", "fetch"),
                StubTool.of("price", "decode", "fetch")));

        assertThat(graph.nodes()).containsExactly("fetch", "decode", "price");
        assertThat(graph.dependentsOf("fetch")).containsExactly("decode", "price");
        assertThat(graph.dependenciesOf("price")).containsExactly("decode", "fetch");
        assertThat(graph.inDegreeOf("fetch")).isZero();
        assertThat(graph.inDegreeOf("price")).isEqualTo(2);
    }

    @Test
    void build_duplicateDependencyDeclarations_countedOnce() {
        DependencyGraph graph = DependencyGraph.build(tools(StubTool.of("a"), StubTool.of("b", "a", "a")));

        assertThat(graph.inDegreeOf("b")).isEqualTo(1);
        assertThat(graph.dependentsOf("a")).containsExactly("b");
    }

    @Test
    void build_nullDependencies_treatedAsNone() {
        StubTool noDeps = new StubTool("a", null, new java.util.ArrayList<>(), (c, b) -> { });

        DependencyGraph graph = DependencyGraph.build(tools(noDeps));

        assertThat(graph.dependenciesOf("a")).isEmpty();
    }

    @Test
    void build_missingDependency_namesDependentAndMissingTool() {
        assertThatThrownBy(() -> DependencyGraph.build(tools(StubTool.of("price", "oracle"))))
                .isInstanceOf(PipelineConstructionException.class)
                .hasMessage("Tool price depends on oracle, but oracle is not registered");
    }

    @Test
    void inDegreeSnapshot_isIndependentCopy() {
        DependencyGraph graph = DependencyGraph.build(tools(StubTool.of("a"), StubTool.of("b", "a")));

        graph.inDegreeSnapshot().put("b", 0);

        assertThat(graph.inDegreeOf("b")).isEqualTo(1);
    }

    static Map<String, Tool> tools(Tool... tools) {
        Map<String, Tool> map = new LinkedHashMap<>();
        Arrays.stream(tools).forEach(t -> map.put(t.getName(), t));
        return map;
    }
}
