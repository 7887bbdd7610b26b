package dev.depgraph.graph;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import dev.depgraph.model.Edge;
import dev.depgraph.model.GraphNode;
import dev.depgraph.model.NodeKind;

import static org.assertj.core.api.Assertions.assertThat;

public class LayerAssignerTest {

    private static Graph graph(String[] ids, String[][] edges) {
        final Map<String, GraphNode> nodes = new HashMap<>();
        for (String id : ids) {
            nodes.put(id, GraphNode.of(id, id, NodeKind.EXTERNAL_MODULE, false));
        }
        final Set<Edge> edgeSet = new HashSet<>();
        for (String[] e : edges) {
            edgeSet.add(new Edge(e[0], e[1]));
        }
        return new Graph(nodes, edgeSet, BuildOptions.defaults());
    }

    private static int layer(Graph graph, String id) {
        return graph.node(id).orElseThrow().layer();
    }

    @Test
    @Tag("unit")
    void chainGetsIncreasingLayers() {
        final Graph g = LayerAssigner.assign(graph(
                new String[]{"a", "b", "c"},
                new String[][]{{"a", "b"}, {"b", "c"}}));

        assertThat(layer(g, "a")).isZero();
        assertThat(layer(g, "b")).isEqualTo(1);
        assertThat(layer(g, "c")).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void shortestDistanceWins() {
        final Graph g = LayerAssigner.assign(graph(
                new String[]{"a", "b", "c"},
                new String[][]{{"a", "b"}, {"b", "c"}, {"a", "c"}}));

        assertThat(layer(g, "c")).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void cycleWithoutRootIsSeededAtZero() {
        final Graph g = LayerAssigner.assign(graph(
                new String[]{"x", "y", "z"},
                new String[][]{{"x", "y"}, {"y", "x"}, {"y", "z"}}));

        assertThat(layer(g, "x")).isZero();
        assertThat(layer(g, "y")).isEqualTo(1);
        assertThat(layer(g, "z")).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void danglingEdgesAreIgnored() {
        final Graph g = LayerAssigner.assign(graph(
                new String[]{"a"},
                new String[][]{{"ghost", "a"}}));

        assertThat(layer(g, "a")).isZero();
        assertThat(g.edges()).hasSize(1);
    }
}
