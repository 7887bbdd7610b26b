package dev.depgraph.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import dev.depgraph.analysis.PinchPointInfo;
import dev.depgraph.analysis.PinchPointReport;
import dev.depgraph.diff.GraphDiff;
import dev.depgraph.graph.BuildOptions;
import dev.depgraph.graph.Graph;
import dev.depgraph.graph.GraphStats;
import dev.depgraph.model.Edge;
import dev.depgraph.model.GraphNode;

/**
 * Writes the JSON exchange files. Every document carries {@code schemaVersion} so consumers can
 * tell stable (path-independent) ids from legacy absolute-path ids.
 */
public final class GraphWriter {

    public static final String GRAPH_FILE = "graph.json";
    public static final String PINCH_POINTS_FILE = "pinch-points.json";
    public static final String DIFF_FILE = "diff.json";

    private final Path outDir;
    private final ObjectMapper jsonMapper;

    public GraphWriter(Path outDir) {
        this.outDir = Objects.requireNonNull(outDir, "outDir");
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path writeGraph(Graph graph, String generatedAt) throws IOException {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(generatedAt, "generatedAt");

        final List<NodeEntry> nodes = new ArrayList<>(graph.nodes().size());
        for (GraphNode n : graph.nodes().values()) {
            nodes.add(new NodeEntry(n.id(), n.name(), n.kind().label(), n.isTransient(), n.layer()));
        }
        final List<EdgeEntry> edges = new ArrayList<>(graph.edges().size());
        for (Edge e : graph.edges()) {
            edges.add(new EdgeEntry(e.from(), e.to()));
        }

        final GraphDocument doc = new GraphDocument(
                graph.schemaVersion(),
                generatedAt,
                graph.options(),
                GraphStats.of(graph),
                GraphStats.consumersOfShared(graph),
                nodes,
                edges
        );
        return write(GRAPH_FILE, doc);
    }

    public Path writePinchPoints(PinchPointReport report, String schemaVersion, String generatedAt)
            throws IOException {
        Objects.requireNonNull(report, "report");
        final List<PinchPointInfo> ranked = report.topByImpact(report.points().size());
        return write(PINCH_POINTS_FILE,
                new PinchPointDocument(schemaVersion, generatedAt, report.maxDepth(), ranked));
    }

    public Path writeDiff(GraphDiff diff, String schemaVersion, String generatedAt) throws IOException {
        Objects.requireNonNull(diff, "diff");
        return write(DIFF_FILE, new DiffDocument(schemaVersion, generatedAt,
                diff.addedNodes(), diff.removedNodes(), diff.addedEdges(), diff.removedEdges()));
    }

    public String toJson(Object document) throws IOException {
        return jsonMapper.writeValueAsString(document);
    }

    private Path write(String fileName, Object data) throws IOException {
        Files.createDirectories(outDir);
        final Path file = outDir.resolve(fileName);
        jsonMapper.writeValue(file.toFile(), data);
        return file;
    }

    // --- documents ---

    public record GraphDocument(
            String schemaVersion,
            String generatedAt,
            BuildOptions options,
            GraphStats stats,
            Map<String, List<String>> sharedDependencies,
            List<NodeEntry> nodes,
            List<EdgeEntry> edges
    ) {
    }

    public record NodeEntry(
            String id,
            String name,
            String kind,
            @JsonProperty("transient") boolean isTransient,
            int layer
    ) {
    }

    public record EdgeEntry(
            String from,
            String to
    ) {
    }

    public record PinchPointDocument(
            String schemaVersion,
            String generatedAt,
            int maxDepth,
            List<PinchPointInfo> points
    ) {
    }

    public record DiffDocument(
            String schemaVersion,
            String generatedAt,
            Set<String> addedNodes,
            Set<String> removedNodes,
            Set<String> addedEdges,
            Set<String> removedEdges
    ) {
    }
}
