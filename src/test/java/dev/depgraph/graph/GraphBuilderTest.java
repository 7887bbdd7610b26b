package dev.depgraph.graph;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.depgraph.model.DependencyInfo;
import dev.depgraph.model.Edge;
import dev.depgraph.model.GraphNode;
import dev.depgraph.model.NodeKind;
import dev.depgraph.model.SubTarget;

import static org.assertj.core.api.Assertions.assertThat;

public class GraphBuilderTest {

    private static final Path ROOT = Path.of("/work/checkout");

    private static DependencyInfo app() {
        return DependencyInfo.of(ROOT.resolve("apps/App"), "App",
                List.of("Core", "swift-log", "swift-collections"),
                Set.of("core", "swift-log"));
    }

    private static DependencyInfo core() {
        return DependencyInfo.of(ROOT.resolve("packages/Core"), "Core",
                List.of("swift-log"),
                Set.of("Core", "swift-log"));
    }

    private static Graph build(BuildOptions options, List<DependencyInfo> records) {
        return new GraphBuilder(ROOT, options).build(records);
    }

    @Test
    @Tag("unit")
    void mergesContainerLocalAndExternalModules() {
        final Graph graph = build(BuildOptions.defaults(), List.of(app(), core()));

        assertThat(graph.nodes().keySet()).containsExactly(
                "container:app@apps/App",
                "module:core",
                "module:swift-collections",
                "module:swift-log");
        assertThat(graph.node("container:app@apps/App").orElseThrow().kind()).isEqualTo(NodeKind.CONTAINER);
        assertThat(graph.node("module:core").orElseThrow().kind()).isEqualTo(NodeKind.INTERNAL_MODULE);
        assertThat(graph.node("module:core").orElseThrow().name()).isEqualTo("Core");
        assertThat(graph.node("module:swift-log").orElseThrow().kind()).isEqualTo(NodeKind.EXTERNAL_MODULE);
        assertThat(graph.node("module:swift-log").orElseThrow().isTransient()).isFalse();
        assertThat(graph.node("module:swift-collections").orElseThrow().isTransient()).isTrue();

        assertThat(graph.edgeKeys()).containsExactly(
                "container:app@apps/App->module:core",
                "container:app@apps/App->module:swift-collections",
                "container:app@apps/App->module:swift-log",
                "module:core->module:swift-log");
    }

    @Test
    @Tag("unit")
    void mergeIsIndependentOfRecordOrderAndRepetition() {
        final DependencyInfo other = DependencyInfo.of(ROOT.resolve("apps/Tool"), "Tool",
                List.of("swift-collections", "swift-argument-parser"), Set.of("swift-collections"));
        final List<DependencyInfo> records = List.of(app(), core(), other);
        final Graph reference = build(BuildOptions.defaults(), records);

        final Random random = new Random(42);
        for (int i = 0; i < 10; i++) {
            final List<DependencyInfo> shuffled = new ArrayList<>(records);
            shuffled.addAll(records);
            Collections.shuffle(shuffled, random);

            final Graph graph = build(BuildOptions.defaults(), shuffled);
            assertThat(graph.nodes()).isEqualTo(reference.nodes());
            assertThat(graph.edges()).isEqualTo(reference.edges());
        }
    }

    @Test
    @Tag("unit")
    void kindUpgradeDoesNotDependOnObservationOrder() {
        final GraphBuilder first = new GraphBuilder(ROOT, BuildOptions.defaults());
        first.addNode("module:core", "Core", NodeKind.EXTERNAL_MODULE, false);
        first.addNode("module:core", "Core", NodeKind.INTERNAL_MODULE, false);

        final GraphBuilder second = new GraphBuilder(ROOT, BuildOptions.defaults());
        second.addNode("module:core", "Core", NodeKind.INTERNAL_MODULE, false);
        second.addNode("module:core", "Core", NodeKind.EXTERNAL_MODULE, false);

        assertThat(first.snapshot().node("module:core").orElseThrow().kind()).isEqualTo(NodeKind.INTERNAL_MODULE);
        assertThat(second.snapshot().nodes()).isEqualTo(first.snapshot().nodes());
    }

    @Test
    @Tag("unit")
    void referenceToLocalPackageIsInternalWhicheverRecordComesFirst() {
        final Graph appFirst = build(BuildOptions.defaults(), List.of(app(), core()));
        final Graph coreFirst = build(BuildOptions.defaults(), List.of(core(), app()));

        assertThat(appFirst.node("module:core").orElseThrow().kind()).isEqualTo(NodeKind.INTERNAL_MODULE);
        assertThat(coreFirst.nodes()).isEqualTo(appFirst.nodes());
    }

    @Test
    @Tag("unit")
    void containerAndModuleWithSameNameStayDistinct() {
        final DependencyInfo containerCore = DependencyInfo.of(ROOT.resolve("apps/Core"), "Core",
                List.of("Core", "swift-log"), Set.of("swift-log"));

        final Graph graph = build(BuildOptions.defaults(), List.of(containerCore, core()));

        assertThat(graph.nodes()).containsKeys("container:core@apps/Core", "module:core");
        assertThat(graph.node("container:core@apps/Core").orElseThrow().kind()).isEqualTo(NodeKind.CONTAINER);
        assertThat(graph.node("module:core").orElseThrow().kind()).isEqualTo(NodeKind.INTERNAL_MODULE);
        // a container never depends on the module it shares a name with
        assertThat(graph.edgeKeys()).doesNotContain("container:core@apps/Core->module:core");
    }

    @Test
    @Tag("unit")
    void nodeDeclaredExplicitlyAnywhereIsNotTransient() {
        final DependencyInfo pullsIn = DependencyInfo.of(ROOT.resolve("a"), "A", List.of("lib"), Set.of());
        final DependencyInfo declares = DependencyInfo.of(ROOT.resolve("b"), "B", List.of(), Set.of("Lib"));

        for (List<DependencyInfo> order : List.of(List.of(pullsIn, declares), List.of(declares, pullsIn))) {
            final Graph graph = build(BuildOptions.defaults(), order);
            assertThat(graph.node("module:lib").orElseThrow().isTransient()).isFalse();
        }
        assertThat(build(BuildOptions.defaults(), List.of(pullsIn)).node("module:lib").orElseThrow().isTransient())
                .isTrue();
    }

    @Test
    @Tag("unit")
    void transientFlagOnlyEverClears() {
        final GraphBuilder builder = new GraphBuilder(ROOT, BuildOptions.defaults());
        builder.addNode("module:lib", "lib", NodeKind.EXTERNAL_MODULE, true);
        builder.addNode("module:lib", "lib", NodeKind.EXTERNAL_MODULE, false);
        builder.addNode("module:lib", "lib", NodeKind.EXTERNAL_MODULE, true);

        assertThat(builder.snapshot().node("module:lib").orElseThrow().isTransient()).isFalse();
    }

    @Test
    @Tag("unit")
    void selfAndDuplicateEdgesAreIgnored() {
        final GraphBuilder builder = new GraphBuilder(ROOT, BuildOptions.defaults());

        assertThat(builder.addEdge("module:a", "module:a")).isFalse();
        assertThat(builder.addEdge("module:a", "module:b")).isTrue();
        assertThat(builder.addEdge("module:a", "module:b")).isFalse();
        assertThat(builder.snapshot().edges()).containsExactly(new Edge("module:a", "module:b"));
    }

    @Test
    @Tag("unit")
    void subTargetsTakeOverThePackagesTheyImport() {
        final DependencyInfo app = new DependencyInfo(ROOT.resolve("apps/App"), "App",
                List.of("swift-log", "Core"),
                Set.of("swift-log", "core"),
                List.of(new SubTarget("AppKit", List.of("swift-log"), List.of("AppModels")),
                        new SubTarget("AppModels", List.of(), List.of())));

        final Graph graph = build(BuildOptions.defaults().withSubTargets(true), List.of(app, core()));

        final String owner = "container:app@apps/App";
        final String appKit = "target:app@apps/App/appkit";
        final String models = "target:app@apps/App/appmodels";
        assertThat(graph.node(appKit).orElseThrow().kind()).isEqualTo(NodeKind.SUB_TARGET);
        assertThat(graph.edgeKeys()).contains(
                owner + "->" + appKit,
                owner + "->" + models,
                appKit + "->" + models,
                appKit + "->module:swift-log",
                owner + "->module:core");
        assertThat(graph.edgeKeys()).doesNotContain(owner + "->module:swift-log");
    }

    @Test
    @Tag("unit")
    void subTargetsAreLeftOutByDefault() {
        final DependencyInfo app = new DependencyInfo(ROOT.resolve("apps/App"), "App",
                List.of("swift-log"), Set.of("swift-log"),
                List.of(new SubTarget("AppKit", List.of("swift-log"), List.of())));

        final Graph graph = build(BuildOptions.defaults(), List.of(app));

        assertThat(graph.nodes().values()).noneMatch(n -> n.kind() == NodeKind.SUB_TARGET);
        assertThat(graph.edgeKeys()).containsExactly("container:app@apps/App->module:swift-log");
    }

    @Test
    @Tag("unit")
    void hideTransientDropsTransientNodesAndTheirEdges() {
        final Graph graph = build(BuildOptions.defaults().withHideTransient(true), List.of(app(), core()));

        assertThat(graph.nodes()).doesNotContainKey("module:swift-collections");
        assertThat(graph.edgeKeys()).noneMatch(k -> k.contains("swift-collections"));
        assertThat(graph.nodes().values()).noneMatch(GraphNode::isTransient);
    }

    @Test
    @Tag("unit")
    void layersFollowDistanceFromRoots() {
        final Graph graph = build(BuildOptions.defaults(), List.of(app(), core()));

        assertThat(graph.node("container:app@apps/App").orElseThrow().layer()).isZero();
        assertThat(graph.node("module:core").orElseThrow().layer()).isEqualTo(1);
        assertThat(graph.node("module:swift-log").orElseThrow().layer()).isEqualTo(1);
    }

    @Test
    @Tag("integration")
    void stableIdsDoNotDependOnCheckoutLocation(@TempDir Path tmp) {
        final Path first = tmp.resolve("first");
        final Path second = tmp.resolve("elsewhere/second");

        final Graph a = new GraphBuilder(first, BuildOptions.defaults()).build(checkout(first));
        final Graph b = new GraphBuilder(second, BuildOptions.defaults()).build(checkout(second));

        assertThat(a.nodes().keySet()).isEqualTo(b.nodes().keySet());
        assertThat(a.edgeKeys()).isEqualTo(b.edgeKeys());
        assertThat(a.schemaVersion()).isEqualTo("depgraph/v2");
    }

    @Test
    @Tag("integration")
    void legacyIdsEmbedTheAbsolutePath(@TempDir Path tmp) {
        final Path first = tmp.resolve("first");
        final Path second = tmp.resolve("second");
        final BuildOptions legacy = BuildOptions.defaults().withStableIds(false);

        final Graph a = new GraphBuilder(first, legacy).build(checkout(first));
        final Graph b = new GraphBuilder(second, legacy).build(checkout(second));

        assertThat(a.nodes().keySet()).isNotEqualTo(b.nodes().keySet());
        assertThat(a.nodes().keySet()).anyMatch(id -> id.contains(first.toString().replace('\\', '/')));
        assertThat(a.schemaVersion()).isEqualTo("depgraph/v1");
    }

    private static List<DependencyInfo> checkout(Path root) {
        return List.of(
                DependencyInfo.of(root.resolve("apps/App"), "App", List.of("Core", "swift-log"), Set.of("core")),
                DependencyInfo.of(root.resolve("packages/Core"), "Core", List.of("swift-log"), Set.of("Core", "swift-log")));
    }
}
