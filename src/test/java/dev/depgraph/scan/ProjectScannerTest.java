package dev.depgraph.scan;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.depgraph.graph.BuildOptions;
import dev.depgraph.graph.Graph;
import dev.depgraph.graph.GraphBuilder;
import dev.depgraph.model.DependencyInfo;
import dev.depgraph.model.NodeKind;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Scans small package trees laid out under a temporary directory.
 */
public class ProjectScannerTest {

    private static final String CORE_MANIFEST = """
            // swift-tools-version:5.9
            import PackageDescription

            let package = Package(
                name: "Core",
                dependencies: [
                    .package(url: "https://github.com/apple/swift-log.git", from: "1.5.0"),
                ],
                targets: [
                    .target(name: "Core", dependencies: [.product(name: "Logging", package: "swift-log")]),
                ]
            )
            """;

    @TempDir
    Path root;

    private final ProjectScanner scanner = new ProjectScanner();

    private void write(String relative, String content) throws Exception {
        final Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private void sampleTree() throws Exception {
        write("App/Package.swift", PackageManifestReaderTest.APP_MANIFEST);
        write("App/Package.resolved", PackageResolvedReaderTest.V2);
        write("Core/Package.swift", CORE_MANIFEST);
        write("Legacy.xcodeproj/project.xcworkspace/xcshareddata/swiftpm/Package.resolved", PackageResolvedReaderTest.V1);
        write(".build/checkouts/swift-log/Package.swift", "let package = Package(name: \"swift-log\")");
        write("node_modules/pkg/Package.swift", "let package = Package(name: \"Nope\")");
        write(".hidden/Package.swift", "let package = Package(name: \"Hidden\")");
    }

    private static DependencyInfo named(List<DependencyInfo> records, String name) {
        return records.stream().filter(r -> r.name().equals(name)).findFirst().orElseThrow();
    }

    @Test
    @Tag("integration")
    void findsPackagesAndProjectLockfiles() throws Exception {
        sampleTree();

        final List<DependencyInfo> records = scanner.scan(root);

        assertThat(records).extracting(DependencyInfo::name).containsExactly("App", "Core", "Legacy");
    }

    @Test
    @Tag("integration")
    void manifestAndLockfileMergeIntoOneRecord() throws Exception {
        sampleTree();

        final DependencyInfo app = named(scanner.scan(root), "App");

        assertThat(app.path()).isEqualTo(root.resolve("App").toAbsolutePath().normalize());
        assertThat(app.dependencies()).containsExactly("swift-log", "swift-atomics", "fookit", "core");
        assertThat(app.explicitDependencies()).containsExactlyInAnyOrder("swift-log", "fookit", "core", "App");
        assertThat(app.declaresItself()).isTrue();
        assertThat(app.subTargets()).hasSize(3);
    }

    @Test
    @Tag("integration")
    void projectLockfileBelongsToOutermostBundle() throws Exception {
        sampleTree();

        final DependencyInfo legacy = named(scanner.scan(root), "Legacy");

        assertThat(legacy.path().getFileName().toString()).isEqualTo("Legacy.xcodeproj");
        assertThat(legacy.dependencies()).containsExactly("Alamofire");
        assertThat(legacy.explicitDependencies()).containsExactly("Alamofire");
        assertThat(legacy.declaresItself()).isFalse();
    }

    @Test
    @Tag("integration")
    void unreadableLockfileWithoutManifestIsSkipped() throws Exception {
        write("Broken/Package.resolved", "{ not json");
        write("Core/Package.swift", CORE_MANIFEST);

        assertThat(scanner.scan(root)).extracting(DependencyInfo::name).containsExactly("Core");
    }

    @Test
    @Tag("integration")
    void emptyTreeYieldsNoRecords() throws Exception {
        assertThat(scanner.scan(root)).isEmpty();
    }

    @Test
    @Tag("unit")
    void missingRootIsAHardFailure() {
        assertThatThrownBy(() -> scanner.scan(root.resolve("does-not-exist")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does-not-exist");
    }

    @Test
    @Tag("unit")
    void ownerDirectory() {
        assertThat(ProjectScanner.ownerDirectory(Path.of("/r/Legacy.xcodeproj/project.xcworkspace/xcshareddata/swiftpm")))
                .isEqualTo(Path.of("/r/Legacy.xcodeproj"));
        assertThat(ProjectScanner.ownerDirectory(Path.of("/r/App"))).isEqualTo(Path.of("/r/App"));
    }

    @Test
    @Tag("integration")
    void scannedTreeBuildsIntoGraph() throws Exception {
        sampleTree();

        final Graph graph = new GraphBuilder(root, BuildOptions.defaults()).build(scanner.scan(root));

        assertThat(graph.node("module:app").orElseThrow().kind()).isEqualTo(NodeKind.INTERNAL_MODULE);
        assertThat(graph.node("module:core").orElseThrow().kind()).isEqualTo(NodeKind.INTERNAL_MODULE);
        assertThat(graph.node("module:swift-atomics").orElseThrow().isTransient()).isTrue();
        assertThat(graph.edgeKeys()).contains(
                "module:app->module:core",
                "module:core->module:swift-log",
                "container:legacy@Legacy.xcodeproj->module:alamofire");
    }
}
