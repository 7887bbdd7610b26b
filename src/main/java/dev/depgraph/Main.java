package dev.depgraph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import dev.depgraph.analysis.PinchPointAnalyzer;
import dev.depgraph.analysis.PinchPointInfo;
import dev.depgraph.analysis.PinchPointReport;
import dev.depgraph.config.DepGraphConfig;
import dev.depgraph.diff.GraphDiff;
import dev.depgraph.diff.GraphDiffer;
import dev.depgraph.graph.BuildOptions;
import dev.depgraph.graph.Graph;
import dev.depgraph.graph.GraphBuilder;
import dev.depgraph.graph.GraphStats;
import dev.depgraph.io.DotWriter;
import dev.depgraph.io.GraphWriter;
import dev.depgraph.model.DependencyInfo;
import dev.depgraph.resolve.PackageResolver;
import dev.depgraph.resolve.ProcessPackageResolver;
import dev.depgraph.resolve.ResolutionCache;
import dev.depgraph.resolve.TransitiveAugmenter;
import dev.depgraph.scan.ProjectScanner;

public final class Main {

    private Main() {
    }

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Path root = null;
        Path outDir = null;
        Path diffRoot = null;
        Path configFile = null;
        String format = "json";
        Integer top = null;
        boolean internalOnly = false;
        BuildOptions options = BuildOptions.defaults();

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if (arg.startsWith("--outDir=")) {
                    outDir = Paths.get(value(arg));
                    continue;
                }
                if (arg.startsWith("--format=")) {
                    format = value(arg).trim().toLowerCase(Locale.ROOT);
                    if (!"json".equals(format) && !"dot".equals(format)) {
                        System.err.println("ERROR: unknown format: " + format);
                        printUsage();
                        return 2;
                    }
                    continue;
                }
                if (arg.startsWith("--showTargets=")) {
                    options = options.withSubTargets(Boolean.parseBoolean(value(arg)));
                    continue;
                }
                if (arg.startsWith("--hideTransient=")) {
                    options = options.withHideTransient(Boolean.parseBoolean(value(arg)));
                    continue;
                }
                if (arg.startsWith("--resolve=")) {
                    options = options.withResolveTransitive(Boolean.parseBoolean(value(arg)));
                    continue;
                }
                if (arg.startsWith("--stableIds=")) {
                    options = options.withStableIds(Boolean.parseBoolean(value(arg)));
                    continue;
                }
                if (arg.startsWith("--internalOnly=")) {
                    internalOnly = Boolean.parseBoolean(value(arg));
                    continue;
                }
                if (arg.startsWith("--top=")) {
                    top = Integer.parseInt(value(arg).trim());
                    continue;
                }
                if (arg.startsWith("--diff=")) {
                    diffRoot = Paths.get(value(arg));
                    continue;
                }
                if (arg.startsWith("--config=")) {
                    configFile = Paths.get(value(arg));
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return 2;
                }
                if (root == null) {
                    root = Paths.get(arg);
                    continue;
                }
                System.err.println("ERROR: unexpected argument: " + arg);
                printUsage();
                return 2;
            }

            if (root == null) {
                root = Paths.get(".");
            }
            root = root.toAbsolutePath().normalize();
            if (outDir == null) {
                outDir = root.resolve(".depgraph");
            } else if (!outDir.isAbsolute()) {
                outDir = root.resolve(outDir).normalize();
            }

            final DepGraphConfig config = configFile == null ? DepGraphConfig.load() : DepGraphConfig.load(configFile);
            final ProjectScanner scanner = new ProjectScanner(config.skipDirectories());
            final PackageResolver resolver = new ProcessPackageResolver(config.resolverCommand());

            final List<DependencyInfo> records = scanner.scan(root);
            if (records.isEmpty() && diffRoot == null) {
                System.out.println("No dependency sources found in " + root);
                return 0;
            }
            final Graph graph = buildSnapshot(root, records, options, resolver);
            final String generatedAt = Instant.now().toString();

            if (diffRoot != null) {
                final Path otherRoot = diffRoot.toAbsolutePath().normalize();
                final Graph other = buildSnapshot(otherRoot, scanner.scan(otherRoot), options, resolver);
                final GraphDiff diff = GraphDiffer.diff(graph, other);
                final Path written = new GraphWriter(outDir).writeDiff(diff, graph.schemaVersion(), generatedAt);
                printDiff(diff);
                System.out.println("Diff written to: " + written);
                return 0;
            }

            final PinchPointAnalyzer analyzer = new PinchPointAnalyzer(config.pinchPointPolicy());
            final PinchPointReport report = analyzer.analyze(graph, internalOnly);

            final GraphWriter writer = new GraphWriter(outDir);
            if ("dot".equals(format)) {
                Files.createDirectories(outDir);
                final Path dotFile = outDir.resolve("graph.dot");
                Files.writeString(dotFile, DotWriter.render(graph));
                System.out.println("DOT graph written to: " + dotFile);
            } else {
                writer.writeGraph(graph, generatedAt);
                System.out.println("Graph written to: " + outDir.resolve(GraphWriter.GRAPH_FILE));
            }
            writer.writePinchPoints(report, graph.schemaVersion(), generatedAt);

            final GraphStats stats = GraphStats.of(graph);
            System.out.println("Schema: " + graph.schemaVersion());
            System.out.println("Containers: " + stats.containers()
                    + ", internal: " + stats.internalModules()
                    + ", external: " + stats.externalModules()
                    + ", targets: " + stats.subTargets()
                    + ", edges: " + stats.edges()
                    + ", shared: " + stats.sharedDependencies());
            final int shown = top != null ? top : analyzer.policy().defaultTop();
            printSharedDependencies(GraphStats.consumersOfShared(graph), shown);
            printPinchPoints(report, shown);
            return 0;
        } catch (IllegalArgumentException ex) {
            System.err.println("ERROR: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (Exception ex) {
            System.err.println("ERROR: failed to build graph: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    /**
     * Builds the graph of one scanned tree. Every tree gets its own resolution cache, so two
     * checkouts of the same package are resolved independently.
     */
    static Graph buildSnapshot(Path root, List<DependencyInfo> records, BuildOptions options,
                               PackageResolver resolver) {
        if (records.isEmpty()) {
            return Graph.empty(options);
        }
        final TransitiveAugmenter augmenter = new TransitiveAugmenter(new ResolutionCache(resolver));
        return new GraphBuilder(root, options, augmenter).build(records);
    }

    private static void printSharedDependencies(Map<String, List<String>> shared, int top) {
        if (shared.isEmpty()) {
            return;
        }
        System.out.println("Shared dependencies:");
        shared.entrySet().stream()
                .sorted((a, b) -> Integer.compare(b.getValue().size(), a.getValue().size()))
                .limit(top)
                .forEach(e -> System.out.println("  " + e.getKey() + " <- " + String.join(", ", e.getValue())));
    }

    private static void printPinchPoints(PinchPointReport report, int top) {
        System.out.println("Max depth: " + report.maxDepth());
        final List<PinchPointInfo> ranked = report.topByImpact(top);
        if (ranked.isEmpty()) {
            return;
        }
        System.out.println("Top pinch points:");
        for (PinchPointInfo p : ranked) {
            System.out.printf("  %-8s %-40s impact=%.1f dependents=%d/%d depth=%d%s%n",
                    p.riskTier(), p.name(), p.impactScore(),
                    p.directDependents(), p.transitiveDependents(), p.dependencyDepth(),
                    p.inCycle() ? " cycle=" + p.cycleSize() : "");
        }
    }

    private static void printDiff(GraphDiff diff) {
        if (diff.isEmpty()) {
            System.out.println("No differences.");
            return;
        }
        diff.addedNodes().forEach(id -> System.out.println("+ node " + id));
        diff.removedNodes().forEach(id -> System.out.println("- node " + id));
        diff.addedEdges().forEach(key -> System.out.println("+ edge " + key));
        diff.removedEdges().forEach(key -> System.out.println("- edge " + key));
    }

    private static String value(String arg) {
        return arg.substring(arg.indexOf('=') + 1);
    }

    private static void printUsage() {
        System.out.println("Usage: depgraph [root] [options]");
        System.out.println("Options:");
        System.out.println("  --outDir=<path>          Output directory (default: <root>/.depgraph)");
        System.out.println("  --format=json|dot        Graph output format (default: json)");
        System.out.println("  --showTargets=<bool>     Include sub-targets (default: false)");
        System.out.println("  --hideTransient=<bool>   Drop transient dependencies (default: false)");
        System.out.println("  --resolve=<bool>         Ask the package manager for transitive edges (default: false)");
        System.out.println("  --stableIds=<bool>       Path-independent node ids (default: true)");
        System.out.println("  --internalOnly=<bool>    Rank only locally owned nodes (default: false)");
        System.out.println("  --top=<n>                Pinch points to print (default: from config)");
        System.out.println("  --diff=<otherRoot>       Compare against another tree built with the same options");
        System.out.println("  --config=<file>          HOCON file overriding reference.conf");
        System.out.println("  --help, -h               Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
