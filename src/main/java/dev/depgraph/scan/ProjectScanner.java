package dev.depgraph.scan;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.depgraph.model.DependencyInfo;
import dev.depgraph.model.SubTarget;

/**
 * Finds every package directory under a scan root and turns it into one {@link DependencyInfo}:
 * - a directory with a manifest is a local package (declares itself)
 * - a lockfile next to it supplies the resolved names
 * - a lockfile alone (e.g. inside a {@code .xcodeproj}) is a container whose pins all count
 *   as explicit
 * Hidden directories and the configured heavy directories are not entered.
 */
public final class ProjectScanner {

    public static final Set<String> DEFAULT_SKIP_DIRS =
            Set.of(".git", ".build", ".swiftpm", "build", "node_modules", "DerivedData", "Pods", "Carthage");

    private static final Logger LOG = LoggerFactory.getLogger(ProjectScanner.class);

    private final Set<String> skipDirs;
    private final PackageManifestReader manifestReader = new PackageManifestReader();
    private final PackageResolvedReader lockfileReader = new PackageResolvedReader();

    public ProjectScanner() {
        this(DEFAULT_SKIP_DIRS);
    }

    public ProjectScanner(Set<String> skipDirs) {
        this.skipDirs = Set.copyOf(Objects.requireNonNull(skipDirs, "skipDirs"));
    }

    /**
     * @throws IllegalArgumentException if the root does not exist or is not a directory
     */
    public List<DependencyInfo> scan(Path root) throws IOException {
        Objects.requireNonNull(root, "root");
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Scan root does not exist or is not a directory: " + root);
        }
        final Path start = root.toAbsolutePath().normalize();
        final Map<Path, Sources> byDir = new TreeMap<>();

        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(start)) {
                    return FileVisitResult.CONTINUE;
                }
                final String name = dir.getFileName() != null ? dir.getFileName().toString() : "";
                if (skipDirs.contains(name) || (name.startsWith(".") && !isProjectBundle(name))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                final String name = file.getFileName().toString();
                if (PackageManifestReader.FILE_NAME.equals(name)) {
                    byDir.computeIfAbsent(file.getParent(), k -> new Sources()).manifest = file;
                } else if (PackageResolvedReader.FILE_NAME.equals(name)) {
                    byDir.computeIfAbsent(file.getParent(), k -> new Sources()).lockfile = file;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                LOG.warn("Cannot read {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        final List<DependencyInfo> records = new ArrayList<>();
        for (var e : byDir.entrySet()) {
            assemble(e.getKey(), e.getValue()).ifPresent(records::add);
        }
        LOG.info("Found {} dependency source(s) under {}", records.size(), start);
        return records;
    }

    private Optional<DependencyInfo> assemble(Path dir, Sources sources) {
        final Optional<PackageManifestReader.Manifest> manifest = sources.manifest == null
                ? Optional.empty()
                : manifestReader.read(sources.manifest);
        final Optional<List<String>> pins = sources.lockfile == null
                ? Optional.empty()
                : lockfileReader.read(sources.lockfile);

        if (manifest.isEmpty() && pins.isEmpty()) {
            return Optional.empty();
        }

        final Path owner = ownerDirectory(dir);
        final List<String> dependencies = new ArrayList<>(pins.orElse(List.of()));

        if (manifest.isPresent()) {
            final PackageManifestReader.Manifest m = manifest.get();
            final String name = m.name().isBlank() ? dirName(owner) : m.name();
            for (String pkg : m.allPackages()) {
                if (!dependencies.contains(pkg)) {
                    dependencies.add(pkg);
                }
            }
            final Set<String> explicit = new LinkedHashSet<>(m.allPackages());
            explicit.add(name);
            final List<SubTarget> targets = m.targets();
            return Optional.of(new DependencyInfo(owner, name, dependencies, explicit, targets));
        }

        // lockfile only: no way to tell direct from indirect
        return Optional.of(DependencyInfo.of(owner, dirName(owner), dependencies, new LinkedHashSet<>(dependencies)));
    }

    /**
     * Lockfiles of IDE projects live inside the project bundle; the record belongs to the bundle.
     */
    static Path ownerDirectory(Path dir) {
        Path owner = dir;
        Path current = dir;
        while (current != null) {
            final Path name = current.getFileName();
            if (name != null && isProjectBundle(name.toString())) {
                owner = current;  // keep going: the outermost bundle wins
            }
            current = current.getParent();
        }
        return owner;
    }

    private static String dirName(Path dir) {
        final String name = dir.getFileName() != null ? dir.getFileName().toString() : "root";
        for (String ext : List.of(".xcodeproj", ".xcworkspace")) {
            if (name.endsWith(ext)) {
                return name.substring(0, name.length() - ext.length());
            }
        }
        return name;
    }

    private static boolean isProjectBundle(String name) {
        return name.endsWith(".xcodeproj") || name.endsWith(".xcworkspace");
    }

    private static final class Sources {
        Path manifest;
        Path lockfile;
    }
}
