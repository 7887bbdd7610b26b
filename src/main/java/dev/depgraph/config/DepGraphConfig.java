package dev.depgraph.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import dev.depgraph.analysis.PinchPointPolicy;

/**
 * Settings under {@code depgraph { ... }}.
 * <p>
 * Precedence, highest first: system properties, the user file passed with {@code --config},
 * {@code reference.conf} on the classpath.
 */
public final class DepGraphConfig {

    private static final String ROOT = "depgraph";

    private final Config config;

    private DepGraphConfig(Config config) {
        this.config = config.getConfig(ROOT);
    }

    public static DepGraphConfig load() {
        return new DepGraphConfig(ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve());
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     */
    public static DepGraphConfig load(Path userFile) {
        Objects.requireNonNull(userFile, "userFile");
        if (!Files.isRegularFile(userFile)) {
            throw new IllegalArgumentException("Configuration file not found: " + userFile.toAbsolutePath());
        }
        return new DepGraphConfig(ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.parseFile(userFile.toFile()))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve());
    }

    static DepGraphConfig fromConfig(Config config) {
        return new DepGraphConfig(config.withFallback(ConfigFactory.defaultReferenceUnresolved()).resolve());
    }

    public PinchPointPolicy pinchPointPolicy() {
        final Config p = config.getConfig("pinch-points");
        return new PinchPointPolicy(
                p.getInt("critical-threshold"),
                p.getInt("high-threshold"),
                p.getInt("medium-threshold"),
                p.getDouble("depth-weight"),
                p.getInt("top"));
    }

    public List<String> resolverCommand() {
        return List.copyOf(config.getStringList("resolver.command"));
    }

    public Set<String> skipDirectories() {
        return new LinkedHashSet<>(config.getStringList("scan.skip-directories"));
    }
}
