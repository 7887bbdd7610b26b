package dev.depgraph.resolve;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Runs the package manager's dependency command in the package directory and parses the JSON
 * tree it prints. The call blocks until the process exits; no timeout is applied here.
 */
public final class ProcessPackageResolver implements PackageResolver {

    public static final List<String> DEFAULT_COMMAND =
            List.of("swift", "package", "show-dependencies", "--format", "json");

    private static final Logger LOG = LoggerFactory.getLogger(ProcessPackageResolver.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final List<String> command;

    public ProcessPackageResolver() {
        this(DEFAULT_COMMAND);
    }

    public ProcessPackageResolver(List<String> command) {
        Objects.requireNonNull(command, "command");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        this.command = List.copyOf(command);
    }

    @Override
    public Optional<ResolvedPackage> resolve(Path packageRoot) {
        Objects.requireNonNull(packageRoot, "packageRoot");
        final ProcessBuilder pb = new ProcessBuilder(command)
                .directory(packageRoot.toFile())
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        try {
            final Process process = pb.start();
            final String stdout;
            try (InputStream in = process.getInputStream()) {
                stdout = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            final int exit = process.waitFor();
            if (exit != 0) {
                LOG.warn("Resolution command exited with {} in {}, skipping", exit, packageRoot);
                return Optional.empty();
            }
            return parse(stdout);
        } catch (IOException ex) {
            LOG.warn("Resolution command {} unavailable in {}: {}", command.get(0), packageRoot, ex.getMessage());
            return Optional.empty();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while resolving {}", packageRoot);
            return Optional.empty();
        }
    }

    /**
     * Parses the command output. Progress lines printed before the JSON document are skipped.
     */
    public static Optional<ResolvedPackage> parse(String output) {
        if (output == null) {
            return Optional.empty();
        }
        final int start = output.indexOf('{');
        if (start < 0) {
            LOG.warn("Resolution output contains no JSON object");
            return Optional.empty();
        }
        try {
            final ResolvedPackage root = MAPPER.readValue(output.substring(start), ResolvedPackage.class);
            if (root == null || root.key().isBlank()) {
                LOG.warn("Resolution output has no package identity");
                return Optional.empty();
            }
            return Optional.of(root);
        } catch (JsonProcessingException ex) {
            LOG.warn("Malformed resolution output: {}", ex.getOriginalMessage());
            return Optional.empty();
        }
    }
}
