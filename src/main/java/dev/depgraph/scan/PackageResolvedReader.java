package dev.depgraph.scan;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads a resolved lockfile ({@code Package.resolved}). Supports the v1 layout
 * ({@code object.pins[].package}) and v2/v3 ({@code pins[].identity}). Yields pin names only;
 * the lockfile carries no edges.
 */
public final class PackageResolvedReader {

    public static final String FILE_NAME = "Package.resolved";

    private static final Logger LOG = LoggerFactory.getLogger(PackageResolvedReader.class);

    private final ObjectMapper mapper = new ObjectMapper();

    public Optional<List<String>> read(Path file) {
        Objects.requireNonNull(file, "file");
        try {
            final ResolvedFile resolved = mapper.readValue(file.toFile(), ResolvedFile.class);
            if (resolved == null) {
                return Optional.empty();
            }
            final List<String> names = new ArrayList<>();
            for (Pin pin : resolved.allPins()) {
                names.add(pin.name());
            }
            return Optional.of(names);
        } catch (IOException ex) {
            LOG.warn("Skipping unreadable lockfile {}: {}", file, ex.getMessage());
            return Optional.empty();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ResolvedFile(Integer version, PinContainer object, List<Pin> pins) {

        List<Pin> allPins() {
            if (pins != null) {
                return pins;
            }
            if (object != null && object.pins() != null) {
                return object.pins();
            }
            return List.of();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PinContainer(List<Pin> pins) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Pin(
            String identity,
            @JsonProperty("package") String packageName,
            String repositoryURL,
            String location
    ) {
        String name() {
            if (identity != null && !identity.isBlank()) {
                return identity;
            }
            if (packageName != null && !packageName.isBlank()) {
                return packageName;
            }
            return "unknown";
        }
    }
}
