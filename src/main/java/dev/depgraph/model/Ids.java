package dev.depgraph.model;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Node id derivation. Ids are composed of a kind namespace, the normalized name and, for
 * containers, a path disambiguator:
 * <ul>
 *   <li>{@code container:<name>@<path>}</li>
 *   <li>{@code module:<name>} (internal and external modules share one namespace so that an
 *       external-looking name can be upgraded in place)</li>
 *   <li>{@code target:<owner>/<name>} where owner is the container or module key</li>
 * </ul>
 */
public final class Ids {

    public static final String CONTAINER_PREFIX = "container:";
    public static final String MODULE_PREFIX = "module:";
    public static final String TARGET_PREFIX = "target:";

    private Ids() {
    }

    public static String normalizeName(String name) {
        if (name == null) {
            return "";
        }
        return name.trim().toLowerCase(Locale.ROOT);
    }

    public static String moduleId(String name) {
        Objects.requireNonNull(name, "name");
        return MODULE_PREFIX + normalizeName(name);
    }

    public static String containerId(String name, String pathKey) {
        Objects.requireNonNull(name, "name");
        final String key = normalizeName(name);
        if (pathKey == null || pathKey.isEmpty()) {
            return CONTAINER_PREFIX + key;
        }
        return CONTAINER_PREFIX + key + "@" + pathKey;
    }

    public static String subTargetId(String ownerId, String targetName) {
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(targetName, "targetName");
        return TARGET_PREFIX + stripNamespace(ownerId) + "/" + normalizeName(targetName);
    }

    /**
     * Path disambiguator for a container: relative to the scan root (forward slashes) for
     * STABLE ids, absolute for LEGACY ids. Paths outside the root keep their {@code ..} segments.
     */
    public static String pathKey(Path path, Path scanRoot, IdScheme scheme) {
        if (path == null) {
            return "";
        }
        final Path normalized = path.toAbsolutePath().normalize();
        if (scheme == IdScheme.LEGACY || scanRoot == null) {
            return slashes(normalized.toString());
        }
        final Path root = scanRoot.toAbsolutePath().normalize();
        final String rel = slashes(root.relativize(normalized).toString());
        return rel.isEmpty() ? "." : rel;
    }

    public static String stripNamespace(String id) {
        final int i = id.indexOf(':');
        return i >= 0 ? id.substring(i + 1) : id;
    }

    /**
     * Package identity from a repository URL or a local path, the way package managers
     * derive it: last segment, without a {@code .git} suffix, lower-cased.
     */
    public static String identityFromLocation(String location) {
        if (location == null) {
            return "";
        }
        String s = location.trim();
        while (s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        final int slash = Math.max(s.lastIndexOf('/'), s.lastIndexOf(':'));
        if (slash >= 0) {
            s = s.substring(slash + 1);
        }
        if (s.endsWith(".git")) {
            s = s.substring(0, s.length() - 4);
        }
        return normalizeName(s);
    }

    private static String slashes(String p) {
        return p.replace('\\', '/');
    }
}
