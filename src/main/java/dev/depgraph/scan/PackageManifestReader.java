package dev.depgraph.scan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.depgraph.model.Ids;
import dev.depgraph.model.SubTarget;

/**
 * Extracts declared dependencies from a package manifest ({@code Package.swift}) by pattern
 * matching. The manifest is never evaluated, so computed names are not seen.
 */
public final class PackageManifestReader {

    public static final String FILE_NAME = "Package.swift";

    private static final Logger LOG = LoggerFactory.getLogger(PackageManifestReader.class);

    // '//' comments, but not the one in 'https://'
    private static final Pattern LINE_COMMENT = Pattern.compile("(?m)(?<![:\"/])//.*$");

    private static final Pattern PACKAGE_NAME = Pattern.compile("Package\\s*\\(\\s*name\\s*:\\s*\"([^\"]+)\"");

    private static final Pattern PACKAGE_URL = Pattern.compile(
            "\\.package\\s*\\(\\s*(?:name\\s*:\\s*\"[^\"]*\"\\s*,\\s*)?url\\s*:\\s*\"([^\"]+)\"");

    private static final Pattern PACKAGE_PATH = Pattern.compile(
            "\\.package\\s*\\(\\s*(?:name\\s*:\\s*\"[^\"]*\"\\s*,\\s*)?path\\s*:\\s*\"([^\"]+)\"");

    private static final Pattern TARGET = Pattern.compile(
            "\\.(?:target|executableTarget|testTarget|macro|plugin)\\s*\\(\\s*name\\s*:\\s*\"([^\"]+)\"");

    private static final Pattern TARGET_DEPENDENCIES = Pattern.compile("dependencies\\s*:\\s*\\[");

    private static final Pattern PRODUCT_DEP = Pattern.compile(
            "\\.product\\s*\\(\\s*name\\s*:\\s*\"([^\"]+)\"\\s*,\\s*package\\s*:\\s*\"([^\"]+)\"");

    private static final Pattern NAMED_DEP = Pattern.compile(
            "\\.(?:target|byName)\\s*\\(\\s*name\\s*:\\s*\"([^\"]+)\"");

    private static final Pattern BARE_DEP = Pattern.compile("\"([^\"]+)\"");

    /**
     * Parsed manifest.
     *
     * @param name              package name, empty if not found
     * @param remotePackages    identities of URL dependencies
     * @param localPackages     identities of path dependencies
     * @param targets           declared targets with their package and sibling references
     */
    public record Manifest(
            String name,
            List<String> remotePackages,
            List<String> localPackages,
            List<SubTarget> targets
    ) {
        public List<String> allPackages() {
            final List<String> all = new ArrayList<>(remotePackages);
            all.addAll(localPackages);
            return all;
        }
    }

    public Optional<Manifest> read(Path file) {
        Objects.requireNonNull(file, "file");
        try {
            return Optional.of(parse(Files.readString(file, StandardCharsets.UTF_8)));
        } catch (IOException ex) {
            LOG.warn("Skipping unreadable manifest {}: {}", file, ex.getMessage());
            return Optional.empty();
        }
    }

    public Manifest parse(String content) {
        final String text = LINE_COMMENT.matcher(content).replaceAll("");

        final Matcher nameMatcher = PACKAGE_NAME.matcher(text);
        final String name = nameMatcher.find() ? nameMatcher.group(1) : "";

        final Set<String> remote = new LinkedHashSet<>();
        final Matcher url = PACKAGE_URL.matcher(text);
        while (url.find()) {
            remote.add(Ids.identityFromLocation(url.group(1)));
        }
        final Set<String> local = new LinkedHashSet<>();
        final Matcher path = PACKAGE_PATH.matcher(text);
        while (path.find()) {
            local.add(Ids.identityFromLocation(path.group(1)));
        }

        final List<RawTarget> raw = new ArrayList<>();
        final Matcher target = TARGET.matcher(text);
        int consumedUntil = -1;
        while (target.find()) {
            // .target(name:) inside another target's dependency list is a reference, not a declaration
            if (target.start() < consumedUntil) {
                continue;
            }
            final int open = text.lastIndexOf('(', target.start(1));
            final int close = matching(text, open, '(', ')');
            final int end = close < 0 ? text.length() : close;
            raw.add(new RawTarget(target.group(1), dependencyBlock(text.substring(target.end(), end))));
            consumedUntil = end;
        }

        final Set<String> targetNames = new LinkedHashSet<>();
        for (RawTarget t : raw) {
            targetNames.add(t.name());
        }
        final List<SubTarget> targets = new ArrayList<>();
        for (RawTarget t : raw) {
            targets.add(classify(t, targetNames));
        }
        return new Manifest(name, List.copyOf(remote), List.copyOf(local), targets);
    }

    private static SubTarget classify(RawTarget target, Set<String> targetNames) {
        final Set<String> packages = new LinkedHashSet<>();
        final Set<String> siblings = new LinkedHashSet<>();
        String deps = target.dependencies();

        final Matcher product = PRODUCT_DEP.matcher(deps);
        while (product.find()) {
            packages.add(Ids.normalizeName(product.group(2)));
        }
        deps = product.replaceAll("");

        final Matcher named = NAMED_DEP.matcher(deps);
        while (named.find()) {
            addReference(named.group(1), targetNames, packages, siblings);
        }
        deps = named.replaceAll("");

        final Matcher bare = BARE_DEP.matcher(deps);
        while (bare.find()) {
            addReference(bare.group(1), targetNames, packages, siblings);
        }
        return new SubTarget(target.name(), List.copyOf(packages), List.copyOf(siblings));
    }

    // a plain name is a sibling target when one is declared, otherwise a product named after its package
    private static void addReference(String ref, Set<String> targetNames,
                                     Set<String> packages, Set<String> siblings) {
        if (targetNames.contains(ref)) {
            siblings.add(ref);
        } else if (!ref.isBlank()) {
            packages.add(Ids.normalizeName(ref));
        }
    }

    private static String dependencyBlock(String targetBody) {
        final Matcher m = TARGET_DEPENDENCIES.matcher(targetBody);
        if (!m.find()) {
            return "";
        }
        final int open = m.end() - 1;
        final int close = matching(targetBody, open, '[', ']');
        return targetBody.substring(open + 1, close < 0 ? targetBody.length() : close);
    }

    private static int matching(String text, int open, char openChar, char closeChar) {
        if (open < 0) {
            return -1;
        }
        int depth = 0;
        boolean inString = false;
        for (int i = open; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == '"') {
                inString = !inString;
            } else if (!inString && c == openChar) {
                depth++;
            } else if (!inString && c == closeChar) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private record RawTarget(String name, String dependencies) {
    }
}
