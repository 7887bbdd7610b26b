package dev.depgraph.model;

/**
 * How container ids are disambiguated.
 * <p>
 * STABLE uses the path relative to the scan root, so the same tree checked out in two places
 * yields the same ids. LEGACY uses the absolute path and is only comparable on one machine.
 */
public enum IdScheme {
    STABLE("depgraph/v2"),
    LEGACY("depgraph/v1");

    private final String schemaVersion;

    IdScheme(String schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    public String schemaVersion() {
        return schemaVersion;
    }
}
