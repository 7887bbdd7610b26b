package dev.depgraph.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * "from depends on to".
 */
public record Edge(String from, String to) {

    public static final Comparator<Edge> ORDER = Comparator.comparing(Edge::from).thenComparing(Edge::to);

    public Edge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public String key() {
        return from + "->" + to;
    }
}
