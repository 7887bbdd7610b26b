package dev.depgraph.model;

/**
 * Kind of a graph node.
 * <p>
 * Merging two observations of the same node goes through {@link #merge(NodeKind)}, which is
 * an explicit 4x4 table. Every entry is the higher of the two kinds in the order
 * EXTERNAL_MODULE &lt; SUB_TARGET &lt; CONTAINER &lt; INTERNAL_MODULE, so the merge is
 * commutative and associative and the final kind never depends on observation order.
 */
public enum NodeKind {
    CONTAINER,
    SUB_TARGET,
    INTERNAL_MODULE,
    EXTERNAL_MODULE;

    // rows: existing kind, columns: observed kind (declaration order)
    private static final NodeKind[][] MERGE = {
            /* CONTAINER       */ {CONTAINER, CONTAINER, INTERNAL_MODULE, CONTAINER},
            /* SUB_TARGET      */ {CONTAINER, SUB_TARGET, INTERNAL_MODULE, SUB_TARGET},
            /* INTERNAL_MODULE */ {INTERNAL_MODULE, INTERNAL_MODULE, INTERNAL_MODULE, INTERNAL_MODULE},
            /* EXTERNAL_MODULE */ {CONTAINER, SUB_TARGET, INTERNAL_MODULE, EXTERNAL_MODULE},
    };

    public NodeKind merge(NodeKind observed) {
        if (observed == null) {
            return this;
        }
        return MERGE[ordinal()][observed.ordinal()];
    }

    public boolean isModule() {
        return this == INTERNAL_MODULE || this == EXTERNAL_MODULE;
    }

    public String label() {
        return switch (this) {
            case CONTAINER -> "container";
            case SUB_TARGET -> "target";
            case INTERNAL_MODULE -> "internal";
            case EXTERNAL_MODULE -> "external";
        };
    }
}
