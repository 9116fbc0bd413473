package net.littleredcomputer.prover.meta;

import javax.annotation.Nonnull;

/**
 * Identity of a unification variable. Numbers are handed out by {@link MetaContext#declare(MVarDecl)}
 * and are never reused within one lineage of snapshots.
 */
public final class MVarId implements Comparable<MVarId> {
    private final int id;

    private MVarId(int id) {
        if (id < 0) throw new IllegalArgumentException("negative metavariable id: " + id);
        this.id = id;
    }

    public static MVarId of(int id) { return new MVarId(id); }

    public int id() { return id; }

    @Override public int compareTo(@Nonnull MVarId o) { return Integer.compare(id, o.id); }
    @Override public boolean equals(Object o) { return o instanceof MVarId && ((MVarId) o).id == id; }
    @Override public int hashCode() { return Integer.hashCode(id); }
    @Override public String toString() { return "?" + id; }
}
