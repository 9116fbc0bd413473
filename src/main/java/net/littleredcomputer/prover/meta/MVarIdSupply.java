package net.littleredcomputer.prover.meta;

/**
 * Hands out metavariable numbers. One supply is shared by a context, every snapshot it takes
 * and every context restored from those snapshots, so sibling branches that start from the same
 * snapshot never number two different metavariables alike. Restoring a snapshot does not rewind it.
 */
final class MVarIdSupply {
    private int next;

    int next() { return next++; }

    /** Make sure {@code id} is never handed out. */
    void reserve(int id) {
        if (id >= next) next = id + 1;
    }
}
