package net.littleredcomputer.prover.tree;

public enum NodeState {
    UNKNOWN,
    PROVEN,
    UNPROVABLE;

    /** Proven and unprovable nodes never change state again. */
    public boolean isTerminal() { return this != UNKNOWN; }
}
