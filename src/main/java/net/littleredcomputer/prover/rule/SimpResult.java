package net.littleredcomputer.prover.rule;

import net.littleredcomputer.prover.meta.MVarId;

/** Outcome of one simplifier pass over a goal. */
public final class SimpResult {
    public enum Kind {
        SOLVED,
        SIMPLIFIED,
        UNCHANGED,
    }

    private static final SimpResult solved = new SimpResult(Kind.SOLVED, null);
    private static final SimpResult unchanged = new SimpResult(Kind.UNCHANGED, null);

    private final Kind kind;
    private final MVarId newGoal;

    private SimpResult(Kind kind, MVarId newGoal) {
        this.kind = kind;
        this.newGoal = newGoal;
    }

    public static SimpResult solved() { return solved; }
    public static SimpResult unchanged() { return unchanged; }
    public static SimpResult simplified(MVarId newGoal) { return new SimpResult(Kind.SIMPLIFIED, newGoal); }

    public Kind kind() { return kind; }

    public MVarId newGoal() {
        if (kind != Kind.SIMPLIFIED) throw new IllegalStateException("no new goal when " + kind);
        return newGoal;
    }

    @Override public String toString() { return kind == Kind.SIMPLIFIED ? "simplified to " + newGoal : kind.toString(); }
}
