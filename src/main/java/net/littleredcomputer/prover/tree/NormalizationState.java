package net.littleredcomputer.prover.tree;

import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.Snapshot;

/**
 * Where a goal stands with respect to normalization. Moves once, from {@link Kind#NOT_NORMAL}
 * to one of the other two kinds.
 */
public final class NormalizationState {
    public enum Kind {
        NOT_NORMAL,
        NORMAL,
        PROVEN_BY_NORMALIZATION,
    }

    public static final NormalizationState NOT_NORMAL = new NormalizationState(Kind.NOT_NORMAL, null, null);

    private final Kind kind;
    private final MVarId postGoal;
    private final Snapshot snapshot;

    private NormalizationState(Kind kind, MVarId postGoal, Snapshot snapshot) {
        this.kind = kind;
        this.postGoal = postGoal;
        this.snapshot = snapshot;
    }

    public static NormalizationState normal(MVarId postGoal, Snapshot snapshot) {
        return new NormalizationState(Kind.NORMAL, postGoal, snapshot);
    }

    public static NormalizationState provenByNormalization(Snapshot snapshot) {
        return new NormalizationState(Kind.PROVEN_BY_NORMALIZATION, null, snapshot);
    }

    public Kind kind() { return kind; }
    public boolean isNormalized() { return kind != Kind.NOT_NORMAL; }

    public MVarId postGoal() {
        if (kind != Kind.NORMAL) throw new IllegalStateException("no normalized goal when " + kind);
        return postGoal;
    }

    public Snapshot snapshot() {
        if (kind == Kind.NOT_NORMAL) throw new IllegalStateException("goal has not been normalized");
        return snapshot;
    }

    @Override
    public String toString() {
        switch (kind) {
            case NORMAL: return "normal " + postGoal;
            case PROVEN_BY_NORMALIZATION: return "proven by normalization";
            default: return "not normal";
        }
    }
}
