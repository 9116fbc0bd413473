package net.littleredcomputer.prover.search;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.meta.Expr;
import net.littleredcomputer.prover.meta.MVarDecl;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.MetaContext;
import net.littleredcomputer.prover.meta.Snapshot;

import java.util.Optional;

/**
 * The outcome of a search that did not end fatally: either a proof of the root goal, or the
 * goals the safe prefix leaves open, with the reason the search stopped.
 */
public final class SearchResult {
    private final MVarId root;
    private final Snapshot finalState;
    private final Expr proof;  // null unless proven
    private final ImmutableList<MVarId> remainingGoals;
    private final SearchException.Reason failureReason;  // null if proven
    private final String message;
    private final Statistics statistics;

    private SearchResult(MVarId root, Snapshot finalState, Expr proof, ImmutableList<MVarId> remainingGoals,
                         SearchException.Reason failureReason, String message, Statistics statistics) {
        this.root = root;
        this.finalState = finalState;
        this.proof = proof;
        this.remainingGoals = remainingGoals;
        this.failureReason = failureReason;
        this.message = message;
        this.statistics = statistics;
    }

    static SearchResult proven(MVarId root, Snapshot finalState, Expr proof, Statistics statistics) {
        return new SearchResult(root, finalState, proof, ImmutableList.of(), null, "proven", statistics);
    }

    static SearchResult partial(MVarId root, Snapshot finalState, ImmutableList<MVarId> remainingGoals,
                                SearchException.Reason reason, String message, Statistics statistics) {
        return new SearchResult(root, finalState, null, remainingGoals, reason, message, statistics);
    }

    public boolean isProven() { return proof != null; }

    /** The fully instantiated proof term of the root goal. */
    public Optional<Expr> proof() { return Optional.ofNullable(proof); }

    /** The root goal's solution as far as the safe prefix determines it; may mention open goals. */
    public Expr partialProof() { return finalState.instantiate(Expr.mvar(root)); }

    public ImmutableList<MVarId> remainingGoals() { return remainingGoals; }

    /** Obligations of the remaining goals, instantiated in the final state. */
    public ImmutableList<MVarDecl> remainingGoalDecls() {
        MetaContext ctx = new MetaContext(finalState);
        ImmutableList.Builder<MVarDecl> b = ImmutableList.builder();
        for (MVarId g : remainingGoals) b.add(ctx.instantiate(ctx.decl(g)));
        return b.build();
    }

    public Snapshot finalState() { return finalState; }
    public Optional<SearchException.Reason> failureReason() { return Optional.ofNullable(failureReason); }
    public String message() { return message; }
    public Statistics statistics() { return statistics; }

    @Override
    public String toString() {
        return isProven() ? "proven: " + proof : "not proven (" + message + "), remaining " + remainingGoals;
    }
}
