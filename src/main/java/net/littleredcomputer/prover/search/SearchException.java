package net.littleredcomputer.prover.search;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.tree.SearchTree;

import java.util.Optional;

/**
 * Raised when a search ends without a proof and the caller asked for that to be an error, and
 * for every fatal condition. Carries the final tree and, where it could be computed, the goals
 * left open by the safe prefix.
 */
public class SearchException extends RuntimeException {
    public enum Reason {
        UNPROVABLE(false),
        MAX_GOALS(false),
        MAX_RULE_APPLICATIONS(false),
        MAX_DEPTH(false),
        NO_GOALS(false),
        RULE_CHECK(true),
        NORMALIZATION_LOOP(true),
        RECURSION_DEPTH(true),
        INTERNAL(true);

        private final boolean fatal;

        Reason(boolean fatal) { this.fatal = fatal; }

        public boolean isFatal() { return fatal; }
    }

    private final Reason reason;
    private transient SearchTree tree;
    private ImmutableList<MVarId> safePrefixGoals;

    public SearchException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SearchException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() { return reason; }
    public boolean isFatal() { return reason.isFatal(); }

    public Optional<SearchTree> tree() { return Optional.ofNullable(tree); }

    /** The final tree rendered as text, or empty if the exception was raised outside a search. */
    public String renderedTree() { return tree == null ? "" : tree.render(); }

    public Optional<ImmutableList<MVarId>> safePrefixGoals() { return Optional.ofNullable(safePrefixGoals); }

    SearchException attach(SearchTree t, ImmutableList<MVarId> goals) {
        if (tree == null) tree = t;
        if (safePrefixGoals == null) safePrefixGoals = goals;
        return this;
    }

    @Override
    public String getMessage() { return reason + ": " + super.getMessage(); }
}
