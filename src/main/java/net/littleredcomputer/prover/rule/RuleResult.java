package net.littleredcomputer.prover.rule;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/** What a rule reports: a failure with a diagnostic, or its candidate applications. */
public abstract class RuleResult {
    private RuleResult() {}

    public static RuleResult failure(String message) { return new Failure(message); }

    public static RuleResult success(RuleOutput... outputs) { return new Success(ImmutableList.copyOf(outputs), null); }

    public static RuleResult success(List<RuleOutput> outputs) { return new Success(ImmutableList.copyOf(outputs), null); }

    /** Success that also advances the rule's branch state on the new subgoals' paths. */
    public static RuleResult success(List<RuleOutput> outputs, Object branchState) {
        if (branchState == null) throw new IllegalArgumentException("null branch state");
        return new Success(ImmutableList.copyOf(outputs), branchState);
    }

    public abstract boolean isFailure();

    public String message() { throw new IllegalStateException("not a failure: " + this); }

    public ImmutableList<RuleOutput> outputs() { throw new IllegalStateException("not a success: " + this); }

    public Optional<Object> branchState() { return Optional.empty(); }

    static final class Failure extends RuleResult {
        private final String message;

        Failure(String message) { this.message = message; }

        @Override public boolean isFailure() { return true; }
        @Override public String message() { return message; }
        @Override public String toString() { return "failure: " + message; }
    }

    static final class Success extends RuleResult {
        private final ImmutableList<RuleOutput> outputs;
        private final Object branchState;

        Success(ImmutableList<RuleOutput> outputs, Object branchState) {
            this.outputs = outputs;
            this.branchState = branchState;
        }

        @Override public boolean isFailure() { return false; }
        @Override public ImmutableList<RuleOutput> outputs() { return outputs; }
        @Override public Optional<Object> branchState() { return Optional.ofNullable(branchState); }
        @Override public String toString() { return "success: " + outputs; }
    }
}
