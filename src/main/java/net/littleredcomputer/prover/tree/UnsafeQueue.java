package net.littleredcomputer.prover.tree;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.rule.RuleMatch;
import net.littleredcomputer.prover.rule.RuleOutput;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * The alternatives still to be tried on a goal: unsafe rules and safe rules whose outputs were
 * postponed. Ordered by descending success probability; equal probabilities keep their
 * selection order.
 */
public final class UnsafeQueue {
    public static final class Entry {
        private final RuleMatch match;
        private final double successProbability;
        private final ImmutableList<RuleOutput> postponedOutputs;  // null unless postponed
        private final Object postponedBranchState;

        private Entry(RuleMatch match, double successProbability, ImmutableList<RuleOutput> postponedOutputs, Object postponedBranchState) {
            this.match = match;
            this.successProbability = successProbability;
            this.postponedOutputs = postponedOutputs;
            this.postponedBranchState = postponedBranchState;
        }

        public static Entry unsafe(RuleMatch m) { return new Entry(m, m.rule().successProbability(), null, null); }

        public static Entry postponed(RuleMatch m, List<RuleOutput> outputs, Optional<Object> branchState, double successProbability) {
            return new Entry(m, successProbability, ImmutableList.copyOf(outputs), branchState.orElse(null));
        }

        public RuleMatch match() { return match; }
        public double successProbability() { return successProbability; }
        public boolean isPostponed() { return postponedOutputs != null; }

        public ImmutableList<RuleOutput> postponedOutputs() {
            if (postponedOutputs == null) throw new IllegalStateException(match + " was not postponed");
            return postponedOutputs;
        }

        public Optional<Object> postponedBranchState() { return Optional.ofNullable(postponedBranchState); }

        @Override public String toString() { return (isPostponed() ? "postponed " : "") + match; }
    }

    private final Deque<Entry> entries;

    private UnsafeQueue(List<Entry> es) { entries = new ArrayDeque<>(es); }

    public static UnsafeQueue empty() { return new UnsafeQueue(ImmutableList.of()); }

    public static UnsafeQueue of(List<Entry> es) {
        List<Entry> sorted = new ArrayList<>(es);
        sorted.sort(Comparator.comparingDouble(Entry::successProbability).reversed());
        return new UnsafeQueue(sorted);
    }

    public boolean isEmpty() { return entries.isEmpty(); }
    public int size() { return entries.size(); }

    public Entry pop() {
        if (entries.isEmpty()) throw new IllegalStateException("pop from empty unsafe queue");
        return entries.removeFirst();
    }

    @Override public String toString() { return entries.toString(); }
}
