package net.littleredcomputer.prover.rule;

import com.google.common.collect.ImmutableMap;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-rule values threaded along one root-to-goal path. Immutable: an update yields a new
 * state for the subgoals of one rule application and leaves siblings untouched.
 */
public final class BranchState {
    public static final BranchState EMPTY = new BranchState(ImmutableMap.of());

    private final ImmutableMap<String, Object> values;

    private BranchState(ImmutableMap<String, Object> values) { this.values = values; }

    /** @return the value recorded for {@code rule} on this path, or its initial value */
    public Object get(Rule rule) {
        Object v = values.get(rule.name());
        return v != null ? v : rule.initialBranchState();
    }

    public BranchState update(Rule rule, Object value) {
        if (value == null) throw new IllegalArgumentException("null branch state for " + rule.name());
        if (value.equals(values.get(rule.name()))) return this;
        Map<String, Object> m = new HashMap<>(values);
        m.put(rule.name(), value);
        return new BranchState(ImmutableMap.copyOf(m));
    }

    @Override
    public boolean equals(Object o) { return o instanceof BranchState && ((BranchState) o).values.equals(values); }

    @Override public int hashCode() { return values.hashCode(); }
    @Override public String toString() { return values.toString(); }
}
