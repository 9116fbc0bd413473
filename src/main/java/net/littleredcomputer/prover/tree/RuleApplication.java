package net.littleredcomputer.prover.tree;

import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.Snapshot;
import net.littleredcomputer.prover.rule.Rule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** One recorded application of a rule to a goal. Proven iff all of its clusters are proven. */
public final class RuleApplication {
    final int id;
    final int parentGoal;
    private final Rule rule;
    private final boolean safe;
    private final Snapshot postState;
    private final ImmutableSet<MVarId> introducedMVars;
    private final ImmutableSet<MVarId> assignedMVars;
    private final double successProbability;
    final List<Integer> clusters = new ArrayList<>();
    NodeState state = NodeState.UNKNOWN;
    boolean irrelevant = false;

    RuleApplication(int id, int parentGoal, Rule rule, boolean safe, Snapshot postState,
                    ImmutableSet<MVarId> introducedMVars, ImmutableSet<MVarId> assignedMVars, double successProbability) {
        this.id = id;
        this.parentGoal = parentGoal;
        this.rule = rule;
        this.safe = safe;
        this.postState = postState;
        this.introducedMVars = introducedMVars;
        this.assignedMVars = assignedMVars;
        this.successProbability = successProbability;
    }

    public int id() { return id; }
    public int parentGoal() { return parentGoal; }
    public Rule rule() { return rule; }

    /** True if applied as a safe rule (postponed safe rules count as unsafe). */
    public boolean isSafe() { return safe; }

    /** The state immediately after the rule ran. */
    public Snapshot postState() { return postState; }
    public ImmutableSet<MVarId> introducedMVars() { return introducedMVars; }
    public ImmutableSet<MVarId> assignedMVars() { return assignedMVars; }
    public double successProbability() { return successProbability; }
    public List<Integer> clusters() { return Collections.unmodifiableList(clusters); }
    public NodeState state() { return state; }
    public boolean isProven() { return state == NodeState.PROVEN; }
    public boolean isUnprovable() { return state == NodeState.UNPROVABLE; }
    public boolean isIrrelevant() { return irrelevant; }

    @Override public String toString() { return "R" + id + " " + rule.name(); }
}
