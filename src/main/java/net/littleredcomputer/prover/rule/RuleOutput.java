package net.littleredcomputer.prover.rule;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.MetaContext;
import net.littleredcomputer.prover.meta.Snapshot;

import java.util.List;
import java.util.Set;

/**
 * One candidate application reported by a rule: the state after it, the subgoals it left and
 * the metavariables it claims to have introduced and assigned.
 */
public final class RuleOutput {
    private final Snapshot postState;
    private final ImmutableList<MVarId> goals;
    private final ImmutableSet<MVarId> introducedMVars;
    private final ImmutableSet<MVarId> assignedMVars;
    private final double successProbability;

    public RuleOutput(Snapshot postState, List<MVarId> goals, Set<MVarId> introducedMVars,
                      Set<MVarId> assignedMVars, double successProbability) {
        if (successProbability <= 0 || successProbability > 1) {
            throw new IllegalArgumentException("success probability must be in (0, 1]: " + successProbability);
        }
        this.postState = postState;
        this.goals = ImmutableList.copyOf(goals);
        this.introducedMVars = ImmutableSet.copyOf(introducedMVars);
        this.assignedMVars = ImmutableSet.copyOf(assignedMVars);
        this.successProbability = successProbability;
    }

    /** Captures the context's current state; the subgoals are reported as the only introduced metavariables. */
    public static RuleOutput of(MetaContext ctx, List<MVarId> goals) {
        return new RuleOutput(ctx.snapshot(), goals, ImmutableSet.copyOf(goals), ImmutableSet.of(), 1.0);
    }

    public static RuleOutput of(MetaContext ctx, List<MVarId> goals, Set<MVarId> introduced, Set<MVarId> assigned) {
        return new RuleOutput(ctx.snapshot(), goals, introduced, assigned, 1.0);
    }

    public RuleOutput withSuccessProbability(double p) {
        return new RuleOutput(postState, goals, introducedMVars, assignedMVars, p);
    }

    public Snapshot postState() { return postState; }
    public ImmutableList<MVarId> goals() { return goals; }
    public ImmutableSet<MVarId> introducedMVars() { return introducedMVars; }
    public ImmutableSet<MVarId> assignedMVars() { return assignedMVars; }
    public double successProbability() { return successProbability; }

    @Override
    public String toString() { return "RuleOutput" + goals + " introduced " + introducedMVars + " assigned " + assignedMVars; }
}
