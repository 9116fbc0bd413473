package net.littleredcomputer.prover.rule;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.prover.meta.MVarDecl;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.MetaContext;
import net.littleredcomputer.prover.meta.Snapshot;

/** Everything a {@link RuleTactic} gets to see. */
public final class RuleInput {
    private final MVarId goal;
    private final MetaContext context;
    private final Snapshot preState;
    private final ImmutableSet<MVarId> accessibleMVars;
    private final ImmutableList<String> matchLocations;
    private final Object branchState;

    public RuleInput(MVarId goal, Snapshot preState, ImmutableSet<MVarId> accessibleMVars,
                     ImmutableList<String> matchLocations, Object branchState) {
        this.goal = goal;
        this.preState = preState;
        this.context = new MetaContext(preState);
        this.accessibleMVars = accessibleMVars;
        this.matchLocations = matchLocations;
        this.branchState = branchState;
    }

    public MVarId goal() { return goal; }
    public MetaContext context() { return context; }

    /** The state the rule started from; restore it before building another alternative. */
    public Snapshot preState() { return preState; }

    /** The goal's obligation, instantiated in the pre-state. */
    public MVarDecl decl() {
        MetaContext c = new MetaContext(preState);
        return c.instantiate(c.decl(goal));
    }

    public ImmutableSet<MVarId> accessibleMVars() { return accessibleMVars; }
    public ImmutableList<String> matchLocations() { return matchLocations; }
    public Object branchState() { return branchState; }
}
