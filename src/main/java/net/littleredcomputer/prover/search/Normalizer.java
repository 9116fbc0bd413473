package net.littleredcomputer.prover.search;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.meta.MVarDecl;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.MetaContext;
import net.littleredcomputer.prover.meta.Snapshot;
import net.littleredcomputer.prover.rule.BranchState;
import net.littleredcomputer.prover.rule.Rule;
import net.littleredcomputer.prover.rule.RuleIndex;
import net.littleredcomputer.prover.rule.RuleMatch;
import net.littleredcomputer.prover.rule.RuleOutput;
import net.littleredcomputer.prover.rule.SimpResult;
import net.littleredcomputer.prover.rule.Simplifier;
import net.littleredcomputer.prover.tree.NormalizationState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * Brings a goal into normal form. A round runs the pre-normalization rules (negative penalty),
 * then the simplifier, then the remaining normalization rules. Rounds repeat until one changes
 * nothing; more than {@link SearchOptions#maxNormIterations()} rounds that do change something
 * is fatal.
 */
final class Normalizer {
    private static final Logger log = LogManager.getFormatterLogger(Normalizer.class);

    private final RuleIndex rules;
    private final Simplifier simplifier;
    private final SearchOptions options;
    private final RuleDriver driver;
    private final Statistics stats;

    Normalizer(RuleIndex rules, Simplifier simplifier, SearchOptions options, RuleDriver driver, Statistics stats) {
        this.rules = rules;
        this.simplifier = simplifier;
        this.options = options;
        this.driver = driver;
        this.stats = stats;
    }

    /** The normal form of a goal together with the branch state after the normalization rules ran. */
    static final class Result {
        private final NormalizationState state;
        private final BranchState branchState;

        Result(NormalizationState state, BranchState branchState) {
            this.state = state;
            this.branchState = branchState;
        }

        NormalizationState state() { return state; }
        BranchState branchState() { return branchState; }
    }

    /** Mutable cursor over one normalization. */
    private static final class Cursor {
        MVarId goal;
        Snapshot state;
        BranchState branchState;
        boolean solved = false;

        Cursor(MVarId goal, Snapshot state, BranchState branchState) {
            this.goal = goal;
            this.state = state;
            this.branchState = branchState;
        }
    }

    Result normalize(MVarId goal, Snapshot state, BranchState branchState) {
        ++stats.normalizations;
        Cursor c = new Cursor(goal, state, branchState);
        int changedRounds = 0;
        while (true) {
            boolean changed = runRules(c, true);
            if (!c.solved) changed |= simplify(c);
            if (!c.solved) changed |= runRules(c, false);
            if (c.solved) {
                log.debug("%s solved by normalization", goal);
                return new Result(NormalizationState.provenByNormalization(c.state), c.branchState);
            }
            if (!changed) {
                if (!c.goal.equals(goal)) log.debug("%s normalized to %s", goal, c.goal);
                return new Result(NormalizationState.normal(c.goal, c.state), c.branchState);
            }
            if (++changedRounds > options.maxNormIterations()) {
                throw new SearchException(SearchException.Reason.NORMALIZATION_LOOP,
                        String.format("normalization of %s did not terminate after %d rounds; now at %s",
                                goal, changedRounds, c.goal));
            }
        }
    }

    private static MVarDecl instantiatedDecl(Cursor c) {
        MetaContext ctx = new MetaContext(c.state);
        return ctx.instantiate(ctx.decl(c.goal));
    }

    /** @return true if some rule changed the goal */
    private boolean runRules(Cursor c, boolean pre) {
        boolean changed = false;
        ImmutableList<RuleMatch> matches = rules.normRules(instantiatedDecl(c));
        for (RuleMatch m : matches) {
            if (c.solved) break;
            Rule rule = m.rule();
            if (rule.isPreNorm() != pre) continue;
            // an earlier rule may have changed the goal since the index was asked
            Optional<ImmutableList<String>> locations = rule.matcher().match(instantiatedDecl(c));
            if (!locations.isPresent()) continue;
            MetaContext ctx = new MetaContext(c.state);
            RuleDriver.Attempt a = driver.run(new RuleMatch(rule, locations.get()), c.goal, c.state,
                    ctx.goalDependencies(c.goal), c.branchState);
            if (a.failed()) continue;
            if (a.outputs().size() != 1) {
                throw check(rule, "produced " + a.outputs().size() + " applications");
            }
            RuleOutput o = a.outputs().get(0);
            if (o.goals().size() > 1) throw check(rule, "produced " + o.goals().size() + " goals");
            if (!o.assignedMVars().isEmpty()) throw check(rule, "assigned " + o.assignedMVars());
            if (a.branchState().isPresent()) c.branchState = c.branchState.update(rule, a.branchState().get());
            c.state = o.postState();
            if (o.goals().isEmpty()) c.solved = true;
            else c.goal = o.goals().get(0);
            log.debug("normalization rule %s: %s", rule.name(), c.solved ? "solved" : c.goal);
            changed = true;
        }
        return changed;
    }

    private static SearchException check(Rule rule, String message) {
        return new SearchException(SearchException.Reason.RULE_CHECK, "normalization rule " + rule.name() + " " + message);
    }

    /** @return true if the simplifier changed the goal */
    private boolean simplify(Cursor c) {
        MetaContext ctx = new MetaContext(c.state);
        SimpResult r;
        try {
            r = simplifier.simplify(c.goal, ctx);
        } catch (SearchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SearchException(SearchException.Reason.INTERNAL, "simplifier failed on " + c.goal, e);
        }
        switch (r.kind()) {
            case SOLVED:
                if (!ctx.isAssigned(c.goal)) {
                    throw new SearchException(SearchException.Reason.INTERNAL, "simplifier solved " + c.goal + " without assigning it");
                }
                c.state = ctx.snapshot();
                c.solved = true;
                return true;
            case SIMPLIFIED:
                MVarId g = r.newGoal();
                if (!ctx.isAssigned(c.goal) || !ctx.isDeclared(g) || ctx.isAssigned(g)) {
                    throw new SearchException(SearchException.Reason.INTERNAL,
                            "simplifier replaced " + c.goal + " by " + g + " inconsistently");
                }
                log.debug("simplified %s to %s", c.goal, g);
                c.state = ctx.snapshot();
                c.goal = g;
                return true;
            default:
                return false;
        }
    }
}
