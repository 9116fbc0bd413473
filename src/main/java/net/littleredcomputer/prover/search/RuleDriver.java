package net.littleredcomputer.prover.search;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import net.littleredcomputer.prover.meta.Expr;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.MetaContext;
import net.littleredcomputer.prover.meta.Snapshot;
import net.littleredcomputer.prover.rule.BranchState;
import net.littleredcomputer.prover.rule.Rule;
import net.littleredcomputer.prover.rule.RuleInput;
import net.littleredcomputer.prover.rule.RuleMatch;
import net.littleredcomputer.prover.rule.RuleOutput;
import net.littleredcomputer.prover.rule.RuleResult;
import net.littleredcomputer.prover.tree.Goal;
import net.littleredcomputer.prover.tree.RuleApplication;
import net.littleredcomputer.prover.tree.SearchTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs rules against goals and turns what they report into tree nodes. Rule failures and
 * exceptions thrown by rules are absorbed here; a rule whose report disagrees with what it
 * actually did to the state is fatal.
 */
final class RuleDriver {
    private static final Logger log = LogManager.getFormatterLogger(RuleDriver.class);

    private final SearchTree tree;
    private final SearchOptions options;
    private final Statistics stats;

    RuleDriver(SearchTree tree, SearchOptions options, Statistics stats) {
        this.tree = tree;
        this.options = options;
        this.stats = stats;
    }

    /** A rule's outcome after validation. */
    static final class Attempt {
        private final String failure;
        private final ImmutableList<RuleOutput> outputs;
        private final Optional<Object> branchState;

        private Attempt(String failure, ImmutableList<RuleOutput> outputs, Optional<Object> branchState) {
            this.failure = failure;
            this.outputs = outputs;
            this.branchState = branchState;
        }

        boolean failed() { return failure != null; }
        String failure() { return failure; }

        /** Outputs whose introduced and assigned sets are the observed ones. */
        ImmutableList<RuleOutput> outputs() { return outputs; }
        Optional<Object> branchState() { return branchState; }

        /** True if applying this as a safe rule could make an irreversible choice. */
        boolean needsPostponement() {
            if (outputs.size() > 1) return true;
            for (RuleOutput o : outputs) if (!o.assignedMVars().isEmpty()) return true;
            return false;
        }
    }

    Attempt run(RuleMatch match, MVarId goal, Snapshot pre, ImmutableSet<MVarId> accessible, BranchState branchState) {
        Rule rule = match.rule();
        ++stats.ruleRuns;
        RuleInput input = new RuleInput(goal, pre, accessible, match.locations(), branchState.get(rule));
        RuleResult result;
        try {
            result = rule.tactic().run(input);
        } catch (SearchException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("rule %s threw on %s: %s", rule.name(), goal, e);
            return failure(rule, goal, "rule threw " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (result == null) throw checkFailure(rule, "returned no result");
        if (result.isFailure()) return failure(rule, goal, result.message());
        if (result.outputs().isEmpty()) return failure(rule, goal, "rule produced no applications");
        ImmutableList.Builder<RuleOutput> checked = ImmutableList.builder();
        for (RuleOutput o : result.outputs()) checked.add(validate(rule, goal, pre, o));
        log.debug("rule %s succeeded on %s with %d applications", rule.name(), goal, result.outputs().size());
        return new Attempt(null, checked.build(), result.branchState());
    }

    private Attempt failure(Rule rule, MVarId goal, String message) {
        ++stats.ruleFailures;
        log.debug("rule %s failed on %s: %s", rule.name(), goal, message);
        return new Attempt(message, ImmutableList.of(), Optional.empty());
    }

    private RuleOutput validate(Rule rule, MVarId goal, Snapshot pre, RuleOutput o) {
        Snapshot post = o.postState();
        if (!post.isAssigned(goal)) throw checkFailure(rule, "did not assign its goal " + goal);
        for (MVarId m : pre.assignedMVars()) {
            if (!post.isAssigned(m)) throw checkFailure(rule, "dropped the assignment of " + m);
        }
        for (MVarId g : o.goals()) {
            if (!post.isDeclared(g)) throw checkFailure(rule, "reported undeclared subgoal " + g);
            if (post.isAssigned(g)) throw checkFailure(rule, "reported assigned subgoal " + g);
        }
        ImmutableSet<MVarId> introduced = Sets.difference(post.declaredMVars(), pre.declaredMVars()).immutableCopy();
        Set<MVarId> as = new LinkedHashSet<>();
        for (MVarId m : post.assignedMVars()) {
            if (pre.isDeclared(m) && !pre.isAssigned(m) && !m.equals(goal)) as.add(m);
        }
        ImmutableSet<MVarId> assigned = ImmutableSet.copyOf(as);
        if (options.check()) {
            if (!introduced.equals(o.introducedMVars())) {
                throw checkFailure(rule, "reported introducing " + o.introducedMVars() + " but introduced " + introduced);
            }
            if (!assigned.equals(o.assignedMVars())) {
                throw checkFailure(rule, "reported assigning " + o.assignedMVars() + " but assigned " + assigned);
            }
        }
        return new RuleOutput(post, o.goals(), introduced, assigned, o.successProbability());
    }

    private static SearchException checkFailure(Rule rule, String message) {
        return new SearchException(SearchException.Reason.RULE_CHECK, "rule " + rule.name() + " " + message);
    }

    /**
     * Add one validated output of {@code rule} to the tree under {@code goal}. Goals depending
     * on metavariables the output assigned are copied into the new application; subgoals that
     * occur in other subgoals' obligations are treated as plain metavariables; the remaining
     * subgoals are grouped into clusters by shared metavariables.
     */
    RuleApplication apply(Goal goal, Rule rule, boolean safe, RuleOutput output, double weight, Optional<Object> branchUpdate) {
        MetaContext ctx = new MetaContext(output.postState());
        Set<MVarId> assigned = new LinkedHashSet<>(output.assignedMVars());
        Set<MVarId> introduced = new LinkedHashSet<>(output.introducedMVars());
        Map<MVarId, Goal.Origin> candidates = new LinkedHashMap<>();
        for (MVarId g : output.goals()) candidates.put(g, Goal.Origin.SUBGOAL);
        for (Goal s : tree.goalsToCopy(goal, output.assignedMVars())) {
            MVarId orig = s.preNormGoal();
            if (ctx.isAssigned(orig)) continue;
            MVarId copy = ctx.declare(ctx.instantiate(ctx.decl(orig)));
            ctx.assign(orig, Expr.mvar(copy));
            assigned.add(orig);
            introduced.add(copy);
            candidates.put(copy, Goal.Origin.COPY);
            log.debug("%s copied to %s under %s", s, copy, rule.name());
        }
        Snapshot post = introduced.size() == output.introducedMVars().size() ? output.postState() : ctx.snapshot();

        Map<MVarId, ImmutableSet<MVarId>> deps = new LinkedHashMap<>();
        for (MVarId g : candidates.keySet()) deps.put(g, ctx.goalDependencies(g));
        List<SearchTree.GoalSpec> specs = new ArrayList<>();
        for (Map.Entry<MVarId, Goal.Origin> e : candidates.entrySet()) {
            MVarId g = e.getKey();
            boolean occursElsewhere = false;
            for (Map.Entry<MVarId, ImmutableSet<MVarId>> d : deps.entrySet()) {
                if (!d.getKey().equals(g) && d.getValue().contains(g)) occursElsewhere = true;
            }
            if (!occursElsewhere) specs.add(new SearchTree.GoalSpec(g, deps.get(g), e.getValue()));
        }
        BranchState bs = goal.branchState();
        if (branchUpdate.isPresent()) bs = bs.update(rule, branchUpdate.get());
        ++stats.ruleApplications;
        return tree.addRuleApplication(goal, rule, safe, post, ImmutableSet.copyOf(introduced), ImmutableSet.copyOf(assigned),
                weight, clusters(specs), bs);
    }

    /** Group goals into the connected components of the relation "share a metavariable", in order of first member. */
    static List<List<SearchTree.GoalSpec>> clusters(List<SearchTree.GoalSpec> specs) {
        int[] parent = new int[specs.size()];
        for (int i = 0; i < parent.length; ++i) parent[i] = i;
        Map<MVarId, Integer> owner = new HashMap<>();
        for (int i = 0; i < specs.size(); ++i) {
            for (MVarId m : specs.get(i).mvars()) {
                Integer j = owner.putIfAbsent(m, i);
                if (j != null) union(parent, i, j);
            }
        }
        Map<Integer, List<SearchTree.GoalSpec>> groups = new LinkedHashMap<>();
        for (int i = 0; i < specs.size(); ++i) {
            groups.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(specs.get(i));
        }
        return new ArrayList<>(groups.values());
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int i, int j) {
        int a = find(parent, i), b = find(parent, j);
        // the smaller index stays the representative so cluster order follows goal order
        if (a < b) parent[b] = a;
        else if (b < a) parent[a] = b;
    }
}
