package net.littleredcomputer.prover.search;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.Snapshot;
import net.littleredcomputer.prover.rule.RuleIndex;
import net.littleredcomputer.prover.rule.Simplifier;
import net.littleredcomputer.prover.tree.Goal;
import net.littleredcomputer.prover.tree.SearchTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Best-first proof search over an AND/OR tree of goals, rule applications and metavariable
 * clusters. Each iteration takes the most promising active goal, normalizes it, applies the
 * first safe rule that fits or else the next unsafe alternative, and queues the new subgoals.
 * On success the proof is replayed out of the tree; on failure the safe prefix is.
 */
public class ProofSearch extends AbstractProofSearch {
    private static final Logger log = LogManager.getFormatterLogger(ProofSearch.class);

    private final RuleIndex rules;
    private final Simplifier simplifier;
    private final SearchOptions options;

    public ProofSearch(RuleIndex rules, Simplifier simplifier, SearchOptions options) {
        super("proof search");
        this.rules = rules;
        this.simplifier = simplifier;
        this.options = options.validate();
        setLogInterval(options.logInterval());
    }

    public ProofSearch(RuleIndex rules) {
        this(rules, Simplifier.NONE, new SearchOptions());
    }

    public SearchOptions options() { return options; }

    @Override
    public SearchResult search(Snapshot initial, MVarId goal) {
        return new Run(initial, goal).run();
    }

    /** The state of one search. */
    private class Run {
        private final MVarId rootGoal;
        private final SearchTree tree;
        private final Statistics stats = new Statistics();
        private final RecursionGuard guard = new RecursionGuard(options.maxRecursionDepth());
        private final GoalExpander expander;
        private final GoalQueue queue;

        Run(Snapshot initial, MVarId goal) {
            rootGoal = goal;
            tree = new SearchTree(goal, initial);
            RuleDriver driver = new RuleDriver(tree, options, stats);
            Normalizer normalizer = new Normalizer(rules, simplifier, options, driver, stats);
            expander = new GoalExpander(tree, rules, options, driver, normalizer, guard);
            queue = GoalQueue.create(options.strategy(), tree);
        }

        SearchResult run() {
            stats.stopwatch.start();
            start();
            log.info("%s: proving %s : %s with %s", name(), rootGoal, tree.root().decl(), options);
            try {
                SearchException.Reason reason = loop();
                stats.goals = tree.goalCount();
                if (reason == null) return success();
                return failure(reason);
            } catch (SearchException e) {
                if (!e.isFatal()) throw e;
                log.debug("fatal: %s", e.getMessage());
                ImmutableList<MVarId> goals = null;
                try {
                    goals = new SafePrefix(tree, expander, options, guard).extract().goals();
                } catch (RuntimeException x) {
                    e.addSuppressed(x);
                }
                throw e.attach(tree, goals);
            } finally {
                stats.stopwatch.stop();
                stop();
                if (options.traceTree()) log.debug("final tree:\n%s", tree.render());
            }
        }

        /** @return null when the root is proven, otherwise why the search stopped */
        private SearchException.Reason loop() {
            queue.push(tree.root());
            while (true) {
                SearchException.Reason stop = limitReached();
                if (stop != null) return stop;
                if (tree.root().isProven()) return null;
                if (queue.isEmpty()) return SearchException.Reason.NO_GOALS;
                Goal g = queue.pop();
                if (!tree.isActive(g)) continue;
                ++stats.iterations;
                ++stepCount;
                if (stepCount % logCheckSteps == 0) maybeReportProgress(() -> String.format("%d goals, %d rule applications, %d queued",
                        tree.goalCount(), tree.rappCount(), queue.size()));
                int before = tree.goalCount();
                expander.expand(g, stats.iterations);
                List<Goal> created = new ArrayList<>();
                for (int i = before; i < tree.goalCount(); ++i) created.add(tree.goal(i));
                queue.pushExpanded(g, created);
            }
        }

        /** Termination conditions, in the order they are checked. Returns null if none holds. */
        private SearchException.Reason limitReached() {
            if (tree.root().isProven()) return null;
            if (tree.root().isUnprovable()) {
                return expander.maxDepthReached() ? SearchException.Reason.MAX_DEPTH : SearchException.Reason.UNPROVABLE;
            }
            if (options.maxGoals() != 0 && tree.goalCount() >= options.maxGoals()) return SearchException.Reason.MAX_GOALS;
            if (options.maxRuleApplications() != 0 && tree.rappCount() >= options.maxRuleApplications()) {
                return SearchException.Reason.MAX_RULE_APPLICATIONS;
            }
            return null;
        }

        private SearchResult success() {
            ProofExtractor.Extraction x = new ProofExtractor(tree, guard).extract();
            log.info("%s: proved %s after %s", name(), rootGoal, stats);
            return SearchResult.proven(rootGoal, x.state(), x.proof(), stats);
        }

        private String describe(SearchException.Reason reason) {
            switch (reason) {
                case MAX_DEPTH:
                    return "failed to prove the goal; maximum rule application depth " + options.maxRuleApplicationDepth() + " reached";
                case MAX_GOALS:
                    return "failed to prove the goal; maximum number of goals " + options.maxGoals() + " reached";
                case MAX_RULE_APPLICATIONS:
                    return "failed to prove the goal; maximum number of rule applications " + options.maxRuleApplications() + " reached";
                case NO_GOALS:
                    return "failed to prove the goal; no active goals remain";
                default:
                    return "failed to prove the goal after exhaustive search";
            }
        }

        private SearchResult failure(SearchException.Reason reason) {
            SafePrefix prefix = new SafePrefix(tree, expander, options, guard);
            prefix.expand();
            if (tree.root().isProven()) {
                log.debug("safe prefix expansion proved the root");
                stats.goals = tree.goalCount();
                return success();
            }
            SafePrefix.Extraction x = prefix.extract();
            stats.goals = tree.goalCount();
            String message = describe(reason);
            if (options.terminal()) throw new SearchException(reason, message).attach(tree, x.goals());
            if (options.warnOnNonterminal()) {
                log.warn("%s: %s; %d goals remain after the safe prefix: %s", name(), message, x.goals().size(), x.goals());
            }
            return SearchResult.partial(rootGoal, x.state(), x.goals(), reason, message, stats);
        }
    }
}
