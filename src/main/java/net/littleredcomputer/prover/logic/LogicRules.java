package net.littleredcomputer.prover.logic;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import net.littleredcomputer.prover.meta.Expr;
import net.littleredcomputer.prover.meta.Hypothesis;
import net.littleredcomputer.prover.meta.MVarDecl;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.MetaContext;
import net.littleredcomputer.prover.meta.Snapshot;
import net.littleredcomputer.prover.rule.Rule;
import net.littleredcomputer.prover.rule.RuleInput;
import net.littleredcomputer.prover.rule.RuleMatcher;
import net.littleredcomputer.prover.rule.RuleOutput;
import net.littleredcomputer.prover.rule.RuleResult;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rules for a small propositional logic with existentials. Formulas are expressions built from
 * {@code True}, {@code (and A B)}, {@code (or A B)}, {@code (imp A B)} and {@code (ex x A)},
 * where {@code x} is a constant bound in {@code A}. Proof terms name hypotheses by their names
 * and use the constructors {@code trivial}, {@code and_intro}, {@code and_elim}, {@code or_inl},
 * {@code or_inr}, {@code ex_intro} and {@code mp}.
 */
public final class LogicRules {
    private LogicRules() {}

    public static final Expr TRUE = Expr.constant("True");
    public static final Expr TRIVIAL = Expr.constant("trivial");
    /** Type of existential witnesses. */
    public static final Expr TERM = Expr.constant("term");

    private static RuleMatcher target(String head, int arity) {
        return d -> d.target().isApp(head) && d.target().args().size() == arity
                ? Optional.of(ImmutableList.<String>of()) : Optional.empty();
    }

    /** Matches goals with a hypothesis of the given shape, at the names of those hypotheses. */
    private static RuleMatcher hypothesis(String head, int arity) {
        return d -> {
            ImmutableList.Builder<String> names = ImmutableList.builder();
            for (Hypothesis h : d.hypotheses()) {
                if (h.type().isApp(head) && h.type().args().size() == arity) names.add(h.name());
            }
            ImmutableList<String> ns = names.build();
            return ns.isEmpty() ? Optional.empty() : Optional.of(ns);
        };
    }

    /** An output from {@code ctx} reporting what changed since {@code in}'s pre-state. */
    static RuleOutput output(RuleInput in, MetaContext ctx, List<MVarId> goals) {
        Snapshot pre = in.preState();
        Set<MVarId> introduced = Sets.difference(ctx.declaredMVars(), pre.declaredMVars());
        Set<MVarId> assigned = new LinkedHashSet<>();
        for (MVarId m : ctx.assignedMVars()) {
            if (pre.isDeclared(m) && !pre.isAssigned(m) && !m.equals(in.goal())) assigned.add(m);
        }
        return RuleOutput.of(ctx, goals, introduced, assigned);
    }

    private static MVarId subgoal(MetaContext ctx, MVarDecl parent, Expr target) {
        return ctx.declare(parent.withTarget(target).withUserName(""));
    }

    /**
     * Close the goal with a hypothesis. A hypothesis equal to the target is used directly;
     * otherwise there is one application per hypothesis that unifies with the target.
     */
    public static Rule assumption() {
        return Rule.safe("assumption", 0, in -> {
            MVarDecl d = in.decl();
            for (Hypothesis h : d.hypotheses()) {
                if (h.type().equals(d.target())) {
                    MetaContext ctx = in.context();
                    ctx.assign(in.goal(), Expr.constant(h.name()));
                    return RuleResult.success(output(in, ctx, ImmutableList.of()));
                }
            }
            List<RuleOutput> outputs = new ArrayList<>();
            for (Hypothesis h : d.hypotheses()) {
                MetaContext ctx = new MetaContext(in.preState());
                if (!Unifier.unify(ctx, d.target(), h.type())) continue;
                ctx.assign(in.goal(), Expr.constant(h.name()));
                outputs.add(output(in, ctx, ImmutableList.of()));
            }
            return outputs.isEmpty() ? RuleResult.failure("no hypothesis matches " + d.target()) : RuleResult.success(outputs);
        });
    }

    public static Rule trueIntro() {
        return Rule.safe("true_intro", 0, in -> {
            MetaContext ctx = in.context();
            ctx.assign(in.goal(), TRIVIAL);
            return RuleResult.success(output(in, ctx, ImmutableList.of()));
        }).withMatcher(d -> d.target().equals(TRUE) ? Optional.of(ImmutableList.<String>of()) : Optional.empty());
    }

    public static Rule splitAnd() {
        return Rule.safe("split_and", 1, in -> {
            MVarDecl d = in.decl();
            MetaContext ctx = in.context();
            MVarId a = subgoal(ctx, d, d.target().arg(0));
            MVarId b = subgoal(ctx, d, d.target().arg(1));
            ctx.assign(in.goal(), Expr.app("and_intro", Expr.mvar(a), Expr.mvar(b)));
            return RuleResult.success(output(in, ctx, ImmutableList.of(a, b)));
        }).withMatcher(target("and", 2));
    }

    /** {@code (imp A B)}: prove {@code B} with a new hypothesis {@code h : A}. */
    public static Rule intro() {
        return Rule.safe("intro", 2, in -> {
            MVarDecl d = in.decl();
            MetaContext ctx = in.context();
            String h = d.freshHypothesisName("h");
            MVarId body = ctx.declare(d.withTarget(d.target().arg(1))
                    .withHypothesis(new Hypothesis(h, d.target().arg(0))).withUserName(""));
            ctx.assignDelayed(in.goal(), ImmutableList.of(h), body);
            return RuleResult.success(output(in, ctx, ImmutableList.of(body)));
        }).withMatcher(target("imp", 2));
    }

    /**
     * {@code (ex x A)}: prove {@code A} with {@code x} replaced by a new witness metavariable,
     * to be determined by whatever closes that goal.
     */
    public static Rule existsIntro() {
        return Rule.unsafe("exists_intro", 0.75, in -> {
            MVarDecl d = in.decl();
            Expr x = d.target().arg(0);
            if (!x.isConstant()) return RuleResult.failure("malformed existential " + d.target());
            MetaContext ctx = in.context();
            MVarId w = ctx.declare(d.withTarget(TERM).withUserName("w"));
            MVarId p = subgoal(ctx, d, d.target().arg(1).substitute(x.head(), Expr.mvar(w)));
            ctx.assign(in.goal(), Expr.app("ex_intro", Expr.mvar(w), Expr.mvar(p)));
            return RuleResult.success(output(in, ctx, ImmutableList.of(w, p)));
        }).withMatcher(target("ex", 2));
    }

    public static Rule orLeft() { return orIntro("or_left", "or_inl", 0); }

    public static Rule orRight() { return orIntro("or_right", "or_inr", 1); }

    private static Rule orIntro(String name, String constructor, int side) {
        return Rule.unsafe(name, 0.5, in -> {
            MVarDecl d = in.decl();
            MetaContext ctx = in.context();
            MVarId a = subgoal(ctx, d, d.target().arg(side));
            ctx.assign(in.goal(), Expr.app(constructor, Expr.mvar(a)));
            return RuleResult.success(output(in, ctx, ImmutableList.of(a)));
        }).withMatcher(target("or", 2));
    }

    /** Backward chaining through each implication hypothesis whose conclusion unifies with the target. */
    public static Rule modusPonens() {
        return Rule.unsafe("modus_ponens", 0.6, in -> {
            MVarDecl d = in.decl();
            List<RuleOutput> outputs = new ArrayList<>();
            for (String name : in.matchLocations()) {
                Optional<Hypothesis> h = d.hypothesis(name);
                if (!h.isPresent()) continue;
                MetaContext ctx = new MetaContext(in.preState());
                if (!Unifier.unify(ctx, h.get().type().arg(1), d.target())) continue;
                MVarId a = subgoal(ctx, d, ctx.instantiate(h.get().type().arg(0)));
                ctx.assign(in.goal(), Expr.app("mp", Expr.constant(name), Expr.mvar(a)));
                outputs.add(output(in, ctx, ImmutableList.of(a)));
            }
            return outputs.isEmpty() ? RuleResult.failure("no implication concludes " + d.target()) : RuleResult.success(outputs);
        }).withMatcher(hypothesis("imp", 2));
    }

    /** Normalization: replace the first conjunction hypothesis by its two halves. */
    public static Rule splitHypotheses() {
        return Rule.norm("split_hypotheses", -1, in -> {
            MVarDecl d = in.decl();
            List<Hypothesis> hs = new ArrayList<>(d.hypotheses());
            for (int i = 0; i < hs.size(); ++i) {
                Hypothesis h = hs.get(i);
                if (!h.type().isApp("and") || h.type().args().size() != 2) continue;
                String l = d.freshHypothesisName(h.name() + "_l");
                String r = d.freshHypothesisName(h.name() + "_r");
                hs.set(i, new Hypothesis(l, h.type().arg(0)));
                hs.add(i + 1, new Hypothesis(r, h.type().arg(1)));
                MetaContext ctx = in.context();
                MVarId g = ctx.declare(d.withHypotheses(hs).withUserName(""));
                ctx.assign(in.goal(), Expr.app("and_elim", Expr.constant(h.name()),
                        Expr.lambda(ImmutableList.of(l, r), Expr.mvar(g))));
                return RuleResult.success(output(in, ctx, ImmutableList.of(g)));
            }
            return RuleResult.failure("no conjunction among the hypotheses");
        }).withMatcher(hypothesis("and", 2));
    }

    /**
     * Limit {@code rule} to {@code max} applications along any one branch of the search. The
     * count is kept in the rule's branch state.
     */
    public static Rule bounded(Rule rule, int max) {
        if (max < 0) throw new IllegalArgumentException("negative bound for " + rule.name());
        return rule.withTactic(in -> {
            int n = (Integer) in.branchState();
            if (n >= max) return RuleResult.failure(rule.name() + " already applied " + n + " times on this branch");
            RuleResult r = rule.tactic().run(in);
            if (r.isFailure()) return r;
            return RuleResult.success(r.outputs(), n + 1);
        }).withBranchState(0);
    }

    public static ImmutableList<Rule> defaultRules() {
        return ImmutableList.of(
                splitHypotheses(),
                assumption(),
                trueIntro(),
                splitAnd(),
                intro(),
                existsIntro(),
                bounded(modusPonens(), 8),
                orLeft(),
                orRight());
    }
}
