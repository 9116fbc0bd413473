package net.littleredcomputer.prover.rule;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.meta.MVarDecl;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A rule index that asks every rule's {@link RuleMatcher} in turn. Ties in the static ordering
 * keep the order in which rules were given.
 */
public class SimpleRuleIndex implements RuleIndex {
    private final ImmutableList<Rule> norm;
    private final ImmutableList<Rule> safe;
    private final ImmutableList<Rule> unsafe;

    public SimpleRuleIndex(Iterable<Rule> rules) {
        List<Rule> n = new ArrayList<>(), s = new ArrayList<>(), u = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Rule r : rules) {
            if (!seen.add(r.name())) throw new IllegalArgumentException("duplicate rule name: " + r.name());
            switch (r.phase()) {
                case NORM: n.add(r); break;
                case SAFE: s.add(r); break;
                case UNSAFE: u.add(r); break;
            }
        }
        n.sort(Comparator.comparingInt(Rule::penalty));
        s.sort(Comparator.comparingInt(Rule::penalty));
        u.sort(Comparator.comparingDouble(Rule::successProbability).reversed());
        norm = ImmutableList.copyOf(n);
        safe = ImmutableList.copyOf(s);
        unsafe = ImmutableList.copyOf(u);
    }

    public static SimpleRuleIndex of(Rule... rules) { return new SimpleRuleIndex(ImmutableList.copyOf(rules)); }

    private static ImmutableList<RuleMatch> select(List<Rule> rules, MVarDecl goal) {
        ImmutableList.Builder<RuleMatch> b = ImmutableList.builder();
        for (Rule r : rules) {
            Optional<ImmutableList<String>> m = r.matcher().match(goal);
            m.ifPresent(locations -> b.add(new RuleMatch(r, locations)));
        }
        return b.build();
    }

    @Override public ImmutableList<RuleMatch> normRules(MVarDecl goal) { return select(norm, goal); }
    @Override public ImmutableList<RuleMatch> safeRules(MVarDecl goal) { return select(safe, goal); }
    @Override public ImmutableList<RuleMatch> unsafeRules(MVarDecl goal) { return select(unsafe, goal); }
}
