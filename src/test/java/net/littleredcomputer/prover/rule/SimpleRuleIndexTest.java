package net.littleredcomputer.prover.rule;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.meta.Expr;
import net.littleredcomputer.prover.meta.MVarDecl;
import org.junit.Test;

import java.util.List;
import java.util.Optional;

import static java.util.stream.Collectors.toList;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class SimpleRuleIndexTest {
    private static final RuleTactic none = in -> RuleResult.failure("unused");
    private static final MVarDecl goal = MVarDecl.of(Expr.constant("P"));

    private static List<String> names(List<RuleMatch> ms) {
        return ms.stream().map(m -> m.rule().name()).collect(toList());
    }

    @Test
    public void staticOrder() {
        SimpleRuleIndex index = SimpleRuleIndex.of(
                Rule.unsafe("u1", 0.3, none), Rule.safe("s2", 5, none), Rule.norm("n1", 2, none),
                Rule.unsafe("u2", 0.9, none), Rule.safe("s1", -1, none), Rule.norm("n0", -3, none),
                Rule.unsafe("u3", 0.3, none));
        assertThat(names(index.normRules(goal)), contains("n0", "n1"));
        assertThat(names(index.safeRules(goal)), contains("s1", "s2"));
        assertThat(names(index.unsafeRules(goal)), contains("u2", "u1", "u3"));
    }

    @Test
    public void matchersFilterAndLocate() {
        Rule onlyQ = Rule.safe("only_q", 0, none)
                .withMatcher(d -> d.target().equals(Expr.constant("Q")) ? Optional.of(ImmutableList.of()) : Optional.empty());
        Rule located = Rule.safe("located", 1, none).withMatcher(d -> Optional.of(ImmutableList.of("h1", "h2")));
        SimpleRuleIndex index = SimpleRuleIndex.of(onlyQ, located);
        List<RuleMatch> ms = index.safeRules(goal);
        assertThat(names(ms), contains("located"));
        assertThat(ms.get(0).locations(), contains("h1", "h2"));
        assertThat(ms.get(0).toString(), is("located[safe 1]@[h1, h2]"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void namesAreUnique() {
        SimpleRuleIndex.of(Rule.safe("r", 0, none), Rule.unsafe("r", 0.5, none));
    }

    @Test(expected = IllegalArgumentException.class)
    public void probabilityMustBePositive() {
        Rule.unsafe("zero", 0, none);
    }

    @Test
    public void branchStateIsPerPath() {
        Rule counter = Rule.unsafe("counter", 0.5, none).withBranchState(0);
        BranchState a = BranchState.EMPTY.update(counter, 1);
        BranchState b = a.update(counter, 2);
        assertThat(BranchState.EMPTY.get(counter), is((Object) 0));
        assertThat(a.get(counter), is((Object) 1));
        assertThat(b.get(counter), is((Object) 2));
        assertThat(a.update(counter, 1), is(sameInstance(a)));
        assertThat(Rule.safe("plain", 0, none).withBranchState(null).initialBranchState(), is(nullValue()));
    }
}
