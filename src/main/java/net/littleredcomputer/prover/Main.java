package net.littleredcomputer.prover;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.logic.LogicRules;
import net.littleredcomputer.prover.logic.LogicSimplifier;
import net.littleredcomputer.prover.meta.Expr;
import net.littleredcomputer.prover.meta.Hypothesis;
import net.littleredcomputer.prover.meta.MVarDecl;
import net.littleredcomputer.prover.rule.SimpleRuleIndex;
import net.littleredcomputer.prover.search.ProofSearch;
import net.littleredcomputer.prover.search.SearchOptions;
import net.littleredcomputer.prover.search.SearchResult;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.time.Duration;
import java.util.List;

public class Main {
    private static Joiner newlineJoiner = Joiner.on('\n');
    private static Splitter colonSplitter = Splitter.on(':').limit(2).trimResults();

    private static Options options() {
        return new Options()
                .addOption("goal", true, "formula to prove, as an s-expression")
                .addOption(Option.builder("hyp").hasArg().desc("hypothesis name:formula (repeatable)").build())
                .addOption("maxgoals", true, "maximum number of goals (0 = unlimited)")
                .addOption("maxrapps", true, "maximum number of rule applications (0 = unlimited)")
                .addOption("maxdepth", true, "maximum rule application depth (0 = unlimited)")
                .addOption("strategy", true, "best_first, depth_first or breadth_first")
                .addOption("terminal", false, "treat failure to prove the goal as an error")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static MVarDecl goal(CommandLine cmd) {
        if (!cmd.hasOption("goal")) throw new IllegalArgumentException("Must specify -goal");
        ImmutableList.Builder<Hypothesis> hs = ImmutableList.builder();
        String[] hyps = cmd.getOptionValues("hyp");
        if (hyps != null) {
            for (String h : hyps) {
                List<String> parts = colonSplitter.splitToList(h);
                if (parts.size() != 2) throw new IllegalArgumentException("hypothesis must be name:formula: " + h);
                hs.add(Hypothesis.parse(parts.get(0), parts.get(1)));
            }
        }
        return new MVarDecl(Expr.parse(cmd.getOptionValue("goal")), hs.build(), "goal");
    }

    private static SearchOptions searchOptions(CommandLine cmd) {
        SearchOptions o = new SearchOptions();
        if (cmd.hasOption("maxgoals")) o.setMaxGoals(Integer.parseInt(cmd.getOptionValue("maxgoals")));
        if (cmd.hasOption("maxrapps")) o.setMaxRuleApplications(Integer.parseInt(cmd.getOptionValue("maxrapps")));
        if (cmd.hasOption("maxdepth")) o.setMaxRuleApplicationDepth(Integer.parseInt(cmd.getOptionValue("maxdepth")));
        if (cmd.hasOption("strategy")) o.setStrategy(SearchOptions.Strategy.valueOf(cmd.getOptionValue("strategy").toUpperCase()));
        return o.setTerminal(cmd.hasOption("terminal"))
                .setLogInterval(Duration.parse(cmd.getOptionValue("loginterval", "PT1S")));
    }

    public static void main(String[] args) throws ParseException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        MVarDecl goal = goal(cmd);
        ProofSearch search = new ProofSearch(new SimpleRuleIndex(LogicRules.defaultRules()), new LogicSimplifier(),
                searchOptions(cmd));
        SearchResult r = search.search(goal);
        System.out.println("c " + r.statistics());
        if (r.isProven()) {
            System.out.println("s PROVEN");
            System.out.println(r.proof().get());
        } else {
            System.out.println("s " + r.failureReason().get() + ": " + r.message());
            System.out.println(r.partialProof());
            System.out.println(newlineJoiner.join(r.remainingGoalDecls()));
        }
    }
}
