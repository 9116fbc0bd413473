package net.littleredcomputer.prover.search;

import com.google.common.base.Stopwatch;

import java.time.Duration;

/** Counters kept during one search. */
public final class Statistics {
    int iterations = 0;
    int ruleRuns = 0;
    int ruleFailures = 0;
    int normalizations = 0;
    int goals = 0;
    int ruleApplications = 0;
    final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public int iterations() { return iterations; }
    public int ruleRuns() { return ruleRuns; }
    public int ruleFailures() { return ruleFailures; }
    public int normalizations() { return normalizations; }
    public int goals() { return goals; }
    public int ruleApplications() { return ruleApplications; }
    public Duration elapsed() { return stopwatch.elapsed(); }

    @Override
    public String toString() {
        return String.format("%d iterations, %d goals, %d rule applications, %d rule runs (%d failed), %d normalizations in %s",
                iterations, goals, ruleApplications, ruleRuns, ruleFailures, normalizations, stopwatch);
    }
}
