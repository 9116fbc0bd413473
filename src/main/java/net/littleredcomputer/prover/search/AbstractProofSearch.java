package net.littleredcomputer.prover.search;

import com.google.common.base.Stopwatch;
import net.littleredcomputer.prover.meta.MVarDecl;
import net.littleredcomputer.prover.meta.MVarId;
import net.littleredcomputer.prover.meta.MetaContext;
import net.littleredcomputer.prover.meta.Snapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

public abstract class AbstractProofSearch {
    private static final Logger log = LogManager.getFormatterLogger(AbstractProofSearch.class);
    final int logCheckSteps = 100;
    long stepCount;
    private long lastStepCount;
    private final String name;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public void setLogInterval(Duration interval) { logInterval = interval; }

    AbstractProofSearch(String name) {
        this.name = name;
    }

    public String name() { return name; }

    /** Begin a new search: progress lines count steps and time from here. */
    void start() {
        stopwatch.reset().start();
        stepCount = 0;
        lastLogTime = Instant.now();
        lastStepCount = 0;
    }

    void stop() {
        if (stopwatch.isRunning()) stopwatch.stop();
    }

    Duration elapsed() { return stopwatch.elapsed(); }

    void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();

        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%s %d steps %s %.0f/sec %s", name, stepCount, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }

    /**
     * Search for a proof of {@code goal}, a declared and unassigned metavariable of {@code initial}.
     * @throws SearchException on fatal errors, and on failure if the search is terminal
     */
    public abstract SearchResult search(Snapshot initial, MVarId goal);

    /** Search for a proof of a single obligation in an otherwise empty state. */
    public SearchResult search(MVarDecl goal) {
        MetaContext ctx = new MetaContext();
        MVarId g = ctx.declare(goal);
        return search(ctx.snapshot(), g);
    }
}
