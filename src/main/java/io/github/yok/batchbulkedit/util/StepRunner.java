package io.github.yok.batchbulkedit.util;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import java.io.PrintStream;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the steps of one command and reports them on the console.
 *
 * <p>
 * With progress enabled each step is announced as {@code [n/total] label ...} and finished with its
 * elapsed time. Without progress a plain {@code - label} bullet is printed. Steps run in the
 * calling thread, one after the other.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class StepRunner {

    @Getter
    private final boolean progress;
    private final int totalSteps;
    private final PrintStream out;
    private int current;

    /**
     * Creates a runner.
     *
     * @param progress {@code true} for numbered steps with timings
     * @param totalSteps number of steps the command will run
     * @param out console stream
     */
    public StepRunner(boolean progress, int totalSteps, PrintStream out) {
        Preconditions.checkArgument(totalSteps > 0, "totalSteps must be positive");
        this.progress = progress;
        this.totalSteps = totalSteps;
        this.out = Preconditions.checkNotNull(out, "out must not be null");
    }

    /**
     * Returns whether progress should be shown when the user did not choose.
     *
     * @return {@code true} when attached to an interactive console
     */
    public static boolean defaultProgress() {
        return System.console() != null;
    }

    /**
     * Runs one step.
     *
     * @param <T> result type
     * @param label step description
     * @param step work to run
     * @return result of the step
     * @throws Exception whatever the step throws; the failure is logged with the step label
     */
    public <T> T run(String label, Callable<T> step) throws Exception {
        current++;
        if (progress) {
            out.print("[" + current + "/" + totalSteps + "] " + label + " ...");
            out.flush();
        } else {
            out.println("- " + label);
        }
        Stopwatch stopwatch = Stopwatch.createStarted();
        try {
            T result = step.call();
            long millis = stopwatch.elapsed(TimeUnit.MILLISECONDS);
            if (progress) {
                out.println(String.format(Locale.ROOT, " done (%.2fs)", millis / 1000.0));
            }
            log.debug("Step finished: {} ({} ms)", label, millis);
            return result;
        } catch (Exception e) {
            if (progress) {
                out.println(" failed");
            }
            log.debug("Step failed: {}", label);
            throw e;
        }
    }
}
