package mediaflow.stage;

import mediaflow.model.LedgerStatistics;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only snapshot of the pipeline for operators.
 *
 * @param stages      counts per stage queue
 * @param ledger      transaction counts per status
 * @param longRunning jobs held by a worker longer than the long-running threshold
 * @param problemJobs number of jobs currently kept in the problem-jobs sink
 * @param generatedAt when the snapshot was taken
 */
public record PipelineStatus(Map<StageName, StageCounts> stages, LedgerStatistics ledger,
                             List<ActiveJob> longRunning, int problemJobs, Instant generatedAt) {

    /** Jobs active longer than this are flagged. */
    public static final Duration LONG_RUNNING = Duration.ofMinutes(3);

    public PipelineStatus {
        stages = Collections.unmodifiableMap(new EnumMap<>(stages));
        longRunning = List.copyOf(longRunning);
    }

    /**
     * Percentage of ledger transactions that were delivered.
     */
    public double successRate() {
        return ledger.successRate();
    }

    /**
     * Plain-text report with one line per stage.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("Pipeline status at ").append(generatedAt).append('\n');
        for (Map.Entry<StageName, StageCounts> entry : stages.entrySet()) {
            StageCounts c = entry.getValue();
            sb.append(String.format(Locale.ROOT,
                    "  %-16s waiting=%d active=%d completed=%d failed=%d delayed=%d%n",
                    entry.getKey().key(), c.waiting(), c.active(), c.completed(), c.failed(), c.delayed()));
        }
        sb.append(String.format(Locale.ROOT, "  transactions=%d success=%.1f%% problemJobs=%d%n",
                ledger.total(), successRate(), problemJobs));
        if (!longRunning.isEmpty()) {
            sb.append("  long-running jobs:\n");
            for (ActiveJob job : longRunning) {
                sb.append("    ").append(job.stage().key()).append(' ').append(job.transactionId())
                        .append(" for ").append(job.runningFor(generatedAt).toSeconds()).append("s\n");
            }
        }
        return sb.toString();
    }
}
