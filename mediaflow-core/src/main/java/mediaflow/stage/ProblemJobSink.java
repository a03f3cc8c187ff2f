package mediaflow.stage;

import java.util.List;

/**
 * Destination for jobs that failed terminally.
 *
 * @see InMemoryProblemJobSink
 */
public interface ProblemJobSink {

    void record(ProblemJob job);

    /**
     * Most recent problem jobs, newest first.
     */
    List<ProblemJob> recent(int limit);

    int count();
}
