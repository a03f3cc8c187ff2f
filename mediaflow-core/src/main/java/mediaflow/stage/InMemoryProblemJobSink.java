package mediaflow.stage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded in-memory {@link ProblemJobSink}; the oldest entry is dropped when full.
 * This class is thread-safe.
 */
public final class InMemoryProblemJobSink implements ProblemJobSink {
    private final int capacity;
    private final Deque<ProblemJob> jobs = new ArrayDeque<>();

    public InMemoryProblemJobSink() {
        this(500);
    }

    public InMemoryProblemJobSink(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void record(ProblemJob job) {
        if (jobs.size() == capacity) {
            jobs.removeFirst();
        }
        jobs.addLast(job);
    }

    @Override
    public synchronized List<ProblemJob> recent(int limit) {
        List<ProblemJob> result = new ArrayList<>(Math.min(limit, jobs.size()));
        Iterator<ProblemJob> it = jobs.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }

    @Override
    public synchronized int count() {
        return jobs.size();
    }
}
