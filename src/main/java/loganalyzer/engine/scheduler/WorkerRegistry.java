package loganalyzer.engine.scheduler;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Job ids currently held by a worker, queued or executing.
 * Lives as long as its scheduler; a fresh process starts empty and rebuilds
 * it from the job store during recovery.
 */
public final class WorkerRegistry {

    private final Set<String> held = ConcurrentHashMap.newKeySet();

    /**
     * @return true if the caller now holds the job, false if someone else already does
     */
    public boolean tryAcquire(String jobId) {
        return held.add(jobId);
    }

    public void release(String jobId) {
        held.remove(jobId);
    }

    public boolean isHeld(String jobId) {
        return held.contains(jobId);
    }

    public Set<String> snapshot() {
        return Set.copyOf(held);
    }

    public int size() {
        return held.size();
    }

    public void clear() {
        held.clear();
    }
}
