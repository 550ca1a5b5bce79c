package resmon.monitor.service;

import resmon.monitor.job.Job;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Jobs currently owned by a worker or recovery thread.
 * Each job is added and removed by the single task that drives it.
 */
public class InFlightRegistry {

    private final Set<Job> jobs = ConcurrentHashMap.newKeySet();

    public void add(Job job) {
        jobs.add(job);
    }

    public void remove(Job job) {
        jobs.remove(job);
    }

    public boolean contains(Job job) {
        return jobs.contains(job);
    }

    public int size() {
        return jobs.size();
    }

    /** Point-in-time copy, oldest submission first. */
    public List<Job> snapshot() {
        return jobs.stream()
                .sorted(Comparator.comparing(Job::submissionTime))
                .toList();
    }
}
