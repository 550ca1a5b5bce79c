package resmon.monitor.model;

import java.time.Instant;

/**
 * Result record emitted to the metrics sink once per finished job.
 *
 * @param name           probe name
 * @param clusterId      batch system cluster id
 * @param passed         overall verdict
 * @param message        human readable verdict
 * @param runtime        wall clock seconds accounted by the batch system, -1 if unknown
 * @param cpuEfficiency  (user + sys) / wall clock, -1 if unknown
 * @param testtime       seconds from submission until results were collected
 * @param site           target execution site
 * @param submissionTime submission timestamp, used as the point timestamp
 */
public record TestResult(
        String name,
        long clusterId,
        boolean passed,
        String message,
        long runtime,
        double cpuEfficiency,
        long testtime,
        String site,
        Instant submissionTime) {
}
