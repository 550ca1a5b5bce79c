package resmon.monitor.model;

/**
 * Accounting data of a job that has left the queue.
 *
 * @param clusterId       cluster id
 * @param status          final {@code JobStatus}
 * @param wallClockSeconds {@code RemoteWallClockTime}
 * @param userCpuSeconds  {@code RemoteUserCpu}
 * @param sysCpuSeconds   {@code RemoteSysCpu}
 */
public record HistoryRecord(
        long clusterId,
        BackendJobStatus status,
        double wallClockSeconds,
        double userCpuSeconds,
        double sysCpuSeconds) {

    /** (user + system) / wall clock; 0 when no wall clock time was accounted. */
    public double cpuEfficiency() {
        if (wallClockSeconds == 0) {
            return 0;
        }
        return (userCpuSeconds + sysCpuSeconds) / wallClockSeconds;
    }
}
