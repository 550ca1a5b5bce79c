package resmon.monitor.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import resmon.monitor.model.JobSnapshot;

import java.io.IOException;

/**
 * JSON encoding of {@link JobSnapshot} for the {@code object} column.
 */
public final class SnapshotCodec {

    private final ObjectMapper mapper;

    public SnapshotCodec() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public SnapshotCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] encode(JobSnapshot snapshot) {
        try {
            return mapper.writeValueAsBytes(snapshot);
        } catch (IOException e) {
            throw new StoreException("Failed to encode snapshot: " + snapshot.jobId(), e);
        }
    }

    public JobSnapshot decode(byte[] data) throws IOException {
        if (data == null || data.length == 0) {
            throw new IOException("Empty snapshot");
        }
        return mapper.readValue(data, JobSnapshot.class);
    }
}
