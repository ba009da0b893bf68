package io.gridsweep.remote;

import java.util.Map;

/**
 * Remote job submission. Implementations are shared across dispatch workers
 * and hold no per-combination state.
 */
public interface RemoteJobService {
    ArtifactReference submit(String modelId, Map<String, Object> input)
            throws RemoteServiceException, InterruptedException;
}
