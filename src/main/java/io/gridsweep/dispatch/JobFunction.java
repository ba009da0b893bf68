package io.gridsweep.dispatch;

import io.gridsweep.remote.ArtifactReference;

import java.util.Map;

/** One remote submission for a prepared payload. */
@FunctionalInterface
public interface JobFunction {
    ArtifactReference run(Map<String, Object> payload) throws Exception;
}
