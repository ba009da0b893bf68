package io.gridsweep.remote;

public interface ArtifactFetcher {
    byte[] fetch(ArtifactReference reference) throws RemoteServiceException, InterruptedException;
}
