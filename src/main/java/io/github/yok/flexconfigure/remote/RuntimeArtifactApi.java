package io.github.yok.flexconfigure.remote;

import io.github.yok.flexconfigure.model.ArtifactType;

/**
 * Deployment and runtime status of artifacts.
 *
 * @author Yasuharu.Okawauchi
 */
public interface RuntimeArtifactApi {

    /**
     * Triggers deployment of the active version of an artifact.
     *
     * @param artifactId effective artifact id
     * @param type artifact type
     * @throws RemoteApiException if the deployment could not be triggered
     */
    void deploy(String artifactId, ArtifactType type) throws RemoteApiException;

    /**
     * Queries the runtime version and status of an artifact.
     *
     * @param artifactId effective artifact id
     * @return mapped runtime status
     * @throws RemoteApiException if the status cannot be read
     */
    RuntimeStatus getStatus(String artifactId) throws RemoteApiException;

    /**
     * Fetches detailed error information of a failed deployment.
     *
     * @param artifactId effective artifact id
     * @return human-readable error detail
     * @throws RemoteApiException if the detail cannot be read
     */
    String getErrorInfo(String artifactId) throws RemoteApiException;
}
