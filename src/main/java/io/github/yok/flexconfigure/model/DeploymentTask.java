package io.github.yok.flexconfigure.model;

import lombok.Value;

/**
 * A queued request to deploy one configured artifact.
 *
 * <p>
 * Ids held here are effective ids, i.e. with the deployment prefix already applied.
 * </p>
 */
@Value
public class DeploymentTask {
    // Effective artifact id
    String artifactId;
    // Effective id of the owning package
    String packageId;
    // Artifact type
    ArtifactType artifactType;
    // Display name, may be null
    String displayName;

    /**
     * Decides whether a successfully configured artifact is to be deployed.
     *
     * @param pkg owning package
     * @param artifact artifact
     * @return {@code true} if the artifact or its package requests deployment
     */
    public static boolean isRequested(ConfigurePackage pkg, ConfigureArtifact artifact) {
        return artifact.isDeploy() || pkg.isDeploy();
    }
}
