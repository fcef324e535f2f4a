package io.github.yok.flexconfigure.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * An artifact whose configuration parameters are updated and which may be deployed afterwards.
 *
 * <p>
 * The {@link #id} is the id as declared in the source, without any deployment prefix.
 * </p>
 */
@Value
@Builder
public class ConfigureArtifact {

    /** Version used when a source declares none. */
    public static final String DEFAULT_VERSION = "active";

    // Declared artifact id (unprefixed)
    String id;
    // Human-readable name, may be null
    String displayName;
    // Artifact type
    ArtifactType type;
    // Designtime version whose configuration is updated
    String version;
    // Deploy this artifact after configuration
    boolean deploy;
    // Parameters in declaration order
    List<ConfigurationParameter> parameters;
    // Optional batch settings; null when the source declares none
    BatchSettings batch;
}
