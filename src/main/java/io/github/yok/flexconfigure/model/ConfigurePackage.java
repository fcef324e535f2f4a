package io.github.yok.flexconfigure.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * A package grouping artifacts to configure.
 */
@Value
@Builder
public class ConfigurePackage {
    // Declared package id (unprefixed)
    String id;
    // Human-readable name, may be null
    String displayName;
    // Deploy every artifact of this package after configuration
    boolean deploy;
    // Artifacts in declaration order
    List<ConfigureArtifact> artifacts;
}
