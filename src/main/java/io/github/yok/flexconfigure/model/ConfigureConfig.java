package io.github.yok.flexconfigure.model;

import java.util.List;
import lombok.Value;

/**
 * Root of a configuration source, or of several sources merged together.
 */
@Value
public class ConfigureConfig {
    // Deployment prefix; empty string when none applies
    String deploymentPrefix;
    // Packages in discovery order
    List<ConfigurePackage> packages;
}
