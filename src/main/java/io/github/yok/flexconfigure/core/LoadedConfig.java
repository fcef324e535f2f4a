package io.github.yok.flexconfigure.core;

import io.github.yok.flexconfigure.model.ConfigureConfig;
import lombok.Value;

/**
 * A configuration source that was loaded successfully, with where it came from.
 */
@Value
public class LoadedConfig {
    // Parsed and defaulted content
    ConfigureConfig config;
    // Full path of the source
    String source;
    // File name, for logs
    String fileName;
}
