package io.github.yok.flexconfigure.model;

import lombok.Value;

/**
 * A single key/value configuration entry to be written to an artifact version.
 */
@Value
public class ConfigurationParameter {
    // Parameter key as known by the remote artifact
    String key;
    // Value to set
    String value;
}
