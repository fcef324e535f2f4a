package io.github.yok.flexconfigure.remote;

import lombok.Value;

/**
 * A "set parameter value" operation submitted through a {@link BatchExecutor}.
 */
@Value
public class ParameterOperation {
    String artifactId;
    String version;
    String key;
    String value;
}
