package io.github.yok.flexconfigure.remote;

import java.util.Map;

/**
 * Access to the configuration parameters of a designtime artifact version.
 *
 * @author Yasuharu.Okawauchi
 */
public interface DesigntimeConfigurationApi {

    /**
     * Reads the current configuration parameters of an artifact version.
     *
     * @param artifactId effective artifact id
     * @param version artifact version
     * @return map of parameter key to current value, in remote order
     * @throws RemoteApiException if the parameters cannot be read
     */
    Map<String, String> getParameters(String artifactId, String version)
            throws RemoteApiException;

    /**
     * Sets a single configuration parameter.
     *
     * @param artifactId effective artifact id
     * @param version artifact version
     * @param key parameter key
     * @param value new value
     * @throws RemoteApiException if the update is rejected or cannot be sent
     */
    void updateParameter(String artifactId, String version, String key, String value)
            throws RemoteApiException;
}
