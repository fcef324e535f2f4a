package io.github.yok.flexconfigure.core;

/**
 * Signals that no usable configuration could be loaded from a configuration path.
 *
 * @author Yasuharu.Okawauchi
 */
public class ConfigLoadException extends Exception {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
