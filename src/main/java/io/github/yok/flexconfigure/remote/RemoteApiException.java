package io.github.yok.flexconfigure.remote;

/**
 * Signals that a call to the remote tenant failed.
 *
 * @author Yasuharu.Okawauchi
 */
public class RemoteApiException extends Exception {

    private static final long serialVersionUID = 1L;

    public RemoteApiException(String message) {
        super(message);
    }

    public RemoteApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
