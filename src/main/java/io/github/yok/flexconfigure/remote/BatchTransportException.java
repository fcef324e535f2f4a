package io.github.yok.flexconfigure.remote;

/**
 * Signals that a batch request as a whole could not be carried out, so no per-operation outcome is
 * available.
 *
 * @author Yasuharu.Okawauchi
 */
public class BatchTransportException extends RemoteApiException {

    private static final long serialVersionUID = 1L;

    public BatchTransportException(String message) {
        super(message);
    }

    public BatchTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
