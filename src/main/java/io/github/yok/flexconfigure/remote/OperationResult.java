package io.github.yok.flexconfigure.remote;

import lombok.Value;

/**
 * Outcome of one {@link ParameterOperation} inside a batch.
 */
@Value
public class OperationResult {

    // Operation this result belongs to
    ParameterOperation operation;

    // HTTP-like status code of the operation, 0 when none was received
    int statusCode;

    // Error description, null when the operation completed with a status code
    String error;

    /**
     * Returns whether the operation was applied.
     *
     * @return {@code true} for a 2xx status without error
     */
    public boolean isSuccess() {
        return error == null && statusCode >= 200 && statusCode < 300;
    }
}
