package io.github.yok.flexconfigure.remote;

import java.util.List;

/**
 * Executes an ordered list of {@link ParameterOperation}s in chunks.
 *
 * @author Yasuharu.Okawauchi
 */
public interface BatchExecutor {

    /**
     * Executes the operations in chunks of at most {@code chunkSize}.
     *
     * @param operations operations in the order they are to be applied
     * @param chunkSize maximum number of operations per request, greater than 0
     * @return one result per operation
     * @throws BatchTransportException if a request could not be carried out as a whole
     */
    BatchResult execute(List<ParameterOperation> operations, int chunkSize)
            throws BatchTransportException;
}
