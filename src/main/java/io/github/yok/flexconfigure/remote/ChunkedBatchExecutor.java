package io.github.yok.flexconfigure.remote;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Base {@link BatchExecutor} that partitions the operations and sends one request per chunk.
 *
 * <p>
 * For {@code P} operations and chunk size {@code S} exactly {@code ceil(P / S)} chunks are sent, in
 * order. The first chunk that fails at transport level aborts the execution.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public abstract class ChunkedBatchExecutor implements BatchExecutor {

    /**
     * {@inheritDoc}
     */
    @Override
    public BatchResult execute(List<ParameterOperation> operations, int chunkSize)
            throws BatchTransportException {
        Preconditions.checkArgument(chunkSize > 0, "chunkSize must be greater than 0");
        if (operations.isEmpty()) {
            return new BatchResult(ImmutableList.of(), 0);
        }

        List<List<ParameterOperation>> chunks = Lists.partition(operations, chunkSize);
        ImmutableList.Builder<OperationResult> results = ImmutableList.builder();
        int sent = 0;
        for (List<ParameterOperation> chunk : chunks) {
            sent++;
            log.debug("Executing batch chunk {}/{} ({} operations)", sent, chunks.size(),
                    chunk.size());
            List<OperationResult> chunkResults = executeChunk(chunk);
            if (chunkResults.size() != chunk.size()) {
                throw new BatchTransportException("Batch chunk " + sent + " returned "
                        + chunkResults.size() + " results for " + chunk.size() + " operations");
            }
            results.addAll(chunkResults);
        }
        return new BatchResult(results.build(), sent);
    }

    /**
     * Sends one chunk as a single request.
     *
     * @param chunk operations of the chunk, never empty
     * @return one result per operation, in chunk order
     * @throws BatchTransportException if the request could not be carried out
     */
    protected abstract List<OperationResult> executeChunk(List<ParameterOperation> chunk)
            throws BatchTransportException;
}
