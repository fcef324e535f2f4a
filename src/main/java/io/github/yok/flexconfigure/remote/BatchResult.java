package io.github.yok.flexconfigure.remote;

import java.util.List;
import lombok.Value;

/**
 * Per-operation outcomes of a batch execution.
 */
@Value
public class BatchResult {

    // One result per submitted operation, in submission order
    List<OperationResult> results;

    // Number of requests (chunks) sent to the remote side
    int requestCount;
}
