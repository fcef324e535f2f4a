package io.github.yok.flexconfigure.model;

import lombok.Value;

/**
 * Per-artifact batch processing settings.
 *
 * <p>
 * Instances are created with every default already applied; see
 * {@link io.github.yok.flexconfigure.parser.ConfigDefaults}.
 * </p>
 */
@Value
public class BatchSettings {

    /** Batch size used when a source enables batching without giving a size. */
    public static final int DEFAULT_BATCH_SIZE = 90;

    // Whether parameter updates of the artifact go through the batch executor
    boolean enabled;

    // Maximum number of operations per batch request
    int batchSize;
}
