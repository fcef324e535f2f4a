package io.github.yok.flexconfigure.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.flexconfigure.model.BatchSettings;
import io.github.yok.flexconfigure.model.ConfigurationParameter;
import io.github.yok.flexconfigure.model.ConfigureArtifact;
import io.github.yok.flexconfigure.model.RunStats;
import io.github.yok.flexconfigure.remote.BatchExecutor;
import io.github.yok.flexconfigure.remote.BatchResult;
import io.github.yok.flexconfigure.remote.BatchTransportException;
import io.github.yok.flexconfigure.remote.DesigntimeConfigurationApi;
import io.github.yok.flexconfigure.remote.OperationResult;
import io.github.yok.flexconfigure.remote.ParameterOperation;
import io.github.yok.flexconfigure.remote.RemoteApiException;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Updates the configuration parameters of one artifact, through the batch executor or with one
 * call per parameter.
 *
 * <p>
 * <strong>Batch path:</strong>
 * </p>
 * <ul>
 * <li>The current remote parameters are read first. Declared keys unknown to the artifact are
 * counted as failed and left out; they do not fail the artifact by themselves.</li>
 * <li>The remaining parameters are sent as ordered operations in chunks of the effective batch
 * size.</li>
 * <li>A transport failure applies the entire declared parameter set once through the individual
 * path. The batch itself is never retried.</li>
 * <li>Any failed operation fails the artifact. Values already applied are not rolled back.</li>
 * </ul>
 *
 * <p>
 * <strong>Individual path:</strong> one call per parameter; a failure is recorded and the remaining
 * parameters are still sent.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ParameterUpdater {

    private final DesigntimeConfigurationApi configurationApi;
    private final BatchExecutor batchExecutor;

    // Batch size used when an artifact does not override it
    private final int globalBatchSize;

    // Disables the batch path for every artifact
    private final boolean disableBatch;

    public ParameterUpdater(DesigntimeConfigurationApi configurationApi,
            BatchExecutor batchExecutor, int globalBatchSize, boolean disableBatch) {
        this.configurationApi = configurationApi;
        this.batchExecutor = batchExecutor;
        this.globalBatchSize = globalBatchSize;
        this.disableBatch = disableBatch;
    }

    /**
     * Decides whether an artifact is updated through the batch executor.
     *
     * @param artifact artifact
     * @param disableBatch global batch-disable toggle
     * @return {@code true} if batching is enabled for the artifact and not disabled globally
     */
    public static boolean useBatch(ConfigureArtifact artifact, boolean disableBatch) {
        BatchSettings batch = artifact.getBatch();
        boolean enabled = batch == null || batch.isEnabled();
        return enabled && !disableBatch;
    }

    /**
     * Returns the batch size for an artifact.
     *
     * @param artifact artifact
     * @param globalBatchSize batch size of the run
     * @return the artifact's own batch size if it declares batch settings, the global one otherwise
     */
    public static int effectiveBatchSize(ConfigureArtifact artifact, int globalBatchSize) {
        BatchSettings batch = artifact.getBatch();
        return batch != null && batch.getBatchSize() > 0 ? batch.getBatchSize() : globalBatchSize;
    }

    /**
     * Updates all declared parameters of an artifact.
     *
     * @param artifactId effective artifact id
     * @param artifact artifact declaration
     * @param stats run statistics to update
     * @return {@code true} if the artifact counts as configured, {@code false} if it failed
     */
    public boolean update(String artifactId, ConfigureArtifact artifact, RunStats stats) {
        List<ConfigurationParameter> parameters = artifact.getParameters();
        if (parameters.isEmpty()) {
            log.info("      No parameters declared");
            return true;
        }

        if (useBatch(artifact, disableBatch)) {
            return updateBatch(artifactId, artifact.getVersion(), parameters,
                    effectiveBatchSize(artifact, globalBatchSize), stats);
        }
        return updateIndividually(artifactId, artifact.getVersion(), parameters, stats);
    }

    private boolean updateBatch(String artifactId, String version,
            List<ConfigurationParameter> parameters, int batchSize, RunStats stats) {
        log.info("      Using batch operations (batch size: {})", batchSize);

        Map<String, String> current;
        try {
            current = configurationApi.getParameters(artifactId, version);
        } catch (RemoteApiException e) {
            log.error("      Failed to get current configuration of {}: {}", artifactId,
                    e.getMessage());
            return false;
        }

        ImmutableList.Builder<ParameterOperation> operationsBuilder = ImmutableList.builder();
        int missing = 0;
        for (ConfigurationParameter param : parameters) {
            if (!current.containsKey(param.getKey())) {
                log.warn("      Parameter {} not found in artifact, skipping", param.getKey());
                missing++;
                continue;
            }
            operationsBuilder.add(
                    new ParameterOperation(artifactId, version, param.getKey(), param.getValue()));
        }

        List<ParameterOperation> operations = operationsBuilder.build();
        if (operations.isEmpty()) {
            log.warn("      None of the declared parameters exists in {}, nothing to update",
                    artifactId);
            stats.parametersFailed(missing);
            return true;
        }

        BatchResult result;
        try {
            result = batchExecutor.execute(operations, batchSize);
        } catch (BatchTransportException e) {
            // Missing keys are counted by the individual path
            log.warn("      Batch operation failed: {}, falling back to individual requests",
                    e.getMessage());
            return updateIndividually(artifactId, version, parameters, stats);
        }

        stats.parametersFailed(missing);
        stats.batchRequestsExecuted(result.getRequestCount());
        int failed = 0;
        for (OperationResult op : result.getResults()) {
            if (op.isSuccess()) {
                stats.parametersUpdated(1);
            } else {
                failed++;
                stats.parametersFailed(1);
                log.error("      Failed to update parameter {} (status={}, error={})",
                        op.getOperation().getKey(), op.getStatusCode(), op.getError());
            }
        }

        if (failed > 0) {
            log.error("      {} parameter(s) failed to update in batch", failed);
            return false;
        }
        return true;
    }

    private boolean updateIndividually(String artifactId, String version,
            List<ConfigurationParameter> parameters, RunStats stats) {
        log.info("      Using individual requests");

        int failed = 0;
        for (ConfigurationParameter param : parameters) {
            stats.individualRequestUsed();
            try {
                configurationApi.updateParameter(artifactId, version, param.getKey(),
                        param.getValue());
                stats.parametersUpdated(1);
            } catch (RemoteApiException e) {
                failed++;
                stats.parametersFailed(1);
                log.error("      Failed to update parameter {}: {}", param.getKey(),
                        e.getMessage());
            }
        }

        if (failed > 0) {
            log.error("      {} parameter(s) failed to update", failed);
            return false;
        }
        return true;
    }
}
