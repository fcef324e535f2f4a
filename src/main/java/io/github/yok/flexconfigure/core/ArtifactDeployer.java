package io.github.yok.flexconfigure.core;

import io.github.yok.flexconfigure.model.DeploymentTask;
import io.github.yok.flexconfigure.remote.RemoteApiException;
import io.github.yok.flexconfigure.remote.RuntimeArtifactApi;
import io.github.yok.flexconfigure.remote.RuntimeStatus;
import lombok.extern.slf4j.Slf4j;

/**
 * Deploys one artifact and polls its runtime status until a terminal outcome.
 *
 * <p>
 * <strong>States:</strong> {@code Triggered → Polling(Starting) → Succeeded | Failed | TimedOut}.
 * </p>
 * <ul>
 * <li>A failed trigger is terminal and not retried.</li>
 * <li>Each of at most {@code maxRetries} status checks is preceded by a wait of
 * {@code delaySeconds}.</li>
 * <li>A failed status query only consumes the attempt.</li>
 * <li>{@code STARTED} succeeds; {@code STARTING} and "not yet deployed" keep polling.</li>
 * <li>Any other status fails; after one more wait the error detail is fetched and becomes the
 * failure reason.</li>
 * <li>Running out of attempts times out.</li>
 * </ul>
 *
 * <p>
 * Instances hold no per-task state and may be shared by concurrent workers.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ArtifactDeployer {

    private final RuntimeArtifactApi runtimeApi;
    private final int maxRetries;
    private final int delaySeconds;
    private final Sleeper sleeper;

    public ArtifactDeployer(RuntimeArtifactApi runtimeApi, int maxRetries, int delaySeconds) {
        this(runtimeApi, maxRetries, delaySeconds, Sleeper.SYSTEM);
    }

    ArtifactDeployer(RuntimeArtifactApi runtimeApi, int maxRetries, int delaySeconds,
            Sleeper sleeper) {
        this.runtimeApi = runtimeApi;
        this.maxRetries = maxRetries;
        this.delaySeconds = delaySeconds;
        this.sleeper = sleeper;
    }

    /**
     * Runs the deployment state machine for one task on the calling thread.
     *
     * @param task task to deploy
     * @return terminal outcome
     */
    public DeploymentOutcome deploy(DeploymentTask task) {
        String artifactId = task.getArtifactId();
        log.info("    Deploying {} (type: {})", artifactId, task.getArtifactType());
        try {
            runtimeApi.deploy(artifactId, task.getArtifactType());
        } catch (RemoteApiException e) {
            return DeploymentOutcome.failed(task,
                    "failed to initiate deployment: " + e.getMessage());
        }
        log.info("    Deployment triggered for {}", artifactId);

        try {
            return poll(task);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeploymentOutcome.failed(task, "interrupted while waiting for deployment");
        }
    }

    private DeploymentOutcome poll(DeploymentTask task) throws InterruptedException {
        String artifactId = task.getArtifactId();
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            sleeper.sleep(delaySeconds);

            RuntimeStatus status;
            try {
                status = runtimeApi.getStatus(artifactId);
            } catch (RemoteApiException e) {
                log.warn("    Failed to get deployment status of {} (attempt {}/{}): {}",
                        artifactId, attempt, maxRetries, e.getMessage());
                continue;
            }

            log.info("    [{}] Check {}/{} - Status: {}, Version: {}", artifactId, attempt,
                    maxRetries, status.getRawStatus(), status.getVersion());

            switch (status.getState()) {
                case STARTED:
                    return DeploymentOutcome.succeeded(task);
                case NOT_YET_VISIBLE:
                case STARTING:
                    break;
                case OTHER_FAILURE:
                default:
                    return failWithErrorInfo(task, status.getRawStatus());
            }
        }
        return DeploymentOutcome.timedOut(task,
                "deployment status check timed out after " + maxRetries + " attempts");
    }

    private DeploymentOutcome failWithErrorInfo(DeploymentTask task, String rawStatus)
            throws InterruptedException {
        sleeper.sleep(delaySeconds);
        try {
            String errorInfo = runtimeApi.getErrorInfo(task.getArtifactId());
            return DeploymentOutcome.failed(task,
                    "deployment failed with status " + rawStatus + ": " + errorInfo);
        } catch (RemoteApiException e) {
            return DeploymentOutcome.failed(task, "deployment failed with status " + rawStatus
                    + " (error details unavailable: " + e.getMessage() + ")");
        }
    }
}
