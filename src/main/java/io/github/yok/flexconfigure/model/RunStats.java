package io.github.yok.flexconfigure.model;

import lombok.Getter;
import lombok.ToString;

/**
 * Counters summarizing one configure run.
 *
 * <p>
 * This class is not thread-safe. It is written by the configuration phase thread and, after all
 * deployment workers have finished, by the single collector of the deployment phase. No two
 * writers are ever active at the same time.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public class RunStats {

    private int packagesProcessed;
    private int packagesWithErrors;
    private int artifactsProcessed;
    private int artifactsConfigured;
    private int artifactsFailed;
    private int artifactsDeployed;
    private int parametersUpdated;
    private int parametersFailed;
    private int batchRequestsExecuted;
    private int individualRequestsUsed;
    private int deploymentTasksQueued;
    private int deploymentTasksSucceeded;
    private int deploymentTasksFailed;

    public void packageProcessed() {
        packagesProcessed++;
    }

    public void packageWithErrors() {
        packagesWithErrors++;
    }

    public void artifactProcessed() {
        artifactsProcessed++;
    }

    public void artifactConfigured() {
        artifactsConfigured++;
    }

    public void artifactFailed() {
        artifactsFailed++;
    }

    public void parametersUpdated(int count) {
        parametersUpdated += count;
    }

    public void parametersFailed(int count) {
        parametersFailed += count;
    }

    public void batchRequestsExecuted(int count) {
        batchRequestsExecuted += count;
    }

    public void individualRequestUsed() {
        individualRequestsUsed++;
    }

    public void deploymentTaskQueued() {
        deploymentTasksQueued++;
    }

    /**
     * Records a deployment task that reached a successful terminal state.
     */
    public void deploymentSucceeded() {
        deploymentTasksSucceeded++;
        artifactsDeployed++;
    }

    public void deploymentFailed() {
        deploymentTasksFailed++;
    }

    /**
     * Returns whether the run as a whole is to be reported as failed.
     *
     * @return {@code true} if any artifact failed configuration or any deployment task failed
     */
    public boolean hasFailures() {
        return artifactsFailed > 0 || deploymentTasksFailed > 0;
    }
}
