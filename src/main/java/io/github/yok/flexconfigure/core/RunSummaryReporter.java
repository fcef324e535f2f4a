package io.github.yok.flexconfigure.core;

import io.github.yok.flexconfigure.model.RunStats;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs the summary of a configure run.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class RunSummaryReporter {

    private static final String RULE = "=".repeat(72);

    /**
     * Logs counters and the final verdict.
     *
     * @param stats run statistics
     * @param dryRun whether the run was a dry run
     */
    public void report(RunStats stats, boolean dryRun) {
        log.info("");
        log.info(RULE);
        log.info(dryRun ? "DRY RUN SUMMARY" : "CONFIGURATION SUMMARY");
        log.info(RULE);
        line("Packages processed", stats.getPackagesProcessed());
        line("Packages with errors", stats.getPackagesWithErrors());
        line("Artifacts processed", stats.getArtifactsProcessed());
        line("Artifacts configured", stats.getArtifactsConfigured());
        line("Artifacts failed", stats.getArtifactsFailed());
        line("Parameters updated", stats.getParametersUpdated());
        line("Parameters failed", stats.getParametersFailed());

        if (!dryRun) {
            log.info("");
            log.info("Performance:");
            line("Batch requests executed", stats.getBatchRequestsExecuted());
            line("Individual requests used", stats.getIndividualRequestsUsed());
        }

        if (stats.getDeploymentTasksQueued() > 0) {
            log.info("");
            log.info("Deployment:");
            line("Deployment tasks queued", stats.getDeploymentTasksQueued());
            if (!dryRun) {
                line("Deployments successful", stats.getDeploymentTasksSucceeded());
                line("Deployments failed", stats.getDeploymentTasksFailed());
                line("Artifacts deployed", stats.getArtifactsDeployed());
            }
        }
        log.info(RULE);

        if (stats.hasFailures()) {
            log.error("Configuration/Deployment completed with errors");
        } else if (dryRun) {
            log.info("Dry run completed successfully");
        } else {
            log.info("Configuration/Deployment completed successfully");
        }
    }

    private void line(String label, int value) {
        log.info(String.format("%-28s %d", label + ":", value));
    }
}
