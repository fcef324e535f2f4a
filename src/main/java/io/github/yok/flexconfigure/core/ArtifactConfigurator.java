package io.github.yok.flexconfigure.core;

import io.github.yok.flexconfigure.model.ConfigurationParameter;
import io.github.yok.flexconfigure.model.ConfigureArtifact;
import io.github.yok.flexconfigure.model.ConfigureConfig;
import io.github.yok.flexconfigure.model.ConfigurePackage;
import io.github.yok.flexconfigure.model.DeploymentTask;
import io.github.yok.flexconfigure.model.RunStats;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Configuration phase: walks packages and artifacts, updates parameters and queues deployments.
 *
 * <p>
 * Runs on a single thread. A failed artifact is counted and skipped; processing always continues
 * with the next artifact. Filtered-out packages and artifacts are not counted at all.
 * </p>
 *
 * <p>
 * In dry-run mode no remote call is made: the parameters that would be set are logged and the
 * counters are updated as if every update had succeeded, but no {@link DeploymentTask} is
 * produced.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ArtifactConfigurator {

    private final ParameterUpdater parameterUpdater;
    private final ArtifactFilter filter;
    private final boolean dryRun;

    public ArtifactConfigurator(ParameterUpdater parameterUpdater, ArtifactFilter filter,
            boolean dryRun) {
        this.parameterUpdater = parameterUpdater;
        this.filter = filter;
        this.dryRun = dryRun;
    }

    /**
     * Configures every included artifact.
     *
     * @param config merged configuration
     * @param stats run statistics to update
     * @return deployment tasks for successfully configured artifacts that request deployment;
     *         always empty in dry-run mode
     */
    public List<DeploymentTask> configureAll(ConfigureConfig config, RunStats stats) {
        List<DeploymentTask> tasks = new ArrayList<>();
        String prefix = config.getDeploymentPrefix();

        for (ConfigurePackage pkg : config.getPackages()) {
            String packageId = DeploymentPrefix.apply(prefix, pkg.getId());
            if (!filter.includesPackage(pkg.getId())) {
                log.info("Skipping package {} (filtered out)", packageId);
                continue;
            }
            stats.packageProcessed();

            log.info("");
            log.info("Processing package: {}", packageId);
            if (StringUtils.isNotEmpty(pkg.getDisplayName())) {
                log.info("   Display Name: {}", pkg.getDisplayName());
            }

            boolean packageHasError = false;
            for (ConfigureArtifact artifact : pkg.getArtifacts()) {
                String artifactId = DeploymentPrefix.apply(prefix, artifact.getId());
                if (!filter.includesArtifact(artifact.getId())) {
                    log.info("   Skipping artifact {} (filtered out)", artifactId);
                    continue;
                }
                stats.artifactProcessed();

                if (!configureArtifact(pkg, packageId, artifact, artifactId, stats, tasks)) {
                    packageHasError = true;
                }
            }

            if (packageHasError) {
                stats.packageWithErrors();
            }
        }
        return tasks;
    }

    private boolean configureArtifact(ConfigurePackage pkg, String packageId,
            ConfigureArtifact artifact, String artifactId, RunStats stats,
            List<DeploymentTask> tasks) {
        log.info("");
        log.info("   Configuring artifact: {}", artifactId);
        if (StringUtils.isNotEmpty(artifact.getDisplayName())) {
            log.info("      Display Name: {}", artifact.getDisplayName());
        }
        log.info("      Type: {}", artifact.getType());
        log.info("      Version: {}", artifact.getVersion());
        log.info("      Parameters: {}", artifact.getParameters().size());

        boolean deploy = DeploymentTask.isRequested(pkg, artifact);

        if (dryRun) {
            log.info("      [DRY RUN] Would update the following parameters:");
            for (ConfigurationParameter param : artifact.getParameters()) {
                log.info("        - {} = {}", param.getKey(), param.getValue());
            }
            stats.artifactConfigured();
            stats.parametersUpdated(artifact.getParameters().size());
            if (deploy) {
                stats.deploymentTaskQueued();
                log.info("      [DRY RUN] Would deploy after configuration");
            }
            return true;
        }

        if (!parameterUpdater.update(artifactId, artifact, stats)) {
            log.error("      Failed to configure artifact {}", artifactId);
            stats.artifactFailed();
            return false;
        }

        stats.artifactConfigured();
        log.info("      Successfully configured {}", artifactId);

        if (deploy) {
            tasks.add(new DeploymentTask(artifactId, packageId, artifact.getType(),
                    artifact.getDisplayName()));
            stats.deploymentTaskQueued();
            log.info("      Queued for deployment");
        }
        return true;
    }
}
