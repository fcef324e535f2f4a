package io.github.yok.flexconfigure.core;

import io.github.yok.flexconfigure.config.ConfigureOptions;
import io.github.yok.flexconfigure.model.ConfigureConfig;
import io.github.yok.flexconfigure.model.DeploymentTask;
import io.github.yok.flexconfigure.model.RunStats;
import io.github.yok.flexconfigure.remote.BatchExecutor;
import io.github.yok.flexconfigure.remote.DesigntimeConfigurationApi;
import io.github.yok.flexconfigure.remote.RuntimeArtifactApi;
import java.io.File;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the configure command: load, configure, then deploy.
 *
 * <p>
 * <strong>Phases:</strong>
 * </p>
 * <ol>
 * <li>Configuration: single-threaded, see {@link ArtifactConfigurator}.</li>
 * <li>Deployment: starts only after phase 1 completed, and only if tasks were queued and this is
 * not a dry run; see {@link DeploymentScheduler}.</li>
 * </ol>
 *
 * <p>
 * Failures of single artifacts or deployments never abort the run; they are counted in
 * {@link RunStats} and reported by {@link RunStats#hasFailures()} at the end.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ConfigureRunner {

    private static final String RULE = "=".repeat(72);

    // Options already validated and normalized
    private final ConfigureOptions options;

    private final DesigntimeConfigurationApi configurationApi;
    private final BatchExecutor batchExecutor;
    private final RuntimeArtifactApi runtimeApi;

    private final ConfigLoader loader;
    private final RunSummaryReporter reporter;

    /**
     * Creates a runner.
     *
     * @param options validated run options
     * @param configurationApi designtime configuration capability
     * @param batchExecutor batch capability
     * @param runtimeApi deployment and runtime status capability
     */
    public ConfigureRunner(ConfigureOptions options, DesigntimeConfigurationApi configurationApi,
            BatchExecutor batchExecutor, RuntimeArtifactApi runtimeApi) {
        this(options, configurationApi, batchExecutor, runtimeApi, new ConfigLoader(),
                new RunSummaryReporter());
    }

    ConfigureRunner(ConfigureOptions options, DesigntimeConfigurationApi configurationApi,
            BatchExecutor batchExecutor, RuntimeArtifactApi runtimeApi, ConfigLoader loader,
            RunSummaryReporter reporter) {
        this.options = options;
        this.configurationApi = configurationApi;
        this.batchExecutor = batchExecutor;
        this.runtimeApi = runtimeApi;
        this.loader = loader;
        this.reporter = reporter;
    }

    /**
     * Executes the run.
     *
     * @return statistics of the run
     * @throws ConfigLoadException if no configuration source could be loaded
     * @throws IllegalArgumentException if the effective deployment prefix is malformed
     */
    public RunStats execute() throws ConfigLoadException {
        log.info("Starting artifact configuration");
        DeploymentPrefix.validate(options.getDeploymentPrefix());
        ArtifactFilter filter =
                ArtifactFilter.parse(options.getPackageFilter(), options.getArtifactFilter());

        log.info("Loading configuration from: {}", options.getConfigPath());
        List<LoadedConfig> loaded = loader.load(new File(options.getConfigPath()));
        log.info("Loaded {} configuration file(s)", loaded.size());

        ConfigureConfig config = loader.merge(loaded, options.getDeploymentPrefix());
        DeploymentPrefix.validate(config.getDeploymentPrefix());

        log.info("Deployment prefix: {}", config.getDeploymentPrefix());
        log.info("Dry run: {}", options.isDryRun());
        log.info("Batch processing: {} (size: {})", !options.isDisableBatch(),
                options.getBatchSize());

        RunStats stats = new RunStats();

        banner("PHASE 1: CONFIGURING ARTIFACTS");
        ParameterUpdater updater = new ParameterUpdater(configurationApi, batchExecutor,
                options.getBatchSize(), options.isDisableBatch());
        List<DeploymentTask> tasks =
                new ArtifactConfigurator(updater, filter, options.isDryRun())
                        .configureAll(config, stats);

        if (!tasks.isEmpty() && !options.isDryRun()) {
            banner("PHASE 2: DEPLOYING CONFIGURED ARTIFACTS");
            log.info("Deploying {} artifact(s) with max {} parallel deployments per package",
                    tasks.size(), options.getParallelDeployments());
            ArtifactDeployer deployer = new ArtifactDeployer(runtimeApi,
                    options.getDeployRetries(), options.getDeployDelaySeconds());
            new DeploymentScheduler(deployer, options.getParallelDeployments()).deployAll(tasks,
                    stats);
        }

        reporter.report(stats, options.isDryRun());
        return stats;
    }

    private void banner(String title) {
        log.info("");
        log.info(RULE);
        log.info(title);
        log.info(RULE);
    }
}
