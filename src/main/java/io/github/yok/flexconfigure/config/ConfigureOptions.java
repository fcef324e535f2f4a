package io.github.yok.flexconfigure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code configure} section in {@code application.yml}.
 *
 * <p>
 * Command-line flags parsed by {@link io.github.yok.flexconfigure.Main} override these values.
 * A numeric value of {@code 0} means "use the default" and is normalized by
 * {@link ConfigureOptionsValidator}.
 * </p>
 *
 * <pre>
 * configure:
 *   config-path: ./config/dev
 *   deployment-prefix: DEV_
 *   deploy-retries: 5
 *   deploy-delay-seconds: 15
 *   parallel-deployments: 3
 *   batch-size: 90
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "configure")
@Data
public class ConfigureOptions {

    public static final int DEFAULT_DEPLOY_RETRIES = 5;
    public static final int DEFAULT_DEPLOY_DELAY_SECONDS = 15;
    public static final int DEFAULT_PARALLEL_DEPLOYMENTS = 3;
    public static final int DEFAULT_BATCH_SIZE = 90;

    /**
     * Configuration source: a single YAML/JSON file or a directory of them. Required.
     */
    private String configPath;

    /**
     * Deployment prefix. When set, it overrides the prefix declared in the sources.
     */
    private String deploymentPrefix;

    /**
     * Comma-separated package ids to include.
     */
    private String packageFilter;

    /**
     * Comma-separated artifact ids to include.
     */
    private String artifactFilter;

    /**
     * Only report what would be done; no remote call is made.
     */
    private boolean dryRun = false;

    /**
     * Maximum number of deployment status checks per artifact.
     */
    private int deployRetries = DEFAULT_DEPLOY_RETRIES;

    /**
     * Seconds to wait before each deployment status check.
     */
    private int deployDelaySeconds = DEFAULT_DEPLOY_DELAY_SECONDS;

    /**
     * Maximum number of concurrent deployments within one package.
     */
    private int parallelDeployments = DEFAULT_PARALLEL_DEPLOYMENTS;

    /**
     * Number of parameter operations per batch request, unless an artifact overrides it.
     */
    private int batchSize = DEFAULT_BATCH_SIZE;

    /**
     * Disable batch requests for every artifact.
     */
    private boolean disableBatch = false;
}
