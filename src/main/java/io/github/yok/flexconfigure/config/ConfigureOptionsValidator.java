package io.github.yok.flexconfigure.config;

import io.github.yok.flexconfigure.core.DeploymentPrefix;
import org.apache.commons.lang3.StringUtils;

/**
 * Validates run options and fills defaults before any processing starts.
 *
 * <p>
 * Zero-valued numeric options are replaced by their defaults. Negative values, a missing
 * configuration path, and a malformed deployment prefix are rejected so the run can fail before
 * anything is loaded.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ConfigureOptionsValidator {

    /**
     * Validates options and fills default values in place.
     *
     * @param options run options
     * @throws IllegalArgumentException if an option is missing or invalid
     */
    public void validateAndNormalize(ConfigureOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("Configure options are required.");
        }
        if (StringUtils.isBlank(options.getConfigPath())) {
            throw new IllegalArgumentException(
                    "--config-path is required (set via CLI flag or configure.config-path)");
        }
        options.setConfigPath(options.getConfigPath().trim());

        options.setDeployRetries(positiveOrDefault("deploy-retries", options.getDeployRetries(),
                ConfigureOptions.DEFAULT_DEPLOY_RETRIES));
        options.setDeployDelaySeconds(positiveOrDefault("deploy-delay",
                options.getDeployDelaySeconds(), ConfigureOptions.DEFAULT_DEPLOY_DELAY_SECONDS));
        options.setParallelDeployments(positiveOrDefault("parallel-deployments",
                options.getParallelDeployments(), ConfigureOptions.DEFAULT_PARALLEL_DEPLOYMENTS));
        options.setBatchSize(positiveOrDefault("batch-size", options.getBatchSize(),
                ConfigureOptions.DEFAULT_BATCH_SIZE));

        options.setDeploymentPrefix(StringUtils.trimToEmpty(options.getDeploymentPrefix()));
        DeploymentPrefix.validate(options.getDeploymentPrefix());
        options.setPackageFilter(StringUtils.trimToEmpty(options.getPackageFilter()));
        options.setArtifactFilter(StringUtils.trimToEmpty(options.getArtifactFilter()));
    }

    private int positiveOrDefault(String name, int value, int defaultValue) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
        return value == 0 ? defaultValue : value;
    }
}
