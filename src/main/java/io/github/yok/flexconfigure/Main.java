package io.github.yok.flexconfigure;

import io.github.yok.flexconfigure.config.ConfigureOptions;
import io.github.yok.flexconfigure.config.ConfigureOptionsValidator;
import io.github.yok.flexconfigure.config.TenantConfig;
import io.github.yok.flexconfigure.core.ConfigLoadException;
import io.github.yok.flexconfigure.core.ConfigureRunner;
import io.github.yok.flexconfigure.model.RunStats;
import io.github.yok.flexconfigure.remote.http.HttpBatchExecutor;
import io.github.yok.flexconfigure.remote.http.HttpTenantClient;
import io.github.yok.flexconfigure.util.ErrorHandler;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options, applies them on top of the {@code configure} section of
 * {@code application.yml}, and invokes {@link ConfigureRunner}.
 * </p>
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --config-path path} or {@code -c path}: configuration file or directory.</li>
 * <li>{@code --deployment-prefix prefix} or {@code -p prefix}: overrides the declared prefix.</li>
 * <li>{@code --package-filter ids} / {@code --artifact-filter ids}: comma-separated ids to
 * include.</li>
 * <li>{@code --dry-run}: report only, no remote call.</li>
 * <li>{@code --deploy-retries n}, {@code --deploy-delay seconds},
 * {@code --parallel-deployments n}, {@code --batch-size n}: tuning, {@code 0} means default.</li>
 * <li>{@code --disable-batch}: update parameters one request at a time.</li>
 * </ul>
 *
 * <p>
 * The exit status is {@code 0} on success and {@code 1} when the run could not start or any
 * artifact or deployment failed.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see ConfigureOptions
 * @see TenantConfig
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ConfigureOptions.class, TenantConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final ConfigureOptions options;
    private final TenantConfig tenantConfig;

    private int exitCode = ErrorHandler.EXIT_SUCCESS;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        try {
            applyArguments(args);
            new ConfigureOptionsValidator().validateAndNormalize(options);
        } catch (IllegalArgumentException e) {
            exitCode = ErrorHandler.errorAndExit("Invalid options: " + e.getMessage());
            return;
        }

        log.info("Config path: {}, Prefix override: [{}], Dry run: {}", options.getConfigPath(),
                options.getDeploymentPrefix(), options.isDryRun());

        try {
            HttpTenantClient client = new HttpTenantClient(tenantConfig);
            RunStats stats = new ConfigureRunner(options, client, new HttpBatchExecutor(client),
                    client).execute();
            if (stats.hasFailures()) {
                log.error("Configure run finished with failures");
                exitCode = ErrorHandler.EXIT_FAILURE;
            } else {
                log.info("Configure run completed");
            }
        } catch (ConfigLoadException | IllegalArgumentException e) {
            exitCode = ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void applyArguments(String... args) {
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config-path":
                case "-c":
                    options.setConfigPath(value(args, ++i));
                    break;
                case "--deployment-prefix":
                case "-p":
                    options.setDeploymentPrefix(value(args, ++i));
                    break;
                case "--package-filter":
                    options.setPackageFilter(value(args, ++i));
                    break;
                case "--artifact-filter":
                    options.setArtifactFilter(value(args, ++i));
                    break;
                case "--dry-run":
                    options.setDryRun(true);
                    break;
                case "--deploy-retries":
                    options.setDeployRetries(intValue(args, ++i));
                    break;
                case "--deploy-delay":
                    options.setDeployDelaySeconds(intValue(args, ++i));
                    break;
                case "--parallel-deployments":
                    options.setParallelDeployments(intValue(args, ++i));
                    break;
                case "--batch-size":
                    options.setBatchSize(intValue(args, ++i));
                    break;
                case "--disable-batch":
                    options.setDisableBatch(true);
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }
    }

    private static String value(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException(args[index - 1] + " requires a value");
        }
        return args[index];
    }

    private static int intValue(String[] args, int index) {
        String value = value(args, index);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    args[index - 1] + " must be an integer: " + value, e);
        }
    }
}
