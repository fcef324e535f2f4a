package io.github.yok.flexconfigure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code tenant} section in {@code application.yml}.
 *
 * <pre>
 * tenant:
 *   host: https://my-tenant.example.com
 *   username: ${TENANT_USER}
 *   password: ${TENANT_PASSWORD}
 *   timeout-seconds: 60
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "tenant")
@Data
public class TenantConfig {

    public static final int DEFAULT_TIMEOUT_SECONDS = 60;

    // Base URL of the tenant API, without trailing /api/v1
    private String host;

    // User for basic authentication
    private String username;

    // Password for basic authentication
    private String password;

    // Timeout of a single HTTP request
    private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
}
