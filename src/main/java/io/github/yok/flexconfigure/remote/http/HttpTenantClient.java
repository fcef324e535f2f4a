package io.github.yok.flexconfigure.remote.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import io.github.yok.flexconfigure.config.TenantConfig;
import io.github.yok.flexconfigure.model.ArtifactType;
import io.github.yok.flexconfigure.remote.DesigntimeConfigurationApi;
import io.github.yok.flexconfigure.remote.RemoteApiException;
import io.github.yok.flexconfigure.remote.RuntimeArtifactApi;
import io.github.yok.flexconfigure.remote.RuntimeStatus;
import java.io.IOException;
import java.net.CookieManager;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.lang3.StringUtils;

/**
 * HTTP implementation of the designtime configuration and runtime capabilities of a tenant.
 *
 * <p>
 * Requests go to {@code {tenant.host}/api/v1} with basic authentication. Modifying requests carry
 * an {@code X-CSRF-Token} that is fetched once and fetched again when the tenant rejects it.
 * </p>
 *
 * <p>
 * Instances are thread-safe and shared by all deployment workers.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class HttpTenantClient implements DesigntimeConfigurationApi, RuntimeArtifactApi {

    static final String API_ROOT = "/api/v1";

    private static final String CSRF_HEADER = "X-CSRF-Token";

    // Deploy endpoint per artifact type
    private static final Map<ArtifactType, String> DEPLOY_ENDPOINTS = ImmutableMap.of(
            ArtifactType.INTEGRATION, "DeployIntegrationDesigntimeArtifact",
            ArtifactType.MESSAGE_MAPPING, "DeployMessageMappingDesigntimeArtifact",
            ArtifactType.SCRIPT_COLLECTION, "DeployScriptCollectionDesigntimeArtifact",
            ArtifactType.VALUE_MAPPING, "DeployValueMappingDesigntimeArtifact");

    private final TenantConfig tenant;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;

    // Token for modifying requests; null until fetched
    private volatile String csrfToken;

    public HttpTenantClient(TenantConfig tenant) {
        this(tenant, HttpClient.newBuilder()
                .connectTimeout(timeout(tenant))
                .cookieHandler(new CookieManager())
                .build(), new ObjectMapper());
    }

    HttpTenantClient(TenantConfig tenant, HttpClient httpClient, ObjectMapper mapper) {
        this.tenant = tenant;
        this.httpClient = httpClient;
        this.mapper = mapper;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Map<String, String> getParameters(String artifactId, String version)
            throws RemoteApiException {
        String path = designtimePath(artifactId, version) + "/Configurations";
        HttpResponse<String> response = send("GET", path, null, null);
        expectSuccess(response, "read configuration of " + artifactId);

        JsonNode results = readJson(response.body()).path("d").path("results");
        ImmutableMap.Builder<String, String> parameters = ImmutableMap.builder();
        for (JsonNode node : results) {
            parameters.put(node.path("ParameterKey").asText(),
                    node.path("ParameterValue").asText(""));
        }
        return parameters.buildKeepingLast();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void updateParameter(String artifactId, String version, String key, String value)
            throws RemoteApiException {
        HttpResponse<String> response = send("PUT", configurationPath(artifactId, version, key),
                "application/json", parameterBody(value));
        expectSuccess(response, "update parameter " + key + " of " + artifactId);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void deploy(String artifactId, ArtifactType type) throws RemoteApiException {
        String path = "/" + DEPLOY_ENDPOINTS.get(type) + "?Id=" + encode(quote(artifactId))
                + "&Version=" + encode(quote("active"));
        HttpResponse<String> response = send("POST", path, null, null);
        expectSuccess(response, "deploy " + artifactId);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public RuntimeStatus getStatus(String artifactId) throws RemoteApiException {
        String path = "/IntegrationRuntimeArtifacts(" + encode(quote(artifactId)) + ")";
        HttpResponse<String> response = send("GET", path, null, null);
        if (response.statusCode() == 404) {
            return RuntimeStatus.of(RuntimeStatus.NOT_DEPLOYED, "");
        }
        expectSuccess(response, "read runtime status of " + artifactId);

        JsonNode d = readJson(response.body()).path("d");
        return RuntimeStatus.of(d.path("Version").asText(""), d.path("Status").asText(""));
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public String getErrorInfo(String artifactId) throws RemoteApiException {
        String path = "/IntegrationRuntimeArtifacts(" + encode(quote(artifactId))
                + ")/ErrorInformation/$value";
        HttpResponse<String> response = send("GET", path, null, null);
        expectSuccess(response, "read error information of " + artifactId);

        String body = StringUtils.defaultString(response.body());
        try {
            JsonNode parameters = mapper.readTree(body).path("parameter");
            if (parameters.isArray() && parameters.size() > 0) {
                List<String> texts = new ArrayList<>();
                parameters.forEach(p -> texts.add(p.asText()));
                return String.join("; ", texts);
            }
        } catch (JsonProcessingException e) {
            log.debug("Error information of {} is not JSON, returning it as is", artifactId);
        }
        return body.trim();
    }

    /**
     * Sends a request below {@value #API_ROOT}.
     *
     * @param method HTTP method
     * @param path path relative to {@value #API_ROOT}, starting with {@code /}
     * @param contentType content type of the body, or {@code null}
     * @param body request body, or {@code null}
     * @return the response
     * @throws RemoteApiException on I/O failure, interruption or missing tenant settings
     */
    HttpResponse<String> send(String method, String path, String contentType, String body)
            throws RemoteApiException {
        boolean modifying = !"GET".equals(method);
        HttpResponse<String> response = sendOnce(method, path, contentType, body, modifying);
        if (modifying && response.statusCode() == 403
                && "required".equalsIgnoreCase(
                        response.headers().firstValue(CSRF_HEADER).orElse(""))) {
            log.debug("CSRF token rejected, fetching a new one");
            csrfToken = null;
            response = sendOnce(method, path, contentType, body, true);
        }
        return response;
    }

    private HttpResponse<String> sendOnce(String method, String path, String contentType,
            String body, boolean modifying) throws RemoteApiException {
        HttpRequest.Builder builder = request(path).header("Accept", "application/json");
        if (modifying) {
            builder.header(CSRF_HEADER, csrfToken());
        }
        if (contentType != null) {
            builder.header("Content-Type", contentType);
        }
        builder.method(method, body != null ? HttpRequest.BodyPublishers.ofString(body)
                : HttpRequest.BodyPublishers.noBody());
        return execute(builder.build());
    }

    private String csrfToken() throws RemoteApiException {
        String token = csrfToken;
        if (token != null) {
            return token;
        }
        synchronized (this) {
            if (csrfToken == null) {
                HttpResponse<String> response = execute(request("/")
                        .header(CSRF_HEADER, "Fetch").GET().build());
                expectSuccess(response, "fetch CSRF token");
                csrfToken = response.headers().firstValue(CSRF_HEADER).orElseThrow(
                        () -> new RemoteApiException("Tenant returned no CSRF token"));
            }
            return csrfToken;
        }
    }

    private HttpRequest.Builder request(String path) throws RemoteApiException {
        if (StringUtils.isBlank(tenant.getHost())) {
            throw new RemoteApiException("tenant.host is not configured");
        }
        String credentials = StringUtils.defaultString(tenant.getUsername()) + ":"
                + StringUtils.defaultString(tenant.getPassword());
        return HttpRequest.newBuilder()
                .uri(URI.create(StringUtils.removeEnd(tenant.getHost(), "/") + API_ROOT + path))
                .timeout(timeout(tenant))
                .header("Authorization", "Basic "
                        + Base64.encodeBase64String(credentials.getBytes(StandardCharsets.UTF_8)));
    }

    private HttpResponse<String> execute(HttpRequest request) throws RemoteApiException {
        try {
            log.debug("{} {}", request.method(), request.uri());
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RemoteApiException(
                    request.method() + " " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteApiException(request.method() + " " + request.uri() + " interrupted",
                    e);
        }
    }

    private JsonNode readJson(String body) throws RemoteApiException {
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RemoteApiException("Unexpected response body: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * JSON body that sets a parameter value.
     *
     * @param value parameter value
     * @return serialized body
     * @throws RemoteApiException if the value cannot be serialized
     */
    String parameterBody(String value) throws RemoteApiException {
        try {
            return mapper.writeValueAsString(ImmutableMap.of("ParameterValue", value));
        } catch (JsonProcessingException e) {
            throw new RemoteApiException("Cannot serialize parameter value", e);
        }
    }

    static void expectSuccess(HttpResponse<String> response, String action)
            throws RemoteApiException {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new RemoteApiException("Failed to " + action + ": HTTP " + status + " "
                    + StringUtils.abbreviate(StringUtils.defaultString(response.body()), 500));
        }
    }

    static String designtimePath(String artifactId, String version) {
        return "/IntegrationDesigntimeArtifacts(Id=" + encode(quote(artifactId)) + ",Version="
                + encode(quote(version)) + ")";
    }

    static String configurationPath(String artifactId, String version, String key) {
        return designtimePath(artifactId, version) + "/$links/Configurations("
                + encode(quote(key)) + ")";
    }

    static Duration timeout(TenantConfig tenant) {
        return Duration.ofSeconds(tenant.getTimeoutSeconds() > 0 ? tenant.getTimeoutSeconds()
                : TenantConfig.DEFAULT_TIMEOUT_SECONDS);
    }

    // OData string literal
    static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
