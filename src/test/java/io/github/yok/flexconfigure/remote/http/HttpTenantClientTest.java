package io.github.yok.flexconfigure.remote.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.flexconfigure.config.TenantConfig;
import io.github.yok.flexconfigure.model.ArtifactType;
import io.github.yok.flexconfigure.remote.RemoteApiException;
import io.github.yok.flexconfigure.remote.RuntimeStatus;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpTenantClientTest {

    private TenantConfig tenant;
    private HttpClient httpClient;
    private List<HttpRequest> requests;
    private HttpTenantClient client;

    @BeforeEach
    void setup() {
        tenant = new TenantConfig();
        tenant.setHost("https://tenant.example.org/");
        tenant.setUsername("user");
        tenant.setPassword("secret");
        httpClient = mock(HttpClient.class);
        requests = new ArrayList<>();
        client = new HttpTenantClient(tenant, httpClient, new ObjectMapper());
    }

    private static HttpResponse<String> response(int status, String body) {
        return new StubResponse(status, body);
    }

    private void answer(Function<HttpRequest, HttpResponse<String>> handler) throws Exception {
        doAnswer(inv -> {
            HttpRequest request = inv.getArgument(0);
            requests.add(request);
            return handler.apply(request);
        }).when(httpClient).send(any(HttpRequest.class), any());
    }

    private static HttpResponse<String> csrfOr(HttpRequest request, HttpResponse<String> other) {
        if (request.uri().getPath().equals("/api/v1/")) {
            return new StubResponse(200, "", Map.of("X-CSRF-Token", List.of("token-1")));
        }
        return other;
    }

    @Test
    void getParameters_正常ケース_設定一覧を受信する_キーと値のマップが返ること() throws Exception {
        answer(request -> response(200, "{\"d\":{\"results\":["
                + "{\"ParameterKey\":\"url\",\"ParameterValue\":\"https://a\"},"
                + "{\"ParameterKey\":\"timeout\",\"ParameterValue\":\"30\"}]}}"));

        Map<String, String> parameters = client.getParameters("DEV_Flow1", "active");

        assertEquals(Map.of("url", "https://a", "timeout", "30"), parameters);
        HttpRequest request = requests.get(0);
        assertEquals("GET", request.method());
        assertEquals("/api/v1/IntegrationDesigntimeArtifacts(Id='DEV_Flow1',Version='active')"
                + "/Configurations", request.uri().getPath());
        assertTrue(request.headers().firstValue("Authorization").orElseThrow()
                .startsWith("Basic "));
    }

    @Test
    void updateParameter_正常ケース_更新する_CSRFトークン取得後にPUTされること() throws Exception {
        answer(request -> csrfOr(request, response(204, "")));

        client.updateParameter("DEV_Flow1", "active", "url", "https://b");
        client.updateParameter("DEV_Flow1", "active", "timeout", "60");

        assertEquals(3, requests.size());
        assertEquals("Fetch", requests.get(0).headers().firstValue("X-CSRF-Token").orElseThrow());
        HttpRequest put = requests.get(1);
        assertEquals("PUT", put.method());
        assertEquals("token-1", put.headers().firstValue("X-CSRF-Token").orElseThrow());
        assertTrue(put.uri().getPath().endsWith("/$links/Configurations('url')"));
        assertEquals("PUT", requests.get(2).method());
    }

    @Test
    void updateParameter_異常ケース_404を受信する_RemoteApiExceptionが送出されること()
            throws Exception {
        answer(request -> csrfOr(request, response(404, "not found")));

        RemoteApiException ex = assertThrows(RemoteApiException.class,
                () -> client.updateParameter("Flow1", "active", "missing", "x"));
        assertTrue(ex.getMessage().contains("404"));
    }

    @Test
    void updateParameter_正常ケース_CSRFトークンが拒否される_再取得して再送されること()
            throws Exception {
        int[] puts = {0};
        answer(request -> {
            if (!"PUT".equals(request.method())) {
                return csrfOr(request, null);
            }
            puts[0]++;
            return puts[0] == 1
                    ? new StubResponse(403, "", Map.of("X-CSRF-Token", List.of("Required")))
                    : response(204, "");
        });

        client.updateParameter("Flow1", "active", "url", "x");

        assertEquals(2, puts[0]);
        assertEquals(4, requests.size());
    }

    @Test
    void deploy_正常ケース_種別を指定する_種別ごとのエンドポイントへPOSTされること() throws Exception {
        answer(request -> csrfOr(request, response(202, "")));

        client.deploy("DEV_Map1", ArtifactType.MESSAGE_MAPPING);

        HttpRequest post = requests.get(1);
        assertEquals("POST", post.method());
        assertEquals("/api/v1/DeployMessageMappingDesigntimeArtifact", post.uri().getPath());
        assertEquals("Id='DEV_Map1'&Version='active'", post.uri().getQuery());
    }

    @Test
    void getStatus_正常ケース_実行時情報を受信する_状態が変換されること() throws Exception {
        answer(request -> response(200,
                "{\"d\":{\"Version\":\"1.0.2\",\"Status\":\"STARTING\"}}"));

        RuntimeStatus status = client.getStatus("DEV_Flow1");

        assertEquals("1.0.2", status.getVersion());
        assertEquals(RuntimeStatus.State.STARTING, status.getState());
        assertEquals("/api/v1/IntegrationRuntimeArtifacts('DEV_Flow1')",
                requests.get(0).uri().getPath());
    }

    @Test
    void getStatus_正常ケース_404を受信する_未表示状態となること() throws Exception {
        answer(request -> response(404, ""));

        assertEquals(RuntimeStatus.State.NOT_YET_VISIBLE, client.getStatus("Flow1").getState());
    }

    @Test
    void getErrorInfo_正常ケース_JSONのparameter配列を受信する_連結されて返ること() throws Exception {
        answer(request -> response(200,
                "{\"message\":\"x\",\"parameter\":[\"Adapter failed\",\"Invalid URL\"]}"));

        assertEquals("Adapter failed; Invalid URL", client.getErrorInfo("Flow1"));
        assertTrue(requests.get(0).uri().getPath().endsWith("/ErrorInformation/$value"));
    }

    @Test
    void getErrorInfo_正常ケース_JSON以外を受信する_本文がそのまま返ること() throws Exception {
        answer(request -> response(200, "  plain failure text \n"));

        assertEquals("plain failure text", client.getErrorInfo("Flow1"));
    }

    @Test
    void getStatus_異常ケース_通信に失敗する_RemoteApiExceptionが送出されること() throws Exception {
        doThrow(new IOException("connection refused")).when(httpClient).send(any(), any());

        RemoteApiException ex =
                assertThrows(RemoteApiException.class, () -> client.getStatus("Flow1"));
        assertTrue(ex.getMessage().contains("connection refused"));
    }

    @Test
    void getParameters_異常ケース_ホスト未設定_RemoteApiExceptionが送出されること() {
        tenant.setHost(" ");

        assertThrows(RemoteApiException.class, () -> client.getParameters("Flow1", "active"));
    }

    @Test
    void quote_正常ケース_シングルクォートを含む値を指定する_二重化されること() {
        assertEquals("'it''s'", HttpTenantClient.quote("it's"));
        assertEquals("a%20b", HttpTenantClient.encode("a b"));
    }
}
