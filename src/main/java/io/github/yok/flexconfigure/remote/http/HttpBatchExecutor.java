package io.github.yok.flexconfigure.remote.http;

import io.github.yok.flexconfigure.remote.BatchTransportException;
import io.github.yok.flexconfigure.remote.ChunkedBatchExecutor;
import io.github.yok.flexconfigure.remote.OperationResult;
import io.github.yok.flexconfigure.remote.ParameterOperation;
import io.github.yok.flexconfigure.remote.RemoteApiException;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends parameter updates as OData {@code $batch} requests.
 *
 * <p>
 * Every operation is wrapped in its own changeset, so one failing update does not roll back the
 * others. The status lines of the multipart response are matched to the operations in order.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class HttpBatchExecutor extends ChunkedBatchExecutor {

    private static final String CRLF = "\r\n";

    private static final Pattern STATUS_LINE =
            Pattern.compile("^HTTP/1\\.1 (\\d{3})", Pattern.MULTILINE);

    private final HttpTenantClient client;

    public HttpBatchExecutor(HttpTenantClient client) {
        this.client = client;
    }

    @Override
    protected List<OperationResult> executeChunk(List<ParameterOperation> chunk)
            throws BatchTransportException {
        String boundary = "batch_" + UUID.randomUUID();
        HttpResponse<String> response;
        try {
            String body = buildBody(boundary, chunk);
            response = client.send("POST", "/$batch", "multipart/mixed; boundary=" + boundary,
                    body);
        } catch (RemoteApiException e) {
            throw new BatchTransportException("Batch request failed: " + e.getMessage(), e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new BatchTransportException("Batch request returned HTTP " + status);
        }

        List<Integer> statuses = parseStatuses(response.body());
        log.debug("Batch of {} operations returned {} part responses", chunk.size(),
                statuses.size());
        List<OperationResult> results = new ArrayList<>(chunk.size());
        for (int i = 0; i < chunk.size(); i++) {
            ParameterOperation op = chunk.get(i);
            if (i < statuses.size()) {
                int code = statuses.get(i);
                results.add(new OperationResult(op, code,
                        code >= 200 && code < 300 ? null : "HTTP " + code));
            } else {
                results.add(new OperationResult(op, 0, "no response for operation"));
            }
        }
        return results;
    }

    String buildBody(String boundary, List<ParameterOperation> chunk)
            throws RemoteApiException {
        StringBuilder sb = new StringBuilder();
        int contentId = 1;
        for (ParameterOperation op : chunk) {
            String changeset = "changeset_" + UUID.randomUUID();
            sb.append("--").append(boundary).append(CRLF)
                    .append("Content-Type: multipart/mixed; boundary=").append(changeset)
                    .append(CRLF).append(CRLF);
            sb.append("--").append(changeset).append(CRLF)
                    .append("Content-Type: application/http").append(CRLF)
                    .append("Content-Transfer-Encoding: binary").append(CRLF)
                    .append("Content-ID: ").append(contentId++).append(CRLF).append(CRLF);
            // Request path is relative to the service root
            sb.append("PUT ")
                    .append(HttpTenantClient.configurationPath(op.getArtifactId(),
                            op.getVersion(), op.getKey()).substring(1))
                    .append(" HTTP/1.1").append(CRLF)
                    .append("Content-Type: application/json").append(CRLF)
                    .append("Accept: application/json").append(CRLF).append(CRLF)
                    .append(client.parameterBody(op.getValue())).append(CRLF);
            sb.append("--").append(changeset).append("--").append(CRLF);
        }
        sb.append("--").append(boundary).append("--").append(CRLF);
        return sb.toString();
    }

    static List<Integer> parseStatuses(String body) {
        List<Integer> statuses = new ArrayList<>();
        if (body == null) {
            return statuses;
        }
        Matcher matcher = STATUS_LINE.matcher(body);
        while (matcher.find()) {
            statuses.add(Integer.parseInt(matcher.group(1)));
        }
        return statuses;
    }
}
