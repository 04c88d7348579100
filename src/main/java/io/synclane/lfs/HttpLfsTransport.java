package io.synclane.lfs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.synclane.config.SyncSettings;
import io.synclane.model.Credentials;
import io.synclane.model.PointerRecord;
import io.synclane.model.TransferDescriptor;
import io.synclane.model.TransferDirection;
import io.synclane.observability.SensitiveDataMasker;
import io.synclane.util.Jsons;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Git LFS batch API client: one POST to negotiate, then direct GET/PUT against the returned hrefs.
 */
public final class HttpLfsTransport implements LfsTransport {
    static final String LFS_MEDIA_TYPE = "application/vnd.git-lfs+json";
    private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host", "upgrade");
    private static final Duration TRANSFER_TIMEOUT = Duration.ofMinutes(10);

    private final HttpClient http;
    private final URI batchEndpoint;
    private final Credentials credentials;
    private final Duration requestTimeout;

    public HttpLfsTransport(URI batchEndpoint, Credentials credentials, Duration connectTimeout) {
        this.http = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.batchEndpoint = batchEndpoint;
        this.credentials = credentials == null ? Credentials.none() : credentials;
        this.requestTimeout = connectTimeout.multipliedBy(6);
    }

    /**
     * Transport for an http(s) remote, or {@code null} for remotes that carry no LFS endpoint
     * (local paths, ssh).
     */
    public static HttpLfsTransport forRemote(String remoteUrl, Credentials credentials, SyncSettings settings) {
        String endpoint = settings.lfsEndpoint() != null && !settings.lfsEndpoint().isBlank()
                ? settings.lfsEndpoint()
                : batchEndpoint(remoteUrl);
        if (endpoint == null) {
            return null;
        }
        return new HttpLfsTransport(URI.create(endpoint), credentials, Duration.ofMillis(settings.connectTimeoutMs()));
    }

    public static String batchEndpoint(String remoteUrl) {
        if (remoteUrl == null) {
            return null;
        }
        String lower = remoteUrl.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            return null;
        }
        String base = stripCredentials(remoteUrl.trim());
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        if (!base.endsWith(".git")) {
            base = base + ".git";
        }
        return base + "/info/lfs/objects/batch";
    }

    public static String stripCredentials(String url) {
        return url == null ? null : url.replaceFirst("(?i)^(https?://)[^@/]*@", "$1");
    }

    @Override
    public BatchResponse batch(TransferDirection direction, List<PointerRecord> objects) throws TransferException {
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.put("operation", direction.operation());
        body.putArray("transfers").add("basic");
        ArrayNode items = body.putArray("objects");
        for (PointerRecord object : objects) {
            items.addObject().put("oid", object.oid()).put("size", object.size());
        }
        HttpRequest.Builder request = HttpRequest.newBuilder(batchEndpoint)
                .timeout(requestTimeout)
                .header("Accept", LFS_MEDIA_TYPE)
                .header("Content-Type", LFS_MEDIA_TYPE)
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(body), StandardCharsets.UTF_8));
        authorize(request);
        HttpResponse<String> response = send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8), "batch");
        if (response.statusCode() / 100 != 2) {
            throw TransferException.forStatus("LFS batch " + SensitiveDataMasker.maskUrl(batchEndpoint.toString()), response.statusCode());
        }
        try {
            return parseBatch(direction, Jsons.mapper().readTree(response.body()));
        } catch (IOException e) {
            throw new TransferException("LFS batch response is not valid JSON", 0, false);
        }
    }

    static BatchResponse parseBatch(TransferDirection direction, JsonNode root) {
        List<TransferDescriptor> descriptors = new ArrayList<>();
        List<ObjectError> errors = new ArrayList<>();
        for (JsonNode object : root.path("objects")) {
            String oid = object.path("oid").asText("");
            long size = object.path("size").asLong(0L);
            JsonNode error = object.path("error");
            if (error.isObject()) {
                errors.add(new ObjectError(oid, error.path("code").asInt(0), error.path("message").asText("")));
                continue;
            }
            JsonNode action = object.path("actions").path(direction.operation());
            if (!action.isObject() || action.path("href").asText("").isBlank()) {
                continue;
            }
            Map<String, String> headers = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = action.path("header").fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> header = it.next();
                headers.put(header.getKey(), header.getValue().asText(""));
            }
            descriptors.add(new TransferDescriptor(oid, size, direction, action.path("href").asText(), headers));
        }
        return new BatchResponse(descriptors, errors);
    }

    @Override
    public void download(TransferDescriptor descriptor, Path target) throws TransferException {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(descriptor.url()))
                .timeout(TRANSFER_TIMEOUT)
                .GET();
        applyHeaders(request, descriptor);
        HttpResponse<Path> response = send(request.build(), HttpResponse.BodyHandlers.ofFile(target), "download " + descriptor.oid());
        if (response.statusCode() / 100 != 2) {
            throw TransferException.forStatus("Download of " + descriptor.oid(), response.statusCode());
        }
    }

    @Override
    public void upload(TransferDescriptor descriptor, Path source) throws TransferException {
        HttpRequest.BodyPublisher body;
        try {
            body = HttpRequest.BodyPublishers.ofFile(source);
        } catch (FileNotFoundException e) {
            throw new TransferException("Payload for " + descriptor.oid() + " is missing: " + source, 0, false);
        }
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(descriptor.url()))
                .timeout(TRANSFER_TIMEOUT)
                .PUT(body);
        if (descriptor.headers().keySet().stream().noneMatch(name -> name.equalsIgnoreCase("Content-Type"))) {
            request.header("Content-Type", "application/octet-stream");
        }
        applyHeaders(request, descriptor);
        HttpResponse<String> response = send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8), "upload " + descriptor.oid());
        if (response.statusCode() / 100 != 2) {
            throw TransferException.forStatus("Upload of " + descriptor.oid(), response.statusCode());
        }
    }

    private void applyHeaders(HttpRequest.Builder request, TransferDescriptor descriptor) {
        boolean hasAuthorization = false;
        for (Map.Entry<String, String> header : descriptor.headers().entrySet()) {
            String name = header.getKey().toLowerCase(Locale.ROOT);
            if (RESTRICTED_HEADERS.contains(name)) {
                continue;
            }
            hasAuthorization |= name.equals("authorization");
            request.header(header.getKey(), header.getValue());
        }
        if (!hasAuthorization && sameOrigin(URI.create(descriptor.url()))) {
            authorize(request);
        }
    }

    private boolean sameOrigin(URI target) {
        return target.getHost() != null
                && target.getHost().equalsIgnoreCase(batchEndpoint.getHost())
                && target.getPort() == batchEndpoint.getPort();
    }

    private void authorize(HttpRequest.Builder request) {
        if (!credentials.isPresent()) {
            return;
        }
        String token = credentials.username() + ":" + (credentials.password() == null ? "" : credentials.password());
        request.header("Authorization", "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8)));
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler, String operation)
            throws TransferException {
        try {
            return http.send(request, handler);
        } catch (IOException e) {
            throw new TransferException("LFS " + operation + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferException("LFS " + operation + " interrupted", 0, false);
        }
    }
}
