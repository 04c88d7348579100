package io.synclane.sync;

import io.synclane.lfs.HttpLfsTransport;
import io.synclane.observability.SensitiveDataMasker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;

/**
 * Reachability check ahead of fetch: HEAD for http(s), a TCP connect for ssh, existence for local paths.
 */
public final class RemoteConnectivityProbe implements ConnectivityProbe {
    private static final Logger logger = LoggerFactory.getLogger(RemoteConnectivityProbe.class);
    private static final int SSH_PORT = 22;

    private final HttpClient http;
    private final Duration timeout;

    public RemoteConnectivityProbe(Duration timeout) {
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public boolean isReachable(String remoteUrl) {
        if (remoteUrl == null || remoteUrl.isBlank()) {
            return false;
        }
        String lower = remoteUrl.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return probeHttp(HttpLfsTransport.stripCredentials(remoteUrl));
        }
        if (lower.startsWith("file://")) {
            return Files.exists(Paths.get(URI.create(remoteUrl)));
        }
        if (lower.startsWith("ssh://")) {
            URI uri = URI.create(remoteUrl);
            return probeSocket(uri.getHost(), uri.getPort() > 0 ? uri.getPort() : SSH_PORT);
        }
        int colon = remoteUrl.indexOf(':');
        int at = remoteUrl.indexOf('@');
        if (at >= 0 && colon > at) {
            return probeSocket(remoteUrl.substring(at + 1, colon), SSH_PORT);
        }
        try {
            return Files.exists(Path.of(remoteUrl));
        } catch (InvalidPathException e) {
            logger.debug("Remote {} is neither a URL nor a path", SensitiveDataMasker.maskUrl(remoteUrl));
            return false;
        }
    }

    private boolean probeHttp(String url) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build();
        try {
            HttpResponse<Void> response = http.send(request, HttpResponse.BodyHandlers.discarding());
            logger.debug("Connectivity probe {} -> {}", url, response.statusCode());
            return true;
        } catch (IOException e) {
            logger.info("Remote {} unreachable: {}", url, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean probeSocket(String host, int port) {
        if (host == null || host.isBlank()) {
            return false;
        }
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) Math.max(1L, timeout.toMillis()));
            return true;
        } catch (IOException e) {
            logger.info("Remote {}:{} unreachable: {}", host, port, e.getMessage());
            return false;
        }
    }
}
