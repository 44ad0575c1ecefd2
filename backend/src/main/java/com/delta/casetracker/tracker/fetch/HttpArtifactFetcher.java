package com.delta.casetracker.tracker.fetch;

import com.delta.casetracker.config.TrackerProperties;
import com.delta.casetracker.tracker.util.PathUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;

/**
 * Retrieves case document bundles from an HTTP endpoint at {@code <base-url>/<case id>}. The size probe is a HEAD
 * request reading Content-Length; materialization streams the body into the artifact directory and stops as soon
 * as it passes the configured size limit.
 */
@Service
public class HttpArtifactFetcher implements ArtifactFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpArtifactFetcher.class);
    private static final int BUFFER_SIZE = 64 * 1024;

    private final TrackerProperties properties;
    private final HttpClient client;

    public HttpArtifactFetcher(TrackerProperties properties, HttpClient artifactHttpClient) {
        this.properties = properties;
        this.client = artifactHttpClient;
    }

    @Override
    public ArtifactProbeResult probeSize(String caseId) {
        URI uri = artifactUri(caseId);
        if (uri == null) {
            return ArtifactProbeResult.failed(caseId, "fetch_not_configured", "tracker.fetch.base-url is not set");
        }
        HttpRequest request = baseRequest(uri)
            .method("HEAD", HttpRequest.BodyPublishers.noBody())
            .build();
        try {
            HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                return ArtifactProbeResult.failed(caseId, "http_" + response.statusCode(), "size probe rejected");
            }
            OptionalLong length = response.headers().firstValueAsLong("Content-Length");
            if (length.isEmpty() || length.getAsLong() < 0) {
                return ArtifactProbeResult.failed(caseId, "no_content_length", "size probe returned no Content-Length");
            }
            return ArtifactProbeResult.ofSize(caseId, length.getAsLong());
        } catch (HttpTimeoutException e) {
            return ArtifactProbeResult.failed(caseId, "timeout", e.getMessage());
        } catch (IOException e) {
            return ArtifactProbeResult.failed(caseId, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ArtifactProbeResult.failed(caseId, "interrupted", e.getMessage());
        }
    }

    @Override
    public ArtifactFetchResult materialize(String caseId) {
        Instant startedAt = Instant.now();
        URI uri = artifactUri(caseId);
        if (uri == null) {
            return ArtifactFetchResult.failed(caseId, startedAt, "fetch_not_configured", "tracker.fetch.base-url is not set");
        }
        long maxBytes = properties.getLimits().getMaxArtifactSizeBytes();
        Path directory = PathUtils.resolve(properties.getFetch().getArtifactDir());
        Path target = directory.resolve(safeFileName(caseId) + ".pdf");
        Path temp = null;
        try {
            Files.createDirectories(directory);
            HttpResponse<InputStream> response = client.send(baseRequest(uri).GET().build(), HttpResponse.BodyHandlers.ofInputStream());
            try (InputStream body = response.body()) {
                if (response.statusCode() < 200 || response.statusCode() >= 300) {
                    return ArtifactFetchResult.failed(caseId, startedAt, "http_" + response.statusCode(), "artifact request rejected");
                }
                temp = Files.createTempFile(directory, safeFileName(caseId) + ".", ".part");
                long written = copyWithLimit(body, temp, maxBytes);
                if (written < 0) {
                    return ArtifactFetchResult.failed(caseId, startedAt, "body_too_large", "artifact exceeded " + maxBytes + " bytes");
                }
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                temp = null;
                log.info("Stored artifact for case {} ({} bytes) at {}", caseId, written, target);
                return ArtifactFetchResult.stored(caseId, target, written, startedAt);
            }
        } catch (HttpTimeoutException e) {
            return ArtifactFetchResult.failed(caseId, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return ArtifactFetchResult.failed(caseId, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ArtifactFetchResult.failed(caseId, startedAt, "interrupted", e.getMessage());
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    /**
     * Copies at most {@code maxBytes}; returns -1 when the stream is longer.
     */
    private long copyWithLimit(InputStream in, Path target, long maxBytes) throws IOException {
        long total = 0;
        byte[] buffer = new byte[BUFFER_SIZE];
        try (OutputStream out = Files.newOutputStream(target)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                total += read;
                if (total > maxBytes) {
                    return -1;
                }
                out.write(buffer, 0, read);
            }
        }
        return total;
    }

    private HttpRequest.Builder baseRequest(URI uri) {
        return HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getFetch().getRequestTimeoutSeconds()))
            .header("User-Agent", properties.getFetch().getUserAgent())
            .header("Accept", "application/pdf,*/*;q=0.8");
    }

    URI artifactUri(String caseId) {
        String baseUrl = properties.getFetch().getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            return null;
        }
        String trimmed = baseUrl.trim();
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        String encoded = URLEncoder.encode(caseId, StandardCharsets.UTF_8).replace("+", "%20");
        return URI.create(trimmed + "/" + encoded);
    }

    static String safeFileName(String caseId) {
        String cleaned = caseId.replaceAll("[^A-Za-z0-9._-]", "_");
        return cleaned.isBlank() ? "case" : cleaned;
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete partial artifact {}", path, e);
        }
    }
}
