package com.tidewatch.data.http;

import com.tidewatch.core.error.FetchException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Thin wrapper over {@link HttpClient} with bounded retries on network errors.
 * <p>
 * HTTP error statuses are not retried. Backoff doubles per attempt, capped at 10 seconds.
 */
public class HttpClientEx {
    private static final Logger LOG = LogManager.getLogger(HttpClientEx.class);
    private static final long MAX_BACKOFF_MS = 10_000L;

    private final HttpClient client;
    private final int timeoutSeconds;
    private final int maxAttempts;
    private final long baseBackoffMs;

    public HttpClientEx(int timeoutSeconds, int maxAttempts) {
        this(timeoutSeconds, maxAttempts, 1000L);
    }

    protected HttpClientEx(int timeoutSeconds, int maxAttempts, long baseBackoffMs) {
        this.timeoutSeconds = Math.max(1, timeoutSeconds);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseBackoffMs = Math.max(0L, baseBackoffMs);
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(this.timeoutSeconds))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public String getText(String url) throws FetchException {
        IOException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return sendOnce(url);
            } catch (IOException e) {
                last = e;
                LOG.debug("GET attempt {}/{} failed for {}: {}", attempt, maxAttempts, redact(url), e.getMessage());
                if (attempt < maxAttempts) {
                    backoff(attempt, url);
                }
            }
        }
        String message = "GET " + redact(url) + " failed after " + maxAttempts + " attempt(s)";
        if (last instanceof HttpTimeoutException) {
            throw FetchException.timeout(message, last);
        }
        throw new FetchException(message, last);
    }

    private String sendOnce(String url) throws IOException, FetchException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .GET()
                .header("User-Agent", "TideWatch/1.0")
                .header("Accept", "application/json")
                .build();
        HttpResponse<String> resp;
        try {
            resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("GET " + redact(url) + " interrupted", e);
        }
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) {
            return resp.body();
        }
        throw new FetchException("HTTP " + resp.statusCode() + " for " + redact(url));
    }

    private void backoff(int attempt, String url) throws FetchException {
        long sleepMs = Math.min(MAX_BACKOFF_MS, baseBackoffMs * (1L << (attempt - 1)));
        if (sleepMs <= 0) {
            return;
        }
        try {
            Thread.sleep(sleepMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("GET " + redact(url) + " interrupted during backoff", e);
        }
    }

    /**
     * Strips the query string so tokens never reach the logs.
     */
    static String redact(String url) {
        if (url == null) {
            return "";
        }
        int q = url.indexOf('?');
        return q < 0 ? url : url.substring(0, q) + "?***";
    }
}
