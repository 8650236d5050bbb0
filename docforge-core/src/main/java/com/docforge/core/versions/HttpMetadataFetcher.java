package com.docforge.core.versions;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link MetadataFetcher} over the JDK HTTP client.
 */
public class HttpMetadataFetcher implements MetadataFetcher {

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpMetadataFetcher(Duration timeout) {
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
        this.requestTimeout = timeout;
    }

    @Override
    public String fetch(URI uri) throws IOException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(requestTimeout)
            .header("Accept", "application/json")
            .GET()
            .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new IOException("GET %s returned HTTP %d".formatted(uri, response.statusCode()));
            }
            return response.body();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while fetching " + uri);
        }
    }
}
