package org.ncdyndns.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link ApiTransport} over {@link HttpClient}. One client is created on first use and
 * reused for every request of the session, so the connection is kept alive.
 */
public class HttpApiTransport implements ApiTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpApiTransport.class);

    private final Duration timeout;
    private HttpClient client;

    public HttpApiTransport(Duration timeout) {
        this.timeout = timeout;
    }

    protected HttpClient buildHttpClient() {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(timeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    HttpClient client() {
        if (client == null) {
            client = buildHttpClient();
        }
        return client;
    }

    @Override
    public String post(String url, String jsonBody) throws TransportException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new TransportException("Invalid API url: " + url, e);
        }

        HttpResponse<String> response;
        try {
            response = client().send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.debug("I/O exception while posting to {}", url, e);
            throw new TransportException("Failed to reach " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for " + url, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new TransportException("API endpoint responded with HTTP " + status, status);
        }
        return response.body();
    }
}
