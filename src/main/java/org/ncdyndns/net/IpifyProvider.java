package org.ncdyndns.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Inet4Address;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Asks the ipify web service (https://www.ipify.org/) for the public address.
 */
public class IpifyProvider implements ExternalIpProvider {

    private static final Logger log = LoggerFactory.getLogger(IpifyProvider.class);

    public static final String API_URL = "https://api.ipify.org";

    private final HttpClient client;
    private final Duration timeout;

    public IpifyProvider(Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), timeout);
    }

    IpifyProvider(HttpClient client, Duration timeout) {
        this.client = client;
        this.timeout = timeout;
    }

    @Override
    public Inet4Address currentIp() throws ExternalIpException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(API_URL))
                .timeout(timeout)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ExternalIpException("Unable to reach " + API_URL + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalIpException("Interrupted while asking " + API_URL, e);
        }

        if (response.statusCode() != 200) {
            throw new ExternalIpException(API_URL + " responded with HTTP " + response.statusCode());
        }

        Inet4Address ip = ExternalIpProviders.parseIpv4(response.body());
        log.debug("Found external ip to be {}", ip.getHostAddress());
        return ip;
    }
}
