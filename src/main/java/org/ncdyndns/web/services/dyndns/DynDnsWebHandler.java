package org.ncdyndns.web.services.dyndns;

import org.ncdyndns.api.ApiException;
import org.ncdyndns.api.TransportException;
import org.ncdyndns.config.ConfigurationException;
import org.ncdyndns.config.SubdomainKeys;
import org.ncdyndns.dns.Record;
import org.ncdyndns.dns.RecordSetConsistencyException;
import org.ncdyndns.dns.RecordType;
import org.ncdyndns.sync.DesiredState;
import org.ncdyndns.sync.DynDnsUpdater;
import org.ncdyndns.sync.SyncReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spark.Request;
import spark.Response;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Dynamic DNS update endpoint. Routers call {@code GET /<key>?ipv4=..&ipv6=..}; the key selects
 * the hostname to update.
 */
public class DynDnsWebHandler {

    private static final Logger log = LoggerFactory.getLogger(DynDnsWebHandler.class);

    private final Path subdomainsFile;
    private final DynDnsUpdater updater;

    public DynDnsWebHandler(Path subdomainsFile, DynDnsUpdater updater) {
        this.subdomainsFile = subdomainsFile;
        this.updater = updater;
    }

    public Object update(Request request, Response response) {
        response.type("application/json");
        try {
            // re-read per request so keys can change without a restart
            SubdomainKeys keys = SubdomainKeys.load(subdomainsFile);

            String hostname = keys.hostnameFor(request.params(":key"));
            if (hostname == null) {
                response.status(403);
                return Map.of("error", "Forbidden");
            }

            String ipv4 = request.queryParams("ipv4");
            String ipv6 = request.queryParams("ipv6");
            if (isBlank(ipv4) && isBlank(ipv6)) {
                response.status(400);
                return Map.of("error", "Provide an ipv4 or ipv6 or both.");
            }

            log.debug("Set the subdomain {} to the IPv4: {} and IPv6: {}",
                    hostname, isBlank(ipv4) ? "-" : ipv4, isBlank(ipv6) ? "-" : ipv6);

            List<Record> records = new ArrayList<>();
            if (!isBlank(ipv4)) {
                records.add(new Record(hostname, RecordType.A, ipv4.trim()));
            }
            if (!isBlank(ipv6)) {
                records.add(new Record(hostname, RecordType.AAAA, ipv6.trim()));
            }

            SyncReport report = updater.run(new DesiredState(keys.getDomain(), records, OptionalInt.empty()), true);

            response.status(200);
            return report.summary();

        } catch (ConfigurationException e) {
            log.error("Webhook configuration error: {}", e.getMessage());
            response.status(500);
            return Map.of("error", "Configuration error", "details", e.getMessage());
        } catch (ApiException | TransportException e) {
            log.error("Remote API failure: {}", e.getMessage());
            response.status(502);
            return Map.of("error", e.getMessage());
        } catch (RecordSetConsistencyException e) {
            log.error("Inconsistent record set", e);
            response.status(500);
            return Map.of("error", "Internal server error", "details", e.getMessage());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
