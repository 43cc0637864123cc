package org.ncdyndns.web;

import org.ncdyndns.config.Settings;
import org.ncdyndns.sync.DynDnsUpdater;
import org.ncdyndns.util.ConversionUtil;
import org.ncdyndns.web.services.dyndns.DynDnsWebHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static spark.Spark.awaitInitialization;
import static spark.Spark.exception;
import static spark.Spark.get;
import static spark.Spark.ipAddress;
import static spark.Spark.port;

/**
 * Entry point for webhook route registration.
 */
public final class WebServer {

    private static final Logger log = LoggerFactory.getLogger(WebServer.class);

    public static final int DEFAULT_PORT = 8081;

    private WebServer() {
    }

    public static void start(Settings settings, int listenPort) {
        port(listenPort);
        ipAddress("0.0.0.0");

        registerGlobalExceptionHandlers();

        DynDnsWebHandler handler = new DynDnsWebHandler(settings.getSubdomainsFile(), new DynDnsUpdater(settings));
        get("/:key", handler::update, ConversionUtil::toJson);

        awaitInitialization();
        log.info("DynDNS webhook listening on port {}", listenPort);
    }

    private static void registerGlobalExceptionHandlers() {
        exception(Exception.class, (error, request, response) -> {
            log.error("Unhandled error on {}", request.pathInfo(), error);
            response.status(500);
            response.type("application/json");
            response.body("{\"error\":\"Internal server error\"}");
        });
    }
}
