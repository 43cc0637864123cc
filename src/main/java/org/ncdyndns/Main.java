package org.ncdyndns;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.ncdyndns.api.ApiException;
import org.ncdyndns.api.TransportException;
import org.ncdyndns.config.ConfigurationException;
import org.ncdyndns.config.HostsFile;
import org.ncdyndns.config.Settings;
import org.ncdyndns.dns.RecordSetConsistencyException;
import org.ncdyndns.net.ExternalIpException;
import org.ncdyndns.net.ExternalIpProviders;
import org.ncdyndns.sync.DesiredState;
import org.ncdyndns.sync.DynDnsUpdater;
import org.ncdyndns.sync.SyncReport;
import org.ncdyndns.util.ConsolePrinter;
import org.ncdyndns.util.LogLevels;
import org.ncdyndns.web.WebServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.OptionalInt;

/**
 * Updates the dns zone ttl and records of a domain from a hosts file, or serves the webhook.
 * <p>
 * Missing destinations in the hosts file are filled with the external ip. The API credentials
 * come from the settings file. Record contents are not checked for sanity.
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_REMOTE = 2;

    private static final String USAGE = "nc-dyndns [options] SETTINGS HOSTS | nc-dyndns --serve [SETTINGS]";

    public static void main(String[] args) {
        Options options = makeOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            ConsolePrinter.printFail(e.getMessage());
            printHelp(options);
            System.exit(EXIT_USAGE);
            return;
        }

        if (cmd.hasOption("h")) {
            printHelp(options);
            return;
        }

        if (cmd.hasOption("serve")) {
            int code = serve(cmd);
            if (code != EXIT_OK) {
                System.exit(code);
            }
            // Spark keeps the JVM alive
            return;
        }

        System.exit(run(cmd, options));
    }

    static Options makeOptions() {
        Options options = new Options();
        options.addOption("h", "help", false, "Print this help message");
        options.addOption("u", "update", false, "Write changed settings, defaults to a dry run");
        options.addOption("v", "verbose", false, "Debugging output");
        options.addOption(null, "serve", false, "Run the webhook server instead of a single update");
        options.addOption(Option.builder("t")
                .longOpt("ttl")
                .desc("Change the zone ttl to this many seconds, defaults to not changing it")
                .argName("seconds")
                .hasArg()
                .build());
        return options;
    }

    static int run(CommandLine cmd, Options options) {
        List<String> files = cmd.getArgList();
        if (files.size() != 2) {
            ConsolePrinter.printFail("Expected a settings file and a hosts file");
            printHelp(options);
            return EXIT_USAGE;
        }

        boolean update = cmd.hasOption("u");
        OptionalInt ttl;
        try {
            ttl = parseTtl(cmd.getOptionValue("t"));
        } catch (IllegalArgumentException e) {
            ConsolePrinter.printFail(e.getMessage());
            return EXIT_USAGE;
        }

        try {
            Settings settings = Settings.load(Path.of(files.get(0)));
            LogLevels.applyRootLevel(cmd.hasOption("v") ? "DEBUG" : settings.getLogLevel());
            log.debug("settings path:\t{}", files.get(0));
            log.debug("hosts path:\t{}", files.get(1));
            log.debug("update:\t{}", update);
            log.debug("ttl:\t{}", ttl);
            log.debug("settings:\t{}", settings);

            DesiredState desired = HostsFile.load(Path.of(files.get(1)), ExternalIpProviders.forSettings(settings));
            if (ttl.isPresent()) {
                desired = desired.withTtl(ttl);
            }
            ConsolePrinter.printInfo("working on domain:\t" + desired.getDomain());

            SyncReport report = new DynDnsUpdater(settings).run(desired, update);
            ConsolePrinter.printPlain(report.render());
            ConsolePrinter.printSuccess(update ? "done" : "done (dry run, use --update to write)");
            return EXIT_OK;

        } catch (ConfigurationException e) {
            ConsolePrinter.printFail("Configuration error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (ExternalIpException e) {
            ConsolePrinter.printFail("Unable to find external ip: " + e.getMessage());
            return EXIT_REMOTE;
        } catch (ApiException | TransportException e) {
            ConsolePrinter.printFail("API error: " + e.getMessage());
            return EXIT_REMOTE;
        } catch (RecordSetConsistencyException e) {
            log.error("Record set is inconsistent", e);
            ConsolePrinter.printFail("Internal error: " + e.getMessage());
            return EXIT_REMOTE;
        }
    }

    static OptionalInt parseTtl(String value) {
        if (value == null) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("ttl must be an integer: " + value);
        }
    }

    private static int serve(CommandLine cmd) {
        List<String> files = cmd.getArgList();
        String settingsPath = files.isEmpty()
                ? System.getenv().getOrDefault("DYNDNS_SETTINGS", "settings.json")
                : files.get(0);

        int port;
        try {
            String configured = System.getenv("DYNDNS_PORT");
            port = configured == null ? WebServer.DEFAULT_PORT : Integer.parseInt(configured.trim());
        } catch (NumberFormatException e) {
            ConsolePrinter.printFail("DYNDNS_PORT is not a number");
            return EXIT_USAGE;
        }

        try {
            Settings settings = Settings.load(Path.of(settingsPath));
            LogLevels.applyRootLevel(cmd.hasOption("v") ? "DEBUG" : settings.getLogLevel());
            WebServer.start(settings, port);
            return EXIT_OK;
        } catch (ConfigurationException e) {
            ConsolePrinter.printFail("Configuration error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private static void printHelp(Options options) {
        new HelpFormatter().printHelp(USAGE, options);
    }
}
