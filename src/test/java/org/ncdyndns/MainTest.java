package org.ncdyndns;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path dir;

    private static int run(String... args) throws Exception {
        Options options = Main.makeOptions();
        CommandLine cmd = new DefaultParser().parse(options, args);
        return Main.run(cmd, options);
    }

    @Test
    void parseTtl() {
        assertEquals(OptionalInt.empty(), Main.parseTtl(null));
        assertEquals(OptionalInt.of(300), Main.parseTtl(" 300 "));
        assertThrows(IllegalArgumentException.class, () -> Main.parseTtl("5m"));
    }

    @Test
    void options_parseShortAndLongForms() throws Exception {
        CommandLine cmd = new DefaultParser().parse(Main.makeOptions(),
                new String[]{"-u", "--ttl", "600", "settings.json", "hosts.json"});

        assertTrue(cmd.hasOption("update"));
        assertEquals("600", cmd.getOptionValue("t"));
        assertEquals(2, cmd.getArgList().size());
    }

    @Test
    void run_requiresTwoFiles() throws Exception {
        assertEquals(Main.EXIT_USAGE, run("settings.json"));
    }

    @Test
    void run_rejectsNonNumericTtl() throws Exception {
        assertEquals(Main.EXIT_USAGE, run("-t", "soon", "settings.json", "hosts.json"));
    }

    @Test
    void run_reportsMissingSettings() throws Exception {
        assertEquals(Main.EXIT_USAGE, run(dir.resolve("absent.json").toString(), dir.resolve("hosts.json").toString()));
    }

    @Test
    void run_reportsBrokenHostsFile() throws Exception {
        Path settings = dir.resolve("settings.json");
        Files.writeString(settings, "{\"API_KEY\":\"key\",\"API_PASSWORD\":\"pw\",\"CUSTOMER_ID\":\"1\",\"LOG_LEVEL\":\"WARN\"}");
        Path hosts = dir.resolve("hosts.json");
        Files.writeString(hosts, "{\"zone\":{}}");

        assertEquals(Main.EXIT_USAGE, run(settings.toString(), hosts.toString()));
    }
}
