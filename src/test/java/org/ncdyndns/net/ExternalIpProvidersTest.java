package org.ncdyndns.net;

import org.junit.jupiter.api.Test;
import org.ncdyndns.config.Settings;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExternalIpProvidersTest {

    private static Settings settings(String fritzboxIp) {
        return new Settings(Settings.DEFAULT_API_URL, "key", "pw", "1", fritzboxIp, "INFO", null, Duration.ofSeconds(5));
    }

    @Test
    void forSettings_prefersFritzBox() {
        assertInstanceOf(FritzBoxProvider.class, ExternalIpProviders.forSettings(settings("192.168.178.1")));
        assertInstanceOf(IpifyProvider.class, ExternalIpProviders.forSettings(settings(null)));
        assertInstanceOf(IpifyProvider.class, ExternalIpProviders.forSettings(settings(" ")));
    }

    @Test
    void parseIpv4_acceptsDottedQuad() throws Exception {
        assertEquals("10.0.0.1", ExternalIpProviders.parseIpv4(" 10.0.0.1 ").getHostAddress());
    }

    @Test
    void parseIpv4_rejectsEverythingElse() {
        assertThrows(ExternalIpException.class, () -> ExternalIpProviders.parseIpv4("2001:db8::1"));
        assertThrows(ExternalIpException.class, () -> ExternalIpProviders.parseIpv4("example.com"));
        assertThrows(ExternalIpException.class, () -> ExternalIpProviders.parseIpv4(""));
    }
}
