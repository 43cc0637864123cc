package org.ncdyndns.net;

import org.ncdyndns.config.Settings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.Address;

import java.net.Inet4Address;
import java.net.UnknownHostException;

public final class ExternalIpProviders {

    private static final Logger log = LoggerFactory.getLogger(ExternalIpProviders.class);

    private ExternalIpProviders() {
    }

    /**
     * The FRITZ!Box provider if {@code FRITZBOX_IP} is set, ipify otherwise.
     */
    public static ExternalIpProvider forSettings(Settings settings) {
        String fritzbox = settings.getFritzboxIp();
        if (fritzbox != null && !fritzbox.isBlank()) {
            log.debug("Getting external ip via FRITZ!Box API on {}", fritzbox);
            return new FritzBoxProvider(fritzbox, settings.getHttpTimeout());
        }
        log.debug("Getting external ip via ipify API");
        return new IpifyProvider(settings.getHttpTimeout());
    }

    /**
     * Parses a dotted-quad IPv4 literal without any name lookup.
     */
    static Inet4Address parseIpv4(String text) throws ExternalIpException {
        if (text == null || text.isBlank()) {
            throw new ExternalIpException("Empty external ip");
        }
        try {
            return (Inet4Address) Address.getByAddress(text.trim(), Address.IPv4);
        } catch (UnknownHostException e) {
            throw new ExternalIpException("Not an IPv4 address: " + text.trim(), e);
        }
    }
}
