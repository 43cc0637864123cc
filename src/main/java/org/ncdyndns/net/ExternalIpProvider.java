package org.ncdyndns.net;

import java.net.Inet4Address;

/**
 * Finds the public IPv4 address this host is reachable under.
 */
public interface ExternalIpProvider {

    Inet4Address currentIp() throws ExternalIpException;
}
