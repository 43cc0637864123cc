package org.ncdyndns.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.StringReader;
import java.net.Inet4Address;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

/**
 * Reads the WAN address from a FRITZ!Box router through its UPnP/TR-064 interface.
 */
public class FritzBoxProvider implements ExternalIpProvider {

    private static final Logger log = LoggerFactory.getLogger(FritzBoxProvider.class);

    static final String SERVICE = "urn:schemas-upnp-org:service:WANIPConnection:1";
    static final String ACTION = "GetExternalIPAddress";
    private static final int PORT = 49000;
    private static final String CONTROL_PATH = "/igdupnp/control/WANIPConn1";

    static final String ADDRESS_ELEMENT = "NewExternalIPAddress";

    private final String fritzboxIp;
    private final HttpClient client;
    private final Duration timeout;

    public FritzBoxProvider(String fritzboxIp, Duration timeout) {
        this(fritzboxIp, HttpClient.newBuilder().connectTimeout(timeout).build(), timeout);
    }

    FritzBoxProvider(String fritzboxIp, HttpClient client, Duration timeout) {
        this.fritzboxIp = fritzboxIp;
        this.client = client;
        this.timeout = timeout;
    }

    String controlUrl() {
        return "http://" + fritzboxIp + ":" + PORT + CONTROL_PATH;
    }

    static String envelope() {
        return "<?xml version=\"1.0\" encoding=\"utf-8\"?>"
                + "<s:Envelope xmlns:s=\"http://schemas.xmlsoap.org/soap/envelope/\""
                + " s:encodingStyle=\"http://schemas.xmlsoap.org/soap/encoding/\">"
                + "<s:Body><u:" + ACTION + " xmlns:u=\"" + SERVICE + "\"/></s:Body>"
                + "</s:Envelope>";
    }

    @Override
    public Inet4Address currentIp() throws ExternalIpException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(controlUrl()))
                    .timeout(timeout)
                    .header("Content-Type", "text/xml; charset=\"utf-8\"")
                    .header("SOAPAction", SERVICE + "#" + ACTION)
                    .POST(HttpRequest.BodyPublishers.ofString(envelope()))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ExternalIpException("Invalid FRITZ!Box address " + fritzboxIp, e);
        }

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.error("Unable to connect to FRITZ!Box {}", fritzboxIp);
            throw new ExternalIpException("Unable to connect to FRITZ!Box " + fritzboxIp, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalIpException("Interrupted while asking FRITZ!Box " + fritzboxIp, e);
        }

        if (response.statusCode() != 200) {
            throw new ExternalIpException("FRITZ!Box " + fritzboxIp + " responded with HTTP " + response.statusCode());
        }

        String address = externalAddress(response.body() == null ? "" : response.body());
        if (address == null) {
            log.error("Unable to get external ip from FRITZ!Box {}", fritzboxIp);
            throw new ExternalIpException("FRITZ!Box " + fritzboxIp + " did not report an external ip");
        }

        Inet4Address ip = ExternalIpProviders.parseIpv4(address);
        log.debug("Found external ip to be {}", ip.getHostAddress());
        return ip;
    }

    /**
     * Text of the first {@code NewExternalIPAddress} element in any namespace, or null if the
     * reply has none.
     */
    static String externalAddress(String soapReply) throws ExternalIpException {
        Document document;
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            dbf.setNamespaceAware(true);
            dbf.setCoalescing(true);
            dbf.setIgnoringComments(true);
            document = dbf.newDocumentBuilder().parse(new InputSource(new StringReader(soapReply)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new ExternalIpException("Malformed SOAP reply: " + e.getMessage(), e);
        }

        NodeList nodes = document.getElementsByTagNameNS("*", ADDRESS_ELEMENT);
        if (nodes.getLength() == 0) {
            return null;
        }
        String text = nodes.item(0).getTextContent();
        return text == null || text.isBlank() ? null : text.trim();
    }
}
