package org.ncdyndns.api;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import org.ncdyndns.config.Settings;
import org.ncdyndns.dns.Record;
import org.ncdyndns.dns.RecordSet;
import org.ncdyndns.dns.Zone;
import org.ncdyndns.util.ConversionUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Authenticated session against the remote DNS control API.
 * <p>
 * A session starts unauthenticated. {@link #login()} authenticates it, and every other action
 * requires that state and carries the session id automatically. {@link #logout()} or
 * {@link #close()} end it. If an authenticated action is answered with a non-success status the
 * session logs out on its own and must not be used again until a new login.
 * <p>
 * Not thread-safe: one session belongs to one sync pass.
 */
public class ApiSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ApiSession.class);

    private final String endpointUrl;
    private final String apiKey;
    private final String apiPassword;
    private final String customerId;
    private final ApiTransport transport;

    private String sessionId;

    public ApiSession(Settings settings, ApiTransport transport) {
        this.endpointUrl = settings.getApiUrl();
        this.apiKey = settings.getApiKey();
        this.apiPassword = settings.getApiPassword();
        this.customerId = settings.getCustomerId();
        this.transport = transport;
    }

    /**
     * Creates a session and logs in. Nothing is left open if the login fails.
     */
    public static ApiSession open(Settings settings, ApiTransport transport) throws ApiException, TransportException {
        ApiSession session = new ApiSession(settings, transport);
        session.login();
        return session;
    }

    public static ApiSession open(Settings settings) throws ApiException, TransportException {
        return open(settings, new HttpApiTransport(settings.getHttpTimeout()));
    }

    public boolean isAuthenticated() {
        return sessionId != null;
    }

    public void login() throws ApiException, TransportException {
        if (isAuthenticated()) {
            throw new IllegalStateException("Session is already logged in");
        }

        JsonObject params = new JsonObject();
        params.addProperty("apipassword", apiPassword);
        JsonObject data = exchange(ApiAction.LOGIN, params);

        JsonElement id = data == null ? null : data.get("apisessionid");
        if (id == null || id.isJsonNull() || id.getAsString().isBlank()) {
            throw new ApiException("Login response did not contain a session id");
        }

        sessionId = id.getAsString();
        log.info("Logged in successfully");
        log.debug("Session id {}", sessionId);
    }

    /**
     * Ends the session. The session id is cleared even if the remote call fails;
     * such a failure is logged and not reported to the caller.
     */
    public void logout() {
        if (!isAuthenticated()) {
            return;
        }
        try {
            exchange(ApiAction.LOGOUT, new JsonObject());
            log.info("Logged out successfully");
        } catch (ApiException | TransportException | RuntimeException e) {
            log.warn("Logout failed, dropping session anyway: {}", e.getMessage());
        } finally {
            sessionId = null;
        }
    }

    @Override
    public void close() {
        logout();
    }

    public Zone infoZone(String domain) throws ApiException, TransportException {
        JsonObject data = call(ApiAction.INFO_DNS_ZONE, domainParams(domain));
        if (data == null) {
            throw new ApiException("No zone data returned for " + domain);
        }
        try {
            return Zone.fromWire(domain, data);
        } catch (IllegalArgumentException | IllegalStateException | UnsupportedOperationException e) {
            throw new ApiException("Malformed zone data for " + domain + ": " + e.getMessage());
        }
    }

    public RecordSet infoRecords(String domain) throws ApiException, TransportException {
        JsonObject data = call(ApiAction.INFO_DNS_RECORDS, domainParams(domain));
        List<Record> records = new ArrayList<>();
        if (data == null || data.get("dnsrecords") == null || !data.get("dnsrecords").isJsonArray()) {
            return new RecordSet(records);
        }

        JsonArray array = data.getAsJsonArray("dnsrecords");
        try {
            for (JsonElement element : array) {
                records.add(Record.fromWire(element.getAsJsonObject()));
            }
        } catch (IllegalArgumentException | IllegalStateException | UnsupportedOperationException e) {
            throw new ApiException("Malformed record data for " + domain + ": " + e.getMessage());
        }
        return new RecordSet(records);
    }

    public void updateZone(Zone zone) throws ApiException, TransportException {
        JsonObject params = domainParams(zone.getName());
        params.add("dnszone", zone.toWire());
        call(ApiAction.UPDATE_DNS_ZONE, params);
        log.info("Updated zone {} (ttl={})", zone.getName(), zone.getTtl());
    }

    public void updateRecords(String domain, RecordSet records) throws ApiException, TransportException {
        JsonObject params = domainParams(domain);
        params.add("dnsrecordset", records.toWire());
        call(ApiAction.UPDATE_DNS_RECORDS, params);
        log.info("Updated {} records of {} ({} deletions)", records.size(), domain, records.pendingDeletions().size());
    }

    private static JsonObject domainParams(String domain) {
        JsonObject params = new JsonObject();
        params.addProperty("domainname", domain);
        return params;
    }

    /**
     * Runs an authenticated action. A non-success answer tears the session down before the
     * error is rethrown.
     */
    private JsonObject call(ApiAction action, JsonObject params) throws ApiException, TransportException {
        if (!isAuthenticated()) {
            throw new IllegalStateException("Action " + action + " requires a logged in session");
        }
        try {
            return exchange(action, params);
        } catch (ApiException e) {
            log.warn("Action {} failed, logging out: {}", action, e.getMessage());
            logout();
            throw e;
        }
    }

    /**
     * Sends one action and returns its {@code responsedata}, or null if there is none.
     */
    private JsonObject exchange(ApiAction action, JsonObject params) throws ApiException, TransportException {
        JsonObject payload = buildRequest(action, params);
        if (log.isDebugEnabled()) {
            log.debug("Posting request {}", ConversionUtil.redact(payload, "apipassword", "apikey"));
        }

        String body = transport.post(endpointUrl, ConversionUtil.toJson(payload));

        JsonObject response;
        try {
            response = ConversionUtil.parseObject(body);
        } catch (JsonParseException e) {
            throw new ApiException("Malformed response to " + action + ": " + e.getMessage());
        }
        JsonElement statusElement = response == null ? null : response.get("status");
        if (statusElement == null || !statusElement.isJsonPrimitive()) {
            throw new ApiException("Response to " + action + " has no status");
        }

        String status = statusElement.getAsString();
        if (!"success".equalsIgnoreCase(status)) {
            throw new ApiException(errorMessage(response, status), statusCode(response));
        }

        log.debug("Action {} returned success", action);
        JsonElement data = response.get("responsedata");
        return data != null && data.isJsonObject() ? data.getAsJsonObject() : null;
    }

    JsonObject buildRequest(ApiAction action, JsonObject params) {
        JsonObject param = new JsonObject();
        param.addProperty("customernumber", customerId);
        param.addProperty("apikey", apiKey);
        for (String key : params.keySet()) {
            param.add(key, params.get(key));
        }
        if (action != ApiAction.LOGIN) {
            param.addProperty("apisessionid", sessionId);
        }

        JsonObject payload = new JsonObject();
        payload.addProperty("action", action.wireName());
        payload.add("param", param);
        return payload;
    }

    private static String errorMessage(JsonObject response, String status) {
        for (String key : new String[]{"longmessage", "shortmessage"}) {
            JsonElement message = response.get(key);
            if (message != null && !message.isJsonNull() && !message.getAsString().isBlank()) {
                return message.getAsString();
            }
        }
        return "API responded with status " + status;
    }

    private static Integer statusCode(JsonObject response) {
        JsonElement code = response.get("statuscode");
        if (code == null || code.isJsonNull()) {
            return null;
        }
        try {
            return code.getAsInt();
        } catch (NumberFormatException | IllegalStateException | UnsupportedOperationException e) {
            return null;
        }
    }
}
