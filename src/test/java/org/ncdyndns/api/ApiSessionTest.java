package org.ncdyndns.api;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.ncdyndns.config.Settings;
import org.ncdyndns.dns.Record;
import org.ncdyndns.dns.RecordSet;
import org.ncdyndns.dns.RecordType;
import org.ncdyndns.dns.Zone;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ApiSessionTest {

    private static final String DOMAIN = "example.com";

    private Settings settings;
    private FakeControlApi api;

    @BeforeEach
    void setUp() {
        settings = new Settings("https://dns.example.net/endpoint", "the-key", "the-password", "12345");
        api = new FakeControlApi(DOMAIN, 3600)
                .withRecord("www", "A", "1.1.1.1")
                .withRecord("mail", "CNAME", "www");
    }

    @Test
    void login_storesSessionId() throws Exception {
        ApiSession session = new ApiSession(settings, api);
        assertFalse(session.isAuthenticated());

        session.login();

        assertTrue(session.isAuthenticated());
        JsonObject param = api.lastRequest(ApiAction.LOGIN).getAsJsonObject("param");
        assertEquals("12345", param.get("customernumber").getAsString());
        assertEquals("the-key", param.get("apikey").getAsString());
        assertEquals("the-password", param.get("apipassword").getAsString());
        assertFalse(param.has("apisessionid"));
    }

    @Test
    void actions_carryCredentialsAndSessionId() throws Exception {
        try (ApiSession session = ApiSession.open(settings, api)) {
            session.infoZone(DOMAIN);
        }

        JsonObject param = api.lastRequest(ApiAction.INFO_DNS_ZONE).getAsJsonObject("param");
        assertEquals("12345", param.get("customernumber").getAsString());
        assertEquals("the-key", param.get("apikey").getAsString());
        assertEquals(FakeControlApi.SESSION_ID, param.get("apisessionid").getAsString());
        assertEquals(DOMAIN, param.get("domainname").getAsString());
        assertFalse(param.has("apipassword"));
    }

    @Test
    void close_logsOut() throws Exception {
        try (ApiSession session = ApiSession.open(settings, api)) {
            assertTrue(api.isLoggedIn());
            session.infoRecords(DOMAIN);
        }

        assertFalse(api.isLoggedIn());
        assertEquals(List.of("login", "infoDnsRecords", "logout"), api.actions());
    }

    @Test
    void logout_whenNotLoggedInSendsNothing() {
        ApiSession session = new ApiSession(settings, api);

        session.logout();
        session.close();

        assertTrue(api.requests().isEmpty());
    }

    @Test
    void login_twiceIsRejected() throws Exception {
        ApiSession session = ApiSession.open(settings, api);
        assertThrows(IllegalStateException.class, session::login);
        assertEquals(1, api.count(ApiAction.LOGIN));
    }

    @Test
    void login_failureLeavesSessionUnauthenticated() {
        api.failing(ApiAction.LOGIN, "The customer number or the api key is invalid.");
        ApiSession session = new ApiSession(settings, api);

        ApiException error = assertThrows(ApiException.class, session::login);

        assertEquals("The customer number or the api key is invalid.", error.getMessage());
        assertEquals(4013, error.getStatusCode());
        assertFalse(session.isAuthenticated());
    }

    @Test
    void actionBeforeLogin_failsWithoutContactingRemote() {
        ApiSession session = new ApiSession(settings, api);

        assertThrows(IllegalStateException.class, () -> session.infoZone(DOMAIN));
        assertTrue(api.requests().isEmpty());
    }

    @Test
    void failedAction_logsOutAndBlocksFurtherActions() throws Exception {
        api.failing(ApiAction.INFO_DNS_RECORDS, "Domain not found.");
        ApiSession session = ApiSession.open(settings, api);

        ApiException error = assertThrows(ApiException.class, () -> session.infoRecords(DOMAIN));

        assertEquals("Domain not found.", error.getMessage());
        assertFalse(session.isAuthenticated());
        assertEquals(List.of("login", "infoDnsRecords", "logout"), api.actions());

        int sent = api.requests().size();
        assertThrows(IllegalStateException.class, () -> session.infoZone(DOMAIN));
        assertEquals(sent, api.requests().size());
    }

    @Test
    void failedLogout_isSwallowedAndSessionCleared() throws Exception {
        api.failing(ApiAction.LOGOUT, "Logout failed.");
        ApiSession session = ApiSession.open(settings, api);

        session.logout();

        assertFalse(session.isAuthenticated());
        assertEquals(1, api.count(ApiAction.LOGOUT));
    }

    @Test
    void failedAction_keepsOriginalErrorWhenLogoutAlsoFails() throws Exception {
        api.failing(ApiAction.INFO_DNS_ZONE, "Zone is locked.")
                .unreachable(ApiAction.LOGOUT);
        ApiSession session = ApiSession.open(settings, api);

        ApiException error = assertThrows(ApiException.class, () -> session.infoZone(DOMAIN));

        assertEquals("Zone is locked.", error.getMessage());
        assertFalse(session.isAuthenticated());
    }

    @Test
    void transportFailure_isNotAnApiError() throws Exception {
        api.unreachable(ApiAction.INFO_DNS_ZONE);
        ApiSession session = ApiSession.open(settings, api);

        TransportException error = assertThrows(TransportException.class, () -> session.infoZone(DOMAIN));

        assertEquals(503, error.getHttpStatus());
        assertTrue(session.isAuthenticated());
        session.close();
        assertFalse(api.isLoggedIn());
    }

    @Test
    void infoZone_parsesRemoteZone() throws Exception {
        try (ApiSession session = ApiSession.open(settings, api)) {
            Zone zone = session.infoZone(DOMAIN);

            assertEquals(DOMAIN, zone.getName());
            assertEquals(3600, zone.getTtl());
            assertEquals("2024010101", zone.getSerial());
        }
    }

    @Test
    void infoRecords_parsesRemoteRecords() throws Exception {
        try (ApiSession session = ApiSession.open(settings, api)) {
            RecordSet records = session.infoRecords(DOMAIN);

            assertEquals(2, records.size());
            Record www = records.getByHostname("www");
            assertEquals(1000, www.getId());
            assertEquals(RecordType.A, www.getType());
            assertEquals("yes", www.getState());
        }
    }

    @Test
    void updateZone_sendsZone() throws Exception {
        try (ApiSession session = ApiSession.open(settings, api)) {
            Zone zone = session.infoZone(DOMAIN);
            zone.setTtl(300);
            session.updateZone(zone);

            assertEquals(300, session.infoZone(DOMAIN).getTtl());
        }

        JsonObject dnszone = api.lastRequest(ApiAction.UPDATE_DNS_ZONE).getAsJsonObject("param").getAsJsonObject("dnszone");
        assertEquals(DOMAIN, dnszone.get("name").getAsString());
        assertEquals(300, dnszone.get("ttl").getAsInt());
    }

    @Test
    void updateRecords_sendsRecordSet() throws Exception {
        try (ApiSession session = ApiSession.open(settings, api)) {
            RecordSet records = session.infoRecords(DOMAIN);
            records.merge(new Record("home", RecordType.AAAA, "2001:db8::1"));
            session.updateRecords(DOMAIN, records);

            RecordSet after = session.infoRecords(DOMAIN);
            assertEquals(3, after.size());
            assertEquals("2001:db8::1", after.getByHostname("home").getDestination());
        }

        JsonObject param = api.lastRequest(ApiAction.UPDATE_DNS_RECORDS).getAsJsonObject("param");
        assertEquals(DOMAIN, param.get("domainname").getAsString());
        assertEquals(3, param.getAsJsonObject("dnsrecordset").getAsJsonArray("dnsrecords").size());
    }

    @Test
    void malformedResponse_isAnApiError() throws Exception {
        ApiTransport transport = mock(ApiTransport.class);
        when(transport.post(anyString(), anyString())).thenReturn("<html>maintenance</html>");

        ApiSession session = new ApiSession(settings, transport);

        assertThrows(ApiException.class, session::login);
        assertFalse(session.isAuthenticated());
    }

    @Test
    void responseWithoutStatus_isAnApiError() throws Exception {
        ApiTransport transport = mock(ApiTransport.class);
        when(transport.post(anyString(), anyString())).thenReturn("{\"responsedata\":{}}");

        ApiSession session = new ApiSession(settings, transport);

        assertThrows(ApiException.class, session::login);
    }

    @Test
    void loginWithoutSessionId_isAnApiError() throws Exception {
        ApiTransport transport = mock(ApiTransport.class);
        when(transport.post(anyString(), anyString())).thenReturn("{\"status\":\"success\",\"responsedata\":\"\"}");

        ApiSession session = new ApiSession(settings, transport);

        assertThrows(ApiException.class, session::login);
        assertFalse(session.isAuthenticated());
    }

    @Test
    void buildRequest_omitsSessionIdOnlyForLogin() {
        ApiSession session = new ApiSession(settings, api);
        JsonObject params = new JsonObject();
        params.addProperty("domainname", DOMAIN);

        JsonObject login = session.buildRequest(ApiAction.LOGIN, params);
        JsonObject info = session.buildRequest(ApiAction.INFO_DNS_ZONE, params);

        assertEquals("login", login.get("action").getAsString());
        assertFalse(login.getAsJsonObject("param").has("apisessionid"));
        assertEquals("infoDnsZone", info.get("action").getAsString());
        assertTrue(info.getAsJsonObject("param").has("apisessionid"));
    }

    @Test
    void structuredStatus_isAnApiError() throws Exception {
        ApiTransport transport = mock(ApiTransport.class);
        when(transport.post(anyString(), anyString()))
                .thenReturn("{\"status\":{\"code\":\"success\"}}")
                .thenReturn("{\"status\":[\"success\"]}");

        ApiSession session = new ApiSession(settings, transport);

        assertThrows(ApiException.class, session::login);
        assertThrows(ApiException.class, session::login);
        assertFalse(session.isAuthenticated());
    }

    @Test
    void structuredStatusOnAction_tearsSessionDown() throws Exception {
        ApiTransport transport = mock(ApiTransport.class);
        when(transport.post(anyString(), anyString()))
                .thenReturn("{\"status\":\"success\",\"responsedata\":{\"apisessionid\":\"abc\"}}")
                .thenReturn("{\"status\":{}}")
                .thenReturn("{\"status\":\"success\"}");

        ApiSession session = ApiSession.open(settings, transport);

        assertThrows(ApiException.class, () -> session.infoZone(DOMAIN));
        assertFalse(session.isAuthenticated());
    }
}
