package org.ncdyndns.util;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConversionUtilTest {

    @Test
    void parseObject_handlesBlankAndNonObjects() {
        assertNull(ConversionUtil.parseObject(null));
        assertNull(ConversionUtil.parseObject("  "));
        assertNull(ConversionUtil.parseObject("[1,2]"));
        assertEquals("success", ConversionUtil.parseObject("{\"status\":\"success\"}").get("status").getAsString());
    }

    @Test
    void parseObject_rejectsBrokenJson() {
        assertThrows(JsonParseException.class, () -> ConversionUtil.parseObject("{\"status\":"));
    }

    @Test
    void redact_masksNestedFieldsOnACopy() {
        JsonObject param = new JsonObject();
        param.addProperty("apikey", "the-key");
        param.addProperty("apipassword", "the-password");
        param.addProperty("customernumber", "12345");
        JsonObject payload = new JsonObject();
        payload.addProperty("action", "login");
        payload.add("param", param);

        JsonObject redacted = ConversionUtil.redact(payload, "apikey", "apipassword");

        JsonObject redactedParam = redacted.getAsJsonObject("param");
        assertEquals("********", redactedParam.get("apikey").getAsString());
        assertEquals("********", redactedParam.get("apipassword").getAsString());
        assertEquals("12345", redactedParam.get("customernumber").getAsString());
        assertEquals("the-key", param.get("apikey").getAsString());
    }

    @Test
    void toJson_keepsHtmlCharacters() {
        JsonObject json = new JsonObject();
        json.addProperty("destination", "<a&b>");
        assertEquals("{\"destination\":\"<a&b>\"}", ConversionUtil.toJson(json));
    }
}
