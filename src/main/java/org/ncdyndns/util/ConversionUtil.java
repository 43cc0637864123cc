package org.ncdyndns.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import java.util.ArrayList;

/**
 * Utility class for converting between Java objects and JSON strings.
 * <p>
 * All JSON handling goes through one shared Gson instance.
 * </p>
 */
public final class ConversionUtil {

    private static final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    private static final String REDACTED = "********";

    private ConversionUtil() {
    }

    /**
     * Converts any Java object into its JSON string representation.
     *
     * @param object The object to serialize.
     * @return The JSON string, or {@code null} for a {@code null} object.
     */
    public static String toJson(Object object) {
        if (object == null) {
            return null;
        }
        return gson.toJson(object);
    }

    /**
     * Parses a JSON document that is expected to be an object.
     *
     * @param jsonString the document
     * @return the object, or {@code null} if the input is blank or not a JSON object
     * @throws com.google.gson.JsonParseException if the input is not valid JSON
     */
    public static JsonObject parseObject(String jsonString) {
        if (jsonString == null || jsonString.isBlank()) {
            return null;
        }
        JsonElement element = JsonParser.parseString(jsonString);
        return element.isJsonObject() ? element.getAsJsonObject() : null;
    }

    /**
     * Copy of {@code json} with the named top-level or nested string fields masked, for logging.
     */
    public static JsonObject redact(JsonObject json, String... fields) {
        JsonObject copy = json.deepCopy();
        redactInPlace(copy, fields);
        return copy;
    }

    private static void redactInPlace(JsonObject json, String... fields) {
        for (String key : new ArrayList<>(json.keySet())) {
            JsonElement value = json.get(key);
            if (value.isJsonObject()) {
                redactInPlace(value.getAsJsonObject(), fields);
                continue;
            }
            for (String field : fields) {
                if (field.equals(key)) {
                    json.addProperty(key, REDACTED);
                }
            }
        }
    }
}
