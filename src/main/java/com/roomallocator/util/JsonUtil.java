package com.roomallocator.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

/**
 * Gson helpers for the wire messages.
 * Nulls are written out so every reply has the same shape.
 */
public class JsonUtil {
    private static final Gson gson = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    public static String toJson(Object object) {
        return gson.toJson(object);
    }

    public static <T> T fromJson(String json, Class<T> classOfT) {
        return gson.fromJson(json, classOfT);
    }

    /**
     * Binds an already parsed element, e.g. the payload of a request.
     * A null element yields null.
     */
    public static <T> T fromJson(JsonElement element, Class<T> classOfT) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        return gson.fromJson(element, classOfT);
    }

    /**
     * Parses a document that must be a JSON object.
     *
     * @throws com.google.gson.JsonParseException if it is not valid JSON
     * @throws IllegalStateException if it is valid JSON but not an object
     */
    public static JsonObject parseObject(String json) {
        return JsonParser.parseString(json).getAsJsonObject();
    }
}
