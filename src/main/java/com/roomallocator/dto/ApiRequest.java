package com.roomallocator.dto;

import com.google.gson.JsonObject;

/**
 * Envelope of every request sent to the allocation server:
 * an action name and an action specific payload.
 */
public class ApiRequest {
    private String action;
    private JsonObject payload;

    // Required for Gson deserialization
    public ApiRequest() {
    }

    public ApiRequest(String action, JsonObject payload) {
        this.action = action;
        this.payload = payload;
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public JsonObject getPayload() {
        return payload;
    }

    public void setPayload(JsonObject payload) {
        this.payload = payload;
    }
}
