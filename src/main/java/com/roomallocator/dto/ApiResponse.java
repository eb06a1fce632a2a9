package com.roomallocator.dto;

/**
 * Reply to one request. {@code error} and {@code message} are null on
 * success; {@code data} is null on failure.
 */
public class ApiResponse {
    private boolean success;
    private String error;
    private String message;
    private Object data;

    // Required for Gson deserialization
    public ApiResponse() {
    }

    public ApiResponse(boolean success, String error, String message, Object data) {
        this.success = success;
        this.error = error;
        this.message = message;
        this.data = data;
    }

    public static ApiResponse ok(Object data) {
        return new ApiResponse(true, null, null, data);
    }

    public static ApiResponse ok(String message, Object data) {
        return new ApiResponse(true, null, message, data);
    }

    public static ApiResponse failure(String error, String message) {
        return new ApiResponse(false, error, message, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public Object getData() {
        return data;
    }

    @Override
    public String toString() {
        return "ApiResponse{" +
                "success=" + success +
                ", error='" + error + '\'' +
                ", message='" + message + '\'' +
                '}';
    }
}
