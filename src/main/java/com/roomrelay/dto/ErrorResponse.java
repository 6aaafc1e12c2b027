package com.roomrelay.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * Standardized error response DTO.
 * Written as the body of rejected WebSocket handshakes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String type;
    private String code;
    private String message;
    private String details;
    private LocalDateTime timestamp;
    private String path;

    // Default constructor
    public ErrorResponse() {
        this.timestamp = LocalDateTime.now();
    }

    // Constructor with code and message
    public ErrorResponse(String code, String message) {
        this();
        this.code = code;
        this.message = message;
        this.type = "error";
    }

    // Static factory methods
    public static ErrorResponse of(ErrorCode errorCode, String details) {
        ErrorResponse response = new ErrorResponse(errorCode.getCode(), errorCode.getMessage());
        response.setDetails(details);
        return response;
    }

    // Error code enum for standardized codes
    public enum ErrorCode {
        // Authentication errors (AUTH_XXX)
        AUTH_006("AUTH_006", "Unauthorized access"),

        // Room errors (ROOM_XXX)
        ROOM_002("ROOM_002", "Room already exists"),
        ROOM_003("ROOM_003", "Invalid room password"),
        ROOM_008("ROOM_008", "Invalid room name"),

        // Validation errors (VAL_XXX)
        VAL_003("VAL_003", "Field too long"),
        VAL_004("VAL_004", "Invalid format"),

        // Server errors (SRV_XXX)
        SRV_001("SRV_001", "Internal server error"),
        SRV_002("SRV_002", "Service unavailable");

        private final String code;
        private final String message;

        ErrorCode(String code, String message) {
            this.code = code;
            this.message = message;
        }

        public String getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }
    }

    // Getters
    public String getType() {
        return type;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }
}
