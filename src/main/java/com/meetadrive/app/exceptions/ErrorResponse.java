package com.meetadrive.app.exceptions;

/**
 * Simple DTO to structure error responses with a code and message.
 * For example:
 * {
 *   "code": "SHEET_NOT_FOUND",
 *   "message": "Sheet not found: sheet7"
 * }
 */
public class ErrorResponse {
    private String code;
    private String message;

    // Default constructor needed for JSON deserialization
    public ErrorResponse() {
    }

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
