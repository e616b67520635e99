package com.smurthy.ai.agri.dto;

/**
 * Body of every 4xx/5xx answer: {@code {"success": false, "error": "..."}}.
 */
public record ErrorResponse(boolean success, String error) {

    public static ErrorResponse of(String error) {
        return new ErrorResponse(false, error);
    }
}
