package com.example.counseling.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.springframework.http.HttpStatusCode;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Body of every REST error. WebSocket clients get an error frame instead.
 */
@Data
@AllArgsConstructor
public class ErrorResponse {
    private final OffsetDateTime timestamp;
    private final int status;
    private final String error;
    private final String message;
    private final String path;

    public static ErrorResponse of(HttpStatusCode status, String error, String message, String path) {
        return new ErrorResponse(OffsetDateTime.now(ZoneOffset.UTC), status.value(), error, message, path);
    }
}
