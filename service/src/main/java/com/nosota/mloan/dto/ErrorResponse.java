package com.nosota.mloan.dto;

import java.time.LocalDateTime;

/**
 * Error body returned by the REST layer.
 *
 * @param status    HTTP status code
 * @param error     short error title
 * @param code      domain error code, e.g. RATIO_BELOW_THRESHOLD
 * @param message   human readable description
 * @param path      request URI
 * @param timestamp time the error was produced
 */
public record ErrorResponse(
        int status,
        String error,
        String code,
        String message,
        String path,
        LocalDateTime timestamp
) {
    public static ErrorResponse of(int status, String error, String code, String message, String path) {
        return new ErrorResponse(status, error, code, message, path, LocalDateTime.now());
    }
}
