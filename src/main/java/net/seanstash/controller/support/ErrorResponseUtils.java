package net.seanstash.controller.support;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Builds the {@code {error, message, code}} payload shared by API controllers.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
    }

    public static Map<String, String> errorBody(String error, String message, String code) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        if (message != null && !message.isBlank()) {
            body.put("message", message);
        }
        body.put("code", code);
        return body;
    }

    public static ResponseEntity<Map<String, String>> error(HttpStatus status, String error, String message, String code) {
        return ResponseEntity.status(status).body(errorBody(error, message, code));
    }
}
