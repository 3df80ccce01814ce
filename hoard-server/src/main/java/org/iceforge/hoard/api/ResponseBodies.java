package org.iceforge.hoard.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.hoard.result.ErrorKind;
import org.iceforge.hoard.result.OperationResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns operation results into the {@code {"success": ..}} response maps used by
 * both the HTTP routes and the command line.
 */
public final class ResponseBodies {
    private ResponseBodies() {}

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    /**
     * Success: the value's properties flattened next to {@code success}.
     * Failure: {@code error} and {@code type}.
     */
    public static Map<String, Object> body(OperationResult<?> result, ObjectMapper mapper) {
        if (!result.isSuccess()) {
            return failure(result.error(), result.message());
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", true);
        if (result.value() != null) {
            out.putAll(mapper.convertValue(result.value(), MAP_TYPE));
        }
        return out;
    }

    /** Success with the value nested under {@code field}. */
    public static Map<String, Object> body(OperationResult<?> result, String field, ObjectMapper mapper) {
        if (!result.isSuccess()) {
            return failure(result.error(), result.message());
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", true);
        out.put(field, mapper.convertValue(result.value(), Object.class));
        return out;
    }

    public static Map<String, Object> failure(ErrorKind kind, String message) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success", false);
        out.put("error", message);
        out.put("type", kind.wireName());
        return out;
    }

    public static boolean isSuccess(Map<String, Object> body) {
        return Boolean.TRUE.equals(body.get("success"));
    }

    public static HttpStatus status(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INTEGRITY_VIOLATION -> HttpStatus.CONFLICT;
            case INVALID_OPERATION -> HttpStatus.BAD_REQUEST;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    static ResponseEntity<Map<String, Object>> respond(OperationResult<?> result, Map<String, Object> body) {
        HttpStatus status = result.isSuccess() ? HttpStatus.OK : status(result.error());
        return ResponseEntity.status(status).body(body);
    }
}
