package com.voxlink.servicebackend.control;

import com.voxlink.servicebackend.common.ErrorKind;

import java.util.LinkedHashMap;
import java.util.Map;

final class ControlResponses {
    static final String INTERNAL_ERROR = "Internal server error";

    private ControlResponses() {
    }

    static Map<String, Object> ok() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        return response;
    }

    static Map<String, Object> ok(Map<String, ?> fields) {
        Map<String, Object> response = ok();
        response.putAll(fields);
        return response;
    }

    static Map<String, Object> error(ErrorKind kind, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", message);
        if (kind != null) {
            response.put("code", kind.code());
        }
        return response;
    }

    static Map<String, Object> internalError() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", INTERNAL_ERROR);
        return response;
    }
}
