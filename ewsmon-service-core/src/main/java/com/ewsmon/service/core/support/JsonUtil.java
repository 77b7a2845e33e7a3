package com.ewsmon.service.core.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

public final class JsonUtil {
    private static final ObjectMapper M = new ObjectMapper();

    private JsonUtil() {}

    public static ObjectNode createObject() {
        return M.createObjectNode();
    }

    public static byte[] toJsonBytes(Object o) {
        try {
            return M.writeValueAsBytes(o);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON encode failed", e);
        }
    }
}
