package com.digitalgroup.zapdesk.integration.whatsapp;

import java.util.List;
import java.util.Map;

/**
 * Null-safe navigation over the loosely typed JSON maps gateways send us.
 */
public final class PayloadUtils {

    private PayloadUtils() {}

    /**
     * Walks a dotted path ("_data.from._serialized") and returns the value, or null.
     */
    public static Object get(Map<String, Object> root, String path) {
        if (root == null || path == null) {
            return null;
        }
        Object current = root;
        for (String key : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(key);
        }
        return current;
    }

    /**
     * String value at the path. Numbers and booleans are converted; maps yield their _serialized id.
     */
    public static String getString(Map<String, Object> root, String path) {
        Object value = get(root, path);
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            Object serialized = map.get("_serialized");
            return serialized != null ? serialized.toString() : null;
        }
        String text = value.toString();
        return text.isEmpty() ? null : text;
    }

    /**
     * First non-blank string among the given paths.
     */
    public static String firstString(Map<String, Object> root, String... paths) {
        for (String path : paths) {
            String value = getString(root, path);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> getMap(Map<String, Object> root, String path) {
        Object value = get(root, path);
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
    }

    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> getList(Map<String, Object> root, String path) {
        Object value = get(root, path);
        if (value instanceof List<?> list) {
            return (List<Map<String, Object>>) list;
        }
        return List.of();
    }

    public static boolean getBoolean(Map<String, Object> root, String path) {
        Object value = get(root, path);
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && "true".equalsIgnoreCase(value.toString());
    }

    public static Long getLong(Map<String, Object> root, String path) {
        Object value = get(root, path);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value != null) {
            try {
                return Long.parseLong(value.toString());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
