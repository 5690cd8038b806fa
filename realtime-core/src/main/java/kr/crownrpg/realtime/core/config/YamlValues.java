package kr.crownrpg.realtime.core.config;

import java.util.HashMap;
import java.util.Map;

/**
 * SnakeYAML 이 돌려주는 느슨한 값들을 변환하는 헬퍼.
 */
final class YamlValues {

    private YamlValues() {
    }

    static Map<String, Object> section(Object v) {
        if (v instanceof Map<?, ?> m) return castMap(m);
        return new HashMap<>();
    }

    static Map<String, Object> castMap(Map<?, ?> m) {
        Map<String, Object> out = new HashMap<>();
        for (Map.Entry<?, ?> e : m.entrySet()) {
            if (e.getKey() == null) continue;
            out.put(String.valueOf(e.getKey()), e.getValue());
        }
        return out;
    }

    static String trimToEmpty(Object value) {
        return value == null ? "" : value.toString().trim();
    }

    static int toInt(Object value, int defaultValue, String key) {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " 값이 정수가 아닙니다: " + value, e);
        }
    }

    static long toLong(Object value, long defaultValue, String key) {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " 값이 정수가 아닙니다: " + value, e);
        }
    }

    static double toDouble(Object value, double defaultValue, String key) {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " 값이 숫자가 아닙니다: " + value, e);
        }
    }

    static boolean toBoolean(Object value, boolean defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }
}
