package com.sparrowlogic.networktopology.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lenient accessors over the field maps of a raw record. A missing or mistyped field yields the
 * supplied default instead of failing, since real exports are frequently partial.
 */
public final class Fields {

    private Fields() {
    }

    public static String str(Map<String, Object> record, String key) {
        return str(record, key, "");
    }

    public static String str(Map<String, Object> record, String key, String defaultValue) {
        var value = record.get(key);
        if (value == null) {
            return defaultValue;
        }
        return value.toString();
    }

    /**
     * The field as a string, or {@code null} when it is missing or empty.
     */
    public static String optStr(Map<String, Object> record, String key) {
        var value = str(record, key, "");
        return value.isEmpty() ? null : value;
    }

    public static long lng(Map<String, Object> record, String key, long defaultValue) {
        var value = record.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public static int integer(Map<String, Object> record, String key, int defaultValue) {
        return (int) lng(record, key, defaultValue);
    }

    public static boolean bool(Map<String, Object> record, String key) {
        var value = record.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value instanceof String text && Boolean.parseBoolean(text);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> map(Map<String, Object> record, String key) {
        var value = record.get(key);
        if (value instanceof Map<?, ?> nested) {
            return (Map<String, Object>) nested;
        }
        return Map.of();
    }

    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> list(Map<String, Object> record, String key) {
        var value = record.get(key);
        if (!(value instanceof List<?> items)) {
            return List.of();
        }
        var result = new ArrayList<Map<String, Object>>();
        for (var item : items) {
            if (item instanceof Map<?, ?> nested) {
                result.add((Map<String, Object>) nested);
            }
        }
        return result;
    }

    /**
     * Value of the {@code Name} tag, or an empty string. Accepts both the EC2 ({@code Key}/{@code Value})
     * and the Direct Connect ({@code key}/{@code value}) tag spellings.
     */
    public static String tagName(Map<String, Object> record, String tagsKey) {
        for (var tag : list(record, tagsKey)) {
            var key = tag.containsKey("Key") ? str(tag, "Key") : str(tag, "key");
            if ("Name".equals(key)) {
                return tag.containsKey("Value") ? str(tag, "Value") : str(tag, "value");
            }
        }
        return "";
    }
}
