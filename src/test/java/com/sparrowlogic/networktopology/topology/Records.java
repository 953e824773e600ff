package com.sparrowlogic.networktopology.topology;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds raw records the way the JSON reader hands them over.
 */
final class Records {

    private Records() {
    }

    static Map<String, Object> rec(Object... keyValues) {
        var record = new LinkedHashMap<String, Object>();
        for (var i = 0; i < keyValues.length; i += 2) {
            record.put((String) keyValues[i], keyValues[i + 1]);
        }
        return record;
    }
}
