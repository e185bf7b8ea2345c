package com.marketbot.core;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

/**
 * Writes one-line JSON events, e.g. {@code {"event":"download.retry","ticker":"AAPL","attempt":2}}.
 */
public final class EventLog {
    private EventLog() {
    }

    public static void info(Logger logger, String event, Object... keyValues) {
        log(logger, Level.INFO, event, keyValues);
    }

    public static void warn(Logger logger, String event, Object... keyValues) {
        log(logger, Level.WARN, event, keyValues);
    }

    public static void log(Logger logger, Level level, String event, Object... keyValues) {
        if (logger == null || !logger.isEnabled(level)) {
            return;
        }
        logger.log(level, format(event, keyValues));
    }

    public static String format(String event, Object... keyValues) {
        JSONObject json = new JSONObject();
        json.put("event", event == null ? "" : event);
        if (keyValues != null) {
            for (int i = 0; i + 1 < keyValues.length; i += 2) {
                Object key = keyValues[i];
                if (key == null) {
                    continue;
                }
                json.put(key.toString(), jsonValue(keyValues[i + 1]));
            }
        }
        return json.toString();
    }

    private static Object jsonValue(Object value) {
        if (value == null) {
            return JSONObject.NULL;
        }
        if (value instanceof Double && !Double.isFinite((Double) value)) {
            return String.valueOf(value);
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof String) {
            return value;
        }
        return String.valueOf(value);
    }
}
