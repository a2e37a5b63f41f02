package com.purchasingpower.timegraph.util;

import java.util.Collection;
import java.util.Map;

/**
 * Helpers that keep log lines and event summaries short.
 */
public final class LogFormat {

    private LogFormat() {
    }

    /**
     * Truncate large strings (document content, summaries) for logging.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }

    /**
     * Cut text to {@code maxLength} characters with a trailing ellipsis, for user-facing summaries.
     */
    public static String abbreviate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() > maxLength ? text.substring(0, maxLength) + "..." : text;
    }

    /**
     * Small maps print in full, larger ones as a size.
     */
    public static String formatMap(Map<?, ?> map) {
        if (map == null || map.isEmpty()) {
            return "{}";
        }
        if (map.size() <= 5) {
            return map.toString();
        }
        return "{" + map.size() + " entries}";
    }

    /**
     * Short ids print in full, long id lists as first few plus a count.
     */
    public static String formatIds(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return "[]";
        }
        if (ids.size() <= 5) {
            return ids.toString();
        }
        return ids.stream().limit(5).toList() + " (+" + (ids.size() - 5) + " more)";
    }
}
