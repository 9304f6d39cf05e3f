package io.github.simbo1905.drops;

import java.util.logging.Level;
import java.util.logging.Logger;

/// Package-private helper for structured JUL logging.
/// Produces concise key=value pairs prefixed by event=NAME.
final class StructuredLog {

    private StructuredLog() {}

    static void fine(Logger log, String event, Object... kv) {
        if (log.isLoggable(Level.FINE)) log.fine(() -> ev(event, kv));
    }

    static void finer(Logger log, String event, Object... kv) {
        if (log.isLoggable(Level.FINER)) log.finer(() -> ev(event, kv));
    }

    static void finest(Logger log, String event, Object... kv) {
        if (log.isLoggable(Level.FINEST)) log.finest(() -> ev(event, kv));
    }

    static void warning(Logger log, String event, Object... kv) {
        if (log.isLoggable(Level.WARNING)) log.warning(() -> ev(event, kv));
    }

    static String ev(String event, Object... kv) {
        StringBuilder sb = new StringBuilder(64);
        sb.append("event=").append(sanitize(event));
        for (int i = 0; i + 1 < kv.length; i += 2) {
            Object key = kv[i];
            if (key == null) continue;
            Object val = kv[i + 1];
            String v = val == null ? "null" : sanitize(val.toString());
            sb.append(' ').append(key).append('=');
            if (needsQuotes(v)) sb.append('"').append(v).append('"'); else sb.append(v);
        }
        return sb.toString();
    }

    private static boolean needsQuotes(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c) || c == '"') return true;
        }
        return false;
    }

    private static String sanitize(String s) {
        // Trim overly long payloads, input values can be arbitrarily large
        final int max = 200;
        String trimmed = s.length() > max ? s.substring(0, max) + "..." : s;
        return trimmed.replace('\n', ' ').replace('\r', ' ').replace('\t', ' ');
    }
}
