package io.coordmesh.util;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Glob-style matching where {@code *} stands for any character sequence, dots included. Case-insensitive.
 */
public final class WildcardPatterns {
    private static final Map<String, Pattern> COMPILED = new ConcurrentHashMap<>();

    private WildcardPatterns() {
    }

    public static boolean matches(String pattern, String value) {
        if (pattern == null || value == null) {
            return false;
        }
        String p = pattern.trim();
        if ("*".equals(p)) {
            return true;
        }
        if (p.indexOf('*') < 0) {
            return p.equalsIgnoreCase(value.trim());
        }
        return COMPILED.computeIfAbsent(p.toLowerCase(Locale.ROOT), WildcardPatterns::compile)
                .matcher(value.trim())
                .matches();
    }

    static Pattern compile(String pattern) {
        String[] parts = pattern.split("\\*", -1);
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                regex.append(".*");
            }
            if (!parts[i].isEmpty()) {
                regex.append(Pattern.quote(parts[i]));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE);
    }
}
