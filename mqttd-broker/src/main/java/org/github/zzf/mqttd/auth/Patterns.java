package org.github.zzf.mqttd.auth;

/**
 * Principal patterns of the global rules: empty or "*" matches anything, a trailing "*" is a prefix match,
 * anything else must be equal.
 */
final class Patterns {

    static final String ANY = "*";

    private Patterns() {
    }

    static boolean matches(String pattern, String value) {
        if (pattern == null || pattern.isEmpty() || ANY.equals(pattern)) {
            return true;
        }
        if (value == null) {
            return false;
        }
        if (pattern.endsWith(ANY)) {
            return value.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return pattern.equals(value);
    }

    static boolean isLiteral(String pattern) {
        return pattern != null && !pattern.isEmpty() && !pattern.endsWith(ANY);
    }

}
