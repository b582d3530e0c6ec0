package org.github.zzf.mqttd.auth;

/**
 * MQTT topic filter semantics.
 *
 * <p>'+' matches exactly one topic level, '#' matches the parent level and any number of child levels and must be
 * the last level of a filter. Matching is case-sensitive and level-exact.</p>
 */
public final class TopicFilter {

    static final String LEVEL_SEPARATOR = "/";
    static final String MULTI_LEVEL_WILDCARD = "#";
    static final String SINGLE_LEVEL_WILDCARD = "+";
    static final String $ = "$";

    private TopicFilter() {
    }

    /**
     * @throws ConfigException if the filter is empty, '#' is not the last level, or a wildcard shares a level with
     *                         other characters
     */
    public static void validate(String filter) {
        if (filter == null || filter.isEmpty()) {
            throw new ConfigException("topic filter is empty");
        }
        String[] levels = levels(filter);
        for (int i = 0; i < levels.length; i++) {
            String level = levels[i];
            if (MULTI_LEVEL_WILDCARD.equals(level)) {
                if (i != levels.length - 1) {
                    throw new ConfigException("'#' must be the last level of topic filter: " + filter);
                }
            }
            else if (!SINGLE_LEVEL_WILDCARD.equals(level)
                && (level.contains(MULTI_LEVEL_WILDCARD) || level.contains(SINGLE_LEVEL_WILDCARD))) {
                throw new ConfigException("wildcard must occupy an entire level of topic filter: " + filter);
            }
        }
    }

    public static boolean isValid(String filter) {
        try {
            validate(filter);
            return true;
        } catch (ConfigException e) {
            return false;
        }
    }

    /**
     * a topic name is a topic filter without wildcards
     */
    public static boolean isTopicName(String topic) {
        return topic != null && !topic.isEmpty()
            && !topic.contains(MULTI_LEVEL_WILDCARD)
            && !topic.contains(SINGLE_LEVEL_WILDCARD);
    }

    public static boolean matches(String filter, String topic) {
        String[] f = levels(filter);
        String[] t = levels(topic);
        // The Server MUST NOT match Topic Filters starting with a wildcard character (# or +)
        // with Topic Names beginning with a $ character
        if (topic.startsWith($) && isWildcard(f[0])) {
            return false;
        }
        int i = 0;
        for (; i < f.length; i++) {
            String level = f[i];
            if (MULTI_LEVEL_WILDCARD.equals(level)) {
                return true;
            }
            if (i >= t.length) {
                return false;
            }
            if (!SINGLE_LEVEL_WILDCARD.equals(level) && !level.equals(t[i])) {
                return false;
            }
        }
        return i == t.length;
    }

    /**
     * @return true if every topic matched by {@code specific} is also matched by {@code general}
     */
    public static boolean covers(String general, String specific) {
        String[] g = levels(general);
        String[] s = levels(specific);
        if (specific.startsWith($) && isWildcard(g[0])) {
            return false;
        }
        for (int i = 0; i < g.length; i++) {
            if (MULTI_LEVEL_WILDCARD.equals(g[i])) {
                return true;
            }
            if (i >= s.length || MULTI_LEVEL_WILDCARD.equals(s[i])) {
                return false;
            }
            if (SINGLE_LEVEL_WILDCARD.equals(g[i])) {
                continue;
            }
            if (SINGLE_LEVEL_WILDCARD.equals(s[i]) || !g[i].equals(s[i])) {
                return false;
            }
        }
        return g.length == s.length;
    }

    private static boolean isWildcard(String level) {
        return MULTI_LEVEL_WILDCARD.equals(level) || SINGLE_LEVEL_WILDCARD.equals(level);
    }

    private static String[] levels(String topic) {
        // keep empty levels: "a/" has two levels
        return topic.split(LEVEL_SEPARATOR, -1);
    }

}
