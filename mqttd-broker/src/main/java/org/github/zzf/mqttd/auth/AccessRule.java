package org.github.zzf.mqttd.auth;

/**
 * One line of a user's ACL: a topic filter and the level granted on the topics it matches.
 */
public record AccessRule(String topicFilter, PermissionLevel level) {

    public AccessRule {
        TopicFilter.validate(topicFilter);
        if (level == null) {
            throw new ConfigException("no permission level for topic filter: " + topicFilter);
        }
    }

    public boolean matches(String topic) {
        return TopicFilter.matches(topicFilter, topic);
    }

}
