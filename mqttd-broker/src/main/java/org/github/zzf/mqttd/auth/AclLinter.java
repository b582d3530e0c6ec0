package org.github.zzf.mqttd.auth;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Reports ACL rules that can never decide anything because an earlier rule of the same user already matches every
 * topic they match. Reporting only, the ledger is used as declared.
 */
@Slf4j
public final class AclLinter {

    private AclLinter() {
    }

    public static List<String> lint(Ledger ledger) {
        List<String> warnings = new ArrayList<>();
        for (Map.Entry<String, UserRecord> e : ledger.users().entrySet()) {
            warnings.addAll(lint(e.getKey(), e.getValue().rules()));
        }
        for (AclRule acl : ledger.aclRules()) {
            warnings.addAll(lint("acl(" + acl.username() + ")", acl.rules()));
        }
        warnings.forEach(log::warn);
        return warnings;
    }

    static List<String> lint(String owner, List<AccessRule> rules) {
        List<String> warnings = new ArrayList<>(0);
        for (int i = 1; i < rules.size(); i++) {
            AccessRule later = rules.get(i);
            for (int j = 0; j < i; j++) {
                AccessRule earlier = rules.get(j);
                if (TopicFilter.covers(earlier.topicFilter(), later.topicFilter())) {
                    warnings.add(String.format("%s: rule '%s: %d' is shadowed by earlier rule '%s: %d'",
                        owner, later.topicFilter(), later.level().value(),
                        earlier.topicFilter(), earlier.level().value()));
                    break;
                }
            }
        }
        return warnings;
    }

}
