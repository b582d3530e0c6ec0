package org.github.zzf.mqttd.auth;

import static org.assertj.core.api.BDDAssertions.then;

import java.util.List;
import org.junit.jupiter.api.Test;

class AclLinterTest {

    @Test
    void givenShadowedRule_whenLint_thenWarned() {
        List<String> warnings = AclLinter.lint("u", List.of(
            new AccessRule("a/#", PermissionLevel.DENY),
            new AccessRule("a/b", PermissionLevel.WRITE)));
        then(warnings).containsExactly("u: rule 'a/b: 2' is shadowed by earlier rule 'a/#: 0'");
    }

    @Test
    void givenSpecificRulesFirst_whenLint_thenNoWarning() {
        Ledger ledger = Ledger.of(new UserRecord("u", "p", List.of(
            new AccessRule("a/b", PermissionLevel.WRITE),
            new AccessRule("a/+", PermissionLevel.READ),
            new AccessRule("a/#", PermissionLevel.DENY))));
        then(AclLinter.lint(ledger)).isEmpty();
    }

    @Test
    void givenSeveralUsers_whenLint_thenEachUserLintedSeparately() {
        Ledger ledger = Ledger.of(
            new UserRecord("u1", "p", List.of(new AccessRule("#", PermissionLevel.READ))),
            new UserRecord("u2", "p", List.of(new AccessRule("x/+", PermissionLevel.READ),
                new AccessRule("x/y", PermissionLevel.WRITE))));
        then(AclLinter.lint(ledger)).hasSize(1).allMatch(w -> w.startsWith("u2: "));
    }

}
