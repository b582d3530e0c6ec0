package org.github.zzf.mqttd.auth;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.BDDAssertions.then;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.github.zzf.mqttd.auth.PermissionLevel.Operation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LedgerBuilderTest {

    @TempDir
    Path dir;

    @Test
    void givenSample_whenBuild_thenDisallowedUserAbsentAndRulesApplied() {
        Ledger ledger = LedgerBuilder.build(AccessFileSample.SAMPLE.getBytes(UTF_8), false);
        then(ledger.users()).containsOnlyKeys("control", "user01");
        then(ledger.authenticate("control", "daysgone", "c", "r")).isTrue();
        then(ledger.authenticate("thisisanACLsample", "lostjudgment", "c", "r")).isFalse();
        then(ledger.decide("control", "down/x/y", Operation.SUBSCRIBE)).isEqualTo(Decision.ALLOW);
        then(ledger.decide("control", "up/x", Operation.PUBLISH)).isEqualTo(Decision.ALLOW);
        then(ledger.decide("user01", "down/dev/user01/cmd", Operation.SUBSCRIBE)).isEqualTo(Decision.ALLOW);
        then(ledger.decide("user01", "down/dev/user01/cmd", Operation.PUBLISH)).isEqualTo(Decision.DENY);
        then(ledger.decide("user01", "up/dev/user01/state", Operation.PUBLISH)).isEqualTo(Decision.ALLOW);
        then(ledger.decide("user01", "up/dev/user02/state", Operation.PUBLISH)).isEqualTo(Decision.DENY);
    }

    @Test
    void givenRules_whenBuild_thenFileOrderPreserved() {
        String yaml = """
            u:
                password: p
                acl:
                    z/#: 0
                    a/#: 3
                    m/+: 1
            """;
        Ledger ledger = LedgerBuilder.build(yaml.getBytes(UTF_8), false);
        then(ledger.user("u").rules()).extracting(AccessRule::topicFilter).containsExactly("z/#", "a/#", "m/+");
        then(ledger.user("u").rules()).extracting(AccessRule::level)
            .containsExactly(PermissionLevel.DENY, PermissionLevel.READ_WRITE, PermissionLevel.READ);
    }

    @Test
    void givenMalformedYaml_whenBuild_thenParseException() {
        Throwable t = catchThrowable(() -> LedgerBuilder.build("u: [unclosed".getBytes(UTF_8), false));
        then(t).isInstanceOf(ParseException.class);
    }

    @Test
    void givenDuplicateUser_whenBuild_thenParseException() {
        String yaml = """
            u:
                password: a
            u:
                password: b
            """;
        then(catchThrowable(() -> LedgerBuilder.build(yaml.getBytes(UTF_8), false))).isInstanceOf(ParseException.class);
    }

    @Test
    void givenNonTerminalMultiLevelWildcard_whenBuild_thenConfigExceptionNamingUser() {
        String yaml = """
            bad:
                password: p
                acl:
                    a/#/b: 1
            """;
        Throwable t = catchThrowable(() -> LedgerBuilder.build(yaml.getBytes(UTF_8), false));
        then(t).isInstanceOf(ConfigException.class).isNotInstanceOf(ParseException.class)
            .hasMessageContaining("bad");
    }

    @Test
    void givenNonTerminalMultiLevelWildcardOfDisallowedUser_whenBuild_thenConfigException() {
        String yaml = """
            gone:
                password: p
                acl:
                    a/#/b: 1
                disallow: true
            """;
        Throwable t = catchThrowable(() -> LedgerBuilder.build(yaml.getBytes(UTF_8), false));
        then(t).isInstanceOf(ConfigException.class).hasMessageContaining("gone");
    }

    @Test
    void givenUnknownLevel_whenBuild_thenConfigException() {
        String yaml = """
            u:
                password: p
                acl:
                    a/b: 7
            """;
        then(catchThrowable(() -> LedgerBuilder.build(yaml.getBytes(UTF_8), false))).isInstanceOf(ConfigException.class);
        String notInt = yaml.replace("7", "rw");
        then(catchThrowable(() -> LedgerBuilder.build(notInt.getBytes(UTF_8), false))).isInstanceOf(ConfigException.class);
    }

    @Test
    void givenObfuscatedPasswords_whenBuild_thenDecoded() {
        String yaml = "u:\n    password: " + PasswordObfuscator.encode("s3cret") + "\nv:\n    password: plain\n";
        Ledger ledger = LedgerBuilder.build(yaml.getBytes(UTF_8), true);
        then(ledger.authenticate("u", "s3cret", "c", "r")).isTrue();
        // an undecodable value is taken verbatim
        then(ledger.authenticate("v", "plain", "c", "r")).isTrue();
    }

    @Test
    void givenEmptyDocument_whenBuild_thenEmptyLedger() {
        then(LedgerBuilder.build(new byte[0], false).users()).isEmpty();
    }

    @Test
    void givenWrittenSample_whenFromFile_thenLoaded() throws IOException {
        Path file = AccessFileSample.write(dir.resolve("conf/auth.yaml"));
        then(Files.readString(file)).isEqualTo(AccessFileSample.SAMPLE);
        then(LedgerBuilder.fromFile(file, false).users()).containsOnlyKeys("control", "user01");
    }

    @Test
    void givenMissingOrEmptyPath_whenFromFile_thenException() {
        then(catchThrowable(() -> LedgerBuilder.fromFile(Paths.get(""), false))).isInstanceOf(IllegalArgumentException.class);
        then(catchThrowable(() -> LedgerBuilder.fromFile(dir.resolve("absent.yaml"), false))).isInstanceOf(IOException.class);
    }

}
