package org.github.zzf.mqttd.auth;

import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.BDDAssertions.then;

import org.github.zzf.mqttd.auth.PermissionLevel.Operation;
import org.junit.jupiter.api.Test;

class PermissionLevelTest {

    @Test
    void givenLevels_whenPermits_thenCapabilitySetsAreIndependent() {
        then(PermissionLevel.DENY.permits(Operation.SUBSCRIBE)).isFalse();
        then(PermissionLevel.DENY.permits(Operation.PUBLISH)).isFalse();
        then(PermissionLevel.READ.permits(Operation.SUBSCRIBE)).isTrue();
        then(PermissionLevel.READ.permits(Operation.PUBLISH)).isFalse();
        // WRITE(2) > READ(1) but WRITE does not imply READ
        then(PermissionLevel.WRITE.permits(Operation.SUBSCRIBE)).isFalse();
        then(PermissionLevel.WRITE.permits(Operation.PUBLISH)).isTrue();
        then(PermissionLevel.READ_WRITE.permits(Operation.SUBSCRIBE)).isTrue();
        then(PermissionLevel.READ_WRITE.permits(Operation.PUBLISH)).isTrue();
    }

    @Test
    void givenFileValues_whenOf_thenLevel() {
        then(PermissionLevel.of(0)).isEqualTo(PermissionLevel.DENY);
        then(PermissionLevel.of(1)).isEqualTo(PermissionLevel.READ);
        then(PermissionLevel.of(2)).isEqualTo(PermissionLevel.WRITE);
        then(PermissionLevel.of(3)).isEqualTo(PermissionLevel.READ_WRITE);
        then(PermissionLevel.READ_WRITE.value()).isEqualTo(3);
    }

    @Test
    void givenUnknownValue_whenOf_thenConfigException() {
        then(catchThrowable(() -> PermissionLevel.of(4))).isInstanceOf(ConfigException.class);
        then(catchThrowable(() -> PermissionLevel.of(-1))).isInstanceOf(ConfigException.class);
    }

    @Test
    void givenWriteFlag_whenOperationOf_thenPublishOrSubscribe() {
        then(Operation.of(true)).isEqualTo(Operation.PUBLISH);
        then(Operation.of(false)).isEqualTo(Operation.SUBSCRIBE);
    }

}
