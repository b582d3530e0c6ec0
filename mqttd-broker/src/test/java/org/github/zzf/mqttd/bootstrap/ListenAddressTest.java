package org.github.zzf.mqttd.bootstrap;

import static org.assertj.core.api.BDDAssertions.then;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ListenAddressTest {

    @ParameterizedTest
    @CsvSource(value = {
        "1883, 0.0.0.0:1883",
        ":1883, 0.0.0.0:1883",
        "127.0.0.1:1883, 127.0.0.1:1883",
        "localhost:0, localhost:0",
        "' 1880 ', 0.0.0.0:1880",
        "'', ''",
        "65535, ''",
        "-1, ''",
        "abc, ''",
        "host:, ''",
    })
    void givenAddress_whenNormalize_thenHostPortOrDisabled(String address, String expected) {
        then(ListenAddress.normalize(address)).isEqualTo(expected);
    }

}
