package org.github.zzf.mqttd.server.metric;

import static org.assertj.core.api.BDDAssertions.then;

import com.alibaba.fastjson.JSON;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ProcessRecorderTest {

    @Test
    void givenStartedRecorder_whenSample_thenJvmFiguresRecorded() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        try (ProcessRecorder recorder = ProcessRecorder.builder()
            .appName("test")
            .interval(Duration.ofHours(1))
            .registry(registry)
            .build()
            .start()) {
            ProcessRecorder.Record r = recorder.sample();
            then(r.getHeapUsed()).isPositive();
            then(r.getLiveThreads()).isPositive();
            then(recorder.records()).contains(r);
            then(registry.find("jvm.memory.used").tag("application", "test").gauges()).isNotEmpty();
            then(JSON.toJSONString(r)).contains("\"heapUsed\"").contains("\"time\"");
        }
    }

    @Test
    void givenShortRetention_whenSample_thenOldSamplesEvicted() throws InterruptedException {
        ProcessRecorder recorder = ProcessRecorder.builder().retention(Duration.ofMillis(1)).build();
        recorder.sample();
        Thread.sleep(20);
        ProcessRecorder.Record latest = recorder.sample();
        then(recorder.records()).containsExactly(latest);
    }

    @Test
    void givenDefaults_whenBuild_thenOneMinuteInterval() {
        then(ProcessRecorder.builder().build().interval()).isEqualTo(Duration.ofSeconds(60));
    }

}
