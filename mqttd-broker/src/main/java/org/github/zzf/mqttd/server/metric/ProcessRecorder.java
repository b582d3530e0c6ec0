package org.github.zzf.mqttd.server.metric;

import io.github.mweirauch.micrometer.jvm.extras.ProcessMemoryMetrics;
import io.github.mweirauch.micrometer.jvm.extras.ProcessThreadMetrics;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.netty.util.concurrent.DefaultThreadFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.Builder;
import lombok.Data;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Samples JVM and process metrics at a fixed interval and keeps the samples of the retention window, oldest first.
 */
@Slf4j
public class ProcessRecorder implements AutoCloseable {

    private final String appName;
    private final Duration interval;
    private final Duration retention;
    private final MeterRegistry registry;
    private final Deque<Record> records = new ConcurrentLinkedDeque<>();
    private ScheduledExecutorService scheduler;
    private JvmGcMetrics gcMetrics;

    @Builder
    public ProcessRecorder(String appName, Duration interval, Duration retention, MeterRegistry registry) {
        this.appName = appName == null ? "mqttd" : appName;
        this.interval = interval == null ? Duration.ofSeconds(60) : interval;
        this.retention = retention == null ? Duration.ofDays(7) : retention;
        this.registry = registry == null ? new SimpleMeterRegistry() : registry;
    }

    public synchronized ProcessRecorder start() {
        if (scheduler != null) {
            return this;
        }
        log.info("ProcessRecorder appName: {}, interval: {}, retention: {}", appName, interval, retention);
        registry.config().commonTags("application", appName);
        new ClassLoaderMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);
        gcMetrics = new JvmGcMetrics();
        gcMetrics.bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessMemoryMetrics().bindTo(registry);
        new ProcessThreadMetrics().bindTo(registry);
        scheduler = Executors.newSingleThreadScheduledExecutor(new DefaultThreadFactory("process-recorder", true));
        scheduler.scheduleAtFixedRate(this::sampleSafely, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        return this;
    }

    private void sampleSafely() {
        try {
            sample();
        } catch (RuntimeException e) {
            log.error("ProcessRecorder sample failed", e);
        }
    }

    Record sample() {
        long now = System.currentTimeMillis();
        Record r = new Record()
            .setTime(now)
            .setProcessCpu(gauge("process.cpu.usage", Tags.empty()))
            .setSystemCpu(gauge("system.cpu.usage", Tags.empty()))
            .setHeapUsed(sum("jvm.memory.used", Tags.of("area", "heap")))
            .setNonHeapUsed(sum("jvm.memory.used", Tags.of("area", "nonheap")))
            .setLiveThreads(gauge("jvm.threads.live", Tags.empty()))
            .setRss(gauge("process.memory.rss", Tags.empty()))
            .setVss(gauge("process.memory.vss", Tags.empty()))
            .setProcessThreads(gauge("process.threads", Tags.empty()));
        records.addLast(r);
        long oldest = now - retention.toMillis();
        while (!records.isEmpty() && records.peekFirst().getTime() < oldest) {
            records.pollFirst();
        }
        return r;
    }

    /**
     * a copy of the retained samples, oldest first
     */
    public List<Record> records() {
        return new ArrayList<>(records);
    }

    public Duration interval() {
        return interval;
    }

    private Double gauge(String name, Tags tags) {
        Gauge g = registry.find(name).tags(tags).gauge();
        return g == null ? null : finite(g.value());
    }

    private Double sum(String name, Tags tags) {
        double total = registry.find(name).tags(tags).gauges().stream()
            .mapToDouble(Gauge::value)
            .filter(Double::isFinite)
            .sum();
        return finite(total);
    }

    private static Double finite(double v) {
        return Double.isFinite(v) ? v : null;
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        scheduler = null;
        if (gcMetrics != null) {
            gcMetrics.close();
        }
        log.info("ProcessRecorder stopped");
    }

    @Data
    @Accessors(chain = true)
    public static class Record {

        /* epoch millis */
        private long time;
        private Double processCpu;
        private Double systemCpu;
        private Double heapUsed;
        private Double nonHeapUsed;
        private Double liveThreads;
        /* linux only (/proc), null elsewhere */
        private Double rss;
        private Double vss;
        private Double processThreads;

    }

}
