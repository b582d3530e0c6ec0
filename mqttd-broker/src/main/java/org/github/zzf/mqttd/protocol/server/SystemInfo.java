package org.github.zzf.mqttd.protocol.server;

import java.lang.management.ManagementFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Data;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Broker-wide counters, the $SYS view of the broker.
 */
public class SystemInfo {

    @Getter
    private final String version;
    @Getter
    private final long started = System.currentTimeMillis();

    final AtomicLong clientsConnected = new AtomicLong();
    final AtomicLong clientsMaximum = new AtomicLong();
    final AtomicLong clientsTotal = new AtomicLong();
    final AtomicLong clientsDisconnected = new AtomicLong();
    final AtomicLong messagesReceived = new AtomicLong();
    final AtomicLong messagesSent = new AtomicLong();
    final AtomicLong messagesDropped = new AtomicLong();
    final AtomicLong packetsReceived = new AtomicLong();
    final AtomicLong packetsSent = new AtomicLong();
    final AtomicLong subscriptions = new AtomicLong();

    public SystemInfo(String version) {
        this.version = version;
    }

    public void clientConnected() {
        long connected = clientsConnected.incrementAndGet();
        clientsTotal.incrementAndGet();
        clientsMaximum.accumulateAndGet(connected, Math::max);
    }

    public void clientDisconnected() {
        clientsConnected.decrementAndGet();
        clientsDisconnected.incrementAndGet();
    }

    public void packetReceived() {
        packetsReceived.incrementAndGet();
    }

    public void packetSent() {
        packetsSent.incrementAndGet();
    }

    public void messageReceived() {
        messagesReceived.incrementAndGet();
    }

    public void messageSent() {
        messagesSent.incrementAndGet();
    }

    public void messageDropped() {
        messagesDropped.incrementAndGet();
    }

    public void subscriptionAdded() {
        subscriptions.incrementAndGet();
    }

    public void subscriptionRemoved(int n) {
        subscriptions.addAndGet(-n);
    }

    /**
     * seconds since the broker started
     */
    public long uptime() {
        return TimeUnit.MILLISECONDS.toSeconds(System.currentTimeMillis() - started);
    }

    public Snapshot snapshot() {
        Runtime rt = Runtime.getRuntime();
        return new Snapshot()
            .setVersion(version)
            .setStarted(TimeUnit.MILLISECONDS.toSeconds(started))
            .setTime(TimeUnit.MILLISECONDS.toSeconds(System.currentTimeMillis()))
            .setUptime(uptime())
            .setClientsConnected(clientsConnected.get())
            .setClientsMaximum(clientsMaximum.get())
            .setClientsTotal(clientsTotal.get())
            .setClientsDisconnected(clientsDisconnected.get())
            .setMessagesReceived(messagesReceived.get())
            .setMessagesSent(messagesSent.get())
            .setMessagesDropped(messagesDropped.get())
            .setPacketsReceived(packetsReceived.get())
            .setPacketsSent(packetsSent.get())
            .setSubscriptions(subscriptions.get())
            .setThreads(ManagementFactory.getThreadMXBean().getThreadCount())
            .setMemoryAlloc(rt.totalMemory() - rt.freeMemory());
    }

    @Data
    @Accessors(chain = true)
    public static class Snapshot {

        private String version;
        private long started;
        private long time;
        private long uptime;
        private long clientsConnected;
        private long clientsMaximum;
        private long clientsTotal;
        private long clientsDisconnected;
        private long messagesReceived;
        private long messagesSent;
        private long messagesDropped;
        private long packetsReceived;
        private long packetsSent;
        private long subscriptions;
        private int threads;
        private long memoryAlloc;

    }

}
