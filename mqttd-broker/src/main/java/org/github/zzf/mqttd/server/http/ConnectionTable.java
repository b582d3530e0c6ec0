package org.github.zzf.mqttd.server.http;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.github.zzf.mqttd.protocol.server.Client;
import org.github.zzf.mqttd.protocol.server.Subscription;

/**
 * A point-in-time view of the connected clients: inline / local sessions left out, rows ordered by
 * (username, client id), subscriptions of a row in alphabetical order.
 *
 * @param counts listener id -> number of clients, ordered by listener id
 */
public record ConnectionTable(List<Row> rows, Map<String, Integer> counts) {

    static final Comparator<Row> ROW_ORDER = Comparator.comparing(Row::username).thenComparing(Row::clientId);

    public static ConnectionTable of(Collection<Client> clients) {
        List<Row> rows = new ArrayList<>(clients.size());
        Map<String, Integer> counts = new TreeMap<>();
        for (Client c : clients) {
            if (c.isInline()) {
                continue;
            }
            List<String> subscriptions = c.getSubscriptions().values().stream()
                .map(Subscription::topicFilter)
                .sorted()
                .toList();
            rows.add(new Row(c.getUsername(), c.getId(), c.getRemote(), c.getProtocolVersion(), c.getListener(),
                subscriptions));
            counts.merge(c.getListener(), 1, Integer::sum);
        }
        rows.sort(ROW_ORDER);
        return new ConnectionTable(List.copyOf(rows), counts);
    }

    /**
     * "mqtt: 2; ws: 1"
     */
    public String countsText() {
        return counts.entrySet().stream()
            .map(e -> e.getKey() + ": " + e.getValue())
            .collect(Collectors.joining("; "));
    }

    public record Row(String username, String clientId, String remote, int protocolVersion, String listener,
                      List<String> subscriptions) {

        public String subscriptionsText() {
            return String.join("\n", subscriptions);
        }

    }

}
