package org.github.zzf.mqttd.protocol.server;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Live client registry, keyed by client identifier. Safe for concurrent use, reads never block writers.
 */
public class Clients {

    private final ConcurrentMap<String, Client> internal = new ConcurrentHashMap<>();

    /**
     * @return the client previously registered with the same id, null if none
     */
    public Client add(Client client) {
        return internal.put(client.getId(), client);
    }

    /**
     * removes the client only if it is still the registered one (a takeover may have replaced it)
     */
    public boolean remove(Client client) {
        return internal.remove(client.getId(), client);
    }

    public Client get(String id) {
        return internal.get(id);
    }

    /**
     * a point-in-time copy
     */
    public List<Client> getAll() {
        return new ArrayList<>(internal.values());
    }

    public List<Client> getByListener(String listenerId) {
        return internal.values().stream()
            .filter(c -> listenerId.equals(c.getListener()))
            .toList();
    }

    public int len() {
        return internal.size();
    }

}
