package org.github.zzf.mqttd.auth;

/**
 * The access file (or an equivalent in-code ledger) is not usable: an illegal topic filter, an unknown permission
 * level, a record of the wrong shape.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }

}
