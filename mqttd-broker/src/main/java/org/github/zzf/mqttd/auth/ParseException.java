package org.github.zzf.mqttd.auth;

/**
 * The access file is not well-formed YAML.
 */
public class ParseException extends ConfigException {

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }

}
