package org.github.zzf.mqttd.auth;

public enum Decision {

    ALLOW,
    DENY,
    ;

    public boolean isAllowed() {
        return this == ALLOW;
    }

    static Decision of(boolean allowed) {
        return allowed ? ALLOW : DENY;
    }

}
