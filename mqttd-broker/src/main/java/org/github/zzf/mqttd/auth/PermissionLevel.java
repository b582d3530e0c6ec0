package org.github.zzf.mqttd.auth;

/**
 * The four access levels of the access file. The numeric value is only meaningful for the file format, each level
 * is its own capability set.
 */
public enum PermissionLevel {

    DENY(0),
    READ(1),
    WRITE(2),
    READ_WRITE(3),
    ;

    private final int value;

    PermissionLevel(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /**
     * subscribe
     */
    public boolean canRead() {
        return this == READ || this == READ_WRITE;
    }

    /**
     * publish
     */
    public boolean canWrite() {
        return this == WRITE || this == READ_WRITE;
    }

    public boolean permits(Operation operation) {
        return switch (operation) {
            case SUBSCRIBE -> canRead();
            case PUBLISH -> canWrite();
        };
    }

    public static PermissionLevel of(int value) {
        for (PermissionLevel level : values()) {
            if (level.value == value) {
                return level;
            }
        }
        throw new ConfigException("unknown permission level: " + value + ", expected 0..3");
    }

    public enum Operation {
        SUBSCRIBE,
        PUBLISH,
        ;

        public static Operation of(boolean write) {
            return write ? PUBLISH : SUBSCRIBE;
        }
    }

}
