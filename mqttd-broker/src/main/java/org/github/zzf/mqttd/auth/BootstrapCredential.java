package org.github.zzf.mqttd.auth;

/**
 * The administrator account added to every ledger that does not already define the username, so that the control
 * plane stays reachable with an empty or missing access file.
 *
 * <p>This is an operational default and not a secret: {@link #DEFAULT} is documented, operators are expected to
 * declare the same username in their access file (which wins) or to pass {@link #NONE}.</p>
 */
public record BootstrapCredential(String username, String password) {

    public static final BootstrapCredential DEFAULT = new BootstrapCredential("YoRHa", "no2typeB");

    public static final BootstrapCredential NONE = new BootstrapCredential("", "");

    public boolean isEnabled() {
        return username != null && !username.isEmpty()
            && password != null && !password.isEmpty();
    }

}
