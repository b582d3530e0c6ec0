package org.github.zzf.mqttd.auth;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Base64;
import java.util.zip.CRC32;

/**
 * Reversible password obfuscation for the access file.
 *
 * <p>NOT encryption: the key is public and anybody holding this class can recover the password. It only keeps
 * passwords from being read over a shoulder or grepped out of a config repository.</p>
 *
 * <p>Layout: base64url(reverse(xor(utf8(password) + crc32(password)))).</p>
 */
public final class PasswordObfuscator {

    private static final byte[] KEY = "mqttd:access-file".getBytes(UTF_8);
    private static final int CHECKSUM_LENGTH = 4;

    private PasswordObfuscator() {
    }

    public static String encode(String plain) {
        if (plain == null || plain.isEmpty()) {
            throw new IllegalArgumentException("password is empty");
        }
        byte[] bytes = plain.getBytes(UTF_8);
        byte[] buf = ByteBuffer.allocate(bytes.length + CHECKSUM_LENGTH)
            .put(bytes)
            .putInt((int) crc32(bytes))
            .array();
        xor(buf);
        reverse(buf);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buf);
    }

    /**
     * @throws IllegalArgumentException if {@code coded} was not produced by {@link #encode(String)}
     */
    public static String decode(String coded) {
        if (coded == null || coded.isEmpty()) {
            throw new IllegalArgumentException("coded password is empty");
        }
        byte[] buf = Base64.getUrlDecoder().decode(coded);
        if (buf.length <= CHECKSUM_LENGTH) {
            throw new IllegalArgumentException("coded password is too short");
        }
        reverse(buf);
        xor(buf);
        byte[] bytes = Arrays.copyOf(buf, buf.length - CHECKSUM_LENGTH);
        int checksum = ByteBuffer.wrap(buf, bytes.length, CHECKSUM_LENGTH).getInt();
        if (checksum != (int) crc32(bytes)) {
            throw new IllegalArgumentException("coded password checksum mismatch");
        }
        return new String(bytes, UTF_8);
    }

    /**
     * @return the decoded password, or {@code coded} itself when it is not an obfuscated value
     */
    public static String tryDecode(String coded) {
        if (coded == null || coded.isEmpty()) {
            return "";
        }
        try {
            return decode(coded);
        } catch (IllegalArgumentException e) {
            return coded;
        }
    }

    private static long crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes);
        return crc.getValue();
    }

    private static void xor(byte[] buf) {
        for (int i = 0; i < buf.length; i++) {
            buf[i] ^= KEY[i % KEY.length];
        }
    }

    private static void reverse(byte[] buf) {
        for (int i = 0, j = buf.length - 1; i < j; i++, j--) {
            byte b = buf[i];
            buf[i] = buf[j];
            buf[j] = b;
        }
    }

}
