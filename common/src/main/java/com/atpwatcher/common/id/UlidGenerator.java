package com.atpwatcher.common.id;

import java.security.SecureRandom;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Generates ULIDs: 48-bit millisecond timestamp followed by 80 random bits,
 * rendered as 26 Crockford Base32 characters.
 *
 * <p>Alert ids are minted from the alert's own timestamp so that ids sort in
 * the same order as the alert log.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class UlidGenerator {

    private static final char[] ENCODING = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final int TIME_CHARS = 10;
    private static final int RANDOM_CHARS = 16;
    private static final SecureRandom RANDOM = new SecureRandom();

    public static String generate() {
        return generate(Instant.now());
    }

    public static String generate(Instant timestamp) {
        var millis = timestamp.toEpochMilli();
        if (millis < 0 || millis >>> 48 != 0) {
            throw new IllegalArgumentException("Timestamp outside ULID range: " + timestamp);
        }
        var randomness = new byte[10];
        RANDOM.nextBytes(randomness);

        var chars = new char[TIME_CHARS + RANDOM_CHARS];
        for (int i = TIME_CHARS - 1; i >= 0; i--) {
            chars[i] = ENCODING[(int) (millis & 0x1F)];
            millis >>>= 5;
        }

        // 80 random bits as two 40-bit halves, 8 chars each
        encodeForty(chars, TIME_CHARS, randomness, 0);
        encodeForty(chars, TIME_CHARS + 8, randomness, 5);
        return new String(chars);
    }

    private static void encodeForty(char[] target, int offset, byte[] source, int from) {
        long bits = 0;
        for (int i = from; i < from + 5; i++) {
            bits = (bits << 8) | (source[i] & 0xFF);
        }
        for (int i = offset + 7; i >= offset; i--) {
            target[i] = ENCODING[(int) (bits & 0x1F)];
            bits >>>= 5;
        }
    }
}
