package net.seanstash.util;

import java.security.SecureRandom;
import java.util.UUID;

/**
 * Identifier helpers for analysis and lease rows.
 */
public final class IdGenerator {

    private static final SecureRandom RANDOM = new SecureRandom();

    private IdGenerator() {
    }

    /** Time-ordered epoch UUID v7 string */
    public static String uuidV7() {
        long ts = System.currentTimeMillis() & 0xFFFFFFFFFFFFL; // 48-bit millis
        int randA = RANDOM.nextInt(1 << 12) & 0x0FFF;

        long msb = (ts << 16) | (0x7L << 12) | randA;

        long randB = RANDOM.nextLong();
        long lsb = (randB & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L; // IETF variant

        return new UUID(msb, lsb).toString();
    }
}
