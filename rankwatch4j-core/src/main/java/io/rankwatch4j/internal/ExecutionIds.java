package io.rankwatch4j.internal;

import java.security.SecureRandom;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Execution ids: {@code <jobId>-<yyyyMMddHHmmss>-<random>}.
 */
public final class ExecutionIds {
    private static final char[] ALPHABET =
            "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final int SUFFIX_SIZE = 6;
    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private static final SecureRandom RANDOM = new SecureRandom();

    private ExecutionIds() {
    }

    public static String next(String jobId, Instant at) {
        char[] suffix = new char[SUFFIX_SIZE];
        for (int i = 0; i < SUFFIX_SIZE; i++) {
            suffix[i] = ALPHABET[RANDOM.nextInt(ALPHABET.length)];
        }
        return jobId + "-" + STAMP.format(at) + "-" + new String(suffix);
    }
}
