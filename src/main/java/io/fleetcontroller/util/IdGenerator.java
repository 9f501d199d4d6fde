package io.fleetcontroller.util;

import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

import static io.fleetcontroller.config.Constants.BACKEND_ID_PREFIX;
import static io.fleetcontroller.config.Constants.DRONE_ID_PREFIX;
import static io.fleetcontroller.config.Constants.GENERATED_ID_LENGTH;

/**
 * Generates identifiers for backends, drones, events and bus messages.
 * Backend ids are used as a DNS label in connection URLs, so only lowercase
 * alphanumerics are emitted.
 */
public final class IdGenerator {

    private static final char[] ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();
    private static final int EVENT_SUFFIX_LENGTH = 8;

    private IdGenerator() {
        // Utility class - prevent instantiation
    }

    public static String backendId() {
        return BACKEND_ID_PREFIX + randomString(GENERATED_ID_LENGTH);
    }

    public static String droneId() {
        return DRONE_ID_PREFIX + randomString(GENERATED_ID_LENGTH);
    }

    /**
     * Time-ordered id: zero-padded epoch millis followed by a random suffix, so
     * lexicographic order of etcd keys follows creation time.
     */
    public static String timeOrderedId(Instant timestamp) {
        return String.format("%015d-%s", timestamp.toEpochMilli(), randomString(EVENT_SUFFIX_LENGTH));
    }

    public static String randomString(int length) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return sb.toString();
    }
}
