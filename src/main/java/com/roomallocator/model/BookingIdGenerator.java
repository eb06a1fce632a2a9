package com.roomallocator.model;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issues booking ids of the form {@code BK<yyyyMMddHHmmss><6 random chars>}.
 * <p>
 * Timestamp plus random suffix alone can collide (two bookings in the same
 * second drawing the same suffix). Every issued id is remembered and a
 * colliding draw is retried, so ids from one generator are unique.
 */
public class BookingIdGenerator {
    static final String PREFIX = "BK";
    static final int SUFFIX_LENGTH = 6;
    static final int MAX_ATTEMPTS = 32;

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final Clock clock;
    private final Random random;
    private final Set<String> issued = ConcurrentHashMap.newKeySet();

    public BookingIdGenerator() {
        this(Clock.systemDefaultZone(), new SecureRandom());
    }

    public BookingIdGenerator(Clock clock, Random random) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Returns a fresh id never returned (or reserved) before by this generator.
     *
     * @throws IllegalStateException if no unique id could be drawn in {@value #MAX_ATTEMPTS} attempts
     */
    public String next() {
        String stamp = now().format(STAMP);
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String candidate = PREFIX + stamp + randomSuffix();
            if (issued.add(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Could not generate a unique booking id after " + MAX_ATTEMPTS + " attempts");
    }

    /**
     * Marks an externally supplied id as taken.
     *
     * @return false if the id was already issued or reserved
     */
    public boolean reserve(String bookingId) {
        return issued.add(bookingId);
    }

    /**
     * Current time on the generator's clock; used as booking creation timestamp.
     */
    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private String randomSuffix() {
        StringBuilder sb = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
