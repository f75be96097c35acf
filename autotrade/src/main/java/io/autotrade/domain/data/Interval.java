package io.autotrade.domain.data;

import java.time.Duration;
import java.time.Instant;

/**
 * Bar interval length in whole minutes.
 *
 * Buckets are aligned to the unix epoch: a bucket starts at
 * {@code floor(epochSeconds / seconds) * seconds}.
 */
public record Interval(int minutes) {

    public static final Interval ONE_MINUTE = new Interval(1);
    public static final Interval FIVE_MINUTES = new Interval(5);
    public static final Interval FIFTEEN_MINUTES = new Interval(15);
    public static final Interval ONE_HOUR = new Interval(60);
    public static final Interval FOUR_HOURS = new Interval(240);
    public static final Interval ONE_DAY = new Interval(1440);

    public Interval {
        if (minutes <= 0) {
            throw new IllegalArgumentException("Interval must be a positive number of minutes: " + minutes);
        }
    }

    public static Interval ofMinutes(int minutes) {
        return new Interval(minutes);
    }

    /**
     * Convert a duration that is a whole number of minutes.
     */
    public static Interval of(Duration duration) {
        if (duration.isNegative() || duration.isZero() || duration.toSeconds() % 60 != 0 || duration.getNano() != 0) {
            throw new IllegalArgumentException("Invalid size of interval: " + duration);
        }
        return new Interval(Math.toIntExact(duration.toMinutes()));
    }

    public long seconds() {
        return minutes * 60L;
    }

    public Duration toDuration() {
        return Duration.ofMinutes(minutes);
    }

    /**
     * Start of the bucket containing the given instant.
     */
    public Instant floor(Instant timestamp) {
        long epoch = timestamp.getEpochSecond();
        return Instant.ofEpochSecond(Math.floorDiv(epoch, seconds()) * seconds());
    }

    /**
     * True if the instant is exactly on a bucket boundary.
     */
    public boolean isAligned(Instant timestamp) {
        return timestamp.getNano() == 0 && Math.floorMod(timestamp.getEpochSecond(), seconds()) == 0;
    }

    /**
     * True if this interval is a whole multiple of {@code finer}.
     */
    public boolean isMultipleOf(Interval finer) {
        return minutes % finer.minutes == 0;
    }

    /**
     * Suffix used in partition names, e.g. {@code 60mins}.
     */
    public String label() {
        return minutes + "mins";
    }

    @Override
    public String toString() {
        return label();
    }
}
