package in.papersim.domain.data;

import java.time.Duration;
import java.time.Instant;

/**
 * Bar sizes supported by the reconciler.
 *
 * Each constant carries the trade-facing label, the exchange interval code and the bar length.
 */
public enum Timeframe {
    MINUTE_1("1m", "1", Duration.ofMinutes(1)),
    MINUTE_3("3m", "3", Duration.ofMinutes(3)),
    MINUTE_5("5m", "5", Duration.ofMinutes(5)),
    MINUTE_15("15m", "15", Duration.ofMinutes(15)),
    MINUTE_30("30m", "30", Duration.ofMinutes(30)),
    HOUR_1("1h", "60", Duration.ofHours(1)),
    HOUR_2("2h", "120", Duration.ofHours(2)),
    HOUR_4("4h", "240", Duration.ofHours(4)),
    HOUR_6("6h", "360", Duration.ofHours(6)),
    HOUR_12("12h", "720", Duration.ofHours(12)),
    DAY_1("1d", "D", Duration.ofDays(1));

    /** Timeframe assumed when a trade and its recommendation both leave it blank. */
    public static final String DEFAULT_LABEL = "1h";

    private final String label;
    private final String intervalCode;
    private final Duration duration;

    Timeframe(String label, String intervalCode, Duration duration) {
        this.label = label;
        this.intervalCode = intervalCode;
        this.duration = duration;
    }

    public String getLabel() {
        return label;
    }

    public String getIntervalCode() {
        return intervalCode;
    }

    public Duration getDuration() {
        return duration;
    }

    public long getMillis() {
        return duration.toMillis();
    }

    /**
     * Parse a trade timeframe label ("1h", "15m", "1D").
     *
     * @throws IllegalArgumentException for unsupported labels
     */
    public static Timeframe fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Timeframe label is required");
        }
        String normalized = label.trim().toLowerCase();
        for (Timeframe tf : values()) {
            if (tf.label.equals(normalized)) {
                return tf;
            }
        }
        throw new IllegalArgumentException("Unsupported timeframe: " + label);
    }

    /**
     * Start of the bar containing {@code instant}.
     */
    public Instant floor(Instant instant) {
        long ms = instant.toEpochMilli();
        return Instant.ofEpochMilli(ms - Math.floorMod(ms, getMillis()));
    }

    /**
     * Start of the first bar beginning at or after {@code instant}.
     */
    public Instant ceil(Instant instant) {
        Instant floor = floor(instant);
        return floor.equals(instant) ? floor : floor.plusMillis(getMillis());
    }

    /**
     * Start of the most recent bar that is fully closed at {@code now}.
     */
    public Instant latestCompleteBarStart(Instant now) {
        return floor(now).minusMillis(getMillis());
    }

    /**
     * A bar is complete once a full interval has elapsed since its start.
     */
    public boolean isComplete(Instant barStart, Instant now) {
        return now.toEpochMilli() - barStart.toEpochMilli() >= getMillis();
    }
}
