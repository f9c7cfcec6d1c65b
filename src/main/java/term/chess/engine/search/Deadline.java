package term.chess.engine.search;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Point in time after which a search must stop deepening and return its best completed result.
 * Built on a nanosecond clock that tests may replace.
 */
public final class Deadline {
    private static final LongSupplier SYSTEM_CLOCK = System::nanoTime;
    private static final Deadline NEVER = new Deadline(Long.MAX_VALUE, SYSTEM_CLOCK, true);

    private final long expiresAtNs;
    private final LongSupplier clock;
    private final boolean infinite;

    private Deadline(long expiresAtNs, LongSupplier clock, boolean infinite) {
        this.expiresAtNs = expiresAtNs;
        this.clock = clock;
        this.infinite = infinite;
    }

    public static Deadline never() {
        return NEVER;
    }

    public static Deadline after(Duration duration) {
        return after(duration, SYSTEM_CLOCK);
    }

    public static Deadline after(Duration duration, LongSupplier nanoClock) {
        long now = nanoClock.getAsLong();
        long budget = toNanosSaturated(duration);
        // Saturate instead of wrapping around for huge durations
        long expiresAt = budget > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + budget;
        return new Deadline(expiresAt, nanoClock, false);
    }

    /** Whichever of the two deadlines comes first. */
    public Deadline earliest(Deadline other) {
        if (other == null || other.infinite) {
            return this;
        }
        if (infinite) {
            return other;
        }
        return remainingNanos() <= other.remainingNanos() ? this : other;
    }

    public boolean expired() {
        return !infinite && clock.getAsLong() - expiresAtNs >= 0;
    }

    /** Time left, {@link Duration#ZERO} once expired. */
    public Duration remaining() {
        if (infinite) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        return Duration.ofNanos(Math.max(0L, remainingNanos()));
    }

    public boolean isInfinite() {
        return infinite;
    }

    private long remainingNanos() {
        return expiresAtNs - clock.getAsLong();
    }

    private static long toNanosSaturated(Duration duration) {
        if (duration.isNegative()) {
            return 0L;
        }
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    @Override
    public String toString() {
        return infinite ? "Deadline[never]" : "Deadline[remaining=" + remaining().toMillis() + "ms]";
    }
}
