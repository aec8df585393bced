package ai.pipestream.workspace.id;

import ai.pipestream.workspace.error.ClockSkewException;
import com.google.common.base.Preconditions;
import org.jboss.logging.Logger;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.LockSupport;
import java.util.function.LongSupplier;

/**
 * Issues 64-bit, time-ordered identifiers.
 * <p>
 * Layout (most significant first):
 * <ul>
 *   <li>1 bit: always 0, keeping ids positive</li>
 *   <li>41 bits: milliseconds since the configured epoch</li>
 *   <li>10 bits: generator id</li>
 *   <li>12 bits: per-millisecond sequence</li>
 * </ul>
 * The only shared mutable state is a single packed {@code (timestamp, sequence)} word
 * advanced by compare-and-swap. Ids from one generator are strictly increasing in
 * issuance order.
 */
public class SnowflakeGenerator {

    private static final Logger LOG = Logger.getLogger(SnowflakeGenerator.class);

    public static final int TIMESTAMP_BITS = 41;
    public static final int GENERATOR_ID_BITS = 10;
    public static final int SEQUENCE_BITS = 12;

    public static final long MAX_GENERATOR_ID = (1L << GENERATOR_ID_BITS) - 1;
    public static final long MAX_SEQUENCE = (1L << SEQUENCE_BITS) - 1;
    public static final long MAX_TIMESTAMP = (1L << TIMESTAMP_BITS) - 1;

    static final int GENERATOR_ID_SHIFT = SEQUENCE_BITS;
    static final int TIMESTAMP_SHIFT = SEQUENCE_BITS + GENERATOR_ID_BITS;

    private final long generatorId;
    private final long epochMillis;
    private final long skewToleranceMillis;
    private final LongSupplier clock;

    // (timestamp since epoch << SEQUENCE_BITS) | sequence of the last issued id; -1 before the first
    private final AtomicLong state = new AtomicLong(-1L);
    private volatile boolean halted;

    public SnowflakeGenerator(long generatorId, long epochMillis, long skewToleranceMillis) {
        this(generatorId, epochMillis, skewToleranceMillis, System::currentTimeMillis);
    }

    public SnowflakeGenerator(long generatorId, long epochMillis, long skewToleranceMillis, LongSupplier clock) {
        Preconditions.checkArgument(generatorId >= 0 && generatorId <= MAX_GENERATOR_ID,
                "generatorId must be in [0, %s], was %s", MAX_GENERATOR_ID, generatorId);
        Preconditions.checkArgument(skewToleranceMillis >= 0, "skew tolerance must not be negative");
        Preconditions.checkNotNull(clock, "clock");
        long now = clock.getAsLong();
        Preconditions.checkArgument(epochMillis <= now,
                "epoch %s lies in the future (now=%s)", epochMillis, now);
        Preconditions.checkArgument(now - epochMillis <= MAX_TIMESTAMP,
                "epoch %s is too far in the past for a %s-bit timestamp", epochMillis, TIMESTAMP_BITS);

        this.generatorId = generatorId;
        this.epochMillis = epochMillis;
        this.skewToleranceMillis = skewToleranceMillis;
        this.clock = clock;
    }

    /**
     * Issue the next identifier.
     *
     * @return a new id, greater than every id previously issued by this generator
     * @throws ClockSkewException if the clock is behind the last issued timestamp by more
     *                            than the tolerance; issuance stays refused until it catches up
     */
    public long next() {
        while (true) {
            long now = clock.getAsLong() - epochMillis;
            long previous = state.get();
            long lastTimestamp = previous < 0 ? -1 : previous >>> SEQUENCE_BITS;

            if (now < lastTimestamp) {
                long drift = lastTimestamp - now;
                if (drift > skewToleranceMillis) {
                    if (!halted) {
                        halted = true;
                        LOG.warnf("Clock moved backwards by %d ms on generator %d; halting id issuance",
                                drift, generatorId);
                    }
                    throw new ClockSkewException(lastTimestamp + epochMillis, now + epochMillis);
                }
                LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(drift));
                continue;
            }

            long candidate;
            if (now > lastTimestamp) {
                candidate = now << SEQUENCE_BITS;
            } else if ((previous & MAX_SEQUENCE) < MAX_SEQUENCE) {
                candidate = previous + 1;
            } else {
                // sequence exhausted for this millisecond
                Thread.onSpinWait();
                continue;
            }

            if (state.compareAndSet(previous, candidate)) {
                if (halted) {
                    halted = false;
                    LOG.infof("Clock caught up on generator %d; id issuance resumed", generatorId);
                }
                return compose(candidate >>> SEQUENCE_BITS, candidate & MAX_SEQUENCE);
            }
        }
    }

    /**
     * Whether the last attempt failed because of clock skew and no id has been issued since.
     */
    public boolean isHalted() {
        return halted;
    }

    public long getGeneratorId() {
        return generatorId;
    }

    public long getEpochMillis() {
        return epochMillis;
    }

    /**
     * Wall-clock millis of the last issued id, or -1 if none has been issued yet.
     */
    public long getLastTimestampMillis() {
        long current = state.get();
        return current < 0 ? -1 : (current >>> SEQUENCE_BITS) + epochMillis;
    }

    private long compose(long timestamp, long sequence) {
        if (timestamp > MAX_TIMESTAMP) {
            throw new IllegalStateException("Timestamp overflowed " + TIMESTAMP_BITS + " bits; epoch exhausted");
        }
        return (timestamp << TIMESTAMP_SHIFT) | (generatorId << GENERATOR_ID_SHIFT) | sequence;
    }
}
