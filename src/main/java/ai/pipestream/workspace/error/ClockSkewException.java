package ai.pipestream.workspace.error;

/**
 * Raised when the system clock has moved backward past the last issued timestamp by
 * more than the configured tolerance. No identifier is minted while this persists.
 */
public class ClockSkewException extends WorkspaceAccessException {

    private final long lastTimestamp;
    private final long observedTimestamp;

    public ClockSkewException(long lastTimestamp, long observedTimestamp) {
        super(ErrorCategory.UNAVAILABLE, String.format(
                "Clock moved backwards by %d ms (last=%d, now=%d); refusing to issue ids",
                lastTimestamp - observedTimestamp, lastTimestamp, observedTimestamp));
        this.lastTimestamp = lastTimestamp;
        this.observedTimestamp = observedTimestamp;
    }

    public long lastTimestamp() {
        return lastTimestamp;
    }

    public long observedTimestamp() {
        return observedTimestamp;
    }
}
