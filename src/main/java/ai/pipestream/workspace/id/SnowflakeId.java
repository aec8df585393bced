package ai.pipestream.workspace.id;

import java.time.Instant;

/**
 * Decoded view of an identifier issued by {@link SnowflakeGenerator}.
 *
 * @param id          the raw identifier
 * @param timestamp   wall-clock instant the id was issued in
 * @param generatorId generator that issued it
 * @param sequence    position within its millisecond
 */
public record SnowflakeId(long id, Instant timestamp, int generatorId, int sequence) {

    /**
     * Decode an id against the epoch of the generator that issued it.
     */
    public static SnowflakeId decode(long id, long epochMillis) {
        if (id < 0) {
            throw new IllegalArgumentException("Not a snowflake id: " + id);
        }
        long millis = (id >>> SnowflakeGenerator.TIMESTAMP_SHIFT) + epochMillis;
        int generatorId = (int) ((id >>> SnowflakeGenerator.GENERATOR_ID_SHIFT) & SnowflakeGenerator.MAX_GENERATOR_ID);
        int sequence = (int) (id & SnowflakeGenerator.MAX_SEQUENCE);
        return new SnowflakeId(id, Instant.ofEpochMilli(millis), generatorId, sequence);
    }
}
