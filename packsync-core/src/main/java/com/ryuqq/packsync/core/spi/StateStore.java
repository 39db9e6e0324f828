package com.ryuqq.packsync.core.spi;

import com.ryuqq.packsync.core.model.ServerState;
import com.ryuqq.packsync.core.model.WatchState;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Idempotency state of previously generated (namespace, name, version, packageType,
 * transportType) tuples.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Answer whether a tuple needs (re)generation</li>
 *   <li>Record successful generations (upsert by composite key)</li>
 *   <li>Track the start time of the last completed poll</li>
 *   <li>Persist the whole state durably</li>
 * </ul>
 *
 * <p><strong>Regeneration Policy:</strong></p>
 * <pre>
 * needsGeneration = key absent
 *                   OR observedUpdatedAt &gt; stored.generatedAt   (strictly after)
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: workers call {@link #setServer} concurrently while others read</li>
 *   <li>Write order between concurrent callers is unspecified</li>
 *   <li>{@link #save()} must never leave a partially written state behind</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StateStore {

    /**
     * Returns whether the tuple needs generation.
     *
     * @param namespace the server namespace
     * @param name the server name
     * @param version the server version
     * @param packageType the package registry type
     * @param transportType the registry-side transport type
     * @param updatedAt the observed update time of the upstream record
     * @return true if the key is absent or {@code updatedAt} is strictly after the stored generatedAt
     */
    boolean needsGeneration(
        String namespace,
        String name,
        String version,
        String packageType,
        String transportType,
        Instant updatedAt
    );

    /**
     * Inserts or replaces the state stored under {@link ServerState#key()}.
     *
     * @param state the state to store
     * @throws IllegalArgumentException if state is null
     */
    void setServer(ServerState state);

    /**
     * Looks up a state by composite key.
     *
     * @param key the composite key
     * @return the stored state, if present
     */
    Optional<ServerState> getServer(String key);

    /**
     * Records the start time of the most recent poll.
     *
     * @param lastPoll the poll start time
     */
    void updateLastPoll(Instant lastPoll);

    /**
     * Returns the start time of the most recent poll.
     *
     * @return the last poll time, empty before the first poll
     */
    Optional<Instant> getLastPoll();

    /**
     * Removes entries whose {@code updatedAt} is before {@code now - maxAge}.
     *
     * @param maxAge the retention period
     * @param now the reference time
     * @return the number of removed entries
     */
    int pruneOlderThan(Duration maxAge, Instant now);

    /**
     * Returns the number of stored entries.
     *
     * @return the entry count
     */
    int size();

    /**
     * Returns an immutable copy of the current state.
     *
     * @return the snapshot
     */
    WatchState snapshot();

    /**
     * Persists the current state.
     *
     * @throws StateStoreException if the state cannot be written
     */
    void save();
}
