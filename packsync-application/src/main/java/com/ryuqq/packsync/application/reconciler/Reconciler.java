package com.ryuqq.packsync.application.reconciler;

import com.ryuqq.packsync.core.lifecycle.CancellationToken;

/**
 * Registry reconciler.
 *
 * <p>Runs one poll cycle that brings locally generated packs in line with the
 * registry's current contents.</p>
 *
 * <p><strong>Cycle Flow:</strong></p>
 * <pre>
 * poll() starts
 *   ↓
 * 1. Read lastPoll from StateStore (absent on first run)
 * 2. Fetch server records from the registry (updatedSince = lastPoll)
 * 3. Reduce records to GenerationTasks (name / status / package / transport filters + StateStore)
 * 4. Dispatch tasks to a bounded worker pool → PackGenerator
 * 5. Record successful generations in StateStore
 * 6. Advance lastPoll to the cycle start and persist
 * </pre>
 *
 * <p><strong>Failure Semantics:</strong></p>
 * <ul>
 *   <li>Fetch failure → {@link FetchFailedException}, lastPoll is not advanced</li>
 *   <li>Task failures never affect sibling tasks</li>
 *   <li>"already exists" failures are benign and only logged</li>
 *   <li>Any other task failure is critical → {@link CriticalGenerationException},
 *       thrown after state has been persisted</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Reconciler {

    /**
     * Executes a single poll cycle.
     *
     * @param token cancellation token; queued tasks are skipped once it is cancelled
     * @return report describing the cycle
     * @throws FetchFailedException if the registry could not be read
     * @throws CriticalGenerationException if at least one task failed critically
     */
    PollReport poll(CancellationToken token);
}
