package com.ryuqq.packsync.application.runtime;

import com.ryuqq.packsync.core.lifecycle.CancellationToken;
import com.ryuqq.packsync.core.lifecycle.StopReason;

/**
 * Continuous watch runtime.
 *
 * <p>Polls immediately, then once per configured interval, until the token is cancelled.</p>
 *
 * <p><strong>Runtime Flow:</strong></p>
 * <pre>
 * run() starts
 *   ↓
 * poll()                       (initial cycle)
 * while (!token.await(interval)):
 *   poll()                     (errors are logged, loop continues)
 *   ↓
 * shut down worker pool
 * return stop reason
 * </pre>
 *
 * <p><strong>Stop Reasons:</strong></p>
 * <ul>
 *   <li>{@link StopReason#GRACEFUL_SHUTDOWN}: token cancelled explicitly (e.g. SIGINT/SIGTERM)</li>
 *   <li>{@link StopReason#DEADLINE_EXCEEDED}: token deadline elapsed</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WatchRuntime {

    /**
     * Runs the watch loop until the token is cancelled.
     *
     * <p>This method blocks the calling thread. Per-cycle failures never stop the loop.</p>
     *
     * @param token lifetime token
     * @return why the loop stopped
     */
    StopReason run(CancellationToken token);
}
