package com.ryuqq.packsync.core.spi;

import com.ryuqq.packsync.core.lifecycle.CancellationToken;
import com.ryuqq.packsync.core.model.ListServersQuery;
import com.ryuqq.packsync.core.model.ServerPage;
import com.ryuqq.packsync.core.model.ServerRecord;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Read access to the upstream server registry.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Paginated listing with server-side narrowing (search, version, updated_since)</li>
 *   <li>Single-record fetch with a distinguishable "not found" failure</li>
 *   <li>Latest active version resolution by semantic-version ordering</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: methods may be called from multiple threads</li>
 *   <li>Transient failures (5xx, transport errors) are retried internally</li>
 *   <li>Client errors (4xx) are never retried</li>
 *   <li>Cancellation of the token aborts waits and in-flight requests promptly</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RegistryGateway {

    /**
     * Fetches one page of servers.
     *
     * @param query the listing query (limit is capped at 100)
     * @param token the cancellation token
     * @return the page
     * @throws RuntimeException registry specific failure kinds, see the implementation
     */
    ServerPage listServers(ListServersQuery query, CancellationToken token);

    /**
     * Fetches a single server record by id.
     *
     * @param id the server id
     * @param token the cancellation token
     * @return the server record
     */
    ServerRecord getServer(String id, CancellationToken token);

    /**
     * Resolves the active record with the greatest semantic version for an exact server name.
     *
     * <p>Records that are not active, and records whose version does not parse as a semantic
     * version, are ignored.</p>
     *
     * @param name the full server name ({@code namespace/name})
     * @param token the cancellation token
     * @return the latest active record
     */
    ServerRecord getLatestActiveServer(String name, CancellationToken token);

    /**
     * Drains every page of a listing, following {@code next_cursor} until exhausted.
     *
     * <p>A cursor that was already followed ends the listing with an error instead of looping.</p>
     *
     * @param query the first-page query
     * @param token the cancellation token
     * @return all servers in page order
     * @throws IllegalStateException if the registry hands back a cursor that was already followed
     */
    default List<ServerRecord> listAllServers(ListServersQuery query, CancellationToken token) {
        List<ServerRecord> all = new ArrayList<>();
        Set<String> followed = new HashSet<>();
        if (query.cursor() != null) {
            followed.add(query.cursor());
        }
        ListServersQuery current = query;
        while (true) {
            ServerPage page = listServers(current, token);
            all.addAll(page.servers());
            if (!page.hasNextPage()) {
                return all;
            }
            if (!followed.add(page.nextCursor())) {
                throw new IllegalStateException("registry returned repeated cursor: " + page.nextCursor());
            }
            current = current.withCursor(page.nextCursor());
        }
    }
}
