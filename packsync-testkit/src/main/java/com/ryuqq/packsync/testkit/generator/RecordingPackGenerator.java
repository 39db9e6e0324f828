package com.ryuqq.packsync.testkit.generator;

import com.ryuqq.packsync.core.generator.GenerateOptions;
import com.ryuqq.packsync.core.generator.PackGenerator;
import com.ryuqq.packsync.core.generator.PackGeneratorException;
import com.ryuqq.packsync.core.lifecycle.CancellationToken;
import com.ryuqq.packsync.core.model.ServerPackage;
import com.ryuqq.packsync.core.model.ServerRecord;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * PackGenerator test double that records calls and measures concurrency.
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Records every call in arrival order ({@link #calls()})</li>
 *   <li>Tracks in-flight and peak concurrent calls ({@link #peakConcurrency()})</li>
 *   <li>Fails calls for configured server names ({@link #failFor(String, Exception)})</li>
 *   <li>Simulates work with a fixed duration ({@link #withWorkDuration(Duration)})</li>
 *   <li>Runs a hook before each call ({@link #beforeEach(Consumer)})</li>
 * </ul>
 *
 * <p>Thread-safe: intended to be called from the Watcher's worker pool.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingPackGenerator implements PackGenerator {

    /**
     * A recorded generate call.
     *
     * @param serverName full server name
     * @param version server version
     * @param packageType package registry type
     * @param transportType user-facing transport type passed to the generator
     * @param options generation options
     */
    public record Call(String serverName, String version, String packageType, String transportType, GenerateOptions options) {
    }

    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private final Map<String, Exception> failures = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();
    private volatile Duration workDuration = Duration.ZERO;
    private volatile Consumer<ServerRecord> beforeEach = server -> { };

    @Override
    public void generate(
        CancellationToken token,
        ServerRecord server,
        ServerPackage serverPackage,
        String transportType,
        GenerateOptions options
    ) throws PackGeneratorException {
        int current = inFlight.incrementAndGet();
        peak.accumulateAndGet(current, Math::max);
        try {
            calls.add(new Call(server.name(), server.version(), serverPackage.registryType(), transportType, options));
            beforeEach.accept(server);
            simulateWork();

            Exception failure = failures.get(server.name());
            if (failure instanceof PackGeneratorException generatorException) {
                throw generatorException;
            }
            if (failure instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (failure != null) {
                throw new PackGeneratorException(failure.getMessage(), failure);
            }
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void simulateWork() throws PackGeneratorException {
        Duration duration = workDuration;
        if (duration.isZero()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PackGeneratorException("interrupted", e);
        }
    }

    /**
     * Makes every call for {@code serverName} throw {@code failure}.
     *
     * @param serverName full server name
     * @param failure exception to throw (checked exceptions other than PackGeneratorException are wrapped)
     * @return this generator
     */
    public RecordingPackGenerator failFor(String serverName, Exception failure) {
        failures.put(serverName, failure);
        return this;
    }

    /**
     * Makes each call take at least {@code duration}.
     */
    public RecordingPackGenerator withWorkDuration(Duration duration) {
        this.workDuration = duration == null ? Duration.ZERO : duration;
        return this;
    }

    /**
     * Runs {@code hook} at the start of each call, on the worker thread.
     */
    public RecordingPackGenerator beforeEach(Consumer<ServerRecord> hook) {
        this.beforeEach = hook == null ? server -> { } : hook;
        return this;
    }

    /**
     * Recorded calls in arrival order.
     */
    public List<Call> calls() {
        return List.copyOf(calls);
    }

    /**
     * Number of recorded calls.
     */
    public int callCount() {
        return calls.size();
    }

    /**
     * Highest number of calls observed in flight at the same time.
     */
    public int peakConcurrency() {
        return peak.get();
    }
}
