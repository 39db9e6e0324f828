package com.ryuqq.packsync.adapter.runner;

import com.ryuqq.packsync.adapter.filestore.FileStateStore;
import com.ryuqq.packsync.application.reconciler.CriticalGenerationException;
import com.ryuqq.packsync.application.reconciler.FetchFailedException;
import com.ryuqq.packsync.application.reconciler.PollReport;
import com.ryuqq.packsync.application.reconciler.Reconciler;
import com.ryuqq.packsync.application.runtime.WatchRuntime;
import com.ryuqq.packsync.core.filter.TaskFilter;
import com.ryuqq.packsync.core.filter.TransportTypes;
import com.ryuqq.packsync.core.generator.PackAlreadyExistsException;
import com.ryuqq.packsync.core.generator.PackGenerator;
import com.ryuqq.packsync.core.lifecycle.CancellationToken;
import com.ryuqq.packsync.core.lifecycle.OperationCancelledException;
import com.ryuqq.packsync.core.lifecycle.StopReason;
import com.ryuqq.packsync.core.model.GenerationTask;
import com.ryuqq.packsync.core.model.ListServersQuery;
import com.ryuqq.packsync.core.model.ServerRecord;
import com.ryuqq.packsync.core.model.ServerState;
import com.ryuqq.packsync.core.outcome.Failed;
import com.ryuqq.packsync.core.outcome.FailureSeverity;
import com.ryuqq.packsync.core.outcome.Generated;
import com.ryuqq.packsync.core.outcome.Skipped;
import com.ryuqq.packsync.core.outcome.TaskOutcome;
import com.ryuqq.packsync.core.spi.RegistryGateway;
import com.ryuqq.packsync.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry 감시 및 pack 생성 Reconciler 구현체.
 *
 * <p>Registry를 주기적으로 폴링하여 새로 나타나거나 변경된 서버 패키지에 대해 pack을 생성하고,
 * 생성 결과를 StateStore에 기록합니다.</p>
 *
 * <p><strong>처리 흐름 (poll 1회):</strong></p>
 * <pre>
 * poll() 호출
 *   ↓
 * 1. updatedSince = stateStore.getLastPoll()
 * 2. fetch: 이름 필터가 있으면 이름별 검색 (name@version 중복 제거), 없으면 전체 목록
 *      - 실패 → FetchFailedException (lastPoll 유지)
 * 3. TaskFilter.select() → [Task1, Task2, ...]
 * 4. 각 Task를 워커 풀에 제출 (maxConcurrent 제한)
 *      - 성공 → setServer(generatedAt = now)
 *      - PackAlreadyExistsException → BENIGN
 *      - 그 외 → CRITICAL
 * 5. lastPoll = 사이클 시작 시각, 보존 기간 정리, save()
 * 6. CRITICAL 실패가 있으면 CriticalGenerationException (저장 이후)
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>poll()은 단일 제어 스레드에서 호출되며 사이클끼리 겹치지 않음</li>
 *   <li>생성 작업은 고정 크기 워커 풀에서 최대 maxConcurrent개까지 동시 실행</li>
 *   <li>워커 간 공유 자원은 StateStore뿐이며 StateStore가 자체적으로 동기화</li>
 *   <li>취소 시 대기 중인 작업은 건너뛰고, 이미 시작된 생성 호출은 중단하지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Watcher implements Reconciler, WatchRuntime, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Watcher.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final RegistryGateway registry;
    private final StateStore stateStore;
    private final PackGenerator generator;
    private final WatcherConfig config;
    private final Clock clock;
    private final TaskFilter taskFilter;
    private final ExecutorService workerExecutor;

    /**
     * 생성자 (시스템 UTC Clock 사용).
     *
     * @param registry Registry 게이트웨이
     * @param stateStore 상태 저장소
     * @param generator pack 생성기
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public Watcher(RegistryGateway registry, StateStore stateStore, PackGenerator generator, WatcherConfig config) {
        this(registry, stateStore, generator, config, Clock.systemUTC());
    }

    /**
     * 생성자 (커스텀 Clock 주입).
     *
     * @param registry Registry 게이트웨이
     * @param stateStore 상태 저장소
     * @param generator pack 생성기
     * @param config 설정
     * @param clock 시각 공급원
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public Watcher(
        RegistryGateway registry,
        StateStore stateStore,
        PackGenerator generator,
        WatcherConfig config,
        Clock clock
    ) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (stateStore == null) {
            throw new IllegalArgumentException("stateStore cannot be null");
        }
        if (generator == null) {
            throw new IllegalArgumentException("generator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }

        this.registry = registry;
        this.stateStore = stateStore;
        this.generator = generator;
        this.config = config;
        this.clock = clock;
        this.taskFilter = new TaskFilter(
            config.nameFilter(),
            config.packageTypeFilter(),
            config.transportTypeFilter(),
            config.allowDeprecated(),
            config.generateOptions().forceOverwrite()
        );
        this.workerExecutor = Executors.newFixedThreadPool(config.maxConcurrent(), new WorkerThreadFactory());
    }

    /**
     * 설정의 stateFile에서 상태를 로드하여 Watcher 생성.
     *
     * @param registry Registry 게이트웨이
     * @param generator pack 생성기
     * @param config 설정
     * @return Watcher
     * @throws com.ryuqq.packsync.core.spi.StateStoreException 상태 파일을 읽을 수 없는 경우
     */
    public static Watcher create(RegistryGateway registry, PackGenerator generator, WatcherConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        StateStore stateStore = FileStateStore.load(Path.of(config.stateFile()));
        return new Watcher(registry, stateStore, generator, config);
    }

    @Override
    public StopReason run(CancellationToken token) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        log.info("Starting watch (interval={}s, maxConcurrent={}, stateFile={})",
            config.pollIntervalSeconds(), config.maxConcurrent(), config.stateFile());

        try {
            pollSafely(token);
            while (!token.await(config.pollInterval())) {
                pollSafely(token);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Watch loop interrupted");
        } finally {
            close();
        }

        StopReason reason = token.stopReason().orElse(StopReason.GRACEFUL_SHUTDOWN);
        log.info("Watch stopped ({})", reason);
        return reason;
    }

    /**
     * 사이클 1회 실행, 예외는 로그만 남기고 루프를 유지.
     */
    private void pollSafely(CancellationToken token) {
        try {
            poll(token);
        } catch (CriticalGenerationException e) {
            log.error("Poll cycle finished with errors: {}", e.getMessage());
        } catch (OperationCancelledException e) {
            log.info("Poll cycle cancelled: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Poll cycle failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public PollReport poll(CancellationToken token) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        Instant updatedSince = stateStore.getLastPoll().orElse(null);
        log.info("Polling registry (updatedSince={})", updatedSince);

        List<ServerRecord> servers = fetchServers(updatedSince, token);
        log.info("Fetched {} servers from registry", servers.size());

        List<GenerationTask> tasks = taskFilter.select(servers, stateStore);
        if (tasks.isEmpty()) {
            log.info("No servers need pack generation");
            finishCycle(startedAt);
            return PollReport.empty(startedAt, elapsedSince(startNanos), servers.size());
        }

        log.info("{} packs need generation", tasks.size());
        Dispatched dispatched = dispatch(tasks, token);
        try {
            finishCycle(startedAt);
        } finally {
            if (dispatched.interrupted()) {
                Thread.currentThread().interrupt();
            }
        }

        PollReport report = PollReport.from(startedAt, elapsedSince(startNanos), servers.size(), dispatched.outcomes());
        log.info("Poll cycle complete: fetched={}, attempted={}, succeeded={}, skipped={}, failed={} (critical={}) in {}ms",
            report.fetched(), report.attempted(), report.succeeded(), report.skipped(), report.failed(),
            report.criticalFailures().size(), report.duration().toMillis());

        if (report.hasCriticalFailures()) {
            throw new CriticalGenerationException(report);
        }
        return report;
    }

    /**
     * Registry 조회.
     *
     * @throws FetchFailedException 조회 실패 시
     */
    private List<ServerRecord> fetchServers(Instant updatedSince, CancellationToken token) {
        ListServersQuery base = ListServersQuery.firstPage().withUpdatedSince(updatedSince);
        try {
            if (config.nameFilter().isEmpty()) {
                return registry.listAllServers(base, token);
            }
            return fetchServersByName(base, token);
        } catch (OperationCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to fetch servers from registry: {}", e.getMessage());
            throw new FetchFailedException("failed to fetch servers from registry: " + e.getMessage(), e);
        }
    }

    private List<ServerRecord> fetchServersByName(ListServersQuery base, CancellationToken token) {
        Map<String, ServerRecord> unique = new LinkedHashMap<>();
        for (String name : config.nameFilter().names()) {
            log.debug("Fetching servers by name: {}", name);
            for (ServerRecord server : registry.listAllServers(base.withSearch(name), token)) {
                unique.putIfAbsent(server.nameAndVersion(), server);
            }
        }
        log.debug("Fetch by name completed: {} servers", unique.size());
        return new ArrayList<>(unique.values());
    }

    /**
     * 모든 Task를 워커 풀에 제출하고 결과를 수집.
     *
     * <p>결과는 제출 순서대로 반환되지만 실제 완료 순서는 보장되지 않습니다.
     * 제어 스레드가 인터럽트되어도 시작된 작업이 모두 끝날 때까지 기다리며,
     * 인터럽트 상태는 상태 저장 이후에 복원됩니다. 풀이 닫혀 제출이 거부된 작업은 CRITICAL 실패로 기록됩니다.</p>
     */
    private Dispatched dispatch(List<GenerationTask> tasks, CancellationToken token) {
        List<Future<TaskOutcome>> futures = new ArrayList<>(tasks.size());
        for (GenerationTask task : tasks) {
            try {
                futures.add(workerExecutor.submit(() -> generate(task, token)));
            } catch (RejectedExecutionException e) {
                log.error("Worker pool rejected {}: watcher is closed", task.stateKey());
                futures.add(CompletableFuture.<TaskOutcome>completedFuture(new Failed(task, FailureSeverity.CRITICAL, e)));
            }
        }

        boolean interrupted = false;
        List<TaskOutcome> outcomes = new ArrayList<>(tasks.size());
        for (int i = 0; i < futures.size(); i++) {
            Future<TaskOutcome> future = futures.get(i);
            GenerationTask task = tasks.get(i);
            while (true) {
                try {
                    outcomes.add(future.get());
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    log.error("Worker failed for {}: {}", task.stateKey(), e.getCause().getMessage(), e.getCause());
                    outcomes.add(new Failed(task, FailureSeverity.CRITICAL, e.getCause()));
                    break;
                }
            }
        }
        return new Dispatched(outcomes, interrupted);
    }

    /**
     * 수집된 결과와 대기 중 인터럽트 여부.
     */
    private record Dispatched(List<TaskOutcome> outcomes, boolean interrupted) {
    }

    /**
     * 단일 Task 실행 (워커 스레드).
     */
    private TaskOutcome generate(GenerationTask task, CancellationToken token) {
        String server = task.server().nameAndVersion();
        String packageType = task.serverPackage().registryType();
        if (token.isCancelled()) {
            log.debug("Skipping {} ({}): cancelled before start", server, packageType);
            return new Skipped(task, "cancelled");
        }

        String transportType = TransportTypes.fromRegistry(task.serverPackage().transportType());
        try {
            generator.generate(token, task.server(), task.serverPackage(), transportType, config.generateOptions());
            Instant generatedAt = clock.instant();
            stateStore.setServer(ServerState.generated(task, generatedAt));
            log.info("Generated pack for {} ({}, {})", server, packageType, transportType);
            return new Generated(task, generatedAt);
        } catch (PackAlreadyExistsException e) {
            log.warn("Pack for {} ({}, {}) already exists: {}", server, packageType, transportType, e.getMessage());
            return new Failed(task, FailureSeverity.BENIGN, e);
        } catch (OperationCancelledException e) {
            log.debug("Generation for {} ({}) cancelled: {}", server, packageType, e.getMessage());
            return new Skipped(task, "cancelled");
        } catch (Exception e) {
            log.error("Failed to generate pack for {} ({}, {}): {}", server, packageType, transportType, e.getMessage(), e);
            return new Failed(task, FailureSeverity.CRITICAL, e);
        }
    }

    /**
     * 사이클 종료 처리: lastPoll 갱신, 보존 기간 정리, 저장.
     */
    private void finishCycle(Instant startedAt) {
        stateStore.updateLastPoll(startedAt);
        Duration retention = config.stateRetention();
        if (retention != null) {
            int pruned = stateStore.pruneOlderThan(retention, startedAt);
            if (pruned > 0) {
                log.warn("Pruned {} server states older than {}", pruned, retention);
            }
        }
        stateStore.save();
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * 워커 풀 종료.
     *
     * <p>새 작업 제출을 막고 진행 중인 생성 작업이 끝나기를 최대 60초 기다립니다.
     * 시작된 생성 호출은 인터럽트하지 않으며, 대기 중 인터럽트는 종료 후 복원됩니다.
     * run()은 반환 시 자동으로 호출하고, poll()만 사용하는 경우 직접 호출해야 합니다. 여러 번 호출해도 안전합니다.</p>
     */
    @Override
    public void close() {
        workerExecutor.shutdown();
        boolean interrupted = false;
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(SHUTDOWN_TIMEOUT_SECONDS);
        while (!workerExecutor.isTerminated()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.warn("Pack generations still running after {}s, leaving them to finish", SHUTDOWN_TIMEOUT_SECONDS);
                break;
            }
            try {
                workerExecutor.awaitTermination(remaining, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "packsync-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
