package com.ryuqq.packsync.adapter.runner;

import com.ryuqq.packsync.application.reconciler.CriticalGenerationException;
import com.ryuqq.packsync.application.reconciler.FetchFailedException;
import com.ryuqq.packsync.application.reconciler.PollReport;
import com.ryuqq.packsync.core.filter.PackageTypeFilter;
import com.ryuqq.packsync.core.filter.ServerNameFilter;
import com.ryuqq.packsync.core.generator.GenerateOptions;
import com.ryuqq.packsync.core.generator.PackAlreadyExistsException;
import com.ryuqq.packsync.core.generator.PackGeneratorException;
import com.ryuqq.packsync.core.lifecycle.CancellationToken;
import com.ryuqq.packsync.core.lifecycle.StopReason;
import com.ryuqq.packsync.core.model.ListServersQuery;
import com.ryuqq.packsync.core.model.ServerRecord;
import com.ryuqq.packsync.core.model.ServerState;
import com.ryuqq.packsync.core.model.ServerStatus;
import com.ryuqq.packsync.core.model.WatchState;
import com.ryuqq.packsync.core.outcome.FailureSeverity;
import com.ryuqq.packsync.core.spi.RegistryGateway;
import com.ryuqq.packsync.testkit.contract.InMemoryStateStore;
import com.ryuqq.packsync.testkit.generator.RecordingPackGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static com.ryuqq.packsync.testkit.fixture.ServerRecordFixtures.active;
import static com.ryuqq.packsync.testkit.fixture.ServerRecordFixtures.activeServers;
import static com.ryuqq.packsync.testkit.fixture.ServerRecordFixtures.npmStdio;
import static com.ryuqq.packsync.testkit.fixture.ServerRecordFixtures.pkg;
import static com.ryuqq.packsync.testkit.fixture.ServerRecordFixtures.withStatus;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Watcher 폴링 사이클 단위 테스트.
 *
 * <p>RegistryGateway는 Mockito로, StateStore와 PackGenerator는 testkit 구현체로 대체합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class WatcherTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

    @Mock
    private RegistryGateway registry;

    private InMemoryStateStore stateStore;
    private RecordingPackGenerator generator;
    private Clock clock;
    private CancellationToken token;
    private final List<Watcher> created = new ArrayList<>();

    @BeforeEach
    void setUp() {
        stateStore = new InMemoryStateStore();
        generator = new RecordingPackGenerator();
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        token = CancellationToken.create();
    }

    @AfterEach
    void tearDown() {
        created.forEach(Watcher::close);
    }

    private Watcher watcher(WatcherConfig config) {
        Watcher watcher = new Watcher(registry, stateStore, generator, config, clock);
        created.add(watcher);
        return watcher;
    }

    private Watcher watcher() {
        return watcher(new WatcherConfig());
    }

    private CriticalGenerationException pollExpectingCritical(Watcher watcher) {
        try {
            watcher.poll(token);
        } catch (CriticalGenerationException e) {
            return e;
        }
        throw new AssertionError("expected CriticalGenerationException");
    }

    private void registryReturns(List<ServerRecord> servers) {
        when(registry.listAllServers(any(), any())).thenReturn(servers);
    }

    // ============================================================
    // 기본 사이클
    // ============================================================

    @Test
    void poll_빈상태_모든패키지_생성후_상태기록() {
        // given
        registryReturns(List.of(active("acme/widget", "1.0.0", npmStdio())));

        // when
        PollReport report = watcher().poll(token);

        // then
        assertThat(report.fetched()).isEqualTo(1);
        assertThat(report.attempted()).isEqualTo(1);
        assertThat(report.succeeded()).isEqualTo(1);
        assertThat(report.hasCriticalFailures()).isFalse();

        ServerState state = stateStore.getServer("acme/widget@1.0.0:npm:stdio").orElseThrow();
        assertThat(state.generatedAt()).isEqualTo(NOW);
        assertThat(state.updatedAt()).isEqualTo(NOW);
        assertThat(stateStore.getLastPoll()).contains(NOW);
        assertThat(stateStore.saveCount()).isEqualTo(1);
    }

    @Test
    void poll_동일버전_재폴링시_작업없음() {
        // given
        registryReturns(List.of(active("acme/widget", "1.0.0", npmStdio())));
        Watcher watcher = watcher();
        watcher.poll(token);

        // when
        PollReport second = watcher.poll(token);

        // then
        assertThat(second.attempted()).isZero();
        assertThat(generator.callCount()).isEqualTo(1);
        assertThat(stateStore.saveCount()).isEqualTo(2);
    }

    @Test
    void poll_두번째_사이클은_lastPoll을_updatedSince로_사용() {
        // given
        registryReturns(List.of());
        Watcher watcher = watcher();
        watcher.poll(token);

        // when
        watcher.poll(token);

        // then
        ArgumentCaptor<ListServersQuery> captor = ArgumentCaptor.forClass(ListServersQuery.class);
        verify(registry, times(2)).listAllServers(captor.capture(), any());
        assertThat(captor.getAllValues().get(0).updatedSince()).isNull();
        assertThat(captor.getAllValues().get(1).updatedSince()).isEqualTo(NOW);
    }

    @Test
    void poll_새버전만_생성() {
        // given
        when(registry.listAllServers(any(), any()))
            .thenReturn(List.of(active("acme/widget", "1.0.0", npmStdio())))
            .thenReturn(List.of(
                active("acme/widget", "1.0.0", npmStdio()),
                active("acme/widget", "1.1.0", npmStdio())
            ));
        Watcher watcher = watcher();
        watcher.poll(token);

        // when
        PollReport second = watcher.poll(token);

        // then
        assertThat(second.succeeded()).isEqualTo(1);
        assertThat(generator.calls()).extracting(RecordingPackGenerator.Call::version)
            .containsExactly("1.0.0", "1.1.0");
        assertThat(stateStore.size()).isEqualTo(2);
    }

    @Test
    void poll_작업없음_lastPoll_갱신_및_저장() {
        // given
        registryReturns(List.of(active("acme/remote", "1.0.0")));

        // when
        PollReport report = watcher().poll(token);

        // then
        assertThat(report.fetched()).isEqualTo(1);
        assertThat(report.attempted()).isZero();
        assertThat(stateStore.getLastPoll()).contains(NOW);
        assertThat(stateStore.saveCount()).isEqualTo(1);
        assertThat(generator.callCount()).isZero();
    }

    @Test
    void poll_전송타입을_사용자표기로_전달() {
        // given
        registryReturns(List.of(active("acme/widget", "1.0.0", pkg("npm", "streamable-http"))));
        GenerateOptions options = new GenerateOptions().withOutputDir(Path.of("out")).withDryRun(true);

        // when
        watcher(new WatcherConfig().withGenerateOptions(options)).poll(token);

        // then
        assertThat(generator.calls()).singleElement().satisfies(call -> {
            assertThat(call.transportType()).isEqualTo("http");
            assertThat(call.options()).isEqualTo(options);
        });
        assertThat(stateStore.getServer("acme/widget@1.0.0:npm:streamable-http")).isPresent();
    }

    // ============================================================
    // 필터 / 설정
    // ============================================================

    @Test
    void poll_이름필터_이름별검색_중복제거() {
        // given
        ServerRecord widget = active("acme/widget", "1.0.0", npmStdio());
        ServerRecord gadget = active("acme/gadget", "1.0.0", npmStdio());
        when(registry.listAllServers(any(), any())).thenAnswer(invocation -> {
            ListServersQuery query = invocation.getArgument(0);
            return "acme/widget".equals(query.search()) ? List.of(widget) : List.of(gadget, widget);
        });
        WatcherConfig config = new WatcherConfig()
            .withNameFilter(ServerNameFilter.parse("acme/widget,acme/gadget"));

        // when
        PollReport report = watcher(config).poll(token);

        // then
        assertThat(report.fetched()).isEqualTo(2);
        assertThat(generator.calls()).extracting(RecordingPackGenerator.Call::serverName)
            .containsExactlyInAnyOrder("acme/widget", "acme/gadget");
        verify(registry, times(2)).listAllServers(any(), any());
    }

    @Test
    void poll_패키지타입필터_적용() {
        // given
        registryReturns(List.of(active("acme/widget", "1.0.0", npmStdio(), pkg("pypi", "stdio"))));
        WatcherConfig config = new WatcherConfig().withPackageTypeFilter(PackageTypeFilter.parse("pypi"));

        // when
        watcher(config).poll(token);

        // then
        assertThat(generator.calls()).extracting(RecordingPackGenerator.Call::packageType).containsExactly("pypi");
    }

    @Test
    void poll_deprecated_허용시에만_생성() {
        // given
        registryReturns(List.of(withStatus("acme/old", "1.0.0", ServerStatus.DEPRECATED, npmStdio())));

        // when
        watcher().poll(token);
        watcher(new WatcherConfig().withAllowDeprecated(true)).poll(token);

        // then
        assertThat(generator.callCount()).isEqualTo(1);
    }

    @Test
    void poll_forceOverwrite_매번_재생성() {
        // given
        registryReturns(List.of(active("acme/widget", "1.0.0", npmStdio())));
        Watcher watcher = watcher(new WatcherConfig()
            .withGenerateOptions(new GenerateOptions().withForceOverwrite(true)));

        // when
        watcher.poll(token);
        watcher.poll(token);

        // then
        assertThat(generator.callCount()).isEqualTo(2);
    }

    @Test
    void poll_보존기간_지난상태_정리() {
        // given
        ServerState stale = new ServerState("acme", "old", "1.0.0", "npm", "stdio",
            NOW.minus(Duration.ofDays(30)), NOW.minus(Duration.ofDays(30)), "");
        ServerState fresh = new ServerState("acme", "new", "1.0.0", "npm", "stdio",
            NOW.minus(Duration.ofDays(1)), NOW.minus(Duration.ofDays(1)), "");
        stateStore = new InMemoryStateStore(new WatchState(null, Map.of(stale.key(), stale, fresh.key(), fresh)));
        registryReturns(List.of());

        // when
        watcher(new WatcherConfig().withStateRetention(Duration.ofDays(7))).poll(token);

        // then
        assertThat(stateStore.getServer(stale.key())).isEmpty();
        assertThat(stateStore.getServer(fresh.key())).isPresent();
        assertThat(stateStore.lastSaved().servers()).containsOnlyKeys(fresh.key());
    }

    // ============================================================
    // 동시성
    // ============================================================

    @Test
    void poll_동시생성수_maxConcurrent_이하() {
        // given
        registryReturns(activeServers("acme", 20));
        generator.withWorkDuration(Duration.ofMillis(30));

        // when
        PollReport report = watcher(new WatcherConfig().withMaxConcurrent(3)).poll(token);

        // then
        assertThat(report.succeeded()).isEqualTo(20);
        assertThat(generator.callCount()).isEqualTo(20);
        assertThat(generator.peakConcurrency()).isBetween(1, 3);
        assertThat(stateStore.size()).isEqualTo(20);
    }

    @Test
    void poll_maxConcurrent_1이면_순차실행() {
        // given
        registryReturns(activeServers("acme", 5));
        generator.withWorkDuration(Duration.ofMillis(10));

        // when
        watcher(new WatcherConfig().withMaxConcurrent(1)).poll(token);

        // then
        assertThat(generator.peakConcurrency()).isEqualTo(1);
    }

    // ============================================================
    // 실패 분류
    // ============================================================

    @Test
    void poll_치명적실패_다른작업에_영향없음_저장후_예외() {
        // given
        registryReturns(List.of(
            active("acme/a", "1.0.0", npmStdio()),
            active("acme/broken", "1.0.0", npmStdio()),
            active("acme/c", "1.0.0", npmStdio())
        ));
        generator.failFor("acme/broken", new PackGeneratorException("template rendering failed"));

        // when
        CriticalGenerationException thrown = pollExpectingCritical(watcher());

        // then
        assertThat(thrown).isNotNull();
        assertThat(thrown.getMessage()).isEqualTo("pack generation completed with 1 critical errors");
        PollReport report = thrown.report();
        assertThat(report.succeeded()).isEqualTo(2);
        assertThat(report.criticalFailures()).singleElement()
            .satisfies(failed -> assertThat(failed.task().server().name()).isEqualTo("acme/broken"));

        assertThat(stateStore.getServer("acme/a@1.0.0:npm:stdio")).isPresent();
        assertThat(stateStore.getServer("acme/c@1.0.0:npm:stdio")).isPresent();
        assertThat(stateStore.getServer("acme/broken@1.0.0:npm:stdio")).isEmpty();
        assertThat(stateStore.getLastPoll()).contains(NOW);
        assertThat(stateStore.saveCount()).isEqualTo(1);
    }

    @Test
    void poll_런타임예외도_치명적실패로_분류() {
        // given
        registryReturns(List.of(active("acme/a", "1.0.0", npmStdio())));
        generator.failFor("acme/a", new IllegalStateException("unexpected"));

        // when
        CriticalGenerationException thrown = pollExpectingCritical(watcher());

        // then
        assertThat(thrown.report().criticalFailures()).singleElement()
            .satisfies(failed -> {
                assertThat(failed.severity()).isEqualTo(FailureSeverity.CRITICAL);
                assertThat(failed.cause()).isInstanceOf(IllegalStateException.class);
            });
    }

    @Test
    void poll_이미존재하는_pack은_경미한실패() {
        // given
        registryReturns(List.of(
            active("acme/a", "1.0.0", npmStdio()),
            active("acme/exists", "1.0.0", npmStdio())
        ));
        generator.failFor("acme/exists",
            new PackAlreadyExistsException(PackAlreadyExistsException.Artifact.DIRECTORY, Path.of("packs/exists")));

        // when
        PollReport report = watcher().poll(token);

        // then
        assertThat(report.hasCriticalFailures()).isFalse();
        assertThat(report.succeeded()).isEqualTo(1);
        assertThat(report.benignFailures()).singleElement()
            .satisfies(failed -> assertThat(failed.severity()).isEqualTo(FailureSeverity.BENIGN));
        assertThat(stateStore.getServer("acme/exists@1.0.0:npm:stdio")).isEmpty();
    }

    @Test
    void poll_조회실패_FetchFailed_lastPoll_유지() {
        // given
        when(registry.listAllServers(any(), any())).thenThrow(new IllegalStateException("connection refused"));

        // when / then
        assertThatThrownBy(() -> watcher().poll(token))
            .isInstanceOf(FetchFailedException.class)
            .hasMessageContaining("connection refused")
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(stateStore.getLastPoll()).isEmpty();
        assertThat(stateStore.saveCount()).isZero();
    }

    // ============================================================
    // 취소
    // ============================================================

    @Test
    void poll_취소된토큰_대기작업_건너뜀() {
        // given
        registryReturns(activeServers("acme", 4));
        token.cancel();

        // when
        PollReport report = watcher().poll(token);

        // then
        assertThat(report.attempted()).isEqualTo(4);
        assertThat(report.skipped()).isEqualTo(4);
        assertThat(generator.callCount()).isZero();
        assertThat(stateStore.size()).isZero();
        assertThat(stateStore.getLastPoll()).contains(NOW);
    }

    @Test
    void poll_작업중_취소시_남은작업_건너뜀() {
        // given
        registryReturns(activeServers("acme", 10));
        generator.beforeEach(server -> token.cancel());

        // when
        PollReport report = watcher(new WatcherConfig().withMaxConcurrent(1)).poll(token);

        // then
        assertThat(generator.callCount()).isEqualTo(1);
        assertThat(report.succeeded()).isEqualTo(1);
        assertThat(report.skipped()).isEqualTo(9);
    }

    // ============================================================
    // run
    // ============================================================

    @Test
    void run_취소된토큰_초기폴링후_GRACEFUL_반환() {
        // given
        registryReturns(List.of());
        token.cancel();

        // when
        StopReason reason = watcher().run(token);

        // then
        assertThat(reason).isEqualTo(StopReason.GRACEFUL_SHUTDOWN);
        verify(registry, times(1)).listAllServers(any(), any());
    }

    @Test
    void run_데드라인_경과시_DEADLINE_EXCEEDED_반환() {
        // given
        registryReturns(List.of());
        CancellationToken deadline = CancellationToken.withTimeout(Duration.ofMillis(200));

        // when
        StopReason reason = watcher().run(deadline);

        // then
        assertThat(reason).isEqualTo(StopReason.DEADLINE_EXCEEDED);
    }

    @Test
    void run_사이클오류는_루프를_멈추지_않음() {
        // given
        when(registry.listAllServers(any(), any())).thenThrow(new IllegalStateException("registry down"));
        CancellationToken deadline = CancellationToken.withTimeout(Duration.ofMillis(200));

        // when
        StopReason reason = watcher().run(deadline);

        // then
        assertThat(reason).isEqualTo(StopReason.DEADLINE_EXCEEDED);
        assertThat(stateStore.getLastPoll()).isEmpty();
    }

    @Test
    void run_치명적실패_후에도_루프유지() {
        // given
        registryReturns(List.of(active("acme/broken", "1.0.0", npmStdio())));
        generator.failFor("acme/broken", new PackGeneratorException("boom"));
        CancellationToken deadline = CancellationToken.withTimeout(Duration.ofMillis(200));

        // when
        StopReason reason = watcher().run(deadline);

        // then
        assertThat(reason).isEqualTo(StopReason.DEADLINE_EXCEEDED);
        assertThat(generator.callCount()).isEqualTo(1);
        assertThat(stateStore.getLastPoll()).contains(NOW);
    }

    @Test
    void run_제어스레드_인터럽트시_진행중_생성은_중단되지_않음() throws Exception {
        // given
        registryReturns(List.of(active("acme/slow", "1.0.0", npmStdio())));
        CountDownLatch started = new CountDownLatch(1);
        generator.withWorkDuration(Duration.ofMillis(1500)).beforeEach(server -> started.countDown());
        Watcher watcher = watcher();
        AtomicReference<StopReason> reason = new AtomicReference<>();
        Thread control = new Thread(() -> reason.set(watcher.run(token)), "watch-control");
        control.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        // when
        control.interrupt();
        control.join(10_000);

        // then
        assertThat(control.isAlive()).isFalse();
        assertThat(reason.get()).isEqualTo(StopReason.GRACEFUL_SHUTDOWN);
        assertThat(generator.callCount()).isEqualTo(1);
        assertThat(stateStore.getServer("acme/slow@1.0.0:npm:stdio")).isPresent();
        assertThat(stateStore.getLastPoll()).contains(NOW);
        assertThat(stateStore.saveCount()).isEqualTo(1);
    }

    @Test
    void poll_대기중_인터럽트_저장후_인터럽트상태_복원() throws Exception {
        // given
        registryReturns(List.of(active("acme/slow", "1.0.0", npmStdio())));
        CountDownLatch started = new CountDownLatch(1);
        generator.withWorkDuration(Duration.ofMillis(500)).beforeEach(server -> started.countDown());
        Watcher watcher = watcher();
        AtomicReference<PollReport> report = new AtomicReference<>();
        AtomicBoolean interruptedAfterPoll = new AtomicBoolean();
        Thread control = new Thread(() -> {
            report.set(watcher.poll(token));
            interruptedAfterPoll.set(Thread.currentThread().isInterrupted());
        }, "poll-control");
        control.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        // when
        control.interrupt();
        control.join(10_000);

        // then
        assertThat(report.get().succeeded()).isEqualTo(1);
        assertThat(report.get().skipped()).isZero();
        assertThat(interruptedAfterPoll).isTrue();
        assertThat(stateStore.saveCount()).isEqualTo(1);
    }

    // ============================================================
    // close
    // ============================================================

    @Test
    void poll_close이후_제출거부는_치명적실패_lastPoll은_저장() {
        // given
        registryReturns(List.of(active("acme/widget", "1.0.0", npmStdio())));
        Watcher watcher = watcher();
        watcher.close();

        // when
        CriticalGenerationException thrown = pollExpectingCritical(watcher);

        // then
        assertThat(thrown.report().criticalFailures()).singleElement()
            .satisfies(failed -> assertThat(failed.severity()).isEqualTo(FailureSeverity.CRITICAL));
        assertThat(generator.callCount()).isZero();
        assertThat(stateStore.getServer("acme/widget@1.0.0:npm:stdio")).isEmpty();
        assertThat(stateStore.getLastPoll()).contains(NOW);
        assertThat(stateStore.saveCount()).isEqualTo(1);
    }

    @Test
    void close_여러번_호출해도_안전() {
        // given
        Watcher watcher = watcher();

        // when
        watcher.close();
        watcher.close();

        // then
        assertThat(Thread.currentThread().isInterrupted()).isFalse();
    }

    @Test
    void close_poll만_사용한_경우_워커스레드_정리() throws Exception {
        // given
        registryReturns(List.of(active("acme/widget", "1.0.0", npmStdio())));
        AtomicReference<Thread> worker = new AtomicReference<>();
        generator.beforeEach(server -> worker.set(Thread.currentThread()));
        Watcher watcher = watcher();
        watcher.poll(token);

        // when
        watcher.close();
        worker.get().join(5_000);

        // then
        assertThat(worker.get().getName()).startsWith("packsync-worker-");
        assertThat(worker.get().isAlive()).isFalse();
    }

    // ============================================================
    // 생성자 검증
    // ============================================================

    @Test
    void constructor_null_의존성_거부() {
        WatcherConfig config = new WatcherConfig();
        assertThatThrownBy(() -> new Watcher(null, stateStore, generator, config))
            .isInstanceOf(IllegalArgumentException.class).hasMessage("registry cannot be null");
        assertThatThrownBy(() -> new Watcher(registry, null, generator, config))
            .isInstanceOf(IllegalArgumentException.class).hasMessage("stateStore cannot be null");
        assertThatThrownBy(() -> new Watcher(registry, stateStore, null, config))
            .isInstanceOf(IllegalArgumentException.class).hasMessage("generator cannot be null");
        assertThatThrownBy(() -> new Watcher(registry, stateStore, generator, null))
            .isInstanceOf(IllegalArgumentException.class).hasMessage("config cannot be null");
    }
}
