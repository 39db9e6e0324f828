package com.ryuqq.packsync.adapter.registry;

import com.ryuqq.packsync.core.lifecycle.CancellationToken;
import com.ryuqq.packsync.core.lifecycle.OperationCancelledException;
import com.ryuqq.packsync.core.lifecycle.StopReason;
import com.ryuqq.packsync.core.model.ListServersQuery;
import com.ryuqq.packsync.core.model.ServerPage;
import com.ryuqq.packsync.core.model.ServerRecord;
import com.ryuqq.packsync.core.model.ServerStatus;
import com.ryuqq.packsync.testkit.registry.RegistryJson;
import com.ryuqq.packsync.testkit.registry.StubRegistryServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RegistryClient 통합 테스트 (StubRegistryServer 사용).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RegistryClientTest {

    private static final String SERVERS = "/v0/servers";

    private StubRegistryServer registry;
    private RegistryClient client;
    private CancellationToken token;

    @BeforeEach
    void setUp() {
        registry = StubRegistryServer.start();
        client = new RegistryClient(new RegistryClientConfig()
            .withBaseUrl(registry.baseUrl() + "/")
            .withRequestTimeout(Duration.ofSeconds(5))
            .withRetryBaseDelay(Duration.ofMillis(10))
            .withMaxRetryDelay(Duration.ofMillis(50)));
        token = CancellationToken.create();
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    // ============================================================
    // listServers
    // ============================================================

    @Test
    void listServers_응답을_도메인_모델로_변환() {
        // given
        registry.respond(SERVERS, 200, RegistryJson.page("cursor-2",
            RegistryJson.serverWithMeta("acme/widget", "1.2.0", "active", "2025-02-01T12:00:00Z",
                RegistryJson.pkg("npm", "@acme/widget", "streamable-http")),
            RegistryJson.flatServer("acme/gadget", "0.1.0", RegistryJson.pkg("pypi", "gadget", "stdio"))
        ));

        // when
        ServerPage page = client.listServers(ListServersQuery.firstPage(), token);

        // then
        assertThat(page.nextCursor()).isEqualTo("cursor-2");
        assertThat(page.hasNextPage()).isTrue();
        assertThat(page.servers()).hasSize(2);

        ServerRecord widget = page.servers().get(0);
        assertThat(widget.name()).isEqualTo("acme/widget");
        assertThat(widget.version()).isEqualTo("1.2.0");
        assertThat(widget.status()).isEqualTo(ServerStatus.ACTIVE);
        assertThat(widget.updatedAt()).isEqualTo(Instant.parse("2025-02-01T12:00:00Z"));
        assertThat(widget.packages()).singleElement().satisfies(pkg -> {
            assertThat(pkg.registryType()).isEqualTo("npm");
            assertThat(pkg.identifier()).isEqualTo("@acme/widget");
            assertThat(pkg.transportType()).isEqualTo("streamable-http");
        });

        ServerRecord gadget = page.servers().get(1);
        assertThat(gadget.status()).isEqualTo(ServerStatus.ACTIVE);
        assertThat(gadget.updatedAt()).isNull();
    }

    @Test
    void listServers_쿼리_파라미터_전달_및_limit_상한() {
        // given
        registry.respond(SERVERS, 200, RegistryJson.page(null));
        ListServersQuery query = new ListServersQuery("abc", 500, Instant.parse("2025-01-01T00:00:00Z"), "acme/widget", "latest");

        // when
        client.listServers(query, token);

        // then
        URI request = registry.requests().get(0);
        assertThat(request.getRawPath()).isEqualTo(SERVERS);
        assertThat(request.getRawQuery())
            .contains("cursor=abc")
            .contains("limit=100")
            .contains("updated_since=2025-01-01T00%3A00%3A00Z")
            .contains("search=acme%2Fwidget")
            .contains("version=latest");
    }

    @Test
    void listAllServers_next_cursor_따라_모든_페이지_조회() {
        // given
        registry.enqueue(SERVERS, 200, RegistryJson.page("p2", RegistryJson.server("acme/a", "1.0.0")));
        registry.enqueue(SERVERS, 200, "{\"servers\":[" + RegistryJson.server("acme/b", "1.0.0")
            + "],\"metadata\":{\"count\":1,\"next_cursor\":\"p3\"}}");
        registry.enqueue(SERVERS, 200, RegistryJson.page(null, RegistryJson.server("acme/c", "1.0.0")));

        // when
        List<ServerRecord> all = client.listAllServers(ListServersQuery.firstPage(), token);

        // then
        assertThat(all).extracting(ServerRecord::name).containsExactly("acme/a", "acme/b", "acme/c");
        assertThat(registry.requests().get(1).getRawQuery()).contains("cursor=p2");
        assertThat(registry.requests().get(2).getRawQuery()).contains("cursor=p3");
    }

    @Test
    void listAllServers_같은_cursor_반복시_RegistryException() {
        // given: 레지스트리가 항상 같은 next cursor를 반환
        registry.respond(SERVERS, 200, RegistryJson.page("loop", RegistryJson.server("acme/a", "1.0.0")));

        // when & then
        assertThatThrownBy(() -> client.listAllServers(ListServersQuery.firstPage(), token))
            .isInstanceOf(RegistryException.class)
            .hasMessageContaining("repeated cursor 'loop'");
        assertThat(registry.requestCount(SERVERS)).isEqualTo(2);
    }

    // ============================================================
    // 재시도
    // ============================================================

    @Test
    void 서버_오류_후_성공하면_재시도로_복구() {
        // given
        registry.enqueue(SERVERS, 500, "boom");
        registry.enqueue(SERVERS, 502, "bad gateway");
        registry.respond(SERVERS, 200, RegistryJson.page(null, RegistryJson.server("acme/widget", "1.0.0")));

        // when
        ServerPage page = client.listServers(ListServersQuery.firstPage(), token);

        // then
        assertThat(page.servers()).hasSize(1);
        assertThat(registry.requestCount(SERVERS)).isEqualTo(3);
    }

    @Test
    void 재시도_소진_시_RegistryUnavailableException() {
        // given
        registry.respond(SERVERS, 503, "unavailable");

        // when & then
        assertThatThrownBy(() -> client.listServers(ListServersQuery.firstPage(), token))
            .isInstanceOf(RegistryUnavailableException.class)
            .satisfies(e -> {
                RegistryUnavailableException unavailable = (RegistryUnavailableException) e;
                assertThat(unavailable.attempts()).isEqualTo(3);
                assertThat(unavailable.lastStatusCode()).isEqualTo(503);
            });
        assertThat(registry.requestCount(SERVERS)).isEqualTo(3);
    }

    @Test
    void 클라이언트_오류는_재시도하지_않음() {
        // given
        registry.respond(SERVERS, 400, "bad request");

        // when & then
        assertThatThrownBy(() -> client.listServers(ListServersQuery.firstPage(), token))
            .isInstanceOf(RegistryClientErrorException.class)
            .hasMessageContaining("400")
            .satisfies(e -> assertThat(((RegistryClientErrorException) e).body()).isEqualTo("bad request"));
        assertThat(registry.requestCount(SERVERS)).isEqualTo(1);
    }

    @Test
    void 잘못된_JSON은_RegistryException() {
        // given
        registry.respond(SERVERS, 200, "{not json");

        // when & then
        assertThatThrownBy(() -> client.listServers(ListServersQuery.firstPage(), token))
            .isInstanceOf(RegistryException.class)
            .hasMessageContaining("failed to decode response");
    }

    // ============================================================
    // getServer
    // ============================================================

    @Test
    void getServer_404는_ServerNotFoundException_단일_요청() {
        // when & then
        assertThatThrownBy(() -> client.getServer("acme/missing", token))
            .isInstanceOf(ServerNotFoundException.class)
            .hasMessageContaining("acme/missing");
        assertThat(registry.requestCount()).isEqualTo(1);
        assertThat(registry.requests().get(0).getRawPath()).isEqualTo("/v0/servers/acme%2Fmissing");
    }

    @Test
    void getServer_단건_조회() {
        // given
        registry.respond("/v0/servers/acme%2Fwidget", 200,
            RegistryJson.serverWithMeta("acme/widget", "2.0.0", "deprecated", null, RegistryJson.pkg("oci", "acme/widget", "sse")));

        // when
        ServerRecord record = client.getServer("acme/widget", token);

        // then
        assertThat(record.version()).isEqualTo("2.0.0");
        assertThat(record.status()).isEqualTo(ServerStatus.DEPRECATED);
    }

    @Test
    void getServer_빈_ID는_거부() {
        assertThatThrownBy(() -> client.getServer(" ", token))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.requestCount()).isZero();
    }

    // ============================================================
    // getLatestActiveServer
    // ============================================================

    @Test
    void getLatestActiveServer_가장_높은_ACTIVE_semver_선택() {
        // given: 1.2.0 active, 1.10.0 active, 2.0.0 deprecated, 이름만 비슷한 서버, 파싱 불가 버전
        registry.enqueue(SERVERS, 200, RegistryJson.page("p2",
            RegistryJson.serverWithMeta("acme/widget", "1.2.0", "active", null),
            RegistryJson.serverWithMeta("acme/widget", "2.0.0", "deprecated", null),
            RegistryJson.serverWithMeta("acme/widget-extra", "9.0.0", "active", null)
        ));
        registry.enqueue(SERVERS, 200, RegistryJson.page(null,
            RegistryJson.serverWithMeta("acme/widget", "1.10.0", "active", null),
            RegistryJson.serverWithMeta("acme/widget", "nightly", "active", null)
        ));

        // when
        ServerRecord latest = client.getLatestActiveServer("acme/widget", token);

        // then
        assertThat(latest.version()).isEqualTo("1.10.0");
        assertThat(registry.requests().get(0).getRawQuery()).contains("search=acme%2Fwidget").contains("limit=100");
    }

    @Test
    void getLatestActiveServer_ACTIVE_없으면_NoActiveVersionException() {
        // given
        registry.respond(SERVERS, 200, RegistryJson.page(null,
            RegistryJson.serverWithMeta("acme/widget", "1.0.0", "deprecated", null)));

        // when & then
        assertThatThrownBy(() -> client.getLatestActiveServer("acme/widget", token))
            .isInstanceOf(NoActiveVersionException.class)
            .hasMessageContaining("no active servers found with name: acme/widget");
    }

    @Test
    void getLatestActiveServer_semver_없으면_NoActiveVersionException() {
        // given
        registry.respond(SERVERS, 200, RegistryJson.page(null,
            RegistryJson.serverWithMeta("acme/widget", "nightly", "active", null)));

        // when & then
        assertThatThrownBy(() -> client.getLatestActiveServer("acme/widget", token))
            .isInstanceOf(NoActiveVersionException.class)
            .hasMessageContaining("no valid semantic version");
    }

    @Test
    void getServerByNameAndVersion_정확한_버전_조회() {
        // given
        registry.respond(SERVERS, 200, RegistryJson.page(null,
            RegistryJson.server("acme/widget", "1.0.0"),
            RegistryJson.server("acme/widget", "1.1.0")));

        // when
        ServerRecord record = client.getServerByNameAndVersion("acme/widget", "1.1.0", token);

        // then
        assertThat(record.version()).isEqualTo("1.1.0");
        assertThatThrownBy(() -> client.getServerByNameAndVersion("acme/widget", "3.0.0", token))
            .isInstanceOf(ServerNotFoundException.class)
            .hasMessageContaining("acme/widget@3.0.0");
    }

    // ============================================================
    // 취소
    // ============================================================

    @Test
    void 백오프_대기_중_취소되면_즉시_중단() {
        // given: 긴 백오프 설정
        RegistryClient slowRetryClient = new RegistryClient(new RegistryClientConfig()
            .withBaseUrl(registry.baseUrl())
            .withRetryBaseDelay(Duration.ofSeconds(30))
            .withMaxRetryDelay(Duration.ofSeconds(30)));
        registry.respond(SERVERS, 500, "boom");
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.schedule(token::cancel, 200, TimeUnit.MILLISECONDS);

        // when
        long start = System.nanoTime();
        assertThatThrownBy(() -> slowRetryClient.listServers(ListServersQuery.firstPage(), token))
            .isInstanceOf(OperationCancelledException.class)
            .satisfies(e -> assertThat(((OperationCancelledException) e).reason()).isEqualTo(StopReason.GRACEFUL_SHUTDOWN));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        scheduler.shutdownNow();

        // then
        assertThat(elapsedMs).isLessThan(10_000);
        assertThat(registry.requestCount(SERVERS)).isEqualTo(1);
    }

    @Test
    void 응답_대기_중_취소되면_즉시_중단() {
        // given
        registry.setResponseDelay(Duration.ofSeconds(3));
        registry.respond(SERVERS, 200, RegistryJson.page(null));
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.schedule(token::cancel, 100, TimeUnit.MILLISECONDS);

        // when
        long start = System.nanoTime();
        assertThatThrownBy(() -> client.listServers(ListServersQuery.firstPage(), token))
            .isInstanceOf(OperationCancelledException.class);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        scheduler.shutdownNow();

        // then
        assertThat(elapsedMs).isLessThan(2_500);
    }

    @Test
    void 이미_취소된_토큰이면_요청하지_않음() {
        // given
        token.cancel();

        // when & then
        assertThatThrownBy(() -> client.listServers(ListServersQuery.firstPage(), token))
            .isInstanceOf(OperationCancelledException.class);
        assertThat(registry.requestCount()).isZero();
    }
}
