package com.ryuqq.packsync.adapter.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.packsync.adapter.registry.dto.ServerListResponse;
import com.ryuqq.packsync.adapter.registry.dto.ServerResponse;
import com.ryuqq.packsync.core.lifecycle.CancellationToken;
import com.ryuqq.packsync.core.lifecycle.OperationCancelledException;
import com.ryuqq.packsync.core.lifecycle.StopReason;
import com.ryuqq.packsync.core.model.ListServersQuery;
import com.ryuqq.packsync.core.model.ServerPage;
import com.ryuqq.packsync.core.model.ServerRecord;
import com.ryuqq.packsync.core.spi.RegistryGateway;
import com.ryuqq.packsync.core.version.SemanticVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * HTTP 레지스트리 클라이언트.
 *
 * <p><strong>요청 처리:</strong></p>
 * <pre>
 * for attempt in 1..maxAttempts:
 *   1. 취소 확인
 *   2. sendAsync() → responsePollInterval 간격으로 완료/취소 확인 (소프트 폴링)
 *   3. 응답 상태 &lt; 500 → 반환
 *   4. 5xx 또는 전송 오류(IOException, 요청 타임아웃) → 선형 백오프 후 재시도
 * 재시도 소진 → RegistryUnavailableException
 * </pre>
 *
 * <p><strong>오류 분류:</strong></p>
 * <ul>
 *   <li>4xx: 재시도 없음 → {@link RegistryClientErrorException}</li>
 *   <li>단건 조회 404: {@link ServerNotFoundException}</li>
 *   <li>응답 해석 실패: {@link RegistryException}</li>
 *   <li>취소 (대기/백오프 중): {@link OperationCancelledException}</li>
 * </ul>
 *
 * <p>스레드 안전: 상태를 갖지 않으므로 여러 스레드에서 공유할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RegistryClient implements RegistryGateway {

    private static final Logger log = LoggerFactory.getLogger(RegistryClient.class);
    private static final String SERVERS_PATH = "/v0/servers";

    private final RegistryClientConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final BackoffCalculator backoffCalculator;

    /**
     * 기본 HttpClient와 ObjectMapper로 생성.
     *
     * @param config 클라이언트 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public RegistryClient(RegistryClientConfig config) {
        this(config, defaultHttpClient(config), defaultObjectMapper());
    }

    /**
     * 생성자.
     *
     * @param config 클라이언트 설정
     * @param httpClient HTTP 클라이언트
     * @param objectMapper JSON 매퍼
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RegistryClient(RegistryClientConfig config, HttpClient httpClient, ObjectMapper objectMapper) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.config = config;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.backoffCalculator = BackoffCalculator.from(config);
    }

    private static HttpClient defaultHttpClient(RegistryClientConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return HttpClient.newBuilder()
            .connectTimeout(config.requestTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    /**
     * 레지스트리 응답 해석용 ObjectMapper.
     *
     * @return 알 수 없는 필드를 무시하는 ObjectMapper
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public ServerPage listServers(ListServersQuery query, CancellationToken token) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        URI uri = buildListUri(query);
        HttpResponse<String> response = execute(uri, token, "list servers");
        requireOk(response);
        return RegistryRecordMapper.toPage(decode(response.body(), ServerListResponse.class));
    }

    @Override
    public ServerRecord getServer(String id, CancellationToken token) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("server ID is required");
        }
        URI uri = URI.create(config.baseUrl() + SERVERS_PATH + "/" + encodePathSegment(id));
        HttpResponse<String> response = execute(uri, token, "get server " + id);
        if (response.statusCode() == 404) {
            throw new ServerNotFoundException(id, response.body());
        }
        requireOk(response);
        return RegistryRecordMapper.toRecord(decode(response.body(), ServerResponse.class));
    }

    /**
     * 모든 페이지 조회 (next_cursor 추적).
     *
     * @throws RegistryException 이미 따라간 cursor가 다시 반환된 경우
     */
    @Override
    public List<ServerRecord> listAllServers(ListServersQuery query, CancellationToken token) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
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
                throw new RegistryException(
                    "registry returned repeated cursor '" + page.nextCursor() + "' after " + all.size() + " servers"
                );
            }
            log.debug("Following cursor {} ({} servers so far)", page.nextCursor(), all.size());
            current = current.withCursor(page.nextCursor());
        }
    }

    @Override
    public ServerRecord getLatestActiveServer(String name, CancellationToken token) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("server name is required");
        }

        List<ServerRecord> active = new ArrayList<>();
        for (ServerRecord record : listAllServers(searchQuery(name), token)) {
            if (record.name().equals(name) && record.isActive()) {
                active.add(record);
            }
        }
        if (active.isEmpty()) {
            throw new NoActiveVersionException(name, "no active servers found with name: " + name);
        }

        ServerRecord latest = null;
        SemanticVersion latestVersion = null;
        for (ServerRecord record : active) {
            Optional<SemanticVersion> version = SemanticVersion.tryParse(record.version());
            if (version.isEmpty()) {
                log.debug("Skipping {}: version is not a semantic version", record.nameAndVersion());
                continue;
            }
            if (latestVersion == null || version.get().isGreaterThan(latestVersion)) {
                latestVersion = version.get();
                latest = record;
            }
        }
        if (latest == null) {
            throw new NoActiveVersionException(
                name, "no valid semantic version found for active servers with name: " + name
            );
        }
        return latest;
    }

    /**
     * 이름과 버전이 정확히 일치하는 서버 조회.
     *
     * <p>버전이 "latest"이면 레지스트리의 latest 표시를 기준으로 첫 일치 항목을 반환합니다.</p>
     *
     * @param name 전체 서버 이름
     * @param version 버전 또는 "latest"
     * @param token 취소 토큰
     * @return 일치하는 레코드
     * @throws ServerNotFoundException 일치하는 레코드가 없는 경우
     */
    public ServerRecord getServerByNameAndVersion(String name, String version, CancellationToken token) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("server name is required");
        }
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("version is required");
        }
        boolean latest = "latest".equals(version);
        ListServersQuery query = latest ? searchQuery(name).withVersion("latest") : searchQuery(name);
        for (ServerRecord record : listAllServers(query, token)) {
            if (record.name().equals(name) && (latest || record.version().equals(version))) {
                return record;
            }
        }
        throw new ServerNotFoundException(name + "@" + version, "");
    }

    private static ListServersQuery searchQuery(String name) {
        return ListServersQuery.firstPage().withSearch(name).withLimit(ListServersQuery.MAX_LIMIT);
    }

    // ============================================================
    // HTTP
    // ============================================================

    URI buildListUri(ListServersQuery query) {
        List<String> params = new ArrayList<>();
        if (query.cursor() != null && !query.cursor().isEmpty()) {
            params.add("cursor=" + encode(query.cursor()));
        }
        if (query.limit() > 0) {
            params.add("limit=" + query.limit());
        }
        if (query.updatedSince() != null) {
            params.add("updated_since=" + encode(query.updatedSince().toString()));
        }
        if (query.search() != null && !query.search().isEmpty()) {
            params.add("search=" + encode(query.search()));
        }
        if (query.version() != null && !query.version().isEmpty()) {
            params.add("version=" + encode(query.version()));
        }
        String url = config.baseUrl() + SERVERS_PATH;
        if (!params.isEmpty()) {
            url += "?" + String.join("&", params);
        }
        return URI.create(url);
    }

    private HttpResponse<String> execute(URI uri, CancellationToken token, String operation) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(config.requestTimeout())
            .header("Accept", "application/json")
            .GET()
            .build();

        int lastStatus = RegistryUnavailableException.NO_STATUS;
        IOException lastError = null;

        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            token.throwIfCancelled(operation);
            try {
                HttpResponse<String> response = send(request, token, operation);
                if (response.statusCode() < 500) {
                    return response;
                }
                lastStatus = response.statusCode();
                lastError = null;
                log.debug("{}: attempt {}/{} returned status {}", operation, attempt, config.maxAttempts(), lastStatus);
            } catch (IOException e) {
                lastStatus = RegistryUnavailableException.NO_STATUS;
                lastError = e;
                log.debug("{}: attempt {}/{} failed: {}", operation, attempt, config.maxAttempts(), e.toString());
            }

            if (attempt < config.maxAttempts()) {
                awaitBackoff(attempt, token, operation);
            }
        }

        throw new RegistryUnavailableException(operation, config.maxAttempts(), lastStatus, lastError);
    }

    /**
     * 비동기 전송 후 완료 또는 취소까지 소프트 폴링.
     */
    private HttpResponse<String> send(HttpRequest request, CancellationToken token, String operation) throws IOException {
        CompletableFuture<HttpResponse<String>> future =
            httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        try {
            while (!future.isDone()) {
                if (token.await(config.responsePollInterval())) {
                    future.cancel(true);
                    token.throwIfCancelled(operation);
                }
            }
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new OperationCancelledException(operation + " interrupted", StopReason.GRACEFUL_SHUTDOWN);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException ioException) {
                throw ioException;
            }
            throw new RegistryException(operation + " failed", cause);
        }
    }

    private void awaitBackoff(int retryCount, CancellationToken token, String operation) {
        Duration delay = backoffCalculator.calculate(retryCount);
        log.debug("{}: retrying in {} ms", operation, delay.toMillis());
        try {
            if (token.await(delay)) {
                token.throwIfCancelled(operation);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException(operation + " interrupted", StopReason.GRACEFUL_SHUTDOWN);
        }
    }

    private static void requireOk(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 200) {
            return;
        }
        if (status >= 400) {
            throw new RegistryClientErrorException(status, response.body());
        }
        throw new RegistryException("unexpected status code " + status + ": " + response.body());
    }

    private <T> T decode(String body, Class<T> type) {
        try {
            T value = objectMapper.readValue(body, type);
            if (value == null) {
                throw new RegistryException("failed to decode response: empty body");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new RegistryException("failed to decode response: " + e.getOriginalMessage(), e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String encodePathSegment(String value) {
        return encode(value).replace("+", "%20");
    }
}
