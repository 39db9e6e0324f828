package com.ryuqq.packsync.adapter.filestore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.packsync.core.model.ServerState;
import com.ryuqq.packsync.core.model.WatchState;
import com.ryuqq.packsync.core.spi.StateStore;
import com.ryuqq.packsync.core.spi.StateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * JSON 파일 기반 StateStore.
 *
 * <p><strong>동시성:</strong> 단일 {@link ReentrantReadWriteLock}이 서버 맵과 lastPoll을 보호합니다.
 * 조회는 읽기 잠금, 변경은 쓰기 잠금을 사용합니다.</p>
 *
 * <p><strong>저장 절차 (크래시 안전):</strong></p>
 * <pre>
 * 1. 읽기 잠금 하에서 스냅샷을 JSON으로 직렬화
 * 2. 같은 디렉토리에 임시 파일 생성 후 기록
 * 3. 임시 파일을 대상 파일로 원자적 이동 (미지원 시 교체 이동)
 * 4. 실패 시 임시 파일 삭제 → 기존 파일은 그대로 유지
 * </pre>
 *
 * <p>동시에 호출된 save()는 순서대로 처리되어 오래된 스냅샷이 최신 파일을 덮어쓰지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FileStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(FileStateStore.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Path path;
    private final FileMover mover;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ReentrantLock saveLock = new ReentrantLock();
    private final Map<String, ServerState> servers;
    private Instant lastPoll;

    FileStateStore(Path path, WatchState initial, FileMover mover) {
        this.path = path;
        this.mover = mover;
        this.servers = new HashMap<>(initial.servers());
        this.lastPoll = initial.lastPoll();
    }

    /**
     * 상태 파일 로드.
     *
     * <p>파일이 없으면 빈 저장소를 반환합니다. {@code servers}가 없거나 null이면 빈 맵으로 취급합니다.
     * 항목은 각 상태의 복합 키로 다시 색인됩니다.</p>
     *
     * @param path 상태 파일 경로
     * @return FileStateStore
     * @throws StateStoreException 파일을 읽을 수 없거나 JSON 형식이 잘못된 경우
     */
    public static FileStateStore load(Path path) {
        return load(path, FileMover.ATOMIC);
    }

    static FileStateStore load(Path path, FileMover mover) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        return new FileStateStore(path, read(path), mover);
    }

    private static WatchState read(Path path) {
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            log.debug("State file {} does not exist, starting with empty state", path);
            return WatchState.empty();
        } catch (IOException e) {
            throw new StateStoreException("failed to read state file " + path, e);
        }

        PersistedWatchState persisted;
        try {
            persisted = MAPPER.readValue(content, PersistedWatchState.class);
        } catch (IOException e) {
            throw new StateStoreException("failed to parse state file " + path, e);
        }
        if (persisted == null) {
            throw new StateStoreException("failed to parse state file " + path + ": empty document", null);
        }

        Map<String, ServerState> servers = new HashMap<>();
        if (persisted.servers() != null) {
            for (Map.Entry<String, PersistedWatchState.Entry> entry : persisted.servers().entrySet()) {
                if (entry.getValue() == null) {
                    continue;
                }
                try {
                    ServerState state = entry.getValue().toState();
                    servers.put(state.key(), state);
                } catch (IllegalArgumentException e) {
                    throw new StateStoreException("invalid entry '" + entry.getKey() + "' in state file " + path, e);
                }
            }
        }
        log.debug("Loaded {} server states from {}", servers.size(), path);
        return new WatchState(persisted.lastPoll(), servers);
    }

    /**
     * 상태 파일 경로.
     *
     * @return 경로
     */
    public Path path() {
        return path;
    }

    @Override
    public boolean needsGeneration(
        String namespace,
        String name,
        String version,
        String packageType,
        String transportType,
        Instant updatedAt
    ) {
        String key = ServerState.keyOf(namespace, name, version, packageType, transportType);
        lock.readLock().lock();
        try {
            ServerState existing = servers.get(key);
            if (existing == null) {
                return true;
            }
            return existing.generatedAt() == null || (updatedAt != null && updatedAt.isAfter(existing.generatedAt()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void setServer(ServerState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        lock.writeLock().lock();
        try {
            servers.put(state.key(), state);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<ServerState> getServer(String key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(servers.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void updateLastPoll(Instant lastPoll) {
        lock.writeLock().lock();
        try {
            this.lastPoll = lastPoll;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Instant> getLastPoll() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(lastPoll);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int pruneOlderThan(Duration maxAge, Instant now) {
        if (maxAge == null || now == null) {
            throw new IllegalArgumentException("maxAge and now cannot be null");
        }
        Instant cutoff = now.minus(maxAge);
        lock.writeLock().lock();
        try {
            int before = servers.size();
            servers.values().removeIf(state -> state.updatedAt() == null || state.updatedAt().isBefore(cutoff));
            return before - servers.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return servers.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public WatchState snapshot() {
        lock.readLock().lock();
        try {
            return new WatchState(lastPoll, servers);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 상태를 파일에 기록 (임시 파일 + 원자적 이동).
     *
     * @throws StateStoreException 직렬화 또는 파일 기록에 실패한 경우 (기존 파일은 유지됨)
     */
    @Override
    public void save() {
        saveLock.lock();
        try {
            byte[] content = serialize();
            write(content);
        } finally {
            saveLock.unlock();
        }
    }

    private byte[] serialize() {
        lock.readLock().lock();
        try {
            Map<String, PersistedWatchState.Entry> entries = new TreeMap<>();
            servers.forEach((key, state) -> entries.put(key, PersistedWatchState.Entry.from(state)));
            return MAPPER.writeValueAsBytes(new PersistedWatchState(lastPoll, entries));
        } catch (JsonProcessingException e) {
            throw new StateStoreException("failed to serialize state", e);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void write(byte[] content) {
        Path target = path.toAbsolutePath();
        Path directory = target.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            Files.write(temp, content);
            mover.move(temp, target);
            log.debug("Saved state to {}", target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StateStoreException("failed to save state file " + target, e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to remove temporary state file {}: {}", temp, e.getMessage());
        }
    }
}
